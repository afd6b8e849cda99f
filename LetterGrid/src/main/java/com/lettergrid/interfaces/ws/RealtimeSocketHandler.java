package com.lettergrid.interfaces.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lettergrid.application.PresenceService;
import com.lettergrid.domain.Channels;
import com.lettergrid.dto.ClientMessage;
import com.lettergrid.dto.ServerMessage;
import com.lettergrid.infrastructure.WebSocketChannelHub;
import com.lettergrid.infrastructure.WebSocketChannelHub.Connection;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
public class RealtimeSocketHandler extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(RealtimeSocketHandler.class);

  private final WebSocketChannelHub hub;
  private final PresenceService presence;
  private final ObjectMapper mapper;

  public RealtimeSocketHandler(
      WebSocketChannelHub hub, PresenceService presence, ObjectMapper mapper) {
    this.hub = hub;
    this.presence = presence;
    this.mapper = mapper;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    hub.register(session);
    log.info("Socket {} opened", session.getId());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    ClientMessage frame;
    try {
      frame = mapper.readValue(message.getPayload(), ClientMessage.class);
    } catch (JsonProcessingException e) {
      log.warn("Ignoring malformed frame on {}: {}", session.getId(), e.getOriginalMessage());
      return;
    }
    String sid = session.getId();
    if (frame instanceof ClientMessage.Identify identify) {
      onIdentify(sid, identify);
    } else if (frame instanceof ClientMessage.Subscribe subscribe) {
      hub.subscribe(sid, subscribe.channel());
    } else if (frame instanceof ClientMessage.Unsubscribe unsubscribe) {
      hub.unsubscribe(sid, unsubscribe.channel());
    } else if (frame instanceof ClientMessage.PlayerAction action) {
      onPlayerAction(sid, action);
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    hub.release(session.getId())
        .filter(Connection::identified)
        .ifPresent(c -> presence.disconnected(c.userId()));
    log.info("Socket {} closed: {}", session.getId(), status);
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn("Transport error on {}: {}", session.getId(), exception.getMessage());
  }

  private void onIdentify(String sid, ClientMessage.Identify identify) {
    if (identify.userId() == null || identify.userId().isBlank()) {
      log.warn("Ignoring identify without userId on {}", sid);
      return;
    }
    String previous = hub.identify(sid, identify.userId(), identify.username());
    if (Objects.equals(previous, identify.userId())) return;
    if (previous != null) presence.disconnected(previous);
    presence.connected(identify.userId());
  }

  // Relayed as-is; actions never touch match state.
  private void onPlayerAction(String sid, ClientMessage.PlayerAction action) {
    Connection c = hub.connection(sid).orElse(null);
    if (c == null || !c.identified() || action.matchId() == null) {
      log.debug("Dropping player action from unidentified socket {}", sid);
      return;
    }
    String channel = Channels.match(action.matchId());
    hub.publish(new ServerMessage.PlayerAction(channel, c.userId(), c.username(), action.action()));
  }
}
