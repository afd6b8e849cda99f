package com.lettergrid.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lettergrid.application.port.Broadcaster;
import com.lettergrid.dto.ServerMessage;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

/**
 * Channel registry and fan-out for the realtime socket.
 *
 * <p>Each connection's outbound frames go through a {@link ConcurrentWebSocketSessionDecorator},
 * which keeps them in send order, so frames on one channel reach a connection FIFO. Delivery is
 * at most once: a frame that cannot be written is dropped, and a connection that falls too far
 * behind is closed without holding up the other subscribers. A closed connection loses all its
 * subscriptions; the client re-declares them after reconnecting.
 */
@Component
public class WebSocketChannelHub implements Broadcaster {
  private static final Logger log = LoggerFactory.getLogger(WebSocketChannelHub.class);

  static final int SEND_TIME_LIMIT_MS = 10_000;
  static final int BUFFER_SIZE_LIMIT = 512 * 1024;

  private final Map<String, Connection> connections = new ConcurrentHashMap<>();
  private final Map<String, Set<Connection>> channels = new ConcurrentHashMap<>();
  private final ObjectMapper mapper;

  public WebSocketChannelHub(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public void register(WebSocketSession session) {
    WebSocketSession out =
        new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    connections.put(session.getId(), new Connection(session.getId(), out));
  }

  /**
   * Attach an identity to a connection.
   *
   * @return the user id the connection carried before, or null
   */
  public String identify(String sessionId, String userId, String username) {
    Connection c = connections.get(sessionId);
    if (c == null) return null;
    String previous = c.userId;
    c.userId = userId;
    c.username = username;
    return previous;
  }

  public Optional<Connection> connection(String sessionId) {
    return Optional.ofNullable(connections.get(sessionId));
  }

  public void subscribe(String sessionId, String channel) {
    Connection c = connections.get(sessionId);
    if (c == null || channel == null || channel.isBlank()) return;
    c.subscriptions.add(channel);
    channels.compute(
        channel,
        (k, subs) -> {
          Set<Connection> s = subs == null ? ConcurrentHashMap.newKeySet() : subs;
          s.add(c);
          return s;
        });
  }

  public void unsubscribe(String sessionId, String channel) {
    Connection c = connections.get(sessionId);
    if (c == null || channel == null) return;
    c.subscriptions.remove(channel);
    detach(c, channel);
  }

  /** Forget a closed connection and every subscription it held. */
  public Optional<Connection> release(String sessionId) {
    Connection c = connections.remove(sessionId);
    if (c == null) return Optional.empty();
    for (String channel : c.subscriptions) {
      detach(c, channel);
    }
    c.subscriptions.clear();
    return Optional.of(c);
  }

  public int subscriberCount(String channel) {
    Set<Connection> subs = channels.get(channel);
    return subs == null ? 0 : subs.size();
  }

  @Override
  public void publish(ServerMessage message) {
    Set<Connection> subs = channels.get(message.channel());
    if (subs == null || subs.isEmpty()) return;

    TextMessage frame;
    try {
      frame = new TextMessage(mapper.writeValueAsString(message));
    } catch (JsonProcessingException e) {
      log.error("Cannot encode {} for {}", message.getClass().getSimpleName(), message.channel(), e);
      return;
    }
    for (Connection c : subs) {
      c.send(frame);
    }
  }

  private void detach(Connection c, String channel) {
    channels.computeIfPresent(
        channel,
        (k, subs) -> {
          subs.remove(c);
          return subs.isEmpty() ? null : subs;
        });
  }

  /** One open socket and the state the server keeps for it while it lives. */
  public static final class Connection {
    private final String sessionId;
    private final WebSocketSession out;
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
    private volatile String userId;
    private volatile String username;

    Connection(String sessionId, WebSocketSession out) {
      this.sessionId = sessionId;
      this.out = out;
    }

    public String sessionId() {
      return sessionId;
    }

    public String userId() {
      return userId;
    }

    public String username() {
      return username;
    }

    public boolean identified() {
      return userId != null;
    }

    void send(TextMessage frame) {
      if (!out.isOpen()) return;
      try {
        out.sendMessage(frame);
      } catch (SessionLimitExceededException e) {
        log.warn("Connection {} too slow, closing: {}", sessionId, e.getMessage());
        close(e.getStatus());
      } catch (IOException | RuntimeException e) {
        log.warn("Dropped frame to {}: {}", sessionId, e.getMessage());
      }
    }

    // the handler's close callback releases the connection
    private void close(CloseStatus status) {
      try {
        out.close(status);
      } catch (IOException e) {
        log.debug("Closing {} failed: {}", sessionId, e.getMessage());
      }
    }
  }
}
