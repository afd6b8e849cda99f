package com.lettergrid.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lettergrid.dto.ActionDetail;
import com.lettergrid.dto.ClientMessage;
import com.lettergrid.dto.ServerMessage;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Reconnecting client for the realtime socket.
 *
 * <p>The server forgets a connection's subscriptions when it closes, so the client owns them:
 * every time a socket opens it re-sends {@code identify} and one {@code subscribe} per channel that
 * still has a handler. After an unexpected close it waits {@link #DEFAULT_RECONNECT_DELAY} (or the
 * configured delay) and tries again, indefinitely, until {@link #close()}. Frames sent while no
 * socket is open are dropped.
 */
public class RealtimeClient implements AutoCloseable {
  public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(2);

  private static final Logger log = LoggerFactory.getLogger(RealtimeClient.class);

  private final WebSocketClient client;
  private final URI uri;
  private final ObjectMapper mapper;
  private final ScheduledExecutorService scheduler;
  private final Duration reconnectDelay;
  private final Map<String, Set<Consumer<ServerMessage>>> handlers = new ConcurrentHashMap<>();
  private final SocketHandler socketHandler = new SocketHandler();

  // Guarded by this.
  private ClientMessage.Identify identity;
  private WebSocketSession session;
  private boolean connecting;
  private boolean closed;
  private ScheduledFuture<?> pendingReconnect;

  public RealtimeClient(WebSocketClient client, URI uri, ScheduledExecutorService scheduler) {
    this(client, uri, defaultMapper(), scheduler, DEFAULT_RECONNECT_DELAY);
  }

  public RealtimeClient(
      WebSocketClient client,
      URI uri,
      ObjectMapper mapper,
      ScheduledExecutorService scheduler,
      Duration reconnectDelay) {
    this.client = client;
    this.uri = uri;
    this.mapper = mapper;
    this.scheduler = scheduler;
    this.reconnectDelay = reconnectDelay;
  }

  public static ObjectMapper defaultMapper() {
    return JsonMapper.builder()
        .findAndAddModules()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  /** Open the socket as the given user, or re-identify if it is already open. */
  public synchronized void connect(String userId, String username) {
    identity = new ClientMessage.Identify(userId, username);
    closed = false;
    if (isOpen()) {
      send(identity);
      return;
    }
    if (connecting) return;
    open();
  }

  public synchronized boolean isOpen() {
    return session != null && session.isOpen();
  }

  /** Add a handler for a channel and tell the server about it. */
  public void subscribe(String channel, Consumer<ServerMessage> handler) {
    handlers.computeIfAbsent(channel, k -> new CopyOnWriteArraySet<>()).add(handler);
    send(new ClientMessage.Subscribe(channel));
  }

  /**
   * Drop one handler, or all of them when {@code handler} is null. The server subscription ends
   * once the channel has no handler left.
   */
  public void unsubscribe(String channel, Consumer<ServerMessage> handler) {
    Set<Consumer<ServerMessage>> set = handlers.get(channel);
    if (set == null) return;
    if (handler == null) {
      set.clear();
    } else {
      set.remove(handler);
    }
    if (set.isEmpty() && handlers.remove(channel, set)) {
      send(new ClientMessage.Unsubscribe(channel));
    }
  }

  public Set<String> channels() {
    return Set.copyOf(handlers.keySet());
  }

  public void sendPlayerAction(String matchId, ActionDetail action) {
    send(new ClientMessage.PlayerAction(matchId, action));
  }

  /** Stop reconnecting and close the current socket. */
  @Override
  public synchronized void close() {
    closed = true;
    if (pendingReconnect != null) {
      pendingReconnect.cancel(false);
      pendingReconnect = null;
    }
    WebSocketSession s = session;
    session = null;
    if (s != null && s.isOpen()) {
      try {
        s.close(CloseStatus.NORMAL);
      } catch (IOException e) {
        log.debug("Closing realtime socket failed: {}", e.getMessage());
      }
    }
  }

  synchronized boolean send(ClientMessage message) {
    if (session == null || !session.isOpen()) {
      log.debug("Not connected; dropped {}", message.getClass().getSimpleName());
      return false;
    }
    try {
      session.sendMessage(new TextMessage(mapper.writeValueAsString(message)));
      return true;
    } catch (IOException e) {
      log.warn("Realtime send failed: {}", e.getMessage());
      return false;
    }
  }

  private void open() {
    connecting = true;
    client
        .execute(socketHandler, null, uri)
        .whenComplete(
            (s, err) -> {
              if (err != null) {
                log.warn("Realtime connect to {} failed: {}", uri, err.getMessage());
                synchronized (this) {
                  connecting = false;
                  scheduleReconnect();
                }
              }
            });
  }

  private void scheduleReconnect() {
    if (closed || identity == null || pendingReconnect != null) return;
    pendingReconnect =
        scheduler.schedule(this::reconnect, reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private synchronized void reconnect() {
    pendingReconnect = null;
    if (closed || connecting || isOpen()) return;
    log.info("Reconnecting to {}", uri);
    open();
  }

  private synchronized void opened(WebSocketSession s) throws IOException {
    connecting = false;
    if (closed) {
      s.close(CloseStatus.NORMAL);
      return;
    }
    session = s;
    if (identity != null) send(identity);
    for (String channel : handlers.keySet()) {
      send(new ClientMessage.Subscribe(channel));
    }
  }

  private synchronized void lost(WebSocketSession s, CloseStatus status) {
    if (session != s) return;
    session = null;
    log.info("Realtime socket closed ({}); retrying in {}", status, reconnectDelay);
    scheduleReconnect();
  }

  private void dispatch(String payload) {
    ServerMessage message;
    try {
      message = mapper.readValue(payload, ServerMessage.class);
    } catch (JsonProcessingException e) {
      log.warn("Ignoring unreadable realtime frame: {}", e.getOriginalMessage());
      return;
    }
    Set<Consumer<ServerMessage>> set = handlers.get(message.channel());
    if (set == null) return;
    for (Consumer<ServerMessage> h : set) {
      try {
        h.accept(message);
      } catch (RuntimeException e) {
        log.error("Handler for {} failed", message.channel(), e);
      }
    }
  }

  private final class SocketHandler extends TextWebSocketHandler {
    @Override
    public void afterConnectionEstablished(WebSocketSession s) throws IOException {
      opened(s);
    }

    @Override
    protected void handleTextMessage(WebSocketSession s, TextMessage message) {
      dispatch(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession s, Throwable exception) {
      log.warn("Realtime transport error: {}", exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession s, CloseStatus status) {
      lost(s, status);
    }
  }
}
