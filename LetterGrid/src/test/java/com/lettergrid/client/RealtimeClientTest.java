package com.lettergrid.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.nullable;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.lettergrid.dto.ActionDetail;
import com.lettergrid.dto.ServerMessage;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

class RealtimeClientTest {
  private static final URI URI_WS = URI.create("ws://localhost:8080/ws");

  private final WebSocketClient ws = mock(WebSocketClient.class);
  private final ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
  private final ScheduledFuture<?> pending = mock(ScheduledFuture.class);
  private final List<WebSocketHandler> handlers = new ArrayList<>();

  private RealtimeClient client;

  @BeforeEach
  void setUp() {
    when(ws.execute(any(WebSocketHandler.class), nullable(WebSocketHttpHeaders.class), eq(URI_WS)))
        .thenAnswer(
            inv -> {
              handlers.add(inv.getArgument(0));
              return new CompletableFuture<WebSocketSession>();
            });
    doReturn(pending)
        .when(scheduler)
        .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    client =
        new RealtimeClient(
            ws, URI_WS, RealtimeClient.defaultMapper(), scheduler, Duration.ofSeconds(2));
  }

  /** Session mock whose sent frames are collected as JSON strings. */
  private static WebSocketSession session(List<String> sent) throws Exception {
    WebSocketSession s = mock(WebSocketSession.class);
    when(s.isOpen()).thenReturn(true);
    doAnswer(
            inv -> {
              sent.add(((TextMessage) inv.getArgument(0)).getPayload());
              return null;
            })
        .when(s)
        .sendMessage(any());
    return s;
  }

  private static TextMessage frame(String json) {
    return new TextMessage(json);
  }

  private Runnable scheduledReconnect() {
    ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    verify(scheduler).schedule(task.capture(), eq(2000L), eq(TimeUnit.MILLISECONDS));
    return task.getValue();
  }

  @Test
  void identifiesOnOpen() throws Exception {
    List<String> sent = new ArrayList<>();
    client.connect("u1", "Ann");

    handlers.get(0).afterConnectionEstablished(session(sent));

    assertThat(sent).hasSize(1);
    assertThat(sent.get(0)).contains("\"type\":\"identify\"").contains("\"userId\":\"u1\"");
    assertThat(client.isOpen()).isTrue();
  }

  @Test
  void secondConnectWhileConnectingDoesNotOpenAnotherSocket() {
    client.connect("u1", "Ann");
    client.connect("u1", "Ann");

    verify(ws, times(1))
        .execute(any(WebSocketHandler.class), nullable(WebSocketHttpHeaders.class), eq(URI_WS));
  }

  @Test
  void reconnectsAfterDelayAndResubscribesEveryChannel() throws Exception {
    List<String> first = new ArrayList<>();
    List<String> second = new ArrayList<>();
    client.connect("u1", "Ann");
    WebSocketSession s1 = session(first);
    handlers.get(0).afterConnectionEstablished(s1);
    client.subscribe("lobby:l1", m -> {});
    client.subscribe("match:m1", m -> {});

    when(s1.isOpen()).thenReturn(false);
    handlers.get(0).afterConnectionClosed(s1, CloseStatus.GOING_AWAY);
    scheduledReconnect().run();
    handlers.get(1).afterConnectionEstablished(session(second));

    assertThat(second).hasSize(3);
    assertThat(second.get(0)).contains("\"type\":\"identify\"");
    assertThat(second.subList(1, 3))
        .anyMatch(f -> f.contains("\"channel\":\"lobby:l1\""))
        .anyMatch(f -> f.contains("\"channel\":\"match:m1\""))
        .allMatch(f -> f.contains("\"type\":\"subscribe\""));
  }

  @Test
  void unsubscribedChannelIsNotRestored() throws Exception {
    List<String> first = new ArrayList<>();
    List<String> second = new ArrayList<>();
    Consumer<ServerMessage> h = m -> {};
    client.connect("u1", "Ann");
    WebSocketSession s1 = session(first);
    handlers.get(0).afterConnectionEstablished(s1);
    client.subscribe("lobby:l1", h);
    client.unsubscribe("lobby:l1", h);

    when(s1.isOpen()).thenReturn(false);
    handlers.get(0).afterConnectionClosed(s1, CloseStatus.GOING_AWAY);
    scheduledReconnect().run();
    handlers.get(1).afterConnectionEstablished(session(second));

    assertThat(first.get(first.size() - 1)).contains("\"type\":\"unsubscribe\"");
    assertThat(second).hasSize(1);
    assertThat(second.get(0)).contains("\"type\":\"identify\"");
    assertThat(client.channels()).isEmpty();
  }

  @Test
  void framesSentWhileDisconnectedAreDropped() throws Exception {
    List<String> sent = new ArrayList<>();
    client.connect("u1", "Ann");
    WebSocketSession s1 = session(sent);
    handlers.get(0).afterConnectionEstablished(s1);
    when(s1.isOpen()).thenReturn(false);
    handlers.get(0).afterConnectionClosed(s1, CloseStatus.GOING_AWAY);

    client.sendPlayerAction("m1", new ActionDetail("selecting", "CA", null, 1L));

    assertThat(sent).hasSize(1);
  }

  @Test
  void failedHandshakeIsRetried() {
    when(ws.execute(any(WebSocketHandler.class), nullable(WebSocketHttpHeaders.class), eq(URI_WS)))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("refused")));

    client.connect("u1", "Ann");

    scheduledReconnect().run();
    verify(ws, times(2))
        .execute(any(WebSocketHandler.class), nullable(WebSocketHttpHeaders.class), eq(URI_WS));
  }

  @Test
  void closeCancelsPendingReconnect() throws Exception {
    client.connect("u1", "Ann");
    WebSocketSession s1 = session(new ArrayList<>());
    handlers.get(0).afterConnectionEstablished(s1);
    when(s1.isOpen()).thenReturn(false);
    handlers.get(0).afterConnectionClosed(s1, CloseStatus.GOING_AWAY);

    client.close();

    verify(pending).cancel(false);
    scheduledReconnect().run();
    verify(ws, times(1))
        .execute(any(WebSocketHandler.class), nullable(WebSocketHttpHeaders.class), eq(URI_WS));
  }

  @Test
  void closedClientDoesNotScheduleReconnects() throws Exception {
    client.connect("u1", "Ann");
    WebSocketSession s1 = session(new ArrayList<>());
    handlers.get(0).afterConnectionEstablished(s1);

    client.close();
    handlers.get(0).afterConnectionClosed(s1, CloseStatus.NORMAL);

    verify(s1).close(CloseStatus.NORMAL);
    verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
  }

  @Test
  void incomingFramesReachTheChannelHandlers() throws Exception {
    List<ServerMessage> got = new ArrayList<>();
    client.connect("u1", "Ann");
    WebSocketSession s1 = session(new ArrayList<>());
    handlers.get(0).afterConnectionEstablished(s1);
    client.subscribe("lobby:l1", got::add);

    WebSocketHandler h = handlers.get(0);
    h.handleMessage(s1, frame("{\"type\":\"lobby:deleted\",\"channel\":\"lobby:l1\",\"lobbyId\":\"l1\"}"));
    h.handleMessage(s1, frame("{\"type\":\"lobby:deleted\",\"channel\":\"lobby:l2\",\"lobbyId\":\"l2\"}"));
    h.handleMessage(s1, frame("not json"));

    assertThat(got).containsExactly(new ServerMessage.LobbyDeleted("lobby:l1", "l1"));
  }
}
