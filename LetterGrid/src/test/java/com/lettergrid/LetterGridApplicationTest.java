package com.lettergrid;

import static org.assertj.core.api.Assertions.assertThat;

import com.lettergrid.application.StartResult;
import com.lettergrid.client.RealtimeClient;
import com.lettergrid.domain.Channels;
import com.lettergrid.domain.LobbySnapshot;
import com.lettergrid.domain.LobbyStatus;
import com.lettergrid.domain.MatchSnapshot;
import com.lettergrid.dto.ErrorMessage;
import com.lettergrid.dto.ServerMessage;
import com.lettergrid.infrastructure.DictionaryService;
import com.lettergrid.infrastructure.WebSocketChannelHub;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketExtension;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LetterGridApplicationTest {

  @DynamicPropertySource
  static void dictionary(DynamicPropertyRegistry registry) throws IOException, SQLException {
    Path db = Files.createTempFile("lettergrid-dict", ".db");
    db.toFile().deleteOnExit();
    try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + db)) {
      try (Statement s = c.createStatement()) {
        s.execute("CREATE TABLE dict (word TEXT PRIMARY KEY)");
      }
      try (PreparedStatement ps = c.prepareStatement("INSERT INTO dict(word) VALUES (?)")) {
        for (String w : List.of("cat", "key", "dog")) {
          ps.setString(1, w);
          ps.executeUpdate();
        }
      }
    }
    registry.add("lettergrid.dictionary-jdbc-url", () -> "jdbc:sqlite:" + db);
  }

  @LocalServerPort int port;

  @Autowired TestRestTemplate rest;

  @Autowired DictionaryService dictionary;

  @Autowired WebSocketChannelHub hub;

  private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
  private RealtimeClient realtime;

  @AfterEach
  void tearDown() {
    if (realtime != null) realtime.close();
    scheduler.shutdownNow();
  }

  private LobbySnapshot createLobby(String userId) {
    ResponseEntity<LobbySnapshot> r =
        rest.postForEntity(
            "/api/lobbies",
            Map.of("userId", userId, "username", userId.toUpperCase(), "visibility", "PUBLIC"),
            LobbySnapshot.class);
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    return r.getBody();
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) throw new AssertionError("condition not met in time");
      Thread.sleep(25);
    }
  }

  @Test
  void dictionaryAnswersFromSqlite() {
    assertThat(dictionary.isValidWord("CAT")).isTrue();
    assertThat(dictionary.isValidWord("tac")).isFalse();
    assertThat(dictionary.isValidWord(null)).isFalse();
  }

  @Test
  void configIsPublished() {
    Map<?, ?> config = rest.getForObject("/config", Map.class);

    assertThat(config.get("maxPlayers")).isEqualTo(8);
    assertThat(config.get("roundsPerPlayer")).isEqualTo(4);
  }

  @Test
  void lobbyFlowOverRest() {
    LobbySnapshot lobby = createLobby("host");

    ResponseEntity<LobbySnapshot> joined =
        rest.postForEntity(
            "/api/lobbies/join",
            Map.of("code", lobby.code(), "userId", "guest", "username", "Guest"),
            LobbySnapshot.class);
    assertThat(joined.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(joined.getBody().players()).hasSize(2);

    ResponseEntity<ErrorMessage> notReady =
        rest.postForEntity(
            "/api/lobbies/" + lobby.id() + "/start", Map.of("userId", "host"), ErrorMessage.class);
    assertThat(notReady.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(notReady.getBody().reason()).isEqualTo("not_ready");

    for (String u : List.of("host", "guest")) {
      rest.postForEntity(
          "/api/lobbies/" + lobby.id() + "/ready",
          Map.of("userId", u, "ready", true),
          LobbySnapshot.class);
    }
    ResponseEntity<ErrorMessage> notHost =
        rest.postForEntity(
            "/api/lobbies/" + lobby.id() + "/start", Map.of("userId", "guest"), ErrorMessage.class);
    assertThat(notHost.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);

    ResponseEntity<StartResult> started =
        rest.postForEntity(
            "/api/lobbies/" + lobby.id() + "/start", Map.of("userId", "host"), StartResult.class);
    assertThat(started.getStatusCode()).isEqualTo(HttpStatus.OK);

    LobbySnapshot playing = rest.getForObject("/api/lobbies/" + lobby.id(), LobbySnapshot.class);
    assertThat(playing.status()).isEqualTo(LobbyStatus.PLAYING);
    MatchSnapshot match =
        rest.getForObject("/api/matches/" + playing.matchId(), MatchSnapshot.class);
    assertThat(match.id()).isEqualTo(started.getBody().match().id());
    assertThat(match.currentPlayerId()).isEqualTo("host");
    assertThat(match.grid()).hasSize(5);

    ResponseEntity<ErrorMessage> wrongTurn =
        rest.postForEntity(
            "/api/matches/" + match.id() + "/shuffle",
            Map.of("userId", "guest"),
            ErrorMessage.class);
    assertThat(wrongTurn.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(wrongTurn.getBody().reason()).isEqualTo("not_your_turn");
  }

  @Test
  void unknownLobbyAndBadRequestsMapToHttpErrors() {
    ResponseEntity<ErrorMessage> missing =
        rest.postForEntity(
            "/api/lobbies/join",
            Map.of("code", "0000", "userId", "x", "username", "X"),
            ErrorMessage.class);
    assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(missing.getBody().reason()).isEqualTo("not_found");

    ResponseEntity<ErrorMessage> noTarget =
        rest.postForEntity(
            "/api/lobbies/join", Map.of("userId", "x", "username", "X"), ErrorMessage.class);
    assertThat(noTarget.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);

    ResponseEntity<ErrorMessage> noUser =
        rest.postForEntity("/api/lobbies", Map.of("username", "X"), ErrorMessage.class);
    assertThat(noUser.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(noUser.getBody().reason()).isEqualTo("invalid_request");

    assertThat(rest.getForEntity("/api/matches/nope", ErrorMessage.class).getStatusCode())
        .isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void clientResubscribesAfterTheServerDropsItsSocket() throws Exception {
    LobbySnapshot lobby = createLobby("host");
    BlockingQueue<ServerMessage> inbox = new LinkedBlockingQueue<>();
    SessionTrackingClient ws = new SessionTrackingClient();
    realtime =
        new RealtimeClient(
            ws,
            URI.create("ws://localhost:" + port + "/ws"),
            RealtimeClient.defaultMapper(),
            scheduler,
            Duration.ofMillis(200));
    realtime.connect("host", "Host");
    realtime.subscribe(Channels.lobby(lobby.id()), inbox::add);
    await(() -> hub.subscriberCount(Channels.lobby(lobby.id())) == 1);
    rest.postForEntity(
        "/api/lobbies/join",
        Map.of("lobbyId", lobby.id(), "userId", "guest", "username", "Guest"),
        LobbySnapshot.class);
    ServerMessage first = inbox.poll(10, TimeUnit.SECONDS);
    assertThat(first).isInstanceOf(ServerMessage.LobbyUpdate.class);

    ws.sessions.get(0).close(CloseStatus.SERVER_ERROR);
    await(() -> ws.sessions.size() == 2 && realtime.isOpen());

    ServerMessage.LobbyUpdate update = null;
    boolean ready = true;
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (update == null && System.nanoTime() < deadline) {
      rest.postForEntity(
          "/api/lobbies/" + lobby.id() + "/ready",
          Map.of("userId", "guest", "ready", ready),
          LobbySnapshot.class);
      ready = !ready;
      ServerMessage m = inbox.poll(200, TimeUnit.MILLISECONDS);
      if (m instanceof ServerMessage.LobbyUpdate u) update = u;
    }

    assertThat(update).isNotNull();
    long before = ((ServerMessage.LobbyUpdate) first).lobby().version();
    assertThat(update.lobby().version()).isGreaterThan(before);
  }

  /** Standard client that remembers each session it opens so a test can cut it. */
  static class SessionTrackingClient extends StandardWebSocketClient {
    final List<WebSocketSession> sessions = new CopyOnWriteArrayList<>();

    @Override
    protected CompletableFuture<WebSocketSession> executeInternal(
        WebSocketHandler handler,
        HttpHeaders headers,
        URI uri,
        List<String> protocols,
        List<WebSocketExtension> extensions,
        Map<String, Object> attributes) {
      return super.executeInternal(handler, headers, uri, protocols, extensions, attributes)
          .thenApply(
              s -> {
                sessions.add(s);
                return s;
              });
    }
  }
}
