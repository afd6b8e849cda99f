package com.lettergrid.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.lettergrid.domain.Channels;
import com.lettergrid.domain.LobbyPlayer;
import com.lettergrid.domain.QueueSnapshot;
import com.lettergrid.domain.Visibility;
import com.lettergrid.dto.ServerMessage;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MatchmakingServiceTest {
  private final RecordingBroadcaster publisher = new RecordingBroadcaster();
  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

  private LobbyService lobbies;
  private MatchmakingService matchmaking;

  @BeforeEach
  void setUp() {
    MatchService matches =
        new MatchService(
            w -> true, publisher, m -> {}, e -> {}, new FixedGridGenerator("E"), clock, 4, 3, 3);
    lobbies = new LobbyService(publisher, matches, clock, 2, 8);
    matchmaking = new MatchmakingService(lobbies, publisher, clock);
  }

  @Test
  void firstPlayerWaitsInTheQueue() {
    MatchmakingResult r = matchmaking.join("a", "Ann", null);

    assertThat(r.isMatched()).isFalse();
    assertThat(r.queuePosition()).isEqualTo(1);
    assertThat(r.playersInQueue()).isEqualTo(1);
    assertThat(publisher.last())
        .isEqualTo(new ServerMessage.MatchmakingUpdate(Channels.MATCHMAKING, matchmaking.snapshot()));
  }

  @Test
  void twoOldestPlayersArePairedIntoAPublicLobby() {
    matchmaking.join("a", "Ann", null);
    clock.advance(Duration.ofSeconds(1));

    MatchmakingResult r = matchmaking.join("b", "Bob", null);

    assertThat(r.isMatched()).isTrue();
    assertThat(r.lobby().visibility()).isEqualTo(Visibility.PUBLIC);
    assertThat(r.lobby().hostId()).isEqualTo("a");
    assertThat(r.lobby().players()).extracting(LobbyPlayer::userId).containsExactly("a", "b");
    assertThat(lobbies.get(r.lobby().id())).contains(r.lobby());
    assertThat(matchmaking.snapshot().queueSize()).isZero();
  }

  @Test
  void playersOnDifferentServersAreNotPaired() {
    matchmaking.join("a", "Ann", "one");

    MatchmakingResult r = matchmaking.join("b", "Bob", "two");

    assertThat(r.isMatched()).isFalse();
    assertThat(r.queuePosition()).isEqualTo(1);
    assertThat(matchmaking.snapshot().entries())
        .extracting(QueueSnapshot.Entry::serverId)
        .containsExactly("one", "two");
  }

  @Test
  void rejoiningMovesThePlayerToTheBack() {
    matchmaking.join("a", "Ann", "one");
    matchmaking.join("b", "Bob", "two");

    matchmaking.join("a", "Ann", "three");

    assertThat(matchmaking.snapshot().entries())
        .extracting(QueueSnapshot.Entry::userId)
        .containsExactly("b", "a");
  }

  @Test
  void leavingEmptiesTheSeatAndIsAnnounced() {
    matchmaking.join("a", "Ann", null);
    int sent = publisher.size();

    matchmaking.leave("a");
    matchmaking.leave("a");

    assertThat(matchmaking.snapshot().queueSize()).isZero();
    assertThat(publisher.size()).isEqualTo(sent + 1);
  }
}
