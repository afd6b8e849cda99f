package com.lettergrid.application;

import com.lettergrid.application.port.Broadcaster;
import com.lettergrid.application.port.Dictionary;
import com.lettergrid.application.port.MatchArchive;
import com.lettergrid.domain.Channels;
import com.lettergrid.domain.InvariantViolation;
import com.lettergrid.domain.LastTurn;
import com.lettergrid.domain.LobbyPlayer;
import com.lettergrid.domain.Match;
import com.lettergrid.domain.MatchPlayer;
import com.lettergrid.domain.MatchSnapshot;
import com.lettergrid.domain.Outcome;
import com.lettergrid.domain.RejectionReason;
import com.lettergrid.domain.grid.GridGenerator;
import com.lettergrid.domain.grid.Tile;
import com.lettergrid.domain.grid.TilePosition;
import com.lettergrid.domain.scoring.ScoreOutcome;
import com.lettergrid.domain.scoring.ScoringEngine;
import com.lettergrid.domain.scoring.WordResult;
import com.lettergrid.dto.ServerMessage;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Match state machine: turn ownership, word submission, shuffles and departures.
 *
 * <p>Each match is mutated only with its {@link Match#lock()} held, so two submissions for the
 * same turn can never both be accepted. Every accepted mutation is broadcast as a full
 * {@link MatchSnapshot} on {@code match:<id>} (and mirrored on the lobby channel) before the call
 * returns. Rejections change nothing and are returned to the caller only.
 */
@Service
public class MatchService {
  public static final int GEM_BONUS = 10;

  private final Logger log = LoggerFactory.getLogger(getClass());

  private final Map<String, Match> matches = new ConcurrentHashMap<>();

  private final Dictionary dict;
  private final Broadcaster publisher;
  private final MatchArchive archive;
  private final ApplicationEventPublisher events;
  private final GridGenerator generator;
  private final Clock clock;
  private final int roundsPerPlayer;
  private final int gridRows;
  private final int gridCols;

  public MatchService(
      Dictionary dict,
      Broadcaster publisher,
      MatchArchive archive,
      ApplicationEventPublisher events,
      GridGenerator generator,
      Clock clock,
      @Value("${lettergrid.rounds-per-player:4}") int roundsPerPlayer,
      @Value("${lettergrid.grid-rows:5}") int gridRows,
      @Value("${lettergrid.grid-cols:5}") int gridCols) {
    this.dict = dict;
    this.publisher = publisher;
    this.archive = archive;
    this.events = events;
    this.generator = generator;
    this.clock = clock;
    this.roundsPerPlayer = roundsPerPlayer;
    this.gridRows = gridRows;
    this.gridCols = gridCols;
  }

  /**
   * Create and register a match for a lobby that is starting. Turn order is the given order; the
   * first player opens.
   */
  public MatchSnapshot start(String lobbyId, List<LobbyPlayer> turnOrder) {
    List<MatchPlayer> players =
        turnOrder.stream().map(p -> new MatchPlayer(p.userId(), p.username())).toList();
    Match match =
        new Match(
            UUID.randomUUID().toString(),
            lobbyId,
            players,
            generator.generate(gridRows, gridCols),
            roundsPerPlayer,
            clock.instant());

    MatchSnapshot snap;
    match.lock().lock();
    try {
      matches.put(match.id(), match);
      verify(match);
      snap = match.snapshot();
      if (lobbyId != null) {
        broadcast(new ServerMessage.MatchStarted(Channels.lobby(lobbyId), snap));
      }
      broadcast(new ServerMessage.MatchUpdate(Channels.match(match.id()), snap));
    } finally {
      match.lock().unlock();
    }
    log.info("Match {} started for lobby {} with {} players", match.id(), lobbyId, players.size());
    return snap;
  }

  public Optional<MatchSnapshot> get(String matchId) {
    Match match = matchId == null ? null : matches.get(matchId);
    if (match == null) return Optional.empty();
    match.lock().lock();
    try {
      return Optional.of(match.snapshot());
    } finally {
      match.lock().unlock();
    }
  }

  /**
   * Score a path of tiles for the player holding the turn.
   *
   * <p>On acceptance the player gains the word score plus {@value #GEM_BONUS} per gem, consumed
   * cells get fresh letters with their bonus and gem cleared, the player's round count grows and
   * the turn moves round-robin to the next player below the round cap. An invalid word keeps the
   * turn so the player can try again.
   */
  public Outcome<SubmitResult> submitWord(
      String matchId, String playerId, List<TilePosition> selection) {
    Match match = matches.get(matchId);
    if (match == null) {
      return Outcome.rejected(RejectionReason.NOT_FOUND, "Match not found");
    }

    SubmitResult result;
    boolean finished;
    match.lock().lock();
    try {
      Outcome<SubmitResult> gate = turnGate(match, playerId);
      if (gate != null) return gate;
      if (selection == null || selection.size() < ScoringEngine.MIN_WORD_LENGTH) {
        return Outcome.rejected(
            RejectionReason.TOO_FEW_TILES,
            "Select at least " + ScoringEngine.MIN_WORD_LENGTH + " tiles");
      }
      if (!match.grid().isPath(selection)) {
        return Outcome.rejected(
            RejectionReason.INVALID_PATH, "Tiles must form a path of adjacent cells");
      }

      List<Tile> tiles = match.grid().tiles(selection);
      ScoreOutcome scored = ScoringEngine.score(tiles, dict::isValidWord);
      if (scored instanceof ScoreOutcome.Rejected r) {
        log.debug("Match {} p {} word '{}' rejected: {}", matchId, playerId, r.word(), r.reason());
        return Outcome.rejected(
            RejectionReason.INVALID_WORD, "\"" + r.word() + "\" is not a valid word");
      }
      WordResult word = (WordResult) scored;

      int gems = (int) tiles.stream().filter(Tile::gem).count();
      int gemBonus = gems * GEM_BONUS;
      int delta = word.finalScore() + gemBonus;
      MatchPlayer player = match.player(playerId).orElseThrow();

      player.award(word.word(), delta);
      for (TilePosition p : selection) {
        match.grid().replace(p, t -> t.consumed(generator.drawLetter()));
      }
      match.logWord(word);
      player.finishRound();
      match.lastTurn(
          new LastTurn(playerId, player.username(), word.word(), delta, gems, clock.instant()));

      String next = match.firstEligibleFrom(match.indexOf(playerId) + 1);
      if (next == null) {
        match.complete(clock.instant());
      } else {
        match.passTurnTo(next);
      }
      match.touch();
      verify(match);

      MatchSnapshot snap = match.snapshot();
      publishUpdate(snap);
      finished = match.completed();
      if (finished) finish(snap);
      result = new SubmitResult(word, gemBonus, delta, snap);
    } finally {
      match.lock().unlock();
    }

    log.info(
        "Match {} p {} scored '{}' for {} ({} gem bonus)",
        matchId,
        playerId,
        result.result().word(),
        result.scoreDelta(),
        result.gemBonus());
    if (finished) events.publishEvent(new MatchCompletedEvent(result.match()));
    return Outcome.accepted(result);
  }

  /**
   * Redraw every letter on the grid at no score cost. Bonus and gem placement stay. Allowed once
   * per turn, for the player holding the turn.
   */
  public Outcome<MatchSnapshot> shuffleGrid(String matchId, String playerId) {
    Match match = matches.get(matchId);
    if (match == null) {
      return Outcome.rejected(RejectionReason.NOT_FOUND, "Match not found");
    }

    MatchSnapshot snap;
    match.lock().lock();
    try {
      Outcome<MatchSnapshot> gate = turnGate(match, playerId);
      if (gate != null) return gate;
      if (match.shuffledThisTurn()) {
        return Outcome.rejected(RejectionReason.ALREADY_SHUFFLED, "Already shuffled this turn");
      }
      match.grid().replaceAll(t -> t.relettered(generator.drawLetter()));
      match.markShuffled();
      match.touch();
      verify(match);
      snap = match.snapshot();
      publishUpdate(snap);
    } finally {
      match.lock().unlock();
    }
    log.info("Match {} grid shuffled by {}", matchId, playerId);
    return Outcome.accepted(snap);
  }

  /**
   * Drop a departing or evicted player from the turn order. If that player held the turn it
   * passes to the next eligible player in order; with one player left the match completes. A
   * selection the player had in progress is discarded with them.
   *
   * @return the new state, or empty if nothing changed
   */
  public Optional<MatchSnapshot> removePlayer(String matchId, String userId) {
    Match match = matchId == null ? null : matches.get(matchId);
    if (match == null) return Optional.empty();

    MatchSnapshot snap;
    boolean finished;
    match.lock().lock();
    try {
      if (match.completed()) return Optional.empty();
      boolean heldTurn = userId.equals(match.currentPlayerId());
      int idx = match.removePlayer(userId);
      if (idx < 0) return Optional.empty();

      if (match.playerCount() <= 1) {
        match.complete(clock.instant());
      } else if (heldTurn) {
        String next = match.firstEligibleFrom(idx);
        if (next == null) {
          match.complete(clock.instant());
        } else {
          match.passTurnTo(next);
        }
      }
      match.touch();
      verify(match);

      snap = match.snapshot();
      publishUpdate(snap);
      finished = match.completed();
      if (finished) finish(snap);
    } finally {
      match.lock().unlock();
    }

    log.info("Match {} removed player {} ({} left)", matchId, userId, snap.players().size());
    if (finished) events.publishEvent(new MatchCompletedEvent(snap));
    return Optional.of(snap);
  }

  /** Forget a match whose lobby no longer exists. */
  public void discard(String matchId) {
    if (matchId != null && matches.remove(matchId) != null) {
      log.info("Match {} discarded.", matchId);
    }
  }

  // Helpers

  /** Rejection for a caller that may not act now, or null if the caller holds the turn. */
  private static <T> Outcome<T> turnGate(Match match, String playerId) {
    if (match.completed()) {
      return Outcome.rejected(RejectionReason.MATCH_COMPLETED, "Match is over");
    }
    if (playerId == null || !playerId.equals(match.currentPlayerId())) {
      return Outcome.rejected(RejectionReason.NOT_YOUR_TURN, "Not your turn");
    }
    return null;
  }

  private void publishUpdate(MatchSnapshot snap) {
    broadcast(new ServerMessage.MatchUpdate(Channels.match(snap.id()), snap));
    if (snap.lobbyId() != null) {
      broadcast(new ServerMessage.MatchUpdate(Channels.lobby(snap.lobbyId()), snap));
    }
  }

  // state is already committed when this runs; a failed delivery must not abort the caller
  private void broadcast(ServerMessage message) {
    try {
      publisher.publish(message);
    } catch (RuntimeException e) {
      log.warn(
          "Broadcast of {} on {} failed",
          message.getClass().getSimpleName(),
          message.channel(),
          e);
    }
  }

  /** Announce completion and hand the result to the archive; archive failures are only logged. */
  private void finish(MatchSnapshot snap) {
    if (snap.lobbyId() != null) {
      broadcast(new ServerMessage.MatchCompleted(Channels.lobby(snap.lobbyId()), snap));
    }
    log.info("Match {} completed after {} words", snap.id(), snap.wordsFound().size());
    try {
      archive.archive(snap);
    } catch (RuntimeException e) {
      log.error("Archiving match {} failed; not retrying", snap.id(), e);
    }
  }

  private void verify(Match match) {
    String violation = match.invariantViolation();
    if (violation != null) {
      log.error("Invariant violation in match {}: {}. State: {}", match.id(), violation, match.snapshot());
      throw new InvariantViolation("Match " + match.id() + ": " + violation);
    }
  }
}
