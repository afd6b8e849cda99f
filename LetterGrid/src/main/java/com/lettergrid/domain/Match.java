package com.lettergrid.domain;

import com.lettergrid.domain.grid.Grid;
import com.lettergrid.domain.scoring.WordResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Authoritative state of one match: turn order, ledger, grid and word log. Guarded by
 * {@link #lock()}; every mutation happens with the lock held.
 *
 * <p>The player list order is the turn rotation. {@code currentPlayerId} is null exactly when
 * the match is completed; otherwise it names a player still below the round cap.
 */
public class Match {
  private final String id;
  private final String lobbyId;
  private final int roundsPerPlayer;
  private final Grid grid;
  private final Instant createdAt;
  private final List<MatchPlayer> players = new ArrayList<>();
  private final List<WordResult> wordsFound = new ArrayList<>();
  private final ReentrantLock lock = new ReentrantLock();

  private MatchStatus status = MatchStatus.IN_PROGRESS;
  private String currentPlayerId;
  private boolean shuffledThisTurn;
  private LastTurn lastTurn;
  private Instant completedAt;
  private long version;

  public Match(
      String id,
      String lobbyId,
      List<MatchPlayer> turnOrder,
      Grid grid,
      int roundsPerPlayer,
      Instant now) {
    if (turnOrder.isEmpty()) {
      throw new InvariantViolation("Match " + id + " created without players");
    }
    this.id = id;
    this.lobbyId = lobbyId;
    this.grid = grid;
    this.roundsPerPlayer = roundsPerPlayer;
    this.createdAt = now;
    this.players.addAll(turnOrder);
    this.currentPlayerId = turnOrder.get(0).userId();
  }

  public String id() {
    return id;
  }

  public String lobbyId() {
    return lobbyId;
  }

  public ReentrantLock lock() {
    return lock;
  }

  public Grid grid() {
    return grid;
  }

  public int roundsPerPlayer() {
    return roundsPerPlayer;
  }

  public MatchStatus status() {
    return status;
  }

  public boolean completed() {
    return status == MatchStatus.COMPLETED;
  }

  public String currentPlayerId() {
    return currentPlayerId;
  }

  public boolean shuffledThisTurn() {
    return shuffledThisTurn;
  }

  public void markShuffled() {
    shuffledThisTurn = true;
  }

  public LastTurn lastTurn() {
    return lastTurn;
  }

  public void lastTurn(LastTurn t) {
    lastTurn = t;
  }

  public List<MatchPlayer> players() {
    return List.copyOf(players);
  }

  public Optional<MatchPlayer> player(String userId) {
    return players.stream().filter(p -> p.userId().equals(userId)).findFirst();
  }

  public void logWord(WordResult r) {
    wordsFound.add(r);
  }

  /** Start a new turn for {@code next}, which may be the same player; resets the shuffle allowance. */
  public void passTurnTo(String next) {
    shuffledThisTurn = false;
    currentPlayerId = next;
  }

  /**
   * Round-robin over the fixed order, starting with the player at {@code fromIndex} and
   * wrapping, skipping anyone who has reached the round cap.
   *
   * @return the first eligible player id, or null if nobody may play another round
   */
  public String firstEligibleFrom(int fromIndex) {
    int n = players.size();
    for (int i = 0; i < n; i++) {
      MatchPlayer p = players.get(Math.floorMod(fromIndex + i, n));
      if (p.roundsPlayed() < roundsPerPlayer) return p.userId();
    }
    return null;
  }

  public int indexOf(String userId) {
    for (int i = 0; i < players.size(); i++) {
      if (players.get(i).userId().equals(userId)) return i;
    }
    return -1;
  }

  /** @return index the player held in the turn order, or -1 if absent */
  public int removePlayer(String userId) {
    int idx = indexOf(userId);
    if (idx >= 0) {
      players.remove(idx);
      if (lastTurn != null && userId.equals(lastTurn.playerId())) {
        lastTurn = null;
      }
    }
    return idx;
  }

  public int playerCount() {
    return players.size();
  }

  public void complete(Instant now) {
    status = MatchStatus.COMPLETED;
    completedAt = now;
    passTurnTo(null);
  }

  public void touch() {
    version++;
  }

  /** Highest round any player is on, capped at the round limit. */
  public int roundNumber() {
    int played = players.stream().mapToInt(MatchPlayer::roundsPlayed).max().orElse(0);
    return Math.min(played + 1, roundsPerPlayer);
  }

  /**
   * Verify the turn invariants.
   *
   * @return a description of the first violation, or null if the state is consistent
   */
  public String invariantViolation() {
    if (players.isEmpty() && !completed()) {
      return "in-progress match has no players";
    }
    if (completed()) {
      return currentPlayerId == null ? null : "completed match still names a current player";
    }
    if (currentPlayerId == null) {
      return "in-progress match has no current player";
    }
    Optional<MatchPlayer> cur = player(currentPlayerId);
    if (cur.isEmpty()) {
      return "current player " + currentPlayerId + " is not in the match";
    }
    if (cur.get().roundsPlayed() >= roundsPerPlayer) {
      return "current player " + currentPlayerId + " already reached the round cap";
    }
    return null;
  }

  public MatchSnapshot snapshot() {
    return new MatchSnapshot(
        id,
        lobbyId,
        status,
        players.stream().map(MatchPlayer::snapshot).toList(),
        currentPlayerId,
        grid.toRows(),
        wordsFound,
        roundNumber(),
        roundsPerPlayer,
        lastTurn,
        version,
        createdAt,
        completedAt);
  }
}
