package com.lettergrid.domain;

import com.lettergrid.domain.grid.Tile;
import com.lettergrid.domain.scoring.WordResult;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Full authoritative match state. Clients replace their local copy with the newest snapshot
 * wholesale.
 */
public record MatchSnapshot(
    String id,
    String lobbyId,
    MatchStatus status,
    List<MatchPlayer.Snapshot> players,
    String currentPlayerId,
    List<List<Tile>> grid,
    List<WordResult> wordsFound,
    int roundNumber,
    int roundsPerPlayer,
    LastTurn lastTurn,
    long version,
    Instant createdAt,
    Instant completedAt) {

  public MatchSnapshot {
    players = List.copyOf(players);
    wordsFound = List.copyOf(wordsFound);
  }

  public Optional<MatchPlayer.Snapshot> player(String userId) {
    return players.stream().filter(p -> p.userId().equals(userId)).findFirst();
  }
}
