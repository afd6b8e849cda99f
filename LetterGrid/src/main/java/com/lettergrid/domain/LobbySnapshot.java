package com.lettergrid.domain;

import java.time.Instant;
import java.util.List;

/** Immutable view of a lobby as broadcast to clients. */
public record LobbySnapshot(
    String id,
    String code,
    String serverId,
    String hostId,
    Visibility visibility,
    LobbyStatus status,
    int maxPlayers,
    List<LobbyPlayer> players,
    String matchId,
    long version,
    Instant createdAt,
    Instant updatedAt) {

  public LobbySnapshot {
    players = List.copyOf(players);
  }

  public boolean hasPlayer(String userId) {
    return players.stream().anyMatch(p -> p.userId().equals(userId));
  }
}
