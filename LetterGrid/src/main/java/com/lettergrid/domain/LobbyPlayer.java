package com.lettergrid.domain;

import java.time.Instant;

public record LobbyPlayer(
    String userId, String username, boolean ready, boolean host, Instant joinedAt) {

  public LobbyPlayer withReady(boolean r) {
    return new LobbyPlayer(userId, username, r, host, joinedAt);
  }

  public LobbyPlayer withHost(boolean h) {
    return new LobbyPlayer(userId, username, ready, h, joinedAt);
  }
}
