package com.lettergrid.domain;

import java.time.Instant;
import java.util.List;

/** FIFO matchmaking queue contents, oldest first. */
public record QueueSnapshot(int queueSize, List<Entry> entries) {

  public QueueSnapshot {
    entries = List.copyOf(entries);
  }

  public record Entry(String userId, String username, String serverId, Instant joinedAt) {}
}
