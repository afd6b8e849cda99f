package com.lettergrid.application;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Counts identified realtime connections per user. When a user's last connection closes and the
 * user does not come back within the grace period, it leaves every lobby it is in.
 */
@Service
public class PresenceService {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final Map<String, Integer> connections = new HashMap<>();
  private final Map<String, ScheduledFuture<?>> pending = new HashMap<>();

  private final LobbyService lobbies;
  private final TaskScheduler scheduler;
  private final Clock clock;
  private final Duration grace;

  public PresenceService(
      LobbyService lobbies,
      @Qualifier("taskScheduler") TaskScheduler scheduler,
      Clock clock,
      @Value("${lettergrid.lobby-reconnect-grace-ms:120000}") long graceMs) {
    this.lobbies = lobbies;
    this.scheduler = scheduler;
    this.clock = clock;
    this.grace = Duration.ofMillis(graceMs);
  }

  public synchronized void connected(String userId) {
    connections.merge(userId, 1, Integer::sum);
    ScheduledFuture<?> cleanup = pending.remove(userId);
    if (cleanup != null) {
      cleanup.cancel(false);
      log.debug("User {} reconnected within grace period", userId);
    }
  }

  public synchronized void disconnected(String userId) {
    Integer left = connections.computeIfPresent(userId, (k, n) -> n > 1 ? n - 1 : null);
    if (left != null || pending.containsKey(userId)) return;
    pending.put(userId, scheduler.schedule(() -> expire(userId), clock.instant().plus(grace)));
    log.debug("User {} offline; lobby cleanup in {}", userId, grace);
  }

  public synchronized boolean isOnline(String userId) {
    return connections.containsKey(userId);
  }

  /**
   * Grace timer callback. Holds the monitor through the lobby cleanup so a reconnect is ordered
   * either before it (and cancels it) or after it.
   */
  synchronized void expire(String userId) {
    pending.remove(userId);
    if (connections.containsKey(userId)) return;
    int left = lobbies.leaveAll(userId);
    if (left > 0) {
      log.info("User {} did not reconnect; removed from {} lobbies", userId, left);
    }
  }
}
