package com.lettergrid.infrastructure;

import com.lettergrid.application.LobbyService;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically deletes abandoned waiting lobbies. */
@Component
public class LobbyJanitor {
  private static final Logger log = LoggerFactory.getLogger(LobbyJanitor.class);

  private final LobbyService lobbies;
  private final Clock clock;
  private final Duration timeout;

  public LobbyJanitor(
      LobbyService lobbies,
      Clock clock,
      @Value("${lettergrid.lobby-inactivity-timeout-ms:1800000}") long timeoutMs) {
    this.lobbies = lobbies;
    this.clock = clock;
    this.timeout = Duration.ofMillis(timeoutMs);
  }

  @Scheduled(
      fixedDelayString = "${lettergrid.lobby-cleanup-interval-ms:60000}",
      initialDelayString = "${lettergrid.lobby-cleanup-interval-ms:60000}")
  public void sweep() {
    int removed = lobbies.cleanupInactive(clock.instant().minus(timeout));
    if (removed > 0) {
      log.info("Removed {} inactive lobbies", removed);
    }
  }
}
