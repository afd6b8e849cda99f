package com.lettergrid.application;

import com.lettergrid.application.port.Broadcaster;
import com.lettergrid.domain.Channels;
import com.lettergrid.domain.LobbySnapshot;
import com.lettergrid.domain.QueueSnapshot;
import com.lettergrid.dto.ServerMessage;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * First-come first-served pairing. Two users waiting in the same server scope are moved into a
 * new public lobby; there is no rating.
 */
@Service
public class MatchmakingService {
  private final Logger log = LoggerFactory.getLogger(getClass());

  /** Waiting users in arrival order, keyed by user id. */
  private final Map<String, QueueSnapshot.Entry> queue = new LinkedHashMap<>();

  private final LobbyService lobbies;
  private final Broadcaster publisher;
  private final Clock clock;

  public MatchmakingService(LobbyService lobbies, Broadcaster publisher, Clock clock) {
    this.lobbies = lobbies;
    this.publisher = publisher;
    this.clock = clock;
  }

  /** Enqueue, or refresh the position of, a user; pairs the two oldest entries of the scope. */
  public synchronized MatchmakingResult join(String userId, String username, String serverId) {
    String scope = serverId == null || serverId.isBlank() ? LobbyService.DEFAULT_SERVER : serverId;
    queue.remove(userId);
    queue.put(userId, new QueueSnapshot.Entry(userId, username, scope, clock.instant()));

    List<QueueSnapshot.Entry> waiting = inScope(scope);
    MatchmakingResult result;
    if (waiting.size() >= 2) {
      QueueSnapshot.Entry a = waiting.get(0);
      QueueSnapshot.Entry b = waiting.get(1);
      queue.remove(a.userId());
      queue.remove(b.userId());
      LobbySnapshot lobby =
          lobbies.createMatched(a.userId(), a.username(), b.userId(), b.username(), scope);
      result = MatchmakingResult.matched(lobby);
    } else {
      result = MatchmakingResult.queued(position(waiting, userId), waiting.size());
      log.info("User {} queued in {} ({} waiting)", userId, scope, waiting.size());
    }
    publishQueue();
    return result;
  }

  public synchronized void leave(String userId) {
    if (queue.remove(userId) != null) {
      log.info("User {} left the matchmaking queue", userId);
      publishQueue();
    }
  }

  public synchronized QueueSnapshot snapshot() {
    List<QueueSnapshot.Entry> entries = new ArrayList<>(queue.values());
    return new QueueSnapshot(entries.size(), entries);
  }

  private List<QueueSnapshot.Entry> inScope(String scope) {
    return queue.values().stream().filter(e -> e.serverId().equals(scope)).toList();
  }

  private static int position(List<QueueSnapshot.Entry> waiting, String userId) {
    for (int i = 0; i < waiting.size(); i++) {
      if (waiting.get(i).userId().equals(userId)) return i + 1;
    }
    return waiting.size();
  }

  private void publishQueue() {
    publisher.publish(new ServerMessage.MatchmakingUpdate(Channels.MATCHMAKING, snapshot()));
  }
}
