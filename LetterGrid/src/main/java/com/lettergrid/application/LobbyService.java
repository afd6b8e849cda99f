package com.lettergrid.application;

import com.lettergrid.application.port.Broadcaster;
import com.lettergrid.domain.Channels;
import com.lettergrid.domain.Lobby;
import com.lettergrid.domain.LobbySnapshot;
import com.lettergrid.domain.LobbyStatus;
import com.lettergrid.domain.MatchSnapshot;
import com.lettergrid.domain.Outcome;
import com.lettergrid.domain.RejectionReason;
import com.lettergrid.domain.Visibility;
import com.lettergrid.dto.ServerMessage;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Lobby lifecycle: create, join, ready-up, leave, host eviction and start.
 *
 * <p>State is in-memory. Each lobby is mutated only with its {@link Lobby#lock()} held and the
 * post-mutation snapshot is published before the lock is released, so the broadcast always
 * precedes the reply to the caller. When a lobby lock and a match lock are both needed, the lobby
 * lock is taken first.
 */
@Service
public class LobbyService {
  public static final String DEFAULT_SERVER = "global";
  private static final int MAX_CODE_ATTEMPTS = 100_000;

  private final Logger log = LoggerFactory.getLogger(getClass());
  private final SecureRandom rnd = new SecureRandom();

  /** All live lobbies keyed by id. */
  private final Map<String, Lobby> lobbies = new ConcurrentHashMap<>();
  /** Join code to lobby id, for codes currently in use. */
  private final Map<String, String> codes = new ConcurrentHashMap<>();

  private final Broadcaster publisher;
  private final MatchService matches;
  private final Clock clock;
  private final int minPlayers;
  private final int maxPlayers;

  public LobbyService(
      Broadcaster publisher,
      MatchService matches,
      Clock clock,
      @Value("${lettergrid.min-players:2}") int minPlayers,
      @Value("${lettergrid.max-players:8}") int maxPlayers) {
    if (maxPlayers < 1 || maxPlayers > 8) {
      throw new IllegalArgumentException("lettergrid.max-players must be in [1, 8]: " + maxPlayers);
    }
    this.publisher = publisher;
    this.matches = matches;
    this.clock = clock;
    this.minPlayers = minPlayers;
    this.maxPlayers = maxPlayers;
  }

  /**
   * Create a lobby with a fresh 4-digit join code and seat the caller as host (not ready).
   *
   * @param serverId grouping scope for public listings, {@value #DEFAULT_SERVER} if null
   */
  public LobbySnapshot create(
      String hostId, String username, Visibility visibility, String serverId) {
    Lobby lobby = newLobby(visibility, serverId);
    LobbySnapshot snap;
    lobby.lock().lock();
    try {
      Instant now = clock.instant();
      lobby.addPlayer(hostId, username, now);
      lobby.touch(now);
      lobbies.put(lobby.id(), lobby);
      snap = lobby.snapshot();
      publishLobby(snap);
    } finally {
      lobby.lock().unlock();
    }
    log.info("Created lobby {} (code {}) host {}", lobby.id(), lobby.code(), hostId);
    return snap;
  }

  /** Create a public lobby for two queued players: the first hosts, the second joins. */
  public LobbySnapshot createMatched(
      String hostId, String hostName, String guestId, String guestName, String serverId) {
    Lobby lobby = newLobby(Visibility.PUBLIC, serverId);
    LobbySnapshot snap;
    lobby.lock().lock();
    try {
      Instant now = clock.instant();
      lobby.addPlayer(hostId, hostName, now);
      lobby.addPlayer(guestId, guestName, now);
      lobby.touch(now);
      lobbies.put(lobby.id(), lobby);
      snap = lobby.snapshot();
      publishLobby(snap);
    } finally {
      lobby.lock().unlock();
    }
    log.info("Matched {} and {} into lobby {}", hostId, guestId, lobby.id());
    return snap;
  }

  public Optional<LobbySnapshot> get(String lobbyId) {
    Lobby lobby = lobbyId == null ? null : lobbies.get(lobbyId);
    return lobby == null ? Optional.empty() : Optional.ofNullable(snapshotOf(lobby));
  }

  public Optional<LobbySnapshot> getByCode(String code) {
    String id = code == null ? null : codes.get(code.trim());
    return id == null ? Optional.empty() : get(id);
  }

  /** Public lobbies still waiting for players in the given scope, oldest first. */
  public List<LobbySnapshot> listOpen(String serverId) {
    String scope = serverId == null ? DEFAULT_SERVER : serverId;
    return lobbies.values().stream()
        .filter(l -> l.serverId().equals(scope) && l.visibility() == Visibility.PUBLIC)
        .map(this::snapshotOf)
        .filter(s -> s != null && s.status() == LobbyStatus.WAITING)
        .sorted(Comparator.comparing(LobbySnapshot::createdAt))
        .toList();
  }

  public Outcome<LobbySnapshot> joinByCode(String code, String userId, String username) {
    String id = code == null ? null : codes.get(code.trim());
    if (id == null) {
      return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
    }
    return join(id, userId, username);
  }

  /**
   * Add a player to a waiting lobby. Joining a lobby one is already in is accepted without
   * change.
   */
  public Outcome<LobbySnapshot> join(String lobbyId, String userId, String username) {
    Lobby lobby = lobbies.get(lobbyId);
    if (lobby == null) {
      return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
    }

    LobbySnapshot snap;
    lobby.lock().lock();
    try {
      if (lobby.deleted()) {
        return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
      }
      if (lobby.player(userId).isPresent()) {
        return Outcome.accepted(lobby.snapshot());
      }
      if (lobby.status() != LobbyStatus.WAITING) {
        return Outcome.rejected(RejectionReason.ALREADY_PLAYING, "Lobby already started");
      }
      if (lobby.isFull()) {
        return Outcome.rejected(RejectionReason.FULL, "Lobby is full");
      }
      Instant now = clock.instant();
      lobby.addPlayer(userId, username, now);
      lobby.touch(now);
      snap = lobby.snapshot();
      publishLobby(snap);
    } finally {
      lobby.lock().unlock();
    }
    log.info("User {} joined lobby {} ({}/{})", userId, lobbyId, snap.players().size(), maxPlayers);
    return Outcome.accepted(snap);
  }

  /** Toggle readiness. A user who is not a member is ignored. */
  public Outcome<LobbySnapshot> setReady(String lobbyId, String userId, boolean ready) {
    Lobby lobby = lobbies.get(lobbyId);
    if (lobby == null) {
      return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
    }

    lobby.lock().lock();
    try {
      if (lobby.deleted()) {
        return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
      }
      if (lobby.status() != LobbyStatus.WAITING) {
        return Outcome.rejected(RejectionReason.ALREADY_PLAYING, "Lobby already started");
      }
      if (lobby.player(userId).isEmpty()) {
        return Outcome.accepted(lobby.snapshot());
      }
      lobby.setReady(userId, ready);
      lobby.touch(clock.instant());
      LobbySnapshot snap = lobby.snapshot();
      publishLobby(snap);
      return Outcome.accepted(snap);
    } finally {
      lobby.lock().unlock();
    }
  }

  /**
   * Leave a lobby. A departing host hands the seat to the earliest remaining joiner; the last
   * player out deletes the lobby. A live match drops the player too.
   */
  public Outcome<LeaveResult> leave(String lobbyId, String userId) {
    Lobby lobby = lobbies.get(lobbyId);
    if (lobby == null) {
      return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
    }

    lobby.lock().lock();
    try {
      if (lobby.deleted()) {
        return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
      }
      if (lobby.player(userId).isEmpty()) {
        return Outcome.accepted(new LeaveResult(lobby.snapshot(), null));
      }
      return Outcome.accepted(depart(lobby, userId));
    } finally {
      lobby.lock().unlock();
    }
  }

  /** Host-only eviction of another member. Hosts leave through {@link #leave} instead. */
  public Outcome<LeaveResult> removePlayer(
      String lobbyId, String targetUserId, String requestedBy) {
    Lobby lobby = lobbies.get(lobbyId);
    if (lobby == null) {
      return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
    }

    lobby.lock().lock();
    try {
      if (lobby.deleted()) {
        return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
      }
      if (requestedBy == null || !requestedBy.equals(lobby.hostId())) {
        return Outcome.rejected(RejectionReason.NOT_HOST, "Only the host can remove players");
      }
      if (requestedBy.equals(targetUserId)) {
        return Outcome.rejected(
            RejectionReason.INVALID_TARGET, "Host cannot remove themselves; leave instead");
      }
      if (lobby.player(targetUserId).isEmpty()) {
        return Outcome.accepted(new LeaveResult(lobby.snapshot(), null));
      }
      log.info("Host {} removed {} from lobby {}", requestedBy, targetUserId, lobbyId);
      return Outcome.accepted(depart(lobby, targetUserId));
    } finally {
      lobby.lock().unlock();
    }
  }

  public Outcome<StartResult> start(String lobbyId) {
    return start(lobbyId, null);
  }

  /**
   * Start the match once at least the minimum number of players are seated and all are ready.
   * Turn order is join order.
   *
   * @param requestedBy when not null, must be the current host
   */
  public Outcome<StartResult> start(String lobbyId, String requestedBy) {
    Lobby lobby = lobbies.get(lobbyId);
    if (lobby == null) {
      return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
    }

    StartResult result;
    lobby.lock().lock();
    try {
      if (lobby.deleted()) {
        return Outcome.rejected(RejectionReason.NOT_FOUND, "Lobby not found");
      }
      if (requestedBy != null && !requestedBy.equals(lobby.hostId())) {
        return Outcome.rejected(RejectionReason.NOT_HOST, "Only the host can start the match");
      }
      if (lobby.status() != LobbyStatus.WAITING) {
        return Outcome.rejected(RejectionReason.ALREADY_PLAYING, "Lobby already started");
      }
      if (lobby.size() < minPlayers) {
        return Outcome.rejected(
            RejectionReason.NOT_ENOUGH_PLAYERS, "Need at least " + minPlayers + " players to start");
      }
      if (!lobby.allReady()) {
        return Outcome.rejected(RejectionReason.NOT_READY, "All players must be ready");
      }

      MatchSnapshot match = matches.start(lobby.id(), lobby.players());
      lobby.status(LobbyStatus.PLAYING);
      lobby.matchId(match.id());
      lobby.touch(clock.instant());
      LobbySnapshot snap = lobby.snapshot();
      publishLobby(snap);
      result = new StartResult(snap, match);
    } finally {
      lobby.lock().unlock();
    }
    log.info("Lobby {} started match {}", lobbyId, result.match().id());
    return Outcome.accepted(result);
  }

  /** Mark the owning lobby finished once its match completes. */
  @EventListener
  public void onMatchCompleted(MatchCompletedEvent e) {
    String lobbyId = e.match().lobbyId();
    Lobby lobby = lobbyId == null ? null : lobbies.get(lobbyId);
    if (lobby == null) return;

    lobby.lock().lock();
    try {
      if (lobby.deleted()
          || lobby.status() != LobbyStatus.PLAYING
          || !e.match().id().equals(lobby.matchId())) {
        return;
      }
      lobby.status(LobbyStatus.FINISHED);
      lobby.touch(clock.instant());
      publishLobby(lobby.snapshot());
    } finally {
      lobby.lock().unlock();
    }
    log.info("Lobby {} finished.", lobbyId);
  }

  /** Remove a user from every lobby it belongs to, e.g. after its connections lapsed. */
  public int leaveAll(String userId) {
    int left = 0;
    for (Lobby lobby : new ArrayList<>(lobbies.values())) {
      LobbySnapshot snap = snapshotOf(lobby);
      if (snap != null && snap.hasPlayer(userId) && leave(lobby.id(), userId).isAccepted()) {
        left++;
      }
    }
    return left;
  }

  /**
   * Delete waiting lobbies with at most one player and no activity since {@code cutoff}.
   *
   * @return number of lobbies deleted
   */
  public int cleanupInactive(Instant cutoff) {
    int removed = 0;
    for (Lobby lobby : new ArrayList<>(lobbies.values())) {
      lobby.lock().lock();
      try {
        if (!lobby.deleted()
            && lobby.status() == LobbyStatus.WAITING
            && lobby.size() <= 1
            && lobby.updatedAt().isBefore(cutoff)) {
          delete(lobby);
          removed++;
        }
      } finally {
        lobby.lock().unlock();
      }
    }
    return removed;
  }

  // Helpers

  private Lobby newLobby(Visibility visibility, String serverId) {
    String id = UUID.randomUUID().toString();
    String code = reserveCode(id);
    return new Lobby(
        id,
        code,
        serverId == null || serverId.isBlank() ? DEFAULT_SERVER : serverId,
        visibility == null ? Visibility.PUBLIC : visibility,
        maxPlayers,
        clock.instant());
  }

  /** Claim an unused 4-digit code for the lobby. */
  private String reserveCode(String lobbyId) {
    for (int i = 0; i < MAX_CODE_ATTEMPTS; i++) {
      String code = Integer.toString(1000 + rnd.nextInt(9000));
      if (codes.putIfAbsent(code, lobbyId) == null) return code;
    }
    throw new IllegalStateException("No free lobby code after " + MAX_CODE_ATTEMPTS + " attempts");
  }

  /** Remove a member with the lobby lock held; deletes the lobby if it empties. */
  private LeaveResult depart(Lobby lobby, String userId) {
    lobby.removePlayer(userId);
    if (lobby.size() == 0) {
      delete(lobby);
      matches.discard(lobby.matchId());
      return new LeaveResult(null, null);
    }

    MatchSnapshot match = null;
    if (lobby.status() == LobbyStatus.PLAYING) {
      match = matches.removePlayer(lobby.matchId(), userId).orElse(null);
    }
    lobby.touch(clock.instant());
    LobbySnapshot snap = lobby.snapshot();
    publishLobby(snap);
    log.info("User {} left lobby {}; host is {}", userId, lobby.id(), snap.hostId());
    return new LeaveResult(snap, match);
  }

  /** Unregister a lobby and announce it; caller holds the lobby lock. */
  private void delete(Lobby lobby) {
    lobby.markDeleted();
    lobbies.remove(lobby.id());
    codes.remove(lobby.code(), lobby.id());
    publisher.publish(new ServerMessage.LobbyDeleted(Channels.lobby(lobby.id()), lobby.id()));
    if (lobby.visibility() == Visibility.PUBLIC) {
      publisher.publish(
          new ServerMessage.LobbyDeleted(Channels.serverLobbies(lobby.serverId()), lobby.id()));
    }
    log.info("Lobby {} removed.", lobby.id());
  }

  private void publishLobby(LobbySnapshot snap) {
    publisher.publish(new ServerMessage.LobbyUpdate(Channels.lobby(snap.id()), snap));
    if (snap.visibility() == Visibility.PUBLIC) {
      publisher.publish(
          new ServerMessage.LobbyUpdate(Channels.serverLobbies(snap.serverId()), snap));
    }
  }

  /** Locked snapshot, or null if the lobby was deleted meanwhile. */
  private LobbySnapshot snapshotOf(Lobby lobby) {
    lobby.lock().lock();
    try {
      return lobby.deleted() ? null : lobby.snapshot();
    } finally {
      lobby.lock().unlock();
    }
  }
}
