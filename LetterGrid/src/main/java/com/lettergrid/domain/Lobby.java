package com.lettergrid.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lobby membership and readiness. All reads and writes happen with {@link #lock()} held; the
 * instance is never handed out, only {@link #snapshot()}s are.
 */
public class Lobby {
  private final String id;
  private final String code;
  private final String serverId;
  private final Visibility visibility;
  private final int maxPlayers;
  private final Instant createdAt;
  private final List<LobbyPlayer> players = new ArrayList<>();
  private final ReentrantLock lock = new ReentrantLock();

  private String hostId;
  private LobbyStatus status = LobbyStatus.WAITING;
  private String matchId;
  private Instant updatedAt;
  private long version;
  private boolean deleted;

  public Lobby(
      String id, String code, String serverId, Visibility visibility, int maxPlayers, Instant now) {
    this.id = id;
    this.code = code;
    this.serverId = serverId;
    this.visibility = visibility;
    this.maxPlayers = maxPlayers;
    this.createdAt = now;
    this.updatedAt = now;
  }

  public String id() {
    return id;
  }

  public String code() {
    return code;
  }

  public String serverId() {
    return serverId;
  }

  public Visibility visibility() {
    return visibility;
  }

  public int maxPlayers() {
    return maxPlayers;
  }

  public ReentrantLock lock() {
    return lock;
  }

  public String hostId() {
    return hostId;
  }

  public LobbyStatus status() {
    return status;
  }

  public void status(LobbyStatus s) {
    status = s;
  }

  public String matchId() {
    return matchId;
  }

  public void matchId(String m) {
    matchId = m;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  public boolean deleted() {
    return deleted;
  }

  public void markDeleted() {
    deleted = true;
  }

  public List<LobbyPlayer> players() {
    return List.copyOf(players);
  }

  public int size() {
    return players.size();
  }

  public boolean isFull() {
    return players.size() >= maxPlayers;
  }

  public Optional<LobbyPlayer> player(String userId) {
    return players.stream().filter(p -> p.userId().equals(userId)).findFirst();
  }

  public boolean allReady() {
    return players.stream().allMatch(LobbyPlayer::ready);
  }

  public void addPlayer(String userId, String username, Instant joinedAt) {
    boolean first = players.isEmpty();
    players.add(new LobbyPlayer(userId, username, false, first, joinedAt));
    if (first) hostId = userId;
  }

  public void setReady(String userId, boolean ready) {
    players.replaceAll(p -> p.userId().equals(userId) ? p.withReady(ready) : p);
  }

  /**
   * Remove a member. If it held the host seat and others remain, the seat passes to the earliest
   * joiner; equal join times fall back to join order.
   *
   * @return true if the member was present
   */
  public boolean removePlayer(String userId) {
    boolean removed = players.removeIf(p -> p.userId().equals(userId));
    if (removed && userId.equals(hostId)) {
      hostId = null;
      players.stream()
          .min(Comparator.comparing(LobbyPlayer::joinedAt))
          .ifPresent(next -> hostId = next.userId());
      players.replaceAll(p -> p.withHost(p.userId().equals(hostId)));
    }
    return removed;
  }

  /** Record a mutation: bumps the version and the activity timestamp. */
  public void touch(Instant now) {
    updatedAt = now;
    version++;
  }

  public LobbySnapshot snapshot() {
    return new LobbySnapshot(
        id,
        code,
        serverId,
        hostId,
        visibility,
        status,
        maxPlayers,
        players,
        matchId,
        version,
        createdAt,
        updatedAt);
  }
}
