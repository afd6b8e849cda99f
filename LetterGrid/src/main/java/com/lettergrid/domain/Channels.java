package com.lettergrid.domain;

/** Pub/sub channel names. */
public final class Channels {
  public static final String MATCHMAKING = "matchmaking:global";

  private Channels() {}

  public static String lobby(String lobbyId) {
    return "lobby:" + lobbyId;
  }

  public static String match(String matchId) {
    return "match:" + matchId;
  }

  public static String serverLobbies(String serverId) {
    return "server:" + serverId + ":lobbies";
  }
}
