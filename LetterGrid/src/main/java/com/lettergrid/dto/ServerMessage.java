package com.lettergrid.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.lettergrid.domain.LobbySnapshot;
import com.lettergrid.domain.MatchSnapshot;
import com.lettergrid.domain.QueueSnapshot;

/**
 * Frames the server pushes on a channel. On the wire every frame is {@code {channel, type, ...}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ServerMessage.LobbyUpdate.class, name = "lobby:update"),
  @JsonSubTypes.Type(value = ServerMessage.LobbyDeleted.class, name = "lobby:deleted"),
  @JsonSubTypes.Type(value = ServerMessage.MatchStarted.class, name = "match:started"),
  @JsonSubTypes.Type(value = ServerMessage.MatchUpdate.class, name = "match:update"),
  @JsonSubTypes.Type(value = ServerMessage.MatchCompleted.class, name = "match:completed"),
  @JsonSubTypes.Type(value = ServerMessage.PlayerAction.class, name = "player:action"),
  @JsonSubTypes.Type(value = ServerMessage.MatchmakingUpdate.class, name = "matchmaking:update")
})
public sealed interface ServerMessage
    permits ServerMessage.LobbyUpdate,
        ServerMessage.LobbyDeleted,
        ServerMessage.MatchStarted,
        ServerMessage.MatchUpdate,
        ServerMessage.MatchCompleted,
        ServerMessage.PlayerAction,
        ServerMessage.MatchmakingUpdate {

  String channel();

  record LobbyUpdate(String channel, LobbySnapshot lobby) implements ServerMessage {}

  record LobbyDeleted(String channel, String lobbyId) implements ServerMessage {}

  record MatchStarted(String channel, MatchSnapshot match) implements ServerMessage {}

  record MatchUpdate(String channel, MatchSnapshot match) implements ServerMessage {}

  record MatchCompleted(String channel, MatchSnapshot match) implements ServerMessage {}

  record PlayerAction(String channel, String playerId, String username, ActionDetail action)
      implements ServerMessage {}

  record MatchmakingUpdate(String channel, QueueSnapshot snapshot) implements ServerMessage {}
}
