package com.lettergrid.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Frames a client sends on the realtime socket, keyed by {@code type}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ClientMessage.Identify.class, name = "identify"),
  @JsonSubTypes.Type(value = ClientMessage.Subscribe.class, name = "subscribe"),
  @JsonSubTypes.Type(value = ClientMessage.Unsubscribe.class, name = "unsubscribe"),
  @JsonSubTypes.Type(value = ClientMessage.PlayerAction.class, name = "player:action")
})
public sealed interface ClientMessage
    permits ClientMessage.Identify,
        ClientMessage.Subscribe,
        ClientMessage.Unsubscribe,
        ClientMessage.PlayerAction {

  record Identify(String userId, String username) implements ClientMessage {}

  record Subscribe(String channel) implements ClientMessage {}

  record Unsubscribe(String channel) implements ClientMessage {}

  record PlayerAction(String matchId, ActionDetail action) implements ClientMessage {}
}
