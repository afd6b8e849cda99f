package com.lettergrid.client;

import com.lettergrid.domain.LobbySnapshot;
import com.lettergrid.domain.MatchSnapshot;
import com.lettergrid.dto.ServerMessage;
import java.util.List;
import java.util.Objects;

/**
 * Folds server frames into a {@link ClientState}. Snapshots replace the local copy wholesale;
 * one older than the copy already held for the same entity is ignored, since the same update can
 * arrive on both the match and the lobby channel.
 */
public final class ClientStateReducer {
  private ClientStateReducer() {}

  public static ClientState apply(ClientState state, ServerMessage message) {
    if (message instanceof ServerMessage.LobbyUpdate m) {
      return onLobby(state, m.lobby());
    }
    if (message instanceof ServerMessage.LobbyDeleted m) {
      if (state.lobby() == null || !state.lobby().id().equals(m.lobbyId())) return state;
      return new ClientState(null, state.match(), state.selection(), state.lastAction());
    }
    if (message instanceof ServerMessage.MatchStarted m) {
      return onMatch(state, m.match());
    }
    if (message instanceof ServerMessage.MatchUpdate m) {
      return onMatch(state, m.match());
    }
    if (message instanceof ServerMessage.MatchCompleted m) {
      return onMatch(state, m.match());
    }
    if (message instanceof ServerMessage.PlayerAction m) {
      MatchSnapshot match = state.match();
      if (match == null || !Objects.equals(match.currentPlayerId(), m.playerId())) return state;
      return new ClientState(state.lobby(), match, state.selection(), m);
    }
    return state;
  }

  private static ClientState onLobby(ClientState state, LobbySnapshot incoming) {
    LobbySnapshot held = state.lobby();
    if (held != null && held.id().equals(incoming.id()) && incoming.version() < held.version()) {
      return state;
    }
    return new ClientState(incoming, state.match(), state.selection(), state.lastAction());
  }

  private static ClientState onMatch(ClientState state, MatchSnapshot incoming) {
    MatchSnapshot held = state.match();
    if (held != null && held.id().equals(incoming.id()) && incoming.version() < held.version()) {
      return state;
    }
    boolean sameTurn =
        held != null
            && held.id().equals(incoming.id())
            && Objects.equals(held.currentPlayerId(), incoming.currentPlayerId());
    return new ClientState(
        state.lobby(), incoming, List.of(), sameTurn ? state.lastAction() : null);
  }
}
