package com.lettergrid.client;

import com.lettergrid.domain.LobbySnapshot;
import com.lettergrid.domain.MatchSnapshot;
import com.lettergrid.domain.grid.TilePosition;
import com.lettergrid.dto.ServerMessage;
import java.util.List;

/**
 * What a client shows: the latest lobby and match it has accepted, its own tile selection and the
 * active player's last live action.
 */
public record ClientState(
    LobbySnapshot lobby,
    MatchSnapshot match,
    List<TilePosition> selection,
    ServerMessage.PlayerAction lastAction) {

  public static final ClientState EMPTY = new ClientState(null, null, List.of(), null);

  public ClientState {
    selection = selection == null ? List.of() : List.copyOf(selection);
  }

  public ClientState withSelection(List<TilePosition> selection) {
    return new ClientState(lobby, match, selection, lastAction);
  }
}
