package com.lettergrid.application;

import com.lettergrid.domain.LobbySnapshot;
import com.lettergrid.domain.MatchSnapshot;

/**
 * State after a player left or was removed.
 *
 * @param lobby the lobby after the change, or null if it was deleted because it emptied
 * @param match the live match after the player was dropped from it, or null if none was affected
 */
public record LeaveResult(LobbySnapshot lobby, MatchSnapshot match) {
  public boolean lobbyDeleted() {
    return lobby == null;
  }
}
