package com.lettergrid.application;

import com.lettergrid.domain.LobbySnapshot;

public record MatchmakingResult(
    String status, LobbySnapshot lobby, Integer queuePosition, Integer playersInQueue) {

  public static MatchmakingResult matched(LobbySnapshot lobby) {
    return new MatchmakingResult("matched", lobby, null, null);
  }

  public static MatchmakingResult queued(int position, int playersInQueue) {
    return new MatchmakingResult("queued", null, position, playersInQueue);
  }

  public boolean isMatched() {
    return lobby != null;
  }
}
