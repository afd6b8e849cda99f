package com.lettergrid.domain;

import java.util.Locale;

public enum RejectionReason {
  NOT_FOUND,
  FULL,
  ALREADY_PLAYING,
  NOT_HOST,
  INVALID_TARGET,
  NOT_ENOUGH_PLAYERS,
  NOT_READY,
  NOT_YOUR_TURN,
  MATCH_COMPLETED,
  TOO_FEW_TILES,
  INVALID_PATH,
  INVALID_WORD,
  ALREADY_SHUFFLED;

  /** Wire form, e.g. {@code not_your_turn}. */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
