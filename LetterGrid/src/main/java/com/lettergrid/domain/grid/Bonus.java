package com.lettergrid.domain.grid;

/** Cell bonus. Letter bonuses scale one tile, word bonuses scale the running word total. */
public enum Bonus {
  NONE(1, 1, null),
  DOUBLE_LETTER(2, 1, "2x Letter"),
  TRIPLE_LETTER(3, 1, "3x Letter"),
  DOUBLE_WORD(1, 2, "2x Word"),
  TRIPLE_WORD(1, 3, "3x Word");

  private final int letterFactor;
  private final int wordFactor;
  private final String tag;

  Bonus(int letterFactor, int wordFactor, String tag) {
    this.letterFactor = letterFactor;
    this.wordFactor = wordFactor;
    this.tag = tag;
  }

  public int letterFactor() {
    return letterFactor;
  }

  public int wordFactor() {
    return wordFactor;
  }

  /** Label recorded in a word result, or null for {@link #NONE}. */
  public String tag() {
    return tag;
  }
}
