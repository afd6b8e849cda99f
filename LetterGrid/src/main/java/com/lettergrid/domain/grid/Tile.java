package com.lettergrid.domain.grid;

import java.util.Objects;

/**
 * One grid cell.
 *
 * @param letter single upper-case glyph
 * @param bonus cell bonus, never null
 * @param row zero-based row
 * @param col zero-based column
 * @param gem whether consuming this cell grants the gem bonus
 */
public record Tile(String letter, Bonus bonus, int row, int col, boolean gem) {

  public Tile {
    Objects.requireNonNull(letter, "letter");
    bonus = bonus == null ? Bonus.NONE : bonus;
  }

  public static Tile plain(String letter, int row, int col) {
    return new Tile(letter, Bonus.NONE, row, col, false);
  }

  /** Letter redrawn after the tile was consumed by a scored word; bonus and gem are spent. */
  public Tile consumed(String newLetter) {
    return new Tile(newLetter, Bonus.NONE, row, col, false);
  }

  /** Letter redrawn by a shuffle; bonus and gem stay on the cell. */
  public Tile relettered(String newLetter) {
    return new Tile(newLetter, bonus, row, col, gem);
  }

  public TilePosition position() {
    return new TilePosition(row, col);
  }
}
