package com.lettergrid.domain.grid;

public record TilePosition(int row, int col) {

  /** 8-directional neighbour test; a cell is not adjacent to itself. */
  public boolean isAdjacentTo(TilePosition other) {
    int dr = Math.abs(row - other.row);
    int dc = Math.abs(col - other.col);
    return dr <= 1 && dc <= 1 && (dr + dc) > 0;
  }
}
