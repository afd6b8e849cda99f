package com.lettergrid.domain.grid;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Fixed-size letter grid. Mutable; callers serialize access through the owning match lock.
 */
public final class Grid {
  private final int rows;
  private final int cols;
  private final Tile[][] cells;

  public Grid(Tile[][] cells) {
    if (cells.length == 0 || cells[0].length == 0) {
      throw new IllegalArgumentException("Grid must have at least one cell");
    }
    this.rows = cells.length;
    this.cols = cells[0].length;
    this.cells = new Tile[rows][cols];
    for (int r = 0; r < rows; r++) {
      if (cells[r].length != cols) {
        throw new IllegalArgumentException("Grid rows must have equal length");
      }
      System.arraycopy(cells[r], 0, this.cells[r], 0, cols);
    }
  }

  public int rows() {
    return rows;
  }

  public int cols() {
    return cols;
  }

  public boolean contains(TilePosition p) {
    return p.row() >= 0 && p.row() < rows && p.col() >= 0 && p.col() < cols;
  }

  public Tile tile(TilePosition p) {
    return cells[p.row()][p.col()];
  }

  public void replace(TilePosition p, UnaryOperator<Tile> change) {
    cells[p.row()][p.col()] = change.apply(cells[p.row()][p.col()]);
  }

  public void replaceAll(UnaryOperator<Tile> change) {
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        cells[r][c] = change.apply(cells[r][c]);
      }
    }
  }

  /**
   * Check that the positions form a path through the grid: all in bounds, no cell visited twice,
   * and each step moves to one of the 8 neighbours.
   */
  public boolean isPath(List<TilePosition> path) {
    Set<TilePosition> seen = new HashSet<>();
    TilePosition prev = null;
    for (TilePosition p : path) {
      if (p == null || !contains(p) || !seen.add(p)) return false;
      if (prev != null && !prev.isAdjacentTo(p)) return false;
      prev = p;
    }
    return true;
  }

  public List<Tile> tiles(List<TilePosition> path) {
    List<Tile> out = new ArrayList<>(path.size());
    for (TilePosition p : path) {
      out.add(tile(p));
    }
    return out;
  }

  /** Immutable row-major copy for snapshots. */
  public List<List<Tile>> toRows() {
    List<List<Tile>> out = new ArrayList<>(rows);
    for (Tile[] row : cells) {
      out.add(List.of(row));
    }
    return List.copyOf(out);
  }
}
