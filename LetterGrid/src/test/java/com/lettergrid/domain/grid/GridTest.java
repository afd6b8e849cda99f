package com.lettergrid.domain.grid;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class GridTest {
  private final Grid grid = new GridGenerator(new Random(7)).generate(5, 5);

  private static TilePosition at(int row, int col) {
    return new TilePosition(row, col);
  }

  @Test
  void diagonalNeighboursFormAPath() {
    assertThat(grid.isPath(List.of(at(0, 0), at(1, 1), at(2, 2), at(1, 3)))).isTrue();
  }

  @Test
  void gapBreaksThePath() {
    assertThat(grid.isPath(List.of(at(0, 0), at(0, 1), at(0, 3)))).isFalse();
  }

  @Test
  void revisitingACellBreaksThePath() {
    assertThat(grid.isPath(List.of(at(0, 0), at(0, 1), at(0, 0)))).isFalse();
  }

  @Test
  void outOfBoundsBreaksThePath() {
    assertThat(grid.isPath(List.of(at(4, 3), at(4, 4), at(5, 4)))).isFalse();
    assertThat(grid.isPath(List.of(at(-1, 0), at(0, 0), at(0, 1)))).isFalse();
  }

  @Test
  void cellIsNotAdjacentToItself() {
    assertThat(at(2, 2).isAdjacentTo(at(2, 2))).isFalse();
    assertThat(at(2, 2).isAdjacentTo(at(3, 3))).isTrue();
    assertThat(at(2, 2).isAdjacentTo(at(4, 2))).isFalse();
  }

  @Test
  void generatedGridHasRequestedShapeAndPositions() {
    List<List<Tile>> rows = grid.toRows();

    assertThat(rows).hasSize(5);
    for (int r = 0; r < 5; r++) {
      assertThat(rows.get(r)).hasSize(5);
      for (int c = 0; c < 5; c++) {
        Tile t = rows.get(r).get(c);
        assertThat(t.position()).isEqualTo(at(r, c));
        assertThat(t.letter()).matches("[A-Z]");
        assertThat(t.bonus()).isNotNull();
      }
    }
  }

  @Test
  void consumedTileLosesBonusAndGemButShuffleKeepsThem() {
    Tile t = new Tile("K", Bonus.DOUBLE_WORD, 1, 2, true);

    assertThat(t.consumed("E")).isEqualTo(new Tile("E", Bonus.NONE, 1, 2, false));
    assertThat(t.relettered("E")).isEqualTo(new Tile("E", Bonus.DOUBLE_WORD, 1, 2, true));
  }

  @Test
  void snapshotRowsAreDetachedFromLaterChanges() {
    List<List<Tile>> before = grid.toRows();
    Tile original = before.get(0).get(0);

    grid.replace(at(0, 0), t -> t.consumed("Q"));

    assertThat(before.get(0).get(0)).isEqualTo(original);
    assertThat(grid.tile(at(0, 0)).letter()).isEqualTo("Q");
  }
}
