package com.lettergrid.domain.grid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Draws letters from a frequency-weighted bag and lays out fresh grids.
 *
 * <p>About 15% of cells carry a letter or word bonus and about 8% carry a gem. Not thread-safe
 * beyond what the supplied {@link Random} guarantees.
 */
public class GridGenerator {
  static final double BONUS_CHANCE = 0.15;
  static final double GEM_CHANCE = 0.08;

  private static final Map<Character, Integer> LETTER_FREQUENCIES = new LinkedHashMap<>();

  static {
    LETTER_FREQUENCIES.put('E', 12);
    LETTER_FREQUENCIES.put('T', 9);
    LETTER_FREQUENCIES.put('A', 9);
    LETTER_FREQUENCIES.put('O', 8);
    LETTER_FREQUENCIES.put('I', 8);
    LETTER_FREQUENCIES.put('N', 7);
    LETTER_FREQUENCIES.put('S', 7);
    LETTER_FREQUENCIES.put('H', 6);
    LETTER_FREQUENCIES.put('R', 6);
    LETTER_FREQUENCIES.put('D', 5);
    LETTER_FREQUENCIES.put('L', 5);
    LETTER_FREQUENCIES.put('C', 4);
    LETTER_FREQUENCIES.put('U', 4);
    LETTER_FREQUENCIES.put('M', 4);
    LETTER_FREQUENCIES.put('W', 3);
    LETTER_FREQUENCIES.put('F', 3);
    LETTER_FREQUENCIES.put('G', 3);
    LETTER_FREQUENCIES.put('Y', 3);
    LETTER_FREQUENCIES.put('P', 3);
    LETTER_FREQUENCIES.put('B', 2);
    LETTER_FREQUENCIES.put('V', 2);
    LETTER_FREQUENCIES.put('K', 2);
    LETTER_FREQUENCIES.put('J', 1);
    LETTER_FREQUENCIES.put('X', 1);
    LETTER_FREQUENCIES.put('Q', 1);
    LETTER_FREQUENCIES.put('Z', 1);
  }

  private static final Bonus[] BONUSES = {
    Bonus.DOUBLE_LETTER, Bonus.TRIPLE_LETTER, Bonus.DOUBLE_WORD, Bonus.TRIPLE_WORD
  };

  private final Random rnd;
  private final List<String> bag;

  public GridGenerator(Random rnd) {
    this.rnd = rnd;
    List<String> letters = new ArrayList<>();
    LETTER_FREQUENCIES.forEach(
        (letter, freq) -> {
          for (int i = 0; i < freq; i++) letters.add(String.valueOf(letter));
        });
    this.bag = List.copyOf(letters);
  }

  public synchronized String drawLetter() {
    return bag.get(rnd.nextInt(bag.size()));
  }

  public synchronized Grid generate(int rows, int cols) {
    if (rows <= 0 || cols <= 0) {
      throw new IllegalArgumentException("Grid dimensions must be positive: " + rows + "x" + cols);
    }
    Tile[][] cells = new Tile[rows][cols];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        String letter = drawLetter();
        Bonus bonus = rnd.nextDouble() < BONUS_CHANCE ? BONUSES[rnd.nextInt(BONUSES.length)] : Bonus.NONE;
        boolean gem = rnd.nextDouble() < GEM_CHANCE;
        cells[r][c] = new Tile(letter, bonus, r, c, gem);
      }
    }
    return new Grid(cells);
  }
}
