package com.lettergrid.domain.scoring;

import com.lettergrid.domain.grid.Bonus;
import com.lettergrid.domain.grid.Tile;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Scores a selection of tiles. Stateless and deterministic: the only input besides the tiles is
 * the dictionary answer.
 *
 * <p>Letter bonuses multiply a single tile's value. Word bonuses compound, so a double-word and a
 * triple-word tile in one selection multiply the word by 6. Words of {@value #LENGTH_BONUS_MIN}
 * letters or more earn a flat {@value #LENGTH_BONUS} points after multipliers. Gems are not
 * scored here.
 */
public final class ScoringEngine {
  public static final int MIN_WORD_LENGTH = 3;
  public static final int LENGTH_BONUS_MIN = 6;
  public static final int LENGTH_BONUS = 5;

  private ScoringEngine() {}

  /**
   * @param tiles tiles in selection order
   * @param dictionary receives the lower-cased candidate word
   */
  public static ScoreOutcome score(List<Tile> tiles, Predicate<String> dictionary) {
    StringBuilder sb = new StringBuilder(tiles.size());
    for (Tile t : tiles) {
      sb.append(t.letter());
    }
    String word = sb.toString();

    int length = word.codePointCount(0, word.length());
    if (length < MIN_WORD_LENGTH) {
      return new ScoreOutcome.Rejected(word, ScoreOutcome.Reason.TOO_SHORT);
    }
    if (!dictionary.test(word.toLowerCase(Locale.ROOT))) {
      return new ScoreOutcome.Rejected(word, ScoreOutcome.Reason.NOT_IN_DICTIONARY);
    }

    int base = 0;
    int wordFactor = 1;
    List<String> tags = new ArrayList<>();
    for (Tile t : tiles) {
      Bonus b = t.bonus();
      base += LetterValues.of(t.letter()) * b.letterFactor();
      wordFactor *= b.wordFactor();
      if (b.tag() != null) tags.add(b.tag());
    }

    int lengthBonus = length >= LENGTH_BONUS_MIN ? LENGTH_BONUS : 0;
    return new WordResult(word, base, tags, base * wordFactor + lengthBonus);
  }
}
