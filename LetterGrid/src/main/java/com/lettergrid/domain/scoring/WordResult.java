package com.lettergrid.domain.scoring;

import java.util.List;

/**
 * An accepted, scored word.
 *
 * @param word letters in selection order
 * @param baseScore letter values after letter bonuses, before word bonuses
 * @param multipliers bonus tags in the order the tiles were selected
 * @param finalScore base score times the compounded word factor plus any length bonus
 */
public record WordResult(String word, int baseScore, List<String> multipliers, int finalScore)
    implements ScoreOutcome {

  public WordResult {
    multipliers = List.copyOf(multipliers);
  }
}
