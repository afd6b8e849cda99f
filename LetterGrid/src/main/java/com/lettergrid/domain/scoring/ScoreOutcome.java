package com.lettergrid.domain.scoring;

/** Result of scoring a selection: either a {@link WordResult} or a {@link Rejected} marker. */
public sealed interface ScoreOutcome permits WordResult, ScoreOutcome.Rejected {

  String word();

  default boolean accepted() {
    return this instanceof WordResult;
  }

  enum Reason {
    TOO_SHORT,
    NOT_IN_DICTIONARY
  }

  record Rejected(String word, Reason reason) implements ScoreOutcome {}
}
