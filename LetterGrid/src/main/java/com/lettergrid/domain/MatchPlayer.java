package com.lettergrid.domain;

import java.util.ArrayList;
import java.util.List;

/** Per-player ledger inside a match. Score and rounds only ever grow. */
public class MatchPlayer {
  private final String userId;
  private final String username;
  private final List<String> wordsFound = new ArrayList<>();
  private int score;
  private int roundsPlayed;

  public MatchPlayer(String userId, String username) {
    this.userId = userId;
    this.username = username;
  }

  public String userId() {
    return userId;
  }

  public String username() {
    return username;
  }

  public int score() {
    return score;
  }

  public int roundsPlayed() {
    return roundsPlayed;
  }

  public void award(String word, int points) {
    if (points < 0) {
      throw new IllegalArgumentException("Negative award: " + points);
    }
    score += points;
    wordsFound.add(word);
  }

  public void finishRound() {
    roundsPlayed++;
  }

  public Snapshot snapshot() {
    return new Snapshot(userId, username, score, roundsPlayed, List.copyOf(wordsFound));
  }

  public record Snapshot(
      String userId, String username, int score, int roundsPlayed, List<String> wordsFound) {}
}
