package com.lettergrid.domain;

import java.time.Instant;

/** Summary of the most recent scored turn, shown to every participant. */
public record LastTurn(
    String playerId, String username, String word, int scoreDelta, int gems, Instant completedAt) {}
