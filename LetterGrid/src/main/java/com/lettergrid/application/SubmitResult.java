package com.lettergrid.application;

import com.lettergrid.domain.MatchSnapshot;
import com.lettergrid.domain.scoring.WordResult;

/**
 * Accepted word submission.
 *
 * @param gemBonus flat bonus for gem tiles in the selection
 * @param scoreDelta points added to the player: final score plus gem bonus
 */
public record SubmitResult(WordResult result, int gemBonus, int scoreDelta, MatchSnapshot match) {}
