package com.lettergrid.application;

import com.lettergrid.domain.MatchSnapshot;

/** Published once, synchronously, after a match reaches {@code COMPLETED}. */
public record MatchCompletedEvent(MatchSnapshot match) {}
