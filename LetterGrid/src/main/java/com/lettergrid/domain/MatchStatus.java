package com.lettergrid.domain;

public enum MatchStatus {
  IN_PROGRESS,
  COMPLETED
}
