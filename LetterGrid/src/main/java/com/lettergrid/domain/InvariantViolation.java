package com.lettergrid.domain;

/** Authoritative state reached a shape that correct callers can never produce. */
public class InvariantViolation extends IllegalStateException {
  public InvariantViolation(String message) {
    super(message);
  }
}
