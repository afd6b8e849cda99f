package com.lettergrid.domain;

import java.util.Objects;

/**
 * Synchronous result of a lobby or match command. A rejection is an ordinary, expected answer
 * for the caller only; it never mutates state and is never broadcast.
 */
public sealed interface Outcome<T> permits Outcome.Accepted, Outcome.Rejected {

  static <T> Outcome<T> accepted(T value) {
    return new Accepted<>(value);
  }

  static <T> Outcome<T> rejected(RejectionReason reason, String message) {
    return new Rejected<>(reason, message);
  }

  default boolean isAccepted() {
    return this instanceof Accepted;
  }

  /** Value of an accepted outcome. */
  default T value() {
    if (this instanceof Accepted<T> a) return a.value();
    throw new IllegalStateException("Outcome was rejected: " + this);
  }

  record Accepted<T>(T value) implements Outcome<T> {}

  record Rejected<T>(RejectionReason reason, String message) implements Outcome<T> {
    public Rejected {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
