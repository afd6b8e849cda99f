package com.lettergrid.interfaces.rest;

import com.lettergrid.domain.Outcome;
import com.lettergrid.domain.RejectionReason;
import com.lettergrid.dto.ErrorMessage;
import java.util.function.Function;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** Maps command outcomes onto HTTP replies. */
final class Responses {
  private Responses() {}

  static <T> ResponseEntity<?> of(Outcome<T> outcome) {
    return of(outcome, Function.identity());
  }

  static <T, B> ResponseEntity<?> of(Outcome<T> outcome, Function<? super T, B> body) {
    if (outcome instanceof Outcome.Rejected<T> r) {
      return rejected(r.reason(), r.message());
    }
    return ResponseEntity.ok(body.apply(outcome.value()));
  }

  static ResponseEntity<ErrorMessage> rejected(RejectionReason reason, String message) {
    return ResponseEntity.status(statusOf(reason)).body(new ErrorMessage(reason.code(), message));
  }

  static ResponseEntity<ErrorMessage> notFound(String message) {
    return rejected(RejectionReason.NOT_FOUND, message);
  }

  static HttpStatus statusOf(RejectionReason reason) {
    switch (reason) {
      case NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      case NOT_HOST:
        return HttpStatus.FORBIDDEN;
      default:
        return HttpStatus.CONFLICT;
    }
  }
}
