package io.autotel.breaker;

import java.time.Instant;

/**
 * One failure observed by a {@link CircuitBreaker}.
 *
 * @param timestamp when the failure happened
 * @param error     the failure's message, or its {@code toString()} when it has none
 */
public record FailureRecord(Instant timestamp, String error) {

  static FailureRecord of(Instant timestamp, Throwable failure) {
    String message = failure.getMessage();
    return new FailureRecord(timestamp, message != null ? message : String.valueOf(failure));
  }
}
