package io.autotel.breaker;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
  /** Calls pass through; failures are counted within the window. */
  CLOSED,
  /** Calls fail fast with {@link CircuitOpenException} until the reset timeout elapses. */
  OPEN,
  /** A single trial call decides between {@link #CLOSED} and {@link #OPEN}. */
  HALF_OPEN
}
