package io.autotel.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-destination circuit breaker that stops calling a persistently failing subscriber for a
 * cooldown period.
 *
 * <ul>
 *   <li>{@link CircuitState#CLOSED} (initial): actions run directly. Failures older than
 *       {@code windowSizeMs} are pruned; when the remaining count reaches
 *       {@code failureThreshold} the circuit opens.</li>
 *   <li>{@link CircuitState#OPEN}: {@link #execute} throws {@link CircuitOpenException}
 *       without running the action. Once {@code resetTimeoutMs} has elapsed since opening,
 *       the next call becomes a trial.</li>
 *   <li>{@link CircuitState#HALF_OPEN}: entered lazily by that trial call. Success closes the
 *       circuit and clears the failure window; failure reopens it and restarts the timeout.
 *       Calls arriving while the trial is in flight fail fast.</li>
 * </ul>
 *
 * <p>Create instances via {@link #builder(String)}. This class is thread-safe; the protected
 * action always runs outside the breaker's lock.
 *
 * @see CircuitBreaker.Builder
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final String name;
  private final int failureThreshold;
  private final long resetTimeoutMs;
  private final long windowSizeMs;
  private final Clock clock;

  private final Deque<FailureRecord> failures = new ArrayDeque<>();
  private CircuitState state = CircuitState.CLOSED;
  private Instant openedAt;
  private boolean trialInFlight;

  private CircuitBreaker(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    if (builder.failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    if (builder.resetTimeoutMs < 0L) {
      throw new IllegalArgumentException("resetTimeoutMs must be >= 0");
    }
    if (builder.windowSizeMs <= 0L) {
      throw new IllegalArgumentException("windowSizeMs must be > 0");
    }
    this.failureThreshold = builder.failureThreshold;
    this.resetTimeoutMs = builder.resetTimeoutMs;
    this.windowSizeMs = builder.windowSizeMs;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Runs {@code action} under breaker protection.
   *
   * @param action the protected call
   * @param <T>    result type
   * @return the action's result
   * @throws CircuitOpenException if the circuit is open (the action was not invoked)
   * @throws Exception            whatever the action threw, unchanged; an
   *                              {@link InterruptedException} is not counted as a failure
   */
  public <T> T execute(Callable<T> action) throws Exception {
    Objects.requireNonNull(action, "action");
    boolean trial = acquirePermission();
    try {
      T result = action.call();
      onSuccess(trial);
      return result;
    } catch (InterruptedException e) {
      onInterrupted(trial);
      throw e;
    } catch (Throwable t) {
      onFailure(trial, t);
      throw t;
    }
  }

  private synchronized boolean acquirePermission() {
    if (state == CircuitState.CLOSED) {
      return false;
    }
    if (state == CircuitState.HALF_OPEN || trialInFlight) {
      throw new CircuitOpenException(name, 0L);
    }
    long elapsed = Duration.between(openedAt, clock.instant()).toMillis();
    if (elapsed < resetTimeoutMs) {
      throw new CircuitOpenException(name, resetTimeoutMs - elapsed);
    }
    state = CircuitState.HALF_OPEN;
    trialInFlight = true;
    logger.log(Level.FINE, "Circuit breaker {0} HALF_OPEN: running trial call", name);
    return true;
  }

  private synchronized void onSuccess(boolean trial) {
    if (trial) {
      reset();
      logger.log(Level.INFO, "Circuit breaker {0} CLOSED after successful trial call", name);
    }
  }

  private synchronized void onFailure(boolean trial, Throwable failure) {
    Instant now = clock.instant();
    prune(now);
    failures.addLast(FailureRecord.of(now, failure));

    if (trial) {
      open(now);
      logger.log(Level.WARNING, "Circuit breaker {0} reopened: trial call failed", name);
    } else if (state == CircuitState.CLOSED && failures.size() >= failureThreshold) {
      open(now);
      logger.log(Level.WARNING, "Circuit breaker {0} OPEN after {1} failures within {2} ms",
          new Object[]{name, failures.size(), windowSizeMs});
    }
  }

  // An interrupt says nothing about the destination: release the trial, record no failure.
  private synchronized void onInterrupted(boolean trial) {
    if (trial && state == CircuitState.HALF_OPEN) {
      state = CircuitState.OPEN;
      trialInFlight = false;
    }
  }

  private void open(Instant now) {
    state = CircuitState.OPEN;
    openedAt = now;
    trialInFlight = false;
  }

  private void reset() {
    state = CircuitState.CLOSED;
    failures.clear();
    openedAt = null;
    trialInFlight = false;
  }

  private void prune(Instant now) {
    while (!failures.isEmpty()
        && Duration.between(failures.peekFirst().timestamp(), now).toMillis() >= windowSizeMs) {
      failures.pollFirst();
    }
  }

  /** Opens the circuit immediately, as if the threshold had just been reached. */
  public synchronized void forceOpen() {
    open(clock.instant());
  }

  /** Closes the circuit and clears the failure window. */
  public synchronized void forceReset() {
    reset();
  }

  /**
   * Returns the current state. An open circuit whose timeout has elapsed still reports
   * {@link CircuitState#OPEN} until the next call.
   *
   * @return the state
   */
  public synchronized CircuitState getState() {
    return state;
  }

  /**
   * Returns the number of failures inside the current window.
   *
   * @return failure count
   */
  public synchronized int getFailureCount() {
    prune(clock.instant());
    return failures.size();
  }

  /**
   * Returns the failures inside the current window, oldest first.
   *
   * @return immutable snapshot of recent failures
   */
  public synchronized List<FailureRecord> getRecentFailures() {
    prune(clock.instant());
    return List.copyOf(failures);
  }

  public String getName() {
    return name;
  }

  /** Builder for {@link CircuitBreaker}. */
  public static final class Builder {
    private final String name;
    private int failureThreshold = 5;
    private long resetTimeoutMs = 30_000L;
    private long windowSizeMs = 60_000L;
    private Clock clock;

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Sets the number of failures within the window that opens the circuit.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param failureThreshold failures before opening
     * @return this builder
     */
    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * Sets how long the circuit stays open before a trial call is allowed.
     *
     * <p>Optional. Defaults to {@code 30000} ms. Must be &ge; 0.
     *
     * @param resetTimeoutMs open duration in milliseconds
     * @return this builder
     */
    public Builder resetTimeoutMs(long resetTimeoutMs) {
      this.resetTimeoutMs = resetTimeoutMs;
      return this;
    }

    /**
     * Sets the sliding window in which failures are counted.
     *
     * <p>Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
     *
     * @param windowSizeMs window length in milliseconds
     * @return this builder
     */
    public Builder windowSizeMs(long windowSizeMs) {
      this.windowSizeMs = windowSizeMs;
      return this;
    }

    /**
     * Sets the clock used for failure timestamps and the reset timeout.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the breaker in the {@link CircuitState#CLOSED} state.
     *
     * @return a new {@link CircuitBreaker}
     * @throws NullPointerException     if {@code name} is null
     * @throws IllegalArgumentException if a threshold or duration is out of range
     */
    public CircuitBreaker build() {
      return new CircuitBreaker(this);
    }
  }
}
