package io.autotel.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff between retry rounds, with optional jitter.
 *
 * <p>Delay: {@code baseDelay * 2^(round-1)} capped at {@code maxDelay}; with jitter the capped
 * value is scaled by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  /**
   * @param baseDelayMs delay before the first retry round (milliseconds, &ge; 0)
   * @param maxDelayMs  delay cap (milliseconds, &ge; 0)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, true);
  }

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int round) {
    if (round <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    long delay;
    if (round >= 63 || (1L << (round - 1)) > maxDelayMs / baseDelayMs) {
      delay = maxDelayMs;
    } else {
      delay = Math.min(maxDelayMs, baseDelayMs << (round - 1));
    }
    if (!jitter) {
      return delay;
    }
    double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, (long) (delay * factor));
  }
}
