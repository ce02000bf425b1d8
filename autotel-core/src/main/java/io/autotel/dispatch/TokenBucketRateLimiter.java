package io.autotel.dispatch;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket limiting how fast events are handed to subscribers.
 *
 * <p>The bucket starts full at {@code burstCapacity} tokens and refills continuously at
 * {@code maxEventsPerSecond}. Each {@link SubscriberChannel} owns one and waits on it from its
 * delivery task, so producers calling {@link io.autotel.EventQueue#enqueue} are never throttled
 * and a slow subscriber does not use up another subscriber's tokens.
 *
 * <p>This class is thread-safe.
 */
public final class TokenBucketRateLimiter {
  private final double maxTokens;
  private final double tokensPerNano;
  private final LongSupplier nanoTime;

  private double tokens;
  private long lastRefillNanos;

  /**
   * @param maxEventsPerSecond sustained rate, &gt; 0
   * @param burstCapacity      bucket size; {@code 0} means twice the rate
   */
  public TokenBucketRateLimiter(int maxEventsPerSecond, int burstCapacity) {
    this(maxEventsPerSecond, burstCapacity, System::nanoTime);
  }

  TokenBucketRateLimiter(int maxEventsPerSecond, int burstCapacity, LongSupplier nanoTime) {
    if (maxEventsPerSecond <= 0) {
      throw new IllegalArgumentException("maxEventsPerSecond must be > 0");
    }
    if (burstCapacity < 0) {
      throw new IllegalArgumentException("burstCapacity must be >= 0");
    }
    this.maxTokens = burstCapacity == 0 ? maxEventsPerSecond * 2.0 : burstCapacity;
    this.tokensPerNano = maxEventsPerSecond / (double) TimeUnit.SECONDS.toNanos(1);
    this.nanoTime = nanoTime;
    this.tokens = maxTokens;
    this.lastRefillNanos = nanoTime.getAsLong();
  }

  /**
   * Takes {@code count} tokens if available.
   *
   * @param count tokens to take
   * @return {@code true} if the tokens were taken
   */
  public synchronized boolean tryAcquire(int count) {
    refill();
    if (tokens >= count) {
      tokens -= count;
      return true;
    }
    return false;
  }

  /**
   * Takes {@code count} tokens, sleeping until they are available. Requests larger than the
   * bucket are served in bucket-sized portions.
   *
   * @param count tokens to take
   * @throws InterruptedException if interrupted while waiting
   */
  public void acquire(int count) throws InterruptedException {
    int remaining = count;
    while (remaining > 0) {
      int portion = (int) Math.min(remaining, Math.max(1.0, Math.floor(maxTokens)));
      long waitNanos;
      synchronized (this) {
        refill();
        if (tokens >= portion) {
          tokens -= portion;
          remaining -= portion;
          continue;
        }
        waitNanos = (long) Math.ceil((portion - tokens) / tokensPerNano);
      }
      TimeUnit.NANOSECONDS.sleep(Math.max(waitNanos, TimeUnit.MILLISECONDS.toNanos(1)));
    }
  }

  synchronized double availableTokens() {
    refill();
    return tokens;
  }

  private void refill() {
    long now = nanoTime.getAsLong();
    long elapsed = now - lastRefillNanos;
    if (elapsed > 0) {
      tokens = Math.min(maxTokens, tokens + elapsed * tokensPerNano);
      lastRefillNanos = now;
    }
  }
}
