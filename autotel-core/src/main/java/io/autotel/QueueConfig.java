package io.autotel;

import io.autotel.dispatch.ExponentialBackoffRetryPolicy;
import io.autotel.dispatch.RetryPolicy;

/**
 * Immutable settings for an {@link EventQueue}. Create instances via {@link #builder()};
 * {@link #defaults()} returns the default configuration.
 *
 * @see QueueConfig.Builder
 */
public final class QueueConfig {
  private final int maxSize;
  private final int batchSize;
  private final long flushIntervalMs;
  private final int maxRetries;
  private final long deliveryTimeoutMs;
  private final long shutdownTimeoutMs;
  private final RetryPolicy retryPolicy;
  private final int failureThreshold;
  private final long resetTimeoutMs;
  private final long windowSizeMs;
  private final int maxEventsPerSecond;
  private final int burstCapacity;

  private QueueConfig(Builder builder) {
    if (builder.maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.flushIntervalMs <= 0L) {
      throw new IllegalArgumentException("flushIntervalMs must be > 0");
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (builder.deliveryTimeoutMs <= 0L) {
      throw new IllegalArgumentException("deliveryTimeoutMs must be > 0");
    }
    if (builder.shutdownTimeoutMs <= 0L) {
      throw new IllegalArgumentException("shutdownTimeoutMs must be > 0");
    }
    if (builder.failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    if (builder.resetTimeoutMs < 0L) {
      throw new IllegalArgumentException("resetTimeoutMs must be >= 0");
    }
    if (builder.windowSizeMs <= 0L) {
      throw new IllegalArgumentException("windowSizeMs must be > 0");
    }
    if (builder.maxEventsPerSecond < 0 || builder.burstCapacity < 0) {
      throw new IllegalArgumentException("rate limit values must be >= 0");
    }
    this.maxSize = builder.maxSize;
    this.batchSize = builder.batchSize;
    this.flushIntervalMs = builder.flushIntervalMs;
    this.maxRetries = builder.maxRetries;
    this.deliveryTimeoutMs = builder.deliveryTimeoutMs;
    this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1000, 4000);
    this.failureThreshold = builder.failureThreshold;
    this.resetTimeoutMs = builder.resetTimeoutMs;
    this.windowSizeMs = builder.windowSizeMs;
    this.maxEventsPerSecond = builder.maxEventsPerSecond;
    this.burstCapacity = builder.burstCapacity;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static QueueConfig defaults() {
    return builder().build();
  }

  public int maxSize() {
    return maxSize;
  }

  public int batchSize() {
    return batchSize;
  }

  public long flushIntervalMs() {
    return flushIntervalMs;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public long deliveryTimeoutMs() {
    return deliveryTimeoutMs;
  }

  public long shutdownTimeoutMs() {
    return shutdownTimeoutMs;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public int failureThreshold() {
    return failureThreshold;
  }

  public long resetTimeoutMs() {
    return resetTimeoutMs;
  }

  public long windowSizeMs() {
    return windowSizeMs;
  }

  /**
   * Returns the sustained delivery rate, or {@code 0} when rate limiting is disabled.
   *
   * @return events per second
   */
  public int maxEventsPerSecond() {
    return maxEventsPerSecond;
  }

  public int burstCapacity() {
    return burstCapacity;
  }

  public boolean rateLimited() {
    return maxEventsPerSecond > 0;
  }

  @Override
  public String toString() {
    return "QueueConfig{maxSize=" + maxSize
        + ", batchSize=" + batchSize
        + ", flushIntervalMs=" + flushIntervalMs
        + ", maxRetries=" + maxRetries
        + ", deliveryTimeoutMs=" + deliveryTimeoutMs
        + ", failureThreshold=" + failureThreshold
        + ", resetTimeoutMs=" + resetTimeoutMs
        + ", windowSizeMs=" + windowSizeMs
        + ", maxEventsPerSecond=" + maxEventsPerSecond + '}';
  }

  /** Builder for {@link QueueConfig}. */
  public static final class Builder {
    private int maxSize = 1000;
    private int batchSize = 50;
    private long flushIntervalMs = 5000L;
    private int maxRetries = 3;
    private long deliveryTimeoutMs = 30_000L;
    private long shutdownTimeoutMs = 30_000L;
    private RetryPolicy retryPolicy;
    private int failureThreshold = 5;
    private long resetTimeoutMs = 30_000L;
    private long windowSizeMs = 60_000L;
    private int maxEventsPerSecond;
    private int burstCapacity;

    private Builder() {}

    /**
     * Sets the buffer capacity. When full, the oldest record is evicted.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param maxSize maximum buffered records
     * @return this builder
     */
    public Builder maxSize(int maxSize) {
      this.maxSize = maxSize;
      return this;
    }

    /**
     * Sets the number of buffered records that triggers an immediate flush; also the chunk
     * size in which a flush hands records to subscribers.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
     *
     * @param batchSize records per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the period of the recurring flush timer.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
     *
     * @param flushIntervalMs flush period in milliseconds
     * @return this builder
     */
    public Builder flushIntervalMs(long flushIntervalMs) {
      this.flushIntervalMs = flushIntervalMs;
      return this;
    }

    /**
     * Sets the number of retry rounds after the first attempt, per event and subscriber.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     *
     * @param maxRetries additional attempts
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets how long a single subscriber call may take before it counts as failed.
     *
     * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
     *
     * @param deliveryTimeoutMs per-call timeout in milliseconds
     * @return this builder
     */
    public Builder deliveryTimeoutMs(long deliveryTimeoutMs) {
      this.deliveryTimeoutMs = deliveryTimeoutMs;
      return this;
    }

    /**
     * Sets the maximum time {@link EventQueue#shutdown()} waits for the final drain.
     *
     * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
     *
     * @param shutdownTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder shutdownTimeoutMs(long shutdownTimeoutMs) {
      this.shutdownTimeoutMs = shutdownTimeoutMs;
      return this;
    }

    /**
     * Sets the pause between retry rounds.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=1000} and {@code maxDelayMs=4000}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Configures the circuit breaker created for each subscriber.
     *
     * <p>Optional. Defaults to {@code 5} failures within {@code 60000} ms opening the circuit
     * for {@code 30000} ms.
     *
     * @param failureThreshold failures within the window that open the circuit
     * @param resetTimeoutMs   open duration before a trial call
     * @param windowSizeMs     failure counting window
     * @return this builder
     */
    public Builder circuitBreaker(int failureThreshold, long resetTimeoutMs, long windowSizeMs) {
      this.failureThreshold = failureThreshold;
      this.resetTimeoutMs = resetTimeoutMs;
      this.windowSizeMs = windowSizeMs;
      return this;
    }

    /**
     * Enables delivery rate limiting.
     *
     * <p>Optional. Disabled by default.
     *
     * @param maxEventsPerSecond sustained rate; {@code 0} disables limiting
     * @param burstCapacity      burst size; {@code 0} means twice the rate
     * @return this builder
     */
    public Builder rateLimit(int maxEventsPerSecond, int burstCapacity) {
      this.maxEventsPerSecond = maxEventsPerSecond;
      this.burstCapacity = burstCapacity;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new {@link QueueConfig}
     * @throws IllegalArgumentException if any value is out of range
     */
    public QueueConfig build() {
      return new QueueConfig(this);
    }
  }
}
