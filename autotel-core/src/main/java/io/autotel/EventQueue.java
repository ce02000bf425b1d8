package io.autotel;

import io.autotel.breaker.CircuitBreaker;
import io.autotel.dispatch.SubscriberChannel;
import io.autotel.dispatch.SubscriberChannel.DeliveryReport;
import io.autotel.dispatch.TokenBucketRateLimiter;
import io.autotel.health.SubscriberHealthRegistry;
import io.autotel.metrics.MetricsEmitter;
import io.autotel.spi.EventDropListener;
import io.autotel.spi.EventDropListener.DropReason;
import io.autotel.spi.Meter;
import io.autotel.util.DaemonThreadFactory;
import io.autotel.util.SubscriberIdentities;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, batching in-memory queue that forwards {@link EventRecord}s to every configured
 * {@link EventSubscriber}.
 *
 * <p>{@link #enqueue} appends to a buffer capped at {@code maxSize}; when full, the oldest
 * record is evicted. A flush runs when the buffer reaches {@code batchSize}, every
 * {@code flushIntervalMs}, or on an explicit {@link #flush()}. A flush takes the whole buffer
 * as a snapshot and hands all of it to each subscriber's {@link SubscriberChannel} concurrently;
 * every channel walks the snapshot in chunks of {@code batchSize} at its own pace, so a slow or
 * failing subscriber never holds back another one. Each subscriber has its own circuit breaker and
 * retries only the events it failed to accept; outcomes update the subscriber's health flag
 * and the delivered/failed/latency metrics.
 *
 * <p>Flushes run one at a time on a dedicated thread. A flush requested while another one is
 * waiting to start joins the waiting one.
 *
 * <p>Create instances via the constructors or {@link #builder()}. This class is thread-safe
 * and implements {@link AutoCloseable}; {@link #close()} drains the buffer before returning.
 *
 * @see EventQueue.Builder
 * @see QueueConfig
 */
public final class EventQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventQueue.class.getName());

  private final QueueConfig config;
  private final List<SubscriberChannel> channels;
  private final SubscriberHealthRegistry health = new SubscriberHealthRegistry();
  private final MetricsEmitter metrics;
  private final EventDropListener dropListener;

  private final ReentrantLock bufferLock = new ReentrantLock();
  private final ArrayDeque<EventRecord> buffer = new ArrayDeque<>();
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CompletableFuture<Void> terminated = new CompletableFuture<>();

  private final Object flushLock = new Object();
  private CompletableFuture<Void> pendingFlush;

  private final ScheduledExecutorService timer;
  private final ScheduledFuture<?> flushTask;
  private final ExecutorService flushExecutor;
  private final ExecutorService deliveryExecutor;

  /**
   * Creates a queue with the default {@link QueueConfig} and no metrics.
   *
   * @param subscribers destinations for every event
   */
  public EventQueue(List<? extends EventSubscriber> subscribers) {
    this(builder().subscribers(subscribers));
  }

  /**
   * Creates a queue with the given configuration and no metrics.
   *
   * @param subscribers destinations for every event
   * @param config      queue settings
   */
  public EventQueue(List<? extends EventSubscriber> subscribers, QueueConfig config) {
    this(builder().subscribers(subscribers).config(config));
  }

  private EventQueue(Builder builder) {
    this.config = builder.config != null ? builder.config : QueueConfig.defaults();
    Meter meter = builder.meter != null ? builder.meter : Meter.NOOP;
    this.metrics = builder.metricsPrefix != null
        ? new MetricsEmitter(meter, builder.metricsPrefix) : new MetricsEmitter(meter);
    this.dropListener = builder.dropListener != null ? builder.dropListener : EventDropListener.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    List<EventSubscriber> subscribers = new ArrayList<>(builder.subscribers);
    for (EventSubscriber subscriber : subscribers) {
      Objects.requireNonNull(subscriber, "subscriber");
    }
    List<String> identities = SubscriberIdentities.assign(subscribers);
    List<SubscriberChannel> channels = new ArrayList<>(subscribers.size());
    for (int i = 0; i < subscribers.size(); i++) {
      String identity = identities.get(i);
      CircuitBreaker breaker = CircuitBreaker.builder(identity)
          .failureThreshold(config.failureThreshold())
          .resetTimeoutMs(config.resetTimeoutMs())
          .windowSizeMs(config.windowSizeMs())
          .clock(clock)
          .build();
      TokenBucketRateLimiter rateLimiter = config.rateLimited()
          ? new TokenBucketRateLimiter(config.maxEventsPerSecond(), config.burstCapacity()) : null;
      health.register(identity);
      channels.add(new SubscriberChannel(identity, subscribers.get(i), breaker, health, metrics,
          config.maxRetries(), config.deliveryTimeoutMs(), config.retryPolicy(), rateLimiter, clock));
    }
    this.channels = Collections.unmodifiableList(channels);
    if (channels.isEmpty()) {
      logger.warning("EventQueue created without subscribers; flushed events will be discarded");
    }

    this.flushExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("autotel-queue-flush-"));
    this.deliveryExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("autotel-queue-delivery-"));
    this.timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("autotel-queue-timer-"));
    long intervalMs = config.flushIntervalMs();
    this.flushTask = timer.scheduleWithFixedDelay(this::onTimer, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Buffers a record for delivery. Never blocks on I/O and never throws for a non-null record.
   *
   * <p>Rejected (logged, reported to the drop listener) once shutdown has begun. If the buffer
   * is full the oldest record is evicted first. Reaching {@code batchSize} starts an
   * asynchronous flush.
   *
   * @param record the record to deliver
   * @return {@code true} if the record was buffered
   */
  public boolean enqueue(EventRecord record) {
    Objects.requireNonNull(record, "record");
    EventRecord evicted = null;
    int size;
    bufferLock.lock();
    try {
      if (shuttingDown.get()) {
        size = -1;
      } else {
        if (buffer.size() >= config.maxSize()) {
          evicted = buffer.pollFirst();
        }
        buffer.addLast(record);
        size = buffer.size();
      }
    } finally {
      bufferLock.unlock();
    }

    if (size < 0) {
      logger.log(Level.FINE, "Queue is shutting down; rejected event {0}", record.name());
      drop(record, DropReason.SHUTDOWN);
      return false;
    }
    if (evicted != null) {
      logger.log(Level.WARNING, "Event queue full (" + config.maxSize() + " events); dropped oldest event "
          + evicted.name() + ". Events are produced faster than subscribers accept them.");
      drop(evicted, DropReason.BACKPRESSURE);
    }
    if (size >= config.batchSize()) {
      flush();
    }
    return true;
  }

  /**
   * Returns the number of buffered records.
   *
   * @return current buffer length
   */
  public int size() {
    bufferLock.lock();
    try {
      return buffer.size();
    } finally {
      bufferLock.unlock();
    }
  }

  /**
   * Delivers everything buffered at the moment the flush starts. Records enqueued while it
   * runs wait for the next flush.
   *
   * <p>The returned future always completes normally; delivery failures are counted, logged
   * and reflected in subscriber health, never propagated.
   *
   * @return future completing when the flush has finished
   */
  public CompletableFuture<Void> flush() {
    synchronized (flushLock) {
      if (pendingFlush != null) {
        return pendingFlush;
      }
      CompletableFuture<Void> flush = new CompletableFuture<>();
      try {
        flushExecutor.execute(() -> runFlush(flush));
      } catch (RejectedExecutionException e) {
        logger.log(Level.FINE, "Flush requested after the queue was shut down");
        flush.complete(null);
        return flush;
      }
      pendingFlush = flush;
      return flush;
    }
  }

  private void onTimer() {
    if (size() > 0) {
      flush();
    }
  }

  private void runFlush(CompletableFuture<Void> flush) {
    synchronized (flushLock) {
      if (pendingFlush == flush) {
        pendingFlush = null;
      }
    }
    try {
      drain();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Event queue flush failed", t);
    } finally {
      flush.complete(null);
    }
  }

  private void drain() {
    List<EventRecord> snapshot;
    bufferLock.lock();
    try {
      if (buffer.isEmpty()) {
        return;
      }
      snapshot = new ArrayList<>(buffer);
      buffer.clear();
    } finally {
      bufferLock.unlock();
    }

    dispatch(snapshot);
  }

  private void dispatch(List<EventRecord> snapshot) {
    int batchSize = config.batchSize();
    List<CompletableFuture<DeliveryReport>> deliveries = new ArrayList<>(channels.size());
    for (SubscriberChannel channel : channels) {
      deliveries.add(CompletableFuture.supplyAsync(() -> channel.deliverAll(snapshot, batchSize), deliveryExecutor)
          .exceptionally(error -> {
            logger.log(Level.SEVERE, "Unexpected error delivering " + snapshot.size()
                + " events to subscriber " + channel.identity(), error);
            return new DeliveryReport(channel.identity(), 0, snapshot.size());
          }));
    }
    CompletableFuture.allOf(deliveries.toArray(new CompletableFuture<?>[0])).join();

    if (logger.isLoggable(Level.FINE)) {
      for (CompletableFuture<DeliveryReport> delivery : deliveries) {
        DeliveryReport report = delivery.join();
        logger.log(Level.FINE, "Subscriber {0}: delivered={1}, failed={2}",
            new Object[]{report.identity(), report.delivered(), report.failed()});
      }
    }
  }

  private void drop(EventRecord record, DropReason reason) {
    metrics.recordDropped(reason);
    try {
      dropListener.onDrop(record, reason);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "EventDropListener failed for event " + record.name(), e);
    }
  }

  /**
   * Stops accepting records, cancels the flush timer, delivers everything still buffered,
   * shuts down each subscriber and releases the queue's threads. Blocks until done or until
   * {@code shutdownTimeoutMs} has elapsed for the final flush. Idempotent; concurrent callers
   * wait for the first one to finish.
   */
  public void shutdown() {
    boolean first;
    bufferLock.lock();
    try {
      first = shuttingDown.compareAndSet(false, true);
    } finally {
      bufferLock.unlock();
    }
    if (!first) {
      terminated.join();
      return;
    }

    try {
      flushTask.cancel(false);
      timer.shutdownNow();
      awaitFinalFlush(flush());
      shutdownSubscribers();
      stopExecutor(flushExecutor);
      stopExecutor(deliveryExecutor);
    } finally {
      terminated.complete(null);
    }
  }

  private void awaitFinalFlush(CompletableFuture<Void> drain) {
    try {
      drain.get(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.log(Level.WARNING, "Final flush did not finish within " + config.shutdownTimeoutMs()
          + " ms; " + size() + " events still buffered");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while waiting for the final flush");
    } catch (ExecutionException e) {
      logger.log(Level.SEVERE, "Final flush failed", e.getCause());
    }
  }

  private void shutdownSubscribers() {
    for (SubscriberChannel channel : channels) {
      try {
        CompletionStage<Void> stage = channel.subscriber().shutdown();
        if (stage != null) {
          stage.toCompletableFuture().get(config.deliveryTimeoutMs(), TimeUnit.MILLISECONDS);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.log(Level.WARNING, "Interrupted while shutting down subscriber " + channel.identity());
        return;
      } catch (ExecutionException e) {
        logger.log(Level.WARNING, "Subscriber " + channel.identity() + " failed to shut down", e.getCause());
      } catch (Exception e) {
        logger.log(Level.WARNING, "Subscriber " + channel.identity() + " failed to shut down", e);
      }
    }
  }

  private void stopExecutor(ExecutorService executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Same as {@link #shutdown()}. */
  @Override
  public void close() {
    shutdown();
  }

  public boolean isShuttingDown() {
    return shuttingDown.get();
  }

  /**
   * Returns whether the subscriber is currently considered healthy. Unknown identities are
   * healthy.
   *
   * @param identity subscriber identity or name (case-insensitive)
   * @return the health flag
   */
  public boolean isSubscriberHealthy(String identity) {
    return health.isHealthy(SubscriberIdentities.normalize(identity));
  }

  /**
   * Returns the health flag of every subscriber, in configuration order.
   *
   * @return unmodifiable identity-to-health snapshot
   */
  public Map<String, Boolean> getSubscriberHealth() {
    return health.snapshot();
  }

  /**
   * Overrides a subscriber's health flag until its next delivery outcome.
   *
   * @param identity subscriber identity or name (case-insensitive)
   * @param healthy  the new flag
   */
  public void setSubscriberHealth(String identity, boolean healthy) {
    String normalized = SubscriberIdentities.normalize(identity);
    if (normalized == null) {
      throw new IllegalArgumentException("identity must not be blank");
    }
    health.set(normalized, healthy);
  }

  /**
   * Returns the circuit breaker guarding a subscriber.
   *
   * @param identity subscriber identity or name (case-insensitive)
   * @return the breaker, or empty if no subscriber has that identity
   */
  public Optional<CircuitBreaker> circuitBreaker(String identity) {
    String normalized = SubscriberIdentities.normalize(identity);
    for (SubscriberChannel channel : channels) {
      if (channel.identity().equals(normalized)) {
        return Optional.of(channel.breaker());
      }
    }
    return Optional.empty();
  }

  /**
   * Returns subscriber identities in configuration order.
   *
   * @return identities
   */
  public List<String> subscriberIdentities() {
    List<String> identities = new ArrayList<>(channels.size());
    for (SubscriberChannel channel : channels) {
      identities.add(channel.identity());
    }
    return Collections.unmodifiableList(identities);
  }

  public QueueConfig config() {
    return config;
  }

  /** Builder for {@link EventQueue}. */
  public static final class Builder {
    private final List<EventSubscriber> subscribers = new ArrayList<>();
    private QueueConfig config;
    private Meter meter;
    private String metricsPrefix;
    private EventDropListener dropListener;
    private Clock clock;

    private Builder() {}

    /**
     * Appends a subscriber.
     *
     * @param subscriber the subscriber
     * @return this builder
     */
    public Builder subscriber(EventSubscriber subscriber) {
      this.subscribers.add(Objects.requireNonNull(subscriber, "subscriber"));
      return this;
    }

    /**
     * Appends subscribers, in order.
     *
     * @param subscribers the subscribers
     * @return this builder
     */
    public Builder subscribers(List<? extends EventSubscriber> subscribers) {
      Objects.requireNonNull(subscribers, "subscribers");
      for (EventSubscriber subscriber : subscribers) {
        subscriber(subscriber);
      }
      return this;
    }

    /**
     * Sets the queue settings.
     *
     * <p>Optional. Defaults to {@link QueueConfig#defaults()}.
     *
     * @param config the configuration
     * @return this builder
     */
    public Builder config(QueueConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the metrics backend for delivered/failed/dropped counters and the latency histogram.
     *
     * <p>Optional. Defaults to {@link Meter#NOOP}.
     *
     * @param meter the meter
     * @return this builder
     */
    public Builder meter(Meter meter) {
      this.meter = meter;
      return this;
    }

    /**
     * Sets the metric name prefix.
     *
     * <p>Optional. Defaults to {@value MetricsEmitter#DEFAULT_PREFIX}.
     *
     * @param metricsPrefix prefix without a trailing dot
     * @return this builder
     */
    public Builder metricsPrefix(String metricsPrefix) {
      this.metricsPrefix = metricsPrefix;
      return this;
    }

    /**
     * Sets the callback notified of records dropped by backpressure or shutdown.
     *
     * <p>Optional. Defaults to {@link EventDropListener#NOOP}.
     *
     * @param dropListener the listener
     * @return this builder
     */
    public Builder dropListener(EventDropListener dropListener) {
      this.dropListener = dropListener;
      return this;
    }

    /**
     * Sets the clock for circuit breaker timing and delivery latency.
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
     * Builds the queue and starts its flush timer.
     *
     * @return a new {@link EventQueue}
     * @throws NullPointerException if a subscriber is null
     */
    public EventQueue build() {
      return new EventQueue(this);
    }
  }
}
