package io.autotel.dispatch;

import io.autotel.EventRecord;
import io.autotel.EventSubscriber;
import io.autotel.breaker.CircuitBreaker;
import io.autotel.breaker.CircuitOpenException;
import io.autotel.health.SubscriberHealthRegistry;
import io.autotel.metrics.MetricsEmitter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivery path to one subscriber: its identity, circuit breaker and retry loop.
 *
 * <p>{@link #deliver} sends every event of a batch through the breaker, then retries only the
 * events that failed, for up to {@code maxRetries} further rounds. Every event ends the call
 * either delivered or failed, and is counted exactly once as such. An open circuit skips the
 * remaining events without calling the subscriber and without consuming retry rounds.
 *
 * <p>{@link #deliverAll} walks a whole flush snapshot chunk by chunk, waiting on this channel's
 * own rate limiter (if any) before each chunk, so channels of one queue never wait on each
 * other. One flush runs at most one delivery per channel at a time.
 */
public final class SubscriberChannel {
  private static final Logger logger = Logger.getLogger(SubscriberChannel.class.getName());

  private final String identity;
  private final EventSubscriber subscriber;
  private final CircuitBreaker breaker;
  private final SubscriberHealthRegistry health;
  private final MetricsEmitter metrics;
  private final int maxRetries;
  private final long deliveryTimeoutMs;
  private final RetryPolicy retryPolicy;
  private final TokenBucketRateLimiter rateLimiter;
  private final Clock clock;

  public SubscriberChannel(String identity, EventSubscriber subscriber, CircuitBreaker breaker,
      SubscriberHealthRegistry health, MetricsEmitter metrics, int maxRetries,
      long deliveryTimeoutMs, RetryPolicy retryPolicy, TokenBucketRateLimiter rateLimiter, Clock clock) {
    this.identity = Objects.requireNonNull(identity, "identity");
    this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
    this.breaker = Objects.requireNonNull(breaker, "breaker");
    this.health = Objects.requireNonNull(health, "health");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.rateLimiter = rateLimiter;
    this.maxRetries = maxRetries;
    this.deliveryTimeoutMs = deliveryTimeoutMs;
  }

  public String identity() {
    return identity;
  }

  public EventSubscriber subscriber() {
    return subscriber;
  }

  public CircuitBreaker breaker() {
    return breaker;
  }

  /**
   * Delivers {@code events} in chunks of {@code batchSize}, each chunk with per-event retry.
   * Never throws.
   *
   * @param events    flush snapshot, in order
   * @param batchSize events per chunk
   * @return totals over all chunks
   */
  public DeliveryReport deliverAll(List<EventRecord> events, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int delivered = 0;
    int failed = 0;
    for (int from = 0; from < events.size(); from += batchSize) {
      List<EventRecord> chunk = events.subList(from, Math.min(events.size(), from + batchSize));
      throttle(chunk.size());
      DeliveryReport report = deliver(chunk);
      delivered += report.delivered();
      failed += report.failed();
    }
    return new DeliveryReport(identity, delivered, failed);
  }

  private void throttle(int events) {
    if (rateLimiter == null) {
      return;
    }
    try {
      rateLimiter.acquire(events);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while rate limiting " + identity
          + "; delivering " + events + " events unthrottled");
    }
  }

  /**
   * Delivers a batch with per-event retry. Never throws.
   *
   * @param batch events to deliver, in order
   * @return how many events were delivered and how many failed
   */
  public DeliveryReport deliver(List<EventRecord> batch) {
    List<EventRecord> pending = batch;
    int delivered = 0;
    int attempts = 0;
    Throwable lastError = null;
    boolean aborted = false;

    for (int round = 0; round <= maxRetries && !pending.isEmpty() && !aborted; round++) {
      if (round > 0 && !pause(round)) {
        break;
      }
      attempts++;
      List<EventRecord> failed = new ArrayList<>();
      for (int i = 0; i < pending.size(); i++) {
        EventRecord event = pending.get(i);
        try {
          breaker.execute(() -> send(event));
          onDelivered(event);
          delivered++;
        } catch (CircuitOpenException e) {
          failed.addAll(pending.subList(i, pending.size()));
          lastError = e;
          aborted = true;
          break;
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          failed.addAll(pending.subList(i, pending.size()));
          lastError = e;
          aborted = true;
          break;
        } catch (Exception e) {
          failed.add(event);
          lastError = e;
        }
      }
      pending = failed;
    }

    if (!pending.isEmpty()) {
      for (int i = 0; i < pending.size(); i++) {
        metrics.recordFailed(identity);
      }
      health.markUnhealthy(identity);
      if (lastError instanceof CircuitOpenException) {
        logger.log(Level.WARNING, "Subscriber " + identity + " skipped " + pending.size() + " of "
            + batch.size() + " events: " + lastError.getMessage());
      } else {
        logger.log(Level.WARNING, "Subscriber " + identity + " failed to deliver " + pending.size()
            + " of " + batch.size() + " events after " + attempts + " attempt(s)", lastError);
      }
    }
    return new DeliveryReport(identity, delivered, pending.size());
  }

  private Void send(EventRecord event) throws Exception {
    CompletionStage<Void> stage = subscriber.trackEvent(event.name(), event.deliveryAttributes());
    if (stage == null) {
      return null;
    }
    CompletableFuture<Void> future = stage.toCompletableFuture();
    try {
      future.get(deliveryTimeoutMs, TimeUnit.MILLISECONDS);
      return null;
    } catch (ExecutionException e) {
      throw unwrap(e.getCause(), e);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TimeoutException("trackEvent(" + event.name() + ") on " + identity
          + " did not complete within " + deliveryTimeoutMs + " ms");
    }
  }

  private static Exception unwrap(Throwable cause, Exception fallback) {
    Throwable current = cause;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    if (current instanceof Exception) {
      return (Exception) current;
    }
    return fallback;
  }

  private void onDelivered(EventRecord event) {
    metrics.recordDelivered(identity);
    // end-to-end: includes buffering and retry backoff, not just the subscriber call
    metrics.recordLatency(identity, Duration.between(event.timestamp(), clock.instant()).toMillis());
    health.markHealthy(identity);
  }

  private boolean pause(int round) {
    long delayMs = retryPolicy.computeDelayMs(round);
    if (delayMs <= 0) {
      return true;
    }
    try {
      TimeUnit.MILLISECONDS.sleep(delayMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Outcome of one {@link #deliver} call.
   *
   * @param identity  subscriber identity
   * @param delivered events delivered (first attempt or after retries)
   * @param failed    events that exhausted retries or were skipped by an open circuit
   */
  public record DeliveryReport(String identity, int delivered, int failed) {
  }
}
