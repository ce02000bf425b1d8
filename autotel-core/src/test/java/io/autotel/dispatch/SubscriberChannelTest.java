package io.autotel.dispatch;

import io.autotel.EventRecord;
import io.autotel.EventSubscriber;
import io.autotel.MutableClock;
import io.autotel.RecordingMeter;
import io.autotel.StubSubscriber;
import io.autotel.breaker.CircuitBreaker;
import io.autotel.dispatch.SubscriberChannel.DeliveryReport;
import io.autotel.health.SubscriberHealthRegistry;
import io.autotel.metrics.MetricsEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubscriberChannelTest {

    private static final String FAILED = "autotel.event_delivery.queue.failed";
    private static final String DELIVERED = "autotel.event_delivery.queue.delivered";

    private MutableClock clock;
    private RecordingMeter meter;
    private SubscriberHealthRegistry health;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        meter = new RecordingMeter();
        health = new SubscriberHealthRegistry();
        health.register("hook");
        breaker = CircuitBreaker.builder("hook").failureThreshold(10).clock(clock).build();
    }

    private SubscriberChannel channel(StubSubscriber subscriber, int maxRetries, RetryPolicy retryPolicy) {
        return new SubscriberChannel("hook", subscriber, breaker, health, new MetricsEmitter(meter),
                maxRetries, 1_000, retryPolicy, null, clock);
    }

    private static List<EventRecord> batch(String... names) {
        return Arrays.stream(names).map(EventRecord::of).toList();
    }

    @Test
    void deliversWholeBatchOnFirstAttempt() {
        StubSubscriber hook = new StubSubscriber("hook");

        DeliveryReport report = channel(hook, 3, RetryPolicy.IMMEDIATE).deliver(batch("a", "b"));

        assertEquals(new DeliveryReport("hook", 2, 0), report);
        assertEquals(List.of("a", "b"), hook.attempts());
        assertEquals(2.0, meter.sum(DELIVERED, "subscriber", "hook"));
        assertTrue(health.isHealthy("hook"));
    }

    @Test
    void failedEventsAreCountedOncePerEvent() {
        StubSubscriber hook = new StubSubscriber("hook").failAlways();

        DeliveryReport report = channel(hook, 2, RetryPolicy.IMMEDIATE).deliver(batch("a", "b"));

        assertEquals(new DeliveryReport("hook", 0, 2), report);
        assertEquals(6, hook.calls());
        assertEquals(2.0, meter.sum(FAILED, "subscriber", "hook"));
        assertFalse(health.isHealthy("hook"));
    }

    @Test
    void retryPolicyIsConsultedForEachRetryRound() {
        StubSubscriber hook = new StubSubscriber("hook").failTimes("a", 2);
        List<Integer> rounds = new CopyOnWriteArrayList<>();
        RetryPolicy recording = round -> {
            rounds.add(round);
            return 0L;
        };

        DeliveryReport report = channel(hook, 3, recording).deliver(batch("a"));

        assertEquals(1, report.delivered());
        assertEquals(List.of(1, 2), rounds);
    }

    @Test
    void openCircuitSkipsBatchWithoutCallingSubscriber() {
        StubSubscriber hook = new StubSubscriber("hook");
        breaker.forceOpen();

        DeliveryReport report = channel(hook, 3, RetryPolicy.IMMEDIATE).deliver(batch("a", "b", "c"));

        assertEquals(new DeliveryReport("hook", 0, 3), report);
        assertEquals(0, hook.calls());
        assertEquals(3.0, meter.sum(FAILED, "subscriber", "hook"));
        assertFalse(health.isHealthy("hook"));
    }

    @Test
    void nullStageCountsAsAccepted() {
        SubscriberChannel channel = new SubscriberChannel("hook", new NullStageSubscriber(), breaker, health,
                new MetricsEmitter(meter), 0, 1_000, RetryPolicy.IMMEDIATE, null, clock);

        DeliveryReport report = channel.deliver(batch("a"));

        assertEquals(1, report.delivered());
        assertTrue(health.isHealthy("hook"));
    }

    @Test
    void deliverAllWalksChunksInOrderAndSumsOutcomes() {
        StubSubscriber hook = new StubSubscriber("hook").failTimes("b", 1).failTimes("d", 5);

        DeliveryReport report = channel(hook, 1, RetryPolicy.IMMEDIATE).deliverAll(batch("a", "b", "c", "d", "e"), 2);

        assertEquals(new DeliveryReport("hook", 4, 1), report);
        // b is retried inside its own chunk before the next chunk starts
        assertEquals(List.of("a", "b", "b", "c", "d", "d", "e"), hook.attempts());
        assertEquals(1.0, meter.sum(FAILED, "subscriber", "hook"));
    }

    @Test
    void deliverAllTakesTokensPerChunk() {
        StubSubscriber hook = new StubSubscriber("hook");
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1, 10, () -> 0L);
        SubscriberChannel channel = new SubscriberChannel("hook", hook, breaker, health,
                new MetricsEmitter(meter), 0, 1_000, RetryPolicy.IMMEDIATE, limiter, clock);

        channel.deliverAll(batch("a", "b", "c", "d"), 3);

        assertEquals(4, hook.calls());
        assertEquals(6.0, limiter.availableTokens());
    }

    @Test
    void successRestoresHealth() {
        health.markUnhealthy("hook");

        channel(new StubSubscriber("hook"), 0, RetryPolicy.IMMEDIATE).deliver(batch("a"));

        assertTrue(health.isHealthy("hook"));
    }

    private static final class NullStageSubscriber implements EventSubscriber {
        @Override
        public CompletionStage<Void> trackEvent(String name, Map<String, Object> attributes) {
            return null;
        }

        @Override
        public CompletionStage<Void> trackFunnelStep(String funnelName, FunnelStatus step,
                Map<String, Object> attributes) {
            return null;
        }

        @Override
        public CompletionStage<Void> trackOutcome(String operationName, OutcomeStatus outcome,
                Map<String, Object> attributes) {
            return null;
        }

        @Override
        public CompletionStage<Void> trackValue(String name, double value, Map<String, Object> attributes) {
            return null;
        }
    }
}
