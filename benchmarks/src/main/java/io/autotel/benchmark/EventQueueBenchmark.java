package io.autotel.benchmark;

import io.autotel.EventQueue;
import io.autotel.EventRecord;
import io.autotel.EventSubscriber;
import io.autotel.QueueConfig;
import io.autotel.dispatch.RetryPolicy;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Measures producer-side enqueue cost and the cost of a full flush across subscribers.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar EventQueueBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
@Threads(1)
public class EventQueueBenchmark {

    @Param({"1", "4"})
    private int subscriberCount;

    @Param({"50", "500"})
    private int eventsPerFlush;

    private EventQueue queue;
    private final LongAdder received = new LongAdder();
    private EventRecord record;

    @Setup(Level.Trial)
    public void setup() {
        List<EventSubscriber> subscribers = new ArrayList<>();
        for (int i = 0; i < subscriberCount; i++) {
            subscribers.add(new CountingSubscriber("bench-" + i, received));
        }
        queue = EventQueue.builder()
                .subscribers(subscribers)
                .config(QueueConfig.builder()
                        .maxSize(100_000)
                        .batchSize(100_000)
                        .flushIntervalMs(TimeUnit.HOURS.toMillis(1))
                        .retryPolicy(RetryPolicy.IMMEDIATE)
                        .build())
                .build();
        record = EventRecord.of("bench.event", Map.of("plan", "pro", "amount", 42));
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        queue.shutdown();
    }

    @Benchmark
    public void enqueue(Blackhole bh) {
        bh.consume(queue.enqueue(record));
        if (queue.size() >= 50_000) {
            queue.flush().join();
        }
    }

    @Benchmark
    public void enqueueAndFlush() {
        for (int i = 0; i < eventsPerFlush; i++) {
            queue.enqueue(record);
        }
        queue.flush().join();
    }

    private static final class CountingSubscriber implements EventSubscriber {
        private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

        private final String name;
        private final LongAdder received;

        CountingSubscriber(String name, LongAdder received) {
            this.name = name;
            this.received = received;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public CompletionStage<Void> trackEvent(String eventName, Map<String, Object> attributes) {
            received.increment();
            return DONE;
        }

        @Override
        public CompletionStage<Void> trackFunnelStep(String funnelName, FunnelStatus step, Map<String, Object> attributes) {
            return DONE;
        }

        @Override
        public CompletionStage<Void> trackOutcome(String operationName, OutcomeStatus outcome, Map<String, Object> attributes) {
            return DONE;
        }

        @Override
        public CompletionStage<Void> trackValue(String valueName, double value, Map<String, Object> attributes) {
            return DONE;
        }
    }
}
