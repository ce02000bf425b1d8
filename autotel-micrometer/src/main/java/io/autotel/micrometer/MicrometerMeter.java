package io.autotel.micrometer;

import io.autotel.spi.Meter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link Meter}.
 *
 * <p>Each counter maps to a Micrometer {@link Counter} and each histogram to a
 * {@link DistributionSummary}, registered lazily per distinct tag set (one meter per
 * subscriber or drop reason). Pass it to {@link io.autotel.EventQueue.Builder#meter}:
 *
 * <pre>{@code
 * MicrometerMeter meter = new MicrometerMeter(registry);
 * EventQueue queue = EventQueue.builder()
 *     .subscribers(subscribers)
 *     .meter(meter)
 *     .build();
 * }</pre>
 *
 * <p>Histograms whose name ends in {@code _ms} get the base unit {@code milliseconds}.
 *
 * @see Meter
 */
public final class MicrometerMeter implements Meter, AutoCloseable {

    private final MeterRegistry registry;
    private final Set<io.micrometer.core.instrument.Meter> registered = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    /**
     * @param registry the Micrometer meter registry
     */
    public MicrometerMeter(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public Meter.Counter createCounter(String name) {
        Objects.requireNonNull(name, "name");
        return (amount, tags) -> {
            if (closed || amount <= 0) return;
            io.micrometer.core.instrument.Counter counter = io.micrometer.core.instrument.Counter.builder(name)
                    .description("Event delivery counter")
                    .tags(toTags(tags))
                    .register(registry);
            registered.add(counter);
            counter.increment(amount);
        };
    }

    @Override
    public Meter.Histogram createHistogram(String name) {
        Objects.requireNonNull(name, "name");
        String baseUnit = name.endsWith("_ms") ? "milliseconds" : null;
        return (value, tags) -> {
            if (closed) return;
            DistributionSummary summary = DistributionSummary.builder(name)
                    .description("Event delivery distribution")
                    .baseUnit(baseUnit)
                    .tags(toTags(tags))
                    .register(registry);
            registered.add(summary);
            summary.record(value);
        };
    }

    private static Tags toTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Tags.empty();
        }
        List<Tag> list = new ArrayList<>(tags.size());
        tags.forEach((key, value) -> list.add(Tag.of(key, value)));
        return Tags.of(list);
    }

    /**
     * Removes all meters registered through this instance from the registry.
     *
     * <p>Call this after the {@link io.autotel.EventQueue} is shut down to prevent stale meters.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (io.micrometer.core.instrument.Meter meter : List.copyOf(registered)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        registered.clear();
        if (first != null) throw first;
    }
}
