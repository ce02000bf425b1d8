package io.autotel.spi;

import java.util.Map;

/**
 * Metrics backend used by {@link io.autotel.metrics.MetricsEmitter}.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge into
 * Micrometer (see the {@code autotel-micrometer} module), OpenTelemetry, or another backend.
 * Implementations must be thread-safe and must not throw from {@code add}/{@code record}.
 */
public interface Meter {

    /**
     * No-op instance that discards all measurements.
     */
    Meter NOOP = new Noop();

    /**
     * Creates (or looks up) a monotonic counter.
     *
     * @param name metric name, e.g. {@code autotel.event_delivery.queue.delivered}
     * @return the counter
     */
    Counter createCounter(String name);

    /**
     * Creates (or looks up) a histogram.
     *
     * @param name metric name, e.g. {@code autotel.event_delivery.queue.latency_ms}
     * @return the histogram
     */
    Histogram createHistogram(String name);

    /** Monotonic counter. */
    interface Counter {
        /**
         * @param amount non-negative increment
         * @param tags   dimension tags, never {@code null}
         */
        void add(long amount, Map<String, String> tags);
    }

    /** Value distribution. */
    interface Histogram {
        /**
         * @param value the sample
         * @param tags  dimension tags, never {@code null}
         */
        void record(double value, Map<String, String> tags);
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements Meter {
        private static final Counter COUNTER = (amount, tags) -> {
        };
        private static final Histogram HISTOGRAM = (value, tags) -> {
        };

        @Override
        public Counter createCounter(String name) {
            return COUNTER;
        }

        @Override
        public Histogram createHistogram(String name) {
            return HISTOGRAM;
        }
    }
}
