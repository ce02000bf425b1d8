package io.autotel.metrics;

import io.autotel.spi.EventDropListener.DropReason;
import io.autotel.spi.Meter;

import java.util.Map;
import java.util.Objects;

/**
 * Naming and tagging layer over a {@link Meter} for event delivery metrics.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code <prefix>.delivered}: events delivered, tag {@code subscriber}</li>
 *   <li>{@code <prefix>.failed}: events that exhausted their retries, tag {@code subscriber}</li>
 *   <li>{@code <prefix>.dropped}: records discarded before delivery, tag {@code reason}</li>
 * </ul>
 *
 * <h3>Histograms</h3>
 * <ul>
 *   <li>{@code <prefix>.latency_ms}: end-to-end latency of successful deliveries, from
 *       {@link io.autotel.EventRecord#timestamp()} to the subscriber accepting the event. It
 *       includes time spent buffered and in retry backoff, so it is not the duration of the
 *       subscriber call. Tag {@code subscriber}</li>
 * </ul>
 *
 * <p>The default prefix is {@value #DEFAULT_PREFIX}. Instruments are created once, at
 * construction.
 */
public final class MetricsEmitter {
    public static final String DEFAULT_PREFIX = "autotel.event_delivery.queue";
    public static final String SUBSCRIBER_TAG = "subscriber";
    public static final String REASON_TAG = "reason";

    private final Meter.Counter delivered;
    private final Meter.Counter failed;
    private final Meter.Counter dropped;
    private final Meter.Histogram latency;

    public MetricsEmitter(Meter meter) {
        this(meter, DEFAULT_PREFIX);
    }

    /**
     * @param meter      the metrics backend
     * @param namePrefix prefix for all metric names, without a trailing dot
     */
    public MetricsEmitter(Meter meter, String namePrefix) {
        Objects.requireNonNull(meter, "meter");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        this.delivered = meter.createCounter(namePrefix + ".delivered");
        this.failed = meter.createCounter(namePrefix + ".failed");
        this.dropped = meter.createCounter(namePrefix + ".dropped");
        this.latency = meter.createHistogram(namePrefix + ".latency_ms");
    }

    public void recordDelivered(String identity) {
        delivered.add(1, Map.of(SUBSCRIBER_TAG, identity));
    }

    public void recordFailed(String identity) {
        failed.add(1, Map.of(SUBSCRIBER_TAG, identity));
    }

    /**
     * Records end-to-end delivery latency: record timestamp to delivery completion.
     *
     * @param identity  subscriber identity
     * @param latencyMs milliseconds since the record's timestamp; negative values record as 0
     */
    public void recordLatency(String identity, long latencyMs) {
        latency.record(Math.max(0L, latencyMs), Map.of(SUBSCRIBER_TAG, identity));
    }

    public void recordDropped(DropReason reason) {
        dropped.add(1, Map.of(REASON_TAG, reason.tagValue()));
    }
}
