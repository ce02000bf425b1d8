package io.autotel.metrics;

import io.autotel.RecordingMeter;
import io.autotel.spi.EventDropListener.DropReason;
import io.autotel.spi.Meter;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MetricsEmitterTest {

    @Test
    void countersAreTaggedBySubscriber() {
        RecordingMeter meter = new RecordingMeter();
        MetricsEmitter metrics = new MetricsEmitter(meter);

        metrics.recordDelivered("console");
        metrics.recordDelivered("console");
        metrics.recordFailed("webhook");

        assertEquals(2.0, meter.sum("autotel.event_delivery.queue.delivered", "subscriber", "console"));
        assertEquals(1.0, meter.sum("autotel.event_delivery.queue.failed", "subscriber", "webhook"));
    }

    @Test
    void droppedCounterIsTaggedByReason() {
        RecordingMeter meter = new RecordingMeter();
        MetricsEmitter metrics = new MetricsEmitter(meter);

        metrics.recordDropped(DropReason.BACKPRESSURE);
        metrics.recordDropped(DropReason.SHUTDOWN);

        assertEquals(Map.of("reason", "backpressure"),
                meter.samples("autotel.event_delivery.queue.dropped").get(0).tags());
        assertEquals(1.0, meter.sum("autotel.event_delivery.queue.dropped", "reason", "shutdown"));
    }

    @Test
    void negativeLatencyIsClampedToZero() {
        RecordingMeter meter = new RecordingMeter();
        MetricsEmitter metrics = new MetricsEmitter(meter);

        metrics.recordLatency("console", -5);
        metrics.recordLatency("console", 12);

        assertEquals(12.0, meter.sum("autotel.event_delivery.queue.latency_ms", "subscriber", "console"));
        assertEquals(0.0, meter.samples("autotel.event_delivery.queue.latency_ms").get(0).value());
    }

    @Test
    void customPrefix() {
        RecordingMeter meter = new RecordingMeter();
        new MetricsEmitter(meter, "shop.events").recordDelivered("console");

        assertEquals(1.0, meter.sum("shop.events.delivered", "subscriber", "console"));
    }

    @Test
    void prefixValidation() {
        assertThrows(NullPointerException.class, () -> new MetricsEmitter(null));
        assertThrows(NullPointerException.class, () -> new MetricsEmitter(Meter.NOOP, null));
        assertThrows(IllegalArgumentException.class, () -> new MetricsEmitter(Meter.NOOP, ""));
        assertThrows(IllegalArgumentException.class, () -> new MetricsEmitter(Meter.NOOP, "shop."));
    }

    @Test
    void noopMeterAcceptsEverything() {
        MetricsEmitter metrics = new MetricsEmitter(Meter.NOOP);

        assertDoesNotThrow(() -> {
            metrics.recordDelivered("console");
            metrics.recordLatency("console", 3);
            metrics.recordDropped(DropReason.SHUTDOWN);
        });
    }
}
