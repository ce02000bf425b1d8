package io.autotel.spi;

import io.autotel.EventRecord;

import java.util.Locale;

/**
 * Callback for records the queue discards before any delivery attempt.
 *
 * <p>Invoked on the producer thread that caused the drop, so implementations must be fast and
 * non-blocking. Exceptions are logged and otherwise ignored.
 */
@FunctionalInterface
public interface EventDropListener {

    /** Listener that ignores every drop. */
    EventDropListener NOOP = (event, reason) -> {
    };

    /**
     * @param event  the discarded record
     * @param reason why it was discarded
     */
    void onDrop(EventRecord event, DropReason reason);

    /** Why a record was discarded. */
    enum DropReason {
        /** Evicted as the oldest record to make room in a full buffer. */
        BACKPRESSURE,
        /** Rejected because the queue was shutting down. */
        SHUTDOWN;

        /**
         * @return lower-case tag value for metrics
         */
        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
