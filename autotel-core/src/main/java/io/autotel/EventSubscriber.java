package io.autotel;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Downstream destination for tracked events: an analytics platform, a webhook, a data sink.
 *
 * <h2>Execution Model</h2>
 * <p>{@link EventQueue} calls {@link #trackEvent} on its own delivery threads, one task per
 * subscriber per batch, and waits for the returned stage up to the configured delivery timeout.
 * A stage that completes exceptionally, a thrown exception, or a timeout all count as a failed
 * attempt for that event and this subscriber only.
 *
 * <h2>Identity</h2>
 * <p>{@link #name()} is lower-cased and used as the key for health state and metric tags.
 * Subscribers returning {@code null} are given a positional fallback identity by the queue.
 *
 * <h2>Idempotency</h2>
 * <p>An event may reach the same subscriber more than once if an attempt fails after the
 * destination accepted it. Use {@link EventRecord#CORRELATION_ID} or the event name and
 * attributes for deduplication.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventSubscriber webhook = new EventSubscriber() {
 *   public String name() { return "Webhook"; }
 *   public CompletionStage<Void> trackEvent(String name, Map<String, Object> attributes) {
 *     return httpClient.sendAsync(toRequest(name, attributes), discarding())
 *         .thenAccept(response -> { });
 *   }
 *   // trackFunnelStep, trackOutcome, trackValue ...
 * };
 * }</pre>
 */
public interface EventSubscriber {

    /**
     * Tracks a named event such as {@code "user.registered"}.
     *
     * @param name       event name
     * @param attributes event attributes, never {@code null}
     * @return stage completing when the destination accepted (or buffered) the event
     */
    CompletionStage<Void> trackEvent(String name, Map<String, Object> attributes);

    /**
     * Tracks one step of a funnel, e.g. checkout started then completed.
     *
     * @param funnelName funnel name
     * @param step       step status
     * @param attributes event attributes, never {@code null}
     * @return stage completing when the step was accepted
     */
    CompletionStage<Void> trackFunnelStep(String funnelName, FunnelStatus step, Map<String, Object> attributes);

    /**
     * Tracks the outcome of an operation, e.g. {@code "payment.processing"} succeeded.
     *
     * @param operationName operation name
     * @param outcome       outcome status
     * @param attributes    event attributes, never {@code null}
     * @return stage completing when the outcome was accepted
     */
    CompletionStage<Void> trackOutcome(String operationName, OutcomeStatus outcome, Map<String, Object> attributes);

    /**
     * Tracks a numeric business value such as revenue or cart size.
     *
     * @param name       value name
     * @param value      the value
     * @param attributes event attributes, never {@code null}
     * @return stage completing when the value was accepted
     */
    CompletionStage<Void> trackValue(String name, double value, Map<String, Object> attributes);

    /**
     * Optional display name, used (lower-cased) as the subscriber identity.
     *
     * @return the name, or {@code null} to let the queue assign a fallback identity
     */
    default String name() {
        return null;
    }

    /**
     * Optional version for diagnostics.
     *
     * @return the version, or {@code null}
     */
    default String version() {
        return null;
    }

    /**
     * Flushes pending work and releases resources. Called once by {@link EventQueue#shutdown()}
     * after the final drain.
     *
     * @return stage completing when the subscriber is shut down
     */
    default CompletionStage<Void> shutdown() {
        return CompletableFuture.completedFuture(null);
    }

    /** Status of a funnel step. */
    enum FunnelStatus {
        STARTED,
        COMPLETED,
        ABANDONED,
        FAILED
    }

    /** Status of an operation outcome. */
    enum OutcomeStatus {
        SUCCESS,
        FAILURE,
        PARTIAL
    }
}
