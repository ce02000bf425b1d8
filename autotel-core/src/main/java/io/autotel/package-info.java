/**
 * Buffered, batched delivery of product events to pluggable subscribers.
 *
 * <p>Producers call {@link io.autotel.EventQueue#enqueue} with an {@link io.autotel.EventRecord};
 * the queue buffers records (evicting the oldest when full) and flushes them to every
 * {@link io.autotel.EventSubscriber} in batches, retrying failed events and isolating
 * failing subscribers behind a per-subscriber circuit breaker.
 *
 * @see io.autotel.EventQueue
 * @see io.autotel.QueueConfig
 */
package io.autotel;
