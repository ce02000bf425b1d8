/**
 * Service provider interfaces for extending the event queue.
 *
 * <ul>
 *   <li>{@link io.autotel.spi.Meter}: metrics backend for counters and histograms</li>
 *   <li>{@link io.autotel.spi.EventDropListener}: notification of records discarded before delivery</li>
 * </ul>
 */
package io.autotel.spi;
