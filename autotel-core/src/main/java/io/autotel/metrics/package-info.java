/**
 * Metric names and tags for event delivery, emitted through the {@link io.autotel.spi.Meter} SPI.
 */
package io.autotel.metrics;
