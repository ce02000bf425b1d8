/**
 * Micrometer bridge for exporting event delivery metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.autotel.micrometer.MicrometerMeter} implements the {@link io.autotel.spi.Meter}
 * SPI using Micrometer counters and distribution summaries.
 *
 * @see io.autotel.micrometer.MicrometerMeter
 */
package io.autotel.micrometer;
