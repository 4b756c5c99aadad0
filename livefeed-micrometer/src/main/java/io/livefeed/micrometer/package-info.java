/**
 * Micrometer bridge for exporting subscription coordinator metrics to Prometheus,
 * Grafana and other backends.
 *
 * <p>{@link io.livefeed.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.livefeed.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see io.livefeed.micrometer.MicrometerMetricsExporter
 */
package io.livefeed.micrometer;
