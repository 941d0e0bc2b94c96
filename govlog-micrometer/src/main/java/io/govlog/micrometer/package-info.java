/**
 * Micrometer bridge for exporting event store metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.govlog.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.govlog.spi.MetricsExporter} SPI using Micrometer counters and timers.
 */
package io.govlog.micrometer;
