/**
 * Micrometer metrics bridge for fanlog.
 *
 * <p>{@link io.fanlog.micrometer.MicrometerMetricsExporter} implements
 * {@link io.fanlog.spi.MetricsExporter} with counters, a gauge and a distribution summary
 * under a configurable prefix (default {@code fanlog}).
 */
package io.fanlog.micrometer;
