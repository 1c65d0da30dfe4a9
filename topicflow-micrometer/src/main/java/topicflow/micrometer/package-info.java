/**
 * Micrometer bridge for exporting handler metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link topicflow.micrometer.MicrometerMetricsExporter} implements the
 * {@link topicflow.spi.MetricsExporter} SPI using Micrometer counters, gauges and timers.
 *
 * @see topicflow.micrometer.MicrometerMetricsExporter
 */
package topicflow.micrometer;
