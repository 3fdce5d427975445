/**
 * Micrometer bridge for exporting wanted-board metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link wasteland.micrometer.MicrometerMetricsExporter} implements the
 * {@link wasteland.spi.MetricsExporter} SPI using Micrometer counters and a timer.
 *
 * @see wasteland.micrometer.MicrometerMetricsExporter
 */
package wasteland.micrometer;
