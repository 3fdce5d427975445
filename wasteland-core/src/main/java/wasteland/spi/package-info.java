/**
 * Service Provider Interfaces (SPI) for plugging a versioned store and a metrics backend
 * into the mutation engine.
 *
 * @see wasteland.spi.CommonsStore
 * @see wasteland.spi.MetricsExporter
 */
package wasteland.spi;
