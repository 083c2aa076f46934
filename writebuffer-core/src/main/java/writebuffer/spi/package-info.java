/**
 * Service Provider Interfaces (SPI) for plugging the write buffer into a store and a
 * metrics backend.
 *
 * @see writebuffer.spi.BatchExecutor
 * @see writebuffer.spi.ConnectionProvider
 * @see writebuffer.spi.MetricsExporter
 */
package writebuffer.spi;
