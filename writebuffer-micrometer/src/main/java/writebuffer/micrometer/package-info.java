/**
 * Micrometer bridge for write buffer flush metrics.
 *
 * @see writebuffer.micrometer.MicrometerMetricsExporter
 */
package writebuffer.micrometer;
