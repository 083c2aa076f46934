package writebuffer.spi;

import writebuffer.Category;
import writebuffer.flush.FlushEvent;

/**
 * Observability hook for exporting flush activity to a metrics backend.
 *
 * <p>Flush and drop events are reported from the flush path, after the built-in
 * {@linkplain writebuffer.metrics.BatchMetrics aggregate metrics} have been updated.
 * Buffer lengths are reported after every accepted write and every flush.
 * Implementations must be thread-safe and must not block. The {@link #NOOP} instance
 * discards everything.
 *
 * @see writebuffer.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Records one flush attempt.
     *
     * @param event the completed flush event
     */
    void recordFlush(FlushEvent event);

    /**
     * Records a batch dropped after exhausting its retries.
     *
     * @param category    the category of the dropped batch
     * @param recordCount number of records lost
     */
    void recordDropped(Category category, int recordCount);

    /**
     * Records the current length of a category buffer.
     *
     * @param category the category
     * @param size     current buffer length
     */
    default void recordBufferSize(Category category, int size) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void recordFlush(FlushEvent event) {
        }

        @Override
        public void recordDropped(Category category, int recordCount) {
        }
    }
}
