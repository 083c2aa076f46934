package writebuffer.metrics;

import writebuffer.Category;
import writebuffer.flush.FlushEvent;
import writebuffer.flush.FlushReason;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Cumulative flush statistics for one write buffer.
 *
 * <p>Updated only by the flush path, read through {@link #snapshot}. Counters only grow;
 * derived values are recomputed from the counters when a snapshot is taken.
 * Zero-size flushes (a shutdown with nothing buffered) count toward
 * {@code totalFlushes} but not toward the min/max batch size.
 */
public final class BatchMetrics {
  private long totalFlushes;
  private long totalWritesAttempted;
  private long totalItemsCommitted;
  private long failedFlushes;
  private long droppedRecords;
  private final EnumMap<FlushReason, Long> flushesByReason = new EnumMap<>(FlushReason.class);
  private int minBatchSize;
  private int maxBatchSize;
  private Instant lastFlushAt;

  public BatchMetrics() {
    for (FlushReason reason : FlushReason.values()) {
      flushesByReason.put(reason, 0L);
    }
  }

  /**
   * Folds one flush attempt into the counters.
   */
  public synchronized void record(FlushEvent event) {
    Objects.requireNonNull(event, "event");
    totalFlushes++;
    totalWritesAttempted += event.recordCount();
    if (event.committed()) {
      totalItemsCommitted += event.recordCount();
    } else {
      failedFlushes++;
    }
    flushesByReason.merge(event.reason(), 1L, Long::sum);
    int size = event.recordCount();
    if (size > 0) {
      if (minBatchSize == 0 || size < minBatchSize) {
        minBatchSize = size;
      }
      if (size > maxBatchSize) {
        maxBatchSize = size;
      }
    }
    lastFlushAt = event.startedAt();
  }

  /**
   * Counts records discarded after their batch exhausted its retries.
   */
  public synchronized void recordDropped(int recordCount) {
    if (recordCount < 0) {
      throw new IllegalArgumentException("recordCount must be >= 0");
    }
    droppedRecords += recordCount;
  }

  /**
   * Returns an immutable view of the counters.
   *
   * @param enabled     whether batching is enabled for the owning buffer
   * @param bufferSizes current per-category buffer lengths
   */
  public synchronized MetricsSnapshot snapshot(boolean enabled, Map<Category, Integer> bufferSizes) {
    double avg = totalFlushes == 0 ? 0.0 : (double) totalItemsCommitted / totalFlushes;
    return new MetricsSnapshot(enabled, totalFlushes, totalWritesAttempted, totalItemsCommitted,
        failedFlushes, droppedRecords, flushesByReason, minBatchSize, maxBatchSize, avg,
        lastFlushAt, bufferSizes);
  }
}
