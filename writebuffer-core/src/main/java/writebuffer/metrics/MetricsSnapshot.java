package writebuffer.metrics;

import writebuffer.Category;
import writebuffer.flush.FlushReason;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of a write buffer's metrics.
 *
 * <p>{@link #toMap()} renders the snapshot with flat snake_case keys for a JSON
 * monitoring endpoint.
 *
 * @param enabled              whether batching is enabled
 * @param totalFlushes         flush attempts, including failed and zero-size ones
 * @param totalWritesAttempted records handed to the executor across all attempts
 * @param totalItemsCommitted  records committed
 * @param failedFlushes        flush attempts that rolled back
 * @param droppedRecords       records discarded after exhausting retries
 * @param flushesByReason      flush attempts per trigger reason
 * @param minBatchSize         smallest non-empty batch (0 before the first one)
 * @param maxBatchSize         largest batch
 * @param avgBatchSize         {@code totalItemsCommitted / totalFlushes}, 0 without flushes
 * @param lastFlushAt          start of the latest flush attempt, or {@code null}
 * @param bufferSizes          current per-category buffer lengths
 */
public record MetricsSnapshot(
    boolean enabled,
    long totalFlushes,
    long totalWritesAttempted,
    long totalItemsCommitted,
    long failedFlushes,
    long droppedRecords,
    Map<FlushReason, Long> flushesByReason,
    int minBatchSize,
    int maxBatchSize,
    double avgBatchSize,
    Instant lastFlushAt,
    Map<Category, Integer> bufferSizes) {

  public MetricsSnapshot {
    flushesByReason = flushesByReason.isEmpty()
        ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(flushesByReason));
    bufferSizes = bufferSizes.isEmpty()
        ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(bufferSizes));
  }

  /**
   * Flush attempts recorded under {@code reason}.
   */
  public long flushesBy(FlushReason reason) {
    return flushesByReason.getOrDefault(reason, 0L);
  }

  /**
   * Current length of one category buffer (0 if unknown).
   */
  public int bufferSize(Category category) {
    return bufferSizes.getOrDefault(category, 0);
  }

  /**
   * Renders the snapshot as an ordered map of plain values: counters, per-reason counts
   * as {@code flush_by_<reason>}, derived statistics rounded to two decimals, and
   * per-category sizes under {@code buffer_sizes} keyed by table name.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("enabled", enabled);
    map.put("total_flushes", totalFlushes);
    map.put("total_writes", totalWritesAttempted);
    map.put("total_batched_items", totalItemsCommitted);
    map.put("failed_flushes", failedFlushes);
    map.put("dropped_records", droppedRecords);
    for (FlushReason reason : FlushReason.values()) {
      map.put("flush_by_" + reason.key(), flushesBy(reason));
    }
    map.put("avg_batch_size", Math.round(avgBatchSize * 100.0) / 100.0);
    map.put("min_batch_size", minBatchSize);
    map.put("max_batch_size", maxBatchSize);
    map.put("last_flush_time", lastFlushAt == null ? null : lastFlushAt.toEpochMilli() / 1000.0);
    Map<String, Integer> sizes = new LinkedHashMap<>();
    for (Category category : Category.values()) {
      sizes.put(category.table(), bufferSize(category));
    }
    map.put("buffer_sizes", sizes);
    return map;
  }
}
