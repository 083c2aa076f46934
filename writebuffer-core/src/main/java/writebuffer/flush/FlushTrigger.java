package writebuffer.flush;

import java.util.Optional;

/**
 * Stateless flush decision for one category.
 *
 * <p>Rules, in priority order:
 * <ol>
 *   <li>shutting down: {@link FlushReason#SHUTDOWN}, regardless of size</li>
 *   <li>batching disabled: no flush</li>
 *   <li>{@code size >= batchSize}: {@link FlushReason#SIZE_THRESHOLD}</li>
 *   <li>{@code size > 0} and the interval elapsed: {@link FlushReason#TIME_INTERVAL}</li>
 *   <li>{@code size >= maxBufferSize}: {@link FlushReason#OVERFLOW}</li>
 * </ol>
 * The overflow rule is normally unreachable because enqueue forces its own flush at
 * capacity; it remains as a safety net.
 */
public final class FlushTrigger {
  private final int batchSize;
  private final long flushIntervalMs;
  private final int maxBufferSize;

  public FlushTrigger(int batchSize, long flushIntervalMs, int maxBufferSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (flushIntervalMs <= 0) {
      throw new IllegalArgumentException("flushIntervalMs must be > 0");
    }
    if (maxBufferSize <= batchSize) {
      throw new IllegalArgumentException("maxBufferSize must be > batchSize");
    }
    this.batchSize = batchSize;
    this.flushIntervalMs = flushIntervalMs;
    this.maxBufferSize = maxBufferSize;
  }

  /**
   * Decides whether a category should flush now.
   *
   * @param bufferSize        current buffer length, including records awaiting retry
   * @param msSinceLastFlush  milliseconds since the category's last flush attempt
   * @param batchingEnabled   whether batching is enabled
   * @param shuttingDown      whether shutdown has begun
   * @return the flush reason, or empty if no flush is due
   */
  public Optional<FlushReason> decide(int bufferSize, long msSinceLastFlush,
      boolean batchingEnabled, boolean shuttingDown) {
    if (shuttingDown) {
      return Optional.of(FlushReason.SHUTDOWN);
    }
    if (!batchingEnabled) {
      return Optional.empty();
    }
    if (bufferSize >= batchSize) {
      return Optional.of(FlushReason.SIZE_THRESHOLD);
    }
    if (bufferSize > 0 && msSinceLastFlush >= flushIntervalMs) {
      return Optional.of(FlushReason.TIME_INTERVAL);
    }
    if (bufferSize >= maxBufferSize) {
      return Optional.of(FlushReason.OVERFLOW);
    }
    return Optional.empty();
  }
}
