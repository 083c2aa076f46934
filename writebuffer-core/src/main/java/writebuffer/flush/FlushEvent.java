package writebuffer.flush;

import writebuffer.Category;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one flush attempt, produced once and fed to the metrics.
 *
 * @param category    the flushed category
 * @param reason      what triggered the flush
 * @param recordCount number of records in the batch (0 for a no-op shutdown flush)
 * @param startedAt   when the attempt started
 * @param durationMs  wall time of the attempt in milliseconds
 * @param outcome     committed or failed
 * @param failure     the failure cause when {@code outcome} is {@link FlushOutcome#FAILED},
 *                    otherwise {@code null}
 */
public record FlushEvent(
    Category category,
    FlushReason reason,
    int recordCount,
    Instant startedAt,
    long durationMs,
    FlushOutcome outcome,
    Throwable failure) {

  public FlushEvent {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(outcome, "outcome");
    if (recordCount < 0) {
      throw new IllegalArgumentException("recordCount must be >= 0");
    }
    if (outcome == FlushOutcome.FAILED && failure == null) {
      throw new IllegalArgumentException("failed flush requires a failure cause");
    }
  }

  public boolean committed() {
    return outcome == FlushOutcome.COMMITTED;
  }
}
