package writebuffer.flush;

import java.time.Duration;
import java.util.Objects;

/**
 * Doubles the retry delay after each failed attempt, starting at {@code baseDelay} and
 * never exceeding {@code maxDelay}.
 *
 * <p>No jitter is applied.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay) {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative() || baseDelay.isZero()) {
      throw new IllegalArgumentException("baseDelay must be > 0");
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    }
    this.baseDelayMs = baseDelay.toMillis();
    this.maxDelayMs = maxDelay.toMillis();
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long delay = baseDelayMs;
    for (int i = 1; i < attempts && delay < maxDelayMs; i++) {
      delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
    }
    return Math.min(delay, maxDelayMs);
  }
}
