package writebuffer.flush;

/**
 * Why a flush was started. Every flush event carries exactly one reason and is counted
 * under it.
 */
public enum FlushReason {
  /** The buffer reached the configured batch size. */
  SIZE_THRESHOLD("size"),
  /** The buffer was non-empty and the flush interval elapsed since the last flush. */
  TIME_INTERVAL("time"),
  /** Final drain during shutdown. */
  SHUTDOWN("shutdown"),
  /** The buffer reached its capacity and an enqueue forced a synchronous flush. */
  OVERFLOW("overflow"),
  /** Explicit {@code flushAll()} request. */
  MANUAL("manual");

  private final String key;

  FlushReason(String key) {
    this.key = key;
  }

  /**
   * Short lowercase name used in metric names and snapshot keys.
   */
  public String key() {
    return key;
  }
}
