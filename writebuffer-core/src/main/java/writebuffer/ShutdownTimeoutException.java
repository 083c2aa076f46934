package writebuffer;

import java.time.Duration;

/**
 * The shutdown drain did not finish within its budget. Records still in flight when
 * the budget ran out must be presumed not committed.
 */
public final class ShutdownTimeoutException extends WriteBufferException {
  private final int pendingRecords;

  public ShutdownTimeoutException(Duration timeout, int pendingRecords) {
    super("Shutdown drain did not complete within " + timeout.toMillis() + " ms; "
        + pendingRecords + " records may not have been committed");
    this.pendingRecords = pendingRecords;
  }

  public int pendingRecords() {
    return pendingRecords;
  }
}
