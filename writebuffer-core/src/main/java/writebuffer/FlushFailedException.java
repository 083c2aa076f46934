package writebuffer;

import java.util.Objects;

/**
 * A synchronous flush (direct write with batching disabled, manual flush, or shutdown
 * drain) could not commit. The transaction was rolled back.
 */
public class FlushFailedException extends WriteBufferException {
  private final Category category;
  private final int recordCount;

  public FlushFailedException(Category category, int recordCount, Throwable cause) {
    super("Failed to flush " + recordCount + " " + Objects.requireNonNull(category, "category")
        + " records", cause);
    this.category = category;
    this.recordCount = recordCount;
  }

  public Category category() {
    return category;
  }

  public int recordCount() {
    return recordCount;
  }
}
