package writebuffer;

/**
 * A record was refused because its category buffer is at capacity and the forced
 * overflow flush failed. The record was not buffered; the caller decides whether to
 * retry or give up.
 */
public final class EnqueueRejectedException extends WriteBufferException {
  private final Category category;

  public EnqueueRejectedException(Category category, int bufferSize, Throwable cause) {
    super(category + " buffer is full (" + bufferSize + " records) and the overflow flush failed",
        cause);
    this.category = category;
  }

  public Category category() {
    return category;
  }
}
