package writebuffer;

/**
 * Base class of the unchecked exceptions surfaced by the synchronous write paths.
 *
 * @see EnqueueRejectedException
 * @see FlushFailedException
 * @see ShutdownTimeoutException
 */
public class WriteBufferException extends RuntimeException {
  public WriteBufferException(String message) {
    super(message);
  }

  public WriteBufferException(String message, Throwable cause) {
    super(message, cause);
  }
}
