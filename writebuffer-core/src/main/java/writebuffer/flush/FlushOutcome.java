package writebuffer.flush;

/**
 * Result of one flush attempt.
 */
public enum FlushOutcome {
  COMMITTED,
  FAILED
}
