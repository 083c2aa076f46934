package writebuffer.flush;

/**
 * Computes how long a failed batch waits before its next scheduled retry.
 *
 * <p>The delay only gates retries started by the background scheduler. Overflow,
 * manual and shutdown flushes retry a pending batch immediately.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Retries on the next trigger, without extra delay.
     */
    RetryPolicy NEXT_TRIGGER = attempts -> 0L;

    /**
     * Computes the delay in milliseconds before the next retry.
     *
     * @param attempts failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
