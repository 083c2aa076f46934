/**
 * Flush policy and execution.
 *
 * <p>{@link writebuffer.flush.FlushTrigger} decides whether a category is due;
 * {@link writebuffer.flush.FlushScheduler} ticks, runs one flush lane per category and
 * drains on shutdown. Every flush attempt produces a {@link writebuffer.flush.FlushEvent}.
 *
 * @see writebuffer.flush.FlushScheduler
 * @see writebuffer.flush.RetryPolicy
 */
package writebuffer.flush;
