package writebuffer;

import writebuffer.flush.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of one {@link WriteBuffer} instance.
 *
 * <p>Create instances via {@link #builder()}; {@link #defaults()} returns the values
 * below:
 * <ul>
 *   <li>{@code enabled} = true</li>
 *   <li>{@code batchSize} = 100</li>
 *   <li>{@code flushInterval} = 50 ms</li>
 *   <li>{@code maxBufferSize} = 10 000</li>
 *   <li>{@code maxRetries} = 3</li>
 *   <li>{@code retryPolicy} = {@link RetryPolicy#NEXT_TRIGGER}</li>
 *   <li>{@code shutdownTimeout} = 5 s</li>
 *   <li>{@code tickInterval} = half the flush interval (at least 1 ms)</li>
 * </ul>
 */
public final class WriteBufferConfig {
  private final boolean enabled;
  private final int batchSize;
  private final Duration flushInterval;
  private final int maxBufferSize;
  private final int maxRetries;
  private final RetryPolicy retryPolicy;
  private final Duration shutdownTimeout;
  private final Duration tickInterval;

  private WriteBufferConfig(Builder builder) {
    Objects.requireNonNull(builder.flushInterval, "flushInterval");
    Objects.requireNonNull(builder.shutdownTimeout, "shutdownTimeout");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.flushInterval.isNegative() || builder.flushInterval.toMillis() <= 0) {
      throw new IllegalArgumentException("flushInterval must be >= 1 ms");
    }
    if (builder.maxBufferSize <= builder.batchSize) {
      throw new IllegalArgumentException("maxBufferSize must be > batchSize");
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (builder.shutdownTimeout.isNegative() || builder.shutdownTimeout.isZero()) {
      throw new IllegalArgumentException("shutdownTimeout must be > 0");
    }
    if (builder.tickInterval != null
        && (builder.tickInterval.isNegative() || builder.tickInterval.toMillis() <= 0)) {
      throw new IllegalArgumentException("tickInterval must be >= 1 ms");
    }
    this.enabled = builder.enabled;
    this.batchSize = builder.batchSize;
    this.flushInterval = builder.flushInterval;
    this.maxBufferSize = builder.maxBufferSize;
    this.maxRetries = builder.maxRetries;
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.NEXT_TRIGGER;
    this.shutdownTimeout = builder.shutdownTimeout;
    this.tickInterval = builder.tickInterval != null
        ? builder.tickInterval
        : Duration.ofMillis(Math.max(1L, builder.flushInterval.toMillis() / 2));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static WriteBufferConfig defaults() {
    return builder().build();
  }

  public boolean enabled() {
    return enabled;
  }

  public int batchSize() {
    return batchSize;
  }

  public Duration flushInterval() {
    return flushInterval;
  }

  public int maxBufferSize() {
    return maxBufferSize;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public Duration shutdownTimeout() {
    return shutdownTimeout;
  }

  public Duration tickInterval() {
    return tickInterval;
  }

  @Override
  public String toString() {
    return "WriteBufferConfig{enabled=" + enabled
        + ", batchSize=" + batchSize
        + ", flushIntervalMs=" + flushInterval.toMillis()
        + ", maxBufferSize=" + maxBufferSize
        + ", maxRetries=" + maxRetries
        + ", shutdownTimeoutMs=" + shutdownTimeout.toMillis()
        + ", tickIntervalMs=" + tickInterval.toMillis() + '}';
  }

  /** Builder for {@link WriteBufferConfig}. */
  public static final class Builder {
    private boolean enabled = true;
    private int batchSize = 100;
    private Duration flushInterval = Duration.ofMillis(50);
    private int maxBufferSize = 10_000;
    private int maxRetries = 3;
    private RetryPolicy retryPolicy;
    private Duration shutdownTimeout = Duration.ofSeconds(5);
    private Duration tickInterval;

    private Builder() {}

    /**
     * Enables or disables batching. When disabled every write is its own transaction.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param enabled whether to batch
     * @return this builder
     */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Sets the number of buffered records that triggers a size flush; size flushes
     * commit exactly this many records per transaction.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param batchSize records per size-triggered transaction
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the longest time a non-empty buffer waits before a time-triggered flush.
     *
     * <p>Optional. Defaults to 50 ms. Must be at least 1 ms.
     *
     * @param flushInterval the flush interval
     * @return this builder
     */
    public Builder flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    /**
     * Shorthand for {@link #flushInterval(Duration)} in milliseconds.
     *
     * @param flushIntervalMs the flush interval in milliseconds
     * @return this builder
     */
    public Builder flushIntervalMs(long flushIntervalMs) {
      return flushInterval(Duration.ofMillis(flushIntervalMs));
    }

    /**
     * Sets the per-category capacity. An enqueue into a full buffer forces a synchronous
     * flush first.
     *
     * <p>Optional. Defaults to {@code 10000}. Must be &gt; {@code batchSize}.
     *
     * @param maxBufferSize maximum buffered records per category
     * @return this builder
     */
    public Builder maxBufferSize(int maxBufferSize) {
      this.maxBufferSize = maxBufferSize;
      return this;
    }

    /**
     * Sets how many times a failed batch is retried before it is dropped.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0; {@code 0} drops a batch on its
     * first failure.
     *
     * @param maxRetries retries after the first failed attempt
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the delay policy between retries of a failed batch.
     *
     * <p>Optional. Defaults to {@link RetryPolicy#NEXT_TRIGGER}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the budget for the shutdown drain.
     *
     * <p>Optional. Defaults to 5 s. Must be &gt; 0.
     *
     * @param shutdownTimeout the drain budget
     * @return this builder
     */
    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    /**
     * Sets the scheduler tick period.
     *
     * <p>Optional. Defaults to half the flush interval, at least 1 ms.
     *
     * @param tickInterval the tick period
     * @return this builder
     */
    public Builder tickInterval(Duration tickInterval) {
      this.tickInterval = tickInterval;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new immutable {@link WriteBufferConfig}
     * @throws IllegalArgumentException if any value is out of range
     */
    public WriteBufferConfig build() {
      return new WriteBufferConfig(this);
    }
  }
}
