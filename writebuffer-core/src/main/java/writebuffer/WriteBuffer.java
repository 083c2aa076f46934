package writebuffer;

import writebuffer.buffer.CategoryBuffer;
import writebuffer.flush.FlushEvent;
import writebuffer.flush.FlushReason;
import writebuffer.flush.FlushScheduler;
import writebuffer.metrics.BatchMetrics;
import writebuffer.metrics.MetricsSnapshot;
import writebuffer.spi.BatchExecutor;
import writebuffer.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite that owns one set of category buffers, their flush scheduler, the batch
 * executor and the metrics, and exposes a {@link WriteRecorder} for producers.
 *
 * <p>Instances are independent of each other; nothing is held in static state.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (WriteBuffer buffer = WriteBuffer.builder()
 *     .config(WriteBufferConfig.builder().batchSize(200).flushIntervalMs(20).build())
 *     .batchExecutor(new JdbcBatchExecutor(connProvider, Dialects.detect(dataSource)))
 *     .build()) {
 *   buffer.start();
 *   buffer.recorder().recordMessage("orders", "m-1", "{\"id\":1}", "client-7");
 * }
 * }</pre>
 *
 * @see WriteRecorder
 * @see FlushScheduler
 */
public final class WriteBuffer implements AutoCloseable {
  private final WriteBufferConfig config;
  private final BatchMetrics metrics;
  private final MetricsExporter exporter;
  private final Map<Category, CategoryBuffer> buffers;
  private final FlushScheduler scheduler;
  private final WriteRecorder recorder;

  private WriteBuffer(Builder builder) {
    this.config = builder.config != null ? builder.config : WriteBufferConfig.defaults();
    BatchExecutor executor = Objects.requireNonNull(builder.batchExecutor, "batchExecutor");
    this.exporter = builder.metricsExporter != null ? builder.metricsExporter : MetricsExporter.NOOP;
    this.metrics = new BatchMetrics();

    EnumMap<Category, CategoryBuffer> map = new EnumMap<>(Category.class);
    for (Category category : Category.values()) {
      map.put(category, new CategoryBuffer(category, config.maxBufferSize()));
    }
    this.buffers = Collections.unmodifiableMap(map);
    this.scheduler = new FlushScheduler(config, buffers, executor, metrics, exporter);
    this.recorder = new WriteRecorder(config, buffers, scheduler, executor);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts background flushing. Records written before this call stay buffered until
   * a flush is triggered by overflow, {@link #flushAll()} or shutdown.
   *
   * @return this instance
   * @throws IllegalStateException if already shut down
   */
  public WriteBuffer start() {
    scheduler.start();
    return this;
  }

  /**
   * Returns the recorder producers write through.
   *
   * @return the write recorder
   */
  public WriteRecorder recorder() {
    return recorder;
  }

  public WriteBufferConfig config() {
    return config;
  }

  /**
   * Returns a point-in-time view of the flush statistics and the current buffer sizes.
   *
   * @return the metrics snapshot
   */
  public MetricsSnapshot metrics() {
    EnumMap<Category, Integer> sizes = new EnumMap<>(Category.class);
    for (Map.Entry<Category, CategoryBuffer> entry : buffers.entrySet()) {
      sizes.put(entry.getKey(), entry.getValue().size());
    }
    return metrics.snapshot(config.enabled(), sizes);
  }

  /**
   * Current buffer length of one category, records awaiting retry included.
   */
  public int bufferSize(Category category) {
    return buffers.get(Objects.requireNonNull(category, "category")).size();
  }

  /**
   * Flushes every category in the calling thread, each as one transaction.
   *
   * @return the flush events, in category order
   * @throws FlushFailedException if any category failed to commit; the failed batch is
   *     kept for retry, other categories are still flushed
   */
  public List<FlushEvent> flushAll() {
    List<FlushEvent> all = new ArrayList<>();
    FlushFailedException failure = null;
    for (Category category : Category.values()) {
      for (FlushEvent event : scheduler.flushNow(category, FlushReason.MANUAL)) {
        all.add(event);
        if (!event.committed()) {
          FlushFailedException e = new FlushFailedException(category, event.recordCount(),
              event.failure());
          if (failure == null) failure = e; else failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
    return all;
  }

  /**
   * Stops background flushing and drains every buffer.
   *
   * @throws ShutdownTimeoutException if the drain exceeded the shutdown timeout
   * @throws FlushFailedException     if a category could not be drained
   * @see FlushScheduler#shutdown()
   */
  public void shutdown() {
    scheduler.shutdown();
  }

  public boolean isShutdown() {
    return scheduler.isShutdown();
  }

  /**
   * Shuts down, then closes the metrics exporter if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      scheduler.shutdown();
    } catch (RuntimeException e) {
      first = e;
    }
    if (exporter instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new WriteBufferException(
            "Failed to close metrics exporter", e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link WriteBuffer}.
   */
  public static final class Builder {
    private WriteBufferConfig config;
    private BatchExecutor batchExecutor;
    private MetricsExporter metricsExporter;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Optional. Defaults to {@link WriteBufferConfig#defaults()}.
     */
    public Builder config(WriteBufferConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the executor that commits batches. Required.
     */
    public Builder batchExecutor(BatchExecutor batchExecutor) {
      this.batchExecutor = batchExecutor;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metricsExporter(MetricsExporter metricsExporter) {
      this.metricsExporter = metricsExporter;
      return this;
    }

    /**
     * Builds the write buffer without starting it.
     *
     * @throws NullPointerException  if the batch executor is missing
     * @throws IllegalStateException if this builder was already used
     */
    public WriteBuffer build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new WriteBuffer(this);
    }
  }
}
