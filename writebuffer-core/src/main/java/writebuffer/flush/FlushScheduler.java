package writebuffer.flush;

import writebuffer.Category;
import writebuffer.FlushFailedException;
import writebuffer.ShutdownTimeoutException;
import writebuffer.WriteBufferConfig;
import writebuffer.WriteBufferException;
import writebuffer.WriteRecord;
import writebuffer.buffer.CategoryBuffer;
import writebuffer.buffer.CategoryBuffer.RetrySegment;
import writebuffer.metrics.BatchMetrics;
import writebuffer.spi.BatchExecutor;
import writebuffer.spi.BatchResult;
import writebuffer.spi.MetricsExporter;
import writebuffer.util.DaemonThreadFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives every flush of a write buffer: the periodic tick, the asynchronous flush lanes,
 * the synchronous flushes requested by callers, and the shutdown drain.
 *
 * <p>A single daemon thread ticks every {@link WriteBufferConfig#tickInterval()} and asks
 * {@link FlushTrigger} whether each category is due. Due categories are handed to a pool
 * of flush workers (one per category), so a slow commit on one category never delays
 * another. At most one asynchronous flush per category is outstanding at any time.
 *
 * <p>Every flush of a category runs under that category's flush lock: a failed batch
 * waiting at the front of the buffer is retried first, then fresh records are taken and
 * committed. The lock is never held by enqueue, so records keep accumulating while a
 * commit is in flight.
 *
 * <p>This class is thread-safe. {@link #start()} and {@link #shutdown()} are synchronized
 * to prevent concurrent lifecycle transitions.
 */
public final class FlushScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FlushScheduler.class.getName());

  private final WriteBufferConfig config;
  private final FlushTrigger trigger;
  private final Map<Category, CategoryBuffer> buffers;
  private final Map<Category, Lane> lanes = new EnumMap<>(Category.class);
  private final BatchExecutor executor;
  private final BatchMetrics metrics;
  private final MetricsExporter exporter;
  private final ExecutorService workers;
  private final ReentrantReadWriteLock admission = new ReentrantReadWriteLock();

  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> tickTask;
  private volatile boolean started;
  private volatile boolean shuttingDown;

  /**
   * @param config   buffer settings
   * @param buffers  one buffer per category
   * @param executor commits batches
   * @param metrics  aggregate metrics updated by every flush
   * @param exporter external metrics sink; {@code null} for none
   */
  public FlushScheduler(WriteBufferConfig config, Map<Category, CategoryBuffer> buffers,
      BatchExecutor executor, BatchMetrics metrics, MetricsExporter exporter) {
    this.config = Objects.requireNonNull(config, "config");
    this.buffers = Objects.requireNonNull(buffers, "buffers");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.exporter = exporter != null ? exporter : MetricsExporter.NOOP;
    for (Category category : Category.values()) {
      if (!buffers.containsKey(category)) {
        throw new IllegalArgumentException("Missing buffer for " + category);
      }
      lanes.put(category, new Lane());
    }
    this.trigger = new FlushTrigger(config.batchSize(), config.flushInterval().toMillis(),
        config.maxBufferSize());
    this.workers = Executors.newFixedThreadPool(Category.values().length,
        new DaemonThreadFactory("writebuffer-flush-"));
  }

  /**
   * Starts the periodic tick. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the scheduler has been shut down
   */
  public synchronized void start() {
    if (shuttingDown) {
      throw new IllegalStateException("FlushScheduler has been shut down");
    }
    if (tickTask != null) {
      logger.warning("FlushScheduler is already running");
      return;
    }
    long tickMs = config.tickInterval().toMillis();
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("writebuffer-scheduler-"));
    tickTask = scheduler.scheduleWithFixedDelay(this::tick, tickMs, tickMs, TimeUnit.MILLISECONDS);
    started = true;
    logger.log(Level.INFO, "Flush scheduler started: {0}", config);
  }

  /**
   * Evaluates the flush trigger for every category once and dispatches due flushes.
   * Called by the tick thread; may also be invoked directly for testing.
   */
  public void tick() {
    if (shuttingDown) {
      return;
    }
    try {
      long now = System.nanoTime();
      for (Category category : Category.values()) {
        Lane lane = lanes.get(category);
        long sinceMs = TimeUnit.NANOSECONDS.toMillis(now - lane.lastFlushNanos);
        if (trigger.decide(buffers.get(category).size(), sinceMs, config.enabled(), false).isPresent()) {
          dispatch(category, lane);
        }
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Flush tick failed", t);
    }
  }

  /**
   * Asks for an asynchronous flush evaluation of {@code category} without waiting for
   * the next tick. Ignored before {@link #start()}, after shutdown began, or while a
   * flush of the category is already outstanding.
   *
   * @param category the category whose buffer grew
   */
  public void requestFlush(Category category) {
    if (!started || shuttingDown) {
      return;
    }
    dispatch(category, lanes.get(category));
  }

  private void dispatch(Category category, Lane lane) {
    if (!lane.scheduled.compareAndSet(false, true)) {
      return;
    }
    try {
      workers.execute(() -> runScheduled(category, lane));
    } catch (RejectedExecutionException e) {
      lane.scheduled.set(false);
      logger.log(Level.FINE, "Flush of " + category + " not scheduled; workers are stopping", e);
    }
  }

  private void runScheduled(Category category, Lane lane) {
    CategoryBuffer buffer = buffers.get(category);
    try {
      if (shuttingDown) {
        return;
      }
      long sinceMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lane.lastFlushNanos);
      // Re-evaluated here: the buffer may have changed since the request
      trigger.decide(buffer.size(), sinceMs, config.enabled(), false)
          .ifPresent(reason -> flushNow(category, reason));
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Scheduled flush of " + category + " failed", t);
    } finally {
      lane.scheduled.set(false);
    }
    // A request arriving while this flush ran was dropped by the scheduled flag.
    // Pending retries are left to the tick so a held-back batch is not spun on.
    if (!shuttingDown && !buffer.hasRetry() && buffer.size() >= config.batchSize()) {
      dispatch(category, lane);
    }
  }

  /**
   * Flushes one category synchronously in the calling thread, waiting for any flush of
   * the same category already in progress.
   *
   * <p>A batch awaiting retry is committed first; if it fails again and goes back to the
   * buffer nothing newer is attempted, and if it is dropped the fresh records follow. {@link FlushReason#SIZE_THRESHOLD} commits fresh records in transactions of
   * exactly {@code batchSize} records and leaves any remainder buffered; every other
   * reason commits all fresh records as one transaction. A failed batch is returned to the
   * front of the buffer, or dropped once it has failed {@code maxRetries + 1} times.
   *
   * @param category the category to flush
   * @param reason   why the flush happens
   * @return one event per attempted transaction, in order; for
   *     {@link FlushReason#SHUTDOWN} with nothing buffered, a single zero-size event
   */
  public List<FlushEvent> flushNow(Category category, FlushReason reason) {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(reason, "reason");
    Lane lane = lanes.get(category);
    CategoryBuffer buffer = buffers.get(category);
    List<FlushEvent> events = new ArrayList<>();
    lane.flushLock.lock();
    try {
      RetrySegment retry = buffer.takeRetry();
      if (retry != null && isScheduled(reason) && System.nanoTime() - retry.notBeforeNanos() < 0) {
        buffer.returnToFront(retry);
        return events;
      }
      lane.lastFlushNanos = System.nanoTime();

      if (retry != null) {
        FlushEvent event = execute(category, reason, retry.records());
        events.add(event);
        if (!event.committed()
            && handleFailure(buffer, retry.records(), retry.attempts() + 1, event.failure())) {
          return events;
        }
      }

      List<List<WriteRecord>> batches = takeBatches(buffer, reason);
      for (int i = 0; i < batches.size(); i++) {
        FlushEvent event = execute(category, reason, batches.get(i));
        events.add(event);
        if (!event.committed()) {
          List<WriteRecord> unflushed = new ArrayList<>();
          for (int j = i; j < batches.size(); j++) {
            unflushed.addAll(batches.get(j));
          }
          handleFailure(buffer, unflushed, 1, event.failure());
          break;
        }
      }

      if (events.isEmpty() && reason == FlushReason.SHUTDOWN) {
        FlushEvent noop = new FlushEvent(category, reason, 0, Instant.now(), 0L,
            FlushOutcome.COMMITTED, null);
        record(noop);
        events.add(noop);
      }
      return events;
    } finally {
      lane.flushLock.unlock();
      reportBufferSize(category);
    }
  }

  /**
   * Publishes the current length of {@code category}'s buffer to the metrics exporter.
   *
   * @param category the category
   */
  public void reportBufferSize(Category category) {
    try {
      exporter.recordBufferSize(category, buffers.get(category).size());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Metrics exporter failed", e);
    }
  }

  private List<List<WriteRecord>> takeBatches(CategoryBuffer buffer, FlushReason reason) {
    if (reason != FlushReason.SIZE_THRESHOLD) {
      List<WriteRecord> all = buffer.takeAll();
      return all.isEmpty() ? List.of() : List.of(all);
    }
    int batchSize = config.batchSize();
    List<WriteRecord> full = buffer.takeFullBatches(batchSize);
    List<List<WriteRecord>> batches = new ArrayList<>(full.size() / batchSize);
    for (int from = 0; from < full.size(); from += batchSize) {
      batches.add(full.subList(from, from + batchSize));
    }
    return batches;
  }

  private FlushEvent execute(Category category, FlushReason reason, List<WriteRecord> batch) {
    Instant startedAt = Instant.now();
    long start = System.nanoTime();
    BatchResult result;
    try {
      result = executor.executeBatch(category, batch);
    } catch (RuntimeException e) {
      result = BatchResult.failed(e);
    }
    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    FlushEvent event;
    if (result instanceof BatchResult.Failed failed) {
      event = new FlushEvent(category, reason, batch.size(), startedAt, durationMs,
          FlushOutcome.FAILED, failed.cause());
    } else {
      event = new FlushEvent(category, reason, batch.size(), startedAt, durationMs,
          FlushOutcome.COMMITTED, null);
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Flushed " + batch.size() + " " + category + " records in " + durationMs
            + " ms (reason: " + reason.key() + ")");
      }
    }
    record(event);
    return event;
  }

  /** Returns true if the batch went back to the buffer, false if it was dropped. */
  private boolean handleFailure(CategoryBuffer buffer, List<WriteRecord> records, int attempts,
      Throwable cause) {
    Category category = buffer.category();
    Lane lane = lanes.get(category);
    if (attempts > config.maxRetries()) {
      lane.dropped += records.size();
      lane.lastDropCause = cause;
      metrics.recordDropped(records.size());
      try {
        exporter.recordDropped(category, records.size());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Metrics exporter failed", e);
      }
      logger.log(Level.SEVERE, "Dropping " + records.size() + " " + category
          + " records after " + attempts + " failed attempts", cause);
      return false;
    }
    long delayMs = Math.max(0L, config.retryPolicy().computeDelayMs(attempts));
    buffer.returnToFront(new RetrySegment(records, attempts,
        System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs)));
    logger.log(Level.WARNING, "Flush of " + records.size() + " " + category
        + " records failed (attempt " + attempts + " of " + (config.maxRetries() + 1)
        + "); returned to buffer for retry", cause);
    return true;
  }

  private void record(FlushEvent event) {
    metrics.record(event);
    try {
      exporter.recordFlush(event);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Metrics exporter failed", e);
    }
  }

  private static boolean isScheduled(FlushReason reason) {
    return reason == FlushReason.SIZE_THRESHOLD || reason == FlushReason.TIME_INTERVAL;
  }

  public boolean isShutdown() {
    return shuttingDown;
  }

  /**
   * Returns the lock producers hold while admitting a record. {@link #shutdown()} takes
   * the exclusive side before the drain, so a record admitted under this lock is either
   * visible to the drain or rejected.
   *
   * @return the shared admission lock
   */
  public Lock admissionLock() {
    return admission.readLock();
  }

  /**
   * Stops the tick, drains every category with {@link FlushReason#SHUTDOWN}, and waits
   * for in-flight flushes, all within {@link WriteBufferConfig#shutdownTimeout()}.
   *
   * <p>Producers are refused before the drain starts. A batch that fails during the drain
   * is retried immediately until it commits or exhausts its retries, and the drain goes on
   * until the buffer is empty. Subsequent calls return immediately.
   *
   * @throws ShutdownTimeoutException if the drain did not finish in time; resources are
   *     released regardless
   * @throws FlushFailedException     if a category could not be drained or records were
   *     dropped during the drain
   */
  public synchronized void shutdown() {
    if (shuttingDown) {
      return;
    }
    admission.writeLock().lock();
    try {
      shuttingDown = true;
    } finally {
      admission.writeLock().unlock();
    }
    logger.info("Stopping flush scheduler and draining buffers");
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
    }

    Map<Category, Future<Drain>> drains = new EnumMap<>(Category.class);
    for (Category category : Category.values()) {
      drains.put(category, workers.submit(() -> drain(category)));
    }
    workers.shutdown();

    WriteBufferException failure = null;
    try {
      if (!workers.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        workers.shutdownNow();
        int pending = 0;
        for (CategoryBuffer buffer : buffers.values()) {
          pending += buffer.size();
        }
        logger.log(Level.SEVERE, "Shutdown drain exceeded {0} ms; {1} records still buffered",
            new Object[]{config.shutdownTimeout().toMillis(), pending});
        failure = new ShutdownTimeoutException(config.shutdownTimeout(), pending);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
      failure = new ShutdownTimeoutException(config.shutdownTimeout(), pendingRecords());
    }

    for (Map.Entry<Category, Future<Drain>> entry : drains.entrySet()) {
      FlushFailedException drainFailure = drainFailure(entry.getKey(), entry.getValue());
      if (drainFailure == null) {
        continue;
      }
      if (failure == null) {
        failure = drainFailure;
      } else {
        failure.addSuppressed(drainFailure);
      }
    }
    if (failure != null) {
      throw failure;
    }
    logger.info("Flush scheduler stopped");
  }

  private Drain drain(Category category) {
    Lane lane = lanes.get(category);
    CategoryBuffer buffer = buffers.get(category);
    lane.flushLock.lock();
    int droppedBefore;
    try {
      droppedBefore = lane.dropped;
    } finally {
      lane.flushLock.unlock();
    }
    List<FlushEvent> events = new ArrayList<>(flushNow(category, FlushReason.SHUTDOWN));
    while (buffer.size() > 0 && !Thread.currentThread().isInterrupted()) {
      List<FlushEvent> more = flushNow(category, FlushReason.SHUTDOWN);
      if (more.isEmpty()) {
        break;
      }
      events.addAll(more);
    }
    lane.flushLock.lock();
    try {
      return new Drain(events, lane.dropped - droppedBefore, lane.lastDropCause);
    } finally {
      lane.flushLock.unlock();
    }
  }

  private FlushFailedException drainFailure(Category category, Future<Drain> future) {
    if (!future.isDone()) {
      return null;
    }
    try {
      Drain drain = future.get();
      List<FlushEvent> events = drain.events();
      FlushEvent last = events.isEmpty() ? null : events.get(events.size() - 1);
      if (last != null && !last.committed()) {
        return new FlushFailedException(category, last.recordCount(), last.failure());
      }
      if (drain.dropped() > 0) {
        return new FlushFailedException(category, drain.dropped(), drain.dropCause());
      }
      return null;
    } catch (ExecutionException e) {
      return new FlushFailedException(category, 0, e.getCause());
    } catch (CancellationException e) {
      return new FlushFailedException(category, 0, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new FlushFailedException(category, 0, e);
    }
  }

  private int pendingRecords() {
    int pending = 0;
    for (CategoryBuffer buffer : buffers.values()) {
      pending += buffer.size();
    }
    return pending;
  }

  /**
   * Same as {@link #shutdown()}.
   */
  @Override
  public void close() {
    shutdown();
  }

  private static final class Lane {
    final ReentrantLock flushLock = new ReentrantLock();
    final AtomicBoolean scheduled = new AtomicBoolean();
    volatile long lastFlushNanos = System.nanoTime();
    // guarded by flushLock
    int dropped;
    Throwable lastDropCause;
  }

  private record Drain(List<FlushEvent> events, int dropped, Throwable dropCause) {
  }
}
