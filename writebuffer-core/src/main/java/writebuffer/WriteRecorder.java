package writebuffer;

import writebuffer.buffer.CategoryBuffer;
import writebuffer.flush.FlushEvent;
import writebuffer.flush.FlushReason;
import writebuffer.flush.FlushScheduler;
import writebuffer.spi.BatchExecutor;
import writebuffer.spi.BatchResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for producers: records message, consumption and subscription writes.
 *
 * <p>With batching enabled a write only appends to its category buffer and returns; the
 * record is committed later by a size, time, overflow or shutdown flush. A write into a
 * full buffer first flushes that category in the calling thread. With batching disabled
 * every write is committed immediately in its own transaction.
 *
 * <p>Thread-safe; obtain instances from {@link WriteBuffer#recorder()}.
 *
 * @see WriteBuffer
 */
public final class WriteRecorder {
    private static final Logger logger = Logger.getLogger(WriteRecorder.class.getName());

    private final WriteBufferConfig config;
    private final Map<Category, CategoryBuffer> buffers;
    private final FlushScheduler scheduler;
    private final BatchExecutor executor;

    WriteRecorder(
            WriteBufferConfig config,
            Map<Category, CategoryBuffer> buffers,
            FlushScheduler scheduler,
            BatchExecutor executor
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.buffers = Objects.requireNonNull(buffers, "buffers");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Records a published message.
     *
     * @param topic     the topic it was published to
     * @param messageId the message id
     * @param message   the payload; non-string payloads are stored as JSON
     * @param producer  the publishing client
     * @param timestamp when it was published
     */
    public void recordMessage(String topic, String messageId, Object message, String producer,
            Instant timestamp) {
        record(WriteRecord.message(topic, messageId, message, producer, timestamp));
    }

    /**
     * Records a published message timestamped now.
     */
    public void recordMessage(String topic, String messageId, Object message, String producer) {
        recordMessage(topic, messageId, message, producer, Instant.now());
    }

    /**
     * Records a message delivered to a consumer.
     *
     * @param consumer  the consuming client
     * @param topic     the topic
     * @param messageId the message id
     * @param message   the payload; non-string payloads are stored as JSON
     * @param timestamp when it was consumed
     */
    public void recordConsumption(String consumer, String topic, String messageId,
            Object message, Instant timestamp) {
        record(WriteRecord.consumption(consumer, topic, messageId, message, timestamp));
    }

    public void recordConsumption(String consumer, String topic, String messageId,
            Object message) {
        recordConsumption(consumer, topic, messageId, message, Instant.now());
    }

    /**
     * Records that session {@code sid} subscribed to {@code topic}. A later subscription
     * of the same session and topic replaces the earlier row.
     *
     * @param sid         the session id
     * @param consumer    the consuming client
     * @param topic       the topic
     * @param connectedAt when the subscription was made
     */
    public void recordSubscription(String sid, String consumer, String topic, Instant connectedAt) {
        record(WriteRecord.subscription(sid, consumer, topic, connectedAt));
    }

    public void recordSubscription(String sid, String consumer, String topic) {
        recordSubscription(sid, consumer, topic, Instant.now());
    }

    /**
     * Records a prebuilt write.
     *
     * @param record the write
     * @throws IllegalStateException    if the write buffer is shutting down
     * @throws EnqueueRejectedException if the buffer was full and the overflow flush failed
     * @throws FlushFailedException     if batching is disabled and the write failed to commit
     */
    public void record(WriteRecord record) {
        Objects.requireNonNull(record, "record");
        Lock admission = scheduler.admissionLock();
        admission.lock();
        try {
            if (scheduler.isShutdown()) {
                throw new IllegalStateException("Write buffer is shut down");
            }
            if (!config.enabled()) {
                writeThrough(record);
                return;
            }
            enqueue(record);
        } finally {
            admission.unlock();
        }
    }

    private void enqueue(WriteRecord record) {
        Category category = record.category();
        CategoryBuffer buffer = buffers.get(category);
        while (!buffer.enqueue(record)) {
            Throwable failure = null;
            for (FlushEvent event : scheduler.flushNow(category, FlushReason.OVERFLOW)) {
                if (!event.committed()) {
                    failure = event.failure();
                }
            }
            if (failure != null) {
                // a dropped batch still frees room
                if (buffer.enqueue(record)) {
                    break;
                }
                throw new EnqueueRejectedException(category, buffer.size(), failure);
            }
        }
        scheduler.reportBufferSize(category);
        if (buffer.size() >= config.batchSize()) {
            scheduler.requestFlush(category);
        }
    }

    private void writeThrough(WriteRecord record) {
        BatchResult result;
        try {
            result = executor.executeBatch(record.category(), List.of(record));
        } catch (RuntimeException e) {
            result = BatchResult.failed(e);
        }
        if (result instanceof BatchResult.Failed failed) {
            logger.log(Level.WARNING, "Unbatched " + record.category() + " write failed",
                failed.cause());
            throw new FlushFailedException(record.category(), 1, failed.cause());
        }
    }
}
