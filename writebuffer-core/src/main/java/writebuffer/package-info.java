/**
 * Root API of the write buffer: coalesces small, uniform writes into grouped JDBC
 * transactions while bounding added latency and memory.
 *
 * <h2>Core Design</h2>
 * <p>Producers write through a {@link writebuffer.WriteRecorder}. Each
 * {@linkplain writebuffer.Category category} (messages, consumptions, subscriptions) has
 * its own bounded FIFO {@linkplain writebuffer.buffer.CategoryBuffer buffer}. The
 * {@linkplain writebuffer.flush.FlushScheduler flush scheduler} commits a buffer when it
 * reaches {@code batchSize} records or when {@code flushInterval} has elapsed since its last
 * flush; a write into a full buffer flushes that category in the caller's thread first.
 * Shutdown drains every buffer. Each flush is one transaction executed by a
 * {@linkplain writebuffer.spi.BatchExecutor batch executor}: all of the batch is committed,
 * or none of it.
 *
 * <p>A failed batch is returned to the front of its buffer and retried before anything
 * newer, up to {@code maxRetries} times, then dropped and counted.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>writebuffer-core</b>: buffers, scheduler, metrics, SPIs (zero external deps)</li>
 *   <li><b>writebuffer-jdbc</b>: {@linkplain writebuffer.jdbc JDBC batch executor} and
 *       SQL dialects (H2, SQLite)</li>
 *   <li><b>writebuffer-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>writebuffer-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * var executor     = new JdbcBatchExecutor(connProvider, Dialects.detect(dataSource));
 *
 * try (WriteBuffer buffer = WriteBuffer.builder()
 *     .config(WriteBufferConfig.builder()
 *         .batchSize(100)
 *         .flushIntervalMs(50)
 *         .build())
 *     .batchExecutor(executor)
 *     .build()
 *     .start()) {
 *
 *   WriteRecorder recorder = buffer.recorder();
 *   recorder.recordMessage("orders", "m-1", Map.of("id", 1), "client-7");
 *   recorder.recordSubscription("sid-1", "client-7", "orders");
 *
 *   System.out.println(buffer.metrics().toMap());
 * }
 * }</pre>
 *
 * @see writebuffer.WriteBuffer
 * @see writebuffer.WriteRecorder
 * @see writebuffer.WriteBufferConfig
 */
package writebuffer;
