package writebuffer.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import writebuffer.Category;
import writebuffer.WriteBuffer;
import writebuffer.WriteRecord;
import writebuffer.flush.FlushEvent;
import writebuffer.flush.FlushOutcome;
import writebuffer.flush.FlushReason;
import writebuffer.spi.BatchResult;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  private static FlushEvent event(Category category, FlushReason reason, int size, FlushOutcome outcome) {
    return new FlushEvent(category, reason, size, Instant.now(), 12L, outcome,
        outcome == FlushOutcome.FAILED ? new SQLException("locked") : null);
  }

  @Test
  void committedFlushCountsRecordsAndBatchSize() {
    exporter.recordFlush(event(Category.MESSAGE, FlushReason.SIZE_THRESHOLD, 100, FlushOutcome.COMMITTED));
    exporter.recordFlush(event(Category.MESSAGE, FlushReason.TIME_INTERVAL, 40, FlushOutcome.COMMITTED));

    assertEquals(1.0, flushCounter("size", "committed").count());
    assertEquals(1.0, flushCounter("time", "committed").count());
    assertEquals(140.0, categoryCounter("writebuffer.records.committed", "message").count());
    DistributionSummary sizes = registry.get("writebuffer.batch.size").tag("category", "message").summary();
    assertEquals(2, sizes.count());
    assertEquals(100.0, sizes.max());
    Timer duration = registry.get("writebuffer.flush.duration").tag("category", "message").timer();
    assertEquals(24.0, duration.totalTime(TimeUnit.MILLISECONDS));
  }

  @Test
  void failedFlushCommitsNothing() {
    exporter.recordFlush(event(Category.CONSUMPTION, FlushReason.OVERFLOW, 150, FlushOutcome.FAILED));

    assertEquals(1.0, flushCounter("overflow", "failed").count());
    assertEquals(0.0, categoryCounter("writebuffer.records.committed", "consumption").count());
    assertEquals(0, registry.get("writebuffer.batch.size").tag("category", "consumption").summary().count());
  }

  @Test
  void zeroSizeShutdownFlushIsCountedOnly() {
    exporter.recordFlush(event(Category.SUBSCRIPTION, FlushReason.SHUTDOWN, 0, FlushOutcome.COMMITTED));

    assertEquals(1.0, flushCounter("shutdown", "committed").count());
    assertEquals(0, registry.get("writebuffer.batch.size").tag("category", "subscription").summary().count());
  }

  @Test
  void droppedRecordsPerCategory() {
    exporter.recordDropped(Category.CONSUMPTION, 50);

    assertEquals(50.0, categoryCounter("writebuffer.records.dropped", "consumption").count());
    assertEquals(0.0, categoryCounter("writebuffer.records.dropped", "message").count());
  }

  @Test
  void bufferSizeGaugeFollowsLatestValue() {
    exporter.recordBufferSize(Category.MESSAGE, 42);
    assertEquals(42.0, gauge("message").value());

    exporter.recordBufferSize(Category.MESSAGE, 0);
    assertEquals(0.0, gauge("message").value());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(custom, "audit.writebuffer");

    prefixed.recordDropped(Category.MESSAGE, 3);

    assertEquals(3.0, custom.get("audit.writebuffer.records.dropped").tag("category", "message")
        .counter().count());
    assertNull(custom.find("writebuffer.records.dropped").counter());
  }

  @Test
  void invalidPrefixIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "app."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterEvents() {
    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    exporter.recordFlush(event(Category.MESSAGE, FlushReason.MANUAL, 1, FlushOutcome.COMMITTED));
    exporter.recordDropped(Category.MESSAGE, 1);
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void writeBufferReportsThroughExporter() {
    WriteBuffer buffer = WriteBuffer.builder()
        .batchExecutor((category, records) -> BatchResult.committed(records.size()))
        .metricsExporter(exporter)
        .build();
    buffer.recorder().record(WriteRecord.message("orders", "m-1", "{}", "client-7", Instant.now()));
    buffer.recorder().recordMessage("orders", "m-2", "{}", "client-7");
    assertEquals(2.0, gauge("message").value());

    buffer.flushAll();

    assertEquals(1.0, flushCounter("manual", "committed").count());
    assertEquals(2.0, categoryCounter("writebuffer.records.committed", "message").count());
    assertEquals(0.0, gauge("message").value());

    buffer.close();
    assertTrue(registry.getMeters().isEmpty());
  }

  private Counter flushCounter(String reason, String outcome) {
    return registry.get("writebuffer.flush").tag("reason", reason).tag("outcome", outcome).counter();
  }

  private Counter categoryCounter(String name, String category) {
    return registry.get(name).tag("category", category).counter();
  }

  private Gauge gauge(String category) {
    return registry.get("writebuffer.buffer.size").tag("category", category).gauge();
  }
}
