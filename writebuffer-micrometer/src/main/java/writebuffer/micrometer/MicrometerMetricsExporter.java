package writebuffer.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import writebuffer.Category;
import writebuffer.flush.FlushEvent;
import writebuffer.flush.FlushOutcome;
import writebuffer.flush.FlushReason;
import writebuffer.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers meters with a {@link MeterRegistry} for export to Prometheus, Grafana,
 * Datadog, and other monitoring backends. Every meter except the flush counter carries a
 * {@code category} tag ({@code message}, {@code consumption}, {@code subscription}).
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code writebuffer.flush}: flush attempts, tagged {@code reason} and
 *       {@code outcome}</li>
 *   <li>{@code writebuffer.records.committed}: records committed</li>
 *   <li>{@code writebuffer.records.dropped}: records dropped after exhausting retries</li>
 * </ul>
 *
 * <h3>Timers and summaries</h3>
 * <ul>
 *   <li>{@code writebuffer.flush.duration}: transaction duration per flush attempt</li>
 *   <li>{@code writebuffer.batch.size}: records per committed non-empty flush</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code writebuffer.buffer.size}: buffer length, updated on every accepted write
 *       and after every flush</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final List<Meter> meters = new ArrayList<>();
  private final Map<FlushReason, Map<FlushOutcome, Counter>> flushes = new EnumMap<>(FlushReason.class);
  private final Map<Category, Counter> committed = new EnumMap<>(Category.class);
  private final Map<Category, Counter> dropped = new EnumMap<>(Category.class);
  private final Map<Category, Timer> durations = new EnumMap<>(Category.class);
  private final Map<Category, DistributionSummary> batchSizes = new EnumMap<>(Category.class);
  private final Map<Category, AtomicInteger> bufferSizes = new EnumMap<>(Category.class);
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "writebuffer"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "writebuffer");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "audit.writebuffer"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;

    for (FlushReason reason : FlushReason.values()) {
      Map<FlushOutcome, Counter> byOutcome = new EnumMap<>(FlushOutcome.class);
      for (FlushOutcome outcome : FlushOutcome.values()) {
        byOutcome.put(outcome, track(Counter.builder(namePrefix + ".flush")
            .description("Flush attempts")
            .tag("reason", reason.key())
            .tag("outcome", tagValue(outcome))
            .register(registry)));
      }
      flushes.put(reason, byOutcome);
    }

    for (Category category : Category.values()) {
      String tag = tagValue(category);
      committed.put(category, track(Counter.builder(namePrefix + ".records.committed")
          .description("Records committed")
          .tag("category", tag)
          .register(registry)));
      dropped.put(category, track(Counter.builder(namePrefix + ".records.dropped")
          .description("Records dropped after exhausting retries")
          .tag("category", tag)
          .register(registry)));
      durations.put(category, track(Timer.builder(namePrefix + ".flush.duration")
          .description("Duration of one flush transaction")
          .tag("category", tag)
          .register(registry)));
      batchSizes.put(category, track(DistributionSummary.builder(namePrefix + ".batch.size")
          .description("Records per committed flush")
          .tag("category", tag)
          .register(registry)));
      AtomicInteger size = new AtomicInteger();
      bufferSizes.put(category, size);
      track(Gauge.builder(namePrefix + ".buffer.size", size, AtomicInteger::get)
          .description("Records currently buffered")
          .tag("category", tag)
          .register(registry));
    }
  }

  @Override
  public void recordFlush(FlushEvent event) {
    if (closed) return;
    flushes.get(event.reason()).get(event.outcome()).increment();
    durations.get(event.category()).record(event.durationMs(), TimeUnit.MILLISECONDS);
    if (event.committed() && event.recordCount() > 0) {
      committed.get(event.category()).increment(event.recordCount());
      batchSizes.get(event.category()).record(event.recordCount());
    }
  }

  @Override
  public void recordDropped(Category category, int recordCount) {
    if (closed) return;
    dropped.get(category).increment(recordCount);
  }

  @Override
  public void recordBufferSize(Category category, int size) {
    if (closed) return;
    bufferSizes.get(category).set(size);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link writebuffer.WriteBuffer#close()} to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private <M extends Meter> M track(M meter) {
    meters.add(meter);
    return meter;
  }

  private static String tagValue(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }
}
