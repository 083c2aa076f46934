package writebuffer.spring.boot;

import writebuffer.Category;
import writebuffer.WriteBuffer;
import writebuffer.WriteBufferConfig;
import writebuffer.WriteRecord;
import writebuffer.WriteRecorder;
import writebuffer.flush.ExponentialBackoffRetryPolicy;
import writebuffer.flush.RetryPolicy;
import writebuffer.jdbc.DataSourceConnectionProvider;
import writebuffer.jdbc.JdbcBatchExecutor;
import writebuffer.jdbc.dialect.H2Dialect;
import writebuffer.jdbc.dialect.SqliteDialect;
import writebuffer.jdbc.spi.Dialect;
import writebuffer.spi.BatchExecutor;
import writebuffer.spi.BatchResult;
import writebuffer.spi.ConnectionProvider;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class WriteBufferAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          WriteBufferAutoConfiguration.class))
      .withPropertyValues("spring.sql.init.schema-locations=classpath:schema.sql");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("writeBufferDialect"));
      assertTrue(ctx.containsBean("insertStatements"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("batchExecutor"));
      assertTrue(ctx.containsBean("writeBufferConfig"));
      assertTrue(ctx.containsBean("writeBuffer"));
      assertTrue(ctx.containsBean("writeRecorder"));

      assertInstanceOf(H2Dialect.class, ctx.getBean(Dialect.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(JdbcBatchExecutor.class, ctx.getBean(BatchExecutor.class));
      assertSame(ctx.getBean(WriteBuffer.class).recorder(), ctx.getBean(WriteRecorder.class));
      assertFalse(ctx.getBean(WriteBuffer.class).isShutdown());
    });
  }

  @Test
  void mapsPropertiesToConfig() {
    runner.withPropertyValues(
        "writebuffer.batch-size=20",
        "writebuffer.flush-interval-ms=200",
        "writebuffer.max-buffer-size=40",
        "writebuffer.max-retries=1",
        "writebuffer.shutdown-timeout-ms=1000",
        "writebuffer.retry.base-delay-ms=10",
        "writebuffer.retry.max-delay-ms=80"
    ).run(ctx -> {
      WriteBufferConfig config = ctx.getBean(WriteBufferConfig.class);
      assertEquals(20, config.batchSize());
      assertEquals(Duration.ofMillis(200), config.flushInterval());
      assertEquals(40, config.maxBufferSize());
      assertEquals(1, config.maxRetries());
      assertEquals(Duration.ofSeconds(1), config.shutdownTimeout());
      assertInstanceOf(ExponentialBackoffRetryPolicy.class, config.retryPolicy());
      assertEquals(80, config.retryPolicy().computeDelayMs(10));
      assertSame(config, ctx.getBean(WriteBuffer.class).config());
    });
  }

  @Test
  void zeroBaseDelayRetriesOnNextTrigger() {
    runner.run(ctx -> assertSame(RetryPolicy.NEXT_TRIGGER,
        ctx.getBean(WriteBufferConfig.class).retryPolicy()));
  }

  @Test
  void explicitDialectOverridesDetection() {
    runner.withPropertyValues("writebuffer.dialect=sqlite").run(ctx ->
        assertInstanceOf(SqliteDialect.class, ctx.getBean(Dialect.class)));
  }

  @Test
  void unknownDialectFailsStartup() {
    runner.withPropertyValues("writebuffer.dialect=oracle").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
    });
  }

  @Test
  void invalidSettingsFailStartup() {
    runner.withPropertyValues("writebuffer.batch-size=100", "writebuffer.max-buffer-size=50")
        .run(ctx -> assertNotNull(ctx.getStartupFailure()));
  }

  @Test
  void recordsAreCommittedToDataSource() {
    runner.run(ctx -> {
      WriteRecorder recorder = ctx.getBean(WriteRecorder.class);
      recorder.recordMessage("orders", "m-1", "{\"id\":1}", "client-7");
      recorder.recordConsumption("client-8", "orders", "m-1", "{\"id\":1}");
      recorder.recordSubscription("sid-1", "client-8", "orders");
      recorder.recordSubscription("sid-1", "client-9", "orders");

      ctx.getBean(WriteBuffer.class).flushAll();

      DataSource dataSource = ctx.getBean(DataSource.class);
      assertEquals(1, count(dataSource, "messages"));
      assertEquals(1, count(dataSource, "consumptions"));
      assertEquals(1, count(dataSource, "subscriptions"));
    });
  }

  @Test
  void closingContextDrainsBuffer() {
    List<WriteRecord> committed = new CopyOnWriteArrayList<>();
    runner.withBean(BatchExecutor.class, () -> (category, records) -> {
      committed.addAll(records);
      return BatchResult.committed(records.size());
    }).withPropertyValues("writebuffer.flush-interval-ms=60000").run(ctx -> {
      WriteBuffer buffer = ctx.getBean(WriteBuffer.class);
      WriteRecorder recorder = buffer.recorder();
      for (int i = 0; i < 5; i++) {
        recorder.recordMessage("orders", "m-" + i, "{}", "client-7");
      }
      assertTrue(committed.isEmpty());

      ctx.close();

      assertEquals(5, committed.size());
      assertTrue(buffer.isShutdown());
    });
  }

  @Test
  void disabledBatchingWritesThrough() {
    runner.withPropertyValues("writebuffer.enabled=false").run(ctx -> {
      ctx.getBean(WriteRecorder.class).recordMessage("orders", "m-1", "{}", "client-7");

      assertEquals(1, count(ctx.getBean(DataSource.class), "messages"));
      assertEquals(0, ctx.getBean(WriteBuffer.class).bufferSize(Category.MESSAGE));
    });
  }

  @Test
  void respectsCustomBatchExecutor() {
    runner.withUserConfiguration(CustomExecutorConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("batchExecutor"));
      assertSame(CustomExecutorConfig.EXECUTOR, ctx.getBean(BatchExecutor.class));
    });
  }

  @Test
  void backsOffWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(WriteBufferAutoConfiguration.class))
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertFalse(ctx.containsBean("writeBuffer"));
        });
  }

  private static int count(DataSource dataSource, String table) throws Exception {
    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  @Configuration
  static class CustomExecutorConfig {
    static final BatchExecutor EXECUTOR = (category, records) -> BatchResult.committed(records.size());

    @Bean
    BatchExecutor customBatchExecutor() {
      return EXECUTOR;
    }
  }
}
