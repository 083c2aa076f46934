package writebuffer.spring.boot;

import writebuffer.WriteBuffer;
import writebuffer.WriteBufferConfig;
import writebuffer.WriteRecorder;
import writebuffer.flush.ExponentialBackoffRetryPolicy;
import writebuffer.flush.RetryPolicy;
import writebuffer.jdbc.DataSourceConnectionProvider;
import writebuffer.jdbc.InsertStatements;
import writebuffer.jdbc.JdbcBatchExecutor;
import writebuffer.jdbc.dialect.Dialects;
import writebuffer.jdbc.spi.Dialect;
import writebuffer.spi.BatchExecutor;
import writebuffer.spi.ConnectionProvider;
import writebuffer.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Auto-configuration for the write buffer.
 *
 * <p>Wires a started {@link WriteBuffer} from a {@link DataSource} and
 * {@link WriteBufferProperties}; the buffer is drained when the context closes.
 *
 * @see WriteBufferProperties
 * @see WriteBufferMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(WriteBuffer.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(WriteBufferProperties.class)
public class WriteBufferAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Dialect writeBufferDialect(DataSource dataSource, WriteBufferProperties props) {
    String name = props.getDialect();
    if (name != null && !name.isBlank()) {
      return Dialects.get(name);
    }
    return Dialects.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public InsertStatements insertStatements(Dialect dialect) {
    return dialect.insertStatements();
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(BatchExecutor.class)
  public JdbcBatchExecutor batchExecutor(ConnectionProvider connectionProvider,
      InsertStatements insertStatements) {
    return new JdbcBatchExecutor(connectionProvider, insertStatements);
  }

  @Bean
  @ConditionalOnMissingBean
  public WriteBufferConfig writeBufferConfig(WriteBufferProperties props) {
    return WriteBufferConfig.builder()
        .enabled(props.isEnabled())
        .batchSize(props.getBatchSize())
        .flushIntervalMs(props.getFlushIntervalMs())
        .maxBufferSize(props.getMaxBufferSize())
        .maxRetries(props.getMaxRetries())
        .shutdownTimeout(Duration.ofMillis(props.getShutdownTimeoutMs()))
        .retryPolicy(retryPolicy(props.getRetry()))
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public WriteBuffer writeBuffer(WriteBufferConfig config, BatchExecutor batchExecutor,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return WriteBuffer.builder()
        .config(config)
        .batchExecutor(batchExecutor)
        .metricsExporter(metricsProvider.getIfAvailable())
        .build()
        .start();
  }

  @Bean
  @ConditionalOnMissingBean
  public WriteRecorder writeRecorder(WriteBuffer writeBuffer) {
    return writeBuffer.recorder();
  }

  private static RetryPolicy retryPolicy(WriteBufferProperties.Retry retry) {
    if (retry.getBaseDelayMs() <= 0) {
      return RetryPolicy.NEXT_TRIGGER;
    }
    return new ExponentialBackoffRetryPolicy(Duration.ofMillis(retry.getBaseDelayMs()),
        Duration.ofMillis(Math.max(retry.getBaseDelayMs(), retry.getMaxDelayMs())));
  }
}
