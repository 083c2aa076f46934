package writebuffer.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import writebuffer.micrometer.MicrometerMetricsExporter;
import writebuffer.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code writebuffer.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link WriteBufferAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the write buffer.
 */
@AutoConfiguration(before = WriteBufferAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "writebuffer.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WriteBufferProperties.class)
public class WriteBufferMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, WriteBufferProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
