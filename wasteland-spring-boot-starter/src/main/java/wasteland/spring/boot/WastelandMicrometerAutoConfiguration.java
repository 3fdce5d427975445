package wasteland.spring.boot;

import wasteland.micrometer.MicrometerMetricsExporter;
import wasteland.spi.MetricsExporter;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code wasteland.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link WastelandAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the client.
 */
@AutoConfiguration(before = WastelandAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "wasteland.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WastelandProperties.class)
public class WastelandMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, WastelandProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
