package supportbus.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import supportbus.micrometer.MicrometerMetricsExporter;
import supportbus.spi.MetricsExporter;

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
 * and {@code supportbus.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link SupportBusAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the bus.
 */
@AutoConfiguration(before = SupportBusAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "supportbus.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SupportBusProperties.class)
public class SupportBusMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, SupportBusProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
