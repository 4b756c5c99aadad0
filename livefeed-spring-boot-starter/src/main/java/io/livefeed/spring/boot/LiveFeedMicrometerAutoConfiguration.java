package io.livefeed.spring.boot;

import io.livefeed.micrometer.MicrometerMetricsExporter;
import io.livefeed.spi.MetricsExporter;
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
 * and {@code livefeed.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link LiveFeedAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the coordinator.
 */
@AutoConfiguration(before = LiveFeedAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "livefeed.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LiveFeedProperties.class)
public class LiveFeedMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, LiveFeedProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
