package io.livefeed.spring.boot;

import io.livefeed.SubscriptionFailureListener;
import io.livefeed.coordinator.ExponentialBackoffRetryPolicy;
import io.livefeed.coordinator.SubscriptionCoordinator;
import io.livefeed.health.StaleChannelMonitor;
import io.livefeed.spi.ChannelProvider;
import io.livefeed.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the live-feed subscription coordinator.
 *
 * <p>Wires a {@link SubscriptionCoordinator} from the application's
 * {@link ChannelProvider} bean and {@link LiveFeedProperties}. An optional
 * {@link MetricsExporter} and {@link SubscriptionFailureListener} bean are picked up
 * when present. Beans annotated with {@link LiveFeedSubscription} are subscribed once
 * the context is initialized.
 *
 * @see LiveFeedProperties
 * @see LiveFeedMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(SubscriptionCoordinator.class)
@ConditionalOnBean(ChannelProvider.class)
@EnableConfigurationProperties(LiveFeedProperties.class)
public class LiveFeedAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public SubscriptionCoordinator subscriptionCoordinator(LiveFeedProperties props,
      ChannelProvider channelProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<SubscriptionFailureListener> failureListenerProvider) {

    var coordinatorProps = props.getCoordinator();
    var builder = SubscriptionCoordinator.builder()
        .channelProvider(channelProvider)
        .maxRetries(coordinatorProps.getMaxRetries())
        .admissionTimeoutMs(coordinatorProps.getAdmissionTimeoutMs())
        .interAdmissionDelayMs(coordinatorProps.getInterAdmissionDelayMs())
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()));

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    SubscriptionFailureListener failureListener = failureListenerProvider.getIfAvailable();
    if (failureListener != null) {
      builder.failureListener(failureListener);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public LiveFeedSubscriptionRegistrar liveFeedSubscriptionRegistrar(
      ListableBeanFactory beanFactory, SubscriptionCoordinator coordinator) {
    return new LiveFeedSubscriptionRegistrar(beanFactory, coordinator);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "livefeed.stale-monitor", name = "enabled", havingValue = "true")
  public StaleChannelMonitor staleChannelMonitor(LiveFeedProperties props,
      SubscriptionCoordinator coordinator) {
    StaleChannelMonitor monitor = StaleChannelMonitor.builder()
        .coordinator(coordinator)
        .idleThreshold(props.getStaleMonitor().getIdleThreshold())
        .interval(props.getStaleMonitor().getInterval())
        .build();
    monitor.start();
    return monitor;
  }
}
