package io.livefeed.spring.boot;

import io.livefeed.ChangeCallback;
import io.livefeed.SubscriptionFailureListener;
import io.livefeed.coordinator.SubscriptionCoordinator;
import io.livefeed.health.StaleChannelMonitor;
import io.livefeed.spi.ChannelProvider;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class LiveFeedAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(LiveFeedAutoConfiguration.class))
      .withPropertyValues("livefeed.coordinator.inter-admission-delay-ms=0");

  @Test
  void createsCoordinatorAndRegistrar() {
    runner.withUserConfiguration(ProviderConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("subscriptionCoordinator"));
      assertTrue(ctx.containsBean("liveFeedSubscriptionRegistrar"));
      assertFalse(ctx.containsBean("staleChannelMonitor"));
      assertInstanceOf(SubscriptionCoordinator.class, ctx.getBean(SubscriptionCoordinator.class));
    });
  }

  @Test
  void backsOffWithoutChannelProvider() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("subscriptionCoordinator"));
      assertFalse(ctx.containsBean("liveFeedSubscriptionRegistrar"));
    });
  }

  @Test
  void coordinatorUsesProvidedChannelProvider() {
    runner.withUserConfiguration(ProviderConfig.class).run(ctx -> {
      var coordinator = ctx.getBean(SubscriptionCoordinator.class);
      var provider = ctx.getBean(TestChannelProvider.class);

      String id = coordinator.request("orders", () -> { });

      long deadline = System.currentTimeMillis() + 5_000;
      while (!coordinator.listActive().contains(id)) {
        assertTrue(System.currentTimeMillis() < deadline, "activation timed out");
        Thread.sleep(5);
      }
      assertEquals(java.util.List.of("orders"), provider.openedTopics);
    });
  }

  @Test
  void closingContextClosesChannels() {
    TestChannelProvider provider = new TestChannelProvider();
    runner.withBean(ChannelProvider.class, () -> provider).run(ctx -> {
      var coordinator = ctx.getBean(SubscriptionCoordinator.class);
      String id = coordinator.request("orders", () -> { });
      long deadline = System.currentTimeMillis() + 5_000;
      while (!coordinator.listActive().contains(id)) {
        assertTrue(System.currentTimeMillis() < deadline, "activation timed out");
        Thread.sleep(5);
      }
    });

    assertEquals(java.util.List.of("orders"), provider.closedTopics);
  }

  @Test
  void invalidCoordinatorSettingsFailStartup() {
    runner
        .withPropertyValues("livefeed.coordinator.max-retries=-1")
        .withUserConfiguration(ProviderConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class,
              findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void staleMonitorCreatedWhenEnabled() {
    runner
        .withPropertyValues("livefeed.stale-monitor.enabled=true",
            "livefeed.stale-monitor.idle-threshold=PT2M",
            "livefeed.stale-monitor.interval=PT1M")
        .withUserConfiguration(ProviderConfig.class).run(ctx -> {
          assertInstanceOf(StaleChannelMonitor.class, ctx.getBean(StaleChannelMonitor.class));
        });
  }

  @Test
  void registersAnnotatedSubscriptions() {
    runner.withUserConfiguration(ProviderConfig.class, SubscriberConfig.class).run(ctx -> {
      var registrar = ctx.getBean(LiveFeedSubscriptionRegistrar.class);
      assertTrue(registrar.subscriptionIds().containsKey("ordersRefresher"));
      assertTrue(registrar.subscriptionIds().get("ordersRefresher").startsWith("dashboard-orders-"));
    });
  }

  @Test
  void picksUpFailureListenerBean() {
    runner.withUserConfiguration(ProviderConfig.class, FailureListenerConfig.class).run(ctx -> {
      assertNotNull(ctx.getBean(SubscriptionCoordinator.class));
      assertNotNull(ctx.getBean(SubscriptionFailureListener.class));
    });
  }

  @Test
  void userDefinedCoordinatorWins() {
    runner.withUserConfiguration(ProviderConfig.class, CustomCoordinatorConfig.class).run(ctx -> {
      assertEquals(1, ctx.getBeansOfType(SubscriptionCoordinator.class).size());
      assertTrue(ctx.containsBean("customCoordinator"));
      assertFalse(ctx.containsBean("subscriptionCoordinator"));
    });
  }

  private static Throwable findRootCause(Throwable t) {
    Throwable cause = t;
    while (cause.getCause() != null && cause.getCause() != cause) {
      cause = cause.getCause();
    }
    return cause;
  }

  @LiveFeedSubscription(topic = "orders", scope = "dashboard", priority = 5)
  static class OrdersRefresher implements ChangeCallback {
    @Override
    public void onChange() {}
  }

  @Configuration
  static class ProviderConfig {
    @Bean
    TestChannelProvider channelProvider() {
      return new TestChannelProvider();
    }
  }

  @Configuration
  static class SubscriberConfig {
    @Bean
    OrdersRefresher ordersRefresher() {
      return new OrdersRefresher();
    }
  }

  @Configuration
  static class FailureListenerConfig {
    @Bean
    SubscriptionFailureListener failureListener() {
      return (id, key, attempts, cause) -> { };
    }
  }

  @Configuration
  static class CustomCoordinatorConfig {
    @Bean(destroyMethod = "close")
    SubscriptionCoordinator customCoordinator(ChannelProvider channelProvider) {
      return SubscriptionCoordinator.builder().channelProvider(channelProvider).build();
    }
  }
}
