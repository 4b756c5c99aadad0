package io.livefeed.spring.boot;

import io.livefeed.micrometer.MicrometerMetricsExporter;
import io.livefeed.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiveFeedMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LiveFeedMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("livefeed.metrics.name-prefix=admin.livefeed").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("admin.livefeed.request.accepted").counter());
            assertNotNull(registry.find("admin.livefeed.queue.depth").gauge());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("livefeed.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void coordinatorReportsThroughMicrometer() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        LiveFeedMicrometerAutoConfiguration.class,
                        LiveFeedAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class)
                .withBean(TestChannelProvider.class, TestChannelProvider::new)
                .withPropertyValues("livefeed.coordinator.inter-admission-delay-ms=0")
                .run(ctx -> {
                    var coordinator = ctx.getBean(io.livefeed.coordinator.SubscriptionCoordinator.class);
                    coordinator.request("orders", () -> { });
                    coordinator.request("orders", () -> { });

                    var registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.find("livefeed.request.accepted").counter().count());
                    assertEquals(1.0, registry.find("livefeed.request.deduplicated").counter().count());
                });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
