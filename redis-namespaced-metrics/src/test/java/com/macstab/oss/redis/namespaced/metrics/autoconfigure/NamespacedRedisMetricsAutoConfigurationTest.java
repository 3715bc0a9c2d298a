/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.metrics.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.macstab.oss.redis.namespaced.metrics.NamespacedRedisMetrics;
import com.macstab.oss.redis.namespaced.metrics.micrometer.MicrometerNamespacedRedisMetrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link NamespacedRedisMetricsAutoConfiguration}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>Use {@link ApplicationContextRunner} for Spring Boot auto-configuration testing
 *   <li>Test conditional bean creation (enabled/disabled/missing MeterRegistry)
 *   <li>Test user-defined bean takes precedence
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("NamespacedRedisMetricsAutoConfiguration")
class NamespacedRedisMetricsAutoConfigurationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(NamespacedRedisMetricsAutoConfiguration.class));

  @Test
  @DisplayName("Should create Micrometer metrics by default when a MeterRegistry exists")
  void shouldCreateMicrometerMetricsByDefault() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class)
        .run(
            context -> {
              // Assert
              assertThat(context).hasSingleBean(NamespacedRedisMetrics.class);
              assertThat(context.getBean(NamespacedRedisMetrics.class))
                  .isInstanceOf(MicrometerNamespacedRedisMetrics.class);
            });
  }

  @Test
  @DisplayName("Should create NOOP metrics when explicitly disabled")
  void shouldCreateNoOpMetricsWhenDisabled() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class)
        .withPropertyValues("management.metrics.namespaced-redis.enabled=false")
        .run(
            context -> {
              // Assert
              assertThat(context).hasSingleBean(NamespacedRedisMetrics.class);
              assertThat(context.getBean(NamespacedRedisMetrics.class))
                  .isSameAs(NamespacedRedisMetrics.NOOP);
            });
  }

  @Test
  @DisplayName("Should create NOOP metrics when MeterRegistry missing")
  void shouldCreateNoOpMetricsWhenMeterRegistryMissing() {
    // Arrange & Act - no MeterRegistry bean
    contextRunner.run(
        context -> {
          // Assert
          assertThat(context).hasSingleBean(NamespacedRedisMetrics.class);
          assertThat(context.getBean(NamespacedRedisMetrics.class))
              .isSameAs(NamespacedRedisMetrics.NOOP);
        });
  }

  @Test
  @DisplayName("Should back off when the user defines NamespacedRedisMetrics")
  void shouldNotCreateBeanWhenUserDefinesCustom() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class, CustomMetricsConfiguration.class)
        .run(
            context -> {
              // Assert
              assertThat(context).hasSingleBean(NamespacedRedisMetrics.class);
              assertThat(context.getBean(NamespacedRedisMetrics.class))
                  .isSameAs(CustomMetricsConfiguration.CUSTOM);
            });
  }

  @Test
  @DisplayName("Should bind properties")
  void shouldBindProperties() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class)
        .withPropertyValues(
            "management.metrics.namespaced-redis.connection-name=cache",
            "management.metrics.namespaced-redis.max-cache-size=50")
        .run(
            context -> {
              // Assert
              final var props = context.getBean(NamespacedRedisMetricsProperties.class);
              assertThat(props.isEnabled()).isTrue();
              assertThat(props.getConnectionName()).isEqualTo("cache");
              assertThat(props.getMaxCacheSize()).isEqualTo(50);
            });
  }

  /** Provides {@link SimpleMeterRegistry} bean for testing. */
  @Configuration
  static class MeterRegistryConfiguration {
    @Bean
    SimpleMeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  /** Provides a custom {@link NamespacedRedisMetrics} bean for testing precedence. */
  @Configuration
  static class CustomMetricsConfiguration {
    static final NamespacedRedisMetrics CUSTOM = new NamespacedRedisMetrics() {};

    @Bean
    NamespacedRedisMetrics customNamespacedRedisMetrics() {
      return CUSTOM;
    }
  }
}
