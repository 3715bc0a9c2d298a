/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.redis.namespaced.metrics.NamespacedRedisMetrics;
import com.macstab.oss.redis.namespaced.metrics.micrometer.MicrometerNamespacedRedisMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot auto-configuration for namespaced Redis metrics.
 *
 * <p><strong>Activation Conditions:</strong>
 *
 * <ol>
 *   <li>{@code MeterRegistry.class} on classpath (Micrometer present)
 *   <li>{@code MeterRegistry} bean exists (Spring Boot Actuator configured)
 *   <li>{@code management.metrics.namespaced-redis.enabled=true} (default: true)
 * </ol>
 *
 * <p><strong>Bean Created:</strong>
 *
 * <ul>
 *   <li>If conditions met: {@code MicrometerNamespacedRedisMetrics}
 *   <li>Otherwise: {@link NamespacedRedisMetrics#NOOP}
 * </ul>
 *
 * <p>The starter's {@code RedisConnectionManager} bean picks the metrics bean up through an {@code
 * ObjectProvider}, so the starter works with or without this module.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(NamespacedRedisMetricsProperties.class)
public class NamespacedRedisMetricsAutoConfiguration {

  /**
   * Micrometer-backed collector.
   *
   * @param registry Micrometer meter registry (injected by Spring Boot Actuator)
   * @param properties metrics configuration properties
   * @return Micrometer metrics collector with dimensional tags
   */
  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.namespaced-redis",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(NamespacedRedisMetrics.class)
  public NamespacedRedisMetrics micrometerNamespacedRedisMetrics(
      final MeterRegistry registry, final NamespacedRedisMetricsProperties properties) {

    log.info(
        "Activating namespaced Redis metrics (Micrometer) - connection: '{}', maxCacheSize: {}",
        properties.getConnectionName(),
        properties.getMaxCacheSize());

    return new MicrometerNamespacedRedisMetrics(
        registry, properties.getConnectionName(), properties.getMaxCacheSize());
  }

  /**
   * No-op collector when metrics are disabled or no registry exists.
   *
   * @return {@link NamespacedRedisMetrics#NOOP}
   */
  @Bean
  @ConditionalOnMissingBean(NamespacedRedisMetrics.class)
  public NamespacedRedisMetrics noOpNamespacedRedisMetrics() {
    log.debug("Namespaced Redis metrics disabled - using NOOP singleton");
    return NamespacedRedisMetrics.NOOP;
  }
}
