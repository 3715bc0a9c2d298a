/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for namespaced Redis metrics.
 *
 * <pre>
 * management:
 *   metrics:
 *     namespaced-redis:
 *       enabled: true
 *       connection-name: primary
 *       max-cache-size: 1000
 * </pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.namespaced-redis")
public class NamespacedRedisMetricsProperties {

  /** Enable Micrometer metrics (requires a {@code MeterRegistry} bean). */
  private boolean enabled = true;

  /**
   * Value of the {@code connection.name} tag. Distinguishes several pools (primary, cache, ...) in
   * one registry. Must equal the pool name ({@code spring.data.redis.namespaced.name}) for the
   * pool's gauges to be removed when it closes.
   */
  private String connectionName = "default";

  /**
   * Upper bound of cached meter instances. Beyond it meters are registered without caching.
   *
   * <p>Rough size: namespaces × (operations × 2 outcomes + channels + 3).
   */
  private int maxCacheSize = 1000;
}
