/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.spring3;

import java.util.Optional;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import com.macstab.oss.redis.namespaced.ConnectionSettings;
import com.macstab.oss.redis.namespaced.NamespacedRedisClientFactory;
import com.macstab.oss.redis.namespaced.RedisConnectionManager;
import com.macstab.oss.redis.namespaced.metrics.NamespacedRedisMetrics;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration for namespaced Redis clients.
 *
 * <p>Active unless {@code spring.data.redis.namespaced.enabled=false}. Contributes:
 *
 * <ul>
 *   <li>{@link RedisConnectionManager} - explicit (non-shared) pool built from {@link
 *       RedisProperties} and {@link NamespacedRedisProperties}, closed with the context
 *   <li>{@link NamespacedRedisClientFactory} - creates clients bound to that pool
 * </ul>
 *
 * <p>Both back off when the application defines its own bean. A {@link NamespacedRedisMetrics}
 * bean (e.g. from the metrics module) is picked up when present.
 *
 * <p><strong>Usage:</strong>
 *
 * <pre>{@code
 * try (var client = factory.open("orders")) {
 *   client.set("order:1", "{...}");
 * }
 * }</pre>
 *
 * <p>Creating the beans performs no I/O: pooled connections open when the first client
 * initializes.
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "com.macstab.oss.redis.namespaced.metrics.autoconfigure"
            + ".NamespacedRedisMetricsAutoConfiguration")
@ConditionalOnClass(RedisClient.class)
@ConditionalOnProperty(
    name = "spring.data.redis.namespaced.enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties({RedisProperties.class, NamespacedRedisProperties.class})
public class NamespacedRedisAutoConfiguration {

  /**
   * Creates the connection manager.
   *
   * @param redisProperties Spring Boot Redis properties
   * @param properties namespaced pool properties
   * @param metricsProvider metrics collector provider (optional, for observability)
   * @return manager owning the connection pool
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(RedisConnectionManager.class)
  public RedisConnectionManager namespacedRedisConnectionManager(
      final RedisProperties redisProperties,
      final NamespacedRedisProperties properties,
      final ObjectProvider<NamespacedRedisMetrics> metricsProvider) {

    final var settings = buildSettings(redisProperties, properties);
    final var metrics = Optional.ofNullable(metricsProvider.getIfAvailable());

    if (log.isInfoEnabled()) {
      log.info(
          "Redis namespaced pool '{}': host={}:{}, maxConnections={}, metrics={}",
          settings.getName(),
          settings.getHost(),
          Integer.valueOf(settings.getPort()),
          Integer.valueOf(settings.getMaxConnections()),
          metrics.isPresent() ? "enabled" : "disabled");
    }

    return new RedisConnectionManager(settings, metrics);
  }

  /**
   * Creates the client factory.
   *
   * @param manager connection manager
   * @param properties namespaced pool properties (client options)
   * @return factory for namespaced clients
   */
  @Bean
  @ConditionalOnMissingBean(NamespacedRedisClientFactory.class)
  public NamespacedRedisClientFactory namespacedRedisClientFactory(
      final RedisConnectionManager manager, final NamespacedRedisProperties properties) {
    return new NamespacedRedisClientFactory(manager, properties.toClientOptions());
  }

  // Package-private for testing
  static ConnectionSettings buildSettings(
      final RedisProperties redisProperties, final NamespacedRedisProperties properties) {

    final var builder =
        ConnectionSettings.builder()
            .maxConnections(properties.getMaxConnections())
            .borrowTimeout(properties.getBorrowTimeout())
            .commandTimeout(redisProperties.getTimeout())
            .name(properties.getName());

    // URL overrides all individual properties
    if (StringUtils.hasText(redisProperties.getUrl())) {
      applyUrl(builder, redisProperties.getUrl());
    } else {
      builder
          .host(redisProperties.getHost())
          .port(redisProperties.getPort())
          .database(redisProperties.getDatabase());

      if (StringUtils.hasText(redisProperties.getUsername())) {
        builder.username(redisProperties.getUsername());
      }
      if (StringUtils.hasText(redisProperties.getPassword())) {
        builder.password(redisProperties.getPassword());
      }
    }

    return builder.build();
  }

  /**
   * Applies a connection URL.
   *
   * <p>Parses {@code redis://[user:password@]host[:port][/database]}.
   */
  @SuppressWarnings("deprecation") // RedisURI#getPassword returns char[]
  private static void applyUrl(
      final ConnectionSettings.ConnectionSettingsBuilder builder, final String url) {
    final RedisURI uri = RedisURI.create(url);

    builder.host(uri.getHost()).port(uri.getPort()).database(uri.getDatabase());

    if (uri.getUsername() != null) {
      builder.username(uri.getUsername());
    }
    if (uri.getPassword() != null && uri.getPassword().length > 0) {
      builder.password(new String(uri.getPassword()));
    }
  }
}
