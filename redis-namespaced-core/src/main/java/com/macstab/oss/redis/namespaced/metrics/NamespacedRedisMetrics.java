/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.metrics;

import java.time.Duration;

/**
 * Framework-agnostic metrics interface for namespaced Redis clients.
 *
 * <p><strong>Design Pattern:</strong> Interface with default no-op methods. Implementations
 * override only the methods they need, core library calls all methods safely (no null checks).
 *
 * <p><strong>Implementations:</strong>
 *
 * <ul>
 *   <li>{@link #NOOP} - Zero-overhead singleton (uses default methods)
 *   <li>{@code MicrometerNamespacedRedisMetrics} - Micrometer integration (Spring Boot Actuator)
 * </ul>
 *
 * <p><strong>Lifecycle:</strong>
 *
 * <ol>
 *   <li>Created by Spring Boot auto-configuration or manually
 *   <li>Injected into {@code RedisConnectionManager} (optional, defaults to {@link #NOOP})
 *   <li>{@link #close(String)} called when the manager closes
 * </ol>
 *
 * <p><strong>Thread Safety:</strong> Implementations MUST be thread-safe. Every client sharing a
 * manager records concurrently.
 *
 * <p><strong>Dimensions:</strong> the implementation is bound to one pool ({@code connection.name})
 * at construction. Methods carry the namespace, so dashboards can split load and failures per
 * namespace.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
public interface NamespacedRedisMetrics {

  /** No-op singleton instance (uses default methods). */
  NamespacedRedisMetrics NOOP = new NamespacedRedisMetrics() {};

  /**
   * Records one store round trip.
   *
   * <p><strong>Expected Metric Name:</strong> {@code redis.lettuce.namespaced.operations}
   *
   * <p><strong>Expected Tags:</strong> {@code connection.name}, {@code namespace}, {@code
   * operation}, {@code outcome} ({@code success} | {@code failure})
   *
   * <p>Failures counted here are the ones the client degraded to a soft result (or propagated,
   * depending on the error policy). They are otherwise only visible in the logs.
   *
   * @param namespace client namespace
   * @param operation operation name ({@code get}, {@code set}, {@code keys}, {@code sadd}, {@code
   *     publish}, {@code subscribe})
   * @param success {@code true} when the store answered without error
   */
  default void recordOperation(String namespace, String operation, boolean success) {
    // No-op by default
  }

  /**
   * Records how long a caller waited for the namespace lock.
   *
   * <p><strong>Metric Type:</strong> Timer ({@code redis.lettuce.namespaced.lock.wait})
   *
   * @param namespace lock namespace
   * @param waited time between first {@code SET NX} attempt and success
   */
  default void recordLockWait(String namespace, Duration waited) {
    // No-op by default
  }

  /**
   * Records a lock acquisition that gave up (timeout, interrupt or store error).
   *
   * @param namespace lock namespace
   */
  default void recordLockTimeout(String namespace) {
    // No-op by default
  }

  /**
   * Records one data message handed to a subscription handler.
   *
   * @param namespace subscribing client namespace
   * @param channel channel the message arrived on
   */
  default void recordMessageDelivered(String namespace, String channel) {
    // No-op by default
  }

  /**
   * Records one data message dropped because the subscription buffer was full.
   *
   * <p><strong>Metric Type:</strong> Counter ({@code redis.lettuce.namespaced.messages.dropped})
   *
   * @param namespace subscribing client namespace
   * @param channel channel the message arrived on
   */
  default void recordMessageDropped(String namespace, String channel) {
    // No-op by default
  }

  /**
   * Client in {@code namespace} finished {@code init()}.
   *
   * <p><strong>Metric Type:</strong> Gauge ({@code redis.lettuce.namespaced.clients.open})
   */
  default void recordClientOpened(String namespace) {
    // No-op by default
  }

  /** Client in {@code namespace} returned its connection. */
  default void recordClientClosed(String namespace) {
    // No-op by default
  }

  /**
   * Releases resources for a pool (removes gauges).
   *
   * <p>Called by {@code RedisConnectionManager.close()}. MUST NOT throw.
   *
   * @param connectionName pool name
   */
  default void close(String connectionName) {
    // No-op by default
  }
}
