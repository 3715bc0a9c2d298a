/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric names and tag keys of the Micrometer integration.
 *
 * <p><strong>Naming Convention:</strong> {@code redis.lettuce.namespaced.*}
 *
 * <ul>
 *   <li>{@code redis} - Domain
 *   <li>{@code lettuce} - Client library
 *   <li>{@code namespaced} - Feature
 * </ul>
 *
 * <p><strong>Prometheus Output:</strong> Micrometer's {@code PrometheusNamingConvention} converts
 * dots to underscores:
 *
 * <pre>
 * redis.lettuce.namespaced.operations → redis_lettuce_namespaced_operations_total
 * redis.lettuce.namespaced.lock.wait  → redis_lettuce_namespaced_lock_wait_seconds
 * </pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class MetricsConfiguration {

  /** Metric name prefix (hierarchical: domain.client.feature). */
  public static final String PREFIX = "redis.lettuce.namespaced";

  /**
   * Store round trips.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code namespace}, {@code operation}, {@code
   * outcome}
   *
   * <p><strong>Usage:</strong> failure rate per namespace. Under the {@code SWALLOW} error policy
   * this is the only signal besides the log.
   */
  public static final String OPERATIONS = PREFIX + ".operations";

  /**
   * Time spent acquiring the namespace lock.
   *
   * <p><strong>Type:</strong> Timer
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code namespace}
   */
  public static final String LOCK_WAIT = PREFIX + ".lock.wait";

  /**
   * Lock acquisitions that gave up.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code namespace}
   */
  public static final String LOCK_TIMEOUTS = PREFIX + ".lock.timeouts";

  /**
   * Pub/Sub messages handed to subscription handlers.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code namespace}, {@code channel}
   */
  public static final String MESSAGES_DELIVERED = PREFIX + ".messages.delivered";

  /**
   * Pub/Sub messages dropped because the subscription buffer was full.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code namespace}, {@code channel}
   */
  public static final String MESSAGES_DROPPED = PREFIX + ".messages.dropped";

  /**
   * Initialized, not yet closed clients (each holds one pooled connection).
   *
   * <p><strong>Type:</strong> Gauge
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code namespace}
   */
  public static final String CLIENTS_OPEN = PREFIX + ".clients.open";

  // Tag keys
  public static final String TAG_CONNECTION_NAME = "connection.name";
  public static final String TAG_NAMESPACE = "namespace";
  public static final String TAG_OPERATION = "operation";
  public static final String TAG_OUTCOME = "outcome";
  public static final String TAG_CHANNEL = "channel";

  public static final String OUTCOME_SUCCESS = "success";
  public static final String OUTCOME_FAILURE = "failure";
}
