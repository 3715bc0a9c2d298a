/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.metrics.micrometer;

import static com.macstab.oss.redis.namespaced.metrics.micrometer.MetricsConfiguration.*;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import com.macstab.oss.redis.namespaced.metrics.NamespacedRedisMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link NamespacedRedisMetrics} with dimensional tags.
 *
 * <p><strong>Dimensional Metrics:</strong> every meter carries {@code connection.name} (the pool
 * this instance is bound to) and {@code namespace}, so one dashboard splits load and failures per
 * pool and per namespace.
 *
 * <p><strong>Metrics Published:</strong>
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Extra tags</th><th>Purpose</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr>
 *       <td>{@code redis.lettuce.namespaced.operations}</td>
 *       <td>Counter</td>
 *       <td>operation, outcome</td>
 *       <td>Failure rate (swallowed errors are otherwise only logged)</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.lettuce.namespaced.lock.wait}</td>
 *       <td>Timer</td>
 *       <td>-</td>
 *       <td>Lock contention per namespace</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.lettuce.namespaced.lock.timeouts}</td>
 *       <td>Counter</td>
 *       <td>-</td>
 *       <td>Lock acquisitions that gave up</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.lettuce.namespaced.messages.delivered}</td>
 *       <td>Counter</td>
 *       <td>channel</td>
 *       <td>Pub/Sub throughput</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.lettuce.namespaced.messages.dropped}</td>
 *       <td>Counter</td>
 *       <td>channel</td>
 *       <td>Messages lost to a full subscription buffer (slow handler)</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.lettuce.namespaced.clients.open}</td>
 *       <td>Gauge</td>
 *       <td>-</td>
 *       <td>Pooled connections held by clients</td>
 *     </tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Lifecycle:</strong> {@link #close(String)} for the bound pool removes its gauges and
 * turns every recording method into a no-op.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MicrometerNamespacedRedisMetrics implements NamespacedRedisMetrics {

  public static final int DEFAULT_MAX_CACHE_SIZE = 1000;

  private final MetricCache cache;
  private final String connectionName;

  private volatile boolean closed = false;

  public MicrometerNamespacedRedisMetrics(
      @NonNull final MeterRegistry registry,
      @NonNull final String connectionName,
      final int maxCacheSize) {

    this.connectionName = connectionName;
    this.cache = new MetricCache(registry, maxCacheSize);

    log.debug(
        "Created MicrometerNamespacedRedisMetrics for connection '{}' (maxCacheSize: {})",
        connectionName,
        maxCacheSize);
  }

  public MicrometerNamespacedRedisMetrics(
      @NonNull final MeterRegistry registry, @NonNull final String connectionName) {
    this(registry, connectionName, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void recordOperation(
      final String namespace, final String operation, final boolean success) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            OPERATIONS,
            "Redis round trips issued by namespaced clients",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_NAMESPACE,
            namespace,
            TAG_OPERATION,
            operation,
            TAG_OUTCOME,
            success ? OUTCOME_SUCCESS : OUTCOME_FAILURE)
        .increment();
  }

  @Override
  public void recordLockWait(final String namespace, final Duration waited) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateTimer(
            LOCK_WAIT,
            "Time spent acquiring the namespace lock",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_NAMESPACE,
            namespace)
        .record(waited);
  }

  @Override
  public void recordLockTimeout(final String namespace) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            LOCK_TIMEOUTS,
            "Namespace lock acquisitions that gave up",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_NAMESPACE,
            namespace)
        .increment();
  }

  @Override
  public void recordMessageDelivered(final String namespace, final String channel) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            MESSAGES_DELIVERED,
            "Pub/Sub messages handed to subscription handlers",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_NAMESPACE,
            namespace,
            TAG_CHANNEL,
            channel)
        .increment();
  }

  @Override
  public void recordMessageDropped(final String namespace, final String channel) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            MESSAGES_DROPPED,
            "Pub/Sub messages dropped because the subscription buffer was full",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_NAMESPACE,
            namespace,
            TAG_CHANNEL,
            channel)
        .increment();
  }

  @Override
  public void recordClientOpened(final String namespace) {
    if (closed) {
      return;
    }

    clientsOpen(namespace).incrementAndGet();
  }

  @Override
  public void recordClientClosed(final String namespace) {
    if (closed) {
      return;
    }

    clientsOpen(namespace).updateAndGet(v -> Math.max(0, v - 1));
  }

  @Override
  public void close(final String connectionName) {
    if (closed) {
      return;
    }

    if (!this.connectionName.equals(connectionName)) {
      log.warn(
          "Ignoring close for connection '{}' (this instance tracks '{}')",
          connectionName,
          this.connectionName);
      return;
    }

    closed = true;

    try {
      cache.removeMetersForConnection(connectionName);
      log.info("Closed MicrometerNamespacedRedisMetrics for connection '{}'", connectionName);
    } catch (final RuntimeException e) {
      // Called from RedisConnectionManager.close(), must not throw
      log.error("Error during metrics cleanup for connection '{}'", connectionName, e);
    }
  }

  private AtomicInteger clientsOpen(final String namespace) {
    return cache.getOrCreateGaugeValue(
        CLIENTS_OPEN,
        "Initialized namespaced clients holding a pooled connection",
        TAG_CONNECTION_NAME,
        connectionName,
        TAG_NAMESPACE,
        namespace);
  }

  String getConnectionName() {
    return connectionName;
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }
}
