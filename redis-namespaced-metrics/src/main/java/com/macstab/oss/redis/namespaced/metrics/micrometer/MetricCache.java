/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.metrics.micrometer;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache for Micrometer meter instances.
 *
 * <p><strong>Problem:</strong> Micrometer registry lookup with tag matching costs a builder
 * allocation plus a map lookup per call. Recording methods run on every store operation.
 *
 * <p><strong>Solution:</strong> Cache {@code Counter}, {@code Timer} and gauge-backing {@code
 * AtomicInteger} instances in {@code ConcurrentHashMap}s. First access registers the meter,
 * subsequent accesses reuse the cached instance.
 *
 * <p><strong>Graceful Degradation:</strong> When the cache exceeds {@code maxCacheSize} (e.g. an
 * unbounded set of channel names), meters are registered directly without caching (slower but
 * works). Each such miss logs a warning.
 *
 * <p><strong>Key Format:</strong> {@code metric.name:tag1=value1:tag2=value2} (tags in call order,
 * callers always pass them in the same order).
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters;
  private final ConcurrentHashMap<String, Timer> timers;
  private final ConcurrentHashMap<String, AtomicInteger> gaugeValues;
  private final ConcurrentHashMap<String, Meter.Id> gaugeIds;
  private final AtomicInteger cacheSize;

  /**
   * Creates metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }

    this.registry = registry;
    this.maxCacheSize = maxCacheSize;
    this.counters = new ConcurrentHashMap<>(64);
    this.timers = new ConcurrentHashMap<>(16);
    this.gaugeValues = new ConcurrentHashMap<>(16);
    this.gaugeIds = new ConcurrentHashMap<>(16);
    this.cacheSize = new AtomicInteger(0);
  }

  /**
   * Gets or creates counter with tags.
   *
   * @param name metric name (e.g., "redis.lettuce.namespaced.operations")
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return counter instance (cached or direct)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Counter getOrCreateCounter(
      final String name, final String description, final String... tagPairs) {

    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);

    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return counters.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return createCounter(name, description, tagPairs);
          });
    }

    log.warn(
        "Metric cache full at {} entries. Direct registry used for counter: {}",
        maxCacheSize,
        key);
    return createCounter(name, description, tagPairs);
  }

  /**
   * Gets or creates timer with tags.
   *
   * @param name metric name (e.g., "redis.lettuce.namespaced.lock.wait")
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return timer instance (cached or direct)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Timer getOrCreateTimer(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = timers.get(key);

    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return timers.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return createTimer(name, description, tagPairs);
          });
    }

    log.warn(
        "Metric cache full at {} entries. Direct registry used for timer: {}", maxCacheSize, key);
    return createTimer(name, description, tagPairs);
  }

  /**
   * Gets or creates gauge value (AtomicInteger) with tags.
   *
   * <p><strong>Memory Management:</strong> Gauges hold strong references, {@link
   * #removeMetersForConnection(String)} unregisters them.
   *
   * @param name metric name (e.g., "redis.lettuce.namespaced.clients.open")
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return AtomicInteger holding gauge value
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  AtomicInteger getOrCreateGaugeValue(
      final String name, final String description, final String... tagPairs) {

    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = gaugeValues.get(key);

    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return gaugeValues.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            final var gaugeValue = new AtomicInteger(0);
            gaugeIds.put(k, createGauge(name, description, gaugeValue, tagPairs).getId());
            return gaugeValue;
          });
    }

    log.warn(
        "Metric cache full at {} entries. Direct registry used for gauge: {}", maxCacheSize, key);
    final var gaugeValue = new AtomicInteger(0);
    createGauge(name, description, gaugeValue, tagPairs);
    return gaugeValue;
  }

  /**
   * Unregisters every cached gauge of a pool and drops its cached counters and timers.
   *
   * <p><strong>When called:</strong> {@code MicrometerNamespacedRedisMetrics.close(connectionName)}
   *
   * @param connectionName pool name whose meters are removed
   */
  void removeMetersForConnection(final String connectionName) {
    final var pattern = ":" + MetricsConfiguration.TAG_CONNECTION_NAME + "=" + connectionName;

    gaugeValues
        .keySet()
        .removeIf(
            key -> {
              if (!belongsTo(key, pattern)) {
                return false;
              }
              final var id = gaugeIds.remove(key);
              if (id != null) {
                registry.remove(id);
              }
              cacheSize.decrementAndGet();
              log.debug("Removed gauge for connection {}: {}", connectionName, key);
              return true;
            });

    counters.keySet().removeIf(key -> evict(key, pattern));
    timers.keySet().removeIf(key -> evict(key, pattern));
  }

  private boolean evict(final String key, final String pattern) {
    if (belongsTo(key, pattern)) {
      cacheSize.decrementAndGet();
      return true;
    }
    return false;
  }

  // Exact tag value match: "conn=a" must not match "conn=ab"
  private static boolean belongsTo(final String key, final String pattern) {
    return key.endsWith(pattern) || key.contains(pattern + ":");
  }

  /**
   * Builds cache key from metric name and tag pairs.
   *
   * @param name metric name
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return cache key
   */
  private String buildKey(final String name, final String... tagPairs) {
    final int capacity = 32 + (tagPairs.length / 2 * 25);
    final var key = new StringBuilder(capacity);

    key.append(name);

    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }

    return key.toString();
  }

  private Counter createCounter(
      final String name, final String description, final String... tagPairs) {
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  private Timer createTimer(final String name, final String description, final String... tagPairs) {
    return Timer.builder(name).description(description).tags(tagPairs).register(registry);
  }

  private Gauge createGauge(
      final String name,
      final String description,
      final AtomicInteger value,
      final String... tagPairs) {
    return Gauge.builder(name, value, AtomicInteger::get)
        .description(description)
        .tags(tagPairs)
        .register(registry);
  }

  /**
   * Validates tag pairs array (must be even length).
   *
   * @throws IllegalArgumentException if length is odd
   */
  private void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }

  /** Current cache size (for testing/monitoring). */
  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }
}
