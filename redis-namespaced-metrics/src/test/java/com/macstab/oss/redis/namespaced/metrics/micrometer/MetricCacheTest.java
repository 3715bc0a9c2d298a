/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.metrics.micrometer;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link MetricCache}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("MetricCache")
class MetricCacheTest {

  private SimpleMeterRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
  }

  @Nested
  @DisplayName("Constructor")
  class Constructor {

    @Test
    @DisplayName("should create empty cache with valid parameters")
    void shouldCreateCacheWithValidParameters() {
      // Arrange + Act
      final var cache = new MetricCache(registry, 1000);

      // Assert
      assertThat(cache.getMaxCacheSize()).isEqualTo(1000);
      assertThat(cache.getCacheSize()).isZero();
    }

    @Test
    @DisplayName("should reject null registry")
    void shouldRejectNullRegistry() {
      // Arrange + Act + Assert
      assertThatNullPointerException()
          .isThrownBy(() -> new MetricCache(null, 1000))
          .withMessageContaining("registry");
    }

    @Test
    @DisplayName("should reject zero max cache size")
    void shouldRejectZeroMaxCacheSize() {
      // Arrange + Act + Assert
      assertThatIllegalArgumentException()
          .isThrownBy(() -> new MetricCache(registry, 0))
          .withMessageContaining("maxCacheSize must be > 0");
    }
  }

  @Nested
  @DisplayName("Counter Caching")
  class CounterCaching {

    @Test
    @DisplayName("should return the cached counter for identical tags")
    void shouldCacheCounter() {
      // Arrange
      final var cache = new MetricCache(registry, 1000);

      // Act
      final var first =
          cache.getOrCreateCounter("test.counter", "d", "connection.name", "primary", "ns", "a");
      final var second =
          cache.getOrCreateCounter("test.counter", "d", "connection.name", "primary", "ns", "a");

      // Assert
      assertThat(first).isSameAs(second);
      assertThat(cache.getCacheSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("should create separate counters for different tag values")
    void shouldSeparateByTags() {
      // Arrange
      final var cache = new MetricCache(registry, 1000);

      // Act
      final var first =
          cache.getOrCreateCounter("test.counter", "d", "connection.name", "primary", "ns", "a");
      final var second =
          cache.getOrCreateCounter("test.counter", "d", "connection.name", "primary", "ns", "b");

      // Assert
      assertThat(first).isNotSameAs(second);
      assertThat(cache.getCacheSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject odd-length tag pairs")
    void shouldRejectOddLengthTagPairs() {
      // Arrange
      final var cache = new MetricCache(registry, 1000);

      // Act + Assert
      assertThatIllegalArgumentException()
          .isThrownBy(() -> cache.getOrCreateCounter("test.counter", "d", "connection.name"))
          .withMessageContaining("even length");
    }
  }

  @Nested
  @DisplayName("Cache Limit")
  class CacheLimit {

    @Test
    @DisplayName("should keep registering meters beyond the limit without caching")
    void shouldDegradeGracefully() {
      // Arrange
      final var cache = new MetricCache(registry, 1);
      cache.getOrCreateCounter("test.counter", "d", "ns", "a");

      // Act
      final var uncached = cache.getOrCreateCounter("test.counter", "d", "ns", "b");
      uncached.increment();

      // Assert
      assertThat(cache.getCacheSize()).isEqualTo(1);
      assertThat(registry.get("test.counter").tag("ns", "b").counter().count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Gauges")
  class Gauges {

    @Test
    @DisplayName("should back the registered gauge with the returned value holder")
    void shouldBackGauge() {
      // Arrange
      final var cache = new MetricCache(registry, 1000);

      // Act
      cache.getOrCreateGaugeValue("test.gauge", "d", "connection.name", "primary").set(3);

      // Assert
      assertThat(registry.get("test.gauge").tag("connection.name", "primary").gauge().value())
          .isEqualTo(3.0);
    }
  }

  @Nested
  @DisplayName("Removal")
  class Removal {

    @Test
    @DisplayName("should remove gauges of the named connection only")
    void shouldRemoveOnlyMatchingConnection() {
      // Arrange
      final var cache = new MetricCache(registry, 1000);
      cache.getOrCreateGaugeValue("test.gauge", "d", "connection.name", "a", "ns", "x");
      cache.getOrCreateGaugeValue("test.gauge", "d", "connection.name", "ab", "ns", "x");
      cache.getOrCreateCounter("test.counter", "d", "connection.name", "a");

      // Act
      cache.removeMetersForConnection("a");

      // Assert
      assertThat(registry.find("test.gauge").tag("connection.name", "a").gauge()).isNull();
      assertThat(registry.find("test.gauge").tag("connection.name", "ab").gauge()).isNotNull();
      assertThat(cache.getCacheSize()).isEqualTo(1);
    }
  }
}
