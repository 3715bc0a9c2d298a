/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.testutil;

import java.time.Duration;

import org.testcontainers.containers.GenericContainer;
import org.testcontainers.utility.DockerImageName;

import com.macstab.oss.redis.namespaced.ConnectionSettings;

/**
 * Factory for the Redis Testcontainers used by the integration tests.
 *
 * <pre>{@code
 * @Container static final GenericContainer<?> REDIS = RedisTestContainers.createStandalone();
 *
 * ConnectionSettings settings = RedisTestContainers.settingsFor(REDIS).toBuilder()
 *     .maxConnections(2)
 *     .build();
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
public final class RedisTestContainers {

  private RedisTestContainers() {
    throw new UnsupportedOperationException("Utility class");
  }

  /** Standalone Redis container (no auth, no SSL), not yet started. */
  public static GenericContainer<?> createStandalone() {
    return new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
        .withExposedPorts(6379)
        .withStartupTimeout(Duration.ofSeconds(30))
        .withReuse(false);
  }

  /** Connection settings pointing at a started container, every other field default. */
  public static ConnectionSettings settingsFor(final GenericContainer<?> redis) {
    return ConnectionSettings.builder()
        .host(redis.getHost())
        .port(redis.getFirstMappedPort())
        .commandTimeout(Duration.ofSeconds(5))
        .borrowTimeout(Duration.ofSeconds(2))
        .build();
  }
}
