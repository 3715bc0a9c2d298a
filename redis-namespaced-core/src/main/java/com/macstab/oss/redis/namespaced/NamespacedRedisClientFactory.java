/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

import static lombok.AccessLevel.PRIVATE;

import com.macstab.oss.redis.namespaced.exception.StoreConnectionException;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * Creates {@link NamespacedRedisClient}s that share one manager and one set of options.
 *
 * <p>The Spring starter exposes this as a bean. Clients are not cached: every call returns a new
 * client with its own borrowed connection, which the caller closes.
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public class NamespacedRedisClientFactory {

  @Getter RedisConnectionManager manager;
  @Getter NamespacedClientOptions options;

  public NamespacedRedisClientFactory(@NonNull final RedisConnectionManager manager) {
    this(manager, NamespacedClientOptions.defaults());
  }

  public NamespacedRedisClientFactory(
      @NonNull final RedisConnectionManager manager,
      @NonNull final NamespacedClientOptions options) {
    this.manager = manager;
    this.options = options;
  }

  /** Uninitialized client (no I/O). */
  public NamespacedRedisClient create(@NonNull final String namespace) {
    return new NamespacedRedisClient(namespace, manager, options);
  }

  /**
   * Initialized client.
   *
   * @throws StoreConnectionException no connection could be borrowed
   */
  public NamespacedRedisClient open(@NonNull final String namespace) {
    return create(namespace).init();
  }
}
