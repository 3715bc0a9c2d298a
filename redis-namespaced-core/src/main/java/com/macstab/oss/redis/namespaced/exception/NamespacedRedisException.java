/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.exception;

/**
 * Base type of every failure surfaced by the namespaced client.
 *
 * <p>Unchecked, like Lettuce's own {@code RedisException}: callers decide where to catch.
 */
public class NamespacedRedisException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public NamespacedRedisException(final String message) {
    super(message);
  }

  public NamespacedRedisException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
