/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.exception;

/**
 * Store unreachable, pool exhausted past the borrow timeout, or pool already closed.
 *
 * <p>Raised while a client initializes. Never raised by {@code close()}, which logs instead.
 */
public class StoreConnectionException extends NamespacedRedisException {

  private static final long serialVersionUID = 1L;

  public StoreConnectionException(final String message) {
    super(message);
  }

  public StoreConnectionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
