/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.lock;

/**
 * Ownership of an acquired {@link NamespaceLock}. Closing releases the lock.
 *
 * <p>Idempotent: a second {@link #close()} does nothing. Never throws; a failed release is logged
 * and the lease expires on its own.
 */
public interface LockHandle extends AutoCloseable {

  /** Owner token written into the lock key. */
  String getToken();

  @Override
  void close();
}
