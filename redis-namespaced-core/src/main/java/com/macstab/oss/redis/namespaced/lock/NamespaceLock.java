/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.lock;

import com.macstab.oss.redis.namespaced.exception.LockAcquisitionException;

/**
 * Mutual exclusion scoped to one namespace, shared by every process talking to the same store.
 *
 * <pre>{@code
 * try (LockHandle ignored = lock.acquire()) {
 *   commands.set(key, value);
 * }
 * }</pre>
 */
public interface NamespaceLock {

  /** Store key holding the lock, {@code "<namespace>:lock"}. */
  String getKey();

  /**
   * Blocks until the lock is held by the caller.
   *
   * @return handle releasing the lock on close
   * @throws LockAcquisitionException acquire timeout elapsed, thread interrupted, or store error
   */
  LockHandle acquire();

  /** {@code true} when any owner currently holds the lock. */
  boolean isLocked();
}
