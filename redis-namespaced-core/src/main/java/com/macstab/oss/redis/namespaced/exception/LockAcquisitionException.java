/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.exception;

import lombok.Getter;

/**
 * Namespace lock not acquired: timed out, interrupted, or the store failed during {@code SET NX}.
 *
 * <p>Always propagated, independent of the client's error policy. The guarded operation did not
 * run.
 */
@Getter
public class LockAcquisitionException extends NamespacedRedisException {

  private static final long serialVersionUID = 1L;

  private final String lockKey;

  public LockAcquisitionException(final String lockKey, final String message) {
    super(message);
    this.lockKey = lockKey;
  }

  public LockAcquisitionException(
      final String lockKey, final String message, final Throwable cause) {
    super(message, cause);
    this.lockKey = lockKey;
  }
}
