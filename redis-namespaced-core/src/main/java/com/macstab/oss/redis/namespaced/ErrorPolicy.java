/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

import com.macstab.oss.redis.namespaced.exception.StoreOperationException;

/** What a {@link NamespacedRedisClient} does when the store fails during an operation. */
public enum ErrorPolicy {

  /**
   * Log the failure and return a neutral result ({@code null}, empty list, {@code 0}, nothing).
   * Default.
   */
  SWALLOW,

  /** Log the failure and throw {@link StoreOperationException}. */
  PROPAGATE
}
