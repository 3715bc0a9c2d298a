/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.exception;

import lombok.Getter;

/**
 * Store error during a single operation, thrown only under {@code ErrorPolicy.PROPAGATE}.
 *
 * <p>Under the default {@code SWALLOW} policy the same failure is logged and the operation returns
 * its soft-failure value instead.
 */
@Getter
public class StoreOperationException extends NamespacedRedisException {

  private static final long serialVersionUID = 1L;

  /** Operation name ({@code get}, {@code set}, {@code keys}, ...). */
  private final String operation;

  private final String namespace;

  /** Key, pattern or channel the operation targeted. */
  private final String target;

  public StoreOperationException(
      final String operation, final String namespace, final String target, final Throwable cause) {
    super(
        String.format(
            "Redis %s on '%s' failed for namespace '%s': %s",
            operation, target, namespace, cause.getMessage()),
        cause);
    this.operation = operation;
    this.namespace = namespace;
    this.target = target;
  }
}
