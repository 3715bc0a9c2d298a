/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.exception;

import lombok.Getter;

/** Operation invoked on a client whose connection and lock are not (yet) in place. */
@Getter
public class ClientNotInitializedException extends NamespacedRedisException {

  private static final long serialVersionUID = 1L;

  private final String namespace;

  public ClientNotInitializedException(final String namespace) {
    this(namespace, "Client for namespace '" + namespace + "' is not initialized, call init()");
  }

  protected ClientNotInitializedException(final String namespace, final String message) {
    super(message);
    this.namespace = namespace;
  }
}
