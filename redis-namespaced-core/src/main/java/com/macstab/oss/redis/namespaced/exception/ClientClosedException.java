/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.exception;

/** Operation or {@code init()} invoked after {@code close()}. A closed client stays closed. */
public class ClientClosedException extends ClientNotInitializedException {

  private static final long serialVersionUID = 1L;

  public ClientClosedException(final String namespace) {
    super(namespace, "Client for namespace '" + namespace + "' has been closed");
  }
}
