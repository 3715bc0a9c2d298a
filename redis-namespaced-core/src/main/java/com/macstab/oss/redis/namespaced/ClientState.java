/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

/**
 * Lifecycle of a {@link NamespacedRedisClient}. Transitions only move forward, except a failed
 * init which returns to {@link #UNINITIALIZED}.
 */
public enum ClientState {
  UNINITIALIZED,
  INITIALIZING,
  READY,
  CLOSED
}
