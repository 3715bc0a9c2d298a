/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.slf4j.Slf4j;

/**
 * Cancellation signal for {@link NamespacedRedisClient#subscribe}.
 *
 * <p>{@link #cancel()} may be called from any thread, any number of times. The subscribe loop is
 * woken immediately, it does not wait for the next message or poll timeout.
 */
@Slf4j
public final class SubscriptionToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();

  private SubscriptionToken() {}

  public static SubscriptionToken create() {
    return new SubscriptionToken();
  }

  /** Requests the subscription to end. Idempotent. */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }

    for (final var listener : listeners) {
      try {
        listener.run();
      } catch (final RuntimeException e) {
        log.warn("Cancellation listener failed", e);
      }
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Registers a callback run on cancel; runs it right away when already cancelled. */
  void onCancel(final Runnable listener) {
    listeners.add(listener);
    if (cancelled.get() && listeners.remove(listener)) {
      listener.run();
    }
  }

  void removeOnCancel(final Runnable listener) {
    listeners.remove(listener);
  }
}
