/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link SubscriptionToken} cancellation and wake-up callbacks. */
@DisplayName("SubscriptionToken")
class SubscriptionTokenTest {

  @Test
  @DisplayName("New token is not cancelled")
  void newTokenActive() {
    assertThat(SubscriptionToken.create().isCancelled()).isFalse();
  }

  @Test
  @DisplayName("cancel() runs listeners exactly once")
  void cancelRunsListenersOnce() {
    // Arrange
    final var token = SubscriptionToken.create();
    final var calls = new AtomicInteger();
    token.onCancel(calls::incrementAndGet);

    // Act
    token.cancel();
    token.cancel();

    // Assert
    assertThat(token.isCancelled()).isTrue();
    assertThat(calls).hasValue(1);
  }

  @Test
  @DisplayName("Listener registered after cancel() runs immediately")
  void lateListenerRunsImmediately() {
    // Arrange
    final var token = SubscriptionToken.create();
    token.cancel();
    final var calls = new AtomicInteger();

    // Act
    token.onCancel(calls::incrementAndGet);

    // Assert
    assertThat(calls).hasValue(1);
  }

  @Test
  @DisplayName("Removed listener is not run")
  void removedListenerSkipped() {
    // Arrange
    final var token = SubscriptionToken.create();
    final var calls = new AtomicInteger();
    final Runnable listener = calls::incrementAndGet;
    token.onCancel(listener);
    token.removeOnCancel(listener);

    // Act
    token.cancel();

    // Assert
    assertThat(calls).hasValue(0);
  }

  @Test
  @DisplayName("Failing listener does not stop the others")
  void failingListenerIsolated() {
    // Arrange
    final var token = SubscriptionToken.create();
    final var calls = new AtomicInteger();
    token.onCancel(
        () -> {
          throw new IllegalStateException("boom");
        });
    token.onCancel(calls::incrementAndGet);

    // Act
    token.cancel();

    // Assert
    assertThat(calls).hasValue(1);
  }
}
