/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Per-client behaviour: error policy, namespace-lock timing and subscription buffering.
 *
 * <pre>{@code
 * NamespacedClientOptions options =
 *     NamespacedClientOptions.builder()
 *         .errorPolicy(ErrorPolicy.PROPAGATE)
 *         .lockAcquireTimeout(Duration.ofSeconds(2))
 *         .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class NamespacedClientOptions {

  @Builder.Default ErrorPolicy errorPolicy = ErrorPolicy.SWALLOW;

  /** Expiry of the lock key, bounds how long a crashed owner blocks the namespace. */
  @Builder.Default Duration lockLease = Duration.ofSeconds(30);

  /** How long {@code set}/{@code sadd} wait for the namespace lock before failing. */
  @Builder.Default Duration lockAcquireTimeout = Duration.ofSeconds(10);

  @Builder.Default Duration lockRetryInterval = Duration.ofMillis(100);

  /** Upper bound between liveness checks of an idle subscription. */
  @Builder.Default Duration subscriptionPollInterval = Duration.ofMillis(100);

  /**
   * Messages a subscription holds for a busy handler. Further messages are dropped until the
   * handler catches up. At least 1.
   */
  @Builder.Default int subscriptionBufferSize = 1024;

  public static NamespacedClientOptions defaults() {
    return builder().build();
  }
}
