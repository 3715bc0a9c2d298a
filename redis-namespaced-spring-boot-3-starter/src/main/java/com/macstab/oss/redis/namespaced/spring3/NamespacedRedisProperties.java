/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.spring3;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.redis.namespaced.ConnectionSettings;
import com.macstab.oss.redis.namespaced.ErrorPolicy;
import com.macstab.oss.redis.namespaced.NamespacedClientOptions;

import lombok.Getter;
import lombok.Setter;

/**
 * Pool and client configuration properties.
 *
 * <p>Host, port, credentials and command timeout come from Spring Boot's standard {@code
 * spring.data.redis.*} properties. This class holds what is specific to namespaced clients.
 *
 * <pre>{@code
 * spring:
 *   data:
 *     redis:
 *       host: localhost
 *       port: 6379
 *       namespaced:
 *         name: primary
 *         max-connections: 10      # 1-1024
 *         borrow-timeout: 20s
 *         error-policy: SWALLOW    # SWALLOW (default) | PROPAGATE
 *         lock:
 *           lease: 30s
 *           acquire-timeout: 10s
 *           retry-interval: 100ms
 *         subscription:
 *           poll-interval: 100ms
 * }</pre>
 *
 * <p><strong>Connection budget:</strong> every initialized client holds one pooled connection, so
 * {@code max-connections} bounds the number of concurrently open clients per process. Pub/Sub
 * subscriptions open extra dedicated connections on top.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "spring.data.redis.namespaced")
public class NamespacedRedisProperties {

  public static final int MIN_CONNECTIONS = 1;
  public static final int MAX_CONNECTIONS = 1024;

  /** Creates the connection manager and client factory beans. */
  private boolean enabled = true;

  /**
   * Pool name. Becomes the {@code connection.name} metric tag, so it should match {@code
   * management.metrics.namespaced-redis.connection-name}.
   */
  private String name = ConnectionSettings.DEFAULT_NAME;

  /**
   * Upper bound of pooled connections.
   *
   * <p>Valid range: 1-1024. Values outside this range are clamped.
   */
  private int maxConnections = ConnectionSettings.DEFAULT_MAX_CONNECTIONS;

  /** How long opening a client waits for a free pooled connection. */
  private Duration borrowTimeout = ConnectionSettings.DEFAULT_BORROW_TIMEOUT;

  /** What operations do when the store fails. */
  private ErrorPolicy errorPolicy = ErrorPolicy.SWALLOW;

  private final Lock lock = new Lock();

  private final Subscription subscription = new Subscription();

  /**
   * Sets the pool bound, clamping to [MIN_CONNECTIONS, MAX_CONNECTIONS].
   *
   * @param maxConnections requested pool bound
   */
  public void setMaxConnections(final int maxConnections) {
    this.maxConnections = Math.max(MIN_CONNECTIONS, Math.min(maxConnections, MAX_CONNECTIONS));
  }

  /** Client options shared by every client the factory creates. */
  public NamespacedClientOptions toClientOptions() {
    return NamespacedClientOptions.builder()
        .errorPolicy(errorPolicy)
        .lockLease(lock.getLease())
        .lockAcquireTimeout(lock.getAcquireTimeout())
        .lockRetryInterval(lock.getRetryInterval())
        .subscriptionPollInterval(subscription.getPollInterval())
        .subscriptionBufferSize(subscription.getBufferSize())
        .build();
  }

  /** Namespace lock timing. */
  @Getter
  @Setter
  public static class Lock {

    /** Expiry of the lock key. */
    private Duration lease = Duration.ofSeconds(30);

    /** How long a write waits for the lock before failing. */
    private Duration acquireTimeout = Duration.ofSeconds(10);

    /** Pause between acquisition attempts. */
    private Duration retryInterval = Duration.ofMillis(100);
  }

  /** Subscription loop timing and buffering. */
  @Getter
  @Setter
  public static class Subscription {

    /** Upper bound between liveness checks of an idle subscription. */
    private Duration pollInterval = Duration.ofMillis(100);

    /** Messages held for a busy handler before further ones are dropped. */
    private int bufferSize = 1024;
  }
}
