/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;

import com.macstab.oss.redis.namespaced.exception.StoreConnectionException;
import com.macstab.oss.redis.namespaced.metrics.NamespacedRedisMetrics;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.lettuce.core.support.ConnectionPoolSupport;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Owner of the bounded connection pool every {@link NamespacedRedisClient} borrows from.
 *
 * <p><strong>Two ways to obtain one:</strong>
 *
 * <ul>
 *   <li>{@link #getInstance(ConnectionSettings)} - process-wide shared instance. <em>First
 *       wins:</em> the settings of the very first call create the pool, every later call returns
 *       that same pool and ignores its own settings (a warning is logged when they differ). Kept
 *       for compatibility with callers written against the shared-pool contract.
 *   <li>{@code new RedisConnectionManager(settings)} - explicit instance for dependency injection
 *       (the Spring starter uses this). Not registered as the shared instance.
 * </ul>
 *
 * <p><strong>Pool semantics (commons-pool2 via Lettuce {@link ConnectionPoolSupport}):</strong>
 * at most {@code maxConnections} connections are out at once; {@link #acquireConnection()} blocks
 * up to {@code borrowTimeout} when exhausted. Connections are created lazily, so constructing a
 * manager performs no I/O. Pooled connections are wrapped: {@code close()} on a borrowed connection
 * returns it to the pool.
 *
 * <p><strong>Pub/Sub:</strong> subscriptions need dedicated connections (see {@link
 * PubSubConnectionTracker}). They are opened outside the pool bound and closed with the manager.
 *
 * <p><strong>Shutdown:</strong> {@link #close()} is idempotent. It closes the pool, every tracked
 * Pub/Sub connection, then shuts the Lettuce client down (which also drops connections still
 * borrowed by clients). Failures are logged, never thrown. Closing the shared instance vacates the
 * shared slot: the next {@link #getInstance(ConnectionSettings)} builds a fresh pool.
 *
 * <p><strong>JMM:</strong> {@code closed} is {@code volatile}: it mutates after construction and is
 * read on every borrow from arbitrary threads.
 */
@Slf4j
public final class RedisConnectionManager implements AutoCloseable {

  private static RedisConnectionManager shared; // guarded by RedisConnectionManager.class

  @Getter private final ConnectionSettings settings;
  @Getter private final NamespacedRedisMetrics metrics;
  private final RedisClient client;
  private final GenericObjectPool<StatefulRedisConnection<String, String>> pool;
  private final PubSubConnectionTracker pubSubTracker;
  private volatile boolean closed;

  /**
   * Creates an explicit (non-shared) manager without metrics.
   *
   * @param settings connection settings (must not be null)
   */
  public RedisConnectionManager(@NonNull final ConnectionSettings settings) {
    this(settings, Optional.empty());
  }

  /**
   * Creates an explicit (non-shared) manager.
   *
   * @param settings connection settings (must not be null)
   * @param metrics metrics collector (optional, defaults to NOOP if not present)
   */
  public RedisConnectionManager(
      @NonNull final ConnectionSettings settings,
      @NonNull final Optional<NamespacedRedisMetrics> metrics) {
    this(settings, RedisClient.create(settings.toRedisUri()), metrics);
  }

  // Package-private for testing (mock RedisClient)
  RedisConnectionManager(
      @NonNull final ConnectionSettings settings,
      @NonNull final RedisClient client,
      @NonNull final Optional<NamespacedRedisMetrics> metrics) {

    this.settings = settings;
    this.client = client;
    this.metrics = metrics.orElse(NamespacedRedisMetrics.NOOP);
    this.pubSubTracker = new PubSubConnectionTracker(client);
    this.closed = false;

    configureClientOptions();
    this.pool = createPool();

    if (log.isInfoEnabled()) {
      log.info(
          "Created RedisConnectionManager for {}:{} db={} (maxConnections: {}, name: {})",
          settings.getHost(),
          settings.getPort(),
          settings.getDatabase(),
          settings.getMaxConnections(),
          settings.getName());
    }
  }

  /** Shared instance with {@link ConnectionSettings#defaults()} (unless one already exists). */
  public static RedisConnectionManager getInstance() {
    return getInstance(ConnectionSettings.defaults());
  }

  /**
   * Returns the process-wide shared manager, creating it on first call.
   *
   * <p>First wins: {@code settings} are honoured only when no shared instance exists yet.
   *
   * @param settings settings used if this call creates the shared instance
   * @return the shared manager
   */
  public static synchronized RedisConnectionManager getInstance(
      @NonNull final ConnectionSettings settings) {

    if (shared == null) {
      shared = new RedisConnectionManager(settings);
      return shared;
    }

    if (!shared.settings.equals(settings) && log.isWarnEnabled()) {
      log.warn(
          "Shared RedisConnectionManager already exists with {}. Ignoring requested {}",
          shared.settings,
          settings);
    }

    return shared;
  }

  private static synchronized void vacateSharedSlot(final RedisConnectionManager manager) {
    if (shared == manager) {
      shared = null;
    }
  }

  /**
   * Returns the pool handle. No I/O, never fails (also after {@link #close()}; the pool then
   * reports itself closed).
   */
  public GenericObjectPool<StatefulRedisConnection<String, String>> getPool() {
    return pool;
  }

  /**
   * Borrows one connection, blocking up to {@code borrowTimeout} when the pool is exhausted.
   *
   * <p>Return it with {@link #releaseConnection(StatefulRedisConnection)} (or {@code close()} on
   * the connection itself).
   *
   * @return pooled UTF-8 connection
   * @throws StoreConnectionException pool closed, exhausted past the timeout, or store unreachable
   */
  public StatefulRedisConnection<String, String> acquireConnection() {
    checkNotClosed();

    try {
      return pool.borrowObject();
    } catch (final NoSuchElementException e) {
      throw new StoreConnectionException(
          String.format(
              "Connection pool exhausted (maxConnections: %d, waited %s)",
              settings.getMaxConnections(), settings.getBorrowTimeout()),
          e);
    } catch (final RedisException e) {
      throw new StoreConnectionException(
          String.format(
              "Redis unreachable at %s:%d: %s",
              settings.getHost(), settings.getPort(), e.getMessage()),
          e);
    } catch (final Exception e) {
      throw new StoreConnectionException("Failed to borrow Redis connection", e);
    }
  }

  /**
   * Returns a borrowed connection to the pool. Null-safe. Errors are logged, not thrown.
   *
   * @param connection connection obtained from {@link #acquireConnection()}
   */
  public void releaseConnection(final StatefulRedisConnection<String, String> connection) {
    if (connection == null) {
      return;
    }

    try {
      connection.close();
    } catch (final RuntimeException e) {
      log.error("Error returning connection to pool (name: {})", settings.getName(), e);
    }
  }

  /**
   * Opens a dedicated Pub/Sub connection, tracked until released or until the manager closes.
   *
   * @throws StoreConnectionException manager closed
   * @throws RedisException store unreachable
   */
  public StatefulRedisPubSubConnection<String, String> openPubSubConnection() {
    checkNotClosed();
    return pubSubTracker.create();
  }

  /** Closes a Pub/Sub connection from {@link #openPubSubConnection()}. Null-safe, idempotent. */
  public void releasePubSubConnection(final StatefulRedisPubSubConnection<String, String> conn) {
    pubSubTracker.release(conn);
  }

  public int getActiveConnectionCount() {
    return pool.getNumActive();
  }

  public int getIdleConnectionCount() {
    return pool.getNumIdle();
  }

  public int getPubSubConnectionCount() {
    return pubSubTracker.getConnectionCount();
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Disconnects every connection of this manager. Idempotent; failures are logged and swallowed.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
    }

    vacateSharedSlot(this);

    // Each step runs even when an earlier one failed
    closeStep("connection pool", pool::close);
    closeStep("Pub/Sub connections", pubSubTracker::closeAll);
    closeStep("Lettuce client", client::shutdown);
    closeStep("metrics", () -> metrics.close(settings.getName()));

    if (log.isInfoEnabled()) {
      log.info("Closed Redis connection pool (name: {})", settings.getName());
    }
  }

  /** {@link #close()} on the common fork-join pool. */
  public CompletableFuture<Void> closeAsync() {
    return CompletableFuture.runAsync(this::close);
  }

  // ==================== Private Methods ====================

  private void closeStep(final String step, final Runnable action) {
    try {
      action.run();
    } catch (final RuntimeException e) {
      log.error("Error closing {} (name: {})", step, settings.getName(), e);
    }
  }

  private void checkNotClosed() {
    if (closed) {
      throw new StoreConnectionException(
          "RedisConnectionManager '" + settings.getName() + "' has been closed");
    }
  }

  /**
   * Configures Lettuce auto-reconnect.
   *
   * <p>{@code REJECT_COMMANDS} while disconnected: commands fail fast instead of buffering, so a
   * dead store surfaces as an operation error rather than a growing backlog.
   */
  private void configureClientOptions() {
    final var existingOptions = client.getOptions();
    final var optionsBuilder =
        existingOptions != null ? existingOptions.mutate() : ClientOptions.builder();

    client.setOptions(
        optionsBuilder
            .autoReconnect(true)
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .build());
  }

  private GenericObjectPool<StatefulRedisConnection<String, String>> createPool() {
    final var config = new GenericObjectPoolConfig<StatefulRedisConnection<String, String>>();
    config.setMaxTotal(settings.getMaxConnections());
    config.setMaxIdle(settings.getMaxConnections());
    config.setMinIdle(0);
    config.setBlockWhenExhausted(true);
    config.setMaxWait(settings.getBorrowTimeout());
    config.setJmxEnabled(false);

    return ConnectionPoolSupport.createGenericObjectPool(
        () -> client.connect(StringCodec.UTF8), config);
  }
}
