/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import com.macstab.oss.redis.namespaced.exception.ClientClosedException;
import com.macstab.oss.redis.namespaced.exception.ClientNotInitializedException;
import com.macstab.oss.redis.namespaced.exception.LockAcquisitionException;
import com.macstab.oss.redis.namespaced.exception.StoreConnectionException;
import com.macstab.oss.redis.namespaced.exception.StoreOperationException;
import com.macstab.oss.redis.namespaced.lock.LockHandle;
import com.macstab.oss.redis.namespaced.lock.NamespaceLock;
import com.macstab.oss.redis.namespaced.lock.RedisNamespaceLock;
import com.macstab.oss.redis.namespaced.metrics.NamespacedRedisMetrics;

import io.lettuce.core.RedisException;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Namespace-scoped facade over one pooled connection of a {@link RedisConnectionManager}.
 *
 * <p><strong>Lifecycle:</strong> {@code UNINITIALIZED → INITIALIZING → READY → CLOSED}.
 * Construction performs no I/O; {@link #init()} borrows the dedicated connection and creates the
 * namespace lock. {@link #open(String, RedisConnectionManager)} does both in one call.
 *
 * <pre>{@code
 * try (NamespacedRedisClient client = NamespacedRedisClient.open("orders", manager)) {
 *   client.set("order:42", "paid");
 *   client.sadd("order:42:tags", "express", "gift");
 * }
 * }</pre>
 *
 * <p><strong>Namespace:</strong> scopes the lock ({@code "<namespace>:lock"}) and the log/metric
 * dimensions. Data keys are passed to the store unchanged, they are NOT prefixed.
 *
 * <p><strong>Locking:</strong> {@code set} and {@code sadd} run under the namespace lock, so they
 * serialize across every client and process sharing the store and namespace. {@code get}, {@code
 * keys}, {@code publish} and {@code subscribe} never take it. A lock that cannot be acquired always
 * throws {@link LockAcquisitionException}, regardless of the error policy.
 *
 * <p><strong>Store errors:</strong> governed by {@link ErrorPolicy}. Under {@code SWALLOW}
 * (default) the error is logged and a neutral result returned: {@code get → null}, {@code keys →
 * []}, {@code sadd → 0}, {@code set}/{@code publish} do nothing. Under {@code PROPAGATE} a {@link
 * StoreOperationException} is thrown after logging.
 *
 * <p><strong>Thread safety:</strong> operations may be called concurrently (the Lettuce connection
 * is thread-safe). {@code init()} and {@code close()} are serialized on the instance. {@code state}
 * and {@code session} are {@code volatile}: operations read them without locking.
 */
@Slf4j
public final class NamespacedRedisClient implements AutoCloseable {

  /** Creates the namespace lock once the dedicated connection exists. Replaced in tests. */
  @FunctionalInterface
  interface LockFactory {
    NamespaceLock create(
        RedisCommands<String, String> commands,
        String namespace,
        NamespacedClientOptions options,
        NamespacedRedisMetrics metrics);
  }

  static final LockFactory REDIS_LOCK_FACTORY =
      (commands, namespace, options, metrics) ->
          new RedisNamespaceLock(
              commands,
              namespace,
              options.getLockLease(),
              options.getLockAcquireTimeout(),
              options.getLockRetryInterval(),
              metrics);

  private static final Object WAKE_UP = new Object();

  @Getter private final String namespace;
  private final RedisConnectionManager manager;
  @Getter private final NamespacedClientOptions options;
  private final NamespacedRedisMetrics metrics;
  private final LockFactory lockFactory;
  // One wake-up per running subscription, caller tokens are never touched by close()
  private final Set<Runnable> subscriptionWakeUps = ConcurrentHashMap.newKeySet();

  private volatile ClientState state = ClientState.UNINITIALIZED;
  private volatile Session session;

  public NamespacedRedisClient(
      @NonNull final String namespace, @NonNull final RedisConnectionManager manager) {
    this(namespace, manager, NamespacedClientOptions.defaults());
  }

  public NamespacedRedisClient(
      @NonNull final String namespace,
      @NonNull final RedisConnectionManager manager,
      @NonNull final NamespacedClientOptions options) {
    this(namespace, manager, options, REDIS_LOCK_FACTORY);
  }

  // Package-private for testing (fake lock)
  NamespacedRedisClient(
      @NonNull final String namespace,
      @NonNull final RedisConnectionManager manager,
      @NonNull final NamespacedClientOptions options,
      @NonNull final LockFactory lockFactory) {

    if (namespace.isBlank()) {
      throw new IllegalArgumentException("namespace must not be blank");
    }
    if (options.getSubscriptionBufferSize() < 1) {
      throw new IllegalArgumentException(
          "subscriptionBufferSize must be >= 1, got: " + options.getSubscriptionBufferSize());
    }

    this.namespace = namespace;
    this.manager = manager;
    this.options = options;
    this.metrics = manager.getMetrics();
    this.lockFactory = lockFactory;
  }

  /**
   * Creates and initializes a client with default options.
   *
   * @throws StoreConnectionException no connection could be borrowed
   */
  public static NamespacedRedisClient open(
      @NonNull final String namespace, @NonNull final RedisConnectionManager manager) {
    return new NamespacedRedisClient(namespace, manager).init();
  }

  /**
   * Creates and initializes a client.
   *
   * @throws StoreConnectionException no connection could be borrowed
   */
  public static NamespacedRedisClient open(
      @NonNull final String namespace,
      @NonNull final RedisConnectionManager manager,
      @NonNull final NamespacedClientOptions options) {
    return new NamespacedRedisClient(namespace, manager, options).init();
  }

  /**
   * Borrows the dedicated connection and creates the namespace lock.
   *
   * <p>No-op when already {@code READY}. A failure leaves the client {@code UNINITIALIZED} with no
   * connection held, so {@code init()} may be retried.
   *
   * @return this client
   * @throws StoreConnectionException store unreachable, pool exhausted or manager closed
   * @throws ClientClosedException client was closed
   */
  public synchronized NamespacedRedisClient init() {
    if (state == ClientState.READY) {
      return this;
    }
    if (state == ClientState.CLOSED) {
      throw new ClientClosedException(namespace);
    }

    state = ClientState.INITIALIZING;
    StatefulRedisConnection<String, String> connection = null;

    try {
      connection = manager.acquireConnection();
      final var commands = connection.sync();
      final var lock = lockFactory.create(commands, namespace, options, metrics);

      session = new Session(connection, commands, lock);
      state = ClientState.READY;
      metrics.recordClientOpened(namespace);

      if (log.isDebugEnabled()) {
        log.debug("Initialized client for namespace '{}' (lock: {})", namespace, lock.getKey());
      }
      return this;
    } catch (final StoreConnectionException e) {
      rollbackInit(connection, e);
      throw e;
    } catch (final RuntimeException e) {
      rollbackInit(connection, e);
      throw new StoreConnectionException(
          "Failed to initialize client for namespace '" + namespace + "'", e);
    }
  }

  public ClientState getState() {
    return state;
  }

  public boolean isReady() {
    return state == ClientState.READY;
  }

  // ==================== Key/Value ====================

  /** Stores {@code value} under {@code key} while holding the namespace lock. */
  public void set(@NonNull final String key, @NonNull final String value) {
    executeLocked("set", key, commands -> commands.set(key, value), null);
  }

  /**
   * Stores {@code value} under {@code key} with an expiry, while holding the namespace lock.
   *
   * <p>Whole-second TTLs are sent as {@code EX}, anything finer as {@code PX}.
   *
   * @param ttl expiry, at least one millisecond
   */
  public void set(
      @NonNull final String key, @NonNull final String value, @NonNull final Duration ttl) {
    if (ttl.toMillis() < 1) {
      throw new IllegalArgumentException("ttl must be at least 1 ms, got: " + ttl);
    }

    final SetArgs args =
        ttl.toMillis() % 1000 == 0
            ? SetArgs.Builder.ex(ttl.getSeconds())
            : SetArgs.Builder.px(ttl.toMillis());

    executeLocked("set", key, commands -> commands.set(key, value, args), null);
  }

  /**
   * Reads {@code key}.
   *
   * @return value, or {@code null} when the key is absent (or the read failed under {@code
   *     SWALLOW})
   */
  public String get(@NonNull final String key) {
    return execute(requireSession(), "get", key, commands -> commands.get(key), null);
  }

  /**
   * Lists keys matching a glob-style {@code pattern} ({@code KEYS}). Order unspecified.
   *
   * <p>{@code KEYS} walks the whole keyspace; keep it to small databases and tooling.
   */
  public List<String> keys(@NonNull final String pattern) {
    return execute(
        requireSession(), "keys", pattern, commands -> commands.keys(pattern), List.of());
  }

  /**
   * Adds members to the set at {@code key} while holding the namespace lock.
   *
   * @return number of members that were not already present ({@code 0} on a swallowed failure)
   */
  public long sadd(@NonNull final String key, @NonNull final String... values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("sadd needs at least one value");
    }

    final Long added = executeLocked("sadd", key, commands -> commands.sadd(key, values), 0L);
    return added != null ? added : 0L;
  }

  // ==================== Pub/Sub ====================

  /** Publishes {@code message} on {@code channel}. Delivery to zero subscribers is not an error. */
  public void publish(@NonNull final String channel, @NonNull final String message) {
    final Long receivers =
        execute(
            requireSession(),
            "publish",
            channel,
            commands -> commands.publish(channel, message),
            null);

    if (receivers != null && log.isDebugEnabled()) {
      log.debug(
          "Published on '{}' to {} subscriber(s) (namespace: {})", channel, receivers, namespace);
    }
  }

  /**
   * Subscribes to {@code channel} and feeds every data message to {@code handler} on the calling
   * thread, one at a time, in arrival order. Blocks until one of:
   *
   * <ul>
   *   <li>{@code token} is cancelled (observed immediately)
   *   <li>this client closes
   *   <li>the Pub/Sub connection closes (manager shut down)
   *   <li>the calling thread is interrupted (interrupt flag restored)
   *   <li>{@code handler} throws (rethrown to the caller)
   * </ul>
   *
   * <p>Subscription confirmations and other control events never reach the handler. Runs on its own
   * Pub/Sub connection from the manager, unsubscribed and released on exit.
   *
   * <p><strong>Buffering:</strong> Lettuce reads the connection independently of the handler.
   * Messages waiting for the handler are held in a buffer of {@code subscriptionBufferSize}
   * entries. When it is full, further messages are dropped (logged and counted through {@link
   * NamespacedRedisMetrics#recordMessageDropped}) until the handler catches up. Pub/Sub delivery
   * is at-most-once anyway: the server itself disconnects subscribers that fall too far behind.
   *
   * <p>Closing this client ends the subscription without cancelling {@code token}, so one token
   * may be shared by subscriptions of several clients.
   *
   * @throws StoreOperationException store error under {@code PROPAGATE}
   */
  public void subscribe(
      @NonNull final String channel,
      @NonNull final MessageHandler handler,
      @NonNull final SubscriptionToken token) {

    requireSession();

    final int bufferSize = options.getSubscriptionBufferSize();
    // One slot above the message bound stays free for the wake-up
    final BlockingQueue<Object> deliveries = new LinkedBlockingQueue<>(bufferSize + 1);
    final AtomicLong dropped = new AtomicLong();
    final Runnable wakeUp = () -> deliveries.offer(WAKE_UP);
    StatefulRedisPubSubConnection<String, String> pubSub = null;

    subscriptionWakeUps.add(wakeUp);
    token.onCancel(wakeUp);

    try {
      pubSub = manager.openPubSubConnection();
      pubSub.addListener(
          new RedisPubSubAdapter<String, String>() {
            @Override
            public void message(final String source, final String message) {
              if (!channel.equals(source)) {
                return;
              }
              if (deliveries.size() >= bufferSize || !deliveries.offer(message)) {
                onBufferFull(channel, bufferSize, dropped);
              }
            }
          });
      pubSub.sync().subscribe(channel);
      metrics.recordOperation(namespace, "subscribe", true);

      if (log.isDebugEnabled()) {
        log.debug("Subscribed to '{}' (namespace: {})", channel, namespace);
      }

      dispatch(channel, handler, token, deliveries, pubSub);
    } catch (final RedisException | StoreConnectionException e) {
      metrics.recordOperation(namespace, "subscribe", false);
      handleFailure("subscribe", channel, e, null);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();

      if (log.isDebugEnabled()) {
        log.debug("Subscription to '{}' interrupted (namespace: {})", channel, namespace);
      }
    } finally {
      token.removeOnCancel(wakeUp);
      subscriptionWakeUps.remove(wakeUp);
      endSubscription(pubSub, channel);
    }
  }

  /**
   * Runs {@link #subscribe} on {@code executor}.
   *
   * @return future completing when the subscription ends, exceptionally when it failed
   */
  public CompletableFuture<Void> subscribeAsync(
      @NonNull final String channel,
      @NonNull final MessageHandler handler,
      @NonNull final SubscriptionToken token,
      @NonNull final Executor executor) {

    requireSession();
    return CompletableFuture.runAsync(() -> subscribe(channel, handler, token), executor);
  }

  // ==================== Lifecycle ====================

  /**
   * Returns the dedicated connection to the pool and ends running subscriptions.
   *
   * <p>Subscription tokens are left as they are. Idempotent. Never closes the shared pool, other
   * clients are unaffected. No-op on a client that was never initialized.
   */
  @Override
  public void close() {
    final Session closing;

    synchronized (this) {
      if (state != ClientState.READY) {
        return;
      }
      closing = session;
      session = null;
      state = ClientState.CLOSED;
    }

    for (final var wakeUp : subscriptionWakeUps) {
      wakeUp.run();
    }

    manager.releaseConnection(closing.connection);
    metrics.recordClientClosed(namespace);

    if (log.isInfoEnabled()) {
      log.info("Closed client for namespace '{}'", namespace);
    }
  }

  // ==================== Private Methods ====================

  private Session requireSession() {
    final var current = session;
    if (current != null) {
      return current;
    }
    if (state == ClientState.CLOSED) {
      throw new ClientClosedException(namespace);
    }
    throw new ClientNotInitializedException(namespace);
  }

  private <T> T executeLocked(
      final String operation,
      final String target,
      final Function<RedisCommands<String, String>, T> action,
      final T fallback) {

    final var current = requireSession();

    try (LockHandle ignored = current.lock.acquire()) {
      return execute(current, operation, target, action, fallback);
    }
  }

  private <T> T execute(
      final Session current,
      final String operation,
      final String target,
      final Function<RedisCommands<String, String>, T> action,
      final T fallback) {

    try {
      final T result = action.apply(current.commands);
      metrics.recordOperation(namespace, operation, true);
      return result;
    } catch (final RedisException e) {
      metrics.recordOperation(namespace, operation, false);
      return handleFailure(operation, target, e, fallback);
    }
  }

  private <T> T handleFailure(
      final String operation, final String target, final RuntimeException e, final T fallback) {

    log.error(
        "Redis {} on '{}' failed (namespace: {}, policy: {})",
        operation,
        target,
        namespace,
        options.getErrorPolicy(),
        e);

    if (options.getErrorPolicy() == ErrorPolicy.PROPAGATE) {
      throw new StoreOperationException(operation, namespace, target, e);
    }
    return fallback;
  }

  private void dispatch(
      final String channel,
      final MessageHandler handler,
      final SubscriptionToken token,
      final BlockingQueue<Object> deliveries,
      final StatefulRedisPubSubConnection<String, String> pubSub)
      throws InterruptedException {

    final long pollMillis = Math.max(1L, options.getSubscriptionPollInterval().toMillis());

    while (!token.isCancelled() && state == ClientState.READY) {
      final Object next = deliveries.poll(pollMillis, TimeUnit.MILLISECONDS);

      if (next == null) {
        if (!pubSub.isOpen()) {
          if (log.isInfoEnabled()) {
            log.info("Subscription stream on '{}' ended (namespace: {})", channel, namespace);
          }
          return;
        }
        continue;
      }

      if (next == WAKE_UP) {
        continue;
      }

      metrics.recordMessageDelivered(namespace, channel);
      handler.onMessage((String) next);
    }
  }

  private void onBufferFull(final String channel, final int bufferSize, final AtomicLong dropped) {
    final long total = dropped.incrementAndGet();
    metrics.recordMessageDropped(namespace, channel);

    if ((total == 1 || total % 1000 == 0) && log.isWarnEnabled()) {
      log.warn(
          "Subscription buffer on '{}' full ({} messages), {} message(s) dropped (namespace: {})",
          channel,
          bufferSize,
          total,
          namespace);
    }
  }

  private void endSubscription(
      final StatefulRedisPubSubConnection<String, String> pubSub, final String channel) {
    if (pubSub == null) {
      return;
    }

    try {
      if (pubSub.isOpen()) {
        pubSub.sync().unsubscribe(channel);
      }
    } catch (final RedisException e) {
      if (log.isDebugEnabled()) {
        log.debug("Unsubscribe from '{}' failed, closing connection anyway", channel, e);
      }
    } finally {
      manager.releasePubSubConnection(pubSub);
    }

    if (log.isDebugEnabled()) {
      log.debug("Unsubscribed from '{}' (namespace: {})", channel, namespace);
    }
  }

  private void rollbackInit(
      final StatefulRedisConnection<String, String> connection, final RuntimeException cause) {
    manager.releaseConnection(connection);
    session = null;
    state = ClientState.UNINITIALIZED;
    log.error("Failed to initialize client for namespace '{}'", namespace, cause);
  }

  /** Connection and lock of a ready client. Present or absent together. */
  private static final class Session {

    private final StatefulRedisConnection<String, String> connection;
    private final RedisCommands<String, String> commands;
    private final NamespaceLock lock;

    private Session(
        final StatefulRedisConnection<String, String> connection,
        final RedisCommands<String, String> commands,
        final NamespaceLock lock) {
      this.connection = connection;
      this.commands = commands;
      this.lock = lock;
    }
  }
}
