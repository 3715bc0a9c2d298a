/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.lock;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import com.macstab.oss.redis.namespaced.exception.LockAcquisitionException;
import com.macstab.oss.redis.namespaced.metrics.NamespacedRedisMetrics;

import io.lettuce.core.RedisException;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Store-backed {@link NamespaceLock} on key {@code "<namespace>:lock"}.
 *
 * <p><strong>Acquire:</strong> {@code SET key token NX PX lease}, retried every {@code
 * retryInterval} until {@code acquireTimeout} elapses. The token is a random UUID per acquisition.
 * The lease bounds how long a crashed owner can block the namespace.
 *
 * <p><strong>Release:</strong> compare-and-delete Lua script ({@link LockScript#RELEASE}). Only the
 * owner token deletes the key, so a release after lease expiry never frees somebody else's lock.
 *
 * <p>Runs its commands on the caller-supplied connection, which is the owning client's dedicated
 * connection. Lettuce connections are thread-safe, so concurrent callers of one client may contend
 * for the lock through the same connection.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RedisNamespaceLock implements NamespaceLock {

  public static final String KEY_SUFFIX = ":lock";

  RedisCommands<String, String> commands;
  String namespace;
  @Getter String key;
  Duration lease;
  Duration acquireTimeout;
  Duration retryInterval;
  NamespacedRedisMetrics metrics;

  public RedisNamespaceLock(
      @NonNull final RedisCommands<String, String> commands,
      @NonNull final String namespace,
      @NonNull final Duration lease,
      @NonNull final Duration acquireTimeout,
      @NonNull final Duration retryInterval,
      @NonNull final NamespacedRedisMetrics metrics) {

    if (lease.isNegative() || lease.isZero()) {
      throw new IllegalArgumentException("lease must be positive, got: " + lease);
    }
    if (acquireTimeout.isNegative()) {
      throw new IllegalArgumentException("acquireTimeout must be >= 0, got: " + acquireTimeout);
    }
    if (retryInterval.isNegative() || retryInterval.isZero()) {
      throw new IllegalArgumentException("retryInterval must be positive, got: " + retryInterval);
    }

    this.commands = commands;
    this.namespace = namespace;
    this.key = keyFor(namespace);
    this.lease = lease;
    this.acquireTimeout = acquireTimeout;
    this.retryInterval = retryInterval;
    this.metrics = metrics;
  }

  /** Lock key of {@code namespace}. */
  public static String keyFor(@NonNull final String namespace) {
    return namespace + KEY_SUFFIX;
  }

  @Override
  public LockHandle acquire() {
    final var token = UUID.randomUUID().toString();
    final var args = SetArgs.Builder.nx().px(lease.toMillis());
    final long start = System.nanoTime();
    final long deadline = start + acquireTimeout.toNanos();

    try {
      while (true) {
        if ("OK".equals(commands.set(key, token, args))) {
          final var waited = Duration.ofNanos(System.nanoTime() - start);
          metrics.recordLockWait(namespace, waited);

          if (log.isDebugEnabled()) {
            log.debug("Acquired lock '{}' after {} ms", key, waited.toMillis());
          }
          return new Handle(token);
        }

        if (System.nanoTime() - deadline >= 0) {
          metrics.recordLockTimeout(namespace);
          throw new LockAcquisitionException(
              key, String.format("Timed out after %s waiting for lock '%s'", acquireTimeout, key));
        }

        Thread.sleep(retryInterval.toMillis());
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      metrics.recordLockTimeout(namespace);
      throw new LockAcquisitionException(
          key, "Interrupted while waiting for lock '" + key + "'", e);
    } catch (final RedisException e) {
      metrics.recordLockTimeout(namespace);
      throw new LockAcquisitionException(
          key, "Store error while acquiring lock '" + key + "': " + e.getMessage(), e);
    }
  }

  @Override
  public boolean isLocked() {
    final Long count = commands.exists(key);
    return count != null && count > 0;
  }

  private void release(final String token) {
    try {
      final long deleted = LockScript.RELEASE.evalAsLong(commands, new String[] {key}, token);

      if (deleted == 0 && log.isWarnEnabled()) {
        log.warn("Lock '{}' was no longer owned on release (lease {} expired?)", key, lease);
      } else if (log.isDebugEnabled()) {
        log.debug("Released lock '{}'", key);
      }
    } catch (final RedisException e) {
      log.error("Failed to release lock '{}', it expires after its lease", key, e);
    }
  }

  @FieldDefaults(level = PRIVATE, makeFinal = true)
  private final class Handle implements LockHandle {

    @Getter String token;
    AtomicBoolean released = new AtomicBoolean();

    private Handle(final String token) {
      this.token = token;
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        release(token);
      }
    }
  }
}
