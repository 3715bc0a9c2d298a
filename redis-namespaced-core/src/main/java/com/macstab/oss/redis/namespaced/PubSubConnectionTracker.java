/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

import static lombok.AccessLevel.PRIVATE;

import java.util.concurrent.CopyOnWriteArrayList;

import io.lettuce.core.RedisClient;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe tracker for the Pub/Sub connections opened by {@code subscribe}.
 *
 * <p><strong>Why Pub/Sub connections live outside the pool:</strong> once a connection issues
 * {@code SUBSCRIBE} the server rejects every command except (P|S)SUBSCRIBE/UNSUBSCRIBE, PING, QUIT
 * and RESET on it. Handing such a connection back to the pool would poison the next borrower, so
 * each subscription gets its own connection, and the manager closes whatever is still open when it
 * shuts down.
 *
 * <p><strong>CopyOnWriteArrayList choice:</strong> subscriptions are long-lived and few; writes
 * (open/release) are rare, reads (count, shutdown iteration) must not block writers.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
final class PubSubConnectionTracker {

  private static final int WARNING_THRESHOLD = 100;

  RedisClient client;

  CopyOnWriteArrayList<StatefulRedisPubSubConnection<String, String>> connections;

  PubSubConnectionTracker(@NonNull final RedisClient client) {
    this.client = client;
    this.connections = new CopyOnWriteArrayList<>();
  }

  /** Opens and tracks a Pub/Sub connection. Lettuce exceptions propagate unchanged. */
  StatefulRedisPubSubConnection<String, String> create() {
    final var connection = client.connectPubSub(StringCodec.UTF8);
    connections.add(connection);

    final var count = connections.size();

    if (log.isDebugEnabled()) {
      log.debug("Created Pub/Sub connection (total: {})", count);
    }

    if (count > WARNING_THRESHOLD && log.isWarnEnabled()) {
      log.warn(
          "Pub/Sub connection count ({}) exceeded threshold ({}). Possible subscription leak.",
          count,
          WARNING_THRESHOLD);
    }

    return connection;
  }

  /** Untracks and closes. Idempotent: a connection already released is left alone. */
  void release(final StatefulRedisPubSubConnection<String, String> connection) {
    if (connection == null) {
      return;
    }

    final boolean removed = connections.remove(connection);
    if (removed) {
      connection.close();

      if (log.isDebugEnabled()) {
        log.debug("Released Pub/Sub connection (remaining: {})", connections.size());
      }
    }
  }

  int getConnectionCount() {
    return connections.size();
  }

  /** Closes every tracked connection. A failing close is logged and the rest still close. */
  void closeAll() {
    for (final var connection : connections) {
      try {
        connection.close();
      } catch (final RuntimeException e) {
        log.warn("Error closing Pub/Sub connection", e);
      }
    }

    connections.clear();

    if (log.isDebugEnabled()) {
      log.debug("Closed all Pub/Sub connections");
    }
  }
}
