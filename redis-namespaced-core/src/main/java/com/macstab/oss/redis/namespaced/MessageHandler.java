/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

/**
 * Receives the payload of each data message on a subscribed channel.
 *
 * <p>Invoked sequentially on the subscribing thread. A thrown exception ends the subscription and
 * propagates to the {@code subscribe} caller.
 */
@FunctionalInterface
public interface MessageHandler {

  void onMessage(String payload);
}
