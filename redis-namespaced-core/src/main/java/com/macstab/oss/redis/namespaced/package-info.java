/* (C)2026 Macstab GmbH */

/**
 * Pure Lettuce core library for namespaced Redis access (NO Spring dependencies).
 *
 * <h2>Purpose</h2>
 *
 * <p>Many lightweight clients, one per namespace, share a single bounded connection pool. Each
 * client holds one pooled connection for its lifetime and a store-backed lock on {@code
 * "<namespace>:lock"} that serializes its mutating operations across processes.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌──────────────────────┐  ┌──────────────────────┐
 * │ NamespacedRedisClient│  │ NamespacedRedisClient│   one per namespace (cheap)
 * │  ns="orders"         │  │  ns="users"          │
 * └─────────┬────────────┘  └─────────┬────────────┘
 *           │ borrow 1 connection      │
 *           ↓                          ↓
 * ┌────────────────────────────────────────────────┐
 * │ RedisConnectionManager                         │   shared (getInstance) or injected
 * │  GenericObjectPool (maxConnections, blocking)  │
 * │  PubSubConnectionTracker (subscribe only)      │
 * └────────────────────┬───────────────────────────┘
 *                      ↓
 *                 Redis server
 * </pre>
 *
 * <h2>Operations</h2>
 *
 * <table>
 *   <caption>Client operations</caption>
 *   <tr><th>Operation</th><th>Namespace lock</th><th>Soft result on store error</th></tr>
 *   <tr><td>set</td><td>yes</td><td>nothing</td></tr>
 *   <tr><td>get</td><td>no</td><td>null</td></tr>
 *   <tr><td>keys</td><td>no</td><td>empty list</td></tr>
 *   <tr><td>sadd</td><td>yes</td><td>0</td></tr>
 *   <tr><td>publish</td><td>no</td><td>nothing</td></tr>
 *   <tr><td>subscribe</td><td>no</td><td>loop ends</td></tr>
 * </table>
 *
 * <p>Soft results apply under {@link com.macstab.oss.redis.namespaced.ErrorPolicy#SWALLOW}. See
 * {@link com.macstab.oss.redis.namespaced.NamespacedRedisClient} for the full contract.
 *
 * <h2>Metrics</h2>
 *
 * <p>{@link com.macstab.oss.redis.namespaced.metrics.NamespacedRedisMetrics} defaults to a no-op.
 * The {@code redis-namespaced-metrics} module provides the Micrometer implementation.
 */
package com.macstab.oss.redis.namespaced;
