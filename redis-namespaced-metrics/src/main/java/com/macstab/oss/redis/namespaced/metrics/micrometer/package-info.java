/* (C)2026 Macstab GmbH */

/**
 * Micrometer implementation of {@link
 * com.macstab.oss.redis.namespaced.metrics.NamespacedRedisMetrics}.
 *
 * <p>Meter names live in {@link
 * com.macstab.oss.redis.namespaced.metrics.micrometer.MetricsConfiguration}. Meter instances are
 * cached per tag combination.
 */
package com.macstab.oss.redis.namespaced.metrics.micrometer;
