/* (C)2026 Macstab GmbH */

/**
 * Spring Boot 3 auto-configuration for namespaced Redis clients.
 *
 * <p>Registers a {@link com.macstab.oss.redis.namespaced.RedisConnectionManager} and a {@link
 * com.macstab.oss.redis.namespaced.NamespacedRedisClientFactory}, configured through {@code
 * spring.data.redis.*} and {@code spring.data.redis.namespaced.*}.
 */
package com.macstab.oss.redis.namespaced.spring3;
