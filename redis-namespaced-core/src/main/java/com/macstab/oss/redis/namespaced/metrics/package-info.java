/* (C)2026 Macstab GmbH */

/**
 * Framework-agnostic metrics SPI. The core library only depends on this interface; the {@code
 * redis-namespaced-metrics} module provides the Micrometer implementation.
 */
package com.macstab.oss.redis.namespaced.metrics;
