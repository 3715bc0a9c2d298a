/* (C)2026 Macstab GmbH */

/**
 * Exception hierarchy of the namespaced client.
 *
 * <pre>
 * NamespacedRedisException
 * ├── StoreConnectionException        init: store unreachable, pool exhausted or closed
 * ├── StoreOperationException         operation failed, ErrorPolicy.PROPAGATE only
 * ├── LockAcquisitionException        namespace lock not acquired (always thrown)
 * └── ClientNotInitializedException   operation before init()
 *     └── ClientClosedException       operation after close()
 * </pre>
 */
package com.macstab.oss.redis.namespaced.exception;
