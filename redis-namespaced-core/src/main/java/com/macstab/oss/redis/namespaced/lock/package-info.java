/* (C)2026 Macstab GmbH */

/** Store-backed per-namespace lock ({@code SET NX PX} acquire, owner-checked Lua release). */
package com.macstab.oss.redis.namespaced.lock;
