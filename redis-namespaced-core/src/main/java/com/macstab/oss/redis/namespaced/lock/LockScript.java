/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.lock;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import io.lettuce.core.RedisNoScriptException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.sync.RedisScriptingCommands;
import lombok.Getter;

/**
 * Lua scripts shipped under {@code /scripts}.
 *
 * <p>Runs by SHA1 ({@code EVALSHA}) and falls back to {@code EVAL} with the full body when the
 * server has not cached the script yet ({@code NOSCRIPT}).
 */
enum LockScript {
  RELEASE("/scripts/release_lock.lua");

  private final byte[] content;
  @Getter private final String shaHex;

  LockScript(final String path) {
    this.content = load(path);
    this.shaHex = toHexString(newSha1Digest().digest(content));
  }

  /**
   * Runs the script and returns its integer reply.
   *
   * @param commands connection the script runs on
   * @param keys {@code KEYS} array
   * @param args {@code ARGV} array
   */
  long evalAsLong(
      final RedisScriptingCommands<String, String> commands,
      final String[] keys,
      final String... args) {

    Long result;
    try {
      result = commands.evalsha(shaHex, ScriptOutputType.INTEGER, keys, args);
    } catch (final RedisNoScriptException e) {
      result = commands.eval(content, ScriptOutputType.INTEGER, keys, args);
    }
    return result != null ? result : 0L;
  }

  private static byte[] load(final String path) {
    try (var in = LockScript.class.getResourceAsStream(path)) {
      if (in == null) {
        throw new NoSuchFileException(path, null, "can't find resource");
      }
      return in.readAllBytes();
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static MessageDigest newSha1Digest() {
    try {
      return MessageDigest.getInstance("SHA1");
    } catch (final NoSuchAlgorithmException e) {
      throw new UnsupportedOperationException("SHA1 not available", e);
    }
  }

  private static String toHexString(final byte[] bytes) {
    final var sb = new StringBuilder(bytes.length * 2);
    for (final byte b : bytes) {
      sb.append(Character.forDigit((b >> 4) & 0xf, 16)).append(Character.forDigit(b & 0xf, 16));
    }
    return sb.toString();
  }
}
