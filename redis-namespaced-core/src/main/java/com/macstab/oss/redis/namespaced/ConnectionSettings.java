/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced;

import java.time.Duration;

import io.lettuce.core.RedisURI;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Immutable connection settings for {@link RedisConnectionManager}.
 *
 * <p>Unset builder fields fall back to the defaults below. Values always decode to text (UTF-8
 * {@code StringCodec}), there is no binary mode.
 *
 * <pre>{@code
 * ConnectionSettings settings =
 *     ConnectionSettings.builder().host("redis.internal").port(6380).maxConnections(32).build();
 * }</pre>
 *
 * <p><strong>Equality:</strong> two settings are equal when every field is equal. {@link
 * RedisConnectionManager#getInstance(ConnectionSettings)} uses this to warn when a later caller
 * asks for a different configuration than the one the shared pool was created with.
 */
@Value
public class ConnectionSettings {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 6379;
  public static final int DEFAULT_DATABASE = 0;
  public static final int DEFAULT_MAX_CONNECTIONS = 10;
  public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(60);
  public static final Duration DEFAULT_BORROW_TIMEOUT = Duration.ofSeconds(20);
  public static final String DEFAULT_NAME = "default";

  String host;
  int port;
  int database;

  /** Upper bound of connections the pool hands out at once. Borrowers block beyond it. */
  int maxConnections;

  String username;

  @ToString.Exclude String password;

  Duration commandTimeout;

  /** How long {@link RedisConnectionManager#acquireConnection()} waits on an exhausted pool. */
  Duration borrowTimeout;

  /** Logical pool name, used as the {@code connection.name} metric dimension. */
  String name;

  @Builder(toBuilder = true)
  private ConnectionSettings(
      final String host,
      final Integer port,
      final Integer database,
      final Integer maxConnections,
      final String username,
      final String password,
      final Duration commandTimeout,
      final Duration borrowTimeout,
      final String name) {

    this.host = host != null ? host : DEFAULT_HOST;
    this.port = port != null ? port : DEFAULT_PORT;
    this.database = database != null ? database : DEFAULT_DATABASE;
    this.maxConnections = maxConnections != null ? maxConnections : DEFAULT_MAX_CONNECTIONS;
    this.username = username;
    this.password = password;
    this.commandTimeout = commandTimeout != null ? commandTimeout : DEFAULT_COMMAND_TIMEOUT;
    this.borrowTimeout = borrowTimeout != null ? borrowTimeout : DEFAULT_BORROW_TIMEOUT;
    this.name = name != null ? name : DEFAULT_NAME;

    validate();
  }

  /** Settings with every default applied ({@code localhost:6379}, db 0, 10 connections). */
  public static ConnectionSettings defaults() {
    return builder().build();
  }

  /**
   * Builds the Lettuce URI for these settings.
   *
   * <p>Username without password is ignored (Redis ACL requires both).
   */
  public RedisURI toRedisUri() {
    final var builder =
        RedisURI.builder()
            .withHost(host)
            .withPort(port)
            .withDatabase(database)
            .withTimeout(commandTimeout);

    if (password != null && !password.isEmpty()) {
      if (username != null && !username.isEmpty()) {
        builder.withAuthentication(username, password.toCharArray());
      } else {
        builder.withPassword(password.toCharArray());
      }
    }

    return builder.build();
  }

  private void validate() {
    if (host.isBlank()) {
      throw new IllegalArgumentException("host must not be blank");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be in [1, 65535], got: " + port);
    }
    if (database < 0) {
      throw new IllegalArgumentException("database must be >= 0, got: " + database);
    }
    if (maxConnections < 1) {
      throw new IllegalArgumentException("maxConnections must be >= 1, got: " + maxConnections);
    }
    if (commandTimeout.isNegative() || commandTimeout.isZero()) {
      throw new IllegalArgumentException("commandTimeout must be positive, got: " + commandTimeout);
    }
    if (borrowTimeout.isNegative() || borrowTimeout.isZero()) {
      throw new IllegalArgumentException("borrowTimeout must be positive, got: " + borrowTimeout);
    }
  }
}
