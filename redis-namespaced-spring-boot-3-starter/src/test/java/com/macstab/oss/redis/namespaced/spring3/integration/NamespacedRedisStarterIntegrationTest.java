/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.spring3.integration;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.macstab.oss.redis.namespaced.NamespacedRedisClientFactory;
import com.macstab.oss.redis.namespaced.RedisConnectionManager;
import com.macstab.oss.redis.namespaced.SubscriptionToken;
import com.macstab.oss.redis.namespaced.spring3.NamespacedRedisAutoConfiguration;

/**
 * End-to-end test of the auto-configured beans against real Redis.
 *
 * <p><strong>Requirements:</strong> Docker must be running (skipped otherwise).
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Starter Integration Tests (Real Redis)")
class NamespacedRedisStarterIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  private ApplicationContextRunner contextRunner() {
    return new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(NamespacedRedisAutoConfiguration.class))
        .withPropertyValues(
            "spring.data.redis.host=" + REDIS.getHost(),
            "spring.data.redis.port=" + REDIS.getFirstMappedPort(),
            "spring.data.redis.timeout=5s",
            "spring.data.redis.namespaced.max-connections=4");
  }

  @Test
  @DisplayName("Factory clients read, write and add to sets through the configured pool")
  void shouldRoundTripThroughFactory() {
    contextRunner()
        .run(
            context -> {
              // Arrange
              final var factory = context.getBean(NamespacedRedisClientFactory.class);

              // Act + Assert
              try (var client = factory.open("app")) {
                client.set("a", "1");
                assertThat(client.get("a")).isEqualTo("1");
                assertThat(client.keys("a*")).contains("a");
                assertThat(client.sadd("s", "x", "y")).isEqualTo(2L);
                assertThat(client.sadd("s", "x")).isZero();
              }

              assertThat(context.getBean(RedisConnectionManager.class).getActiveConnectionCount())
                  .isZero();
            });
  }

  @Test
  @DisplayName("Message published by one client reaches a subscriber of another")
  void shouldDeliverPublishedMessage() {
    contextRunner()
        .run(
            context -> {
              // Arrange
              final var factory = context.getBean(NamespacedRedisClientFactory.class);
              final var received = new CopyOnWriteArrayList<String>();
              final var token = SubscriptionToken.create();
              final var executor = Executors.newSingleThreadExecutor();

              try (var subscriber = factory.open("events");
                  var publisher = factory.open("events")) {
                final var loop = subscriber.subscribeAsync("news", received::add, token, executor);

                // Act: publish until the subscription is live
                await()
                    .atMost(5, SECONDS)
                    .pollInterval(Duration.ofMillis(100))
                    .until(
                        () -> {
                          if (received.isEmpty()) {
                            publisher.publish("news", "x");
                          }
                          return !received.isEmpty();
                        });

                // Assert
                token.cancel();
                loop.get(5, SECONDS);
                assertThat(received).first().isEqualTo("x");
              } finally {
                executor.shutdownNow();
              }
            });
  }
}
