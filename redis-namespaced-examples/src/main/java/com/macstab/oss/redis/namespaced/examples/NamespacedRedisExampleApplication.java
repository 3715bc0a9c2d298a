/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.namespaced.examples;

import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.redis.namespaced.NamespacedRedisClientFactory;
import com.macstab.oss.redis.namespaced.SubscriptionToken;

import lombok.extern.slf4j.Slf4j;

/**
 * Example Spring Boot application demonstrating namespaced Redis clients.
 *
 * <p>Run with: {@code mvn -pl redis-namespaced-examples -am spring-boot:run}
 *
 * <p>Requires Redis running on localhost:6379 or configure via:
 *
 * <pre>{@code
 * spring.data.redis.host=your-redis-host
 * spring.data.redis.port=6379
 * }</pre>
 */
@Slf4j
@SpringBootApplication
public class NamespacedRedisExampleApplication {

  public static void main(String[] args) {
    SpringApplication.run(NamespacedRedisExampleApplication.class, args);
  }

  @Bean
  CommandLineRunner demo(NamespacedRedisClientFactory factory) {
    return args -> {
      log.info("=== Namespaced Redis Client Example ===");

      try (var client = factory.open("example")) {
        // Locked SET, unlocked GET
        client.set("example:key", "Hello from a namespaced client!");
        log.info("Stored and retrieved: {}", client.get("example:key"));

        // Locked SADD
        final var added = client.sadd("example:members", "alice", "bob", "alice");
        log.info("Added {} distinct members, keys: {}", added, client.keys("example:*"));
      }

      // Pub/Sub between two clients of one namespace
      final var executor = Executors.newSingleThreadExecutor();
      final var token = SubscriptionToken.create();

      try (var subscriber = factory.open("chat");
          var publisher = factory.open("chat")) {
        final var loop =
            subscriber.subscribeAsync(
                "chat:room", payload -> log.info("Received: {}", payload), token, executor);

        TimeUnit.MILLISECONDS.sleep(200);
        publisher.publish("chat:room", "hello");
        TimeUnit.MILLISECONDS.sleep(200);

        token.cancel();
        loop.get(5, TimeUnit.SECONDS);
      } finally {
        executor.shutdownNow();
      }

      log.info("=== Example complete ===");
    };
  }
}
