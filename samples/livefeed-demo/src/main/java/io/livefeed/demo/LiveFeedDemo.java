package io.livefeed.demo;

import io.livefeed.coordinator.ExponentialBackoffRetryPolicy;
import io.livefeed.coordinator.SubscriptionCoordinator;

import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simple demo showing the subscription coordinator without Spring.
 *
 * Run with: mvn -pl samples/livefeed-demo exec:java
 */
public final class LiveFeedDemo {

  public static void main(String[] args) throws Exception {
    // 1. Simulated backend; "orders" fails its first connection
    SimulatedChannelProvider backend = new SimulatedChannelProvider(Set.of("orders"), 200);

    // 2. Coordinator with a fast retry schedule
    SubscriptionCoordinator coordinator = SubscriptionCoordinator.builder()
        .channelProvider(backend)
        .retryPolicy(new ExponentialBackoffRetryPolicy(250, 5_000))
        .maxRetries(3)
        .admissionTimeoutMs(2_000)
        .interAdmissionDelayMs(50)
        .failureListener((id, key, attempts, cause) ->
            System.out.println("[Dropped] " + key + " after " + attempts + " attempts: " + cause.getMessage()))
        .build();

    System.out.println("=== LiveFeed Demo ===\n");

    AtomicInteger sessionChanges = new AtomicInteger();
    CountDownLatch ordersChanged = new CountDownLatch(3);

    // 3. Several screens ask for feeds; two of them want the same thing
    String sessions = coordinator.request("sessions", () -> {
      System.out.println("[Dashboard] sessions changed");
      sessionChanges.incrementAndGet();
    }, 1, "dashboard");
    String sessionsAgain = coordinator.request("sessions", () ->
        System.out.println("[Never called] duplicate callback"), 1, "dashboard");
    String orders = coordinator.request("orders", () -> {
      System.out.println("[Admin] orders changed");
      ordersChanged.countDown();
    }, 5, "admin");
    coordinator.request("messages", () -> System.out.println("[Chat] messages changed"), 1, "chat");

    System.out.println("sessions id:        " + sessions);
    System.out.println("duplicate sessions: " + sessionsAgain + " (same id: " + sessions.equals(sessionsAgain) + ")");
    System.out.println("orders id:          " + orders);
    System.out.println("status:             " + coordinator.status() + "\n");

    // 4. Wait for the retried "orders" feed to deliver
    boolean completed = ordersChanged.await(10, TimeUnit.SECONDS);
    System.out.println();
    if (completed) {
      System.out.println("orders recovered after "
          + coordinator.activeSubscription(orders).map(s -> s.retryCount()).orElse(-1) + " retries");
    } else {
      System.out.println("Timeout waiting for orders changes");
    }
    System.out.println("active: " + coordinator.listActive());
    System.out.println("status: " + coordinator.status());
    System.out.println("session changes seen: " + sessionChanges.get());

    // 5. Cancel one, then tear everything down
    coordinator.cancel(sessions);
    System.out.println("\nafter cancel, sessions active: " + coordinator.hasActive("sessions"));

    coordinator.close();
    System.out.println("open channels after close: " + backend.openChannels());
    backend.close();

    System.out.println("\nDemo complete.");
  }
}
