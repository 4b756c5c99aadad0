package io.livefeed.coordinator;

import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/** Polls a condition until it holds or the timeout elapses. */
final class Await {

  private Await() {
  }

  static void until(BooleanSupplier condition, String message) {
    until(condition, 5_000, message);
  }

  static void until(BooleanSupplier condition, long timeoutMs, String message) {
    long deadline = System.currentTimeMillis() + timeoutMs;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        fail("Timed out after " + timeoutMs + " ms waiting for: " + message);
      }
      try {
        Thread.sleep(5);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        fail("Interrupted while waiting for: " + message);
      }
    }
  }
}
