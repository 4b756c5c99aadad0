package io.livefeed.coordinator;

import io.livefeed.ChangeCallback;
import io.livefeed.SubscriptionKey;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One caller's intent to be notified of changes on a topic, waiting for admission.
 *
 * <p>Instances are immutable; a retry or a demotion produces a new request that keeps
 * the same {@link #id()} so the caller's handle stays valid across attempts.
 *
 * @param id          stable identity returned to the caller
 * @param key         scope and topic
 * @param callback    the caller's change callback
 * @param retryCount  admission attempts already failed, {@code 0} for a fresh request
 * @param priority    higher values are admitted first
 * @param enqueuedAt  epoch millis of the original enqueue, FIFO tiebreaker
 * @param sequence    insertion sequence, tiebreaker within the same millisecond
 */
public record SubscriptionRequest(String id, SubscriptionKey key, ChangeCallback callback,
    int retryCount, int priority, long enqueuedAt, long sequence) {

  private static final long SUFFIX_BOUND = 101_559_956_668_416L; // 36^9
  private static final int SUFFIX_LENGTH = 9;

  public SubscriptionRequest {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(callback, "callback");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0, got: " + retryCount);
    }
  }

  /**
   * Creates a fresh request with a newly minted id.
   *
   * @param key      scope and topic
   * @param callback the caller's change callback
   * @param priority admission priority
   * @param now      current epoch millis
   * @param sequence insertion sequence
   * @return a request with {@code retryCount == 0}
   */
  public static SubscriptionRequest create(SubscriptionKey key, ChangeCallback callback,
      int priority, long now, long sequence) {
    return new SubscriptionRequest(newId(key, now), key, callback, 0, priority, now, sequence);
  }

  /**
   * Builds an id of the form {@code <scope>-<topic>-<epochMillis>-<9 base-36 chars>}.
   */
  static String newId(SubscriptionKey key, long now) {
    String suffix = Long.toString(ThreadLocalRandom.current().nextLong(SUFFIX_BOUND), 36);
    StringBuilder sb = new StringBuilder(key.scope().length() + key.topic().length() + 32)
        .append(key.scope()).append('-')
        .append(key.topic()).append('-')
        .append(now).append('-');
    for (int i = suffix.length(); i < SUFFIX_LENGTH; i++) {
      sb.append('0');
    }
    return sb.append(suffix).toString();
  }

  public String scope() {
    return key.scope();
  }

  public String topic() {
    return key.topic();
  }

  /**
   * Returns the request to re-enqueue after a failed attempt: one more retry
   * counted, priority boosted by one (saturating at {@link Integer#MAX_VALUE}),
   * original enqueue time kept.
   *
   * @return the retry request
   */
  public SubscriptionRequest retried() {
    int boosted = priority == Integer.MAX_VALUE ? priority : priority + 1;
    return new SubscriptionRequest(id, key, callback, retryCount + 1, boosted,
        enqueuedAt, sequence);
  }

  /**
   * Returns a fresh request for a subscription whose live channel was lost.
   *
   * @param now      current epoch millis
   * @param sequence insertion sequence
   * @return a request with the same id and priority and {@code retryCount == 0}
   */
  public SubscriptionRequest demoted(long now, long sequence) {
    return new SubscriptionRequest(id, key, callback, 0, priority, now, sequence);
  }
}
