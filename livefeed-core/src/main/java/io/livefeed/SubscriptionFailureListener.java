package io.livefeed;

/**
 * Optional hook told when a subscription is abandoned after exhausting its retries.
 *
 * <p>Without a listener a dropped subscription simply never delivers: the caller's
 * {@link ChangeCallback} is not invoked and no error surfaces. Register one with
 * {@link io.livefeed.coordinator.SubscriptionCoordinator.Builder#failureListener}
 * to surface the failure, for example as a degraded-connection banner.
 */
@FunctionalInterface
public interface SubscriptionFailureListener {

  /**
   * Called once, on the coordinator's drain thread, after the final failed attempt.
   *
   * @param id       the id returned by {@code request}
   * @param key      the scope and topic that could not be subscribed
   * @param attempts total admission attempts made
   * @param cause    the failure of the last attempt
   */
  void onDropped(String id, SubscriptionKey key, int attempts, Throwable cause);
}
