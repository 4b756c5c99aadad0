package io.livefeed.coordinator;

/**
 * Point-in-time view of a {@link SubscriptionCoordinator}.
 *
 * @param queuedCount requests waiting for admission, including retries in backoff
 * @param activeCount live channels
 * @param isDraining  whether the drain loop is running
 */
public record CoordinatorStatus(int queuedCount, int activeCount, boolean isDraining) {

  /** Status of an idle coordinator with nothing queued or active. */
  public static final CoordinatorStatus IDLE = new CoordinatorStatus(0, 0, false);
}
