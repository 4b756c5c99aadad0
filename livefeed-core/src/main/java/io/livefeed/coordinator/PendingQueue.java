package io.livefeed.coordinator;

import io.livefeed.SubscriptionKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Requests waiting for admission, kept sorted by priority (descending), then
 * enqueue time and sequence (ascending). Holds at most one request per
 * {@link SubscriptionKey}.
 *
 * <p>Not thread-safe; guarded by the owning coordinator's lock.
 */
public final class PendingQueue {

  static final Comparator<SubscriptionRequest> ORDER =
      Comparator.comparingInt(SubscriptionRequest::priority).reversed()
          .thenComparingLong(SubscriptionRequest::enqueuedAt)
          .thenComparingLong(SubscriptionRequest::sequence);

  private final List<SubscriptionRequest> requests = new ArrayList<>();

  /**
   * Inserts a request at the position dictated by the ordering.
   *
   * @param request the request to insert
   * @return {@code false} if a request for the same key is already queued
   */
  public boolean offer(SubscriptionRequest request) {
    if (find(request.key()).isPresent()) {
      return false;
    }
    int index = 0;
    while (index < requests.size() && ORDER.compare(requests.get(index), request) <= 0) {
      index++;
    }
    requests.add(index, request);
    return true;
  }

  /**
   * Removes and returns the head of the queue.
   *
   * @return the highest-priority, earliest request, or {@code null} if empty
   */
  public SubscriptionRequest poll() {
    return requests.isEmpty() ? null : requests.remove(0);
  }

  public Optional<SubscriptionRequest> find(SubscriptionKey key) {
    for (SubscriptionRequest request : requests) {
      if (request.key().equals(key)) {
        return Optional.of(request);
      }
    }
    return Optional.empty();
  }

  /**
   * Removes the request with the given id.
   *
   * @param id request id
   * @return {@code true} if a request was removed
   */
  public boolean remove(String id) {
    return requests.removeIf(r -> r.id().equals(id));
  }

  public int size() {
    return requests.size();
  }

  public boolean isEmpty() {
    return requests.isEmpty();
  }

  public void clear() {
    requests.clear();
  }

  /**
   * Returns the queued requests in admission order.
   *
   * @return an immutable copy
   */
  public List<SubscriptionRequest> snapshot() {
    return List.copyOf(requests);
  }
}
