package io.livefeed;

/**
 * Zero-argument notification invoked every time the watched topic changes.
 *
 * <p>The callback belongs to the caller: the coordinator never wraps, replaces or
 * mutates it. It runs on the channel provider's notification thread, so it should
 * hand off any real work (reload a view, invalidate a cache) instead of doing it
 * inline.
 *
 * <h2>Error Handling</h2>
 * <p>Exceptions thrown by the callback are logged and discarded. They never tear
 * down the channel and never reach the provider.
 *
 * <pre>{@code
 * String id = coordinator.request("sessions", () -> sessionsView.refresh(), 1, "dashboard");
 * }</pre>
 *
 * @see io.livefeed.coordinator.SubscriptionCoordinator#request(String, ChangeCallback, int, String)
 */
@FunctionalInterface
public interface ChangeCallback {

  /**
   * Reacts to a change on the subscribed topic.
   *
   * @throws Exception if the reaction fails; logged by the coordinator
   */
  void onChange() throws Exception;
}
