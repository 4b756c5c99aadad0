package io.livefeed.spi;

/**
 * Backend pub/sub connection that hands out live channels.
 *
 * <p>This is the only point where the coordinator touches the backend.
 * Implementations wrap a concrete realtime client; tests use a fake that
 * emits statuses deterministically.
 *
 * @see io.livefeed.coordinator.SubscriptionCoordinator
 */
public interface ChannelProvider {

  /**
   * Starts opening a channel for {@code topic}. Returns immediately; progress
   * is reported through {@code listener}.
   *
   * @param topic    the topic to watch
   * @param listener receives status notifications and change events
   * @return a handle for the new channel, never {@code null}
   * @throws RuntimeException if the channel cannot even be requested
   */
  ChannelHandle open(String topic, ChannelListener listener);

  /**
   * Tears down a channel. Idempotent, and safe to call for a channel that
   * never reached {@link ChannelStatus#ACTIVE}.
   *
   * @param handle the channel to close
   */
  void close(ChannelHandle handle);
}
