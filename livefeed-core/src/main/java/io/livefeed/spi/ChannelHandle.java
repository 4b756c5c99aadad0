package io.livefeed.spi;

/**
 * Opaque handle to one live channel opened by a {@link ChannelProvider}.
 *
 * <p>The coordinator never inspects a handle beyond {@link #topic()}; it only
 * passes it back to {@link ChannelProvider#close(ChannelHandle)}. Each handle
 * is owned by exactly one subscription.
 */
public interface ChannelHandle {

  /**
   * Returns the topic this channel watches.
   *
   * @return the topic name
   */
  String topic();
}
