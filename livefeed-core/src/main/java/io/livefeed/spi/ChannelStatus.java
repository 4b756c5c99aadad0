package io.livefeed.spi;

/**
 * Lifecycle states reported by a live channel.
 */
public enum ChannelStatus {
  /** The provider is still negotiating the channel. */
  CONNECTING,
  /** The channel is live and delivering change events. */
  ACTIVE,
  /** The channel failed; no further events will be delivered. */
  ERROR,
  /** The channel was closed, either remotely or by {@link ChannelProvider#close}. */
  CLOSED;

  /**
   * Returns whether this status ends the channel.
   *
   * @return {@code true} for {@link #ERROR} and {@link #CLOSED}
   */
  public boolean isTerminal() {
    return this == ERROR || this == CLOSED;
  }
}
