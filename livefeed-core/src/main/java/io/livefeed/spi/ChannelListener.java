package io.livefeed.spi;

/**
 * Receives asynchronous notifications for one channel.
 *
 * <p>Providers may invoke these methods from any thread, including
 * synchronously from within {@link ChannelProvider#open}. Implementations
 * must not block.
 */
public interface ChannelListener {

  /**
   * Called whenever the channel changes state.
   *
   * @param status the new status
   * @param cause  the failure reported with {@link ChannelStatus#ERROR}, otherwise {@code null}
   */
  void onStatus(ChannelStatus status, Throwable cause);

  /**
   * Called for every change event while the channel is active.
   *
   * @param event the change
   */
  void onChange(ChangeEvent event);
}
