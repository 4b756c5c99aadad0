package io.livefeed.coordinator;

import io.livefeed.spi.ChannelStatus;

/**
 * Thrown when a request could not be turned into an active channel.
 *
 * <p>The coordinator treats every admission failure as transient and hands it to
 * the retry policy; it never reaches callers of
 * {@link SubscriptionCoordinator#request}.
 */
public final class AdmissionException extends Exception {

  private final ChannelStatus status;

  public AdmissionException(String message, ChannelStatus status, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  static AdmissionException timedOut(String id, long timeoutMs) {
    return new AdmissionException("Subscription " + id + " timed out after " + timeoutMs + " ms",
        null, null);
  }

  /**
   * Returns the channel status that ended the attempt.
   *
   * @return {@code ERROR} or {@code CLOSED}, or {@code null} for a timeout or open failure
   */
  public ChannelStatus status() {
    return status;
  }

  public boolean isTimeout() {
    return status == null && getCause() == null;
  }
}
