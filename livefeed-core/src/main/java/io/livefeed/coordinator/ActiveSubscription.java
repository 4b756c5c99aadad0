package io.livefeed.coordinator;

import io.livefeed.SubscriptionKey;
import io.livefeed.spi.ChannelHandle;

import java.time.Instant;

/**
 * A subscription whose channel reached {@code ACTIVE}.
 *
 * <p>Shares its id with the originating {@link SubscriptionRequest}. The channel handle
 * is owned exclusively by this entry.
 */
public final class ActiveSubscription {
  private final SubscriptionRequest request;
  private final ChannelAdmission admission;
  private final long activatedAt;
  private volatile long lastActivityAt;

  ActiveSubscription(SubscriptionRequest request, ChannelAdmission admission, long activatedAt) {
    this.request = request;
    this.admission = admission;
    this.activatedAt = activatedAt;
    this.lastActivityAt = activatedAt;
  }

  public String id() {
    return request.id();
  }

  public SubscriptionKey key() {
    return request.key();
  }

  public String scope() {
    return request.scope();
  }

  public String topic() {
    return request.topic();
  }

  public ChannelHandle handle() {
    return admission.handle();
  }

  /**
   * Returns how many failed attempts preceded this activation.
   *
   * @return retry count at the moment of success
   */
  public int retryCount() {
    return request.retryCount();
  }

  public Instant activatedAt() {
    return Instant.ofEpochMilli(activatedAt);
  }

  /**
   * Returns the last time the channel reported a status or change event.
   *
   * @return last activity, never before {@link #activatedAt()}
   */
  public Instant lastActivityAt() {
    return Instant.ofEpochMilli(lastActivityAt);
  }

  SubscriptionRequest request() {
    return request;
  }

  ChannelAdmission admission() {
    return admission;
  }

  long lastActivityMillis() {
    return lastActivityAt;
  }

  void recordActivity(long now) {
    if (now > lastActivityAt) {
      lastActivityAt = now;
    }
  }

  @Override
  public String toString() {
    return "ActiveSubscription{id=" + id() + ", key=" + key() + ", retryCount=" + retryCount() + "}";
  }
}
