package io.livefeed.coordinator;

import io.livefeed.spi.ChangeEvent;
import io.livefeed.spi.ChannelHandle;
import io.livefeed.spi.ChannelListener;
import io.livefeed.spi.ChannelProvider;
import io.livefeed.spi.ChannelStatus;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One attempt to turn a {@link SubscriptionRequest} into a live channel, and the
 * listener for that channel for as long as it lives.
 *
 * <p>The first {@code ACTIVE} completes the admission; {@code ERROR} or {@code CLOSED}
 * before that fails it. After activation a terminal status reports the channel as lost
 * to the owning coordinator. The channel is closed at most once, whoever asks first.
 */
final class ChannelAdmission implements ChannelListener {
  private static final Logger logger = Logger.getLogger(ChannelAdmission.class.getName());

  private final SubscriptionRequest request;
  private final SubscriptionCoordinator owner;
  private final CompletableFuture<Void> outcome = new CompletableFuture<>();
  private final AtomicBoolean channelClosed = new AtomicBoolean();
  private final AtomicBoolean lost = new AtomicBoolean();

  private volatile ChannelHandle handle;
  private volatile boolean activated;
  private volatile boolean cancelled;
  private volatile boolean abandoned;
  private volatile ActiveSubscription active;

  ChannelAdmission(SubscriptionRequest request, SubscriptionCoordinator owner) {
    this.request = request;
    this.owner = owner;
  }

  SubscriptionRequest request() {
    return request;
  }

  String id() {
    return request.id();
  }

  ChannelHandle handle() {
    return handle;
  }

  boolean isCancelled() {
    return cancelled;
  }

  boolean isLost() {
    return lost.get();
  }

  boolean isPromoted() {
    return active != null;
  }

  void promoted(ActiveSubscription subscription) {
    this.active = subscription;
  }

  /**
   * Asks the provider for a channel. A cancel that raced with the call closes the
   * channel as soon as the handle is known.
   */
  void open(ChannelProvider provider) throws AdmissionException {
    ChannelHandle opened;
    try {
      opened = provider.open(request.topic(), this);
    } catch (RuntimeException e) {
      throw new AdmissionException("Failed to open channel for " + request.key(), null, e);
    }
    if (opened == null) {
      throw new AdmissionException("Provider returned no channel for " + request.key(), null, null);
    }
    handle = opened;
    if (cancelled) {
      closeChannel(provider);
    }
  }

  /**
   * Blocks until the channel is active.
   *
   * @throws AdmissionException    on {@code ERROR}/{@code CLOSED} before activation, or timeout
   * @throws CancellationException if the admission was cancelled while waiting
   */
  void awaitActive(long timeoutMs) throws AdmissionException, InterruptedException {
    try {
      outcome.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof AdmissionException admissionFailure) {
        throw admissionFailure;
      }
      throw new AdmissionException("Admission failed for " + request.key(), null, cause);
    } catch (TimeoutException e) {
      throw AdmissionException.timedOut(request.id(), timeoutMs);
    }
  }

  /**
   * Marks the admission cancelled: wakes a waiting drain thread and silences any
   * later notifications from the channel.
   */
  void cancel() {
    cancelled = true;
    outcome.cancel(false);
  }

  /**
   * Marks a failed attempt as given up: any later status or change from its channel
   * is ignored. Unlike {@link #cancel()} the request itself stays eligible for retry.
   */
  void abandon() {
    abandoned = true;
  }

  /**
   * Closes the channel unless it was already closed.
   *
   * @return {@code true} if this call closed it
   */
  boolean closeChannel(ChannelProvider provider) {
    ChannelHandle h = handle;
    if (h == null || !channelClosed.compareAndSet(false, true)) {
      return false;
    }
    try {
      provider.close(h);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Error closing channel for " + request.id(), e);
    }
    return true;
  }

  @Override
  public void onStatus(ChannelStatus status, Throwable cause) {
    if (cancelled || abandoned) {
      return;
    }
    touch();
    switch (status) {
      case ACTIVE -> {
        if (!activated) {
          activated = true;
          outcome.complete(null);
        }
      }
      case ERROR, CLOSED -> {
        if (!activated) {
          outcome.completeExceptionally(new AdmissionException(
              "Subscription " + request.id() + " failed with status: " + status, status, cause));
        } else if (lost.compareAndSet(false, true)) {
          owner.channelLost(this, status, cause);
        }
      }
      default -> {
        // CONNECTING: nothing to do beyond recording activity
      }
    }
  }

  @Override
  public void onChange(ChangeEvent event) {
    if (!activated || cancelled || abandoned || lost.get()) {
      return;
    }
    touch();
    try {
      request.callback().onChange();
    } catch (Exception e) {
      logger.log(Level.WARNING, "Change callback failed for " + request.id(), e);
    }
  }

  private void touch() {
    ActiveSubscription subscription = active;
    if (subscription != null) {
      subscription.recordActivity(System.currentTimeMillis());
    }
  }
}
