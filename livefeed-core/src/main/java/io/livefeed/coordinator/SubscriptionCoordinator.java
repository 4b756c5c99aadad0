package io.livefeed.coordinator;

import io.livefeed.ChangeCallback;
import io.livefeed.SubscriptionFailureListener;
import io.livefeed.SubscriptionKey;
import io.livefeed.spi.ChannelProvider;
import io.livefeed.spi.ChannelStatus;
import io.livefeed.spi.MetricsExporter;
import io.livefeed.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Arbitrates live-update subscriptions from many independent callers against one
 * shared {@link ChannelProvider}.
 *
 * <p>Callers {@linkplain #request(String, ChangeCallback, int, String) request} a feed
 * for a {@code (scope, topic)} pair. Identical intents are deduplicated and answered
 * with the existing id. New requests wait in a priority-ordered {@link PendingQueue}
 * and are admitted one at a time by a single drain thread, with a short pause between
 * admissions. Each admission waits for the channel to turn {@code ACTIVE}, bounded by
 * a timeout; failures are retried with exponential backoff and a priority boost, up to
 * {@code maxRetries}, after which the request is dropped. A live channel that later
 * reports {@code ERROR} or {@code CLOSED} is demoted back into the queue under the
 * same id.
 *
 * <p>All queue and registry mutations happen under one monitor, so the class is
 * thread-safe. Channel callbacks and change notifications run on the provider's
 * threads, never while that monitor is held by the coordinator.
 *
 * <p>Create instances via {@link #builder()}; share one instance per backend
 * connection. Implements {@link AutoCloseable}; {@link #reset()} tears down all
 * subscriptions but keeps the coordinator usable.
 *
 * @see SubscriptionCoordinator.Builder
 * @see ChannelProvider
 */
public final class SubscriptionCoordinator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SubscriptionCoordinator.class.getName());

  /** Priority used when the caller does not name one. */
  public static final int DEFAULT_PRIORITY = 1;

  private final ChannelProvider channelProvider;
  private final RetryPolicy retryPolicy;
  private final int maxRetries;
  private final long admissionTimeoutMs;
  private final long interAdmissionDelayMs;
  private final MetricsExporter metrics;
  private final SubscriptionFailureListener failureListener;

  private final ExecutorService drainExecutor;
  private final ScheduledExecutorService timer;

  private final Object lock = new Object();
  private final PendingQueue queue = new PendingQueue();
  private final ActiveRegistry registry = new ActiveRegistry();
  private final Map<String, PendingRetry> retries = new HashMap<>();
  private ChannelAdmission inFlight;
  private boolean draining;
  private long drainGeneration;
  private long sequence;
  private boolean closed;

  private SubscriptionCoordinator(Builder builder) {
    this.channelProvider = Objects.requireNonNull(builder.channelProvider, "channelProvider");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1000, Long.MAX_VALUE);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.failureListener = builder.failureListener;

    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (builder.admissionTimeoutMs <= 0) {
      throw new IllegalArgumentException("admissionTimeoutMs must be > 0");
    }
    if (builder.interAdmissionDelayMs < 0) {
      throw new IllegalArgumentException("interAdmissionDelayMs must be >= 0");
    }
    this.maxRetries = builder.maxRetries;
    this.admissionTimeoutMs = builder.admissionTimeoutMs;
    this.interAdmissionDelayMs = builder.interAdmissionDelayMs;

    this.drainExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("livefeed-drain-"));
    this.timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("livefeed-timer-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Admission control ───────────────────────────────────────────

  /**
   * Requests a live feed for {@code topic} in the default scope with default priority.
   *
   * @see #request(String, ChangeCallback, int, String)
   */
  public String request(String topic, ChangeCallback callback) {
    return request(topic, callback, DEFAULT_PRIORITY, SubscriptionKey.DEFAULT_SCOPE);
  }

  /**
   * Requests a live feed for {@code topic} in the default scope.
   *
   * @see #request(String, ChangeCallback, int, String)
   */
  public String request(String topic, ChangeCallback callback, int priority) {
    return request(topic, callback, priority, SubscriptionKey.DEFAULT_SCOPE);
  }

  /**
   * Requests a live feed for {@code topic} within {@code scope}.
   *
   * <p>If the same {@code (scope, topic)} is already active, queued, being admitted or
   * waiting to retry, returns that subscription's id and changes nothing; the new
   * callback is not registered. Otherwise enqueues a new request and starts the drain
   * loop if it is idle.
   *
   * <p>Admission failures are never reported here: the request is retried in the
   * background and, once retries run out, dropped.
   *
   * @param topic    backend resource to watch, non-empty
   * @param callback invoked on every change once the channel is active
   * @param priority higher values are admitted first
   * @param scope    caller namespace, non-empty
   * @return the subscription id, usable with {@link #cancel(String)}
   * @throws IllegalArgumentException if {@code topic} or {@code scope} is empty
   * @throws IllegalStateException    if the coordinator has been closed
   */
  public String request(String topic, ChangeCallback callback, int priority, String scope) {
    SubscriptionKey key = new SubscriptionKey(scope, topic);
    Objects.requireNonNull(callback, "callback");
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("SubscriptionCoordinator has been closed");
      }
      String existing = existingId(key);
      if (existing != null) {
        metrics.incrementRequestDeduplicated();
        logger.log(Level.FINE, "Subscription for {0} already present: {1}",
            new Object[]{key, existing});
        return existing;
      }
      SubscriptionRequest request = SubscriptionRequest.create(
          key, callback, priority, System.currentTimeMillis(), ++sequence);
      queue.offer(request);
      metrics.incrementRequestAccepted();
      recordDepthsLocked();
      logger.log(Level.FINE, "Queued subscription request {0} (priority {1})",
          new Object[]{request.id(), priority});
      startDrainIfIdleLocked();
      return request.id();
    }
  }

  /**
   * Cancels a subscription in whatever phase it is: queued requests are removed
   * without opening a channel, a pending retry is unscheduled, an in-flight admission
   * is aborted and an active channel is closed exactly once. Unknown ids are ignored.
   *
   * @param id the id returned by {@code request}
   */
  public void cancel(String id) {
    if (id == null) {
      return;
    }
    ChannelAdmission toClose = null;
    synchronized (lock) {
      if (queue.remove(id)) {
        logger.log(Level.FINE, "Cancelled queued subscription {0}", id);
      } else if (retries.containsKey(id)) {
        retries.remove(id).future().cancel(false);
        logger.log(Level.FINE, "Cancelled subscription {0} awaiting retry", id);
      } else if (inFlight != null && inFlight.id().equals(id)) {
        toClose = inFlight;
        toClose.cancel();
        inFlight = null;
        logger.log(Level.FINE, "Cancelled subscription {0} during admission", id);
      } else {
        Optional<ActiveSubscription> removed = registry.remove(id);
        if (removed.isEmpty()) {
          return;
        }
        toClose = removed.get().admission();
        toClose.cancel();
        logger.log(Level.FINE, "Cancelled active subscription {0}", id);
      }
      metrics.incrementSubscriptionCancelled();
      recordDepthsLocked();
    }
    if (toClose != null) {
      toClose.closeChannel(channelProvider);
    }
  }

  // ── Introspection ───────────────────────────────────────────────

  /**
   * Returns whether any scope holds a live channel for {@code topic}.
   *
   * @param topic the topic
   * @return {@code true} if at least one active subscription watches it
   */
  public boolean hasActive(String topic) {
    synchronized (lock) {
      return registry.hasTopic(topic);
    }
  }

  /**
   * Returns the ids of all active subscriptions in activation order.
   *
   * @return an immutable list
   */
  public List<String> listActive() {
    synchronized (lock) {
      return registry.ids();
    }
  }

  public Optional<ActiveSubscription> activeSubscription(String id) {
    synchronized (lock) {
      return registry.get(id);
    }
  }

  public CoordinatorStatus status() {
    synchronized (lock) {
      return new CoordinatorStatus(queuedCountLocked(), registry.size(), draining);
    }
  }

  // ── Teardown ────────────────────────────────────────────────────

  /**
   * Closes every channel, forgets every request and stops the drain loop. The
   * coordinator accepts new requests afterwards.
   */
  public void reset() {
    List<ChannelAdmission> toClose = new ArrayList<>();
    synchronized (lock) {
      drainGeneration++;
      draining = false;
      queue.clear();
      for (PendingRetry retry : retries.values()) {
        retry.future().cancel(false);
      }
      retries.clear();
      if (inFlight != null) {
        inFlight.cancel();
        toClose.add(inFlight);
        inFlight = null;
      }
      for (ActiveSubscription subscription : registry.drain()) {
        subscription.admission().cancel();
        toClose.add(subscription.admission());
      }
      recordDepthsLocked();
    }
    int closedChannels = 0;
    for (ChannelAdmission admission : toClose) {
      if (admission.closeChannel(channelProvider)) {
        closedChannels++;
      }
    }
    logger.log(Level.INFO, "Reset subscription coordinator; closed {0} channels", closedChannels);
  }

  /**
   * Resets the coordinator and shuts down its threads. Idempotent.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
    }
    reset();
    drainExecutor.shutdownNow();
    timer.shutdownNow();
    try {
      if (!drainExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Drain thread did not terminate within 5 seconds");
      }
      timer.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  // ── Stale channels ──────────────────────────────────────────────

  /**
   * Demotes active subscriptions that have shown no activity for longer than
   * {@code idleThreshold}: each channel is closed and a fresh request with the same id
   * is queued.
   *
   * @param idleThreshold maximum silence tolerated
   * @return number of subscriptions recycled
   */
  public int recycleIdle(Duration idleThreshold) {
    Objects.requireNonNull(idleThreshold, "idleThreshold");
    long cutoff = System.currentTimeMillis() - idleThreshold.toMillis();
    List<ChannelAdmission> toClose = new ArrayList<>();
    synchronized (lock) {
      if (closed) {
        return 0;
      }
      for (ActiveSubscription subscription : registry.snapshot()) {
        if (subscription.lastActivityMillis() < cutoff) {
          subscription.admission().cancel();
          toClose.add(subscription.admission());
          demoteLocked(subscription);
        }
      }
      if (!toClose.isEmpty()) {
        recordDepthsLocked();
        startDrainIfIdleLocked();
      }
    }
    for (ChannelAdmission admission : toClose) {
      logger.log(Level.WARNING, "Recycling idle subscription {0}", admission.id());
      admission.closeChannel(channelProvider);
    }
    return toClose.size();
  }

  // ── Drain loop ──────────────────────────────────────────────────

  private void startDrainIfIdleLocked() {
    if (draining || closed || queue.isEmpty()) {
      return;
    }
    draining = true;
    long generation = drainGeneration;
    drainExecutor.execute(() -> drainLoop(generation));
  }

  private void drainLoop(long generation) {
    try {
      while (true) {
        ChannelAdmission admission;
        synchronized (lock) {
          if (generation != drainGeneration || closed) {
            return;
          }
          SubscriptionRequest next = queue.poll();
          if (next == null) {
            draining = false;
            return;
          }
          if (registry.contains(next.key())) {
            logger.log(Level.FINE, "Skipping {0}: {1} is already active",
                new Object[]{next.id(), next.key()});
            recordDepthsLocked();
            continue;
          }
          admission = new ChannelAdmission(next, this);
          inFlight = admission;
        }
        try {
          admit(admission);
        } catch (InterruptedException e) {
          throw e;
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Drain loop error admitting " + admission.id(), t);
          if (admission.isPromoted()) {
            clearInFlight(admission);
          } else {
            admission.abandon();
            admission.closeChannel(channelProvider);
            handleFailure(admission, new AdmissionException(
                "Unexpected error admitting " + admission.id(), null, t));
          }
        }
        if (interAdmissionDelayMs > 0) {
          Thread.sleep(interAdmissionDelayMs);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      synchronized (lock) {
        if (generation == drainGeneration) {
          draining = false;
        }
      }
    }
  }

  private void admit(ChannelAdmission admission) throws InterruptedException {
    SubscriptionRequest request = admission.request();
    logger.log(Level.FINE, "Opening channel for {0} (retry {1})",
        new Object[]{request.id(), request.retryCount()});
    try {
      admission.open(channelProvider);
      admission.awaitActive(admissionTimeoutMs);
    } catch (CancellationException e) {
      clearInFlight(admission);
      return;
    } catch (InterruptedException e) {
      admission.cancel();
      admission.closeChannel(channelProvider);
      clearInFlight(admission);
      throw e;
    } catch (AdmissionException e) {
      admission.abandon();
      admission.closeChannel(channelProvider);
      handleFailure(admission, e);
      return;
    }
    promote(admission);
  }

  private void promote(ChannelAdmission admission) {
    SubscriptionRequest request = admission.request();
    synchronized (lock) {
      if (inFlight == admission) {
        inFlight = null;
      }
      if (!admission.isCancelled() && !closed && !admission.isLost()) {
        ActiveSubscription subscription =
            new ActiveSubscription(request, admission, System.currentTimeMillis());
        if (registry.register(subscription)) {
          admission.promoted(subscription);
          metrics.incrementAdmissionSuccess();
          recordDepthsLocked();
          logger.log(Level.INFO, "Subscription {0} active on topic {1} after {2} retries",
              new Object[]{request.id(), request.topic(), request.retryCount()});
          return;
        }
        logger.log(Level.FINE, "Discarding duplicate admission {0} for {1}",
            new Object[]{request.id(), request.key()});
      }
    }
    admission.closeChannel(channelProvider);
    if (admission.isLost()) {
      handleFailure(admission, new AdmissionException(
          "Channel for " + request.id() + " was lost before registration", ChannelStatus.CLOSED, null));
    }
  }

  private void clearInFlight(ChannelAdmission admission) {
    synchronized (lock) {
      if (inFlight == admission) {
        inFlight = null;
      }
    }
  }

  // ── Retry scheduler ─────────────────────────────────────────────

  private void handleFailure(ChannelAdmission admission, AdmissionException failure) {
    SubscriptionRequest request = admission.request();
    synchronized (lock) {
      if (inFlight == admission) {
        inFlight = null;
      }
      if (closed || admission.isCancelled()) {
        return;
      }
      if (request.retryCount() < maxRetries) {
        SubscriptionRequest retry = request.retried();
        long delayMs = retryPolicy.computeDelayMs(retry.retryCount());
        ScheduledFuture<?> future = timer.schedule(
            () -> reenqueue(retry), delayMs, TimeUnit.MILLISECONDS);
        retries.put(retry.id(), new PendingRetry(retry, future));
        metrics.incrementAdmissionFailure();
        recordDepthsLocked();
        logger.log(Level.WARNING, "Admission of {0} failed ({1}); retry {2}/{3} in {4} ms",
            new Object[]{request.id(), failure.getMessage(), retry.retryCount(), maxRetries, delayMs});
        return;
      }
      metrics.incrementSubscriptionDropped();
      recordDepthsLocked();
    }
    logger.log(Level.SEVERE, "Max retries exceeded for subscription " + request.id()
        + "; dropping it", failure);
    notifyDropped(request, failure);
  }

  private void reenqueue(SubscriptionRequest retry) {
    synchronized (lock) {
      PendingRetry pending = retries.remove(retry.id());
      if (pending == null || closed) {
        return;
      }
      if (registry.contains(retry.key()) || !queue.offer(retry)) {
        logger.log(Level.FINE, "Discarding stale retry {0} for {1}",
            new Object[]{retry.id(), retry.key()});
        recordDepthsLocked();
        return;
      }
      recordDepthsLocked();
      startDrainIfIdleLocked();
    }
  }

  private void notifyDropped(SubscriptionRequest request, AdmissionException failure) {
    if (failureListener == null) {
      return;
    }
    try {
      failureListener.onDropped(request.id(), request.key(), request.retryCount() + 1, failure);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failure listener threw for " + request.id(), e);
    }
  }

  // ── Lost channels ───────────────────────────────────────────────

  void channelLost(ChannelAdmission admission, ChannelStatus status, Throwable cause) {
    boolean demoted = false;
    synchronized (lock) {
      if (closed) {
        return;
      }
      Optional<ActiveSubscription> current = registry.get(admission.id());
      if (current.isPresent() && current.get().admission() == admission) {
        demoteLocked(current.get());
        metrics.incrementChannelLost();
        recordDepthsLocked();
        startDrainIfIdleLocked();
        demoted = true;
      }
    }
    if (demoted) {
      logger.log(Level.WARNING, "Channel for " + admission.id() + " reported " + status
          + "; re-queued", cause);
      admission.closeChannel(channelProvider);
    }
  }

  private void demoteLocked(ActiveSubscription subscription) {
    registry.removeExact(subscription);
    SubscriptionRequest fresh = subscription.request()
        .demoted(System.currentTimeMillis(), ++sequence);
    queue.offer(fresh);
  }

  // ── Internals ───────────────────────────────────────────────────

  private String existingId(SubscriptionKey key) {
    Optional<ActiveSubscription> active = registry.find(key);
    if (active.isPresent()) {
      return active.get().id();
    }
    Optional<SubscriptionRequest> queued = queue.find(key);
    if (queued.isPresent()) {
      return queued.get().id();
    }
    if (inFlight != null && inFlight.request().key().equals(key)) {
      return inFlight.id();
    }
    for (PendingRetry retry : retries.values()) {
      if (retry.request().key().equals(key)) {
        return retry.request().id();
      }
    }
    return null;
  }

  private int queuedCountLocked() {
    return queue.size() + retries.size();
  }

  private void recordDepthsLocked() {
    metrics.recordDepths(queuedCountLocked(), registry.size());
  }

  private record PendingRetry(SubscriptionRequest request, ScheduledFuture<?> future) {
  }

  /** Builder for {@link SubscriptionCoordinator}. */
  public static final class Builder {
    private ChannelProvider channelProvider;
    private RetryPolicy retryPolicy;
    private int maxRetries = 3;
    private long admissionTimeoutMs = 30_000;
    private long interAdmissionDelayMs = 100;
    private MetricsExporter metrics;
    private SubscriptionFailureListener failureListener;

    private Builder() {}

    /**
     * Sets the backend that opens and closes live channels.
     *
     * <p><b>Required.</b>
     *
     * @param channelProvider the channel provider
     * @return this builder
     */
    public Builder channelProvider(ChannelProvider channelProvider) {
      this.channelProvider = channelProvider;
      return this;
    }

    /**
     * Sets the policy that computes the backoff before each retry.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=1000} and no delay cap.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets how many times a failed admission is retried before the request is dropped.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     *
     * @param maxRetries maximum retries per request
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets how long one admission may wait for {@code ACTIVE} before the channel is
     * force-closed and the attempt counts as failed.
     *
     * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
     *
     * @param admissionTimeoutMs admission timeout in milliseconds
     * @return this builder
     */
    public Builder admissionTimeoutMs(long admissionTimeoutMs) {
      this.admissionTimeoutMs = admissionTimeoutMs;
      return this;
    }

    /**
     * Sets the pause between two consecutive admissions.
     *
     * <p>Optional. Defaults to {@code 100} ms. Must be &ge; 0.
     *
     * @param interAdmissionDelayMs delay in milliseconds
     * @return this builder
     */
    public Builder interAdmissionDelayMs(long interAdmissionDelayMs) {
      this.interAdmissionDelayMs = interAdmissionDelayMs;
      return this;
    }

    /**
     * Sets the metrics exporter for counters and queue depths.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets a listener told when a request is dropped after exhausting its retries.
     *
     * <p>Optional. Without one, dropped requests fail silently.
     *
     * @param failureListener the listener
     * @return this builder
     */
    public Builder failureListener(SubscriptionFailureListener failureListener) {
      this.failureListener = failureListener;
      return this;
    }

    /**
     * Builds the coordinator. Its threads start lazily with the first request.
     *
     * @return a new {@link SubscriptionCoordinator}
     * @throws NullPointerException     if {@code channelProvider} is null
     * @throws IllegalArgumentException if {@code maxRetries < 0},
     *     {@code admissionTimeoutMs <= 0} or {@code interAdmissionDelayMs < 0}
     */
    public SubscriptionCoordinator build() {
      return new SubscriptionCoordinator(this);
    }
  }
}
