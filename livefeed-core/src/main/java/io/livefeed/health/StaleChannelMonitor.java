package io.livefeed.health;

import io.livefeed.coordinator.SubscriptionCoordinator;
import io.livefeed.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled heartbeat that recycles live channels which have gone quiet.
 *
 * <p>Every {@code interval} the monitor asks the coordinator to
 * {@linkplain SubscriptionCoordinator#recycleIdle(Duration) recycle} subscriptions with
 * no status or change event for longer than {@code idleThreshold}. A recycled
 * subscription keeps its id and goes back through normal admission.
 *
 * <p>Only useful for topics that change regularly; a quiet topic is indistinguishable
 * from a dead channel. Create instances via {@link #builder()}.
 *
 * @see StaleChannelMonitor.Builder
 */
public final class StaleChannelMonitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(StaleChannelMonitor.class.getName());

  private final SubscriptionCoordinator coordinator;
  private final Duration idleThreshold;
  private final Duration interval;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private StaleChannelMonitor(Builder builder) {
    this.coordinator = Objects.requireNonNull(builder.coordinator, "coordinator");
    Objects.requireNonNull(builder.idleThreshold, "idleThreshold");
    Objects.requireNonNull(builder.interval, "interval");
    if (builder.idleThreshold.isNegative() || builder.idleThreshold.isZero()) {
      throw new IllegalArgumentException("idleThreshold must be > 0");
    }
    if (builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.idleThreshold = builder.idleThreshold;
    this.interval = builder.interval;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the periodic sweep. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("StaleChannelMonitor has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("livefeed-stale-"));
    long periodMs = interval.toMillis();
    sweepTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, periodMs, periodMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single sweep.
   *
   * <p>May be invoked directly for testing or one-off checks.
   *
   * @return number of subscriptions recycled
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      int recycled = coordinator.recycleIdle(idleThreshold);
      if (recycled > 0) {
        logger.log(Level.INFO, "Recycled {0} subscriptions idle for more than {1}",
            new Object[]{recycled, idleThreshold});
      }
      return recycled;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Stale channel sweep failed", t);
      return 0;
    }
  }

  /** Cancels the sweep schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link StaleChannelMonitor}. */
  public static final class Builder {
    private SubscriptionCoordinator coordinator;
    private Duration idleThreshold = Duration.ofSeconds(60);
    private Duration interval = Duration.ofSeconds(30);

    private Builder() {}

    /**
     * Sets the coordinator whose active subscriptions are checked.
     *
     * <p><b>Required.</b>
     *
     * @param coordinator the coordinator
     * @return this builder
     */
    public Builder coordinator(SubscriptionCoordinator coordinator) {
      this.coordinator = coordinator;
      return this;
    }

    /**
     * Sets how long a channel may stay silent before it is recycled.
     *
     * <p>Optional. Defaults to {@code 60 seconds}. Must be &gt; 0.
     *
     * @param idleThreshold maximum silence
     * @return this builder
     */
    public Builder idleThreshold(Duration idleThreshold) {
      this.idleThreshold = idleThreshold;
      return this;
    }

    /**
     * Sets the time between sweeps.
     *
     * <p>Optional. Defaults to {@code 30 seconds}. Must be &gt; 0.
     *
     * @param interval sweep interval
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Builds the monitor. Call {@link StaleChannelMonitor#start()} to begin.
     *
     * @return a new {@link StaleChannelMonitor}
     * @throws NullPointerException     if {@code coordinator} is null
     * @throws IllegalArgumentException if {@code idleThreshold} or {@code interval} is not positive
     */
    public StaleChannelMonitor build() {
      return new StaleChannelMonitor(this);
    }
  }
}
