package io.livefeed.micrometer;

import io.livefeed.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code livefeed.request.accepted}: requests that created a new subscription</li>
 *   <li>{@code livefeed.request.deduplicated}: requests answered with an existing id</li>
 *   <li>{@code livefeed.admission.success}: admissions that reached {@code ACTIVE}</li>
 *   <li>{@code livefeed.admission.failure}: failed admissions scheduled for retry</li>
 *   <li>{@code livefeed.subscription.dropped}: requests dropped after max retries</li>
 *   <li>{@code livefeed.channel.lost}: live channels lost and re-queued</li>
 *   <li>{@code livefeed.subscription.cancelled}: subscriptions cancelled by callers</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code livefeed.queue.depth}: requests waiting for admission, retries included</li>
 *   <li>{@code livefeed.active.count}: live channels</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter requestAccepted;
  private final Counter requestDeduplicated;
  private final Counter admissionSuccess;
  private final Counter admissionFailure;
  private final Counter subscriptionDropped;
  private final Counter channelLost;
  private final Counter subscriptionCancelled;
  private final Gauge queueDepthGauge;
  private final Gauge activeCountGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger activeCount = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "livefeed"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "livefeed");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several
   * coordinators in one application.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "admin.livefeed"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.requestAccepted = Counter.builder(namePrefix + ".request.accepted")
        .description("Requests that created a new subscription")
        .register(registry);
    this.requestDeduplicated = Counter.builder(namePrefix + ".request.deduplicated")
        .description("Requests answered with an existing subscription id")
        .register(registry);
    this.admissionSuccess = Counter.builder(namePrefix + ".admission.success")
        .description("Admissions that reached an active channel")
        .register(registry);
    this.admissionFailure = Counter.builder(namePrefix + ".admission.failure")
        .description("Failed admissions (will retry)")
        .register(registry);
    this.subscriptionDropped = Counter.builder(namePrefix + ".subscription.dropped")
        .description("Requests dropped after exhausting retries")
        .register(registry);
    this.channelLost = Counter.builder(namePrefix + ".channel.lost")
        .description("Active channels lost and re-queued")
        .register(registry);
    this.subscriptionCancelled = Counter.builder(namePrefix + ".subscription.cancelled")
        .description("Subscriptions cancelled by their caller")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .description("Requests waiting for admission, including retries in backoff")
        .register(registry);
    this.activeCountGauge = Gauge.builder(namePrefix + ".active.count", activeCount, AtomicInteger::get)
        .description("Live channels")
        .register(registry);
  }

  @Override
  public void incrementRequestAccepted() {
    if (closed) return;
    requestAccepted.increment();
  }

  @Override
  public void incrementRequestDeduplicated() {
    if (closed) return;
    requestDeduplicated.increment();
  }

  @Override
  public void incrementAdmissionSuccess() {
    if (closed) return;
    admissionSuccess.increment();
  }

  @Override
  public void incrementAdmissionFailure() {
    if (closed) return;
    admissionFailure.increment();
  }

  @Override
  public void incrementSubscriptionDropped() {
    if (closed) return;
    subscriptionDropped.increment();
  }

  @Override
  public void incrementChannelLost() {
    if (closed) return;
    channelLost.increment();
  }

  @Override
  public void incrementSubscriptionCancelled() {
    if (closed) return;
    subscriptionCancelled.increment();
  }

  @Override
  public void recordDepths(int queued, int active) {
    if (closed) return;
    this.queueDepth.set(queued);
    this.activeCount.set(active);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the coordinator is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(requestAccepted, requestDeduplicated, admissionSuccess,
        admissionFailure, subscriptionDropped, channelLost, subscriptionCancelled,
        queueDepthGauge, activeCountGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
