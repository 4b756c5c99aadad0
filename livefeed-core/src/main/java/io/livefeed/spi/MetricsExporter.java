package io.livefeed.spi;

/**
 * Observability hook for exporting coordinator counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of requests that created a new pending subscription.
     */
    void incrementRequestAccepted();

    /**
     * Increments the count of requests answered with an existing subscription id.
     */
    void incrementRequestDeduplicated();

    /**
     * Increments the count of admissions that reached an active channel.
     */
    void incrementAdmissionSuccess();

    /**
     * Increments the count of failed admissions that were scheduled for retry.
     */
    void incrementAdmissionFailure();

    /**
     * Increments the count of requests dropped after exhausting their retries.
     */
    void incrementSubscriptionDropped();

    /**
     * Increments the count of active channels that were lost and demoted back to the queue.
     */
    default void incrementChannelLost() {
    }

    /**
     * Increments the count of subscriptions cancelled by their caller.
     */
    default void incrementSubscriptionCancelled() {
    }

    /**
     * Records the current number of queued and active subscriptions.
     *
     * @param queued number of requests waiting for admission (including retries in backoff)
     * @param active number of live channels
     */
    void recordDepths(int queued, int active);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementRequestAccepted() {
        }

        @Override
        public void incrementRequestDeduplicated() {
        }

        @Override
        public void incrementAdmissionSuccess() {
        }

        @Override
        public void incrementAdmissionFailure() {
        }

        @Override
        public void incrementSubscriptionDropped() {
        }

        @Override
        public void recordDepths(int queued, int active) {
        }
    }
}
