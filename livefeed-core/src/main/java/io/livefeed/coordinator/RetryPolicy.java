package io.livefeed.coordinator;

/**
 * Strategy for computing the delay before re-enqueueing a failed admission.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before retry number {@code retry}.
     *
     * @param retry the retry about to be scheduled (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retry);
}
