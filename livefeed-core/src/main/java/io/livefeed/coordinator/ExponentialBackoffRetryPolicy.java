package io.livefeed.coordinator;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with optional jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(retry-1)}, capped at {@code maxDelay}.
 * With a jitter factor {@code j > 0} the capped delay is multiplied by a random
 * value in {@code [1-j, 1+j)} and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  /**
   * Creates a deterministic policy (no jitter).
   *
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, 0.0);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitter      jitter factor in {@code [0, 1)}; {@code 0} disables jitter
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int retry) {
    if (retry <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    long expDelay;
    if (retry >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (retry - 1);
      // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (jitter == 0.0) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
    long withJitter = (long) (capped * factor);
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
