package com.github.flowengine;

/**
 * Attempt budget and exponential backoff applied to persist and clear calls.
 * 
 * Notes:<br>
 * 1. backoff sleeps on the engine's operation thread, so every navigation queued behind a failing
 * persist waits for the whole retry sequence<br>
 * 2. the default therefore keeps the worst case short: 3 attempts with 20ms then 40ms between
 * them<br>
 * 3. policies with longer backoff suit handlers that fail rarely, or hand-off handlers that return
 * quickly and retry on their own executor<br>
 */
public final class RetryPolicy {
  private static final RetryPolicy DEFAULT = new RetryPolicy(3, 20L, 2.0d);
  private static final RetryPolicy NONE = new RetryPolicy(1, 0L, 1.0d);

  private final int maxAttempts;
  private final long initialBackoffMillis;
  private final double backoffMultiplier;

  public RetryPolicy(final int maxAttempts, final long initialBackoffMillis,
      final double backoffMultiplier) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (initialBackoffMillis < 0L || backoffMultiplier < 1.0d) {
      throw new IllegalArgumentException("backoff must be non-negative and non-shrinking");
    }
    this.maxAttempts = maxAttempts;
    this.initialBackoffMillis = initialBackoffMillis;
    this.backoffMultiplier = backoffMultiplier;
  }

  public static RetryPolicy defaultPolicy() {
    return DEFAULT;
  }

  public static RetryPolicy noRetries() {
    return NONE;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public long getInitialBackoffMillis() {
    return initialBackoffMillis;
  }

  public double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  /**
   * Delay before the given retry, 1 being the first retry.
   */
  long backoffMillis(final int retry) {
    return (long) (initialBackoffMillis * Math.pow(backoffMultiplier, retry - 1));
  }

  @Override
  public String toString() {
    return "RetryPolicy [maxAttempts=" + maxAttempts + ", initialBackoffMillis="
        + initialBackoffMillis + ", backoffMultiplier=" + backoffMultiplier + "]";
  }
}
