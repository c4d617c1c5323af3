package com.gentoro.labasset.retry;

import com.gentoro.labasset.config.ConfigSnapshot;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff: retry {@code n} (0-based) waits {@code baseDelayMs * 2^n}, capped
 * at {@code maxDelayMs}, plus a random jitter of up to {@code jitterRatio} of that delay. The
 * jittered value is capped again.
 *
 * @param maxRetries retries after the first attempt; total attempts are {@code maxRetries + 1}
 */
public record RetryPolicy(int maxRetries, long baseDelayMs, long maxDelayMs, double jitterRatio) {

  public RetryPolicy {
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    if (baseDelayMs < 0 || maxDelayMs < 0) {
      throw new IllegalArgumentException("delays must be >= 0");
    }
    if (jitterRatio < 0 || jitterRatio > 1) {
      throw new IllegalArgumentException("jitterRatio must be within [0, 1]");
    }
  }

  public static RetryPolicy from(ConfigSnapshot config) {
    return new RetryPolicy(
        config.getInt("pipeline.retry.maxRetries", 2),
        config.getLong("pipeline.retry.baseDelayMs", 500),
        config.getLong("pipeline.retry.maxDelayMs", 8000),
        config.getDouble("pipeline.retry.jitterRatio", 0.2));
  }

  public static RetryPolicy none() {
    return new RetryPolicy(0, 0, 0, 0);
  }

  /** Delay before the retry with the given 0-based index, without jitter. */
  public long backoffMs(int retryIndex) {
    if (baseDelayMs == 0) return 0;
    // cap the exponent to avoid overflow
    int steps = Math.min(30, Math.max(0, retryIndex));
    long delay = baseDelayMs;
    for (int i = 0; i < steps && delay < maxDelayMs; i++) {
      delay = delay * 2;
    }
    return Math.min(delay, maxDelayMs);
  }

  /** Delay before the retry with the given 0-based index, jitter included. */
  public long delayMs(int retryIndex) {
    long base = backoffMs(retryIndex);
    long bound = (long) Math.floor(base * jitterRatio);
    long jitter = bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(0, bound + 1);
    return Math.min(maxDelayMs, base + jitter);
  }
}
