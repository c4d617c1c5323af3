package com.gentoro.labasset.retry;

import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.ExceptionUtil;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * Runs an operation under a {@link RetryPolicy}. Only failures whose {@link ErrorKind} is transient
 * are retried; anything else propagates on the first occurrence.
 */
public final class Retrier {
  private static final Logger log = LoggingService.getLogger(Retrier.class);

  /** Observer of the retry loop. */
  public interface Listener {
    Listener NONE = new Listener() {};

    /** Called before each attempt; {@code attempt} starts at 1. */
    default void onAttempt(int attempt) {}

    /** Called after attempt {@code attempt} failed transiently and a retry is scheduled. */
    default void onRetry(int attempt, long delayMs, LabAssetException cause) {}
  }

  private final RetryPolicy policy;
  private final Sleeper sleeper;

  public Retrier(RetryPolicy policy, Sleeper sleeper) {
    this.policy = policy;
    this.sleeper = sleeper;
  }

  public RetryPolicy policy() {
    return policy;
  }

  public <T> T call(String operation, Callable<T> action) {
    return call(operation, action, () -> false, Listener.NONE, null);
  }

  /**
   * @param cancelled checked before every attempt; when true the loop stops with {@link
   *     ErrorKind#CANCELLED}
   * @param onExhausted maps the last transient failure once retries are used up; {@code null}
   *     rethrows it unchanged
   */
  public <T> T call(
      String operation,
      Callable<T> action,
      BooleanSupplier cancelled,
      Listener listener,
      Function<LabAssetException, LabAssetException> onExhausted) {
    int attempt = 0;
    while (true) {
      attempt++;
      if (cancelled.getAsBoolean()) {
        throw new LabAssetException(ErrorKind.CANCELLED, operation + " cancelled");
      }
      listener.onAttempt(attempt);
      LabAssetException failure;
      try {
        return action.call();
      } catch (Exception e) {
        failure =
            ExceptionUtil.rethrowIfUnchecked(
                e, ex -> new LabAssetException(ErrorKind.UNKNOWN, operation + " failed", ex));
      }
      if (!failure.isTransient()) {
        throw failure;
      }
      if (attempt > policy.maxRetries()) {
        log.warn(
            "{} failed after {} attempt(s): [{}] {}",
            operation,
            attempt,
            failure.getKind(),
            failure.getMessage());
        throw onExhausted == null ? failure : onExhausted.apply(failure);
      }
      long delay = policy.delayMs(attempt - 1);
      log.info(
          "{} attempt {} failed with {}, retrying in {} ms",
          operation,
          attempt,
          failure.getKind(),
          delay);
      listener.onRetry(attempt, delay, failure);
      try {
        if (delay > 0) sleeper.sleep(delay);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        throw new LabAssetException(ErrorKind.CANCELLED, operation + " interrupted", ie);
      }
    }
  }
}
