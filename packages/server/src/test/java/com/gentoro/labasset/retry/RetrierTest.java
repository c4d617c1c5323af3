package com.gentoro.labasset.retry;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.labasset.exception.AnalysisException;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.LabAssetException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetrierTest {

  private final List<Long> sleeps = new ArrayList<>();
  private final Sleeper recordingSleeper = sleeps::add;

  @Test
  void backoffDoublesAndIsCapped() {
    RetryPolicy policy = new RetryPolicy(5, 500, 3000, 0.0);

    assertEquals(500, policy.backoffMs(0));
    assertEquals(1000, policy.backoffMs(1));
    assertEquals(2000, policy.backoffMs(2));
    assertEquals(3000, policy.backoffMs(3));
    assertEquals(3000, policy.backoffMs(40));
  }

  @Test
  void jitterStaysWithinBounds() {
    RetryPolicy policy = new RetryPolicy(3, 1000, 8000, 0.5);

    for (int i = 0; i < 200; i++) {
      long delay = policy.delayMs(0);
      assertTrue(delay >= 1000 && delay <= 1500, "delay " + delay);
      assertTrue(policy.delayMs(10) <= 8000);
    }
  }

  @Test
  void invalidPolicyIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, 0, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, 0, 0, 1.5));
  }

  @Test
  void transientFailuresAreRetriedUntilSuccess() {
    Retrier retrier = new Retrier(new RetryPolicy(3, 100, 1000, 0.0), recordingSleeper);
    AtomicInteger calls = new AtomicInteger();

    String result =
        retrier.call(
            "op",
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new AnalysisException(ErrorKind.RATE_LIMITED, "slow down");
              }
              return "ok";
            });

    assertEquals("ok", result);
    assertEquals(3, calls.get());
    assertEquals(List.of(100L, 200L), sleeps);
  }

  @Test
  void structuralFailureIsNotRetried() {
    Retrier retrier = new Retrier(new RetryPolicy(3, 100, 1000, 0.0), recordingSleeper);
    AtomicInteger calls = new AtomicInteger();

    LabAssetException ex =
        assertThrows(
            LabAssetException.class,
            () ->
                retrier.call(
                    "op",
                    () -> {
                      calls.incrementAndGet();
                      throw new AnalysisException(ErrorKind.AUTH_ERROR, "bad key");
                    }));

    assertEquals(ErrorKind.AUTH_ERROR, ex.getKind());
    assertEquals(1, calls.get());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void exhaustionMapsLastFailureAndNotifiesListener() {
    Retrier retrier = new Retrier(new RetryPolicy(2, 0, 0, 0.0), recordingSleeper);
    List<Integer> attempts = new ArrayList<>();
    List<Integer> retries = new ArrayList<>();
    Retrier.Listener listener =
        new Retrier.Listener() {
          @Override
          public void onAttempt(int attempt) {
            attempts.add(attempt);
          }

          @Override
          public void onRetry(int attempt, long delayMs, LabAssetException cause) {
            retries.add(attempt);
          }
        };

    LabAssetException ex =
        assertThrows(
            LabAssetException.class,
            () ->
                retrier.call(
                    "op",
                    () -> {
                      throw new AnalysisException(ErrorKind.PROVIDER_TIMEOUT, "timeout");
                    },
                    () -> false,
                    listener,
                    last -> new AnalysisException(ErrorKind.PROVIDER_ERROR, "gave up", last)));

    assertEquals(ErrorKind.PROVIDER_ERROR, ex.getKind());
    assertEquals(List.of(1, 2, 3), attempts);
    assertEquals(List.of(1, 2), retries);
  }

  @Test
  void cancellationStopsBeforeNextAttempt() {
    Retrier retrier = new Retrier(new RetryPolicy(5, 0, 0, 0.0), recordingSleeper);
    AtomicInteger calls = new AtomicInteger();

    LabAssetException ex =
        assertThrows(
            LabAssetException.class,
            () ->
                retrier.call(
                    "op",
                    () -> {
                      calls.incrementAndGet();
                      throw new AnalysisException(ErrorKind.TRANSIENT_NETWORK_ERROR, "reset");
                    },
                    () -> calls.get() >= 2,
                    Retrier.Listener.NONE,
                    null));

    assertEquals(ErrorKind.CANCELLED, ex.getKind());
    assertEquals(2, calls.get());
  }

  @Test
  void foreignCheckedExceptionBecomesUnknown() {
    Retrier retrier = new Retrier(new RetryPolicy(2, 0, 0, 0.0), recordingSleeper);

    LabAssetException ex =
        assertThrows(
            LabAssetException.class,
            () ->
                retrier.call(
                    "op",
                    () -> {
                      throw new java.io.IOException("disk");
                    }));

    assertEquals(ErrorKind.UNKNOWN, ex.getKind());
  }
}
