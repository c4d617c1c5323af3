package com.gentoro.labasset.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void detailsKeepKindAndContext() {
    LabAssetException ex =
        new LabAssetException(ErrorKind.CONFLICT, "stale").withContext("currentVersion", 4L);

    ErrorDetails details = ExceptionUtil.toErrorDetails(new ExecutionException(ex));

    assertEquals("CONFLICT", details.errorKind());
    assertEquals("stale", details.message());
    assertEquals(4L, details.context().get("currentVersion"));
  }

  @Test
  void foreignExceptionsAreUnknown() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(new CompletionException(new IOException("disk full")));

    assertEquals("UNKNOWN", details.errorKind());
    assertEquals("IOException: disk full", details.message());
    assertEquals(ErrorKind.UNKNOWN, ExceptionUtil.kindOf(new IllegalStateException()));
  }

  @Test
  void rethrowKeepsOwnExceptions() {
    LabAssetException own = new CaptureException(ErrorKind.CAPTURE_TIMEOUT, "late");

    assertSame(
        own,
        ExceptionUtil.rethrowIfUnchecked(
            new ExecutionException(own), t -> new LabAssetException(ErrorKind.UNKNOWN, "x")));
    LabAssetException wrapped =
        ExceptionUtil.rethrowIfUnchecked(
            new IOException("nope"),
            t -> new LabAssetException(ErrorKind.STORAGE_ERROR, t.getMessage(), t));
    assertEquals(ErrorKind.STORAGE_ERROR, wrapped.getKind());
    assertEquals("nope", wrapped.getMessage());
  }

  @Test
  void messageFallsBackToType() {
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
    assertEquals(
        "IllegalStateException", ExceptionUtil.extractErrorMessage(new IllegalStateException()));
    assertEquals(
        "IOException: root",
        ExceptionUtil.extractErrorMessage(new RuntimeException(null, new IOException("root"))));
  }

  @Test
  void transientKindsAreMarked() {
    assertTrue(ErrorKind.RATE_LIMITED.isTransient());
    assertTrue(ErrorKind.PROVIDER_TIMEOUT.isTransient());
    assertFalse(ErrorKind.AUTH_ERROR.isTransient());
    assertEquals(429, ErrorKind.RATE_LIMITED.httpStatus());
    assertEquals(404, ErrorKind.NOT_FOUND.httpStatus());
  }
}
