package com.gentoro.labasset.exception;

/**
 * Stable error kinds reported to callers as {@code errorKind}.
 *
 * <p>Kinds flagged as transient describe network-class failures that the stage owning the call
 * retries with backoff. Every other kind is structural and fails the operation immediately.
 */
public enum ErrorKind {
  CONFIG_ERROR(false, 500),
  VALIDATION_ERROR(false, 400),
  INVALID_INPUT(false, 400),
  DEVICE_UNAVAILABLE(false, 503),
  CAPTURE_TIMEOUT(false, 504),
  PARTIAL_CAPTURE(false, 500),
  STORAGE_ERROR(false, 500),
  PROVIDER_ERROR(false, 502),
  RATE_LIMITED(true, 429),
  PROVIDER_TIMEOUT(true, 504),
  TRANSIENT_NETWORK_ERROR(true, 502),
  INVALID_RESPONSE(false, 502),
  AUTH_ERROR(false, 502),
  NOT_FOUND(false, 404),
  CONFLICT(false, 409),
  ENCODING_ERROR(false, 422),
  DUPLICATE_JOB(false, 409),
  JOB_FAILED(false, 500),
  CANCELLED(false, 409),
  STATE_ERROR(false, 500),
  UNKNOWN(false, 500);

  private final boolean transientFailure;
  private final int httpStatus;

  ErrorKind(boolean transientFailure, int httpStatus) {
    this.transientFailure = transientFailure;
    this.httpStatus = httpStatus;
  }

  /** Whether a failure of this kind may succeed when the same call is repeated later. */
  public boolean isTransient() {
    return transientFailure;
  }

  /** HTTP status used when the failure is reported over the JSON API. */
  public int httpStatus() {
    return httpStatus;
  }
}
