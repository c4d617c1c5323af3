package com.gentoro.labasset.exception;

/**
 * Record-management system failure. Kinds used: {@link ErrorKind#AUTH_ERROR}, {@link
 * ErrorKind#NOT_FOUND}, {@link ErrorKind#CONFLICT}, {@link ErrorKind#TRANSIENT_NETWORK_ERROR} and
 * {@link ErrorKind#INVALID_INPUT} for requests the remote side rejected as malformed.
 */
public class RecordClientException extends LabAssetException {
  public RecordClientException(ErrorKind kind, String message) {
    super(kind, message);
  }

  public RecordClientException(ErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }
}
