package com.gentoro.labasset.exception;

/**
 * Capture layer failure: {@link ErrorKind#DEVICE_UNAVAILABLE}, {@link ErrorKind#CAPTURE_TIMEOUT},
 * {@link ErrorKind#PARTIAL_CAPTURE} or {@link ErrorKind#STORAGE_ERROR}.
 */
public class CaptureException extends LabAssetException {
  public CaptureException(ErrorKind kind, String message) {
    super(kind, message);
  }

  public CaptureException(ErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }
}
