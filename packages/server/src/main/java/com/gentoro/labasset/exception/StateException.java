package com.gentoro.labasset.exception;

/** Illegal state transition or use of a component before it was initialized. */
public class StateException extends LabAssetException {
  public StateException(String message) {
    super(ErrorKind.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(ErrorKind.STATE_ERROR, message, cause);
  }
}
