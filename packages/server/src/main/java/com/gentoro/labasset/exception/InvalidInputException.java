package com.gentoro.labasset.exception;

/** Malformed request input, rejected before any pipeline stage executes. */
public class InvalidInputException extends LabAssetException {
  public InvalidInputException(String message) {
    super(ErrorKind.INVALID_INPUT, message);
  }

  public InvalidInputException(String message, Throwable cause) {
    super(ErrorKind.INVALID_INPUT, message, cause);
  }
}
