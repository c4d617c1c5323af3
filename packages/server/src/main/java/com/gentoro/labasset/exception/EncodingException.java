package com.gentoro.labasset.exception;

/** Label payload does not fit the chosen encoding profile. Never retried. */
public class EncodingException extends LabAssetException {
  public EncodingException(String message) {
    super(ErrorKind.ENCODING_ERROR, message);
  }

  public EncodingException(String message, Throwable cause) {
    super(ErrorKind.ENCODING_ERROR, message, cause);
  }
}
