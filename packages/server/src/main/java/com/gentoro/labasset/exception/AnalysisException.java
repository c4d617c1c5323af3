package com.gentoro.labasset.exception;

/** Errors raised while running attribute extraction with an inference provider. */
public class AnalysisException extends LabAssetException {
  public AnalysisException(ErrorKind kind, String message) {
    super(kind, message);
  }

  public AnalysisException(ErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }
}
