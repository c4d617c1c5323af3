package com.gentoro.labasset.exception;

/** A configuration value was rejected by its module schema. The store is left unchanged. */
public class ValidationException extends LabAssetException {
  private final String field;
  private final String reason;

  public ValidationException(String field, String reason) {
    super(ErrorKind.VALIDATION_ERROR, "Invalid value for '%s': %s".formatted(field, reason));
    this.field = field;
    this.reason = reason;
    withContext("field", field);
  }

  public String getField() {
    return field;
  }

  public String getReason() {
    return reason;
  }
}
