package com.gentoro.labasset.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base runtime exception for the ingestion pipeline. Carries a stable {@link ErrorKind}. */
public class LabAssetException extends RuntimeException {
  private final ErrorKind kind;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public LabAssetException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public LabAssetException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public boolean isTransient() {
    return kind.isTransient();
  }

  /** Attach a diagnostic key/value pair. Returns {@code this} for chaining. */
  public LabAssetException withContext(String key, Object value) {
    if (key != null && value != null) {
      context.put(key, value);
    }
    return this;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }
}
