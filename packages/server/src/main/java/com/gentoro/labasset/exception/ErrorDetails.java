package com.gentoro.labasset.exception;

import java.time.Instant;
import java.util.Map;

/** Structured error payload: a stable {@code errorKind} plus a human-readable message. */
public record ErrorDetails(
    String errorKind, String message, String type, Map<String, Object> context, Instant timestamp) {

  public static ErrorDetails of(ErrorKind kind, String message) {
    return new ErrorDetails(kind.name(), message, null, Map.of(), Instant.now());
  }
}
