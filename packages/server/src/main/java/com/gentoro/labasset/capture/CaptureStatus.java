package com.gentoro.labasset.capture;

import com.gentoro.labasset.exception.ErrorDetails;

/** Health of the configured capture device. */
public record CaptureStatus(
    String deviceId,
    boolean present,
    boolean capturing,
    String resolution,
    int artifacts,
    ErrorDetails lastError) {}
