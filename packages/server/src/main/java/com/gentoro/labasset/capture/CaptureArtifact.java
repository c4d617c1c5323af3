package com.gentoro.labasset.capture;

import java.nio.file.Path;
import java.time.Instant;

/** A persisted image produced by one capture. Immutable. */
public record CaptureArtifact(
    String id,
    String deviceId,
    Path imagePath,
    Resolution resolution,
    String mediaType,
    Instant capturedAt) {}
