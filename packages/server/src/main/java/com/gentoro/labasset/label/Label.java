package com.gentoro.labasset.label;

import java.nio.file.Path;
import java.time.Instant;

/** A generated QR label bound to one record. */
public record Label(
    String externalId,
    String payload,
    Path imagePath,
    EncodingProfile profile,
    int qrVersion,
    Instant generatedAt) {

  public String fileName() {
    return imagePath.getFileName().toString();
  }
}
