package com.gentoro.labasset.label;

import com.gentoro.labasset.exception.ValidationException;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import java.util.Locale;

/** QR encoding parameters, selected by {@code pipeline.labelProfile}. */
public enum EncodingProfile {
  COMPACT(ErrorCorrectionLevel.L, 4, 4, 2),
  STANDARD(ErrorCorrectionLevel.M, 10, 8, 4),
  ROBUST(ErrorCorrectionLevel.H, 10, 8, 4);

  private final ErrorCorrectionLevel errorCorrection;
  private final int maxVersion;
  private final int modulePixels;
  private final int margin;

  EncodingProfile(
      ErrorCorrectionLevel errorCorrection, int maxVersion, int modulePixels, int margin) {
    this.errorCorrection = errorCorrection;
    this.maxVersion = maxVersion;
    this.modulePixels = modulePixels;
    this.margin = margin;
  }

  public ErrorCorrectionLevel errorCorrection() {
    return errorCorrection;
  }

  /** Largest QR version (1-40) the payload may need. */
  public int maxVersion() {
    return maxVersion;
  }

  public int modulePixels() {
    return modulePixels;
  }

  /** Quiet zone in modules. */
  public int margin() {
    return margin;
  }

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static EncodingProfile fromId(String id) {
    for (EncodingProfile p : values()) {
      if (p.id().equalsIgnoreCase(id == null ? "" : id.trim())) return p;
    }
    throw new ValidationException("labelProfile", "unknown profile '" + id + "'");
  }
}
