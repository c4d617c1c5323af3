package com.gentoro.labasset.analysis;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Structured attributes extracted from one image. */
public record AnalysisResult(
    Map<String, Object> attributes,
    double confidence,
    String rawProviderOutput,
    String providerId,
    String model,
    Instant analyzedAt) {

  public AnalysisResult {
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /**
   * Record title: {@code summary.asset_name} when it is known, otherwise the first of {@code
   * name}, {@code asset_name} or {@code title}.
   */
  public String title() {
    if (attributes.get("summary") instanceof Map<?, ?> summary
        && isKnown(summary.get("asset_name"))) {
      return String.valueOf(summary.get("asset_name")).trim();
    }
    for (String key : new String[] {"name", "asset_name", "title"}) {
      if (isKnown(attributes.get(key))) {
        return String.valueOf(attributes.get(key)).trim();
      }
    }
    return "Unnamed asset";
  }

  public String assetType() {
    if (attributes.get("summary") instanceof Map<?, ?> summary
        && isKnown(summary.get("asset_type"))) {
      return String.valueOf(summary.get("asset_type")).trim();
    }
    return null;
  }

  static boolean isKnown(Object value) {
    if (value == null) return false;
    String s = String.valueOf(value).trim();
    return !s.isEmpty() && !"unknown".equals(s.toLowerCase(Locale.ROOT));
  }

  /**
   * Confidence of an extraction: a numeric {@code confidence} field in [0, 1] when the provider
   * supplied one, otherwise the share of detail fields that carry a known value.
   */
  static double confidenceOf(Map<String, Object> attributes) {
    if (attributes.get("confidence") instanceof Number n) {
      double v = n.doubleValue();
      if (v >= 0 && v <= 1) return v;
    }
    int total = 0;
    int known = 0;
    for (Map.Entry<String, Object> e : attributes.entrySet()) {
      if ("summary".equals(e.getKey()) || "confidence".equals(e.getKey())) continue;
      if (e.getValue() instanceof Map<?, ?> nested) {
        for (Object v : nested.values()) {
          total++;
          if (isKnown(v)) known++;
        }
      } else {
        total++;
        if (isKnown(e.getValue())) known++;
      }
    }
    return total == 0 ? 0.0 : (double) known / total;
  }
}
