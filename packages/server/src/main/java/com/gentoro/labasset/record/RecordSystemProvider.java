package com.gentoro.labasset.record;

import com.gentoro.labasset.exception.ValidationException;
import java.util.Locale;

/** Record-system variants selectable through {@code recordSystem.provider}. */
public enum RecordSystemProvider {
  ELABFTW,
  MEMORY;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static RecordSystemProvider fromId(String id) {
    for (RecordSystemProvider p : values()) {
      if (p.id().equalsIgnoreCase(id == null ? "" : id.trim())) return p;
    }
    throw new ValidationException("recordSystem.provider", "unknown provider '" + id + "'");
  }
}
