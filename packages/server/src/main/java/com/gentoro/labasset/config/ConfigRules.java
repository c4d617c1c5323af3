package com.gentoro.labasset.config;

import com.gentoro.labasset.exception.ValidationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/** Factory of the value rules used by {@link ConfigSchema}. */
final class ConfigRules {
  private static final Pattern RESOLUTION = Pattern.compile("^\\d{1,5}x\\d{1,5}$");
  private static final Pattern LOG_LEVEL_ENTRY =
      Pattern.compile("^[\\w.$-]+=(?i)(TRACE|DEBUG|INFO|WARN|ERROR|OFF|ALL)$");

  private ConfigRules() {}

  static ConfigRule string() {
    return (path, value) -> value == null ? "" : String.valueOf(value).trim();
  }

  static ConfigRule nonBlank() {
    return (path, value) -> {
      String s = value == null ? "" : String.valueOf(value).trim();
      if (s.isEmpty()) {
        throw new ValidationException(path, "must not be blank");
      }
      return s;
    };
  }

  static ConfigRule oneOf(String... allowed) {
    Set<String> options = Set.of(allowed);
    return (path, value) -> {
      String s = value == null ? "" : String.valueOf(value).trim().toLowerCase(Locale.ROOT);
      if (!options.contains(s)) {
        throw new ValidationException(
            path, "must be one of " + String.join(", ", allowed) + " but was '" + value + "'");
      }
      return s;
    };
  }

  static ConfigRule url() {
    return (path, value) -> {
      String s = value == null ? "" : String.valueOf(value).trim();
      try {
        URI uri = new URI(s);
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
          throw new ValidationException(path, "must be an http(s) URL");
        }
        if (StringUtils.isBlank(uri.getHost())) {
          throw new ValidationException(path, "URL has no host");
        }
      } catch (URISyntaxException e) {
        throw new ValidationException(path, "malformed URL: " + e.getReason());
      }
      return StringUtils.removeEnd(s, "/");
    };
  }

  static ConfigRule bool() {
    return (path, value) -> {
      if (value instanceof Boolean b) return b;
      String s = value == null ? "" : String.valueOf(value).trim().toLowerCase(Locale.ROOT);
      if ("true".equals(s)) return Boolean.TRUE;
      if ("false".equals(s)) return Boolean.FALSE;
      throw new ValidationException(path, "must be true or false");
    };
  }

  static ConfigRule intRange(int min, int max) {
    return (path, value) -> {
      long parsed;
      if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
        parsed = n.longValue();
      } else {
        try {
          parsed = Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
          throw new ValidationException(path, "must be an integer");
        }
      }
      if (parsed < min || parsed > max) {
        throw new ValidationException(path, "must be between " + min + " and " + max);
      }
      return (int) parsed;
    };
  }

  static ConfigRule doubleRange(double min, double max) {
    return (path, value) -> {
      double parsed;
      if (value instanceof Number n) {
        parsed = n.doubleValue();
      } else {
        try {
          parsed = Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
          throw new ValidationException(path, "must be a number");
        }
      }
      if (Double.isNaN(parsed) || parsed < min || parsed > max) {
        throw new ValidationException(path, "must be between " + min + " and " + max);
      }
      return parsed;
    };
  }

  static ConfigRule resolution() {
    return (path, value) -> {
      String s = value == null ? "" : String.valueOf(value).trim().toLowerCase(Locale.ROOT);
      if (!RESOLUTION.matcher(s).matches()) {
        throw new ValidationException(path, "must be formatted as WIDTHxHEIGHT");
      }
      return s;
    };
  }

  /** A list of {@code logger=LEVEL} entries. A single string is accepted as a one-entry list. */
  static ConfigRule logLevels() {
    return (path, value) -> {
      Collection<?> raw;
      if (value == null) {
        raw = List.of();
      } else if (value instanceof Collection<?> c) {
        raw = c;
      } else {
        raw = List.of(value);
      }
      List<String> out = new ArrayList<>();
      for (Object o : raw) {
        String entry = String.valueOf(o).trim();
        if (!LOG_LEVEL_ENTRY.matcher(entry).matches()) {
          throw new ValidationException(path, "entry '" + entry + "' is not logger=LEVEL");
        }
        out.add(entry);
      }
      return out;
    };
  }
}
