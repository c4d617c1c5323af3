package com.gentoro.labasset;

import com.gentoro.labasset.exception.InvalidInputException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Command-line parameters of the form {@code --name=value}. */
public final class StartupParameters {
  public static final String DEFAULT_CONFIG = "config/application.yaml";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null || arg.isBlank()) continue;
      if (!arg.startsWith("--")) {
        throw new InvalidInputException("Unexpected argument '" + arg + "', use --name=value");
      }
      int eq = arg.indexOf('=');
      if (eq < 0) {
        parameters.put(arg.substring(2), "true");
      } else {
        parameters.put(arg.substring(2, eq), arg.substring(eq + 1));
      }
    }
  }

  public String getParameter(String name, String defaultValue) {
    String value = parameters.get(name);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  public Path configFile() {
    return Path.of(getParameter("config", DEFAULT_CONFIG));
  }

  /** {@code server} (default) or {@code once}. */
  public String mode() {
    return getParameter("mode", "server");
  }
}
