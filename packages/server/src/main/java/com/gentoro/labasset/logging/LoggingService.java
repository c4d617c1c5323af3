package com.gentoro.labasset.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Stream;
import org.apache.commons.configuration2.ImmutableConfiguration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central access point for slf4j loggers and runtime log level tuning. */
public final class LoggingService {
  private static final Logger log = getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static Logger getLogger(String name) {
    return LoggerFactory.getLogger(name);
  }

  /**
   * Apply {@code logging.levels} entries of the form {@code logger=LEVEL}. Entries that do not
   * parse are logged and skipped. No-op when the slf4j binding is not logback.
   */
  public static void applyConfiguration(ImmutableConfiguration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.debug("Logging backend is not logback, skipping level configuration");
      return;
    }
    List<String> entries = configuration.getList(String.class, "logging.levels", List.of());
    for (String entry : entries) {
      if (entry == null || entry.isBlank()) continue;
      int idx = entry.indexOf('=');
      if (idx <= 0 || idx == entry.length() - 1) {
        log.warn("Ignoring malformed logging level entry '{}'", entry);
        continue;
      }
      String name = entry.substring(0, idx).trim();
      Level level = Level.toLevel(entry.substring(idx + 1).trim(), null);
      if (level == null) {
        log.warn("Ignoring unknown log level in entry '{}'", entry);
        continue;
      }
      context.getLogger(name).setLevel(level);
      log.debug("Log level for '{}' set to {}", name, level);
    }
  }

  /**
   * Return the last {@code lines} lines of a log file, oldest first. A missing file yields an empty
   * list.
   */
  public static List<String> tail(Path file, int lines) throws IOException {
    if (lines <= 0 || file == null || !Files.isRegularFile(file)) {
      return List.of();
    }
    Deque<String> window = new ArrayDeque<>(lines);
    try (Stream<String> stream = Files.lines(file, StandardCharsets.UTF_8)) {
      stream.forEachOrdered(
          line -> {
            if (window.size() == lines) window.removeFirst();
            window.addLast(line);
          });
    }
    return new ArrayList<>(window);
  }
}
