package com.gentoro.labasset.config;

import static com.gentoro.labasset.config.ConfigRules.bool;
import static com.gentoro.labasset.config.ConfigRules.doubleRange;
import static com.gentoro.labasset.config.ConfigRules.intRange;
import static com.gentoro.labasset.config.ConfigRules.logLevels;
import static com.gentoro.labasset.config.ConfigRules.nonBlank;
import static com.gentoro.labasset.config.ConfigRules.oneOf;
import static com.gentoro.labasset.config.ConfigRules.resolution;
import static com.gentoro.labasset.config.ConfigRules.string;
import static com.gentoro.labasset.config.ConfigRules.url;

import com.gentoro.labasset.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Per-module validation rules. Paths are {@code module.key}, where {@code key} may itself be
 * dotted ({@code pipeline.retry.maxRetries}). Unknown modules and keys are rejected.
 */
public final class ConfigSchema {
  private final Map<String, Map<String, ConfigRule>> modules;
  private final List<Function<Function<String, Object>, ValidationException>> crossChecks;

  private ConfigSchema(
      Map<String, Map<String, ConfigRule>> modules,
      List<Function<Function<String, Object>, ValidationException>> crossChecks) {
    this.modules = modules;
    this.crossChecks = crossChecks;
  }

  public static ConfigSchema standard() {
    Map<String, Map<String, ConfigRule>> m = new LinkedHashMap<>();

    Map<String, ConfigRule> inference = new LinkedHashMap<>();
    inference.put("providerId", oneOf("openai", "anthropic", "gemini", "ollama"));
    inference.put("credential", string());
    inference.put("model", string());
    inference.put("temperature", doubleRange(0.0, 2.0));
    inference.put("maxOutputTokens", intRange(1, 200_000));
    inference.put("localEndpoint", url());
    inference.put("timeoutSeconds", intRange(1, 3600));
    inference.put("maxConcurrent", intRange(1, 64));
    inference.put("promptTemplate", string());
    m.put("inference", inference);

    Map<String, ConfigRule> recordSystem = new LinkedHashMap<>();
    recordSystem.put("provider", oneOf("elabftw", "memory"));
    recordSystem.put("baseUrl", url());
    recordSystem.put("credential", string());
    recordSystem.put("defaultCategory", intRange(1, Integer.MAX_VALUE));
    recordSystem.put("teamId", intRange(1, Integer.MAX_VALUE));
    recordSystem.put("verifyTls", bool());
    recordSystem.put("timeoutSeconds", intRange(1, 600));
    recordSystem.put("uploadImage", bool());
    m.put("recordSystem", recordSystem);

    Map<String, ConfigRule> capture = new LinkedHashMap<>();
    capture.put("deviceId", nonBlank());
    capture.put("resolution", resolution());
    capture.put("frameRate", intRange(1, 240));
    capture.put("autoStart", bool());
    capture.put("inboxDir", nonBlank());
    capture.put("timeoutSeconds", intRange(1, 600));
    m.put("capture", capture);

    Map<String, ConfigRule> storage = new LinkedHashMap<>();
    storage.put("imagesDir", nonBlank());
    storage.put("labelsDir", nonBlank());
    storage.put("dataDir", nonBlank());
    storage.put("retainImages", bool());
    m.put("storage", storage);

    Map<String, ConfigRule> pipeline = new LinkedHashMap<>();
    pipeline.put("workers", intRange(1, 64));
    pipeline.put("retry.maxRetries", intRange(0, 20));
    pipeline.put("retry.baseDelayMs", intRange(0, 600_000));
    pipeline.put("retry.maxDelayMs", intRange(0, 3_600_000));
    pipeline.put("retry.jitterRatio", doubleRange(0.0, 1.0));
    pipeline.put("conflictRetries", intRange(0, 10));
    pipeline.put("labelProfile", oneOf("compact", "standard", "robust"));
    m.put("pipeline", pipeline);

    Map<String, ConfigRule> http = new LinkedHashMap<>();
    http.put("hostname", nonBlank());
    http.put("port", intRange(0, 65535));
    m.put("http", http);

    Map<String, ConfigRule> logging = new LinkedHashMap<>();
    logging.put("file", string());
    logging.put("levels", logLevels());
    m.put("logging", logging);

    List<Function<Function<String, Object>, ValidationException>> checks = new ArrayList<>();
    checks.add(
        cfg -> {
          int base = ((Number) cfg.apply("pipeline.retry.baseDelayMs")).intValue();
          int max = ((Number) cfg.apply("pipeline.retry.maxDelayMs")).intValue();
          return max < base
              ? new ValidationException(
                  "pipeline.retry.maxDelayMs", "must not be lower than pipeline.retry.baseDelayMs")
              : null;
        });

    return new ConfigSchema(Collections.unmodifiableMap(m), List.copyOf(checks));
  }

  public Set<String> modules() {
    return modules.keySet();
  }

  public Set<String> keys(String module) {
    Map<String, ConfigRule> rules = modules.get(module);
    return rules == null ? Set.of() : rules.keySet();
  }

  public boolean knows(String path) {
    int idx = path == null ? -1 : path.indexOf('.');
    if (idx <= 0) return false;
    Map<String, ConfigRule> rules = modules.get(path.substring(0, idx));
    return rules != null && rules.containsKey(path.substring(idx + 1));
  }

  /** Validate and normalize a single value. */
  public Object normalize(String path, Object value) {
    if (path == null || path.isBlank()) {
      throw new ValidationException(String.valueOf(path), "path must not be blank");
    }
    int idx = path.indexOf('.');
    if (idx <= 0 || idx == path.length() - 1) {
      throw new ValidationException(path, "path must be formatted as module.key");
    }
    String module = path.substring(0, idx);
    Map<String, ConfigRule> rules = modules.get(module);
    if (rules == null) {
      throw new ValidationException(path, "unknown module '" + module + "'");
    }
    ConfigRule rule = rules.get(path.substring(idx + 1));
    if (rule == null) {
      throw new ValidationException(path, "unknown key for module '" + module + "'");
    }
    return rule.normalize(path, value);
  }

  /** Checks spanning several keys, evaluated against the full candidate configuration. */
  public void checkConsistency(Function<String, Object> lookup) {
    for (Function<Function<String, Object>, ValidationException> check : crossChecks) {
      ValidationException failure = check.apply(lookup);
      if (failure != null) {
        throw failure;
      }
    }
  }
}
