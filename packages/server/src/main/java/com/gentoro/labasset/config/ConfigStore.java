package com.gentoro.labasset.config;

import com.gentoro.labasset.events.ConfigChanged;
import com.gentoro.labasset.events.NotificationBus;
import com.gentoro.labasset.events.Subscription;
import com.gentoro.labasset.exception.ConfigException;
import com.gentoro.labasset.exception.ExceptionUtil;
import com.gentoro.labasset.exception.StateException;
import com.gentoro.labasset.exception.ValidationException;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.utility.FileUtility;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;
import org.slf4j.Logger;

/**
 * Process-wide versioned configuration.
 *
 * <p>Values are layered: the bundled {@code default-config.yaml} first, then the YAML file the
 * store was created for. Reads go to an immutable {@link ConfigSnapshot} and never block. All
 * mutations go through {@link #set} / {@link #setAll}, which validate the candidate against the
 * {@link ConfigSchema}, persist it (temp file + atomic move), swap the snapshot and then publish a
 * {@link ConfigChanged} event. A failed mutation leaves value and version untouched.
 */
public class ConfigStore {
  private static final Logger log = LoggingService.getLogger(ConfigStore.class);
  private static final String DEFAULTS_RESOURCE = "default-config.yaml";

  private final Path file;
  private final ConfigSchema schema;
  private final NotificationBus bus;
  private final Object writeLock = new Object();
  private volatile ConfigSnapshot current;

  public ConfigStore(Path file, NotificationBus bus) {
    this(file, ConfigSchema.standard(), bus);
  }

  public ConfigStore(Path file, ConfigSchema schema, NotificationBus bus) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
    this.schema = Objects.requireNonNull(schema, "schema");
    this.bus = Objects.requireNonNull(bus, "bus");
  }

  /**
   * Load the configuration. A missing file is created from the defaults; a malformed file or a
   * value that violates the schema fails with {@link ConfigException}.
   */
  public ConfigSnapshot load() {
    synchronized (writeLock) {
      YAMLConfiguration merged = readDefaults();
      boolean persistDefaults = !Files.exists(file);
      if (!persistDefaults) {
        YAMLConfiguration overrides = readFile();
        for (Iterator<String> it = overrides.getKeys(); it.hasNext(); ) {
          String key = it.next();
          if (!schema.knows(key)) {
            throw new ConfigException("Unknown configuration key '" + key + "' in " + file);
          }
          merged.setProperty(key, overrides.getProperty(key));
        }
      }
      try {
        normalizeAll(merged);
      } catch (ValidationException e) {
        throw new ConfigException("Invalid configuration in " + file + ": " + e.getMessage(), e);
      }
      if (persistDefaults) {
        log.info("Configuration file {} not found, writing defaults", file);
        persist(merged);
      }
      long version = current == null ? 1 : current.version() + 1;
      current = new ConfigSnapshot(version, merged, schema);
      log.info("Configuration loaded from {} (version {})", file, version);
      return current;
    }
  }

  /** Current snapshot. Never blocks. */
  public ConfigSnapshot snapshot() {
    ConfigSnapshot s = current;
    if (s == null) {
      throw new StateException("Configuration not loaded. Call load() first.");
    }
    return s;
  }

  public long version() {
    return snapshot().version();
  }

  public Object get(String path) {
    return snapshot().get(path);
  }

  public Path file() {
    return file;
  }

  public ConfigSchema schema() {
    return schema;
  }

  /**
   * Validate and apply a single value.
   *
   * @return the new version
   * @throws ValidationException when the value or the resulting configuration is invalid
   */
  public long set(String path, Object value) {
    Map<String, Object> single = new LinkedHashMap<>();
    single.put(path, value);
    return apply(single);
  }

  /** Apply several keys of one module as a single version. Keys are relative to the module. */
  public long setAll(String module, Map<String, ?> values) {
    if (values == null || values.isEmpty()) {
      throw new ValidationException(String.valueOf(module), "no values supplied");
    }
    if (!schema.modules().contains(module)) {
      throw new ValidationException(String.valueOf(module), "unknown module '" + module + "'");
    }
    Map<String, Object> paths = new LinkedHashMap<>();
    values.forEach((k, v) -> paths.put(module + "." + k, v));
    return apply(paths);
  }

  public Subscription subscribe() {
    return bus.subscribe(ConfigChanged.class);
  }

  private long apply(Map<String, Object> changes) {
    ConfigSnapshot published;
    List<String> paths = new ArrayList<>(changes.keySet());
    synchronized (writeLock) {
      ConfigSnapshot base = snapshot();
      YAMLConfiguration candidate = new YAMLConfiguration(toYaml(base));
      for (Map.Entry<String, Object> change : changes.entrySet()) {
        Object normalized = schema.normalize(change.getKey(), change.getValue());
        candidate.setProperty(change.getKey(), normalized);
      }
      schema.checkConsistency(candidate::getProperty);
      persist(candidate);
      published = new ConfigSnapshot(base.version() + 1, candidate, schema);
      current = published;
      // inside the lock so that subscribers see versions in order; publish never blocks
      log.info("Configuration updated to version {}: {}", published.version(), paths);
      bus.publish(new ConfigChanged(published.version(), paths, Instant.now()));
    }
    return published.version();
  }

  private YAMLConfiguration toYaml(ConfigSnapshot snapshot) {
    YAMLConfiguration copy = new YAMLConfiguration();
    for (Iterator<String> it = snapshot.configuration().getKeys(); it.hasNext(); ) {
      String key = it.next();
      copy.setProperty(key, snapshot.get(key));
    }
    return copy;
  }

  private void normalizeAll(YAMLConfiguration config) {
    List<String> keys = new ArrayList<>();
    config.getKeys().forEachRemaining(keys::add);
    for (String key : keys) {
      config.setProperty(key, schema.normalize(key, config.getProperty(key)));
    }
    schema.checkConsistency(config::getProperty);
  }

  private YAMLConfiguration readDefaults() {
    YAMLConfiguration defaults = new YAMLConfiguration();
    ClassLoader loader = ConfigStore.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new ConfigException("Bundled resource " + DEFAULTS_RESOURCE + " is missing");
      }
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        new FileHandler(defaults).load(reader);
      }
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to read bundled defaults", e);
    }
    return defaults;
  }

  private YAMLConfiguration readFile() {
    YAMLConfiguration config = new YAMLConfiguration();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      new FileHandler(config).load(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Malformed configuration file " + file, e);
    } catch (RuntimeException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new ConfigException("Malformed configuration file " + file, ex));
    }
    return config;
  }

  private void persist(YAMLConfiguration config) {
    try {
      StringWriter writer = new StringWriter();
      new FileHandler(config).save(writer);
      FileUtility.writeAtomically(file, writer.toString().getBytes(StandardCharsets.UTF_8));
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to persist configuration to " + file, e);
    }
  }
}
