package com.gentoro.labasset.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.ConfigurationUtils;
import org.apache.commons.configuration2.ImmutableConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Immutable view of one configuration version. Components keep a reference for the duration of an
 * operation so that every value they read comes from the same version.
 *
 * <p>String getters resolve {@code ${env:NAME}} and {@code ${sys:name}} references.
 */
public final class ConfigSnapshot {
  private final long version;
  private final ImmutableConfiguration config;
  private final ConfigSchema schema;

  ConfigSnapshot(long version, YAMLConfiguration source, ConfigSchema schema) {
    this.version = version;
    this.config = ConfigurationUtils.unmodifiableConfiguration(new YAMLConfiguration(source));
    this.schema = schema;
  }

  public long version() {
    return version;
  }

  public ImmutableConfiguration configuration() {
    return config;
  }

  /** Raw value of a dotted path; lists come back as {@link List}. */
  public Object get(String path) {
    Object value = config.getProperty(path);
    if (value instanceof List<?> list) {
      return List.copyOf(list);
    }
    return value;
  }

  public boolean contains(String path) {
    return config.containsKey(path);
  }

  public String getString(String path) {
    return config.getString(path, "");
  }

  public String getString(String path, String defaultValue) {
    String value = config.getString(path, defaultValue);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  public int getInt(String path, int defaultValue) {
    return config.getInt(path, defaultValue);
  }

  public long getLong(String path, long defaultValue) {
    return config.getLong(path, defaultValue);
  }

  public double getDouble(String path, double defaultValue) {
    return config.getDouble(path, defaultValue);
  }

  public boolean getBoolean(String path, boolean defaultValue) {
    return config.getBoolean(path, defaultValue);
  }

  public List<String> getList(String path) {
    return config.getList(String.class, path, List.of());
  }

  /** All keys of a module, in schema order, with their current values. */
  public Map<String, Object> section(String module) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (String key : schema.keys(module)) {
      out.put(key, get(module + "." + key));
    }
    return out;
  }

  public Set<String> modules() {
    return schema.modules();
  }
}
