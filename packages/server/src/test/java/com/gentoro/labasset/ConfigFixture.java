package com.gentoro.labasset;

import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.events.NotificationBus;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds a {@link ConfigStore} whose directories live under a test's temporary folder. */
public final class ConfigFixture {
  private ConfigFixture() {}

  public static ConfigStore store(Path dir) {
    return store(dir, new NotificationBus(), Map.of());
  }

  public static ConfigStore store(Path dir, NotificationBus bus, Map<String, Object> overrides) {
    ConfigStore store = new ConfigStore(dir.resolve("application.yaml"), bus);
    store.load();
    Map<String, Object> storage = new LinkedHashMap<>();
    storage.put("imagesDir", dir.resolve("images").toString());
    storage.put("labelsDir", dir.resolve("labels").toString());
    storage.put("dataDir", dir.resolve("data").toString());
    store.setAll("storage", storage);
    store.set("capture.inboxDir", dir.resolve("inbox").toString());
    store.set("logging.file", "");
    Map<String, Object> retry = new LinkedHashMap<>();
    retry.put("retry.baseDelayMs", 0);
    retry.put("retry.maxDelayMs", 0);
    retry.put("retry.jitterRatio", 0.0);
    store.setAll("pipeline", retry);
    overrides.forEach(store::set);
    return store;
  }
}
