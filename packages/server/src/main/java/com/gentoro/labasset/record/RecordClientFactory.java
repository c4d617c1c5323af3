package com.gentoro.labasset.record;

import com.gentoro.labasset.config.ConfigSnapshot;
import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.retry.RetryPolicy;
import com.gentoro.labasset.retry.Sleeper;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Supplies the record client matching the current {@code recordSystem} configuration. The client is
 * rebuilt when the settings change; the create log is shared per data directory.
 */
public class RecordClientFactory implements Supplier<RecordClient>, AutoCloseable {
  private static final Logger log = LoggingService.getLogger(RecordClientFactory.class);
  static final String CREATE_LOG_FILE = "create-log.json";

  private final ConfigStore config;
  private final Sleeper sleeper;
  private final Map<Path, CreateLog> createLogs = new HashMap<>();
  private RecordSettings currentSettings;
  private RecordClient current;

  public RecordClientFactory(ConfigStore config, Sleeper sleeper) {
    this.config = config;
    this.sleeper = sleeper;
  }

  @Override
  public synchronized RecordClient get() {
    ConfigSnapshot snapshot = config.snapshot();
    RecordSettings settings = RecordSettings.from(snapshot);
    if (current == null || !settings.equals(currentSettings)) {
      // in-flight calls may still use the previous client, so it is left to be collected
      current = create(settings, snapshot);
      currentSettings = settings;
      log.info("Record client ready: {}", settings);
    }
    return current;
  }

  private RecordClient create(RecordSettings settings, ConfigSnapshot snapshot) {
    Path dataDir = Path.of(snapshot.getString("storage.dataDir", "data"));
    CreateLog createLog =
        createLogs.computeIfAbsent(dataDir, dir -> new CreateLog(dir.resolve(CREATE_LOG_FILE)));
    Supplier<RetryPolicy> retry = () -> RetryPolicy.from(config.snapshot());
    switch (settings.provider()) {
      case MEMORY:
        return new InMemoryRecordClient(settings, createLog, retry, sleeper);
      case ELABFTW:
      default:
        return new ElabFtwRecordClient(settings, createLog, retry, sleeper);
    }
  }

  @Override
  public synchronized void close() {
    if (current != null) {
      current.close();
      current = null;
    }
  }
}
