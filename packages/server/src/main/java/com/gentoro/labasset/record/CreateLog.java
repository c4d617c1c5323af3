package com.gentoro.labasset.record;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.utility.FileUtility;
import com.gentoro.labasset.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Local journal of successful creates, {@code idempotency key -> external id}. Persisted as JSON
 * and rewritten atomically on every change. A {@code null} file keeps the journal in memory only.
 */
public class CreateLog {
  private static final Logger log = LoggingService.getLogger(CreateLog.class);
  private static final TypeReference<LinkedHashMap<String, String>> TYPE = new TypeReference<>() {};

  private final Path file;
  private Map<String, String> entries;

  public CreateLog(Path file) {
    this.file = file;
  }

  public static CreateLog inMemory() {
    return new CreateLog(null);
  }

  public synchronized Optional<String> find(String key) {
    return Optional.ofNullable(entries().get(key));
  }

  public synchronized void record(String key, String externalId) {
    String previous = entries().put(key, externalId);
    if (externalId.equals(previous)) return;
    if (file == null) return;
    try {
      FileUtility.writeAtomically(file, JacksonUtility.getJsonMapper().writeValueAsBytes(entries));
    } catch (IOException e) {
      // the remote tag lookup still finds the record, so the create stays idempotent
      log.warn("Could not persist create log {}: {}", file, e.getMessage());
    }
  }

  public synchronized int size() {
    return entries().size();
  }

  private Map<String, String> entries() {
    if (entries == null) {
      entries = new LinkedHashMap<>();
      if (file != null && Files.isRegularFile(file)) {
        try {
          entries.putAll(JacksonUtility.getJsonMapper().readValue(file.toFile(), TYPE));
        } catch (IOException e) {
          throw new LabAssetException(
              ErrorKind.STORAGE_ERROR, "Create log " + file + " is unreadable", e);
        }
      }
    }
    return entries;
  }
}
