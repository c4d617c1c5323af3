package com.gentoro.labasset.record;

import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import java.util.Map;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;

/**
 * Applies an update under optimistic concurrency. On {@code CONFLICT} the current version is
 * re-fetched and the update retried, at most {@code conflictRetries} times.
 */
public class OptimisticUpdater {
  private static final Logger log = LoggingService.getLogger(OptimisticUpdater.class);

  private final RecordClient client;
  private final int conflictRetries;

  public OptimisticUpdater(RecordClient client, int conflictRetries) {
    if (conflictRetries < 0) throw new IllegalArgumentException("conflictRetries must be >= 0");
    this.client = client;
    this.conflictRetries = conflictRetries;
  }

  public long update(String externalId, Map<String, Object> fields, long expectedVersion) {
    return update(externalId, fields, expectedVersion, () -> false);
  }

  /** @return the version of the record after the update */
  public long update(
      String externalId,
      Map<String, Object> fields,
      long expectedVersion,
      BooleanSupplier cancelled) {
    long expected = expectedVersion;
    int conflicts = 0;
    while (true) {
      try {
        return client.update(externalId, fields, expected);
      } catch (LabAssetException e) {
        if (e.getKind() != ErrorKind.CONFLICT || conflicts >= conflictRetries) {
          throw e;
        }
        conflicts++;
      }
      if (cancelled.getAsBoolean()) {
        throw new LabAssetException(
            ErrorKind.CANCELLED, "Update of record " + externalId + " cancelled");
      }
      long current = client.get(externalId).recordVersion();
      log.info(
          "Record {} changed concurrently (expected version {}, now {}); retrying update",
          externalId,
          expected,
          current);
      expected = current;
    }
  }
}
