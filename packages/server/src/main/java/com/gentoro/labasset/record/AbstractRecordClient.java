package com.gentoro.labasset.record;

import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.retry.Retrier;
import com.gentoro.labasset.retry.RetryPolicy;
import com.gentoro.labasset.retry.Sleeper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Shared behaviour of record clients: idempotent create through the {@link CreateLog} and a remote
 * key lookup, per-key and per-record serialization, and retry of transient failures. Subclasses
 * implement the single remote calls.
 */
public abstract class AbstractRecordClient implements RecordClient {
  private static final Logger log = LoggingService.getLogger(AbstractRecordClient.class);

  /** Tag prefix marking the idempotency key of a created record. */
  public static final String KEY_TAG_PREFIX = "ingest-key:";

  static final Set<String> UPDATABLE_FIELDS =
      Set.of("title", "body", "categoryId", "status", "tags", "attributes");

  protected final RecordSettings settings;
  private final CreateLog createLog;
  private final Supplier<RetryPolicy> retryPolicy;
  private final Sleeper sleeper;
  private final KeyedLocks createLocks = new KeyedLocks();
  private final KeyedLocks recordLocks = new KeyedLocks();

  protected AbstractRecordClient(
      RecordSettings settings,
      CreateLog createLog,
      Supplier<RetryPolicy> retryPolicy,
      Sleeper sleeper) {
    this.settings = settings;
    this.createLog = createLog;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
  }

  public RecordSettings settings() {
    return settings;
  }

  public static String keyTag(String idempotencyKey) {
    return KEY_TAG_PREFIX + idempotencyKey;
  }

  @Override
  public String create(AssetRecord record, String idempotencyKey) {
    if (idempotencyKey == null || idempotencyKey.isBlank()) {
      throw new InvalidInputException("idempotencyKey is required");
    }
    if (record == null || record.title() == null || record.title().isBlank()) {
      throw new InvalidInputException("record title is required");
    }
    return createLocks.withLock(
        idempotencyKey,
        () -> {
          Optional<String> logged = createLog.find(idempotencyKey);
          if (logged.isPresent()) {
            log.debug("Create for key {} already done as {}", idempotencyKey, logged.get());
            return logged.get();
          }
          String externalId =
              retrying(
                  "record create",
                  () ->
                      findByKey(idempotencyKey)
                          .map(
                              existing -> {
                                log.info(
                                    "Record for key {} already exists as {}",
                                    idempotencyKey,
                                    existing);
                                completeCreate(existing, record, idempotencyKey);
                                return existing;
                              })
                          .orElseGet(() -> doCreate(record, idempotencyKey)));
          createLog.record(idempotencyKey, externalId);
          return externalId;
        });
  }

  @Override
  public long update(String externalId, Map<String, Object> fields, long expectedVersion) {
    requireId(externalId);
    if (fields == null || fields.isEmpty()) {
      throw new InvalidInputException("no fields to update");
    }
    for (String field : fields.keySet()) {
      if (!UPDATABLE_FIELDS.contains(field)) {
        throw new InvalidInputException("field '" + field + "' cannot be updated");
      }
    }
    return recordLocks.withLock(
        externalId,
        () -> retrying("record update", () -> doUpdate(externalId, fields, expectedVersion)));
  }

  @Override
  public AssetRecord get(String externalId) {
    requireId(externalId);
    return retrying("record get", () -> doGet(externalId));
  }

  @Override
  public List<RecordSummary> list(RecordFilter filter) {
    return retrying("record list", () -> doList(filter == null ? RecordFilter.all() : filter));
  }

  @Override
  public void attachImage(String externalId, Path image, String fileName, String mediaType) {
    requireId(externalId);
    if (image == null || !Files.isRegularFile(image)) {
      throw new InvalidInputException("Image file not found: " + image);
    }
    if (fileName == null || fileName.isBlank()) {
      throw new InvalidInputException("fileName is required");
    }
    recordLocks.withLock(
        externalId,
        () ->
            retrying(
                "image upload",
                () -> {
                  doAttachImage(externalId, image, fileName, mediaType);
                  return null;
                }));
  }

  @Override
  public List<RecordTemplate> templates() {
    return retrying("template list", this::doTemplates);
  }

  protected abstract Optional<String> findByKey(String idempotencyKey);

  /**
   * Called when the key lookup finds a record, i.e. an earlier attempt created it. Finishes any
   * write of that attempt that may not have happened.
   */
  protected void completeCreate(String externalId, AssetRecord record, String idempotencyKey) {}

  protected abstract String doCreate(AssetRecord record, String idempotencyKey);

  protected abstract long doUpdate(
      String externalId, Map<String, Object> fields, long expectedVersion);

  protected abstract AssetRecord doGet(String externalId);

  protected abstract List<RecordSummary> doList(RecordFilter filter);

  protected abstract List<RecordTemplate> doTemplates();

  protected abstract void doAttachImage(
      String externalId, Path image, String fileName, String mediaType);

  /** The record after applying {@code fields}, at {@code newVersion}. */
  protected static AssetRecord applyFields(
      AssetRecord current, Map<String, Object> fields, long newVersion) {
    String title = current.title();
    String body = current.body();
    int categoryId = current.categoryId();
    String status = current.status();
    List<String> tags = current.tags();
    Map<String, Object> attributes = current.attributes();
    if (fields.containsKey("title")) title = String.valueOf(fields.get("title"));
    if (fields.containsKey("body")) body = String.valueOf(fields.get("body"));
    if (fields.containsKey("categoryId")) {
      categoryId = toInt("categoryId", fields.get("categoryId"));
    }
    if (fields.containsKey("status")) status = String.valueOf(fields.get("status"));
    if (fields.containsKey("tags")) tags = mergeTags(current.tags(), toTags(fields.get("tags")));
    if (fields.containsKey("attributes")) attributes = toAttributes(fields.get("attributes"));
    return new AssetRecord(
        current.externalId(), title, body, categoryId, attributes, tags, status, newVersion);
  }

  /** Replaces the tags of a record while keeping its idempotency-key tag. */
  static List<String> mergeTags(List<String> current, List<String> requested) {
    List<String> merged = new ArrayList<>();
    for (String tag : current) {
      if (tag.startsWith(KEY_TAG_PREFIX)) merged.add(tag);
    }
    for (String tag : requested) {
      if (!merged.contains(tag)) merged.add(tag);
    }
    return merged;
  }

  static int toInt(String field, Object value) {
    if (value instanceof Number n) return n.intValue();
    try {
      return Integer.parseInt(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new InvalidInputException("field '" + field + "' must be an integer", e);
    }
  }

  static List<String> toTags(Object value) {
    if (!(value instanceof List<?> list)) {
      throw new InvalidInputException("field 'tags' must be a list");
    }
    List<String> tags = new ArrayList<>();
    for (Object tag : list) {
      if (tag != null && !String.valueOf(tag).isBlank()) tags.add(String.valueOf(tag).trim());
    }
    return tags;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> toAttributes(Object value) {
    if (!(value instanceof Map<?, ?> map)) {
      throw new InvalidInputException("field 'attributes' must be an object");
    }
    return new LinkedHashMap<>((Map<String, Object>) map);
  }

  private <T> T retrying(String operation, Callable<T> call) {
    return new Retrier(retryPolicy.get(), sleeper).call(operation, call);
  }

  private static void requireId(String externalId) {
    if (externalId == null || externalId.isBlank()) {
      throw new InvalidInputException("externalId is required");
    }
  }
}
