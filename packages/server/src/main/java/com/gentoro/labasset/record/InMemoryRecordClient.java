package com.gentoro.labasset.record;

import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.RecordClientException;
import com.gentoro.labasset.retry.RetryPolicy;
import com.gentoro.labasset.retry.Sleeper;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Record system kept in process memory. Selected with {@code recordSystem.provider: memory}; also
 * the fake used by tests, which can inject failures and concurrent edits.
 *
 * <p>A create for an idempotency key that was already used is rejected with {@code CONFLICT}, so a
 * duplicate create is visible as a failure instead of a second record.
 */
public class InMemoryRecordClient extends AbstractRecordClient {
  private final Map<String, AssetRecord> records = new LinkedHashMap<>();
  private final Map<String, String> keys = new LinkedHashMap<>();
  private final Map<String, String> dates = new LinkedHashMap<>();
  private final Map<String, Map<String, Path>> attachments = new LinkedHashMap<>();
  private final Deque<ErrorKind> injected = new ArrayDeque<>();
  private final List<RecordTemplate> templates = new ArrayList<>();
  private final Supplier<String> ids;
  private final AtomicInteger createCalls = new AtomicInteger();

  public InMemoryRecordClient() {
    this(defaultSettings(), CreateLog.inMemory(), RetryPolicy::none, Sleeper.SYSTEM);
  }

  public InMemoryRecordClient(
      RecordSettings settings,
      CreateLog createLog,
      Supplier<RetryPolicy> retryPolicy,
      Sleeper sleeper) {
    this(settings, createLog, retryPolicy, sleeper, sequentialIds());
  }

  public InMemoryRecordClient(
      RecordSettings settings,
      CreateLog createLog,
      Supplier<RetryPolicy> retryPolicy,
      Sleeper sleeper,
      Supplier<String> ids) {
    super(settings, createLog, retryPolicy, sleeper);
    this.ids = ids;
    templates.add(
        new RecordTemplate(
            1, "Asset", "<p>Manufacturer:</p><p>Model:</p><p>Serial number:</p>", "29aeb9"));
  }

  public static RecordSettings defaultSettings() {
    return new RecordSettings(
        RecordSystemProvider.MEMORY,
        "memory://local/api/v2",
        "",
        1,
        1,
        true,
        Duration.ofSeconds(5));
  }

  private static Supplier<String> sequentialIds() {
    AtomicLong next = new AtomicLong(1);
    return () -> String.valueOf(next.getAndIncrement());
  }

  /** Number of remote creates performed, key lookups excluded. */
  public int createCalls() {
    return createCalls.get();
  }

  /** Make the next {@code times} remote calls fail with {@code kind}. */
  public synchronized void failNext(ErrorKind kind, int times) {
    for (int i = 0; i < times; i++) injected.add(kind);
  }

  /** Simulate an edit by another client: bumps the version of a record. */
  public synchronized long touch(String externalId) {
    AssetRecord current = require(externalId);
    AssetRecord touched = current.withExternalId(externalId, current.recordVersion() + 1);
    records.put(externalId, touched);
    return touched.recordVersion();
  }

  public synchronized void setTemplates(List<RecordTemplate> replacement) {
    templates.clear();
    templates.addAll(replacement);
  }

  public synchronized int size() {
    return records.size();
  }

  /** File names attached to a record, in attach order. */
  public synchronized List<String> attachments(String externalId) {
    return List.copyOf(attachments.getOrDefault(externalId, Map.of()).keySet());
  }

  @Override
  protected synchronized Optional<String> findByKey(String idempotencyKey) {
    injectFailure();
    return Optional.ofNullable(keys.get(idempotencyKey));
  }

  @Override
  protected synchronized String doCreate(AssetRecord record, String idempotencyKey) {
    injectFailure();
    createCalls.incrementAndGet();
    if (keys.containsKey(idempotencyKey)) {
      throw new RecordClientException(
          ErrorKind.CONFLICT, "Key " + idempotencyKey + " was already used for a create");
    }
    String id = ids.get();
    List<String> tags = new ArrayList<>(record.tags());
    tags.add(keyTag(idempotencyKey));
    records.put(
        id,
        new AssetRecord(
            id,
            record.title(),
            record.body(),
            record.categoryId() > 0 ? record.categoryId() : settings.defaultCategory(),
            record.attributes(),
            tags,
            record.status(),
            1));
    keys.put(idempotencyKey, id);
    dates.put(id, LocalDate.now().toString());
    return id;
  }

  @Override
  protected synchronized long doUpdate(
      String externalId, Map<String, Object> fields, long expectedVersion) {
    injectFailure();
    AssetRecord current = require(externalId);
    if (current.recordVersion() != expectedVersion) {
      throw new RecordClientException(
              ErrorKind.CONFLICT,
              "Record "
                  + externalId
                  + " is at version "
                  + current.recordVersion()
                  + ", expected "
                  + expectedVersion)
          .withContext("currentVersion", current.recordVersion());
    }
    AssetRecord updated = applyFields(current, fields, expectedVersion + 1);
    records.put(externalId, updated);
    return updated.recordVersion();
  }

  @Override
  protected synchronized AssetRecord doGet(String externalId) {
    injectFailure();
    return require(externalId);
  }

  @Override
  protected synchronized List<RecordSummary> doList(RecordFilter filter) {
    injectFailure();
    String query = filter.query() == null ? "" : filter.query().toLowerCase(Locale.ROOT);
    return records.values().stream()
        .filter(r -> r.title().toLowerCase(Locale.ROOT).contains(query))
        .filter(r -> filter.categoryId() == null || filter.categoryId() == r.categoryId())
        .skip(filter.offset())
        .limit(filter.limit())
        .map(
            r ->
                new RecordSummary(
                    r.externalId(), r.title(), r.categoryId(), r.tags(), dates.get(r.externalId())))
        .toList();
  }

  @Override
  protected synchronized void doAttachImage(
      String externalId, Path image, String fileName, String mediaType) {
    injectFailure();
    require(externalId);
    attachments
        .computeIfAbsent(externalId, k -> new LinkedHashMap<>())
        .putIfAbsent(fileName, image);
  }

  @Override
  protected synchronized List<RecordTemplate> doTemplates() {
    injectFailure();
    return List.copyOf(templates);
  }

  private AssetRecord require(String externalId) {
    AssetRecord record = records.get(externalId);
    if (record == null) {
      throw new RecordClientException(ErrorKind.NOT_FOUND, "Record " + externalId + " not found");
    }
    return record;
  }

  private void injectFailure() {
    ErrorKind kind = injected.poll();
    if (kind != null) {
      throw new RecordClientException(kind, "Injected " + kind + " failure");
    }
  }
}
