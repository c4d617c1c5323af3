package com.gentoro.labasset.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.RecordClientException;
import com.gentoro.labasset.http.OkHttpFactory;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.retry.RetryPolicy;
import com.gentoro.labasset.retry.Sleeper;
import com.gentoro.labasset.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/**
 * eLabFTW API v2 client for database items.
 *
 * <p>The optimistic-concurrency version, the idempotency key, the status and the full attribute
 * tree live in the item metadata under {@code ingest}. Scalar attributes are mirrored into {@code
 * extra_fields} so they show up in the eLabFTW item view.
 */
public class ElabFtwRecordClient extends AbstractRecordClient {
  private static final Logger log = LoggingService.getLogger(ElabFtwRecordClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private final OkHttpClient http;
  private final HttpUrl base;

  public ElabFtwRecordClient(
      RecordSettings settings,
      CreateLog createLog,
      Supplier<RetryPolicy> retryPolicy,
      Sleeper sleeper) {
    this(
        settings,
        createLog,
        retryPolicy,
        sleeper,
        OkHttpFactory.create(settings.timeout(), settings.verifyTls()));
  }

  public ElabFtwRecordClient(
      RecordSettings settings,
      CreateLog createLog,
      Supplier<RetryPolicy> retryPolicy,
      Sleeper sleeper,
      OkHttpClient http) {
    super(settings, createLog, retryPolicy, sleeper);
    this.http = http;
    HttpUrl parsed = HttpUrl.parse(settings.baseUrl());
    if (parsed == null) {
      throw new RecordClientException(
          ErrorKind.CONFIG_ERROR, "Invalid recordSystem.baseUrl: " + settings.baseUrl());
    }
    this.base = parsed;
  }

  @Override
  protected Optional<String> findByKey(String idempotencyKey) {
    String tag = keyTag(idempotencyKey);
    HttpUrl url = url("items").newBuilder().addQueryParameter("tags[]", tag).build();
    JsonNode items = readJson(call(get(url), "find item by key"));
    List<Long> matches = new ArrayList<>();
    for (JsonNode item : items) {
      if (parseTags(item.get("tags")).contains(tag)) {
        matches.add(item.path("id").asLong());
      }
    }
    if (matches.size() > 1) {
      log.warn("{} items carry tag {}; using the oldest", matches.size(), tag);
    }
    return matches.stream().min(Comparator.naturalOrder()).map(String::valueOf);
  }

  @Override
  protected String doCreate(AssetRecord record, String idempotencyKey) {
    ObjectNode body = mapper().createObjectNode();
    body.put(
        "category_id",
        record.categoryId() > 0 ? record.categoryId() : settings.defaultCategory());
    body.put("title", record.title());
    body.put("body", record.body() == null ? "" : record.body());
    var tags = body.putArray("tags");
    record.tags().forEach(tags::add);
    tags.add(keyTag(idempotencyKey));

    Reply reply = call(post(url("items"), body), "create item");
    String id = idFromLocation(reply.location());
    if (id == null) {
      id = readJson(reply).path("id").asText(null);
    }
    if (id == null || id.isBlank()) {
      throw new RecordClientException(
          ErrorKind.INVALID_RESPONSE, "eLabFTW did not report the id of the created item");
    }
    storeMetadata(id, mapper().createObjectNode(), record, idempotencyKey);
    log.info("Created eLabFTW item {} for key {}", id, idempotencyKey);
    return id;
  }

  /** The item exists but the metadata write of its create may have failed. */
  @Override
  protected void completeCreate(String externalId, AssetRecord record, String idempotencyKey) {
    ObjectNode metadata =
        metadataOf(readJson(call(get(url("items", externalId)), "read item")));
    if (metadata.path("ingest").has("version")) return;
    log.info("Item {} has no ingest metadata yet, storing it", externalId);
    storeMetadata(externalId, metadata, record, idempotencyKey);
  }

  private void storeMetadata(
      String id, ObjectNode metadata, AssetRecord record, String idempotencyKey) {
    ObjectNode patch = mapper().createObjectNode();
    patch.put(
        "metadata",
        metadataJson(metadata, idempotencyKey, 1, record.status(), record.attributes()));
    call(patch(url("items", id), patch), "store item metadata");
  }

  @Override
  protected long doUpdate(String externalId, Map<String, Object> fields, long expectedVersion) {
    JsonNode item = readJson(call(get(url("items", externalId)), "read item"));
    ObjectNode metadata = metadataOf(item);
    JsonNode ingest = metadata.path("ingest");
    long current = ingest.path("version").asLong(0);
    if (current != expectedVersion) {
      throw new RecordClientException(
              ErrorKind.CONFLICT,
              "Item " + externalId + " is at version " + current + ", expected " + expectedVersion)
          .withContext("currentVersion", current);
    }
    AssetRecord updated = applyFields(toRecord(externalId, item), fields, expectedVersion + 1);

    ObjectNode patch = mapper().createObjectNode();
    if (fields.containsKey("title")) patch.put("title", updated.title());
    if (fields.containsKey("body")) patch.put("body", updated.body());
    if (fields.containsKey("categoryId")) patch.put("category", updated.categoryId());
    patch.put(
        "metadata",
        metadataJson(
            metadata,
            ingest.path("key").asText(null),
            updated.recordVersion(),
            updated.status(),
            updated.attributes()));
    call(patch(url("items", externalId), patch), "update item");

    if (fields.containsKey("tags")) {
      replaceTags(externalId, parseTags(item.get("tags")), updated.tags());
    }
    return updated.recordVersion();
  }

  private void replaceTags(String externalId, List<String> existing, List<String> wanted) {
    for (String tag : wanted) {
      if (!existing.contains(tag)) {
        ObjectNode tagBody = mapper().createObjectNode().put("tag", tag);
        call(post(url("items", externalId, "tags"), tagBody), "add item tag");
      }
    }
    if (wanted.containsAll(existing)) return;
    // removal goes by tag id, which only the tags endpoint reports
    for (JsonNode tag : readJson(call(get(url("items", externalId, "tags")), "list item tags"))) {
      if (wanted.contains(tag.path("tag").asText())) continue;
      ObjectNode unreference = mapper().createObjectNode().put("action", "unreference");
      call(
          patch(url("items", externalId, "tags", tag.path("tag_id").asText()), unreference),
          "remove item tag");
    }
  }

  @Override
  protected AssetRecord doGet(String externalId) {
    return toRecord(externalId, readJson(call(get(url("items", externalId)), "read item")));
  }

  @Override
  protected List<RecordSummary> doList(RecordFilter filter) {
    HttpUrl.Builder url =
        url("items")
            .newBuilder()
            .addQueryParameter("limit", String.valueOf(filter.limit()))
            .addQueryParameter("offset", String.valueOf(filter.offset()));
    if (filter.query() != null && !filter.query().isBlank()) {
      url.addQueryParameter("q", filter.query());
    }
    if (filter.categoryId() != null) {
      url.addQueryParameter("cat", String.valueOf(filter.categoryId()));
    }
    List<RecordSummary> out = new ArrayList<>();
    for (JsonNode item : readJson(call(get(url.build()), "list items"))) {
      out.add(
          new RecordSummary(
              item.path("id").asText(),
              item.path("title").asText(""),
              categoryOf(item),
              parseTags(item.get("tags")),
              item.path("date").asText(null)));
    }
    return out;
  }

  @Override
  protected void doAttachImage(
      String externalId, Path image, String fileName, String mediaType) {
    for (JsonNode upload :
        readJson(call(get(url("items", externalId, "uploads")), "list item uploads"))) {
      if (fileName.equals(upload.path("real_name").asText())) {
        log.debug("Item {} already has upload {}", externalId, fileName);
        return;
      }
    }
    MultipartBody body =
        new MultipartBody.Builder()
            .setType(MultipartBody.FORM)
            .addFormDataPart(
                "file",
                fileName,
                RequestBody.create(
                    image.toFile(),
                    MediaType.parse(mediaType == null ? "image/jpeg" : mediaType)))
            .addFormDataPart("comment", "Captured asset image")
            .build();
    call(
        authorized(url("items", externalId, "uploads")).post(body).build(), "upload item image");
    log.info("Uploaded {} to eLabFTW item {}", fileName, externalId);
  }

  @Override
  protected List<RecordTemplate> doTemplates() {
    List<RecordTemplate> out = new ArrayList<>();
    for (JsonNode type : readJson(call(get(url("items_types")), "list item types"))) {
      out.add(
          new RecordTemplate(
              type.path("id").asInt(),
              type.path("title").asText(""),
              type.path("body").asText(""),
              type.path("color").asText(null)));
    }
    return out;
  }

  @Override
  public void close() {
    http.connectionPool().evictAll();
  }

  private AssetRecord toRecord(String externalId, JsonNode item) {
    JsonNode ingest = metadataOf(item).path("ingest");
    Map<String, Object> attributes = new LinkedHashMap<>();
    if (ingest.path("attributes").isObject()) {
      attributes = mapper().convertValue(ingest.get("attributes"), MAP_TYPE);
    }
    return new AssetRecord(
        externalId,
        item.path("title").asText(""),
        item.path("body").asText(""),
        categoryOf(item),
        attributes,
        parseTags(item.get("tags")),
        ingest.path("status").asText("registered"),
        ingest.path("version").asLong(0));
  }

  private static int categoryOf(JsonNode item) {
    if (item.hasNonNull("category")) return item.get("category").asInt();
    return item.path("category_id").asInt(0);
  }

  /** The item metadata. eLabFTW returns it as a JSON string, {@code null} or an object. */
  private static ObjectNode metadataOf(JsonNode item) {
    JsonNode metadata = item.get("metadata");
    if (metadata != null && metadata.isTextual() && !metadata.asText().isBlank()) {
      try {
        metadata = mapper().readTree(metadata.asText());
      } catch (JsonProcessingException e) {
        log.warn("Ignoring unparsable metadata of item {}", item.path("id").asText());
        metadata = null;
      }
    }
    return metadata instanceof ObjectNode object ? object.deepCopy() : mapper().createObjectNode();
  }

  private static String metadataJson(
      ObjectNode metadata,
      String idempotencyKey,
      long version,
      String status,
      Map<String, Object> attributes) {
    ObjectNode ingest = metadata.putObject("ingest");
    ingest.put("version", version);
    if (idempotencyKey != null) ingest.put("key", idempotencyKey);
    ingest.put("status", status);
    ingest.set("attributes", mapper().valueToTree(attributes));
    ObjectNode extra =
        metadata.get("extra_fields") instanceof ObjectNode existing
            ? existing
            : metadata.putObject("extra_fields");
    attributes.forEach(
        (name, value) -> {
          if (value != null && !(value instanceof Map) && !(value instanceof List)) {
            extra.putObject(name).put("type", "text").put("value", String.valueOf(value));
          }
        });
    return JacksonUtility.toJson(metadata);
  }

  /** Tags come either as a JSON array or as eLabFTW's pipe-separated string. */
  static List<String> parseTags(JsonNode tags) {
    List<String> out = new ArrayList<>();
    if (tags == null || tags.isNull()) return out;
    if (tags.isArray()) {
      for (JsonNode tag : tags) {
        String value = tag.isObject() ? tag.path("tag").asText("") : tag.asText("");
        if (!value.isBlank()) out.add(value);
      }
    } else {
      Arrays.stream(tags.asText("").split("\\|"))
          .map(String::trim)
          .filter(t -> !t.isEmpty())
          .forEach(out::add);
    }
    return out;
  }

  static String idFromLocation(String location) {
    if (location == null || location.isBlank()) return null;
    String trimmed =
        location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
    String id = trimmed.substring(trimmed.lastIndexOf('/') + 1);
    return id.chars().allMatch(Character::isDigit) && !id.isEmpty() ? id : null;
  }

  private HttpUrl url(String... segments) {
    HttpUrl.Builder builder = base.newBuilder();
    for (String segment : segments) builder.addPathSegment(segment);
    return builder.build();
  }

  private Request get(HttpUrl url) {
    return authorized(url).get().build();
  }

  private Request post(HttpUrl url, JsonNode body) {
    return authorized(url).post(RequestBody.create(JacksonUtility.toJson(body), JSON)).build();
  }

  private Request patch(HttpUrl url, JsonNode body) {
    return authorized(url).patch(RequestBody.create(JacksonUtility.toJson(body), JSON)).build();
  }

  private Request.Builder authorized(HttpUrl url) {
    return new Request.Builder()
        .url(url)
        .header("Authorization", settings.credential() == null ? "" : settings.credential())
        .header("Accept", "application/json");
  }

  private record Reply(int code, String body, String location) {}

  private Reply call(Request request, String operation) {
    try (Response response = http.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String payload = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw new RecordClientException(
                kindForStatus(response.code()),
                "eLabFTW " + operation + " failed with HTTP " + response.code())
            .withContext("status", response.code())
            .withContext("url", request.url().encodedPath());
      }
      return new Reply(response.code(), payload, response.header("Location"));
    } catch (IOException e) {
      throw new RecordClientException(
          ErrorKind.TRANSIENT_NETWORK_ERROR,
          "eLabFTW " + operation + " failed: " + e.getMessage(),
          e);
    }
  }

  static ErrorKind kindForStatus(int status) {
    if (status == 401 || status == 403) return ErrorKind.AUTH_ERROR;
    if (status == 404) return ErrorKind.NOT_FOUND;
    if (status == 409 || status == 412) return ErrorKind.CONFLICT;
    if (status == 408 || status == 429 || status >= 500) return ErrorKind.TRANSIENT_NETWORK_ERROR;
    return ErrorKind.INVALID_INPUT;
  }

  private static JsonNode readJson(Reply reply) {
    if (reply.body().isBlank()) return mapper().createObjectNode();
    try {
      return mapper().readTree(reply.body());
    } catch (JsonProcessingException e) {
      throw new RecordClientException(
          ErrorKind.INVALID_RESPONSE, "eLabFTW returned malformed JSON", e);
    }
  }

  private static ObjectMapper mapper() {
    return JacksonUtility.getJsonMapper();
  }
}
