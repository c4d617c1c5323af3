package com.gentoro.labasset.record;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.labasset.FakeHttpServer;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.retry.RetryPolicy;
import com.gentoro.labasset.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ElabFtwRecordClientTest {

  private static final String TOKEN = "token-1";

  @TempDir Path tempDir;

  private FakeElab elab;
  private FakeHttpServer server;

  @BeforeEach
  void setUp() throws Exception {
    elab = new FakeElab();
    server = new FakeHttpServer(elab, "/api/v2/*");
  }

  @AfterEach
  void tearDown() throws Exception {
    server.close();
  }

  private ElabFtwRecordClient client(String credential) {
    RecordSettings settings =
        new RecordSettings(
            RecordSystemProvider.ELABFTW,
            server.baseUrl() + "/api/v2",
            credential,
            3,
            1,
            true,
            Duration.ofSeconds(5));
    return new ElabFtwRecordClient(
        settings, CreateLog.inMemory(), () -> new RetryPolicy(2, 0, 0, 0.0), millis -> {});
  }

  private static AssetRecord draft() {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("manufacturer", "Eppendorf");
    attributes.put("specs", Map.of("rpm", "15000"));
    return AssetRecord.draft(
        "Centrifuge", "<p>Eppendorf</p>", 0, attributes, List.of("auto-ingest"));
  }

  @Test
  void createPostsItemAndStoresIngestMetadata() throws Exception {
    ElabFtwRecordClient client = client(TOKEN);

    String id = client.create(draft(), "job-1");

    assertEquals("17", id);
    ObjectNode item = elab.items.get(17L);
    assertEquals("Centrifuge", item.path("title").asText());
    assertEquals(3, item.path("category").asInt());
    assertEquals("auto-ingest|ingest-key:job-1", item.path("tags").asText());
    JsonNode metadata = elab.mapper.readTree(item.path("metadata").asText());
    assertEquals(1, metadata.path("ingest").path("version").asLong());
    assertEquals("job-1", metadata.path("ingest").path("key").asText());
    assertEquals(
        "Eppendorf", metadata.path("extra_fields").path("manufacturer").path("value").asText());
    assertTrue(metadata.path("extra_fields").path("specs").isMissingNode());

    AssetRecord stored = client.get(id);
    assertEquals(1, stored.recordVersion());
    assertEquals("draft", stored.status());
    assertEquals(Map.of("rpm", "15000"), stored.attributes().get("specs"));
    assertEquals(List.of("auto-ingest", "ingest-key:job-1"), stored.tags());
  }

  @Test
  void createReusesItemCarryingKeyTag() {
    ObjectNode existing = elab.newItem(5, "Centrifuge", 3, "ingest-key:job-9");
    elab.items.put(5L, existing);

    String id = client(TOKEN).create(draft(), "job-9");

    assertEquals("5", id);
    assertEquals(0, elab.count("POST /items"));
  }

  @Test
  void transientServerErrorIsRetried() {
    elab.failures.add(503);

    String id = client(TOKEN).create(draft(), "job-1");

    assertEquals("17", id);
    assertEquals(1, elab.items.size());
  }

  @Test
  void failedMetadataWriteIsCompletedOnRetry() throws Exception {
    elab.patchFailures.add(503);
    ElabFtwRecordClient client = client(TOKEN);

    String id = client.create(draft(), "job-1");

    assertEquals("17", id);
    assertEquals(1, elab.items.size());
    assertEquals(1, elab.count("POST /items"));
    AssetRecord stored = client.get(id);
    assertEquals(1, stored.recordVersion());
    assertEquals("draft", stored.status());
    assertEquals("Eppendorf", stored.attributes().get("manufacturer"));
    assertEquals(2, client.update(id, Map.of("status", "registered"), 1));
  }

  @Test
  void reusedItemWithMetadataIsNotRewritten() throws Exception {
    ElabFtwRecordClient first = client(TOKEN);
    String id = first.create(draft(), "job-1");
    first.update(id, Map.of("status", "registered"), 1);
    int patches = elab.count("PATCH /items/17");

    // a fresh create log, as after a restart that lost it
    String again = client(TOKEN).create(draft(), "job-1");

    assertEquals(id, again);
    assertEquals(patches, elab.count("PATCH /items/17"));
    assertEquals(2, first.get(id).recordVersion());
  }

  @Test
  void staleUpdateIsRejectedWithoutWriting() {
    ElabFtwRecordClient client = client(TOKEN);
    String id = client.create(draft(), "job-1");
    long version = client.update(id, Map.of("status", "registered"), 1);
    assertEquals(2, version);
    int patches = elab.count("PATCH /items/17");

    LabAssetException ex =
        assertThrows(
            LabAssetException.class, () -> client.update(id, Map.of("title", "Other"), 1));

    assertEquals(ErrorKind.CONFLICT, ex.getKind());
    assertEquals(2L, ex.getContext().get("currentVersion"));
    assertEquals(patches, elab.count("PATCH /items/17"));
    assertEquals("Centrifuge", client.get(id).title());
    assertEquals("registered", client.get(id).status());
  }

  @Test
  void updateAddsNewTags() {
    ElabFtwRecordClient client = client(TOKEN);
    String id = client.create(draft(), "job-1");

    client.update(id, Map.of("tags", List.of("auto-ingest", "room-101")), 1);

    assertEquals(1, elab.count("POST /items/17/tags"));
    assertEquals(0, elab.count("PATCH /items/17/tags"));
    assertEquals(
        List.of("auto-ingest", "ingest-key:job-1", "room-101"), client.get(id).tags());
  }

  @Test
  void updateReplacesTagsLikeTheMemoryClient() {
    ElabFtwRecordClient client = client(TOKEN);
    String id = client.create(draft(), "job-1");
    InMemoryRecordClient memory = new InMemoryRecordClient();
    String memoryId = memory.create(draft(), "job-1");

    client.update(id, Map.of("tags", List.of("room-101")), 1);
    memory.update(memoryId, Map.of("tags", List.of("room-101")), 1);

    assertEquals(List.of("ingest-key:job-1", "room-101"), client.get(id).tags());
    assertEquals(memory.get(memoryId).tags(), client.get(id).tags());
    assertEquals(1, elab.count("PATCH /items/17/tags/"));
  }

  @Test
  void attachImageUploadsOnce() throws Exception {
    Path image = tempDir.resolve("img-1.png");
    Files.write(image, "PNGDATA".getBytes(StandardCharsets.US_ASCII));
    ElabFtwRecordClient client = client(TOKEN);
    String id = client.create(draft(), "job-1");

    client.attachImage(id, image, "img-1.png", "image/png");
    client.attachImage(id, image, "img-1.png", "image/png");

    assertEquals(List.of("img-1.png"), elab.uploads.get(17L));
    assertEquals(1, elab.count("POST /items/17/uploads"));
    assertTrue(elab.uploadBodies.get(0).contains("PNGDATA"));
    assertTrue(elab.uploadBodies.get(0).contains("Content-Type: image/png"));
  }

  @Test
  void attachImageToMissingItemIsNotFound() throws Exception {
    Path image = tempDir.resolve("img-1.jpg");
    Files.write(image, new byte[] {1});

    LabAssetException ex =
        assertThrows(
            LabAssetException.class,
            () -> client(TOKEN).attachImage("99", image, "img-1.jpg", "image/jpeg"));

    assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
  }

  @Test
  void wrongCredentialIsAuthError() {
    LabAssetException ex =
        assertThrows(LabAssetException.class, () -> client("wrong").templates());

    assertEquals(ErrorKind.AUTH_ERROR, ex.getKind());
    assertEquals(1, elab.requests.size());
  }

  @Test
  void missingItemIsNotFound() {
    LabAssetException ex = assertThrows(LabAssetException.class, () -> client(TOKEN).get("99"));

    assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
  }

  @Test
  void templatesAreParsed() {
    List<RecordTemplate> templates = client(TOKEN).templates();

    assertEquals(1, templates.size());
    assertEquals(3, templates.get(0).id());
    assertEquals("Equipment", templates.get(0).title());
    assertTrue(templates.get(0).structure().contains("Model:"));
  }

  @Test
  void listPassesFilter() {
    ElabFtwRecordClient client = client(TOKEN);
    client.create(draft(), "job-1");

    List<RecordSummary> found = client.list(new RecordFilter("centri", 3, 10, 0));

    assertEquals(1, found.size());
    assertEquals("17", found.get(0).externalId());
    assertTrue(elab.requests.contains("GET /items?limit=10&offset=0&q=centri&cat=3"));
  }

  @Test
  void tagAndLocationParsing() {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    ArrayNode array = mapper.createArrayNode();
    array.addObject().put("tag", "a");
    array.add("b");

    assertEquals(List.of("a", "b"), ElabFtwRecordClient.parseTags(array));
    assertEquals(
        List.of("x", "y"), ElabFtwRecordClient.parseTags(mapper.getNodeFactory().textNode("x|y")));
    assertEquals("42", ElabFtwRecordClient.idFromLocation("https://h/api/v2/items/42/"));
    assertNull(ElabFtwRecordClient.idFromLocation("https://h/api/v2/items/new"));
  }

  /** Minimal in-memory eLabFTW items API. */
  static final class FakeElab extends HttpServlet {
    final ObjectMapper mapper = JacksonUtility.getJsonMapper();
    final Map<Long, ObjectNode> items = new TreeMap<>();
    final List<String> requests = new CopyOnWriteArrayList<>();
    final List<Integer> failures = new CopyOnWriteArrayList<>();
    final List<Integer> patchFailures = new CopyOnWriteArrayList<>();
    final Map<Long, List<String>> uploads = new TreeMap<>();
    final List<String> uploadBodies = new CopyOnWriteArrayList<>();
    private final Map<String, Long> tagIds = new LinkedHashMap<>();
    private long nextId = 17;

    int count(String request) {
      return (int) requests.stream().filter(r -> r.startsWith(request)).count();
    }

    ObjectNode newItem(long id, String title, int category, String tags) {
      ObjectNode item = mapper.createObjectNode();
      item.put("id", id);
      item.put("title", title);
      item.put("body", "");
      item.put("category", category);
      item.put("tags", tags);
      item.put("date", "2024-05-01");
      item.putNull("metadata");
      return item;
    }

    @Override
    protected synchronized void service(HttpServletRequest req, HttpServletResponse resp)
        throws IOException {
      String path = req.getPathInfo() == null ? "" : req.getPathInfo();
      String query = req.getQueryString() == null ? "" : "?" + decode(req.getQueryString());
      requests.add(req.getMethod() + " " + path + query);
      if (!TOKEN.equals(req.getHeader("Authorization"))) {
        resp.setStatus(401);
        return;
      }
      if (!failures.isEmpty()) {
        resp.setStatus(failures.remove(0));
        return;
      }
      if (req.getMethod().equals("PATCH") && !patchFailures.isEmpty()) {
        resp.setStatus(patchFailures.remove(0));
        return;
      }
      String[] parts =
          Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toArray(String[]::new);
      String method = req.getMethod();
      if (parts.length == 1 && parts[0].equals("items_types") && method.equals("GET")) {
        ArrayNode types = mapper.createArrayNode();
        types.addObject().put("id", 3).put("title", "Equipment").put("body", "<p>Model:</p>");
        write(resp, 200, types);
      } else if (parts.length == 1 && parts[0].equals("items") && method.equals("GET")) {
        write(resp, 200, list(req));
      } else if (parts.length == 1 && parts[0].equals("items") && method.equals("POST")) {
        JsonNode body = mapper.readTree(req.getInputStream());
        long id = nextId++;
        List<String> tags = new ArrayList<>();
        body.path("tags").forEach(t -> tags.add(t.asText()));
        ObjectNode item =
            newItem(
                id,
                body.path("title").asText(),
                body.path("category_id").asInt(),
                String.join("|", tags));
        item.put("body", body.path("body").asText());
        items.put(id, item);
        resp.setHeader("Location", "/api/v2/items/" + id);
        resp.setStatus(201);
      } else if (parts.length >= 2 && parts[0].equals("items")) {
        ObjectNode item = items.get(Long.parseLong(parts[1]));
        if (item == null) {
          resp.setStatus(404);
        } else if (parts.length >= 3 && parts[2].equals("uploads")) {
          uploads(req, resp, Long.parseLong(parts[1]));
        } else if (parts.length == 3 && method.equals("GET")) {
          ArrayNode tags = mapper.createArrayNode();
          for (String tag : tagsOf(item)) {
            long tagId = tagIds.computeIfAbsent(tag, t -> 100L + tagIds.size());
            tags.addObject().put("tag_id", tagId).put("tag", tag);
          }
          write(resp, 200, tags);
        } else if (parts.length == 4 && method.equals("PATCH")) {
          JsonNode action = mapper.readTree(req.getInputStream());
          long tagId = Long.parseLong(parts[3]);
          if (!action.path("action").asText().equals("unreference")) {
            resp.setStatus(400);
            return;
          }
          List<String> kept = new ArrayList<>(tagsOf(item));
          kept.removeIf(t -> tagIds.getOrDefault(t, -1L) == tagId);
          item.put("tags", String.join("|", kept));
          resp.setStatus(204);
        } else if (parts.length == 3 && method.equals("POST")) {
          String tag = mapper.readTree(req.getInputStream()).path("tag").asText();
          String tags = item.path("tags").asText("");
          item.put("tags", tags.isEmpty() ? tag : tags + "|" + tag);
          resp.setStatus(201);
        } else if (method.equals("PATCH")) {
          JsonNode patch = mapper.readTree(req.getInputStream());
          patch.fields().forEachRemaining(e -> item.set(e.getKey(), e.getValue()));
          write(resp, 200, item);
        } else {
          write(resp, 200, item);
        }
      } else {
        resp.setStatus(400);
      }
    }

    private void uploads(HttpServletRequest req, HttpServletResponse resp, long id)
        throws IOException {
      List<String> names = uploads.computeIfAbsent(id, k -> new ArrayList<>());
      if (req.getMethod().equals("GET")) {
        ArrayNode out = mapper.createArrayNode();
        for (int i = 0; i < names.size(); i++) {
          out.addObject().put("id", i + 1).put("real_name", names.get(i));
        }
        write(resp, 200, out);
        return;
      }
      String body = new String(req.getInputStream().readAllBytes(), StandardCharsets.ISO_8859_1);
      Matcher fileName = Pattern.compile("filename=\"([^\"]+)\"").matcher(body);
      if (!req.getContentType().startsWith("multipart/form-data") || !fileName.find()) {
        resp.setStatus(400);
        return;
      }
      uploadBodies.add(body);
      names.add(fileName.group(1));
      resp.setStatus(201);
    }

    private static List<String> tagsOf(ObjectNode item) {
      return Arrays.stream(item.path("tags").asText("").split("\\|"))
          .filter(t -> !t.isEmpty())
          .toList();
    }

    private ArrayNode list(HttpServletRequest req) {
      ArrayNode out = mapper.createArrayNode();
      String tag = req.getParameter("tags[]");
      String q = req.getParameter("q");
      for (ObjectNode item : items.values()) {
        List<String> tags = Arrays.asList(item.path("tags").asText("").split("\\|"));
        if (tag != null && !tags.contains(tag)) continue;
        if (q != null && !item.path("title").asText().toLowerCase().contains(q)) continue;
        out.add(item);
      }
      return out;
    }

    private void write(HttpServletResponse resp, int status, JsonNode body) throws IOException {
      resp.setStatus(status);
      resp.setContentType("application/json");
      resp.getOutputStream().write(mapper.writeValueAsBytes(body));
    }

    private static String decode(String query) {
      return java.net.URLDecoder.decode(query, StandardCharsets.UTF_8);
    }
  }
}
