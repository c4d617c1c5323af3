package com.gentoro.labasset.record;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.exception.RecordClientException;
import com.gentoro.labasset.retry.RetryPolicy;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InMemoryRecordClientTest {

  private static final RetryPolicy TWO_RETRIES = new RetryPolicy(2, 0, 0, 0.0);

  @TempDir Path tempDir;

  private static AssetRecord draft(String title) {
    return AssetRecord.draft(
        title, "<p>body</p>", 0, Map.of("manufacturer", "Eppendorf"), List.of("auto-ingest"));
  }

  private static InMemoryRecordClient client(CreateLog createLog) {
    return new InMemoryRecordClient(
        InMemoryRecordClient.defaultSettings(), createLog, () -> TWO_RETRIES, millis -> {});
  }

  @Test
  void createReturnsSameIdForSameKey() {
    InMemoryRecordClient client = client(CreateLog.inMemory());

    String first = client.create(draft("Centrifuge"), "job-1");
    String second = client.create(draft("Centrifuge"), "job-1");

    assertEquals(first, second);
    assertEquals(1, client.size());
    assertEquals(1, client.createCalls());
    AssetRecord stored = client.get(first);
    assertEquals(1, stored.recordVersion());
    assertEquals(1, stored.categoryId());
    assertTrue(stored.tags().contains("ingest-key:job-1"));
  }

  @Test
  void createLogIsSharedThroughItsFile() {
    Path file = tempDir.resolve("create-log.json");
    InMemoryRecordClient first = client(new CreateLog(file));
    String id = first.create(draft("Centrifuge"), "job-7");

    InMemoryRecordClient restarted = client(new CreateLog(file));
    String again = restarted.create(draft("Centrifuge"), "job-7");

    assertEquals(id, again);
    assertEquals(0, restarted.createCalls());
  }

  @Test
  void transientFailureIsRetried() {
    InMemoryRecordClient client = client(CreateLog.inMemory());
    client.failNext(ErrorKind.TRANSIENT_NETWORK_ERROR, 2);

    String id = client.create(draft("Centrifuge"), "job-1");

    assertNotNull(id);
    assertEquals(1, client.size());
  }

  @Test
  void lostCreateResponseDoesNotDuplicate() {
    AtomicBoolean dropResponse = new AtomicBoolean(true);
    InMemoryRecordClient client =
        new InMemoryRecordClient(
            InMemoryRecordClient.defaultSettings(),
            CreateLog.inMemory(),
            () -> TWO_RETRIES,
            millis -> {}) {
          @Override
          protected synchronized String doCreate(AssetRecord record, String idempotencyKey) {
            String id = super.doCreate(record, idempotencyKey);
            if (dropResponse.getAndSet(false)) {
              throw new RecordClientException(ErrorKind.TRANSIENT_NETWORK_ERROR, "reset");
            }
            return id;
          }
        };

    String id = client.create(draft("Centrifuge"), "job-1");

    assertEquals("1", id);
    assertEquals(1, client.size());
    assertEquals(1, client.createCalls());
  }

  @Test
  void concurrentCreatesWithSameKeyMakeOneRecord() throws Exception {
    InMemoryRecordClient client = client(CreateLog.inMemory());
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<String>> results = new ArrayList<>();
    try {
      for (int i = 0; i < 8; i++) {
        Callable<String> create =
            () -> {
              start.await();
              return client.create(draft("Centrifuge"), "job-1");
            };
        results.add(pool.submit(create));
      }
      start.countDown();
      Set<String> ids = ConcurrentHashMap.newKeySet();
      for (Future<String> f : results) {
        ids.add(f.get(5, TimeUnit.SECONDS));
      }
      assertEquals(1, ids.size());
      assertEquals(1, client.size());
      assertEquals(1, client.createCalls());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void structuralFailureFailsCreate() {
    InMemoryRecordClient client = client(CreateLog.inMemory());
    client.failNext(ErrorKind.AUTH_ERROR, 1);

    LabAssetException ex =
        assertThrows(LabAssetException.class, () -> client.create(draft("X"), "job-1"));

    assertEquals(ErrorKind.AUTH_ERROR, ex.getKind());
    assertEquals(0, client.size());
  }

  @Test
  void createRequiresKeyAndTitle() {
    InMemoryRecordClient client = client(CreateLog.inMemory());

    assertThrows(InvalidInputException.class, () -> client.create(draft("X"), " "));
    assertThrows(InvalidInputException.class, () -> client.create(draft(""), "job-1"));
  }

  @Test
  void updateChecksVersionAndKeepsKeyTag() {
    InMemoryRecordClient client = client(CreateLog.inMemory());
    String id = client.create(draft("Centrifuge"), "job-1");

    long version =
        client.update(id, Map.of("title", "Centrifuge 5424", "tags", List.of("lab-2")), 1);

    assertEquals(2, version);
    AssetRecord updated = client.get(id);
    assertEquals("Centrifuge 5424", updated.title());
    assertEquals(List.of("ingest-key:job-1", "lab-2"), updated.tags());

    RecordClientException conflict =
        assertThrows(
            RecordClientException.class, () -> client.update(id, Map.of("title", "Y"), 1));
    assertEquals(ErrorKind.CONFLICT, conflict.getKind());
    assertEquals(2L, conflict.getContext().get("currentVersion"));
    assertEquals("Centrifuge 5424", client.get(id).title());
  }

  @Test
  void updateRejectsUnknownFields() {
    InMemoryRecordClient client = client(CreateLog.inMemory());
    String id = client.create(draft("Centrifuge"), "job-1");

    assertThrows(
        InvalidInputException.class, () -> client.update(id, Map.of("owner", "alice"), 1));
    assertThrows(InvalidInputException.class, () -> client.update(id, Map.of(), 1));
  }

  @Test
  void getUnknownRecordIsNotFound() {
    RecordClientException ex =
        assertThrows(
            RecordClientException.class, () -> client(CreateLog.inMemory()).get("404"));

    assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
  }

  @Test
  void listFiltersAndPages() {
    InMemoryRecordClient client = client(CreateLog.inMemory());
    client.create(draft("Centrifuge"), "k1");
    client.create(draft("Pipette"), "k2");
    client.create(draft("Mini centrifuge"), "k3");

    List<RecordSummary> matches = client.list(new RecordFilter("centrifuge", null, 10, 0));
    assertEquals(2, matches.size());

    List<RecordSummary> page = client.list(new RecordFilter(null, 1, 1, 1));
    assertEquals(1, page.size());
    assertEquals("Pipette", page.get(0).title());

    assertThrows(InvalidInputException.class, () -> new RecordFilter(null, null, 101, 0));
    assertThrows(InvalidInputException.class, () -> new RecordFilter(null, null, 10, -1));
  }

  @Test
  void templateStructureDropsMarkup() {
    InMemoryRecordClient client = client(CreateLog.inMemory());
    client.setTemplates(List.of(new RecordTemplate(4, "Chemical", "<p>CAS:</p>", null)));

    RecordTemplate template = client.templates().get(0);

    assertEquals(
        "Template name: Chemical\n\nTemplate structure:\nCAS:", template.structure());
  }
}
