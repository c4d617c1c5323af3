package com.gentoro.labasset.service;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.labasset.ConfigFixture;
import com.gentoro.labasset.analysis.AnalysisEngine;
import com.gentoro.labasset.analysis.AnalysisResult;
import com.gentoro.labasset.analysis.ProviderId;
import com.gentoro.labasset.analysis.VisionProvider;
import com.gentoro.labasset.analysis.VisionRequest;
import com.gentoro.labasset.capture.ArtifactRegistry;
import com.gentoro.labasset.capture.CaptureDeviceFactory;
import com.gentoro.labasset.capture.CaptureService;
import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.events.NotificationBus;
import com.gentoro.labasset.exception.AnalysisException;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.JobFailedException;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.exception.ValidationException;
import com.gentoro.labasset.label.Label;
import com.gentoro.labasset.label.LabelGenerator;
import com.gentoro.labasset.label.LabelStore;
import com.gentoro.labasset.pipeline.InMemoryJobStore;
import com.gentoro.labasset.pipeline.JobStatus;
import com.gentoro.labasset.pipeline.JobView;
import com.gentoro.labasset.pipeline.PipelineOrchestrator;
import com.gentoro.labasset.record.AssetRecord;
import com.gentoro.labasset.record.InMemoryRecordClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AssetServiceTest {

  private static final String PIPETTE =
      "{\"summary\":{\"asset_name\":\"Pipette P200\",\"asset_type\":\"tool\"},"
          + "\"brand\":\"Gilson\"}";

  @TempDir Path tempDir;

  private final AtomicReference<RuntimeException> providerFailure = new AtomicReference<>();
  private ConfigStore config;
  private ArtifactRegistry registry;
  private InMemoryRecordClient records;
  private PipelineOrchestrator pipeline;
  private AssetService service;
  private Path inbox;

  @BeforeEach
  void setUp() throws Exception {
    NotificationBus bus = new NotificationBus();
    config = ConfigFixture.store(tempDir, bus, Map.of("capture.timeoutSeconds", 2));
    inbox = tempDir.resolve("inbox");
    Files.createDirectories(inbox);
    registry = new ArtifactRegistry();
    CaptureService capture =
        new CaptureService(config, CaptureDeviceFactory.directory(), registry);
    VisionProvider provider =
        new VisionProvider() {
          @Override
          public ProviderId id() {
            return ProviderId.OPENAI;
          }

          @Override
          public String complete(VisionRequest request) {
            RuntimeException failure = providerFailure.get();
            if (failure != null) throw failure;
            return PIPETTE;
          }
        };
    AnalysisEngine analysis = new AnalysisEngine(config, settings -> provider, millis -> {});
    records = new InMemoryRecordClient();
    LabelGenerator labels = new LabelGenerator(config);
    pipeline =
        new PipelineOrchestrator(
            config, new InMemoryJobStore(), bus, capture, analysis, () -> records, labels);
    service =
        new AssetService(
            config,
            bus,
            capture,
            analysis,
            () -> records,
            labels,
            new LabelStore(config),
            pipeline);
  }

  @AfterEach
  void tearDown() {
    pipeline.close();
  }

  private String createdId(String title, Integer category) {
    return (String)
        service.createRecord(title, "", category, Map.of(), List.of(), "k").get("externalId");
  }

  @Test
  void runOnceCapturesAndCompletes() throws Exception {
    Files.write(inbox.resolve("shot.jpg"), new byte[] {1, 2, 3});

    JobView done = service.runOnce(Duration.ofSeconds(10));

    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals("Pipette P200", done.title());
    assertEquals(1, service.listLabels().size());
    assertEquals(done.labelFile(), service.listLabels().get(0).fileName());
    assertEquals(done.jobId(), service.jobs().get(0).jobId());
    assertEquals(JobStatus.COMPLETED, service.job(done.jobId()).status());
  }

  @Test
  void runOnceReportsFailedJob() throws Exception {
    Files.write(inbox.resolve("shot.jpg"), new byte[] {1, 2, 3});
    providerFailure.set(new AnalysisException(ErrorKind.AUTH_ERROR, "bad key"));

    JobFailedException ex =
        assertThrows(JobFailedException.class, () -> service.runOnce(Duration.ofSeconds(10)));

    assertEquals(ErrorKind.JOB_FAILED, ex.getKind());
    assertEquals("ANALYZE", ex.getStage());
    assertEquals("AUTH_ERROR", ex.getContext().get("causeKind"));
  }

  @Test
  void runOnceWithoutImageTimesOut() {
    LabAssetException ex =
        assertThrows(LabAssetException.class, () -> service.runOnce(Duration.ofSeconds(10)));

    assertEquals(ErrorKind.CAPTURE_TIMEOUT, ex.getKind());
    assertTrue(service.jobs().isEmpty());
  }

  @Test
  void analyzeByPathReleasesTemporaryArtifact() throws Exception {
    Path image = tempDir.resolve("bench.png");
    Files.write(image, new byte[] {7});

    AnalysisResult result = service.analyze(null, image.toString(), "focus on ${deviceId}");

    assertEquals("Pipette P200", result.title());
    assertEquals("tool", result.assetType());
    assertTrue(registry.list().isEmpty());
    assertTrue(Files.exists(image));
  }

  @Test
  void analyzeNeedsExactlyOneSource() {
    assertThrows(InvalidInputException.class, () -> service.analyze(null, null, null));
    assertThrows(InvalidInputException.class, () -> service.analyze("img-1", "/tmp/x.jpg", null));
    LabAssetException ex =
        assertThrows(LabAssetException.class, () -> service.analyze("img-1", null, null));
    assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
  }

  @Test
  void createRecordIsIdempotentWithKey() {
    Map<String, Object> first =
        service.createRecord("Freezer", "<p>-80</p>", null, Map.of(), List.of("cold"), "k-1");
    Map<String, Object> second =
        service.createRecord("Freezer", "<p>-80</p>", null, Map.of(), List.of("cold"), "k-1");
    Map<String, Object> third =
        service.createRecord("Freezer", "<p>-80</p>", null, Map.of(), List.of("cold"), null);

    assertEquals(first.get("externalId"), second.get("externalId"));
    assertNotEquals(first.get("externalId"), third.get("externalId"));
    assertTrue(((String) third.get("idempotencyKey")).startsWith("api-"));
    AssetRecord record = (AssetRecord) first.get("record");
    assertEquals(1, record.categoryId());
    assertEquals(1, record.recordVersion());
    assertEquals(2, records.size());
  }

  @Test
  void updateRecordReturnsRefreshedRecord() {
    String id = createdId("Freezer", 2);

    AssetRecord updated = service.updateRecord(id, Map.of("title", "Freezer B"), 1L);

    assertEquals("Freezer B", updated.title());
    assertEquals(2, updated.recordVersion());
    assertThrows(
        InvalidInputException.class, () -> service.updateRecord(id, Map.of("title", "x"), null));
    LabAssetException conflict =
        assertThrows(
            LabAssetException.class, () -> service.updateRecord(id, Map.of("title", "C"), 1L));
    assertEquals(ErrorKind.CONFLICT, conflict.getKind());
  }

  @Test
  void generateLabelDefaultsToRecordTitle() {
    String id = createdId("Fume hood", null);

    Label label = service.generateLabel(id, null, "robust");

    assertEquals("Fume_hood_" + id + ".png", label.fileName());
    assertEquals(
        label.imagePath().toAbsolutePath().normalize(), service.labelFile(label.fileName()));
    service.deleteLabel(label.fileName());
    assertTrue(service.listLabels().isEmpty());
    assertThrows(ValidationException.class, () -> service.generateLabel(id, "x", "huge"));
  }

  @Test
  void cancellingFinishedJobIsConflict() throws Exception {
    Files.write(inbox.resolve("shot.jpg"), new byte[] {1});
    JobView done = service.runOnce(Duration.ofSeconds(10));

    LabAssetException ex =
        assertThrows(LabAssetException.class, () -> service.cancelJob(done.jobId()));

    assertEquals(ErrorKind.CONFLICT, ex.getKind());
    LabAssetException missing =
        assertThrows(LabAssetException.class, () -> service.job("no-such-job"));
    assertEquals(ErrorKind.NOT_FOUND, missing.getKind());
  }

  @Test
  void recordSettingsUpdateHidesCredential() {
    Map<String, Object> settings =
        service.updateRecordSettings(Map.of("credential", "abc", "defaultCategory", 4));

    assertEquals(4, settings.get("defaultCategory"));
    assertEquals(Boolean.TRUE, settings.get("credentialConfigured"));
    assertFalse(settings.containsValue("abc"));
    assertThrows(
        ValidationException.class,
        () -> service.updateRecordSettings(Map.of("baseUrl", "ftp://nowhere")));
    assertThrows(InvalidInputException.class, () -> service.updateAnalysisSettings(Map.of()));
  }

  @Test
  void systemLogsTailsConfiguredFile() throws Exception {
    assertTrue(service.systemLogs(10).isEmpty());

    Path logFile = tempDir.resolve("app.log");
    Files.write(logFile, List.of("one", "two", "three"));
    config.set("logging.file", logFile.toString());

    assertEquals(List.of("two", "three"), service.systemLogs(2));
    assertThrows(InvalidInputException.class, () -> service.systemLogs(0));
    assertThrows(InvalidInputException.class, () -> service.systemLogs(2001));
  }

  @Test
  void captureSettingsUpdateIsValidated() {
    Map<String, Object> settings =
        service.updateCaptureSettings(Map.of("resolution", "640x480", "frameRate", 15));

    assertEquals("640x480", settings.get("resolution"));
    assertEquals(15, ((Number) settings.get("frameRate")).intValue());
    assertEquals(settings, service.captureSettings());
    long version = config.version();
    assertThrows(
        ValidationException.class,
        () -> service.updateCaptureSettings(Map.of("resolution", "wide")));
    assertThrows(
        ValidationException.class, () -> service.updateCaptureSettings(Map.of("lens", "50mm")));
    assertThrows(InvalidInputException.class, () -> service.updateCaptureSettings(Map.of()));
    assertEquals(version, config.version());
    assertEquals("640x480", service.captureSettings().get("resolution"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void systemStatusReportsComponentHealth() {
    config.set("recordSystem.provider", "memory");
    config.set("inference.credential", "sk-test");

    Map<String, Object> healthy = service.systemStatus();
    Map<String, ComponentHealth> components =
        (Map<String, ComponentHealth>) healthy.get("components");

    assertEquals(Boolean.TRUE, healthy.get("healthy"));
    assertEquals(List.of("capture", "recordSystem", "inference"), List.copyOf(components.keySet()));
    assertTrue(components.values().stream().allMatch(ComponentHealth::healthy));

    records.failNext(ErrorKind.AUTH_ERROR, 1);
    config.set("inference.credential", "");
    Map<String, Object> degraded = service.systemStatus();
    components = (Map<String, ComponentHealth>) degraded.get("components");

    assertEquals(Boolean.FALSE, degraded.get("healthy"));
    assertTrue(components.get("capture").healthy());
    assertFalse(components.get("recordSystem").healthy());
    assertTrue(components.get("recordSystem").detail().contains("AUTH_ERROR"));
    assertFalse(components.get("inference").healthy());
    assertTrue(components.get("inference").detail().contains("openai"));
  }

  @Test
  void recordSystemWithoutCredentialIsUnhealthy() {
    config.set("recordSystem.provider", "elabftw");

    @SuppressWarnings("unchecked")
    Map<String, ComponentHealth> components =
        (Map<String, ComponentHealth>) service.systemStatus().get("components");

    assertFalse(components.get("recordSystem").healthy());
    assertTrue(components.get("recordSystem").detail().startsWith("No credential"));
  }

  @Test
  void systemStatusCountsJobs() throws Exception {
    Files.write(inbox.resolve("shot.jpg"), new byte[] {1});
    service.runOnce(Duration.ofSeconds(10));

    Map<String, Object> status = service.systemStatus();

    assertEquals("openai", status.get("inferenceProvider"));
    assertEquals(Map.of(JobStatus.COMPLETED, 1), status.get("jobs"));
    assertEquals(config.version(), status.get("configVersion"));
  }
}
