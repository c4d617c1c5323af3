package com.gentoro.labasset.service;

import com.gentoro.labasset.analysis.AnalysisEngine;
import com.gentoro.labasset.analysis.AnalysisResult;
import com.gentoro.labasset.analysis.ProviderSettings;
import com.gentoro.labasset.capture.CaptureArtifact;
import com.gentoro.labasset.capture.CaptureService;
import com.gentoro.labasset.capture.CaptureStatus;
import com.gentoro.labasset.config.ConfigSnapshot;
import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.events.NotificationBus;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.JobFailedException;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.label.EncodingProfile;
import com.gentoro.labasset.label.Label;
import com.gentoro.labasset.label.LabelFile;
import com.gentoro.labasset.label.LabelGenerator;
import com.gentoro.labasset.label.LabelStore;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.pipeline.JobStatus;
import com.gentoro.labasset.pipeline.JobView;
import com.gentoro.labasset.pipeline.PipelineOrchestrator;
import com.gentoro.labasset.record.AssetRecord;
import com.gentoro.labasset.record.RecordClient;
import com.gentoro.labasset.record.RecordFilter;
import com.gentoro.labasset.record.RecordSettings;
import com.gentoro.labasset.record.RecordSummary;
import com.gentoro.labasset.record.RecordSystemProvider;
import com.gentoro.labasset.record.RecordTemplate;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Request/response operations of the ingestion server. The HTTP API and the one-shot mode are thin
 * adapters over this class; every operation either returns its payload or throws a {@link
 * LabAssetException} whose kind is reported to the caller.
 */
public class AssetService {
  private static final Logger log = LoggingService.getLogger(AssetService.class);
  public static final int MAX_LOG_LINES = 2000;

  private final ConfigStore config;
  private final NotificationBus bus;
  private final CaptureService capture;
  private final AnalysisEngine analysis;
  private final Supplier<RecordClient> records;
  private final LabelGenerator labels;
  private final LabelStore labelStore;
  private final PipelineOrchestrator pipeline;
  private final Instant startedAt = Instant.now();

  public AssetService(
      ConfigStore config,
      NotificationBus bus,
      CaptureService capture,
      AnalysisEngine analysis,
      Supplier<RecordClient> records,
      LabelGenerator labels,
      LabelStore labelStore,
      PipelineOrchestrator pipeline) {
    this.config = config;
    this.bus = bus;
    this.capture = capture;
    this.analysis = analysis;
    this.records = records;
    this.labels = labels;
    this.labelStore = labelStore;
    this.pipeline = pipeline;
  }

  // ---- capture

  public CaptureStatus captureStatus() {
    return capture.status();
  }

  /** Current {@code capture.*} settings. */
  public Map<String, Object> captureSettings() {
    return config.snapshot().section("capture");
  }

  /** Update {@code capture.*} keys as one configuration version. */
  public Map<String, Object> updateCaptureSettings(Map<String, ?> changes) {
    requireChanges(changes);
    config.setAll("capture", changes);
    return captureSettings();
  }

  /** Capture an image and start a pipeline job for it. */
  public Map<String, Object> triggerCapture() {
    CaptureArtifact artifact = capture.capture();
    JobView job = pipeline.submit(artifact.id());
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("artifact", artifact);
    out.put("job", job);
    return out;
  }

  /** Start a job for an artifact that is already registered. */
  public JobView submit(String captureArtifactId) {
    return pipeline.submit(captureArtifactId);
  }

  // ---- analysis

  public Map<String, Object> analysisSettings() {
    return analysis.settings();
  }

  public Map<String, Object> updateAnalysisSettings(Map<String, ?> changes) {
    requireChanges(changes);
    return analysis.updateSettings(changes);
  }

  /**
   * Analyze one image outside the pipeline. Exactly one of {@code artifactId} or {@code imagePath}
   * must be given; an image given by path is registered for the duration of the call.
   */
  public AnalysisResult analyze(String artifactId, String imagePath, String prompt) {
    boolean byId = artifactId != null && !artifactId.isBlank();
    boolean byPath = imagePath != null && !imagePath.isBlank();
    if (byId == byPath) {
      throw new InvalidInputException("Exactly one of artifactId or imagePath is required");
    }
    if (byId) {
      CaptureArtifact artifact =
          capture.find(artifactId).orElseThrow(() -> notFound("Capture artifact " + artifactId));
      return analysis.analyze(artifact, prompt);
    }
    CaptureArtifact artifact = capture.registerExisting(Path.of(imagePath), "external");
    try {
      return analysis.analyze(artifact, prompt);
    } finally {
      capture.release(artifact.id());
    }
  }

  // ---- records

  public Map<String, Object> recordSettings() {
    ConfigSnapshot snapshot = config.snapshot();
    Map<String, Object> out = RecordSettings.from(snapshot).describe();
    out.put("uploadImage", snapshot.getBoolean("recordSystem.uploadImage", true));
    return out;
  }

  public Map<String, Object> updateRecordSettings(Map<String, ?> changes) {
    requireChanges(changes);
    config.setAll("recordSystem", changes);
    return recordSettings();
  }

  public List<RecordTemplate> recordTemplates() {
    return records.get().templates();
  }

  /**
   * Create a record. Without an {@code idempotencyKey} every call creates a new record; with one,
   * repeated calls return the first record.
   */
  public Map<String, Object> createRecord(
      String title,
      String body,
      Integer categoryId,
      Map<String, Object> attributes,
      List<String> tags,
      String idempotencyKey) {
    if (title == null || title.isBlank()) {
      throw new InvalidInputException("title is required");
    }
    int category =
        categoryId != null
            ? categoryId
            : config.snapshot().getInt("recordSystem.defaultCategory", 1);
    String key =
        idempotencyKey == null || idempotencyKey.isBlank()
            ? "api-" + UUID.randomUUID()
            : idempotencyKey;
    RecordClient client = records.get();
    String externalId =
        client.create(AssetRecord.draft(title, body, category, attributes, tags), key);
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("externalId", externalId);
    out.put("idempotencyKey", key);
    out.put("record", client.get(externalId));
    return out;
  }

  public AssetRecord getRecord(String externalId) {
    return records.get().get(externalId);
  }

  /** @return the updated record */
  public AssetRecord updateRecord(
      String externalId, Map<String, Object> fields, Long expectedVersion) {
    if (expectedVersion == null) {
      throw new InvalidInputException("expectedVersion is required");
    }
    RecordClient client = records.get();
    client.update(externalId, fields, expectedVersion);
    return client.get(externalId);
  }

  public List<RecordSummary> listRecords(RecordFilter filter) {
    return records.get().list(filter);
  }

  // ---- labels

  /**
   * Generate a label for an existing record. The title defaults to the record's title; the
   * profile to {@code pipeline.labelProfile}.
   */
  public Label generateLabel(String externalId, String title, String profile) {
    if (externalId == null || externalId.isBlank()) {
      throw new InvalidInputException("externalId is required");
    }
    String labelTitle = title;
    if (labelTitle == null || labelTitle.isBlank()) {
      labelTitle = records.get().get(externalId).title();
    }
    EncodingProfile encoding =
        EncodingProfile.fromId(
            profile == null || profile.isBlank()
                ? config.snapshot().getString("pipeline.labelProfile", "standard")
                : profile);
    return labels.generate(externalId, labelTitle, encoding);
  }

  public List<LabelFile> listLabels() {
    return labelStore.list();
  }

  public Path labelFile(String fileName) {
    return labelStore.open(fileName);
  }

  public void deleteLabel(String fileName) {
    labelStore.delete(fileName);
  }

  // ---- jobs

  public List<JobView> jobs() {
    return pipeline.list();
  }

  public JobView job(String jobId) {
    return pipeline.view(jobId).orElseThrow(() -> notFound("Job " + jobId));
  }

  /** @return the job after the cancellation request */
  public JobView cancelJob(String jobId) {
    JobView current = job(jobId);
    if (current.isTerminal()) {
      throw new LabAssetException(
          ErrorKind.CONFLICT, "Job " + jobId + " is already " + current.status());
    }
    pipeline.cancel(jobId);
    return job(jobId);
  }

  /**
   * Capture, then run the job to its end.
   *
   * @throws JobFailedException when the job fails
   */
  public JobView runOnce(Duration timeout) throws InterruptedException {
    CaptureArtifact artifact = capture.capture();
    JobView job = pipeline.submit(artifact.id());
    JobView done = pipeline.awaitTerminal(job.jobId(), timeout);
    if (!done.isTerminal()) {
      pipeline.cancel(job.jobId());
      throw new LabAssetException(
          ErrorKind.STATE_ERROR, "Job " + job.jobId() + " did not finish within " + timeout);
    }
    if (done.status() == JobStatus.FAILED) {
      throw new JobFailedException(
          done.jobId(),
          done.failedStage() == null ? "queue" : done.failedStage().name(),
          done.lastError());
    }
    return done;
  }

  // ---- system

  public Map<String, Object> systemStatus() {
    ConfigSnapshot snapshot = config.snapshot();
    Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
    for (JobView job : pipeline.list()) {
      counts.merge(job.status(), 1, Integer::sum);
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("startedAt", startedAt);
    out.put("uptimeSeconds", Duration.between(startedAt, Instant.now()).toSeconds());
    out.put("configVersion", snapshot.version());
    out.put("configFile", config.file().toString());
    out.put("inferenceProvider", snapshot.getString("inference.providerId"));
    out.put("recordSystem", snapshot.getString("recordSystem.provider"));
    CaptureStatus captureStatus = capture.status();
    out.put("capture", captureStatus);
    out.put("jobs", counts);
    out.put("subscribers", bus.subscriberCount());
    Map<String, ComponentHealth> components = new LinkedHashMap<>();
    components.put("capture", captureHealth(captureStatus));
    components.put("recordSystem", recordSystemHealth(RecordSettings.from(snapshot)));
    components.put("inference", inferenceHealth(ProviderSettings.from(snapshot)));
    out.put("healthy", components.values().stream().allMatch(ComponentHealth::healthy));
    out.put("components", components);
    return out;
  }

  private static ComponentHealth captureHealth(CaptureStatus status) {
    if (!status.present()) {
      return ComponentHealth.down("Device " + status.deviceId() + " is not present");
    }
    if (status.lastError() != null) {
      return ComponentHealth.down(
          "Last capture failed: [%s] %s"
              .formatted(status.lastError().errorKind(), status.lastError().message()));
    }
    return ComponentHealth.up("Device " + status.deviceId() + " is present");
  }

  /** Lists the templates, which needs a working connection and credential. */
  private ComponentHealth recordSystemHealth(RecordSettings settings) {
    if (settings.provider() == RecordSystemProvider.ELABFTW && !settings.credentialConfigured()) {
      return ComponentHealth.down("No credential configured for " + settings.baseUrl());
    }
    try {
      int templates = records.get().templates().size();
      return ComponentHealth.up(
          "%s reachable, %d template(s)".formatted(settings.provider().id(), templates));
    } catch (LabAssetException e) {
      log.debug("Record system health check failed: {}", e.getMessage());
      return ComponentHealth.down("[%s] %s".formatted(e.getKind(), e.getMessage()));
    }
  }

  private static ComponentHealth inferenceHealth(ProviderSettings settings) {
    String provider = settings.providerId().id();
    if (!settings.providerId().isHosted()) {
      return ComponentHealth.up(
          "%s at %s, model %s"
              .formatted(provider, settings.localEndpoint(), settings.effectiveModel()));
    }
    if (!settings.credentialConfigured()) {
      return ComponentHealth.down("No credential configured for " + provider);
    }
    return ComponentHealth.up(provider + ", model " + settings.effectiveModel());
  }

  /** Last lines of the log file configured in {@code logging.file}. */
  public List<String> systemLogs(int lines) {
    if (lines <= 0 || lines > MAX_LOG_LINES) {
      throw new InvalidInputException("lines must be between 1 and " + MAX_LOG_LINES);
    }
    String file = config.snapshot().getString("logging.file");
    if (file.isBlank()) return List.of();
    try {
      return LoggingService.tail(Path.of(file), lines);
    } catch (IOException e) {
      log.warn("Could not read log file {}: {}", file, e.getMessage());
      throw new LabAssetException(ErrorKind.STORAGE_ERROR, "Could not read log file " + file, e);
    }
  }

  private static LabAssetException notFound(String what) {
    return new LabAssetException(ErrorKind.NOT_FOUND, what + " not found");
  }

  private static void requireChanges(Map<String, ?> changes) {
    if (changes == null || changes.isEmpty()) {
      throw new InvalidInputException("No settings given");
    }
  }
}
