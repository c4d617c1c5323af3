package com.gentoro.labasset.pipeline;

import com.gentoro.labasset.analysis.AnalysisEngine;
import com.gentoro.labasset.analysis.AnalysisResult;
import com.gentoro.labasset.analysis.ProviderSettings;
import com.gentoro.labasset.capture.CaptureArtifact;
import com.gentoro.labasset.capture.CaptureService;
import com.gentoro.labasset.config.ConfigSnapshot;
import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.events.JobEvent;
import com.gentoro.labasset.events.NotificationBus;
import com.gentoro.labasset.exception.DuplicateJobException;
import com.gentoro.labasset.exception.ErrorDetails;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.ExceptionUtil;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.exception.StateException;
import com.gentoro.labasset.label.EncodingProfile;
import com.gentoro.labasset.label.Label;
import com.gentoro.labasset.label.LabelGenerator;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.record.AssetRecord;
import com.gentoro.labasset.record.OptimisticUpdater;
import com.gentoro.labasset.record.RecordBody;
import com.gentoro.labasset.record.RecordClient;
import com.gentoro.labasset.record.RecordSettings;
import com.gentoro.labasset.record.RecordTemplate;
import com.gentoro.labasset.retry.Retrier;
import com.gentoro.labasset.retry.RetryPolicy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Drives capture artifacts through analysis, record registration and labeling.
 *
 * <p>Jobs run on a fixed pool of {@code pipeline.workers} threads; the stages of one job run
 * sequentially on the same worker. Every status change is persisted to the {@link JobStore} and
 * published on the {@link NotificationBus} before the next stage starts. At most one non-terminal
 * job exists per capture artifact. The artifact is released once its job completes; after a
 * failure it stays registered so that a new job can be submitted for it.
 */
public class PipelineOrchestrator implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(PipelineOrchestrator.class);

  private final ConfigStore config;
  private final JobStore store;
  private final NotificationBus bus;
  private final CaptureService capture;
  private final AnalysisEngine analysis;
  private final Supplier<RecordClient> records;
  private final LabelGenerator labels;
  private final ExecutorService workers;
  private final Map<String, Job> live = new ConcurrentHashMap<>();
  private final Map<String, String> activeByArtifact = new ConcurrentHashMap<>();

  public PipelineOrchestrator(
      ConfigStore config,
      JobStore store,
      NotificationBus bus,
      CaptureService capture,
      AnalysisEngine analysis,
      Supplier<RecordClient> records,
      LabelGenerator labels) {
    this.config = config;
    this.store = store;
    this.bus = bus;
    this.capture = capture;
    this.analysis = analysis;
    this.records = records;
    this.labels = labels;
    int size = config.snapshot().getInt("pipeline.workers", 2);
    AtomicInteger counter = new AtomicInteger();
    this.workers =
        Executors.newFixedThreadPool(
            size,
            r -> {
              Thread t = new Thread(r, "pipeline-worker-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Mark jobs that were still running when the process stopped as failed. They cannot be resumed
   * because their capture artifacts do not survive a restart.
   *
   * @return number of jobs marked failed
   */
  public int recoverInterrupted() {
    int recovered = 0;
    for (JobView view : store.list()) {
      if (view.isTerminal() || live.containsKey(view.jobId())) continue;
      ErrorDetails error =
          ErrorDetails.of(ErrorKind.STATE_ERROR, "Interrupted by a restart in " + view.status());
      store.put(
          new JobView(
              view.jobId(),
              view.captureArtifactId(),
              JobStatus.FAILED,
              view.stage(),
              view.attempt(),
              view.attempts(),
              view.title(),
              view.assetType(),
              view.confidence(),
              view.attributes(),
              view.externalId(),
              view.recordVersion(),
              view.labelFile(),
              view.labelPayload(),
              error,
              view.stage(),
              view.createdAt(),
              Instant.now()));
      recovered++;
    }
    if (recovered > 0) {
      log.warn("Marked {} interrupted job(s) as failed", recovered);
    }
    return recovered;
  }

  /**
   * Start a job for a registered capture artifact.
   *
   * @throws DuplicateJobException when a non-terminal job already exists for the artifact
   */
  public JobView submit(String captureArtifactId) {
    if (captureArtifactId == null || captureArtifactId.isBlank()) {
      throw new InvalidInputException("captureArtifactId is required");
    }
    CaptureArtifact artifact =
        capture
            .find(captureArtifactId)
            .orElseThrow(() -> notFound("Capture artifact " + captureArtifactId));

    Job job = new Job(UUID.randomUUID().toString(), captureArtifactId);
    String active = activeByArtifact.putIfAbsent(captureArtifactId, job.id);
    if (active != null) {
      throw new DuplicateJobException(captureArtifactId, active);
    }
    live.put(job.id, job);
    try {
      store.put(job.view());
    } catch (RuntimeException e) {
      live.remove(job.id);
      activeByArtifact.remove(captureArtifactId, job.id);
      throw e;
    }
    publish(JobEvent.Type.CREATED, job, null);
    log.info("Job {} accepted for artifact {}", job.id, captureArtifactId);
    try {
      job.future = workers.submit(() -> run(job, artifact));
    } catch (RejectedExecutionException e) {
      fail(job, ErrorDetails.of(ErrorKind.STATE_ERROR, "Pipeline is shut down"));
      throw new StateException("Pipeline is shut down", e);
    }
    return job.view();
  }

  public Optional<JobView> view(String jobId) {
    Job job = live.get(jobId);
    return job != null ? Optional.of(job.view()) : store.get(jobId);
  }

  public List<JobView> list() {
    List<JobView> out = new ArrayList<>(store.list());
    out.replaceAll(v -> live.containsKey(v.jobId()) ? live.get(v.jobId()).view() : v);
    return out;
  }

  /** Job currently active for an artifact, if any. */
  public Optional<String> activeJob(String captureArtifactId) {
    return Optional.ofNullable(activeByArtifact.get(captureArtifactId));
  }

  /**
   * Request cancellation. A job that has not started ends immediately; a running job stops at its
   * next stage boundary or when its in-flight call returns.
   *
   * @return {@code false} when the job is unknown or already terminal
   */
  public boolean cancel(String jobId) {
    Job job = live.get(jobId);
    if (job == null || job.status().isTerminal()) return false;
    job.cancelRequested = true;
    log.info("Cancellation requested for job {}", jobId);
    // the job monitor keeps a worker from entering its first stage meanwhile
    synchronized (job) {
      if (job.status() == JobStatus.PENDING && job.future != null && job.future.cancel(false)) {
        fail(job, cancelled(job));
      }
    }
    return true;
  }

  /** Wait until the job is terminal or the timeout elapses; returns its latest view. */
  public JobView awaitTerminal(String jobId, Duration timeout) throws InterruptedException {
    Job job = live.get(jobId);
    if (job != null) {
      job.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    return view(jobId).orElseThrow(() -> notFound("Job " + jobId));
  }

  private void run(Job job, CaptureArtifact artifact) {
    try {
      ConfigSnapshot snapshot = config.snapshot();
      RetryPolicy retry = RetryPolicy.from(snapshot);

      // analysis
      enter(job, Stage.ANALYZE, JobStatus.ANALYZING);
      String templateFields = templateFields(RecordSettings.from(snapshot));
      AnalysisResult result =
          analysis.analyze(
              artifact,
              null,
              ProviderSettings.from(snapshot),
              templateFields,
              retry,
              () -> job.cancelRequested,
              listener(job));
      checkCancelled(job);
      job.analyzed(result);
      advance(job, JobStatus.ANALYZED);

      // registration
      enter(job, Stage.REGISTER, JobStatus.REGISTERING);
      RecordClient client = records.get();
      job.attempt(1);
      String externalId = client.create(draft(result, snapshot), "job-" + job.id);
      checkCancelled(job);
      long version = client.get(externalId).recordVersion();
      job.registered(externalId, version);
      store.put(job.view());
      if (snapshot.getBoolean("recordSystem.uploadImage", true)) {
        client.attachImage(
            externalId, artifact.imagePath(), imageFileName(artifact), artifact.mediaType());
        checkCancelled(job);
      }
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("attributes", result.attributes());
      fields.put("status", "registered");
      long updated =
          new OptimisticUpdater(client, snapshot.getInt("pipeline.conflictRetries", 2))
              .update(externalId, fields, version, () -> job.cancelRequested);
      checkCancelled(job);
      job.registered(externalId, updated);
      advance(job, JobStatus.REGISTERED);

      // labeling
      enter(job, Stage.LABEL, JobStatus.LABELING);
      job.attempt(1);
      EncodingProfile profile =
          EncodingProfile.fromId(snapshot.getString("pipeline.labelProfile", "standard"));
      Label label = labels.generate(externalId, result.title(), profile);
      job.labeled(label);
      advance(job, JobStatus.COMPLETED);
      finish(job);
      capture.release(job.captureArtifactId);
      publish(JobEvent.Type.COMPLETED, job, null);
      log.info("Job {} completed: record {}, label {}", job.id, externalId, label.fileName());
    } catch (Exception e) {
      if (ExceptionUtil.unwrap(e) instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      ErrorDetails error = job.cancelRequested ? cancelled(job) : ExceptionUtil.toErrorDetails(e);
      fail(job, error);
    }
  }

  private void enter(Job job, Stage stage, JobStatus status) {
    synchronized (job) {
      checkCancelled(job);
      job.startStage(stage);
      advance(job, status);
    }
  }

  /** Transitions, persists and publishes under the job monitor so nothing follows a failure. */
  private void advance(Job job, JobStatus status) {
    synchronized (job) {
      if (job.status().isTerminal()) {
        throw new LabAssetException(
            ErrorKind.CANCELLED, "Job " + job.id + " already ended as " + job.status());
      }
      job.transition(status);
      store.put(job.view());
      publish(JobEvent.Type.TRANSITIONED, job, null);
    }
  }

  private void checkCancelled(Job job) {
    if (job.cancelRequested) {
      throw new LabAssetException(ErrorKind.CANCELLED, "Job " + job.id + " cancelled");
    }
  }

  private Retrier.Listener listener(Job job) {
    return new Retrier.Listener() {
      @Override
      public void onAttempt(int attempt) {
        job.attempt(attempt);
      }

      @Override
      public void onRetry(int attempt, long delayMs, LabAssetException cause) {
        synchronized (job) {
          if (job.status().isTerminal()) return;
          store.put(job.view());
          publish(JobEvent.Type.RETRYING, job, ExceptionUtil.toErrorDetails(cause));
        }
      }
    };
  }

  /** Template of the default category, used to shape the extraction; optional. */
  private String templateFields(RecordSettings settings) {
    try {
      for (RecordTemplate template : records.get().templates()) {
        if (template.id() == settings.defaultCategory()) {
          return template.structure();
        }
      }
    } catch (LabAssetException e) {
      log.warn("Record templates unavailable, using generic fields: {}", e.getMessage());
    }
    return null;
  }

  private static AssetRecord draft(AnalysisResult result, ConfigSnapshot snapshot) {
    List<String> tags = new ArrayList<>();
    tags.add("auto-ingest");
    if (result.assetType() != null) tags.add(result.assetType());
    return AssetRecord.draft(
        result.title(),
        RecordBody.render(result.attributes()),
        snapshot.getInt("recordSystem.defaultCategory", 1),
        result.attributes(),
        tags);
  }

  /** Upload name of the image: artifact id plus the extension of the stored file. */
  static String imageFileName(CaptureArtifact artifact) {
    String name = artifact.imagePath().getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? artifact.id() : artifact.id() + name.substring(dot);
  }

  private static ErrorDetails cancelled(Job job) {
    return ErrorDetails.of(ErrorKind.CANCELLED, "Job " + job.id + " cancelled");
  }

  private void fail(Job job, ErrorDetails error) {
    synchronized (job) {
      if (job.status().isTerminal()) return;
      job.failed(error);
      try {
        store.put(job.view());
      } catch (LabAssetException e) {
        log.error("Could not persist failure of job {}: {}", job.id, e.getMessage());
      }
      finish(job);
      publish(JobEvent.Type.FAILED, job, error);
    }
    log.warn(
        "Job {} failed in {}: [{}] {}",
        job.id,
        job.stage() == null ? "queue" : job.stage(),
        error.errorKind(),
        error.message());
  }

  private void finish(Job job) {
    activeByArtifact.remove(job.captureArtifactId, job.id);
    live.remove(job.id);
    job.done.countDown();
  }

  private void publish(JobEvent.Type type, Job job, ErrorDetails error) {
    JobView view = job.view();
    bus.publish(
        new JobEvent(
            type,
            view.jobId(),
            view.captureArtifactId(),
            view.status().name(),
            view.stage() == null ? null : view.stage().name(),
            view.attempt(),
            error,
            Instant.now()));
  }

  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
  }

  private static LabAssetException notFound(String what) {
    return new LabAssetException(ErrorKind.NOT_FOUND, what + " not found");
  }
}
