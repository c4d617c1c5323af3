package com.gentoro.labasset.pipeline;

import com.gentoro.labasset.analysis.AnalysisResult;
import com.gentoro.labasset.exception.ErrorDetails;
import com.gentoro.labasset.exception.StateException;
import com.gentoro.labasset.label.Label;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;

/** Live state of a job while it is owned by the orchestrator. */
final class Job {
  final String id;
  final String captureArtifactId;
  final Instant createdAt = Instant.now();
  final CountDownLatch done = new CountDownLatch(1);

  private JobStatus status = JobStatus.PENDING;
  private Stage stage;
  private int attempt;
  private final Map<Stage, Integer> attempts = new EnumMap<>(Stage.class);
  private Instant updatedAt = createdAt;
  private AnalysisResult analysis;
  private String externalId;
  private Long recordVersion;
  private Label label;
  private ErrorDetails lastError;
  private Stage failedStage;

  volatile Future<?> future;
  volatile boolean cancelRequested;

  Job(String id, String captureArtifactId) {
    this.id = id;
    this.captureArtifactId = captureArtifactId;
  }

  synchronized JobStatus status() {
    return status;
  }

  synchronized Stage stage() {
    return stage;
  }

  synchronized String externalId() {
    return externalId;
  }

  synchronized void transition(JobStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new StateException("Job " + id + " cannot move from " + status + " to " + next);
    }
    status = next;
    updatedAt = Instant.now();
  }

  synchronized void startStage(Stage next) {
    stage = next;
    attempt = 0;
  }

  synchronized void attempt(int n) {
    attempt = n;
    if (stage != null) {
      attempts.put(stage, n);
    }
    updatedAt = Instant.now();
  }

  synchronized void analyzed(AnalysisResult result) {
    analysis = result;
  }

  synchronized void registered(String id, long version) {
    externalId = id;
    recordVersion = version;
  }

  synchronized void labeled(Label generated) {
    label = generated;
  }

  synchronized void failed(ErrorDetails error) {
    lastError = error;
    failedStage = stage;
    transition(JobStatus.FAILED);
  }

  synchronized JobView view() {
    return new JobView(
        id,
        captureArtifactId,
        status,
        stage,
        attempt,
        attempts,
        analysis == null ? null : analysis.title(),
        analysis == null ? null : analysis.assetType(),
        analysis == null ? null : analysis.confidence(),
        analysis == null ? null : analysis.attributes(),
        externalId,
        recordVersion,
        label == null ? null : label.fileName(),
        label == null ? null : label.payload(),
        lastError,
        failedStage,
        createdAt,
        updatedAt);
  }
}
