package com.gentoro.labasset.pipeline;

import com.gentoro.labasset.exception.ErrorDetails;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable snapshot of a job, as persisted by a {@link JobStore} and returned to callers.
 *
 * @param stage the stage that ran last, {@code null} before analysis started
 * @param attempt attempt number within {@code stage}
 * @param attempts attempts made by every stage that has run, in stage order
 * @param failedStage stage during which the job failed, {@code null} unless {@code FAILED}
 */
public record JobView(
    String jobId,
    String captureArtifactId,
    JobStatus status,
    Stage stage,
    int attempt,
    Map<Stage, Integer> attempts,
    String title,
    String assetType,
    Double confidence,
    Map<String, Object> attributes,
    String externalId,
    Long recordVersion,
    String labelFile,
    String labelPayload,
    ErrorDetails lastError,
    Stage failedStage,
    Instant createdAt,
    Instant updatedAt) {

  public JobView {
    attempts =
        attempts == null || attempts.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(attempts));
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
