package com.gentoro.labasset.events;

import com.gentoro.labasset.exception.ErrorDetails;
import java.time.Instant;

/**
 * State change of a pipeline job.
 *
 * @param type what happened
 * @param status job status after the change
 * @param stage stage the job is in, or {@code null} before analysis started
 * @param attempt attempt number within the stage, 0 when not applicable
 * @param error populated for {@link Type#RETRYING} and {@link Type#FAILED}
 */
public record JobEvent(
    Type type,
    String jobId,
    String captureArtifactId,
    String status,
    String stage,
    int attempt,
    ErrorDetails error,
    Instant timestamp)
    implements BusEvent {

  public enum Type {
    CREATED,
    TRANSITIONED,
    RETRYING,
    COMPLETED,
    FAILED
  }

  @Override
  public String key() {
    return jobId;
  }
}
