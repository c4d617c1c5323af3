package com.gentoro.labasset.exception;

/** A job ended in the failed state. Reports the stage that failed and the underlying error. */
public class JobFailedException extends LabAssetException {
  private final String stage;

  public JobFailedException(String jobId, String stage, ErrorDetails cause) {
    super(
        ErrorKind.JOB_FAILED,
        "Job '%s' failed during %s: [%s] %s"
            .formatted(jobId, stage, cause.errorKind(), cause.message()));
    this.stage = stage;
    withContext("jobId", jobId);
    withContext("stage", stage);
    withContext("causeKind", cause.errorKind());
  }

  public String getStage() {
    return stage;
  }
}
