package com.gentoro.labasset.exception;

/** A non-terminal job already exists for the capture artifact. */
public class DuplicateJobException extends LabAssetException {
  private final String activeJobId;

  public DuplicateJobException(String captureArtifactId, String activeJobId) {
    super(
        ErrorKind.DUPLICATE_JOB,
        "Capture artifact '%s' is already being processed by job '%s'"
            .formatted(captureArtifactId, activeJobId));
    this.activeJobId = activeJobId;
    withContext("captureArtifactId", captureArtifactId);
    withContext("activeJobId", activeJobId);
  }

  public String getActiveJobId() {
    return activeJobId;
  }
}
