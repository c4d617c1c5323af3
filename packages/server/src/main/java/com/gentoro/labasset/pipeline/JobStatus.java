package com.gentoro.labasset.pipeline;

/**
 * Lifecycle of a pipeline job. Statuses only move forward along the declared order; {@link
 * #FAILED} is reachable from every non-terminal status.
 */
public enum JobStatus {
  /** Accepted, waiting for a worker. */
  PENDING,
  ANALYZING,
  ANALYZED,
  REGISTERING,
  REGISTERED,
  LABELING,
  /** Record created and label written. */
  COMPLETED,
  /** Failed permanently or cancelled; see the job's last error. */
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public boolean canTransitionTo(JobStatus next) {
    if (isTerminal() || next == null) return false;
    if (next == FAILED) return true;
    return next.ordinal() == ordinal() + 1;
  }
}
