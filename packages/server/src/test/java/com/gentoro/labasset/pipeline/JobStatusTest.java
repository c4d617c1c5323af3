package com.gentoro.labasset.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class JobStatusTest {

  @Test
  void forwardStepsOnly() {
    assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.ANALYZING));
    assertTrue(JobStatus.REGISTERED.canTransitionTo(JobStatus.LABELING));
    assertTrue(JobStatus.LABELING.canTransitionTo(JobStatus.COMPLETED));
    assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.REGISTERING));
    assertFalse(JobStatus.ANALYZED.canTransitionTo(JobStatus.ANALYZING));
  }

  @Test
  void anyActiveStatusMayFail() {
    for (JobStatus status : JobStatus.values()) {
      assertEquals(!status.isTerminal(), status.canTransitionTo(JobStatus.FAILED), status.name());
    }
  }

  @Test
  void terminalStatusesAreFinal() {
    assertTrue(JobStatus.COMPLETED.isTerminal());
    assertTrue(JobStatus.FAILED.isTerminal());
    for (JobStatus next : JobStatus.values()) {
      assertFalse(JobStatus.COMPLETED.canTransitionTo(next));
      assertFalse(JobStatus.FAILED.canTransitionTo(next));
    }
  }
}
