package com.gentoro.labasset.pipeline;

import java.util.List;
import java.util.Optional;

/** Storage of job snapshots. Every state change of a job is written before the next stage. */
public interface JobStore {
  void put(JobView job);

  Optional<JobView> get(String jobId);

  /** All jobs, oldest first. */
  List<JobView> list();
}
