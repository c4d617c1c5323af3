package com.gentoro.labasset.pipeline;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Simple in-memory JobStore implementation. */
public final class InMemoryJobStore implements JobStore {
  private final Map<String, JobView> map = new ConcurrentHashMap<>();

  @Override
  public void put(JobView job) {
    map.put(job.jobId(), job);
  }

  @Override
  public Optional<JobView> get(String jobId) {
    return Optional.ofNullable(map.get(jobId));
  }

  @Override
  public List<JobView> list() {
    return map.values().stream().sorted(Comparator.comparing(JobView::createdAt)).toList();
  }
}
