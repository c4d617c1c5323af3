package com.gentoro.labasset.pipeline;

import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.utility.FileUtility;
import com.gentoro.labasset.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.slf4j.Logger;

/**
 * JobStore keeping one JSON file per job ({@code <dir>/<jobId>.json}). Existing files are loaded
 * on construction, so jobs survive a restart.
 */
public final class FileJobStore implements JobStore {
  private static final Logger log = LoggingService.getLogger(FileJobStore.class);

  private final Path dir;
  private final Map<String, JobView> cache = new ConcurrentHashMap<>();

  public FileJobStore(Path dir) {
    this.dir = dir;
    load();
  }

  @Override
  public synchronized void put(JobView job) {
    try {
      FileUtility.writeAtomically(
          fileOf(job.jobId()), JacksonUtility.getJsonMapper().writeValueAsBytes(job));
    } catch (IOException e) {
      String message = "Could not persist job " + job.jobId();
      throw new LabAssetException(ErrorKind.STORAGE_ERROR, message, e)
          .withContext("dir", dir.toString());
    }
    cache.put(job.jobId(), job);
  }

  @Override
  public Optional<JobView> get(String jobId) {
    return Optional.ofNullable(cache.get(jobId));
  }

  @Override
  public List<JobView> list() {
    return cache.values().stream().sorted(Comparator.comparing(JobView::createdAt)).toList();
  }

  private Path fileOf(String jobId) {
    return dir.resolve(jobId + ".json");
  }

  private void load() {
    if (!Files.isDirectory(dir)) return;
    try (Stream<Path> files = Files.list(dir)) {
      files
          .filter(f -> f.getFileName().toString().endsWith(".json"))
          .forEach(
              f -> {
                try {
                  JobView job = JacksonUtility.getJsonMapper().readValue(f.toFile(), JobView.class);
                  cache.put(job.jobId(), job);
                } catch (IOException e) {
                  log.warn("Skipping unreadable job file {}: {}", f, e.getMessage());
                }
              });
    } catch (IOException e) {
      throw new LabAssetException(ErrorKind.STORAGE_ERROR, "Could not read jobs from " + dir, e);
    }
    log.info("Loaded {} job(s) from {}", cache.size(), dir);
  }
}
