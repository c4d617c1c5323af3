package com.gentoro.labasset;

import com.gentoro.labasset.exception.JobFailedException;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.pipeline.JobView;
import org.slf4j.Logger;

public class LabAssetApp {
  private static final Logger log = LoggingService.getLogger(LabAssetApp.class);

  public static void main(String[] args) {
    LabAsset app = null;
    try {
      app = new LabAsset(args);
      app.initialize();
      if (app.isServerMode()) {
        // Keep the server running until shutdown signal
        app.waitShutdownSignal();
        return;
      }
      JobView job = app.runOnce();
      log.info(
          "Job {} completed: record {}, label {}", job.jobId(), job.externalId(), job.labelFile());
      app.shutdown();
    } catch (JobFailedException e) {
      log.error("Ingestion failed: {}", e.getMessage());
      shutdown(app);
      System.exit(2);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      shutdown(app);
      System.exit(130);
    } catch (Exception e) {
      log.error("Application failed to start", e);
      shutdown(app);
      System.exit(1);
    }
  }

  private static void shutdown(LabAsset app) {
    if (app != null) app.shutdown();
  }
}
