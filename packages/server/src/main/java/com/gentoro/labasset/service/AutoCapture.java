package com.gentoro.labasset.service;

import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;

/**
 * Background loop enabled by {@code capture.autoStart}: every image the configured device delivers
 * is captured and submitted to the pipeline.
 */
public class AutoCapture implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(AutoCapture.class);
  static final long ERROR_BACKOFF_MS = 1000;

  private final AssetService service;
  private final AtomicBoolean running = new AtomicBoolean();
  private Thread thread;

  public AutoCapture(AssetService service) {
    this.service = service;
  }

  public synchronized void start() {
    if (!running.compareAndSet(false, true)) return;
    thread = new Thread(this::loop, "auto-capture");
    thread.setDaemon(true);
    thread.start();
    log.info("Automatic capture started");
  }

  public boolean isRunning() {
    return running.get();
  }

  private void loop() {
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      try {
        service.triggerCapture();
      } catch (LabAssetException e) {
        if (e.getKind() == ErrorKind.CAPTURE_TIMEOUT) {
          // nothing arrived within the capture timeout
          continue;
        }
        log.warn("Automatic capture failed: [{}] {}", e.getKind(), e.getMessage());
        try {
          Thread.sleep(ERROR_BACKOFF_MS);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
        }
      }
    }
    running.set(false);
  }

  @Override
  public synchronized void close() {
    running.set(false);
    if (thread != null) {
      thread.interrupt();
      thread = null;
    }
  }
}
