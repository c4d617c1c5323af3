package com.gentoro.labasset;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import com.gentoro.labasset.analysis.AnalysisEngine;
import com.gentoro.labasset.analysis.VisionProviderFactory;
import com.gentoro.labasset.api.ApiServer;
import com.gentoro.labasset.capture.ArtifactRegistry;
import com.gentoro.labasset.capture.CaptureDeviceFactory;
import com.gentoro.labasset.capture.CaptureService;
import com.gentoro.labasset.config.ConfigSnapshot;
import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.events.ConfigChanged;
import com.gentoro.labasset.events.Envelope;
import com.gentoro.labasset.events.NotificationBus;
import com.gentoro.labasset.events.Subscription;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.StateException;
import com.gentoro.labasset.http.EmbeddedJettyServer;
import com.gentoro.labasset.label.LabelGenerator;
import com.gentoro.labasset.label.LabelStore;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.pipeline.FileJobStore;
import com.gentoro.labasset.pipeline.JobView;
import com.gentoro.labasset.pipeline.PipelineOrchestrator;
import com.gentoro.labasset.record.RecordClientFactory;
import com.gentoro.labasset.retry.Sleeper;
import com.gentoro.labasset.service.AssetService;
import com.gentoro.labasset.service.AutoCapture;
import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/** Wires the ingestion components together and owns their lifecycle. */
public class LabAsset {
  private static final org.slf4j.Logger log = LoggingService.getLogger(LabAsset.class);

  private final StartupParameters startupParameters;
  private final NotificationBus bus = new NotificationBus();
  private ConfigStore config;
  private CaptureService capture;
  private AnalysisEngine analysis;
  private RecordClientFactory records;
  private PipelineOrchestrator pipeline;
  private AssetService service;
  private EmbeddedJettyServer httpServer;
  private AutoCapture autoCapture;
  private Thread configWatcher;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public LabAsset(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.config = new ConfigStore(startupParameters.configFile(), bus);
    ConfigSnapshot snapshot = config.load();
    LoggingService.applyConfiguration(snapshot.configuration());
    configureFileLogging(snapshot.getString("logging.file"));
    watchLoggingConfiguration();

    this.capture =
        new CaptureService(config, CaptureDeviceFactory.directory(), new ArtifactRegistry());
    this.analysis = new AnalysisEngine(config, VisionProviderFactory.standard(), Sleeper.SYSTEM);
    this.records = new RecordClientFactory(config, Sleeper.SYSTEM);
    LabelGenerator labels = new LabelGenerator(config);
    Path jobsDir = Path.of(snapshot.getString("storage.dataDir", "data")).resolve("jobs");
    this.pipeline =
        new PipelineOrchestrator(
            config, new FileJobStore(jobsDir), bus, capture, analysis, records, labels);
    pipeline.recoverInterrupted();
    this.service =
        new AssetService(
            config, bus, capture, analysis, records, labels, new LabelStore(config), pipeline);

    switch (startupParameters.mode()) {
      case "server":
        startServer(snapshot);
        break;
      case "once":
        break;
      default:
        shutdown();
        throw new InvalidInputException("Invalid mode: " + startupParameters.mode());
    }
  }

  private void startServer(ConfigSnapshot snapshot) {
    this.httpServer = new EmbeddedJettyServer(config);
    httpServer.prepare();
    try {
      new ApiServer(service).register(httpServer);
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
    if (snapshot.getBoolean("capture.autoStart", false)) {
      this.autoCapture = new AutoCapture(service);
      autoCapture.start();
    }
  }

  /** Capture one image and run it through the pipeline; used by {@code --mode=once}. */
  public JobView runOnce() throws InterruptedException {
    ConfigSnapshot snapshot = config().snapshot();
    Duration timeout =
        Duration.ofSeconds(
            snapshot.getInt("capture.timeoutSeconds", 10)
                + 4L * snapshot.getInt("inference.timeoutSeconds", 120)
                + 4L * snapshot.getInt("recordSystem.timeoutSeconds", 20));
    return service.runOnce(timeout);
  }

  public boolean isServerMode() {
    return "server".equals(startupParameters.mode());
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM
   * termination), then release resources.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "labasset-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(autoCapture);
        closeQuietly(httpServer);
        closeQuietly(pipeline);
        closeQuietly(analysis);
        closeQuietly(records);
        if (configWatcher != null) configWatcher.interrupt();
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error while closing {}: {}", closeable.getClass().getSimpleName(), e.toString());
      }
    }
  }

  /** Re-apply log levels whenever the {@code logging} module changes. */
  private void watchLoggingConfiguration() {
    Subscription subscription = config.subscribe();
    configWatcher =
        new Thread(
            () -> {
              try (subscription) {
                while (!Thread.currentThread().isInterrupted()) {
                  Envelope envelope = subscription.poll(Duration.ofSeconds(1));
                  if (envelope != null
                      && envelope.event() instanceof ConfigChanged changed
                      && changed.paths().stream().anyMatch(p -> p.startsWith("logging."))) {
                    LoggingService.applyConfiguration(config.snapshot().configuration());
                  }
                }
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            },
            "config-watcher");
    configWatcher.setDaemon(true);
    configWatcher.start();
  }

  /** Add a rolling file appender next to the console one; the system-logs operation reads it. */
  private void configureFileLogging(String file) {
    if (file == null || file.isBlank()) return;
    if (!(org.slf4j.LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) return;
    ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    File logFile = new File(file).getAbsoluteFile();
    File logsDir = logFile.getParentFile();
    if (!logsDir.exists()) {
      // noinspection ResultOfMethodCallIgnored
      logsDir.mkdirs();
    }
    String baseName = logFile.getName().replaceFirst("\\.log$", "");

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(logFile.getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(
        new File(logsDir, baseName + ".%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();
    root.addAppender(fileAppender);
    log.info("File logging enabled at {}", logFile);
  }

  public ConfigStore config() {
    if (config == null) {
      throw new StateException("LabAsset not initialized. Call initialize() first.");
    }
    return config;
  }

  public NotificationBus bus() {
    return bus;
  }

  public AssetService service() {
    return service;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }
}
