package com.gentoro.labasset.analysis;

import com.gentoro.labasset.capture.CaptureArtifact;
import com.gentoro.labasset.config.ConfigSnapshot;
import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.exception.AnalysisException;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.retry.Retrier;
import com.gentoro.labasset.retry.RetryPolicy;
import com.gentoro.labasset.retry.Sleeper;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;

/**
 * Turns a captured image into an {@link AnalysisResult} using the provider selected in {@code
 * inference.providerId}.
 *
 * <p>Transient provider failures are retried under {@code pipeline.retry.*}; running out of retries
 * fails with {@link ErrorKind#PROVIDER_ERROR}. Simultaneous calls per provider are capped at {@code
 * inference.maxConcurrent}, independently of the pipeline worker count.
 */
public class AnalysisEngine implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(AnalysisEngine.class);

  private final ConfigStore config;
  private final VisionProviderFactory providerFactory;
  private final Sleeper sleeper;
  private final Map<ProviderSettings, VisionProvider> providers = new ConcurrentHashMap<>();
  private final Map<ProviderId, Limit> limits = new ConcurrentHashMap<>();

  private record Limit(int permits, Semaphore semaphore) {}

  public AnalysisEngine(
      ConfigStore config, VisionProviderFactory providerFactory, Sleeper sleeper) {
    this.config = config;
    this.providerFactory = providerFactory;
    this.sleeper = sleeper;
  }

  /** Analyze with the current configuration. */
  public AnalysisResult analyze(CaptureArtifact artifact, String promptTemplate) {
    ConfigSnapshot snapshot = config.snapshot();
    return analyze(
        artifact,
        promptTemplate,
        ProviderSettings.from(snapshot),
        null,
        RetryPolicy.from(snapshot),
        () -> false,
        Retrier.Listener.NONE);
  }

  /**
   * @param promptTemplate additional user instruction; {@code null} uses {@code
   *     inference.promptTemplate}
   * @param templateFields record template describing the detail fields; {@code null} uses a
   *     generic field list
   * @param cancelled checked before each attempt and after each provider call; a result that
   *     arrives after cancellation is discarded
   */
  public AnalysisResult analyze(
      CaptureArtifact artifact,
      String promptTemplate,
      ProviderSettings settings,
      String templateFields,
      RetryPolicy retryPolicy,
      BooleanSupplier cancelled,
      Retrier.Listener listener) {
    if (artifact == null || artifact.imagePath() == null) {
      throw new InvalidInputException("An image artifact is required for analysis");
    }
    byte[] image;
    try {
      image = Files.readAllBytes(artifact.imagePath());
    } catch (IOException e) {
      throw new LabAssetException(
          ErrorKind.STORAGE_ERROR, "Cannot read image " + artifact.imagePath(), e);
    }
    String additional = promptTemplate == null ? settings.promptTemplate() : promptTemplate;
    VisionRequest request =
        new VisionRequest(
            PromptTemplate.systemPrompt(templateFields),
            PromptTemplate.userPrompt(additional, artifact, templateFields),
            image,
            artifact.mediaType() == null ? "image/jpeg" : artifact.mediaType());

    VisionProvider provider = providerFor(settings);
    Retrier retrier = new Retrier(retryPolicy, sleeper);
    String raw =
        retrier.call(
            "analysis of " + artifact.id() + " with " + settings.providerId().id(),
            () -> callLimited(provider, settings, request, cancelled),
            cancelled,
            listener,
            last ->
                new AnalysisException(
                    ErrorKind.PROVIDER_ERROR,
                    "Provider %s still failing after %d attempts: [%s] %s"
                        .formatted(
                            settings.providerId().id(),
                            retryPolicy.maxRetries() + 1,
                            last.getKind(),
                            last.getMessage()),
                    last));

    Map<String, Object> attributes =
        ResponseExtractor.extract(raw, settings.providerId().extractionRule());
    AnalysisResult result =
        new AnalysisResult(
            attributes,
            AnalysisResult.confidenceOf(attributes),
            raw,
            settings.providerId().id(),
            settings.effectiveModel(),
            Instant.now());
    log.info(
        "Analyzed {} with {} ({}): '{}' confidence {}",
        artifact.id(),
        result.providerId(),
        result.model(),
        result.title(),
        String.format("%.2f", result.confidence()));
    return result;
  }

  private String callLimited(
      VisionProvider provider,
      ProviderSettings settings,
      VisionRequest request,
      BooleanSupplier cancelled) {
    Semaphore semaphore = limitFor(settings);
    boolean acquired;
    try {
      acquired = semaphore.tryAcquire(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AnalysisException(ErrorKind.CANCELLED, "Interrupted waiting for provider slot", e);
    }
    if (!acquired) {
      throw new AnalysisException(
          ErrorKind.PROVIDER_TIMEOUT,
          "No free " + settings.providerId().id() + " slot within " + settings.timeout());
    }
    String raw;
    try {
      raw = provider.complete(request);
    } finally {
      semaphore.release();
    }
    if (cancelled.getAsBoolean()) {
      throw new AnalysisException(ErrorKind.CANCELLED, "Analysis result discarded after cancel");
    }
    return raw;
  }

  VisionProvider providerFor(ProviderSettings settings) {
    return providers.computeIfAbsent(
        settings,
        s -> {
          log.debug("Creating provider client for {}", s);
          return providerFactory.create(s);
        });
  }

  Semaphore limitFor(ProviderSettings settings) {
    return limits
        .compute(
            settings.providerId(),
            (id, existing) ->
                existing != null && existing.permits() == settings.maxConcurrent()
                    ? existing
                    : new Limit(settings.maxConcurrent(), new Semaphore(settings.maxConcurrent())))
        .semaphore();
  }

  /** Current provider settings, without the credential. */
  public Map<String, Object> settings() {
    return ProviderSettings.from(config.snapshot()).describe();
  }

  /** Update {@code inference.*} keys as one configuration version. */
  public Map<String, Object> updateSettings(Map<String, ?> changes) {
    config.setAll("inference", changes);
    return settings();
  }

  @Override
  public void close() {
    providers.values().forEach(VisionProvider::close);
    providers.clear();
  }
}
