package com.gentoro.labasset.analysis;

import com.gentoro.labasset.exception.AnalysisException;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.ExceptionUtil;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;

/**
 * Base {@link VisionProvider} with the common call plumbing.
 *
 * <p>Each call runs on its own worker thread and is abandoned when {@code inference.timeoutSeconds}
 * elapses ({@link ErrorKind#PROVIDER_TIMEOUT}). Subclasses implement {@link #run(VisionRequest)}
 * against their SDK and translate SDK exceptions in {@link #classify(RuntimeException)}.
 */
public abstract class AbstractVisionProvider implements VisionProvider {
  private static final Logger log = LoggingService.getLogger(AbstractVisionProvider.class);

  protected final ProviderSettings settings;

  protected AbstractVisionProvider(ProviderSettings settings) {
    this.settings = settings;
  }

  @Override
  public ProviderId id() {
    return settings.providerId();
  }

  @Override
  public String complete(VisionRequest request) {
    if (id().isHosted() && !settings.credentialConfigured()) {
      throw new AnalysisException(
          ErrorKind.AUTH_ERROR, "No credential configured for provider '" + id().id() + "'");
    }
    long start = System.currentTimeMillis();
    ExecutorService executor = null;
    try {
      executor =
          Executors.newSingleThreadExecutor(
              r -> {
                Thread t = new Thread(r, "inference-" + id().id());
                t.setDaemon(true);
                return t;
              });
      Future<String> future = executor.submit(() -> run(request));
      try {
        return future.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        future.cancel(true);
        throw new AnalysisException(
            ErrorKind.PROVIDER_TIMEOUT,
            "Inference with %s timed out after %d seconds"
                .formatted(id().id(), settings.timeout().toSeconds()),
            e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof LabAssetException lae) {
          throw lae;
        }
        if (cause instanceof RuntimeException re) {
          throw classify(re);
        }
        throw new AnalysisException(
            ErrorKind.PROVIDER_ERROR, "Inference with " + id().id() + " failed", cause);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AnalysisException(ErrorKind.CANCELLED, "Inference interrupted", e);
    } finally {
      if (executor != null) {
        executor.shutdownNow();
      }
      log.debug("{} inference took {} ms", id().id(), System.currentTimeMillis() - start);
    }
  }

  /** Execute the request with the provider SDK. Runs on a worker thread. */
  protected abstract String run(VisionRequest request) throws Exception;

  /** Translate a provider specific runtime exception. */
  protected AnalysisException classify(RuntimeException e) {
    return new AnalysisException(
        ErrorKind.PROVIDER_ERROR,
        id().id() + " request failed: " + ExceptionUtil.extractErrorMessage(e),
        e);
  }

  /**
   * Key handed to SDK client builders, which reject an empty one. {@link #complete} refuses to call
   * a hosted provider without a configured credential, so the placeholder never reaches the wire.
   */
  protected static String apiKey(ProviderSettings settings) {
    return settings.credentialConfigured() ? settings.credential() : "unset";
  }

  /** Map an HTTP status returned by a provider to an error kind. */
  protected static ErrorKind kindForStatus(int status) {
    if (status == 401 || status == 403) return ErrorKind.AUTH_ERROR;
    if (status == 429) return ErrorKind.RATE_LIMITED;
    if (status == 408 || status == 504) return ErrorKind.PROVIDER_TIMEOUT;
    if (status >= 500) return ErrorKind.TRANSIENT_NETWORK_ERROR;
    return ErrorKind.PROVIDER_ERROR;
  }
}
