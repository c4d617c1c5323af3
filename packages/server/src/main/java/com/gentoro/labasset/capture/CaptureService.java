package com.gentoro.labasset.capture;

import com.gentoro.labasset.config.ConfigSnapshot;
import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.exception.CaptureException;
import com.gentoro.labasset.exception.ErrorDetails;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.ExceptionUtil;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.utility.FileUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;

/**
 * Serialized access to capture devices.
 *
 * <p>At most one capture runs per device id; callers for the same device wait for the lock up to
 * their timeout, callers for different devices proceed independently. The device read runs on a
 * dedicated thread bounded by the same deadline. The image is written under {@code
 * storage.imagesDir} before the artifact is registered.
 */
public class CaptureService {
  private static final Logger log = LoggingService.getLogger(CaptureService.class);
  private static final DateTimeFormatter ID_TIME =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

  private final ConfigStore config;
  private final CaptureDeviceFactory deviceFactory;
  private final ArtifactRegistry registry;
  private final Map<String, ReentrantLock> deviceLocks = new ConcurrentHashMap<>();
  private final Map<String, CaptureDevice> extraDevices = new ConcurrentHashMap<>();
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
  // artifacts whose image the caller supplied; their files are never deleted
  private final Set<String> supplied = ConcurrentHashMap.newKeySet();
  private volatile ErrorDetails lastError;

  public CaptureService(
      ConfigStore config, CaptureDeviceFactory deviceFactory, ArtifactRegistry registry) {
    this.config = config;
    this.deviceFactory = deviceFactory;
    this.registry = registry;
  }

  /** Make an additional device available next to the configured one. */
  public void registerDevice(CaptureDevice device) {
    extraDevices.put(device.id(), device);
  }

  /** Capture with the configured device, resolution and timeout. */
  public CaptureArtifact capture() {
    ConfigSnapshot snapshot = config.snapshot();
    return capture(
        snapshot.getString("capture.deviceId"),
        Resolution.parse(snapshot.getString("capture.resolution", "1280x720")),
        Duration.ofSeconds(snapshot.getInt("capture.timeoutSeconds", 10)));
  }

  /**
   * Capture one image.
   *
   * @throws CaptureException {@code DEVICE_UNAVAILABLE} when the device is missing or stays busy
   *     past {@code timeout}, {@code CAPTURE_TIMEOUT} when the read misses the deadline, {@code
   *     STORAGE_ERROR} when the image cannot be written, {@code PARTIAL_CAPTURE} when the image was
   *     written but could not be registered
   */
  public CaptureArtifact capture(String deviceId, Resolution resolution, Duration timeout) {
    if (deviceId == null || deviceId.isBlank()) {
      throw new InvalidInputException("deviceId is required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new InvalidInputException("timeout must be positive");
    }
    ConfigSnapshot snapshot = config.snapshot();
    long deadline = System.nanoTime() + timeout.toNanos();
    try {
      CaptureDevice device = resolveDevice(deviceId, snapshot);
      if (!device.isPresent()) {
        throw new CaptureException(
            ErrorKind.DEVICE_UNAVAILABLE, "Capture device '" + deviceId + "' is not present");
      }
      ReentrantLock lock = deviceLocks.computeIfAbsent(deviceId, k -> new ReentrantLock());
      if (!lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
        throw new CaptureException(
            ErrorKind.DEVICE_UNAVAILABLE,
            "Capture device '%s' stayed busy for %d ms".formatted(deviceId, timeout.toMillis()));
      }
      try {
        inFlight.add(deviceId);
        CapturedFrame frame = grab(device, resolution, deadline);
        CaptureArtifact artifact = persist(deviceId, resolution, frame, snapshot);
        lastError = null;
        return artifact;
      } finally {
        inFlight.remove(deviceId);
        lock.unlock();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw record(
          new CaptureException(ErrorKind.DEVICE_UNAVAILABLE, "Capture interrupted", e));
    } catch (LabAssetException e) {
      throw record(e);
    }
  }

  /** Register an image that already exists on disk, e.g. one supplied by path to analysis. */
  public CaptureArtifact registerExisting(Path imagePath, String deviceId) {
    if (imagePath == null || !Files.isRegularFile(imagePath)) {
      throw new InvalidInputException("Image file not found: " + imagePath);
    }
    String ext = DirectoryCaptureDevice.extension(imagePath);
    String mediaType = DirectoryCaptureDevice.MEDIA_TYPES.get(ext);
    if (mediaType == null) {
      throw new InvalidInputException("Unsupported image type: " + imagePath.getFileName());
    }
    CaptureArtifact artifact =
        new CaptureArtifact(
            newId(Instant.now()),
            deviceId == null ? "external" : deviceId,
            imagePath.toAbsolutePath(),
            null,
            mediaType,
            Instant.now());
    registry.register(artifact);
    supplied.add(artifact.id());
    return artifact;
  }

  public Optional<CaptureArtifact> find(String artifactId) {
    return registry.find(artifactId);
  }

  /**
   * Forget an artifact whose job is terminal. The image file is deleted only when this service
   * captured it into the images directory and {@code storage.retainImages} is off.
   */
  public void release(String artifactId) {
    Optional<CaptureArtifact> removed = registry.remove(artifactId);
    boolean external = supplied.remove(artifactId);
    if (removed.isEmpty() || external) return;
    ConfigSnapshot snapshot = config.snapshot();
    if (snapshot.getBoolean("storage.retainImages", true)) return;
    Path imagesDir = imagesDir(snapshot);
    Path image = removed.get().imagePath();
    if (!image.toAbsolutePath().normalize().startsWith(imagesDir)) return;
    try {
      Files.deleteIfExists(image);
      log.debug("Deleted image {} of artifact {}", image, artifactId);
    } catch (IOException e) {
      log.warn("Could not delete image {} of artifact {}", image, artifactId, e);
    }
  }

  public CaptureStatus status() {
    ConfigSnapshot snapshot = config.snapshot();
    String deviceId = snapshot.getString("capture.deviceId");
    boolean present;
    try {
      present = resolveDevice(deviceId, snapshot).isPresent();
    } catch (LabAssetException e) {
      present = false;
    }
    return new CaptureStatus(
        deviceId,
        present,
        inFlight.contains(deviceId),
        snapshot.getString("capture.resolution"),
        registry.list().size(),
        lastError);
  }

  private CaptureDevice resolveDevice(String deviceId, ConfigSnapshot snapshot) {
    CaptureDevice extra = extraDevices.get(deviceId);
    if (extra != null) return extra;
    if (deviceId.equals(snapshot.getString("capture.deviceId"))) {
      return deviceFactory.create(deviceId, snapshot);
    }
    throw new CaptureException(
        ErrorKind.DEVICE_UNAVAILABLE, "Unknown capture device '" + deviceId + "'");
  }

  private CapturedFrame grab(CaptureDevice device, Resolution resolution, long deadline)
      throws InterruptedException {
    ExecutorService executor = null;
    try {
      executor =
          Executors.newSingleThreadExecutor(
              r -> {
                Thread t = new Thread(r, "capture-" + device.id());
                t.setDaemon(true);
                return t;
              });
      Future<CapturedFrame> future = executor.submit(() -> device.grab(resolution));
      long remaining = Math.max(0, deadline - System.nanoTime());
      try {
        CapturedFrame frame = future.get(remaining, TimeUnit.NANOSECONDS);
        if (frame == null || frame.data() == null || frame.data().length == 0) {
          throw new CaptureException(
              ErrorKind.DEVICE_UNAVAILABLE, "Device '" + device.id() + "' returned no image");
        }
        return frame;
      } catch (TimeoutException e) {
        future.cancel(true);
        throw new CaptureException(
            ErrorKind.CAPTURE_TIMEOUT, "No image from device '" + device.id() + "' in time", e);
      } catch (ExecutionException e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e.getCause(),
            ex ->
                new CaptureException(
                    ErrorKind.DEVICE_UNAVAILABLE,
                    "Device '" + device.id() + "' failed: " + ex.getMessage(),
                    ex));
      }
    } finally {
      if (executor != null) {
        executor.shutdownNow();
      }
    }
  }

  private CaptureArtifact persist(
      String deviceId, Resolution resolution, CapturedFrame frame, ConfigSnapshot snapshot) {
    Instant capturedAt = Instant.now();
    String id = newId(capturedAt);
    String ext =
        frame.extension() == null || frame.extension().isBlank() ? "jpg" : frame.extension();
    Path imagesDir = imagesDir(snapshot);
    Path target = imagesDir.resolve(id + "." + ext);
    try {
      FileUtility.writeAtomically(target, frame.data());
    } catch (IOException e) {
      throw new CaptureException(ErrorKind.STORAGE_ERROR, "Could not write image " + target, e);
    }

    String mediaType = frame.mediaType() == null ? "image/jpeg" : frame.mediaType();
    CaptureArtifact artifact =
        new CaptureArtifact(id, deviceId, target, resolution, mediaType, capturedAt);
    try {
      registry.register(artifact);
    } catch (RuntimeException e) {
      throw new CaptureException(
              ErrorKind.PARTIAL_CAPTURE, "Image " + target + " written but not registered", e)
          .withContext("imagePath", target.toString());
    }
    log.info("Captured {} from {} into {}", id, deviceId, target);
    return artifact;
  }

  private LabAssetException record(LabAssetException e) {
    lastError = ExceptionUtil.toErrorDetails(e);
    log.warn("Capture failed: [{}] {}", e.getKind(), e.getMessage());
    return e;
  }

  private static Path imagesDir(ConfigSnapshot snapshot) {
    return Path.of(snapshot.getString("storage.imagesDir", "images")).toAbsolutePath().normalize();
  }

  private static String newId(Instant at) {
    return "img-" + ID_TIME.format(at) + "-" + UUID.randomUUID().toString().substring(0, 8);
  }
}
