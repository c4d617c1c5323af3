package com.gentoro.labasset.capture;

import com.gentoro.labasset.logging.LoggingService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;

/**
 * Device backed by an inbox directory that tethering software drops photos into. A grab takes the
 * newest image, moves it to {@code consumed/} and returns its bytes; when the inbox is empty it
 * polls until a photo arrives or the thread is interrupted.
 */
public class DirectoryCaptureDevice implements CaptureDevice {
  private static final Logger log = LoggingService.getLogger(DirectoryCaptureDevice.class);

  static final Map<String, String> MEDIA_TYPES =
      Map.of(
          "jpg", "image/jpeg",
          "jpeg", "image/jpeg",
          "png", "image/png",
          "webp", "image/webp",
          "gif", "image/gif");

  private final String id;
  private final Path inbox;
  private final long pollIntervalMs;

  public DirectoryCaptureDevice(String id, Path inbox) {
    this(id, inbox, 100);
  }

  public DirectoryCaptureDevice(String id, Path inbox, long pollIntervalMs) {
    this.id = id;
    this.inbox = inbox;
    this.pollIntervalMs = pollIntervalMs;
  }

  @Override
  public String id() {
    return id;
  }

  public Path inbox() {
    return inbox;
  }

  @Override
  public boolean isPresent() {
    return Files.isDirectory(inbox);
  }

  @Override
  public CapturedFrame grab(Resolution requested) throws IOException, InterruptedException {
    while (true) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("grab on " + id + " interrupted");
      }
      Optional<Path> newest = newestImage();
      if (newest.isPresent()) {
        Path source = newest.get();
        byte[] data = Files.readAllBytes(source);
        Path consumed = inbox.resolve("consumed");
        Files.createDirectories(consumed);
        Files.move(
            source, consumed.resolve(source.getFileName()), StandardCopyOption.REPLACE_EXISTING);
        String ext = extension(source);
        log.debug("Device {} took {} ({} bytes)", id, source.getFileName(), data.length);
        return new CapturedFrame(data, MEDIA_TYPES.get(ext), ext);
      }
      Thread.sleep(pollIntervalMs);
    }
  }

  private Optional<Path> newestImage() throws IOException {
    if (!Files.isDirectory(inbox)) {
      throw new IOException("Inbox " + inbox + " does not exist");
    }
    try (Stream<Path> files = Files.list(inbox)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> MEDIA_TYPES.containsKey(extension(p)))
          .max(Comparator.comparing(DirectoryCaptureDevice::modified));
    }
  }

  private static FileTime modified(Path p) {
    try {
      return Files.getLastModifiedTime(p);
    } catch (IOException e) {
      // removed between listing and stat
      return FileTime.fromMillis(0);
    }
  }

  static String extension(Path p) {
    String name = p.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
