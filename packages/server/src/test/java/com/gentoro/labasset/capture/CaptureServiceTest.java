package com.gentoro.labasset.capture;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.labasset.ConfigFixture;
import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.exception.CaptureException;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.InvalidInputException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CaptureServiceTest {

  @TempDir Path tempDir;

  private ConfigStore config;
  private ArtifactRegistry registry;
  private CaptureService service;
  private Path inbox;
  private ExecutorService executor;

  @BeforeEach
  void setUp() throws Exception {
    config = ConfigFixture.store(tempDir);
    registry = new ArtifactRegistry();
    service = new CaptureService(config, CaptureDeviceFactory.directory(), registry);
    inbox = tempDir.resolve("inbox");
    Files.createDirectories(inbox);
    executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void captureMovesInboxImageIntoImagesDir() throws Exception {
    Files.write(inbox.resolve("photo.jpg"), new byte[] {1, 2, 3});

    CaptureArtifact artifact = service.capture();

    assertTrue(artifact.id().startsWith("img-"));
    assertEquals("camera-0", artifact.deviceId());
    assertEquals("image/jpeg", artifact.mediaType());
    assertEquals(new Resolution(1280, 720), artifact.resolution());
    assertTrue(artifact.imagePath().startsWith(tempDir.resolve("images")));
    assertArrayEquals(new byte[] {1, 2, 3}, Files.readAllBytes(artifact.imagePath()));
    assertFalse(Files.exists(inbox.resolve("photo.jpg")));
    assertTrue(Files.exists(inbox.resolve("consumed").resolve("photo.jpg")));
    assertSame(artifact, service.find(artifact.id()).orElseThrow());
  }

  @Test
  void emptyInboxTimesOut() {
    CaptureException ex =
        assertThrows(
            CaptureException.class,
            () -> service.capture("camera-0", new Resolution(640, 480), Duration.ofMillis(300)));

    assertEquals(ErrorKind.CAPTURE_TIMEOUT, ex.getKind());
    assertNotNull(service.status().lastError());
    assertEquals("CAPTURE_TIMEOUT", service.status().lastError().errorKind());
  }

  @Test
  void missingInboxMeansDeviceUnavailable() throws Exception {
    config.set("capture.inboxDir", tempDir.resolve("nowhere").toString());

    CaptureException ex = assertThrows(CaptureException.class, () -> service.capture());

    assertEquals(ErrorKind.DEVICE_UNAVAILABLE, ex.getKind());
    assertFalse(service.status().present());
  }

  @Test
  void unknownDeviceIsUnavailable() {
    CaptureException ex =
        assertThrows(
            CaptureException.class,
            () -> service.capture("camera-9", new Resolution(640, 480), Duration.ofSeconds(1)));

    assertEquals(ErrorKind.DEVICE_UNAVAILABLE, ex.getKind());
  }

  @Test
  void invalidArgumentsAreRejected() {
    assertThrows(
        InvalidInputException.class,
        () -> service.capture(" ", new Resolution(640, 480), Duration.ofSeconds(1)));
    assertThrows(
        InvalidInputException.class,
        () -> service.capture("camera-0", new Resolution(640, 480), Duration.ZERO));
    assertThrows(InvalidInputException.class, () -> Resolution.parse("1280by720"));
  }

  @Test
  void busyDeviceReportsUnavailableAfterTimeout() throws Exception {
    CountDownLatch grabbing = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    service.registerDevice(
        new CaptureDevice() {
          @Override
          public String id() {
            return "slow";
          }

          @Override
          public boolean isPresent() {
            return true;
          }

          @Override
          public CapturedFrame grab(Resolution requested) throws InterruptedException {
            grabbing.countDown();
            release.await();
            return new CapturedFrame(new byte[] {9}, "image/png", "png");
          }
        });

    Future<CaptureArtifact> first =
        executor.submit(
            () -> service.capture("slow", new Resolution(10, 10), Duration.ofSeconds(10)));
    assertTrue(grabbing.await(5, TimeUnit.SECONDS));

    CaptureException ex =
        assertThrows(
            CaptureException.class,
            () -> service.capture("slow", new Resolution(10, 10), Duration.ofMillis(200)));
    assertEquals(ErrorKind.DEVICE_UNAVAILABLE, ex.getKind());

    release.countDown();
    CaptureArtifact artifact = first.get(5, TimeUnit.SECONDS);
    assertEquals("image/png", artifact.mediaType());
    assertTrue(artifact.imagePath().toString().endsWith(".png"));
  }

  @Test
  void releaseDeletesImageUnlessRetained() throws Exception {
    config.set("storage.retainImages", false);
    Files.write(inbox.resolve("a.png"), new byte[] {4});
    CaptureArtifact artifact = service.capture();

    service.release(artifact.id());

    assertTrue(service.find(artifact.id()).isEmpty());
    assertFalse(Files.exists(artifact.imagePath()));
  }

  @Test
  void releaseKeepsExternalImages() throws Exception {
    config.set("storage.retainImages", false);
    Path external = tempDir.resolve("external.jpg");
    Files.write(external, new byte[] {5});
    CaptureArtifact artifact = service.registerExisting(external, null);

    service.release(artifact.id());

    assertEquals("external", artifact.deviceId());
    assertTrue(Files.exists(external));
  }

  @Test
  void releaseKeepsSuppliedImagesInsideImagesDir() throws Exception {
    config.set("storage.retainImages", false);
    Path images = tempDir.resolve("images");
    Files.createDirectories(images);
    Path supplied = images.resolve("bench-photo.jpg");
    Files.write(supplied, new byte[] {6});
    CaptureArtifact artifact = service.registerExisting(supplied, null);

    service.release(artifact.id());

    assertTrue(service.find(artifact.id()).isEmpty());
    assertTrue(Files.exists(supplied));
  }

  @Test
  void registrationFailureAfterWriteIsPartialCapture() throws Exception {
    ArtifactRegistry failing =
        new ArtifactRegistry() {
          @Override
          public void register(CaptureArtifact artifact) {
            throw new IllegalStateException("registry unavailable");
          }
        };
    CaptureService partial =
        new CaptureService(config, CaptureDeviceFactory.directory(), failing);
    Files.write(inbox.resolve("photo.jpg"), new byte[] {7, 8});

    CaptureException ex = assertThrows(CaptureException.class, partial::capture);

    assertEquals(ErrorKind.PARTIAL_CAPTURE, ex.getKind());
    Path written = Path.of(String.valueOf(ex.getContext().get("imagePath")));
    assertTrue(written.startsWith(tempDir.resolve("images")));
    assertArrayEquals(new byte[] {7, 8}, Files.readAllBytes(written));
    assertInstanceOf(IllegalStateException.class, ex.getCause());
    assertEquals("PARTIAL_CAPTURE", partial.status().lastError().errorKind());
    assertTrue(failing.list().isEmpty());
  }

  @Test
  void registerExistingRejectsUnsupportedFiles() throws Exception {
    Path text = tempDir.resolve("notes.txt");
    Files.writeString(text, "hello");

    assertThrows(InvalidInputException.class, () -> service.registerExisting(text, null));
    assertThrows(
        InvalidInputException.class,
        () -> service.registerExisting(tempDir.resolve("missing.jpg"), null));
  }
}
