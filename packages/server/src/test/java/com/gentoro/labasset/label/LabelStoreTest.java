package com.gentoro.labasset.label;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.labasset.ConfigFixture;
import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.LabAssetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LabelStoreTest {

  @TempDir Path tempDir;

  private LabelStore store;
  private Path labels;

  @BeforeEach
  void setUp() throws Exception {
    ConfigStore config = ConfigFixture.store(tempDir);
    store = new LabelStore(config);
    labels = tempDir.resolve("labels");
  }

  @Test
  void emptyWhenDirectoryMissing() {
    assertTrue(store.list().isEmpty());
  }

  @Test
  void listsOnlyPngFilesSorted() throws Exception {
    Files.createDirectories(labels);
    Files.write(labels.resolve("b_2.png"), new byte[] {1, 2});
    Files.write(labels.resolve("a_1.png"), new byte[] {1});
    Files.writeString(labels.resolve("notes.txt"), "x");

    List<LabelFile> files = store.list();

    assertEquals(List.of("a_1.png", "b_2.png"), files.stream().map(LabelFile::fileName).toList());
    assertEquals(2, files.get(1).sizeBytes());
  }

  @Test
  void openAndDelete() throws Exception {
    Files.createDirectories(labels);
    Files.write(labels.resolve("a_1.png"), new byte[] {1});

    assertEquals(labels.resolve("a_1.png").toAbsolutePath(), store.open("a_1.png"));
    store.delete("a_1.png");

    assertFalse(Files.exists(labels.resolve("a_1.png")));
    LabAssetException ex = assertThrows(LabAssetException.class, () -> store.open("a_1.png"));
    assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
  }

  @Test
  void traversalAndForeignNamesAreRejected() throws Exception {
    Files.createDirectories(labels);
    Files.writeString(tempDir.resolve("secret.png"), "x");

    for (String name :
        new String[] {"../secret.png", "..png", "sub/a.png", "a\\b.png", "a.txt", " ", null}) {
      assertThrows(InvalidInputException.class, () -> store.open(name), String.valueOf(name));
    }
  }
}
