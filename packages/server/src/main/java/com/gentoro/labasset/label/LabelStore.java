package com.gentoro.labasset.label;

import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.slf4j.Logger;

/** Label files in {@code storage.labelsDir}. Only plain {@code .png} names inside it resolve. */
public class LabelStore {
  private static final Logger log = LoggingService.getLogger(LabelStore.class);

  private final ConfigStore config;

  public LabelStore(ConfigStore config) {
    this.config = config;
  }

  public List<LabelFile> list() {
    Path dir = directory();
    if (!Files.isDirectory(dir)) return List.of();
    List<LabelFile> out = new ArrayList<>();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : (Iterable<Path>) files::iterator) {
        String name = file.getFileName().toString();
        if (!Files.isRegularFile(file) || !name.toLowerCase(Locale.ROOT).endsWith(".png")) {
          continue;
        }
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        out.add(new LabelFile(name, attrs.size(), attrs.lastModifiedTime().toInstant()));
      }
    } catch (IOException e) {
      throw new LabAssetException(ErrorKind.STORAGE_ERROR, "Could not list labels in " + dir, e);
    }
    out.sort(Comparator.comparing(LabelFile::fileName));
    return out;
  }

  /** Path of an existing label file. */
  public Path open(String fileName) {
    Path file = resolve(fileName);
    if (!Files.isRegularFile(file)) {
      throw new LabAssetException(ErrorKind.NOT_FOUND, "Label " + fileName + " not found");
    }
    return file;
  }

  public void delete(String fileName) {
    Path file = open(fileName);
    try {
      Files.delete(file);
    } catch (IOException e) {
      throw new LabAssetException(ErrorKind.STORAGE_ERROR, "Could not delete label " + file, e);
    }
    log.info("Deleted label {}", file);
  }

  Path resolve(String fileName) {
    if (fileName == null
        || fileName.isBlank()
        || fileName.contains("/")
        || fileName.contains("\\")
        || fileName.contains("..")
        || !fileName.toLowerCase(Locale.ROOT).endsWith(".png")) {
      throw new InvalidInputException("Invalid label file name: " + fileName);
    }
    Path dir = directory();
    Path file = dir.resolve(fileName).normalize();
    if (!dir.equals(file.getParent())) {
      throw new InvalidInputException("Invalid label file name: " + fileName);
    }
    return file;
  }

  private Path directory() {
    return Path.of(config.snapshot().getString("storage.labelsDir", "labels"))
        .toAbsolutePath()
        .normalize();
  }
}
