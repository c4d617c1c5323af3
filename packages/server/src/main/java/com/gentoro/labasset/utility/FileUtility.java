package com.gentoro.labasset.utility;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** File helpers shared by the components that persist state. */
public final class FileUtility {
  private FileUtility() {}

  /**
   * Replace {@code target} with {@code content} so that readers observe either the old or the new
   * file, never a partial one: the bytes go to a temporary file in the same directory, which is
   * then moved over the target.
   */
  public static void writeAtomically(Path target, byte[] content) throws IOException {
    Path dir = target.toAbsolutePath().getParent();
    Files.createDirectories(dir);
    Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
    try {
      Files.write(tmp, content);
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  /** Keep letters, digits, dash and underscore; collapse everything else to one underscore. */
  public static String sanitizeFileName(String name, int maxLength) {
    if (name == null) return "";
    String cleaned = name.trim().replaceAll("[^A-Za-z0-9_-]+", "_").replaceAll("^_+|_+$", "");
    return cleaned.length() <= maxLength ? cleaned : cleaned.substring(0, maxLength);
  }
}
