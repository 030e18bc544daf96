package com.gentoro.mcpindex.utility;

import com.gentoro.mcpindex.exception.IoException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class FileUtility {

  /**
   * Write {@code content} next to {@code target} and move it over the target, atomically where the
   * file system allows it. Concurrent writers converge on whichever move lands last.
   */
  public static void writeAtomically(Path target, byte[] content) {
    try {
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
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
    } catch (IOException e) {
      throw new IoException("Failed to write file: " + target, e);
    }
  }
}
