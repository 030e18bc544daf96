package com.gentoro.mcpindex.cache;

import com.gentoro.mcpindex.catalog.EmbeddingMatrix;
import com.gentoro.mcpindex.utility.FileUtility;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Embedding matrices keyed by catalog content hash. Only the newest {@code keep} files survive a
 * write.
 */
public class EmbeddingCache {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(EmbeddingCache.class);

  private static final String PREFIX = "embeddings_";
  private static final String SUFFIX = ".npy";

  private final Path dir;
  private final int keep;

  public EmbeddingCache(Path embeddingsDir, int keep) {
    if (keep < 1) {
      throw new IllegalArgumentException("keep must be >= 1: " + keep);
    }
    this.dir = embeddingsDir;
    this.keep = keep;
  }

  public Path pathFor(String contentHash) {
    return dir.resolve(PREFIX + contentHash + SUFFIX);
  }

  /**
   * Matrix for {@code contentHash}, provided it has exactly {@code expectedRows} rows. A file with
   * another row count, or one that fails to decode, is deleted.
   */
  public Optional<EmbeddingMatrix> load(String contentHash, int expectedRows) {
    Path file = pathFor(contentHash);
    if (!Files.isRegularFile(file)) {
      log.debug("No cached embeddings for hash {}", contentHash);
      return Optional.empty();
    }
    try {
      EmbeddingMatrix matrix = EmbeddingMatrix.of(NpyCodec.readNpy(Files.readAllBytes(file)));
      if (matrix.rowCount() != expectedRows) {
        log.warn(
            "Cached embeddings {} have {} rows, catalog has {}; discarding",
            file.getFileName(),
            matrix.rowCount(),
            expectedRows);
        deleteQuietly(file);
        return Optional.empty();
      }
      log.debug(
          "Loaded cached embeddings {} {}x{}",
          file.getFileName(),
          matrix.rowCount(),
          matrix.dimension());
      return Optional.of(matrix);
    } catch (IOException | RuntimeException e) {
      log.warn("Discarding corrupt embedding cache {}: {}", file, e.getMessage());
      deleteQuietly(file);
      return Optional.empty();
    }
  }

  public void save(String contentHash, EmbeddingMatrix matrix) {
    Path file = pathFor(contentHash);
    FileUtility.writeAtomically(file, NpyCodec.writeNpy(matrix));
    log.debug("Saved embeddings {}x{} to {}", matrix.rowCount(), matrix.dimension(), file);
    cleanup();
  }

  /** Remove all but the newest {@code keep} cache files. Returns how many were removed. */
  public int cleanup() {
    List<Path> files = listFiles();
    if (files.size() <= keep) {
      return 0;
    }
    files.sort(Comparator.comparing(EmbeddingCache::modified).reversed());
    int removed = 0;
    for (Path stale : files.subList(keep, files.size())) {
      if (deleteQuietly(stale)) {
        removed++;
      }
    }
    log.debug("Removed {} old embedding cache files", removed);
    return removed;
  }

  public Map<String, Object> info() {
    List<Path> files = listFiles();
    long total = 0;
    for (Path f : files) {
      try {
        total += Files.size(f);
      } catch (IOException e) {
        log.debug("Cannot stat {}: {}", f, e.getMessage());
      }
    }
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("path", dir.toString());
    info.put("files", files.size());
    info.put("sizeBytes", total);
    info.put("keep", keep);
    return info;
  }

  public void clear() {
    listFiles().forEach(EmbeddingCache::deleteQuietly);
  }

  private List<Path> listFiles() {
    List<Path> files = new ArrayList<>();
    if (!Files.isDirectory(dir)) {
      return files;
    }
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, PREFIX + "*" + SUFFIX)) {
      stream.forEach(files::add);
    } catch (IOException e) {
      log.warn("Cannot list embedding cache {}: {}", dir, e.getMessage());
    }
    return files;
  }

  private static FileTime modified(Path file) {
    try {
      return Files.getLastModifiedTime(file);
    } catch (IOException e) {
      return FileTime.fromMillis(0);
    }
  }

  private static boolean deleteQuietly(Path file) {
    try {
      return Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Failed to delete {}: {}", file, e.getMessage());
      return false;
    }
  }
}
