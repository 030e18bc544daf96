package com.gentoro.mcpindex.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.exception.SerializationException;
import com.gentoro.mcpindex.schema.Compatibility;
import com.gentoro.mcpindex.schema.SchemaCompatibilityChecker;
import com.gentoro.mcpindex.schema.SchemaVersion;
import com.gentoro.mcpindex.utility.FileUtility;
import com.gentoro.mcpindex.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON file holding the last assembled catalog.
 *
 * <p>Reads never throw: an unreadable or structurally invalid file, or one written under a schema
 * version this build cannot consume, is deleted and reported as a miss. Writes replace the file
 * atomically, so concurrent writers leave one complete document.
 */
public class CatalogCache {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(CatalogCache.class);

  public static final String FILE_NAME = "server_list.json";
  public static final String FORMAT_VERSION = "multi-source-v1";

  private final Path file;
  private final Duration ttl;
  private final SchemaCompatibilityChecker checker;
  private final Clock clock;

  public CatalogCache(Path serversDir, Duration ttl) {
    this(serversDir, ttl, Clock.systemUTC());
  }

  public CatalogCache(Path serversDir, Duration ttl, Clock clock) {
    this(serversDir, ttl, SchemaCompatibilityChecker.fromVersions(List.of()), clock);
  }

  public CatalogCache(
      Path serversDir, Duration ttl, SchemaCompatibilityChecker checker, Clock clock) {
    this.file = serversDir.resolve(FILE_NAME);
    this.ttl = ttl;
    this.checker = checker;
    this.clock = clock;
  }

  public Path path() {
    return file;
  }

  public Duration ttl() {
    return ttl;
  }

  /**
   * Read the cached catalog.
   *
   * @param allowStale return the catalog even when it is older than the TTL
   * @return the catalog, or empty when absent, expired (and {@code allowStale} is false), corrupt
   *     or of an incompatible schema version
   */
  public Optional<CachedCatalog> load(boolean allowStale) {
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      JsonNode root = JacksonUtility.getJsonMapper().readTree(file.toFile());
      String schemaText = schemaVersionText(root);
      if (checker.check(schemaText) == Compatibility.INCOMPATIBLE) {
        log.warn("Discarding catalog cache {}: {}", file, checker.describe(schemaText));
        deleteQuietly();
        return Optional.empty();
      }
      Instant writtenAt = writtenAt(root);
      Duration age = ageOf(writtenAt);
      boolean stale = age.compareTo(ttl) > 0;
      if (stale && !allowStale) {
        log.debug("Catalog cache expired ({}s > {}s)", age.toSeconds(), ttl.toSeconds());
        return Optional.empty();
      }
      Catalog catalog = new Catalog(readEntries(root), writtenAt, SchemaVersion.parse(schemaText));
      if (stale) {
        log.warn("Using stale catalog cache ({}s old)", age.toSeconds());
      }
      String hash = root.hasNonNull("content_hash") ? root.get("content_hash").asText() : null;
      return Optional.of(new CachedCatalog(catalog, age, stale, hash));
    } catch (IOException | RuntimeException e) {
      log.warn("Discarding corrupt catalog cache {}: {}", file, e.getMessage());
      deleteQuietly();
      return Optional.empty();
    }
  }

  public void save(Catalog catalog, String contentHash) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("servers", catalog.entries());
    document.put("timestamp", clock.instant().toEpochMilli() / 1000.0);
    document.put("version", FORMAT_VERSION);
    document.put("schema_version", catalog.schemaVersion().toString());
    document.put("entry_count", catalog.entryCount());
    document.put("content_hash", contentHash);
    try {
      ObjectMapper mapper = JacksonUtility.getJsonMapper();
      FileUtility.writeAtomically(file, mapper.writeValueAsBytes(document));
      log.debug("Saved {} entries to catalog cache {}", catalog.entryCount(), file);
    } catch (IOException e) {
      throw new SerializationException("Failed to serialize catalog cache", e);
    }
  }

  /** Age and freshness come from the stored timestamp, as in {@link #load(boolean)}. */
  public CacheInfo info() {
    if (!Files.isRegularFile(file)) {
      return new CacheInfo(file, false, null, 0, false, ttl);
    }
    try {
      JsonNode root = JacksonUtility.getJsonMapper().readTree(file.toFile());
      Duration age = ageOf(writtenAt(root));
      return new CacheInfo(file, true, age, Files.size(file), age.compareTo(ttl) <= 0, ttl);
    } catch (IOException | RuntimeException e) {
      log.debug("Cannot read {}: {}", file, e.getMessage());
      return new CacheInfo(file, true, null, 0, false, ttl);
    }
  }

  public void clear() {
    deleteQuietly();
  }

  private Duration ageOf(Instant writtenAt) {
    Duration age = Duration.between(writtenAt, clock.instant());
    return age.isNegative() ? Duration.ZERO : age;
  }

  private Instant writtenAt(JsonNode root) throws IOException {
    JsonNode ts = root.get("timestamp");
    if (ts != null && ts.isNumber()) {
      return Instant.ofEpochMilli(Math.round(ts.asDouble() * 1000));
    }
    // legacy files carry no timestamp
    return Files.getLastModifiedTime(file).toInstant();
  }

  private static List<CatalogEntry> readEntries(JsonNode root) {
    JsonNode servers = root.get("servers");
    if (servers == null || !servers.isArray()) {
      throw new SerializationException("missing 'servers' array");
    }
    List<CatalogEntry> entries = new ArrayList<>(servers.size());
    for (JsonNode node : servers) {
      entries.add(toEntry(node));
    }
    return entries;
  }

  /** Convert one serialized entry; name and url are required, source defaults to unknown. */
  public static CatalogEntry toEntry(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new SerializationException("entry is not an object");
    }
    String name = text(node, "name");
    String url = text(node, "url");
    if (name == null || name.isBlank() || url == null || url.isBlank()) {
      throw new SerializationException("entry lacks name or url: " + node);
    }
    return new CatalogEntry(
        name, text(node, "description"), url, text(node, "category"), text(node, "source"));
  }

  /** Files written before versioning carry no schema version and count as the current one. */
  private static String schemaVersionText(JsonNode root) {
    JsonNode v = root.get("schema_version");
    return v == null || v.isNull() ? SchemaVersion.CURRENT.toString() : v.asText();
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private void deleteQuietly() {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Failed to delete catalog cache {}: {}", file, e.getMessage());
    }
  }
}
