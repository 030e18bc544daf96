package com.gentoro.mcpindex.precomputed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.mcpindex.cache.CatalogCache;
import com.gentoro.mcpindex.cache.EmbeddingCache;
import com.gentoro.mcpindex.cache.NpyCodec;
import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.catalog.ContentHasher;
import com.gentoro.mcpindex.catalog.EmbeddingMatrix;
import com.gentoro.mcpindex.exception.ExceptionUtil;
import com.gentoro.mcpindex.exception.McpIndexException;
import com.gentoro.mcpindex.exception.SerializationException;
import com.gentoro.mcpindex.schema.Compatibility;
import com.gentoro.mcpindex.schema.SchemaCompatibilityChecker;
import com.gentoro.mcpindex.schema.SchemaVersion;
import com.gentoro.mcpindex.utility.JacksonUtility;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Downloads and validates the publisher-built bundle ({@code data_info.json}, {@code
 * servers.json}, {@code embeddings.npz}).
 *
 * <p>{@link #load()} never throws; every failure becomes an unavailable result so the caller can
 * move on to the next tier. A successful load seeds both local caches.
 */
public class PrecomputedDataLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(PrecomputedDataLoader.class);

  public static final String DEFAULT_BASE_URL =
      "https://github.com/wojtyniak/mcp-mcp/releases/download/data-latest";
  public static final String SERVERS_FILE = "servers.json";
  public static final String EMBEDDINGS_FILE = "embeddings.npz";
  public static final String EMBEDDINGS_KEY = "embeddings";

  private final OkHttpClient httpClient;
  private final String baseUrl;
  private final SchemaCompatibilityChecker checker;
  private final String modelName;
  private final CatalogCache catalogCache;
  private final EmbeddingCache embeddingCache;
  private final boolean enabled;

  public PrecomputedDataLoader(
      OkHttpClient httpClient,
      String baseUrl,
      SchemaCompatibilityChecker checker,
      String modelName,
      CatalogCache catalogCache,
      EmbeddingCache embeddingCache,
      boolean enabled) {
    this.httpClient = httpClient;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.checker = checker;
    this.modelName = modelName;
    this.catalogCache = catalogCache;
    this.embeddingCache = embeddingCache;
    this.enabled = enabled;
  }

  public String baseUrl() {
    return baseUrl;
  }

  public PrecomputedLoadResult load() {
    if (!enabled) {
      return PrecomputedLoadResult.unavailable("precomputed data disabled");
    }
    try {
      ObjectMapper mapper = JacksonUtility.getJsonMapper();

      DataInfo info = mapper.readValue(download(DataInfo.FILE_NAME), DataInfo.class);
      info.validate();
      String schemaVersion = info.effectiveSchemaVersion();
      if (checker.check(schemaVersion) != Compatibility.COMPATIBLE) {
        return unavailable(checker.describe(schemaVersion));
      }
      log.debug(checker.describe(schemaVersion));
      if (!modelName.equals(info.getModelName())) {
        return unavailable(
            "bundle built with model '%s', configured '%s'"
                .formatted(info.getModelName(), modelName));
      }

      List<CatalogEntry> entries = parseServers(mapper.readTree(download(SERVERS_FILE)));
      if (entries.isEmpty()) {
        return unavailable("bundle contains no servers");
      }
      float[][] rows =
          NpyCodec.readNpz(new ByteArrayInputStream(download(EMBEDDINGS_FILE)), EMBEDDINGS_KEY);
      EmbeddingMatrix matrix = EmbeddingMatrix.of(rows);

      List<Integer> shape = info.getEmbeddingsShape();
      if (entries.size() != info.getServersCount() || matrix.rowCount() != entries.size()) {
        return unavailable(
            "misaligned bundle: %d servers, %d embedding rows, servers_count %d"
                .formatted(entries.size(), matrix.rowCount(), info.getServersCount()));
      }
      if (shape.get(0) != matrix.rowCount() || shape.get(1) != matrix.dimension()) {
        return unavailable(
            "embeddings_shape %s does not match matrix %dx%d"
                .formatted(shape, matrix.rowCount(), matrix.dimension()));
      }

      Instant builtAt = Instant.ofEpochMilli(Math.round(info.getBuildTimestamp() * 1000));
      Catalog catalog = new Catalog(entries, builtAt, SchemaVersion.parse(schemaVersion));
      String hash = ContentHasher.catalogHash(catalog.entries(), modelName);
      seedCaches(catalog, matrix, hash);
      log.info(
          "Loaded precomputed bundle: {} servers, embeddings {}x{}, schema v{}",
          catalog.entryCount(),
          matrix.rowCount(),
          matrix.dimension(),
          schemaVersion);
      return PrecomputedLoadResult.available(new PrecomputedBundle(info, catalog, matrix, hash));
    } catch (IOException | RuntimeException e) {
      return unavailable(ExceptionUtil.describe(e));
    }
  }

  private PrecomputedLoadResult unavailable(String reason) {
    log.info("Precomputed data unavailable: {}", reason);
    return PrecomputedLoadResult.unavailable(reason);
  }

  private static List<CatalogEntry> parseServers(JsonNode root) {
    if (root == null || !root.isArray()) {
      throw new SerializationException("servers.json is not an array");
    }
    List<CatalogEntry> entries = new ArrayList<>(root.size());
    int index = 0;
    for (JsonNode node : root) {
      try {
        entries.add(CatalogCache.toEntry(node));
      } catch (SerializationException e) {
        // one dropped row would shift every embedding after it
        throw new SerializationException("malformed server entry #" + index, e);
      }
      index++;
    }
    return entries;
  }

  private void seedCaches(Catalog catalog, EmbeddingMatrix matrix, String hash) {
    try {
      catalogCache.save(catalog, hash);
      embeddingCache.save(hash, matrix);
    } catch (McpIndexException e) {
      log.warn("Could not seed local caches from precomputed bundle: {}", e.getMessage());
    }
  }

  private byte[] download(String fileName) throws IOException {
    String url = baseUrl + "/" + fileName;
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new IOException("HTTP %d fetching %s".formatted(response.code(), fileName));
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new IOException("Empty body fetching " + fileName);
      }
      return body.bytes();
    }
  }
}
