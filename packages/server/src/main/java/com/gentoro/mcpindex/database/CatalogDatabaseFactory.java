package com.gentoro.mcpindex.database;

import com.gentoro.mcpindex.McpIndex;
import com.gentoro.mcpindex.cache.CacheDirectories;
import com.gentoro.mcpindex.cache.CatalogCache;
import com.gentoro.mcpindex.cache.EmbeddingCache;
import com.gentoro.mcpindex.exception.ConfigException;
import com.gentoro.mcpindex.precomputed.PrecomputedDataLoader;
import com.gentoro.mcpindex.schema.SchemaCompatibilityChecker;
import com.gentoro.mcpindex.search.EmbeddingProvider;
import com.gentoro.mcpindex.search.MiniLmEmbeddingProvider;
import com.gentoro.mcpindex.source.ServerSource;
import com.gentoro.mcpindex.source.ServerSourceFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/** Wires a {@link CatalogDatabase} from the application configuration. */
public final class CatalogDatabaseFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(CatalogDatabaseFactory.class);

  public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(3);
  public static final int DEFAULT_EMBEDDING_CACHE_KEEP = 5;

  private CatalogDatabaseFactory() {}

  public static CatalogDatabase create(McpIndex mcpIndex) {
    Configuration config = mcpIndex.configuration();

    CacheDirectories directories = CacheDirectories.fromConfiguration(config);
    log.debug("Cache directory: {}", directories.base());
    SchemaCompatibilityChecker checker =
        SchemaCompatibilityChecker.fromVersions(
            config.getList(String.class, "precomputed.schema.known-versions", List.of()));
    CatalogCache catalogCache =
        new CatalogCache(directories.serversDir(), cacheTtl(config), checker, Clock.systemUTC());
    EmbeddingCache embeddingCache =
        new EmbeddingCache(
            directories.embeddingsDir(),
            config.getInt("embeddings.cache.keep", DEFAULT_EMBEDDING_CACHE_KEEP));

    EmbeddingProvider embeddingProvider = createEmbeddingProvider(config);
    String modelName =
        embeddingProvider != null
            ? embeddingProvider.modelName()
            : MiniLmEmbeddingProvider.MODEL_NAME;

    PrecomputedDataLoader precomputedLoader =
        new PrecomputedDataLoader(
            mcpIndex.httpClient(),
            config.getString("precomputed.base-url", PrecomputedDataLoader.DEFAULT_BASE_URL),
            checker,
            modelName,
            catalogCache,
            embeddingCache,
            config.getBoolean("precomputed.enabled", true));

    List<ServerSource> sources = ServerSourceFactory.createEnabled(mcpIndex.httpClient(), config);

    return new CatalogDatabase(
        DatabaseSettings.fromConfiguration(config),
        precomputedLoader,
        sources,
        catalogCache,
        embeddingCache,
        embeddingProvider,
        modelName,
        Clock.systemUTC());
  }

  /** The local embedding model, or {@code null} when {@code embeddings.enabled} is false. */
  public static EmbeddingProvider createEmbeddingProvider(Configuration config) {
    if (!config.getBoolean("embeddings.enabled", true)) {
      log.info("Embeddings disabled by configuration; search will be keyword-only");
      return null;
    }
    return new MiniLmEmbeddingProvider();
  }

  private static Duration cacheTtl(Configuration config) {
    String value = config.getString("catalog.cache.ttl", DEFAULT_CACHE_TTL.toString());
    try {
      Duration ttl = Duration.parse(value);
      if (ttl.isNegative()) {
        throw new ConfigException("catalog.cache.ttl must not be negative: " + value);
      }
      return ttl;
    } catch (DateTimeParseException e) {
      throw new ConfigException("Invalid catalog.cache.ttl: " + value, e);
    }
  }
}
