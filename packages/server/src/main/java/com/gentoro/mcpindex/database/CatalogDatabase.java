package com.gentoro.mcpindex.database;

import com.gentoro.mcpindex.cache.CachedCatalog;
import com.gentoro.mcpindex.cache.CatalogCache;
import com.gentoro.mcpindex.cache.EmbeddingCache;
import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.catalog.ContentHasher;
import com.gentoro.mcpindex.catalog.EmbeddingMatrix;
import com.gentoro.mcpindex.exception.CatalogUnavailableException;
import com.gentoro.mcpindex.exception.ExceptionUtil;
import com.gentoro.mcpindex.exception.McpIndexException;
import com.gentoro.mcpindex.exception.ValidationException;
import com.gentoro.mcpindex.precomputed.PrecomputedBundle;
import com.gentoro.mcpindex.precomputed.PrecomputedDataLoader;
import com.gentoro.mcpindex.precomputed.PrecomputedLoadResult;
import com.gentoro.mcpindex.schema.SchemaVersion;
import com.gentoro.mcpindex.search.EmbeddingProvider;
import com.gentoro.mcpindex.search.SearchHit;
import com.gentoro.mcpindex.search.SemanticSearchEngine;
import com.gentoro.mcpindex.source.ServerSource;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the catalog being served and the search engine built over it.
 *
 * <p>A catalog is assembled by trying, in order: the precomputed bundle, the fresh local cache, a
 * live fetch of every configured source, and finally the stale cache. A complete stale catalog
 * beats a partial live one. The result is published as an immutable {@link IndexState}; queries
 * read it without locking and a refresh swaps in a new one.
 */
public class CatalogDatabase {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(CatalogDatabase.class);

  private final DatabaseSettings settings;
  private final PrecomputedDataLoader precomputedLoader;
  private final LiveCatalogFetcher liveFetcher;
  private final CatalogCache catalogCache;
  private final EmbeddingCache embeddingCache;
  private final EmbeddingProvider embeddingProvider;
  private final String modelName;
  private final Clock clock;

  private volatile IndexState state;

  /**
   * @param embeddingProvider may be {@code null}, in which case search is keyword-only
   */
  public CatalogDatabase(
      DatabaseSettings settings,
      PrecomputedDataLoader precomputedLoader,
      List<ServerSource> sources,
      CatalogCache catalogCache,
      EmbeddingCache embeddingCache,
      EmbeddingProvider embeddingProvider,
      String modelName,
      Clock clock) {
    this.settings = settings;
    this.precomputedLoader = precomputedLoader;
    this.liveFetcher = new LiveCatalogFetcher(sources, settings.sourcesTimeout());
    this.catalogCache = catalogCache;
    this.embeddingCache = embeddingCache;
    this.embeddingProvider = embeddingProvider;
    this.modelName = modelName;
    this.clock = clock;
  }

  /**
   * Assemble and publish the first catalog.
   *
   * @throws CatalogUnavailableException when every tier failed
   */
  public IndexState initialize() {
    IndexState next = assemble(false);
    this.state = next;
    return next;
  }

  /**
   * Rebuild the index and swap it in. The previous state keeps serving until the new one is ready,
   * and stays in place if the rebuild fails.
   *
   * @param forceLive skip the precomputed bundle and the fresh cache
   */
  public IndexState refresh(boolean forceLive) {
    IndexState next = assemble(forceLive);
    this.state = next;
    return next;
  }

  public boolean isReady() {
    return state != null;
  }

  /** Current state, or empty before a successful {@link #initialize()}. */
  public Optional<IndexState> state() {
    return Optional.ofNullable(state);
  }

  public List<SearchHit> search(String query) {
    return search(query, settings.topK());
  }

  /**
   * @throws CatalogUnavailableException when no catalog has been loaded
   */
  public List<SearchHit> search(String query, int topK) {
    IndexState current = state;
    if (current == null) {
      throw new CatalogUnavailableException("Catalog not loaded");
    }
    return current.engine().search(query, topK);
  }

  public Map<String, Object> searchInfo() {
    Map<String, Object> info = new LinkedHashMap<>();
    IndexState current = state;
    if (current == null) {
      info.put("ready", false);
    } else {
      info.put("ready", true);
      info.put("entries", current.catalog().entryCount());
      info.put("origin", current.origin().name());
      info.put("searchMode", current.engine().mode().name());
      info.put("schemaVersion", current.catalog().schemaVersion().toString());
      info.put("loadedAt", current.loadedAt().toString());
      info.put("contentHash", current.contentHash());
    }
    info.put("sources", liveFetcher.sources().stream().map(ServerSource::id).toList());
    info.put("catalogCache", catalogCache.info().toMap());
    info.put("embeddingCache", embeddingCache.info());
    return info;
  }

  /** Remove the catalog cache and all cached embeddings. */
  public void clearCaches() {
    catalogCache.clear();
    embeddingCache.clear();
  }

  private IndexState assemble(boolean forceLive) {
    if (!forceLive) {
      PrecomputedLoadResult precomputed = precomputedLoader.load();
      if (precomputed.isAvailable()) {
        PrecomputedBundle bundle = precomputed.bundle();
        return buildState(
            bundle.catalog(), bundle.embeddings(), CatalogOrigin.PRECOMPUTED, bundle.contentHash());
      }
      Optional<CachedCatalog> fresh = catalogCache.load(false).filter(c -> !c.catalog().isEmpty());
      if (fresh.isPresent()) {
        log.info(
            "Using cached catalog: {} entries, {}s old",
            fresh.get().catalog().entryCount(),
            fresh.get().age().toSeconds());
        return buildState(fresh.get().catalog(), null, CatalogOrigin.CACHE, null);
      }
    }

    LiveFetchResult live = liveFetcher.fetch();
    if (live.partial()) {
      Optional<CachedCatalog> stale = catalogCache.load(true).filter(c -> !c.catalog().isEmpty());
      if (stale.isPresent()
          && (live.entries().isEmpty()
              || stale.get().catalog().entryCount() > live.entries().size())) {
        log.info(
            "Using cached catalog with {} entries over {} entries from partial live fetch",
            stale.get().catalog().entryCount(),
            live.entries().size());
        CatalogOrigin origin =
            stale.get().stale() ? CatalogOrigin.STALE_CACHE : CatalogOrigin.CACHE;
        return buildState(stale.get().catalog(), null, origin, null);
      }
    }
    if (live.entries().isEmpty()) {
      throw new CatalogUnavailableException(
          "No catalog available: precomputed data, cache and all live sources failed",
          Map.of("failures", live.failures()));
    }

    Catalog catalog = new Catalog(live.entries(), clock.instant(), SchemaVersion.CURRENT);
    String hash = ContentHasher.catalogHash(catalog.entries(), modelName);
    try {
      catalogCache.save(catalog, hash);
    } catch (McpIndexException e) {
      log.warn("Could not write catalog cache: {}", e.getMessage());
    }
    log.info(
        "Live catalog: {} unique entries from {} raw ({} source failures)",
        catalog.entryCount(),
        live.rawCount(),
        live.failures().size());
    return buildState(catalog, null, CatalogOrigin.LIVE, hash);
  }

  private IndexState buildState(
      Catalog catalog, EmbeddingMatrix matrix, CatalogOrigin origin, String contentHash) {
    String hash =
        contentHash != null ? contentHash : ContentHasher.catalogHash(catalog.entries(), modelName);
    SemanticSearchEngine engine = buildEngine(catalog, matrix, hash);
    log.info(
        "Catalog ready: {} entries from {}, search mode {}",
        catalog.entryCount(),
        origin,
        engine.mode());
    return new IndexState(catalog, engine, origin, clock.instant(), hash);
  }

  private SemanticSearchEngine buildEngine(Catalog catalog, EmbeddingMatrix matrix, String hash) {
    if (embeddingProvider == null) {
      return SemanticSearchEngine.lexical(catalog);
    }
    boolean dimensionMismatch =
        matrix != null
            && matrix.rowCount() > 0
            && matrix.dimension() != embeddingProvider.dimension();
    if (dimensionMismatch) {
      log.warn(
          "Precomputed embeddings have dimension {}, model {} produces {}; recomputing locally",
          matrix.dimension(),
          embeddingProvider.modelName(),
          embeddingProvider.dimension());
      matrix = null;
    }
    if (matrix == null) {
      matrix =
          embeddingCache
              .load(hash, catalog.entryCount())
              .filter(m -> m.rowCount() == 0 || m.dimension() == embeddingProvider.dimension())
              .orElse(null);
    }
    if (matrix == null) {
      try {
        matrix = computeEmbeddings(catalog);
      } catch (McpIndexException e) {
        log.warn("Embedding model unavailable, keyword search only: {}", ExceptionUtil.describe(e));
        return SemanticSearchEngine.lexical(catalog);
      }
      try {
        embeddingCache.save(hash, matrix);
      } catch (McpIndexException e) {
        log.warn("Could not write embedding cache: {}", e.getMessage());
      }
    }
    try {
      return new SemanticSearchEngine(
          catalog, matrix, embeddingProvider, settings.similarityThreshold());
    } catch (ValidationException e) {
      log.warn("Embeddings unusable, keyword search only: {}", e.getMessage());
      return SemanticSearchEngine.lexical(catalog);
    }
  }

  private EmbeddingMatrix computeEmbeddings(Catalog catalog) {
    log.info("Computing embeddings for {} entries", catalog.entryCount());
    List<String> texts = catalog.entries().stream().map(CatalogEntry::embeddingText).toList();
    return EmbeddingMatrix.of(embeddingProvider.embedAll(texts));
  }
}
