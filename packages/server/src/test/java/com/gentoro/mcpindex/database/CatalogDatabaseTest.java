package com.gentoro.mcpindex.database;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mcpindex.cache.CatalogCache;
import com.gentoro.mcpindex.cache.EmbeddingCache;
import com.gentoro.mcpindex.cache.NpyCodec;
import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.catalog.EmbeddingMatrix;
import com.gentoro.mcpindex.exception.CatalogUnavailableException;
import com.gentoro.mcpindex.precomputed.PrecomputedDataLoader;
import com.gentoro.mcpindex.schema.SchemaCompatibilityChecker;
import com.gentoro.mcpindex.schema.SchemaVersion;
import com.gentoro.mcpindex.search.EmbeddingProvider;
import com.gentoro.mcpindex.search.SearchMode;
import com.gentoro.mcpindex.source.ServerSource;
import com.gentoro.mcpindex.testing.BagOfWordsEmbeddingProvider;
import com.gentoro.mcpindex.testing.FakeSource;
import com.gentoro.mcpindex.testing.MutableClock;
import com.gentoro.mcpindex.testing.StubHttp;
import com.gentoro.mcpindex.utility.JacksonUtility;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CatalogDatabaseTest {

  private static final String BASE = "https://data.example.org/latest";

  @TempDir Path tempDir;

  private MutableClock clock;
  private StubHttp http;
  private BagOfWordsEmbeddingProvider provider;
  private CatalogCache catalogCache;
  private EmbeddingCache embeddingCache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-06-01T10:00:00Z"));
    http = new StubHttp();
    provider = new BagOfWordsEmbeddingProvider();
    catalogCache = new CatalogCache(tempDir.resolve("servers"), Duration.ofHours(3), clock);
    embeddingCache = new EmbeddingCache(tempDir.resolve("embeddings"), 5);
  }

  private CatalogDatabase database(
      boolean precomputed, EmbeddingProvider embeddings, ServerSource... sources) {
    PrecomputedDataLoader loader =
        new PrecomputedDataLoader(
            http.client(),
            BASE,
            SchemaCompatibilityChecker.fromVersions(List.of("1.0")),
            BagOfWordsEmbeddingProvider.MODEL_NAME,
            catalogCache,
            embeddingCache,
            precomputed);
    return new CatalogDatabase(
        new DatabaseSettings(Duration.ofSeconds(5), 0.1, 20),
        loader,
        List.of(sources),
        catalogCache,
        embeddingCache,
        embeddings,
        BagOfWordsEmbeddingProvider.MODEL_NAME,
        clock);
  }

  private void publishBundle(List<CatalogEntry> entries, int dimension) throws Exception {
    BagOfWordsEmbeddingProvider builder = new BagOfWordsEmbeddingProvider(dimension);
    EmbeddingMatrix matrix =
        EmbeddingMatrix.of(
            builder.embedAll(entries.stream().map(CatalogEntry::embeddingText).toList()));
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("servers_count", entries.size());
    info.put("embeddings_shape", List.of(entries.size(), dimension));
    info.put("model_name", BagOfWordsEmbeddingProvider.MODEL_NAME);
    info.put("schema_version", "1.0");
    info.put("build_timestamp", 1748772000.0);
    http.respond(
        BASE + "/data_info.json", JacksonUtility.getJsonMapper().writeValueAsString(info));
    http.respond(
        BASE + "/servers.json", JacksonUtility.getJsonMapper().writeValueAsString(entries));
    http.respond(BASE + "/embeddings.npz", NpyCodec.writeNpz("embeddings", matrix));
  }

  private void seedCache(List<CatalogEntry> entries) {
    catalogCache.save(new Catalog(entries, clock.instant(), SchemaVersion.CURRENT), null);
  }

  @Test
  @DisplayName("the precomputed bundle is used first and no source is fetched")
  void precomputedFirst() throws Exception {
    publishBundle(FakeSource.entries("bundle", 4), provider.dimension());
    FakeSource official = FakeSource.returning("official", FakeSource.entries("official", 2));

    IndexState state = database(true, provider, official).initialize();

    assertEquals(CatalogOrigin.PRECOMPUTED, state.origin());
    assertEquals(4, state.catalog().entryCount());
    assertEquals(SearchMode.SEMANTIC, state.engine().mode());
    assertEquals(0, official.fetches());
  }

  @Test
  @DisplayName("a fresh cache is used before any live fetch")
  void freshCacheBeforeLive() {
    seedCache(FakeSource.entries("cached", 3));
    clock.advance(Duration.ofHours(1));
    FakeSource official = FakeSource.returning("official", FakeSource.entries("official", 2));

    IndexState state = database(false, provider, official).initialize();

    assertEquals(CatalogOrigin.CACHE, state.origin());
    assertEquals(3, state.catalog().entryCount());
    assertEquals(0, official.fetches());
  }

  @Test
  @DisplayName("live fetch populates both caches and later starts reuse the embeddings")
  void liveFetchWritesCaches() {
    FakeSource official = FakeSource.returning("official", FakeSource.entries("official", 3));
    FakeSource punkpeye = FakeSource.returning("punkpeye", FakeSource.entries("punkpeye", 2));

    IndexState state = database(false, provider, official, punkpeye).initialize();

    assertEquals(CatalogOrigin.LIVE, state.origin());
    assertEquals(5, state.catalog().entryCount());
    assertTrue(catalogCache.load(false).isPresent());
    assertTrue(embeddingCache.load(state.contentHash(), 5).isPresent());

    int embeddedBefore = provider.embeddedTexts();
    IndexState second = database(false, provider, official, punkpeye).initialize();
    assertEquals(CatalogOrigin.CACHE, second.origin());
    assertEquals(state.contentHash(), second.contentHash());
    assertEquals(embeddedBefore, provider.embeddedTexts());
  }

  @Test
  @DisplayName("a complete stale cache beats a partial live fetch")
  void staleCacheBeatsPartialLive() {
    seedCache(FakeSource.entries("cached", 1296));
    clock.advance(Duration.ofHours(5));

    IndexState state =
        database(
                false,
                null,
                FakeSource.failing("official"),
                FakeSource.returning("punkpeye", FakeSource.entries("punkpeye", 200)))
            .initialize();

    assertEquals(CatalogOrigin.STALE_CACHE, state.origin());
    assertEquals(1296, state.catalog().entryCount());
  }

  @Test
  @DisplayName("a complete live fetch replaces an expired cache even when smaller")
  void completeLiveBeatsStaleCache() {
    seedCache(FakeSource.entries("cached", 50));
    clock.advance(Duration.ofHours(5));

    IndexState state =
        database(
                false, null, FakeSource.returning("official", FakeSource.entries("official", 10)))
            .initialize();

    assertEquals(CatalogOrigin.LIVE, state.origin());
    assertEquals(10, state.catalog().entryCount());
  }

  @Test
  @DisplayName("every tier failing raises CatalogUnavailableException")
  void allTiersFail() {
    http.fail(BASE + "/data_info.json", 503);
    CatalogDatabase database =
        database(true, provider, FakeSource.failing("official"), FakeSource.failing("punkpeye"));

    assertThrows(CatalogUnavailableException.class, database::initialize);
    assertFalse(database.isReady());
    assertThrows(CatalogUnavailableException.class, () -> database.search("anything"));
    assertEquals(false, database.searchInfo().get("ready"));
  }

  @Test
  @DisplayName("precomputed embeddings of another dimension are recomputed locally")
  void dimensionMismatchRecomputes() throws Exception {
    publishBundle(FakeSource.entries("bundle", 3), 16);

    IndexState state = database(true, provider).initialize();

    assertEquals(CatalogOrigin.PRECOMPUTED, state.origin());
    assertEquals(SearchMode.SEMANTIC, state.engine().mode());
    assertEquals(3, provider.embeddedTexts());
  }

  @Test
  @DisplayName("without a working model the index is keyword-only")
  void lexicalWithoutModel() {
    FakeSource official = FakeSource.returning("official", FakeSource.entries("official", 3));

    assertEquals(
        SearchMode.LEXICAL, database(false, null, official).initialize().engine().mode());

    provider.failFromNowOn();
    CatalogDatabase failing = database(false, provider, official);
    failing.clearCaches();
    IndexState state = failing.initialize();
    assertEquals(SearchMode.LEXICAL, state.engine().mode());
    assertEquals("official-server-2", failing.search("server-2").get(0).entry().name());
  }

  @Test
  @DisplayName("forced refresh goes live; a failed refresh keeps the previous state")
  void refresh() throws Exception {
    publishBundle(FakeSource.entries("bundle", 2), provider.dimension());
    FakeSource official = FakeSource.returning("official", FakeSource.entries("official", 3));
    CatalogDatabase database = database(true, null, official);
    database.initialize();

    IndexState refreshed = database.refresh(true);
    assertEquals(CatalogOrigin.LIVE, refreshed.origin());
    assertEquals(1, official.fetches());

    CatalogDatabase broken = database(false, null, FakeSource.failing("official"));
    broken.initialize();
    assertEquals(CatalogOrigin.CACHE, broken.state().orElseThrow().origin());
    broken.clearCaches();
    assertThrows(CatalogUnavailableException.class, () -> broken.refresh(true));
    assertEquals(3, broken.state().orElseThrow().catalog().entryCount());
  }

  @Test
  @DisplayName("searchInfo describes the served catalog")
  void searchInfo() {
    CatalogDatabase database =
        database(false, null, FakeSource.returning("official", FakeSource.entries("official", 2)));
    database.initialize();

    Map<String, Object> info = database.searchInfo();

    assertEquals(true, info.get("ready"));
    assertEquals(2, info.get("entries"));
    assertEquals("LIVE", info.get("origin"));
    assertEquals("LEXICAL", info.get("searchMode"));
    assertEquals(List.of("official"), info.get("sources"));
  }
}
