package com.gentoro.mcpindex.search;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.catalog.EmbeddingMatrix;
import com.gentoro.mcpindex.exception.ValidationException;
import com.gentoro.mcpindex.testing.BagOfWordsEmbeddingProvider;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SemanticSearchEngineTest {

  private BagOfWordsEmbeddingProvider provider;
  private Catalog catalog;
  private EmbeddingMatrix matrix;

  @BeforeEach
  void setUp() {
    provider = new BagOfWordsEmbeddingProvider(256);
    catalog =
        Catalog.of(
            List.of(
                new CatalogEntry(
                    "mcp-git", "Git repository tools", "https://a.org/git", "", "official"),
                new CatalogEntry(
                    "mcp-weather",
                    "Weather forecast and current conditions",
                    "https://a.org/weather",
                    "",
                    "official"),
                new CatalogEntry(
                    "mcp-postgres",
                    "Query Postgres databases",
                    "https://a.org/pg",
                    "",
                    "punkpeye")));
    List<String> texts = catalog.entries().stream().map(CatalogEntry::embeddingText).toList();
    matrix = EmbeddingMatrix.of(provider.embedAll(texts));
  }

  @Test
  @DisplayName("semantic search ranks the closest entry first")
  void semanticRanking() {
    SemanticSearchEngine engine = new SemanticSearchEngine(catalog, matrix, provider, 0.1);

    List<SearchHit> hits = engine.search("weather forecast");

    assertEquals(SearchMode.SEMANTIC, engine.mode());
    assertFalse(hits.isEmpty());
    assertEquals("mcp-weather", hits.get(0).entry().name());
    assertEquals(1, hits.get(0).index());
    for (int i = 1; i < hits.size(); i++) {
      assertTrue(hits.get(i - 1).score() >= hits.get(i).score());
    }
  }

  @Test
  @DisplayName("hits below the similarity threshold are dropped")
  void threshold() {
    SemanticSearchEngine engine = new SemanticSearchEngine(catalog, matrix, provider, 0.99);
    assertTrue(engine.search("weather").isEmpty());
  }

  @Test
  @DisplayName("topK bounds the number of hits and blank queries return nothing")
  void topK() {
    SemanticSearchEngine engine = new SemanticSearchEngine(catalog, matrix, provider, 0.0);
    assertEquals(2, engine.search("mcp", 2).size());
    assertTrue(engine.search("  ").isEmpty());
    assertTrue(engine.search("mcp", 0).isEmpty());
  }

  @Test
  @DisplayName("an embedding failure switches to keyword search for good")
  void fallbackToLexical() {
    SemanticSearchEngine engine = new SemanticSearchEngine(catalog, matrix, provider, 0.1);
    provider.failFromNowOn();

    List<SearchHit> hits = engine.search("weather");

    assertEquals(SearchMode.LEXICAL, engine.mode());
    assertEquals("mcp-weather", hits.get(0).entry().name());
    assertEquals("mcp-postgres", engine.search("postgres").get(0).entry().name());
  }

  @Test
  @DisplayName("without matrix or provider the engine is lexical from the start")
  void lexicalFromStart() {
    assertEquals(SearchMode.LEXICAL, SemanticSearchEngine.lexical(catalog).mode());
    assertEquals(
        SearchMode.LEXICAL, new SemanticSearchEngine(catalog, matrix, null, 0.1).mode());
    assertEquals(
        "mcp-git", SemanticSearchEngine.lexical(catalog).search("git").get(0).entry().name());
  }

  @Test
  @DisplayName("matrix dimension must match the model")
  void dimensionMismatch() {
    BagOfWordsEmbeddingProvider other = new BagOfWordsEmbeddingProvider(64);
    assertThrows(
        ValidationException.class, () -> new SemanticSearchEngine(catalog, matrix, other, 0.1));
  }

  @Test
  @DisplayName("matrix row count must match the catalog")
  void misaligned() {
    EmbeddingMatrix oneRow = EmbeddingMatrix.of(new float[][] {new float[256]});
    assertThrows(
        ValidationException.class, () -> new SemanticSearchEngine(catalog, oneRow, provider, 0.1));
  }

  @Test
  @DisplayName("the same query on the same catalog yields the same ranking")
  void deterministic() {
    SemanticSearchEngine engine = new SemanticSearchEngine(catalog, matrix, provider, 0.0);
    SemanticSearchEngine twin = new SemanticSearchEngine(catalog, matrix, provider, 0.0);

    List<SearchHit> first = engine.search("query weather databases");

    assertFalse(first.isEmpty());
    assertEquals(first, engine.search("query weather databases"));
    assertEquals(first, twin.search("query weather databases"));
  }

  @Test
  @DisplayName("equal similarities keep catalog order")
  void tiesKeepCatalogOrder() {
    Catalog twins =
        Catalog.of(
            List.of(
                new CatalogEntry("zeta", "Weather", "https://a.org/z", "", "official"),
                new CatalogEntry("alpha", "Weather", "https://a.org/a", "", "official"),
                new CatalogEntry("mid", "Weather", "https://a.org/m", "", "official")));
    float[] row = provider.embed("weather forecast");
    EmbeddingMatrix same = EmbeddingMatrix.of(new float[][] {row, row.clone(), row.clone()});
    SemanticSearchEngine engine = new SemanticSearchEngine(twins, same, provider, 0.0);

    List<SearchHit> hits = engine.search("weather");

    assertEquals(3, hits.size());
    assertEquals(List.of(0, 1, 2), hits.stream().map(SearchHit::index).toList());
    assertEquals(hits.get(0).score(), hits.get(2).score());
  }

  @Test
  @DisplayName("keyword fallback is deterministic and keeps catalog order on ties")
  void lexicalTiesKeepCatalogOrder() {
    Catalog twins =
        Catalog.of(
            List.of(
                new CatalogEntry("zeta", "weather data", "https://a.org/z", "", "official"),
                new CatalogEntry("alpha", "weather data", "https://a.org/a", "", "official")));
    SemanticSearchEngine engine = SemanticSearchEngine.lexical(twins);

    List<SearchHit> hits = engine.search("weather");

    assertEquals(List.of("zeta", "alpha"), hits.stream().map(h -> h.entry().name()).toList());
    assertEquals(hits, engine.search("weather"));
  }
}
