package com.gentoro.mcpindex.search;

import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.catalog.EmbeddingMatrix;
import com.gentoro.mcpindex.exception.ExceptionUtil;
import com.gentoro.mcpindex.exception.McpIndexException;
import com.gentoro.mcpindex.exception.ValidationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ranks catalog entries against a free-text query by cosine similarity of sentence embeddings.
 *
 * <p>The engine starts in semantic mode when it has both a matrix and an embedding provider. The
 * first failure to embed a query switches it to keyword scoring for the rest of its life; the
 * switch is one-way.
 */
public class SemanticSearchEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(SemanticSearchEngine.class);

  public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.1;
  public static final int DEFAULT_TOP_K = 20;

  private final Catalog catalog;
  private final EmbeddingMatrix matrix;
  private final EmbeddingProvider provider;
  private final double similarityThreshold;
  private final AtomicBoolean lexicalOnly = new AtomicBoolean();

  /**
   * @param matrix row-aligned embeddings; {@code null} starts the engine in lexical mode
   * @param provider query embedder; {@code null} starts the engine in lexical mode
   * @throws ValidationException when the matrix is misaligned with the catalog or its dimension
   *     differs from the provider's
   */
  public SemanticSearchEngine(
      Catalog catalog,
      EmbeddingMatrix matrix,
      EmbeddingProvider provider,
      double similarityThreshold) {
    this.catalog = catalog;
    this.matrix = matrix;
    this.provider = provider;
    this.similarityThreshold = similarityThreshold;
    if (matrix != null) {
      matrix.requireAlignedWith(catalog);
      if (provider != null && matrix.rowCount() > 0 && matrix.dimension() != provider.dimension()) {
        throw new ValidationException(
            "Embedding dimension %d does not match model %s (%d)"
                .formatted(matrix.dimension(), provider.modelName(), provider.dimension()),
            Map.of("matrix", matrix.dimension(), "model", provider.dimension()));
      }
    }
    if (matrix == null || provider == null) {
      lexicalOnly.set(true);
    }
  }

  /** Engine that only ever uses keyword scoring. */
  public static SemanticSearchEngine lexical(Catalog catalog) {
    return new SemanticSearchEngine(catalog, null, null, DEFAULT_SIMILARITY_THRESHOLD);
  }

  public SearchMode mode() {
    return lexicalOnly.get() ? SearchMode.LEXICAL : SearchMode.SEMANTIC;
  }

  public Catalog catalog() {
    return catalog;
  }

  public List<SearchHit> search(String query) {
    return search(query, DEFAULT_TOP_K);
  }

  /**
   * Best matches for {@code query}, highest score first, ties in catalog order.
   *
   * @return at most {@code topK} hits; empty for a blank query
   */
  public List<SearchHit> search(String query, int topK) {
    if (query == null || query.isBlank() || topK <= 0) {
      return List.of();
    }
    if (!lexicalOnly.get()) {
      try {
        return semanticSearch(query, topK);
      } catch (McpIndexException e) {
        if (lexicalOnly.compareAndSet(false, true)) {
          log.warn(
              "Semantic search failed, using keyword search from now on: {}",
              ExceptionUtil.describe(e));
        }
      }
    }
    return KeywordScorer.rank(catalog, query, topK);
  }

  private List<SearchHit> semanticSearch(String query, int topK) {
    double[] similarities = matrix.cosineSimilarities(provider.embed(query));
    List<CatalogEntry> entries = catalog.entries();
    List<SearchHit> hits = new ArrayList<>();
    for (int i = 0; i < similarities.length; i++) {
      if (similarities[i] >= similarityThreshold) {
        hits.add(new SearchHit(entries.get(i), similarities[i], i));
      }
    }
    hits.sort(Comparator.comparingDouble(SearchHit::score).reversed());
    return hits.size() > topK ? new ArrayList<>(hits.subList(0, topK)) : hits;
  }
}
