package com.gentoro.mcpindex.database;

import com.gentoro.mcpindex.search.SemanticSearchEngine;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * @param sourcesTimeout bound on each live source fetch
 * @param similarityThreshold minimum cosine similarity for a semantic hit
 * @param topK default number of hits returned by {@link CatalogDatabase#search(String)}
 */
public record DatabaseSettings(Duration sourcesTimeout, double similarityThreshold, int topK) {

  public static final Duration DEFAULT_SOURCES_TIMEOUT = Duration.ofSeconds(30);

  public static DatabaseSettings defaults() {
    return new DatabaseSettings(
        DEFAULT_SOURCES_TIMEOUT,
        SemanticSearchEngine.DEFAULT_SIMILARITY_THRESHOLD,
        SemanticSearchEngine.DEFAULT_TOP_K);
  }

  public static DatabaseSettings fromConfiguration(Configuration config) {
    return new DatabaseSettings(
        Duration.parse(
            config.getString("catalog.sources.timeout", DEFAULT_SOURCES_TIMEOUT.toString())),
        config.getDouble(
            "search.similarity-threshold", SemanticSearchEngine.DEFAULT_SIMILARITY_THRESHOLD),
        config.getInt("search.top-k", SemanticSearchEngine.DEFAULT_TOP_K));
  }
}
