package com.gentoro.mcpindex.tool;

import com.gentoro.mcpindex.database.CatalogDatabase;
import com.gentoro.mcpindex.exception.CatalogUnavailableException;
import com.gentoro.mcpindex.search.SearchHit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The {@code find_mcp_tool} operation: best catalog match for a capability description, with its
 * README and a few alternatives.
 *
 * <p>When the top hit has no README, a close runner-up that has one is promoted. Only the first
 * {@link ToolSettings#promotionLookahead()} hits are considered, and only those scoring at least
 * {@link ToolSettings#minScoreRatio()} of the top score, so a clearly better match is never
 * displaced.
 */
public class FindServerTool {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(FindServerTool.class);

  public static final String NAME = "find_mcp_tool";
  public static final String DESCRIPTION =
      "Find an MCP server that provides a capability. Describe what you need in natural language;"
          + " optionally add an example question the server should be able to answer.";

  private final CatalogDatabase database;
  private final ReadmeFetcher readmeFetcher;
  private final ToolSettings settings;

  public FindServerTool(
      CatalogDatabase database, ReadmeFetcher readmeFetcher, ToolSettings settings) {
    this.database = database;
    this.readmeFetcher = readmeFetcher;
    this.settings = settings;
  }

  public FindServerResult find(String description, String exampleQuestion) {
    if (description == null || description.isBlank()) {
      return FindServerResult.error("description must not be blank");
    }
    List<SearchHit> hits;
    try {
      hits = database.search(description);
      if (hits.isEmpty() && exampleQuestion != null && !exampleQuestion.isBlank()) {
        log.debug("No hits for '{}', retrying with the example question", description);
        hits = database.search(description + " " + exampleQuestion);
      }
    } catch (CatalogUnavailableException e) {
      log.warn("Catalog unavailable: {}", e.getMessage());
      return FindServerResult.error("Server catalog unavailable: " + e.getMessage());
    }
    if (hits.isEmpty()) {
      return FindServerResult.notFound(description);
    }

    int primaryIndex = 0;
    Optional<String> readme = readmeFetcher.fetch(hits.get(0).entry().url());
    if (readme.isEmpty()) {
      double floor = hits.get(0).score() * settings.minScoreRatio();
      int window = Math.min(settings.promotionLookahead(), hits.size());
      for (int i = 1; i < window; i++) {
        SearchHit candidate = hits.get(i);
        if (candidate.score() < floor) {
          break;
        }
        Optional<String> candidateReadme = readmeFetcher.fetch(candidate.entry().url());
        if (candidateReadme.isPresent()) {
          log.debug(
              "Promoting '{}' over '{}' for having a README",
              candidate.entry().name(),
              hits.get(0).entry().name());
          primaryIndex = i;
          readme = candidateReadme;
          break;
        }
      }
    }

    SearchHit primary = hits.get(primaryIndex);
    List<ServerView> alternatives = new ArrayList<>();
    for (int i = 0; i < hits.size() && alternatives.size() < settings.maxAlternatives(); i++) {
      if (i != primaryIndex) {
        alternatives.add(ServerView.of(hits.get(i).entry(), null));
      }
    }
    return FindServerResult.found(
        ServerView.of(primary.entry(), readme.orElse(null)), alternatives);
  }
}
