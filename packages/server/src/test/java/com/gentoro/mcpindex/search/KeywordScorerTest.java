package com.gentoro.mcpindex.search;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KeywordScorerTest {

  private static CatalogEntry entry(String name, String description, String category) {
    return new CatalogEntry(name, description, "https://example.com/" + name, category, "official");
  }

  @Test
  @DisplayName("exact name match collects name, word, fuzzy and category points")
  void exactNameScore() {
    CatalogEntry weather = entry("weather", "Forecast data", CatalogEntry.CATEGORY_REFERENCE);
    double expected =
        KeywordScorer.EXACT_NAME
            + KeywordScorer.NAME_WORD
            + KeywordScorer.NAME_FUZZY
            + KeywordScorer.REFERENCE_BONUS;
    assertEquals(expected, KeywordScorer.score(weather, "Weather"));
  }

  @Test
  @DisplayName("no match scores zero and earns no category bonus")
  void noMatch() {
    CatalogEntry weather = entry("weather", "Forecast data", CatalogEntry.CATEGORY_OFFICIAL);
    assertEquals(0, KeywordScorer.score(weather, "kubernetes"));
    assertEquals(0, KeywordScorer.score(weather, "   "));
  }

  @Test
  @DisplayName("description substring outranks a single description word")
  void descriptionSubstring() {
    CatalogEntry a = entry("alpha", "query postgres databases", "");
    CatalogEntry b = entry("beta", "postgres tools and databases query", "");
    String query = "postgres databases";
    assertTrue(KeywordScorer.score(a, query) > KeywordScorer.score(b, query));
  }

  @Test
  @DisplayName("rank drops zero scores, orders best first and honours topK")
  void rank() {
    Catalog catalog =
        Catalog.of(
            List.of(
                entry("git-tools", "work with git repositories", ""),
                entry("slack", "chat messages", ""),
                entry("git", "git", CatalogEntry.CATEGORY_REFERENCE),
                entry("gitlab", "gitlab api", "")));

    List<SearchHit> hits = KeywordScorer.rank(catalog, "git", 10);

    assertEquals("git", hits.get(0).entry().name());
    assertEquals(2, hits.get(0).index());
    assertTrue(hits.stream().noneMatch(h -> h.entry().name().equals("slack")));
    assertEquals(2, KeywordScorer.rank(catalog, "git", 2).size());
    assertTrue(KeywordScorer.rank(catalog, "", 10).isEmpty());
  }

  @Test
  @DisplayName("equal scores keep catalog order and repeated ranking is identical")
  void tiesKeepCatalogOrder() {
    Catalog catalog =
        Catalog.of(
            List.of(
                entry("zeta", "slack chat bridge", ""),
                entry("slack", "slack workspace", CatalogEntry.CATEGORY_OFFICIAL),
                entry("alpha", "slack chat bridge", ""),
                entry("mid", "slack chat bridge", "")));

    List<SearchHit> hits = KeywordScorer.rank(catalog, "slack", 10);

    assertEquals(
        List.of("slack", "zeta", "alpha", "mid"),
        hits.stream().map(h -> h.entry().name()).toList());
    assertEquals(hits.get(1).score(), hits.get(3).score());
    assertEquals(hits, KeywordScorer.rank(catalog, "slack", 10));
  }
}
