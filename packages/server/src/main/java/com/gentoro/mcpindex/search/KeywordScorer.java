package com.gentoro.mcpindex.search;

import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Lexical relevance used when no embedding model is available. */
public final class KeywordScorer {

  static final int EXACT_NAME = 100;
  static final int NAME_SUBSTRING = 50;
  static final int DESCRIPTION_SUBSTRING = 30;
  static final int NAME_WORD = 20;
  static final int DESCRIPTION_WORD = 10;
  static final int NAME_FUZZY = 5;
  static final int DESCRIPTION_FUZZY = 2;
  static final int REFERENCE_BONUS = 5;
  static final int OFFICIAL_BONUS = 3;

  private static final int FUZZY_MIN_LENGTH = 3;

  private KeywordScorer() {}

  public static double score(CatalogEntry entry, String query) {
    String q = query.toLowerCase(Locale.ROOT).trim();
    if (q.isEmpty()) {
      return 0;
    }
    Set<String> queryWords = words(q);
    String name = entry.name().toLowerCase(Locale.ROOT);
    String description = entry.description().toLowerCase(Locale.ROOT);

    double score = 0;
    if (q.equals(name)) {
      score += EXACT_NAME;
    } else if (name.contains(q)) {
      score += NAME_SUBSTRING;
    }
    if (description.contains(q)) {
      score += DESCRIPTION_SUBSTRING;
    }

    Set<String> nameWords = words(name);
    Set<String> descriptionWords = words(description);
    for (String w : queryWords) {
      if (nameWords.contains(w)) score += NAME_WORD;
      if (descriptionWords.contains(w)) score += DESCRIPTION_WORD;
    }

    for (String w : queryWords) {
      if (w.length() < FUZZY_MIN_LENGTH) {
        continue;
      }
      score += NAME_FUZZY * fuzzyMatches(w, nameWords);
      score += DESCRIPTION_FUZZY * fuzzyMatches(w, descriptionWords);
    }

    if (score > 0) {
      if (CatalogEntry.CATEGORY_REFERENCE.equals(entry.category())) {
        score += REFERENCE_BONUS;
      } else if (CatalogEntry.CATEGORY_OFFICIAL.equals(entry.category())) {
        score += OFFICIAL_BONUS;
      }
    }
    return score;
  }

  /** Positive-scoring entries, best first; equal scores keep catalog order. */
  public static List<SearchHit> rank(Catalog catalog, String query, int topK) {
    List<SearchHit> hits = new ArrayList<>();
    if (query == null || query.isBlank()) {
      return hits;
    }
    List<CatalogEntry> entries = catalog.entries();
    for (int i = 0; i < entries.size(); i++) {
      double s = score(entries.get(i), query);
      if (s > 0) {
        hits.add(new SearchHit(entries.get(i), s, i));
      }
    }
    hits.sort(Comparator.comparingDouble(SearchHit::score).reversed());
    return hits.size() > topK ? new ArrayList<>(hits.subList(0, topK)) : hits;
  }

  private static int fuzzyMatches(String queryWord, Set<String> candidates) {
    int matches = 0;
    for (String c : candidates) {
      if (c.length() >= FUZZY_MIN_LENGTH && (c.contains(queryWord) || queryWord.contains(c))) {
        matches++;
      }
    }
    return matches;
  }

  private static Set<String> words(String text) {
    Set<String> out = new LinkedHashSet<>();
    for (String w : text.split("\\s+")) {
      if (!w.isEmpty()) {
        out.add(w);
      }
    }
    return out;
  }
}
