package com.gentoro.mcpindex.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the entries produced by all sources of one refresh cycle into a duplicate-free list.
 *
 * <p>Entries are grouped by {@link CatalogEntry#normalizeUrl(String)}. A group keeps the name and
 * url of its first member, joins every distinct description, takes the first non-empty category
 * and concatenates the contributing source labels. Groups are emitted in first-seen order.
 */
public final class CatalogAggregator {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(CatalogAggregator.class);

  public static final String DESCRIPTION_SEPARATOR = "; ";
  public static final String SOURCE_SEPARATOR = "+";

  private CatalogAggregator() {}

  public static List<CatalogEntry> deduplicate(List<CatalogEntry> rawEntries) {
    Map<String, List<CatalogEntry>> groups = new LinkedHashMap<>();
    for (CatalogEntry entry : rawEntries) {
      if (entry.url().isEmpty()) {
        continue;
      }
      groups.computeIfAbsent(entry.normalizedUrl(), k -> new ArrayList<>()).add(entry);
    }

    List<CatalogEntry> merged = new ArrayList<>(groups.size());
    for (List<CatalogEntry> group : groups.values()) {
      merged.add(group.size() == 1 ? group.get(0) : merge(group));
    }
    log.debug(
        "Deduplicated {} raw entries into {} unique entries", rawEntries.size(), merged.size());
    return merged;
  }

  static CatalogEntry merge(List<CatalogEntry> group) {
    CatalogEntry primary = group.get(0);

    Set<String> descriptions = new LinkedHashSet<>();
    Set<String> sources = new LinkedHashSet<>();
    String category = "";
    for (CatalogEntry entry : group) {
      if (!entry.description().isEmpty()) {
        descriptions.add(entry.description());
      }
      for (String label : entry.source().split("\\" + SOURCE_SEPARATOR)) {
        if (!label.isBlank()) {
          sources.add(label.trim());
        }
      }
      if (category.isEmpty() && !entry.category().isEmpty()) {
        category = entry.category();
      }
    }

    log.debug(
        "Merged {} entries for {} from sources: {}", group.size(), primary.name(), sources);
    return new CatalogEntry(
        primary.name(),
        String.join(DESCRIPTION_SEPARATOR, descriptions),
        primary.url(),
        category,
        String.join(SOURCE_SEPARATOR, sources));
  }
}
