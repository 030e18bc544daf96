package com.gentoro.mcpindex.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Locale;

/**
 * One discoverable MCP server descriptor.
 *
 * @param name short identifier, not unique across sources before deduplication
 * @param description human-curated free text
 * @param url canonical link to the source code or documentation; the deduplication key
 * @param category tag inferred from the listing section the entry was read from
 * @param source provenance label; composite ({@code "a+b"}) after merge
 */
public record CatalogEntry(
    String name, String description, String url, String category, String source) {

  public static final String UNKNOWN_SOURCE = "unknown";

  public static final String CATEGORY_REFERENCE = "reference";
  public static final String CATEGORY_OFFICIAL = "official";
  public static final String CATEGORY_COMMUNITY = "community";
  public static final String CATEGORY_ARCHIVED = "archived";

  public CatalogEntry {
    name = name == null ? "" : name.trim();
    description = description == null ? "" : description.trim();
    url = url == null ? "" : url.trim();
    category = category == null ? "" : category.trim();
    source = source == null || source.isBlank() ? UNKNOWN_SOURCE : source.trim();
  }

  /** Url key used to group entries from different listings. */
  public static String normalizeUrl(String url) {
    if (url == null) {
      return "";
    }
    String key = url.trim().toLowerCase(Locale.ROOT);
    while (key.endsWith("/")) {
      key = key.substring(0, key.length() - 1);
    }
    return key;
  }

  @JsonIgnore
  public String normalizedUrl() {
    return normalizeUrl(url);
  }

  /** Text the embedding model sees for this entry. Must stay in sync with published bundles. */
  @JsonIgnore
  public String embeddingText() {
    return "%s. %s. Category: %s".formatted(name, description, category);
  }

  public CatalogEntry withSource(String newSource) {
    return new CatalogEntry(name, description, url, category, newSource);
  }
}
