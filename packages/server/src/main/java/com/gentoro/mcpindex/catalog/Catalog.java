package com.gentoro.mcpindex.catalog;

import com.gentoro.mcpindex.exception.ValidationException;
import com.gentoro.mcpindex.schema.SchemaVersion;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, deduplicated collection of entries at a point in time. Instances are immutable; a
 * refresh produces a new catalog.
 */
public final class Catalog {
  private final List<CatalogEntry> entries;
  private final Instant retrievedAt;
  private final SchemaVersion schemaVersion;

  public Catalog(List<CatalogEntry> entries, Instant retrievedAt, SchemaVersion schemaVersion) {
    Objects.requireNonNull(entries, "entries");
    this.entries = List.copyOf(entries);
    this.retrievedAt = Objects.requireNonNull(retrievedAt, "retrievedAt");
    this.schemaVersion = Objects.requireNonNull(schemaVersion, "schemaVersion");

    // same key as CatalogAggregator
    Set<String> urls = new HashSet<>();
    for (CatalogEntry entry : this.entries) {
      if (!urls.add(entry.normalizedUrl())) {
        throw new ValidationException(
            "Duplicate url in catalog: " + entry.url(), Map.of("url", entry.url()));
      }
    }
  }

  public static Catalog of(List<CatalogEntry> entries) {
    return new Catalog(entries, Instant.now(), SchemaVersion.CURRENT);
  }

  public List<CatalogEntry> entries() {
    return entries;
  }

  public CatalogEntry get(int index) {
    return entries.get(index);
  }

  public int entryCount() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public Instant retrievedAt() {
    return retrievedAt;
  }

  public SchemaVersion schemaVersion() {
    return schemaVersion;
  }

  @Override
  public String toString() {
    return "Catalog{entryCount="
        + entries.size()
        + ", retrievedAt="
        + retrievedAt
        + ", schemaVersion="
        + schemaVersion
        + '}';
  }
}
