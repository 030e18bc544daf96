package com.gentoro.mcpindex.database;

import com.gentoro.mcpindex.catalog.CatalogEntry;
import java.util.List;

/**
 * Outcome of fetching every configured source once.
 *
 * @param entries deduplicated entries in aggregation order
 * @param rawCount entries parsed before deduplication
 * @param failures one line per source that failed, timed out or produced nothing
 */
public record LiveFetchResult(List<CatalogEntry> entries, int rawCount, List<String> failures) {

  public LiveFetchResult {
    entries = List.copyOf(entries);
    failures = List.copyOf(failures);
  }

  public boolean partial() {
    return !failures.isEmpty();
  }
}
