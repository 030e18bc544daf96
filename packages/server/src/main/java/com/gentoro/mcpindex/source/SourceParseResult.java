package com.gentoro.mcpindex.source;

import com.gentoro.mcpindex.catalog.CatalogEntry;
import java.util.List;

/** Every row outcome a source produced for one listing, in listing order. */
public record SourceParseResult(String sourceId, List<RowOutcome> outcomes) {

  public SourceParseResult {
    outcomes = List.copyOf(outcomes);
  }

  public List<CatalogEntry> entries() {
    return outcomes.stream().filter(RowOutcome::isParsed).map(RowOutcome::entry).toList();
  }

  public List<RowOutcome> skipped() {
    return outcomes.stream().filter(o -> !o.isParsed()).toList();
  }

  public int parsedCount() {
    return (int) outcomes.stream().filter(RowOutcome::isParsed).count();
  }
}
