package com.gentoro.mcpindex.source;

import com.gentoro.mcpindex.catalog.CatalogEntry;
import java.util.Objects;

/**
 * Result of parsing one listing row: either an entry or the reason the row was skipped.
 *
 * @param kind which variant this is
 * @param lineNumber 1-based line in the listing
 * @param entry the parsed entry, only for {@link Kind#PARSED}
 * @param reason why the row was skipped, only for {@link Kind#SKIPPED}
 */
public record RowOutcome(Kind kind, int lineNumber, CatalogEntry entry, String reason) {

  public enum Kind {
    PARSED,
    SKIPPED
  }

  public RowOutcome {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.PARSED && entry == null) {
      throw new IllegalArgumentException("Parsed row requires an entry");
    }
  }

  public static RowOutcome parsed(int lineNumber, CatalogEntry entry) {
    return new RowOutcome(Kind.PARSED, lineNumber, entry, null);
  }

  public static RowOutcome skipped(int lineNumber, String reason) {
    return new RowOutcome(Kind.SKIPPED, lineNumber, null, reason);
  }

  public boolean isParsed() {
    return kind == Kind.PARSED;
  }
}
