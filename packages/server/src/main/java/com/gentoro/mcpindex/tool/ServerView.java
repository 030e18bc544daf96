package com.gentoro.mcpindex.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gentoro.mcpindex.catalog.CatalogEntry;

/** An entry as presented to tool callers. {@code readme} is always serialized, null or not. */
public record ServerView(
    String name,
    String description,
    String url,
    String category,
    String source,
    @JsonInclude(JsonInclude.Include.ALWAYS) String readme) {

  public static ServerView of(CatalogEntry entry, String readme) {
    return new ServerView(
        entry.name(), entry.description(), entry.url(), entry.category(), entry.source(), readme);
  }
}
