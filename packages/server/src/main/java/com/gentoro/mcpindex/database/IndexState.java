package com.gentoro.mcpindex.database;

import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.search.SemanticSearchEngine;
import java.time.Instant;

/** Everything a query needs, published as one immutable unit. */
public record IndexState(
    Catalog catalog,
    SemanticSearchEngine engine,
    CatalogOrigin origin,
    Instant loadedAt,
    String contentHash) {}
