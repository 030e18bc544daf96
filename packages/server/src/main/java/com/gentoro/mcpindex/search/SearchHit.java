package com.gentoro.mcpindex.search;

import com.gentoro.mcpindex.catalog.CatalogEntry;

/**
 * @param entry matched entry
 * @param score cosine similarity in semantic mode, keyword points in lexical mode
 * @param index position of the entry in the catalog
 */
public record SearchHit(CatalogEntry entry, double score, int index) {}
