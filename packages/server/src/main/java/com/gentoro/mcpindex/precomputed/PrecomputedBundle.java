package com.gentoro.mcpindex.precomputed;

import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.EmbeddingMatrix;

/** A validated bundle: catalog and embeddings aligned row for row. */
public record PrecomputedBundle(
    DataInfo info, Catalog catalog, EmbeddingMatrix embeddings, String contentHash) {}
