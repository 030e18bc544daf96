package com.gentoro.mcpindex.publish;

import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.catalog.EmbeddingMatrix;
import com.gentoro.mcpindex.precomputed.DataInfo;
import java.util.List;

/** Whatever could be downloaded of the last published bundle; each part may be missing. */
record PreviousRelease(List<CatalogEntry> entries, EmbeddingMatrix embeddings, DataInfo info) {

  static PreviousRelease none() {
    return new PreviousRelease(null, null, null);
  }

  String serversHash() {
    return info == null ? null : info.getServersHash();
  }

  boolean hasReusableEmbeddings() {
    return entries != null && embeddings != null && embeddings.rowCount() > 0;
  }
}
