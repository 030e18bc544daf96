package com.gentoro.mcpindex.database;

/** Which tier produced the catalog currently being served. */
public enum CatalogOrigin {
  PRECOMPUTED,
  CACHE,
  LIVE,
  STALE_CACHE
}
