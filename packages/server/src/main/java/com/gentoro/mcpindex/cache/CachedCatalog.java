package com.gentoro.mcpindex.cache;

import com.gentoro.mcpindex.catalog.Catalog;
import java.time.Duration;

/**
 * A catalog read back from the cache.
 *
 * @param catalog the entries with their original retrieval time
 * @param age time since the catalog was written
 * @param stale whether {@code age} exceeds the configured TTL
 * @param contentHash hash recorded at write time, or {@code null} for legacy files
 */
public record CachedCatalog(Catalog catalog, Duration age, boolean stale, String contentHash) {}
