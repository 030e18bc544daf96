package com.gentoro.mcpindex.cache;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** Snapshot of one cache file for diagnostics. {@code age} is null when the file is absent. */
public record CacheInfo(
    Path path, boolean exists, Duration age, long sizeBytes, boolean fresh, Duration ttl) {

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("path", path.toString());
    map.put("exists", exists);
    if (age != null) {
      map.put("ageSeconds", age.toSeconds());
    }
    map.put("sizeBytes", sizeBytes);
    map.put("fresh", fresh);
    map.put("ttlSeconds", ttl.toSeconds());
    return map;
  }
}
