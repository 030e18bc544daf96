package com.gentoro.mcpindex.cache;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * On-disk layout of the local cache.
 *
 * <pre>
 *   &lt;root&gt;/mcp-index/servers/server_list.json
 *   &lt;root&gt;/mcp-index/embeddings/embeddings_&lt;hash&gt;.npy
 * </pre>
 *
 * The root is {@code cache.root} when configured, else {@code $XDG_CACHE_HOME}, else {@code
 * ~/.cache}.
 */
public record CacheDirectories(Path base) {

  public static final String NAMESPACE = "mcp-index";

  public CacheDirectories {
    Objects.requireNonNull(base, "base");
  }

  public static CacheDirectories fromConfiguration(Configuration configuration) {
    return resolve(
        configuration.getString("cache.root", null),
        System.getenv(),
        Path.of(System.getProperty("user.home")));
  }

  static CacheDirectories resolve(String configuredRoot, Map<String, String> env, Path home) {
    Path root;
    if (configuredRoot != null && !configuredRoot.isBlank()) {
      root = Path.of(configuredRoot.trim());
    } else {
      String xdg = env.get("XDG_CACHE_HOME");
      root = xdg != null && !xdg.isBlank() ? Path.of(xdg.trim()) : home.resolve(".cache");
    }
    return new CacheDirectories(root.resolve(NAMESPACE));
  }

  public Path serversDir() {
    return base.resolve("servers");
  }

  public Path embeddingsDir() {
    return base.resolve("embeddings");
  }
}
