package com.gentoro.mcpindex.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Builds the enabled {@link ServerSource}s from configuration.
 *
 * <p>Every {@link ServerSourceProvider} found through {@link ServiceLoader} is consulted; its
 * {@code catalog.sources.<id>} block may disable it or override its URLs.
 *
 * <pre>
 *   catalog.sources.official.enabled = true
 *   catalog.sources.punkpeye.url = https://example.org/README.md
 * </pre>
 */
public final class ServerSourceFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(ServerSourceFactory.class);

  private ServerSourceFactory() {}

  public static List<ServerSource> createEnabled(OkHttpClient httpClient, Configuration config) {
    List<ServerSource> sources = new ArrayList<>();
    for (ServerSourceProvider provider : ServiceLoader.load(ServerSourceProvider.class)) {
      String id = provider.sourceId().trim().toLowerCase(Locale.ROOT);
      Configuration subConfig = config.subset("catalog.sources.%s".formatted(id));
      if (!subConfig.getBoolean("enabled", true)) {
        log.info("Server source '{}' disabled by configuration", id);
        continue;
      }
      sources.add(provider.create(httpClient, subConfig));
    }
    log.debug("Enabled server sources: {}", sources.stream().map(ServerSource::id).toList());
    return sources;
  }
}
