package com.gentoro.mcpindex.source;

import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable server listings.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; register them in {@code
 * META-INF/services/com.gentoro.mcpindex.source.ServerSourceProvider}. Each provider is matched
 * against the {@code catalog.sources.<id>} configuration block by its {@code sourceId}.
 */
public interface ServerSourceProvider {

  /** A stable, lowercase identifier (e.g. "official"). */
  String sourceId();

  /**
   * Creates a configured source.
   *
   * @param httpClient shared client used to download the listing
   * @param subConfiguration source-specific subset (e.g. {@code catalog.sources.official.*}); keys
   *     {@code url} and {@code base-url} override the built-in locations
   */
  ServerSource create(OkHttpClient httpClient, Configuration subConfiguration);
}
