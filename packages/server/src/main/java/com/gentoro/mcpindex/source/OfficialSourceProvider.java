package com.gentoro.mcpindex.source;

import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

public class OfficialSourceProvider implements ServerSourceProvider {
  @Override
  public String sourceId() {
    return OfficialServersSource.ID;
  }

  @Override
  public ServerSource create(OkHttpClient httpClient, Configuration subConfiguration) {
    return new OfficialServersSource(
        httpClient,
        subConfiguration.getString("url", OfficialServersSource.DEFAULT_URL),
        subConfiguration.getString("base-url", OfficialServersSource.DEFAULT_BASE_URL));
  }
}
