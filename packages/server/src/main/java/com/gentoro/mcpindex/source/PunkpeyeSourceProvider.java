package com.gentoro.mcpindex.source;

import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

public class PunkpeyeSourceProvider implements ServerSourceProvider {
  @Override
  public String sourceId() {
    return PunkpeyeAwesomeSource.ID;
  }

  @Override
  public ServerSource create(OkHttpClient httpClient, Configuration subConfiguration) {
    return new PunkpeyeAwesomeSource(
        httpClient,
        subConfiguration.getString("url", PunkpeyeAwesomeSource.DEFAULT_URL),
        subConfiguration.getString("base-url", PunkpeyeAwesomeSource.DEFAULT_BASE_URL));
  }
}
