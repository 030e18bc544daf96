package com.gentoro.mcpindex.source;

import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

public class AppcypherSourceProvider implements ServerSourceProvider {
  @Override
  public String sourceId() {
    return AppcypherAwesomeSource.ID;
  }

  @Override
  public ServerSource create(OkHttpClient httpClient, Configuration subConfiguration) {
    return new AppcypherAwesomeSource(
        httpClient,
        subConfiguration.getString("url", AppcypherAwesomeSource.DEFAULT_URL),
        subConfiguration.getString("base-url", AppcypherAwesomeSource.DEFAULT_BASE_URL));
  }
}
