package com.gentoro.mcpindex.source;

import okhttp3.OkHttpClient;

/** {@code appcypher/awesome-mcp-servers}. */
public class AppcypherAwesomeSource extends AwesomeListSource {

  public static final String ID = "appcypher";
  public static final String LABEL = "appcypher-awesome";
  public static final String DEFAULT_URL =
      "https://raw.githubusercontent.com/appcypher/awesome-mcp-servers/main/README.md";
  public static final String DEFAULT_BASE_URL =
      "https://github.com/appcypher/awesome-mcp-servers/blob/main/";

  public AppcypherAwesomeSource(OkHttpClient httpClient) {
    this(httpClient, DEFAULT_URL, DEFAULT_BASE_URL);
  }

  public AppcypherAwesomeSource(OkHttpClient httpClient, String url, String baseUrl) {
    super(httpClient, url, baseUrl);
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String name() {
    return "Appcypher Awesome MCP Servers";
  }

  @Override
  public String label() {
    return LABEL;
  }
}
