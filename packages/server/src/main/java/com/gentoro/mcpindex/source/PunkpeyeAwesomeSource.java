package com.gentoro.mcpindex.source;

import okhttp3.OkHttpClient;

/** {@code punkpeye/awesome-mcp-servers}. */
public class PunkpeyeAwesomeSource extends AwesomeListSource {

  public static final String ID = "punkpeye";
  public static final String LABEL = "punkpeye-awesome";
  public static final String DEFAULT_URL =
      "https://raw.githubusercontent.com/punkpeye/awesome-mcp-servers/main/README.md";
  public static final String DEFAULT_BASE_URL =
      "https://github.com/punkpeye/awesome-mcp-servers/blob/main/";

  public PunkpeyeAwesomeSource(OkHttpClient httpClient) {
    this(httpClient, DEFAULT_URL, DEFAULT_BASE_URL);
  }

  public PunkpeyeAwesomeSource(OkHttpClient httpClient, String url, String baseUrl) {
    super(httpClient, url, baseUrl);
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String name() {
    return "Punkpeye Awesome MCP Servers";
  }

  @Override
  public String label() {
    return LABEL;
  }
}
