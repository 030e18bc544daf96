package com.gentoro.mcpindex.http;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mcpindex.testing.StubHttp;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OkHttpFactoryTest {

  @Test
  @DisplayName("timeouts come from configuration and default when absent")
  void timeouts() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("http.client.connect-timeout", "PT2S");

    OkHttpClient client = OkHttpFactory.create(config);

    assertEquals(2_000, client.connectTimeoutMillis());
    assertEquals(30_000, client.readTimeoutMillis());
    assertEquals(60_000, client.callTimeoutMillis());
    assertTrue(client.followRedirects());
  }

  @Test
  @DisplayName("extra interceptors are installed ahead of request logging")
  void extraInterceptors() throws Exception {
    StubHttp stub = new StubHttp().respond("https://example.org/a", "hello");
    OkHttpClient client = OkHttpFactory.create(new BaseConfiguration(), stub);

    Request request = new Request.Builder().url("https://example.org/a").build();
    try (Response response = client.newCall(request).execute()) {
      assertEquals(200, response.code());
      assertEquals("hello", response.body().string());
    }
    assertEquals(2, client.interceptors().size());
    assertInstanceOf(LoggingInterceptor.class, client.interceptors().get(1));
  }
}
