package com.gentoro.mcpindex.http;

import java.time.Duration;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Shared outbound HTTP client. Redirects are followed since release assets answer with a redirect
 * to object storage.
 *
 * <pre>
 *   http.client.connect-timeout = PT10S
 *   http.client.read-timeout    = PT30S
 *   http.client.call-timeout    = PT60S
 * </pre>
 */
public class OkHttpFactory {

  public static OkHttpClient create(Configuration config, Interceptor... extraInterceptors) {
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(duration(config, "http.client.connect-timeout", "PT10S"))
            .readTimeout(duration(config, "http.client.read-timeout", "PT30S"))
            .callTimeout(duration(config, "http.client.call-timeout", "PT60S"))
            .followRedirects(true)
            .followSslRedirects(true);
    for (Interceptor interceptor : extraInterceptors) {
      builder.addInterceptor(interceptor);
    }
    return builder.addInterceptor(new LoggingInterceptor()).build();
  }

  private static Duration duration(Configuration config, String key, String defaultValue) {
    return Duration.parse(config.getString(key, defaultValue));
  }
}
