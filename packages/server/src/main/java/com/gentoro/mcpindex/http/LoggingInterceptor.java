package com.gentoro.mcpindex.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Logs outgoing requests and their outcome. Bodies are listings and archives, so never logged. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("➡️ {} {}", request.method(), request.url());

    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      log.debug("❌ {} failed: {}", request.url(), e.getMessage());
      throw e;
    }

    long endTime = System.nanoTime();
    log.debug(
        "⬅️ {} for {} in {} ms ({} bytes)",
        response.code(),
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.body() == null ? -1 : response.body().contentLength());
    return response;
  }
}
