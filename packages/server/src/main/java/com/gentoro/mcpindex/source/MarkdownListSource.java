package com.gentoro.mcpindex.source;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Base class for listings written as markdown bullet lists grouped under headings.
 *
 * <p>Subclasses decide how headings map to categories and how a bullet row becomes an entry. The
 * walk itself, and the policy that bullets outside any category are ignored, live here.
 */
public abstract class MarkdownListSource implements ServerSource {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(MarkdownListSource.class);

  private final OkHttpClient httpClient;
  private final String url;
  private final String baseUrl;

  protected MarkdownListSource(OkHttpClient httpClient, String url, String baseUrl) {
    this.httpClient = httpClient;
    this.url = Objects.requireNonNull(url, "url");
    this.baseUrl = baseUrl;
  }

  @Override
  public String url() {
    return url;
  }

  /** Base used to resolve relative links found in the listing. */
  public String baseUrl() {
    return baseUrl;
  }

  @Override
  public String fetch() throws IOException {
    if (httpClient == null) {
      throw new IOException("No HTTP client configured for source " + id());
    }
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new IOException("HTTP %d fetching %s".formatted(response.code(), url));
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new IOException("Empty body fetching " + url);
      }
      return body.string();
    }
  }

  @Override
  public SourceParseResult parse(String content) {
    List<RowOutcome> outcomes = new ArrayList<>();
    if (content == null) {
      return new SourceParseResult(id(), outcomes);
    }
    String category = null;
    String[] lines = content.split("\\r?\\n", -1);
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].strip();
      int level = MarkdownText.headingLevel(line);
      if (level > 0) {
        category = categoryForHeading(level, MarkdownText.headingText(line), category);
        continue;
      }
      if (category == null || !line.startsWith("- ")) {
        continue;
      }
      RowOutcome outcome;
      try {
        outcome = parseRow(i + 1, line, category);
      } catch (RuntimeException e) {
        outcome = RowOutcome.skipped(i + 1, "unexpected error: " + e.getMessage());
      }
      if (!outcome.isParsed()) {
        log.trace("{}: skipped line {}: {}", id(), outcome.lineNumber(), outcome.reason());
      }
      outcomes.add(outcome);
    }
    SourceParseResult result = new SourceParseResult(id(), outcomes);
    log.debug(
        "{}: parsed {} entries, skipped {} rows",
        id(),
        result.parsedCount(),
        result.skipped().size());
    return result;
  }

  /**
   * Category in effect after a heading.
   *
   * @param level heading level (1 to 6)
   * @param headingText heading text without the leading hashes
   * @param current category in effect before the heading, possibly {@code null}
   * @return the new category, or {@code null} when rows below the heading are not servers
   */
  protected abstract String categoryForHeading(int level, String headingText, String current);

  /** Turn one bullet row ({@code "- ..."}) into an outcome. */
  protected abstract RowOutcome parseRow(int lineNumber, String line, String category);

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id() + ", url=" + url + '}';
  }
}
