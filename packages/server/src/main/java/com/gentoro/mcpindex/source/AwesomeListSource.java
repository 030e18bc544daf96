package com.gentoro.mcpindex.source;

import com.gentoro.mcpindex.catalog.CatalogEntry;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.OkHttpClient;

/**
 * Community "awesome" lists: level-2 headings name the category, rows link a GitHub repository
 * followed by optional badges and a description.
 */
public abstract class AwesomeListSource extends MarkdownListSource {

  private static final Pattern GITHUB_LINK =
      Pattern.compile("\\[([^\\]]+)]\\((https://github\\.com/[^)]+)\\)");

  protected AwesomeListSource(OkHttpClient httpClient, String url, String baseUrl) {
    super(httpClient, url, baseUrl);
  }

  @Override
  protected String categoryForHeading(int level, String headingText, String current) {
    if (level != 2) {
      return current;
    }
    String slug = MarkdownText.slug(headingText);
    return slug.isEmpty() ? null : slug;
  }

  @Override
  protected RowOutcome parseRow(int lineNumber, String line, String category) {
    String content = MarkdownText.stripImages(line.substring(2)).strip();
    Matcher m = GITHUB_LINK.matcher(content);
    if (!m.find()) {
      return RowOutcome.skipped(lineNumber, "no GitHub repository link");
    }
    String name = MarkdownText.toPlainText(m.group(1));
    if (name.isEmpty()) {
      return RowOutcome.skipped(lineNumber, "empty name");
    }
    String tail =
        MarkdownText.normalizeWhitespace(MarkdownText.stripSymbols(content.substring(m.end())));
    String description = MarkdownText.toPlainText(MarkdownText.stripLeadingSeparators(tail));
    if (description.isEmpty()) {
      description = "MCP server for " + category;
    }
    return RowOutcome.parsed(
        lineNumber, new CatalogEntry(name, description, m.group(2), category, label()));
  }
}
