package com.gentoro.mcpindex.source;

import com.gentoro.mcpindex.catalog.CatalogEntry;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.OkHttpClient;

/**
 * The {@code modelcontextprotocol/servers} README.
 *
 * <p>Only four sections hold servers; each maps to a fixed category. Any other level-2 heading
 * closes the current section so that rows under e.g. "Frameworks" or "Resources" are ignored.
 */
public class OfficialServersSource extends MarkdownListSource {

  public static final String ID = "official";
  public static final String LABEL = "official";
  public static final String DEFAULT_URL =
      "https://raw.githubusercontent.com/modelcontextprotocol/servers/main/README.md";
  public static final String DEFAULT_BASE_URL =
      "https://github.com/modelcontextprotocol/servers/tree/main/";

  private static final Map<String, String> SECTION_CATEGORIES =
      Map.of(
          "reference-servers", CatalogEntry.CATEGORY_REFERENCE,
          "archived", CatalogEntry.CATEGORY_ARCHIVED,
          "official-integrations", CatalogEntry.CATEGORY_OFFICIAL,
          "community-servers", CatalogEntry.CATEGORY_COMMUNITY);

  private static final Pattern ROW =
      Pattern.compile("-\\s*\\*\\*\\[([^\\]]+)]\\(([^)]+)\\)\\*\\*\\s*-\\s*(.+)");

  public OfficialServersSource(OkHttpClient httpClient) {
    this(httpClient, DEFAULT_URL, DEFAULT_BASE_URL);
  }

  public OfficialServersSource(OkHttpClient httpClient, String url, String baseUrl) {
    super(httpClient, url, baseUrl);
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String name() {
    return "Official MCP Servers";
  }

  @Override
  public String label() {
    return LABEL;
  }

  @Override
  protected String categoryForHeading(int level, String headingText, String current) {
    String known = SECTION_CATEGORIES.get(MarkdownText.slug(headingText));
    if (known != null) {
      return known;
    }
    return level <= 2 ? null : current;
  }

  @Override
  protected RowOutcome parseRow(int lineNumber, String line, String category) {
    String clean = MarkdownText.normalizeWhitespace(MarkdownText.stripImages(line));
    Matcher m = ROW.matcher(clean);
    if (!m.find()) {
      return RowOutcome.skipped(lineNumber, "row does not match '- **[name](url)** - description'");
    }
    String url = MarkdownText.resolveUrl(baseUrl(), m.group(2));
    if (url == null) {
      return RowOutcome.skipped(lineNumber, "unresolvable link: " + m.group(2));
    }
    String name = MarkdownText.toPlainText(m.group(1));
    String description = MarkdownText.toPlainText(m.group(3));
    if (name.isEmpty()) {
      return RowOutcome.skipped(lineNumber, "empty name");
    }
    return RowOutcome.parsed(
        lineNumber, new CatalogEntry(name, description, url, category, label()));
  }
}
