package com.gentoro.mcpindex.source;

import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.ast.TextCollectingVisitor;
import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;

/** Text clean-up shared by the markdown listing parsers. */
final class MarkdownText {

  private static final Pattern HTML_IMG = Pattern.compile("<img[^>]*?>", Pattern.CASE_INSENSITIVE);
  private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
  private static final Pattern MD_IMAGE = Pattern.compile("!\\[[^\\]]*]\\([^)]*\\)");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern SYMBOLS =
      Pattern.compile("[\\p{So}\\p{Sk}\\p{Cs}\\x{FE0F}\\x{200D}]");
  private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile("\\s*\\(.*\\)\\s*$");
  private static final Pattern NON_SLUG =
      Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s\\-–—:|]+");

  private static final Parser PARSER = Parser.builder().build();

  private MarkdownText() {}

  static String stripImages(String line) {
    String out = HTML_IMG.matcher(line).replaceAll("");
    return MD_IMAGE.matcher(out).replaceAll("");
  }

  static String normalizeWhitespace(String text) {
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  static String stripSymbols(String text) {
    return SYMBOLS.matcher(text).replaceAll("");
  }

  /** Drop dashes and similar separators between a link and its description. */
  static String stripLeadingSeparators(String text) {
    return LEADING_SEPARATORS.matcher(text).replaceAll("");
  }

  /** Render inline markdown (emphasis, links, code) as plain text. */
  static String toPlainText(String markdown) {
    if (markdown == null || markdown.isBlank()) {
      return "";
    }
    Node document = PARSER.parse(markdown);
    String text = new TextCollectingVisitor().collectAndGetText(document);
    return normalizeWhitespace(text);
  }

  /**
   * Heading text to category slug: drops markup, emoji, a trailing parenthetical and punctuation,
   * then lower-cases and hyphenates ("🔗 Aggregators (3)" becomes "aggregators").
   */
  static String slug(String headingText) {
    String text = stripSymbols(HTML_TAG.matcher(headingText).replaceAll(""));
    text = TRAILING_PARENTHETICAL.matcher(text).replaceAll("");
    text = NON_SLUG.matcher(text).replaceAll("");
    return WHITESPACE.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
  }

  /** Heading level ({@code ## x} is 2), or 0 when the line is not an ATX heading. */
  static int headingLevel(String line) {
    int level = 0;
    while (level < line.length() && line.charAt(level) == '#') {
      level++;
    }
    if (level == 0 || level > 6) {
      return 0;
    }
    return level == line.length() || Character.isWhitespace(line.charAt(level)) ? level : 0;
  }

  static String headingText(String line) {
    return line.substring(headingLevel(line)).trim();
  }

  /**
   * Resolve {@code href} against {@code baseUrl} when it is relative.
   *
   * @return absolute http(s) url, or {@code null} when it cannot be resolved
   */
  static String resolveUrl(String baseUrl, String href) {
    String target = href.trim();
    if (target.startsWith("http://") || target.startsWith("https://")) {
      return target;
    }
    if (baseUrl == null || baseUrl.isBlank() || target.startsWith("#")) {
      return null;
    }
    try {
      String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
      String relative = target.startsWith("./") ? target.substring(2) : target;
      URI resolved = URI.create(base).resolve(relative);
      String scheme = resolved.getScheme();
      return "http".equals(scheme) || "https".equals(scheme) ? resolved.toString() : null;
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
