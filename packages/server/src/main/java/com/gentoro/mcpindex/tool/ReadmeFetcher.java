package com.gentoro.mcpindex.tool;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Fetches the README of a GitHub repository (or of a sub-directory given as a {@code /tree/} URL)
 * from {@code raw.githubusercontent.com}. Anything else, and any failure, yields no README.
 */
public class ReadmeFetcher {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(ReadmeFetcher.class);

  static final List<String> FILE_NAMES = List.of("README.md", "README.txt", "README", "readme.md");
  static final List<String> DEFAULT_BRANCHES = List.of("main", "master");
  static final String RAW_BASE = "https://raw.githubusercontent.com";
  static final String TRUNCATION_MARKER = "\n\n[README truncated]";

  private final OkHttpClient httpClient;
  private final int maxChars;

  public ReadmeFetcher(OkHttpClient httpClient, int maxChars) {
    this.httpClient = httpClient;
    this.maxChars = maxChars;
  }

  public Optional<String> fetch(String url) {
    List<String> candidates = candidateUrls(url);
    if (candidates.isEmpty()) {
      log.debug("No README location for non-GitHub url {}", url);
      return Optional.empty();
    }
    for (String candidate : candidates) {
      Request request = new Request.Builder().url(candidate).get().build();
      try (Response response = httpClient.newCall(request).execute()) {
        ResponseBody body = response.body();
        if (response.code() == 200 && body != null) {
          return Optional.of(truncate(body.string()));
        }
      } catch (IOException | RuntimeException e) {
        log.debug("README fetch for {} failed: {}", url, e.getMessage());
        return Optional.empty();
      }
    }
    log.debug("No README found for {}", url);
    return Optional.empty();
  }

  /**
   * Raw-content URLs to try, in order, for a repository URL. Empty when the URL is not a GitHub
   * repository URL.
   */
  static List<String> candidateUrls(String url) {
    List<String> out = new ArrayList<>();
    if (url == null) {
      return out;
    }
    URI uri;
    try {
      uri = URI.create(url.trim());
    } catch (IllegalArgumentException e) {
      return out;
    }
    String host = uri.getHost();
    if (host == null || !(host.equals("github.com") || host.equals("www.github.com"))) {
      return out;
    }
    String path = uri.getPath() == null ? "" : uri.getPath();
    List<String> segments = new ArrayList<>();
    for (String s : path.split("/")) {
      if (!s.isEmpty()) {
        segments.add(s);
      }
    }
    if (segments.size() < 2) {
      return out;
    }
    String owner = segments.get(0);
    String repo = segments.get(1);
    if (repo.endsWith(".git")) {
      repo = repo.substring(0, repo.length() - 4);
    }

    List<String> branches = DEFAULT_BRANCHES;
    String subPath = "";
    if (segments.size() >= 4 && "tree".equals(segments.get(2))) {
      branches = List.of(segments.get(3));
      if (segments.size() > 4) {
        subPath = String.join("/", segments.subList(4, segments.size())) + "/";
      }
    }
    for (String branch : branches) {
      for (String fileName : FILE_NAMES) {
        out.add("%s/%s/%s/%s/%s%s".formatted(RAW_BASE, owner, repo, branch, subPath, fileName));
      }
    }
    return out;
  }

  private String truncate(String content) {
    if (maxChars <= 0 || content.length() <= maxChars) {
      return content;
    }
    return content.substring(0, maxChars) + TRUNCATION_MARKER;
  }
}
