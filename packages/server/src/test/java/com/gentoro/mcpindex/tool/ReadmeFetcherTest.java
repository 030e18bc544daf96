package com.gentoro.mcpindex.tool;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mcpindex.testing.StubHttp;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReadmeFetcherTest {

  private static final String RAW = "https://raw.githubusercontent.com";

  @Test
  @DisplayName("repository urls map to main then master README candidates")
  void repositoryCandidates() {
    List<String> urls = ReadmeFetcher.candidateUrls("https://github.com/acme/weather.git/");

    assertEquals(8, urls.size());
    assertEquals(RAW + "/acme/weather/main/README.md", urls.get(0));
    assertEquals(RAW + "/acme/weather/master/README.md", urls.get(4));
  }

  @Test
  @DisplayName("tree urls keep their branch and sub-directory")
  void treeCandidates() {
    List<String> urls =
        ReadmeFetcher.candidateUrls(
            "https://github.com/modelcontextprotocol/servers/tree/main/src/everything");

    assertEquals(4, urls.size());
    assertEquals(
        RAW + "/modelcontextprotocol/servers/main/src/everything/README.md", urls.get(0));
  }

  @Test
  @DisplayName("non-GitHub and owner-only urls have no candidates")
  void nonGithub() {
    assertTrue(ReadmeFetcher.candidateUrls("https://gitlab.com/acme/weather").isEmpty());
    assertTrue(ReadmeFetcher.candidateUrls("https://github.com/acme").isEmpty());
    assertTrue(ReadmeFetcher.candidateUrls("not a url").isEmpty());
    assertTrue(ReadmeFetcher.candidateUrls(null).isEmpty());
  }

  @Test
  @DisplayName("falls back to the master branch when main has no README")
  void masterFallback() {
    StubHttp http = new StubHttp().respond(RAW + "/acme/weather/master/README.md", "# Weather");

    Optional<String> readme =
        new ReadmeFetcher(http.client(), 1000).fetch("https://github.com/acme/weather");

    assertEquals(Optional.of("# Weather"), readme);
    assertEquals(5, http.requested().size());
  }

  @Test
  @DisplayName("long READMEs are truncated with a marker")
  void truncation() {
    StubHttp http =
        new StubHttp().respond(RAW + "/acme/weather/main/README.md", "x".repeat(50));

    String readme =
        new ReadmeFetcher(http.client(), 10).fetch("https://github.com/acme/weather").orElseThrow();

    assertEquals("x".repeat(10) + ReadmeFetcher.TRUNCATION_MARKER, readme);
  }

  @Test
  @DisplayName("nothing found anywhere yields empty without requests for non-GitHub urls")
  void notFound() {
    StubHttp http = new StubHttp();
    ReadmeFetcher fetcher = new ReadmeFetcher(http.client(), 1000);

    assertTrue(fetcher.fetch("https://github.com/acme/weather").isEmpty());
    assertEquals(8, http.requested().size());
    assertTrue(fetcher.fetch("https://example.org/x").isEmpty());
    assertEquals(8, http.requested().size());
  }
}
