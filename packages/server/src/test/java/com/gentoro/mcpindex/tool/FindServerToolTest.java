package com.gentoro.mcpindex.tool;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.database.CatalogDatabase;
import com.gentoro.mcpindex.exception.CatalogUnavailableException;
import com.gentoro.mcpindex.search.SearchHit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FindServerToolTest {

  @Mock private CatalogDatabase database;
  @Mock private ReadmeFetcher readmeFetcher;

  private static List<SearchHit> hits(double... scores) {
    List<SearchHit> out = new ArrayList<>();
    for (int i = 0; i < scores.length; i++) {
      CatalogEntry entry =
          new CatalogEntry(
              "server-" + i, "Server " + i, "https://github.com/o/server-" + i, "", "official");
      out.add(new SearchHit(entry, scores[i], i));
    }
    return out;
  }

  private FindServerTool tool(int lookahead) {
    return new FindServerTool(
        database, readmeFetcher, new ToolSettings(lookahead, 0.9, 3, 20_000));
  }

  @Test
  @DisplayName("top hit with a README is returned with up to three alternatives")
  void topHitWithReadme() {
    when(database.search("weather")).thenReturn(hits(0.9, 0.8, 0.7, 0.6, 0.5));
    when(readmeFetcher.fetch("https://github.com/o/server-0")).thenReturn(Optional.of("# S0"));

    FindServerResult result = tool(4).find("weather", null);

    assertEquals(FindServerResult.FOUND, result.status());
    assertEquals("server-0", result.server().name());
    assertEquals("# S0", result.server().readme());
    assertEquals(
        List.of("server-1", "server-2", "server-3"),
        result.alternatives().stream().map(ServerView::name).toList());
    assertTrue(result.alternatives().stream().allMatch(a -> a.readme() == null));
    verify(readmeFetcher, times(1)).fetch(anyString());
  }

  @Test
  @DisplayName("a close runner-up with a README is promoted over a top hit without one")
  void promotesCloseRunnerUp() {
    when(database.search("weather")).thenReturn(hits(0.80, 0.75, 0.5));
    when(readmeFetcher.fetch("https://github.com/o/server-1")).thenReturn(Optional.of("# S1"));

    FindServerResult result = tool(4).find("weather", null);

    assertEquals("server-1", result.server().name());
    assertEquals("# S1", result.server().readme());
    assertEquals(
        List.of("server-0", "server-2"),
        result.alternatives().stream().map(ServerView::name).toList());
  }

  @Test
  @DisplayName("a runner-up scoring well below the top is never promoted")
  void noPromotionBelowRatio() {
    when(database.search("weather")).thenReturn(hits(0.80, 0.40));

    FindServerResult result = tool(4).find("weather", null);

    assertEquals("server-0", result.server().name());
    assertNull(result.server().readme());
    verify(readmeFetcher, never()).fetch("https://github.com/o/server-1");
  }

  @Test
  @DisplayName("only hits inside the lookahead window are considered for promotion")
  void lookaheadWindow() {
    when(database.search("weather")).thenReturn(hits(0.80, 0.79, 0.78));

    FindServerResult result = tool(2).find("weather", null);

    assertEquals("server-0", result.server().name());
    verify(readmeFetcher).fetch("https://github.com/o/server-1");
    verify(readmeFetcher, never()).fetch("https://github.com/o/server-2");
  }

  @Test
  @DisplayName("the example question is tried when the description alone finds nothing")
  void retriesWithExampleQuestion() {
    when(database.search("forecasts")).thenReturn(List.of());
    when(database.search("forecasts will it rain tomorrow")).thenReturn(hits(0.5));

    FindServerResult result = tool(4).find("forecasts", "will it rain tomorrow");

    assertEquals(FindServerResult.FOUND, result.status());
    assertTrue(result.alternatives().isEmpty());
  }

  @Test
  @DisplayName("no hits yields not_found with suggestions")
  void notFound() {
    when(database.search("quantum teleport")).thenReturn(List.of());

    FindServerResult result = tool(4).find("quantum teleport", " ");

    assertEquals(FindServerResult.NOT_FOUND, result.status());
    assertTrue(result.message().contains("quantum teleport"));
    assertEquals(FindServerResult.DEFAULT_SUGGESTIONS, result.suggestions());
    verify(database, times(1)).search(anyString());
  }

  @Test
  @DisplayName("an unavailable catalog and a blank description are errors")
  void errors() {
    when(database.search("weather")).thenThrow(new CatalogUnavailableException("not loaded"));

    FindServerResult unavailable = tool(4).find("weather", null);
    assertEquals(FindServerResult.ERROR, unavailable.status());
    assertTrue(unavailable.message().contains("not loaded"));

    FindServerResult blank = tool(4).find("  ", null);
    assertEquals(FindServerResult.ERROR, blank.status());
    verify(database).search("weather");
    verifyNoMoreInteractions(database);
  }
}
