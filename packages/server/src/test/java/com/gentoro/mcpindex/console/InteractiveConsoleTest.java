package com.gentoro.mcpindex.console;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.mcpindex.McpIndex;
import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.database.CatalogDatabase;
import com.gentoro.mcpindex.database.CatalogOrigin;
import com.gentoro.mcpindex.database.IndexState;
import com.gentoro.mcpindex.exception.CatalogUnavailableException;
import com.gentoro.mcpindex.search.SemanticSearchEngine;
import com.gentoro.mcpindex.tool.FindServerResult;
import com.gentoro.mcpindex.tool.FindServerTool;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InteractiveConsoleTest {

  @Mock private McpIndex mcpIndex;
  @Mock private CatalogDatabase database;
  @Mock private FindServerTool tool;

  private ByteArrayOutputStream output;
  private InteractiveConsole console;

  @BeforeEach
  void setUp() {
    output = new ByteArrayOutputStream();
    console =
        new InteractiveConsole(mcpIndex, new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  private String printed() {
    return output.toString(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("a line with a separator is split into description and example question")
  void findWithExample() {
    when(mcpIndex.findServerTool()).thenReturn(tool);
    when(tool.find("weather data", "will it rain?"))
        .thenReturn(FindServerResult.notFound("weather data"));

    assertTrue(console.handle("  weather data | will it rain?  "));

    assertTrue(printed().contains("\"status\" : \"not_found\""));
  }

  @Test
  @DisplayName("exit words stop the console and blank lines are ignored")
  void exitAndBlank() {
    assertTrue(console.handle("   "));
    assertFalse(console.handle("EXIT"));
    assertFalse(console.handle("quit"));
    assertFalse(console.handle(":q"));
    verifyNoInteractions(mcpIndex);
  }

  @Test
  @DisplayName(":info prints the index description")
  void info() {
    when(mcpIndex.catalogDatabase()).thenReturn(database);
    when(database.searchInfo()).thenReturn(Map.of("ready", true));

    console.handle(":info");

    assertTrue(printed().contains("\"ready\" : true"));
  }

  @Test
  @DisplayName(":refresh forces a live rebuild and survives a failure")
  void refresh() {
    Catalog catalog =
        Catalog.of(List.of(new CatalogEntry("a", "b", "https://example.org/a", "", "x")));
    IndexState state =
        new IndexState(
            catalog, SemanticSearchEngine.lexical(catalog), CatalogOrigin.LIVE, Instant.now(), "h");
    when(mcpIndex.catalogDatabase()).thenReturn(database);
    when(database.refresh(true))
        .thenReturn(state)
        .thenThrow(new CatalogUnavailableException("all sources failed"));

    assertTrue(console.handle(":refresh"));
    assertTrue(console.handle(":refresh"));

    verify(database, times(2)).refresh(true);
  }

  @Test
  @DisplayName("run reads lines until exit")
  void run() {
    when(mcpIndex.findServerTool()).thenReturn(tool);
    when(tool.find("git", null)).thenReturn(FindServerResult.error("catalog unavailable"));

    byte[] input = "git\nexit\nnever read\n".getBytes(StandardCharsets.UTF_8);
    console.run(new ByteArrayInputStream(input));

    verify(tool, times(1)).find(anyString(), any());
    assertTrue(printed().contains("Goodbye!"));
  }
}
