package com.gentoro.mcpindex.actuator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.mcpindex.catalog.Catalog;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.database.CatalogDatabase;
import com.gentoro.mcpindex.database.CatalogOrigin;
import com.gentoro.mcpindex.database.IndexState;
import com.gentoro.mcpindex.search.SemanticSearchEngine;
import com.gentoro.mcpindex.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ActuatorServiceTest {

  @Mock private CatalogDatabase database;
  @Mock private HttpServletRequest request;
  @Mock private HttpServletResponse response;

  private StringWriter body;

  @BeforeEach
  void setUp() throws Exception {
    body = new StringWriter();
    when(response.getWriter()).thenReturn(new PrintWriter(body));
  }

  @Test
  @DisplayName("health is UP with entry count once a catalog is loaded")
  void healthUp() throws Exception {
    Catalog catalog =
        Catalog.of(
            List.of(new CatalogEntry("a", "b", "https://example.org/a", "", "official")));
    IndexState state =
        new IndexState(
            catalog, SemanticSearchEngine.lexical(catalog), CatalogOrigin.LIVE, Instant.now(), "h");
    when(database.isReady()).thenReturn(true);
    when(database.state()).thenReturn(Optional.of(state));

    new ActuatorService.HealthServlet(database).doGet(request, response);

    verify(response).setStatus(HttpServletResponse.SC_OK);
    verify(response).setContentType("application/json");
    JsonNode json = JacksonUtility.getJsonMapper().readTree(body.toString());
    assertEquals("UP", json.get("status").asText());
    assertEquals(1, json.get("entries").asInt());
    assertEquals("LEXICAL", json.get("searchMode").asText());
  }

  @Test
  @DisplayName("health is DOWN with 503 before a catalog is loaded")
  void healthDown() throws Exception {
    when(database.isReady()).thenReturn(false);
    when(database.state()).thenReturn(Optional.empty());

    new ActuatorService.HealthServlet(database).doGet(request, response);

    verify(response).setStatus(503);
    assertEquals(
        "DOWN", JacksonUtility.getJsonMapper().readTree(body.toString()).get("status").asText());
  }

  @Test
  @DisplayName("info returns the database search info")
  void info() throws Exception {
    when(database.searchInfo()).thenReturn(Map.of("ready", false, "sources", List.of("official")));

    new ActuatorService.InfoServlet(database).doGet(request, response);

    JsonNode json = JacksonUtility.getJsonMapper().readTree(body.toString());
    assertFalse(json.get("ready").asBoolean());
    assertEquals("official", json.get("sources").get(0).asText());
  }
}
