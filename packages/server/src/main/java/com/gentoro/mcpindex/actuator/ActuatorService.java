package com.gentoro.mcpindex.actuator;

import com.gentoro.mcpindex.McpIndex;
import com.gentoro.mcpindex.database.CatalogDatabase;
import com.gentoro.mcpindex.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health and info endpoints in the style of Spring Boot's actuator.
 *
 * <ul>
 *   <li>{@code /actuator/health}: {@code {"status":"UP"}} once a catalog is loaded, otherwise
 *       {@code DOWN} with status 503
 *   <li>{@code /actuator/info}: catalog origin, search mode and cache details
 * </ul>
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(ActuatorService.class);

  public static final String HEALTH_PATH = "/actuator/health";
  public static final String INFO_PATH = "/actuator/info";

  private final McpIndex mcpIndex;

  public ActuatorService(McpIndex mcpIndex) {
    this.mcpIndex = mcpIndex;
  }

  /** Register the actuator servlets with the shared Jetty context handler. */
  public void register() {
    CatalogDatabase database = mcpIndex.catalogDatabase();
    var context = mcpIndex.httpServer().getContextHandler();
    context.addServlet(new ServletHolder(new HealthServlet(database)), HEALTH_PATH);
    context.addServlet(new ServletHolder(new InfoServlet(database)), INFO_PATH);
    log.info("Actuator endpoints registered at {} and {}", HEALTH_PATH, INFO_PATH);
  }

  static class HealthServlet extends HttpServlet {
    private final transient CatalogDatabase database;

    HealthServlet(CatalogDatabase database) {
      this.database = database;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      boolean ready = database.isReady();
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("status", ready ? "UP" : "DOWN");
      database
          .state()
          .ifPresent(
              state -> {
                payload.put("entries", state.catalog().entryCount());
                payload.put("searchMode", state.engine().mode().name());
              });
      writeJson(resp, ready ? HttpServletResponse.SC_OK : 503, payload);
    }
  }

  static class InfoServlet extends HttpServlet {
    private final transient CatalogDatabase database;

    InfoServlet(CatalogDatabase database) {
      this.database = database;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      writeJson(resp, HttpServletResponse.SC_OK, database.searchInfo());
    }
  }

  private static void writeJson(HttpServletResponse resp, int status, Object payload)
      throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    try (PrintWriter out = resp.getWriter()) {
      out.println(JacksonUtility.toJson(payload));
    }
  }
}
