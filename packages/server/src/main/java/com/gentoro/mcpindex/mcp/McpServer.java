package com.gentoro.mcpindex.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.mcpindex.McpIndex;
import com.gentoro.mcpindex.exception.ExceptionUtil;
import com.gentoro.mcpindex.tool.FindServerResult;
import com.gentoro.mcpindex.tool.FindServerTool;
import com.gentoro.mcpindex.utility.JacksonUtility;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Exposes {@link FindServerTool} over the MCP Streamable HTTP transport.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) servlet path; default "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) reject HTTP DELETE; default false
 *   <li><b>http.mcp.server.name</b> (string) name reported to clients; default "mcp-index"
 *   <li><b>http.mcp.server.version</b> (string) version reported to clients; default "1.0.0"
 * </ul>
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(McpServer.class);

  static final String ARG_DESCRIPTION = "description";
  static final String ARG_EXAMPLE_QUESTION = "example_question";

  private final McpIndex mcpIndex;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(McpIndex mcpIndex) {
    this.mcpIndex = mcpIndex;
  }

  /** Register the MCP servlet on the shared Jetty context without managing its lifecycle. */
  public void register() {
    Configuration cfg = mcpIndex.configuration();
    String endpoint = normalizeEndpoint(cfg.getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = cfg.getBoolean("http.mcp.disallow-delete", false);
    String serverName = cfg.getString("http.mcp.server.name", "mcp-index");
    String serverVersion = cfg.getString("http.mcp.server.version", "1.0.0");

    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    FindServerTool tool = mcpIndex.findServerTool();
    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(
                McpServerFeatures.SyncToolSpecification.builder()
                    .tool(
                        McpSchema.Tool.builder()
                            .name(FindServerTool.NAME)
                            .description(FindServerTool.DESCRIPTION)
                            .inputSchema(inputSchema())
                            .build())
                    .callHandler((srv, request) -> handleCall(tool, request.arguments()))
                    .build())
            .build();

    mcpIndex
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(servletTransport), endpoint);

    log.info(
        "MCP servlet registered at http://localhost:{}{}",
        mcpIndex.httpServer().getPort(),
        endpoint);
  }

  static McpSchema.JsonSchema inputSchema() {
    return new McpSchema.JsonSchema(
        "object",
        Map.of(
            ARG_DESCRIPTION,
            Map.of(
                "type",
                "string",
                "description",
                "Natural language description of the capability you need"),
            ARG_EXAMPLE_QUESTION,
            Map.of(
                "type",
                "string",
                "description",
                "Optional example of a question the server should be able to answer")),
        List.of(ARG_DESCRIPTION),
        false,
        Collections.emptyMap(),
        Collections.emptyMap());
  }

  static McpSchema.CallToolResult handleCall(FindServerTool tool, Map<String, Object> arguments) {
    try {
      Map<String, Object> args = Objects.requireNonNullElse(arguments, Map.of());
      String description = stringArgument(args, ARG_DESCRIPTION);
      FindServerResult result =
          tool.find(description, stringArgument(args, ARG_EXAMPLE_QUESTION));
      log.info(
          "{} '{}' -> {}",
          FindServerTool.NAME,
          description,
          result.server() != null ? result.server().name() : result.status());
      return new McpSchema.CallToolResult(
          JacksonUtility.toJson(result), FindServerResult.ERROR.equals(result.status()));
    } catch (Exception e) {
      log.error("Failed to handle MCP tool request", e);
      return new McpSchema.CallToolResult(
          Objects.requireNonNullElse(e.getMessage(), ExceptionUtil.formatCompactStackTrace(e)),
          true);
    }
  }

  private static String stringArgument(Map<String, Object> args, String name) {
    Object value = args.get(name);
    return value == null ? null : value.toString();
  }

  /** Clean up MCP transport/resources. */
  @Override
  public void close() {
    if (servletTransport != null) {
      try {
        servletTransport.destroy();
      } finally {
        servletTransport = null;
      }
    }
    mcpServer = null;
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
