package com.gentoro.mcpindex.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Tool response. Which fields are present depends on {@code status}: {@code found} carries server
 * and alternatives, {@code not_found} a message and suggestions, {@code error} a message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FindServerResult(
    String status,
    ServerView server,
    List<ServerView> alternatives,
    String message,
    List<String> suggestions) {

  public static final String FOUND = "found";
  public static final String NOT_FOUND = "not_found";
  public static final String ERROR = "error";

  static final List<String> DEFAULT_SUGGESTIONS =
      List.of(
          "Describe the capability in more general terms",
          "Mention the service or data source by name",
          "Try a related capability or a synonym");

  public static FindServerResult found(ServerView server, List<ServerView> alternatives) {
    return new FindServerResult(FOUND, server, List.copyOf(alternatives), null, null);
  }

  public static FindServerResult notFound(String description) {
    return new FindServerResult(
        NOT_FOUND,
        null,
        null,
        "No MCP servers found matching '%s'".formatted(description),
        DEFAULT_SUGGESTIONS);
  }

  public static FindServerResult error(String message) {
    return new FindServerResult(ERROR, null, null, message, null);
  }
}
