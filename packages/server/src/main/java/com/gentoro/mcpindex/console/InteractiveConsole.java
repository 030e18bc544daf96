package com.gentoro.mcpindex.console;

import com.gentoro.mcpindex.McpIndex;
import com.gentoro.mcpindex.database.IndexState;
import com.gentoro.mcpindex.exception.McpIndexException;
import com.gentoro.mcpindex.tool.FindServerResult;
import com.gentoro.mcpindex.utility.JacksonUtility;
import com.gentoro.mcpindex.utility.StdoutUtility;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Scanner;

/**
 * Line-oriented console over the local index. A plain line is a capability description; {@code
 * description | example question} adds an example. {@code :info}, {@code :refresh} and {@code
 * exit} are commands.
 */
public class InteractiveConsole {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(InteractiveConsole.class);

  static final String EXAMPLE_SEPARATOR = "|";

  private final McpIndex mcpIndex;
  private final PrintStream out;

  public InteractiveConsole(McpIndex mcpIndex) {
    this(mcpIndex, System.out);
  }

  InteractiveConsole(McpIndex mcpIndex, PrintStream out) {
    this.mcpIndex = mcpIndex;
    this.out = out;
  }

  /** Read commands from {@code in} until {@code exit} or end of input. */
  public void run(InputStream in) {
    Scanner scanner = new Scanner(in, StandardCharsets.UTF_8);
    out.println("Describe the capability you need (':help' for commands, 'exit' to quit):");
    while (true) {
      out.print("> ");
      if (!scanner.hasNextLine()) {
        break;
      }
      if (!handle(scanner.nextLine())) {
        out.println("Goodbye!");
        break;
      }
    }
  }

  /**
   * Handle one input line.
   *
   * @return false when the console should stop
   */
  boolean handle(String line) {
    String input = line == null ? "" : line.trim();
    if (input.isEmpty()) {
      return true;
    }
    switch (input.toLowerCase()) {
      case "exit", "quit", ":q" -> {
        return false;
      }
      case ":help" -> out.println(
          "  <description> [| <example question>]  find a server\n"
              + "  :info                                 index and cache details\n"
              + "  :refresh                              fetch all sources again\n"
              + "  exit                                  quit");
      case ":info" -> out.println(JacksonUtility.toJson(mcpIndex.catalogDatabase().searchInfo()));
      case ":refresh" -> refresh();
      default -> find(input);
    }
    return true;
  }

  private void refresh() {
    try {
      IndexState state = mcpIndex.catalogDatabase().refresh(true);
      StdoutUtility.printSuccessLine(
          mcpIndex,
          "Catalog refreshed: %d entries from %s"
              .formatted(state.catalog().entryCount(), state.origin()));
    } catch (McpIndexException e) {
      log.error("Refresh failed", e);
      StdoutUtility.printError(mcpIndex, "Refresh failed, previous catalog kept", e);
    }
  }

  private void find(String input) {
    String description = input;
    String example = null;
    int separator = input.indexOf(EXAMPLE_SEPARATOR);
    if (separator >= 0) {
      description = input.substring(0, separator).trim();
      example = input.substring(separator + 1).trim();
    }
    try {
      FindServerResult result = mcpIndex.findServerTool().find(description, example);
      out.println(JacksonUtility.toJson(result));
    } catch (RuntimeException e) {
      log.error("Error handling query", e);
      StdoutUtility.printError(mcpIndex, "Could not handle query properly", e);
    }
  }
}
