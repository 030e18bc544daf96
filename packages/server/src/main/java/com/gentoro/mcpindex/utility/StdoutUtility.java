package com.gentoro.mcpindex.utility;

import com.gentoro.mcpindex.McpIndex;
import com.gentoro.mcpindex.exception.ExceptionUtil;

public class StdoutUtility {
  private static final String green = "\u001B[32m";
  private static final String red = "\u001B[31m";
  private static final String reset = "\u001B[0m";

  public static void printSuccessLine(McpIndex mcpIndex, String message) {
    if (mcpIndex.isConsoleOutputEnabled()) {
      System.out.print("\r✅ ");
      for (String line : message.split("\n")) {
        System.out.printf("%s%s%s%n", green, line, reset);
      }
    }
  }

  public static void printError(McpIndex mcpIndex, String message, Throwable cause) {
    if (mcpIndex.isConsoleOutputEnabled()) {
      System.out.printf("\r❌ %s%s%s%n", red, message, reset);
      if (cause != null) {
        for (String line : ExceptionUtil.formatCompactStackTrace(cause).split("\n")) {
          System.out.printf("  %s%s%s%n", red, line, reset);
        }
      }
    }
  }
}
