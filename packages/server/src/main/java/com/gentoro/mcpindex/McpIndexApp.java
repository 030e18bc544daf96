package com.gentoro.mcpindex;

public class McpIndexApp {

  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(McpIndexApp.class);

  public static void main(String[] args) {
    McpIndex app;
    try {
      app = new McpIndex(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(StartupParameters.usage());
      System.exit(2);
      return;
    }
    try {
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      app.shutdown();
      System.exit(1);
      return;
    }
    if (StartupParameters.MODE_SERVER.equals(app.startupParameters().mode())) {
      app.waitShutdownSignal();
    }
  }
}
