package com.gentoro.mcprouter;

public class McpRouterApp {

  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(McpRouterApp.class);

  public static void main(String[] args) {
    try {
      McpRouter app = new McpRouter(args);
      app.initialize();
      // Keep the server running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
