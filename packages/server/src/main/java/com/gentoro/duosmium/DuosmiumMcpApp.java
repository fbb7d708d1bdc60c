package com.gentoro.duosmium;

public class DuosmiumMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(DuosmiumMcpApp.class);

  public static void main(String[] args) {
    DuosmiumMcp app;
    try {
      app = new DuosmiumMcp(args);
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
      return;
    }
    if (app.isServerMode()) {
      app.waitShutdownSignal();
    } else {
      System.exit(app.exitCode() == 0 ? 0 : 2);
    }
  }
}
