package com.gentoro.mcprouter.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying log levels from the application
 * configuration.
 */
public final class LoggingService {
  public static final String ROUTER_LOGGER = "com.gentoro.mcprouter";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.root-level} and {@code logging.router-level} to Logback. Unknown level
   * names fall back to INFO; a non-Logback SLF4J binding is left untouched.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    String rootLevel = configuration.getString("logging.root-level", null);
    if (rootLevel != null && !rootLevel.isBlank()) {
      context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(rootLevel, Level.INFO));
    }
    String routerLevel = configuration.getString("logging.router-level", null);
    if (routerLevel != null && !routerLevel.isBlank()) {
      context.getLogger(ROUTER_LOGGER).setLevel(Level.toLevel(routerLevel, Level.INFO));
    }
  }
}
