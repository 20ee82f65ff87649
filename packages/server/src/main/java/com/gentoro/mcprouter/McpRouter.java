package com.gentoro.mcprouter;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import com.gentoro.mcprouter.api.RouterApiService;
import com.gentoro.mcprouter.cache.CacheSettings;
import com.gentoro.mcprouter.cache.InMemoryResponseCache;
import com.gentoro.mcprouter.cache.RequestFingerprinter;
import com.gentoro.mcprouter.catalog.ProviderCatalog;
import com.gentoro.mcprouter.catalog.ProviderCatalogFactory;
import com.gentoro.mcprouter.engine.FallbackChain;
import com.gentoro.mcprouter.engine.RoutingEngine;
import com.gentoro.mcprouter.engine.RoutingSettings;
import com.gentoro.mcprouter.engine.UpstreamCallGuard;
import com.gentoro.mcprouter.exception.StateException;
import com.gentoro.mcprouter.http.EmbeddedJettyServer;
import com.gentoro.mcprouter.invoke.Invoker;
import com.gentoro.mcprouter.invoke.InvokerFactory;
import com.gentoro.mcprouter.invoke.MockInvoker;
import com.gentoro.mcprouter.model.RoutingRequest;
import com.gentoro.mcprouter.model.RoutingResponse;
import com.gentoro.mcprouter.parse.RequestParser;
import com.gentoro.mcprouter.parse.SemanticExpander;
import com.gentoro.mcprouter.ranking.CandidateRanker;
import com.gentoro.mcprouter.ranking.ScoringWeights;
import com.gentoro.mcprouter.ranking.ToolSelector;
import com.gentoro.mcprouter.utility.JacksonUtility;
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

public class McpRouter {

  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(McpRouter.class);

  static final String DRY_RUN_QUERY = "what's the weather in Seoul";

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ProviderCatalog catalog;
  private Invoker invoker;
  private UpstreamCallGuard guard;
  private RoutingEngine engine;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public McpRouter(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public boolean isInteractiveModeEnabled() {
    return "interactive".equalsIgnoreCase(startupParameters.mode());
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    String mode = startupParameters.mode();
    if (!"server".equals(mode) && !"interactive".equals(mode) && !"dry-run".equals(mode)) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.mcprouter.logging.LoggingService.applyConfiguration(configuration());

    buildEngine(configuration());

    switch (mode) {
      case "interactive" -> {
        configureFileOnlyLogging();
        enterInteractiveMode(System.in, System.out);
      }
      case "dry-run" -> {
        System.out.println(render(engine.route(RoutingRequest.ofQuery(DRY_RUN_QUERY))));
        shutdown();
      }
      default -> startHttpServer();
    }
  }

  RoutingEngine buildEngine(Configuration configuration) {
    RoutingSettings settings = RoutingSettings.fromConfiguration(configuration);
    CacheSettings cacheSettings = CacheSettings.fromConfiguration(configuration);
    this.catalog = ProviderCatalogFactory.create(configuration);
    this.invoker = InvokerFactory.create(configuration);
    this.guard = new UpstreamCallGuard();

    SemanticExpander expander = new SemanticExpander();
    CandidateRanker ranker =
        new CandidateRanker(
            catalog,
            expander,
            ScoringWeights.fromConfiguration(configuration),
            guard,
            settings.catalogTimeoutMs());
    FallbackChain chain = new FallbackChain(ranker, new ToolSelector(), expander, settings);

    log.info(
        "Router ready: {} providers ({}), invoker={}, cache={}, strict={}",
        catalog.size(),
        catalog.driverId(),
        invoker.mode(),
        cacheSettings.enabled(),
        settings.strict());
    this.engine =
        new RoutingEngine(
            new RequestParser(),
            new RequestFingerprinter(),
            new InMemoryResponseCache<RoutingResponse>(cacheSettings),
            cacheSettings.enabled(),
            chain,
            invoker,
            new MockInvoker(),
            guard,
            settings);
    return engine;
  }

  private void startHttpServer() {
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new RouterApiService(this).register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  /** Read queries line by line and print the routing response until {@code exit} or EOF. */
  void enterInteractiveMode(InputStream input, PrintStream out) {
    Scanner scanner = new Scanner(input);
    try {
      out.println("Type a request (or 'exit' to quit):");
      while (true) {
        out.print("> ");
        if (!scanner.hasNextLine()) {
          break;
        }
        String line = scanner.nextLine().trim();
        if (line.equalsIgnoreCase("exit")) {
          out.println("Goodbye!");
          break;
        }
        if (line.isEmpty()) {
          continue;
        }
        out.println(render(engine.route(RoutingRequest.ofQuery(line))));
      }
    } finally {
      shutdown();
    }
  }

  private static String render(RoutingResponse response) {
    try {
      return JacksonUtility.getJsonMapper()
          .writerWithDefaultPrettyPrinter()
          .writeValueAsString(response);
    } catch (Exception e) {
      log.error("Could not render routing response", e);
      return "{\"success\":" + response.isSuccess() + "}";
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "mcprouter-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (httpServer != null) {
          httpServer.close();
        }
        if (guard != null) {
          guard.close();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("McpRouter not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public RoutingEngine engine() {
    if (engine == null) {
      throw new StateException("McpRouter not initialized. Call initialize() first.");
    }
    return engine;
  }

  public ProviderCatalog catalog() {
    return catalog;
  }

  public Invoker invoker() {
    return invoker;
  }

  /**
   * Reconfigure Logback to disable console output and enable only file-based logging. Intended for
   * use in "interactive" mode to keep console clean.
   */
  private void configureFileOnlyLogging() {
    if (!(org.slf4j.LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    // Detach any console appenders (e.g., STDOUT)
    for (java.util.Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders();
        it.hasNext(); ) {
      Appender<ILoggingEvent> app = it.next();
      if (app instanceof ConsoleAppender) {
        root.detachAppender(app);
      }
    }

    // Use MCPROUTER_LOG_DIR if set, otherwise ~/.mcprouter/logs
    String logDirEnv = System.getenv("MCPROUTER_LOG_DIR");
    File logsDir;
    if (logDirEnv != null && !logDirEnv.isBlank()) {
      logsDir = new File(logDirEnv);
    } else {
      String userHome = System.getProperty("user.home");
      logsDir =
          new File(
              userHome != null ? userHome : System.getProperty("java.io.tmpdir"),
              ".mcprouter/logs");
    }
    if (!logsDir.exists() && !logsDir.mkdirs()) {
      log.warn("Could not create log directory {}", logsDir.getAbsolutePath());
    }

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(new File(logsDir, "mcprouter.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(
        new File(logsDir, "mcprouter.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    log.info(
        "Interactive mode: console logging disabled; file logging enabled at {}",
        new File(logsDir, "mcprouter.log").getPath());
  }
}
