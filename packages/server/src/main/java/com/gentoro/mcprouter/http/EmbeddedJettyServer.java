package com.gentoro.mcprouter.http;

import com.gentoro.mcprouter.exception.ConfigException;
import com.gentoro.mcprouter.exception.ExceptionUtil;
import com.gentoro.mcprouter.exception.NetworkException;
import jakarta.servlet.http.HttpServlet;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop/join). Servlets are registered
 * between {@link #prepare()} and {@link #start()}. Port {@code 0} binds an ephemeral port; {@link
 * #getPort()} reports the actual one once started.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  private static final String ANY_HOST = "0.0.0.0";

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServerConnector connector;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = configuration.getInt("http.port", 8080);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }

      String hostname;
      try {
        hostname = configuration.getString("http.hostname", ANY_HOST);
        if (Objects.isNull(hostname) || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      try {
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("jetty-http");
        server = new Server(threadPool);

        connector = new ServerConnector(server);
        if (!hostname.equals(ANY_HOST)) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException(
            "There was a problem while attempting to initialize jetty service. "
                + "Please, check if the chosen port and hostname are available",
            e);
      }
    }
  }

  public void addServlet(HttpServlet servlet, String pathSpec) {
    synchronized (lifecycleLock) {
      if (contextHandler == null) {
        prepare();
      }
      contextHandler.addServlet(new ServletHolder(servlet), pathSpec);
      log.debug("Registered {} at {}", servlet.getClass().getSimpleName(), pathSpec);
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "There was a problem while attempting to start jetty service. "
                        + "Please, check if the chosen port and hostname are available",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      Server s = server;
      try {
        if (s.isRunning() || s.isStarted() || s.isStarting()) {
          s.setStopTimeout(2000);
          s.stop();
        }
      } catch (Exception e) {
        // stopping must not prevent the remaining components from shutting down
        log.error("Error stopping jetty server", e);
      } finally {
        server = null;
        connector = null;
        contextHandler = null;
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return connector.getLocalPort();
      }
      return configuration.getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
