package com.gentoro.mcpindex.http;

import com.gentoro.mcpindex.McpIndex;
import com.gentoro.mcpindex.exception.ConfigException;
import com.gentoro.mcpindex.exception.ExceptionUtil;
import com.gentoro.mcpindex.exception.NetworkException;
import jakarta.servlet.DispatcherType;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import org.eclipse.jetty.ee10.servlet.FilterHolder;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (start/stop/join) and exposes the underlying {@link
 * ServletContextHandler} so that other components can register their servlets. Every request
 * passes through the {@link OriginValidationFilter}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(EmbeddedJettyServer.class);
  private static final String NETWORK_HINT =
      "Please, check if the chosen port and hostname are available and that this process has "
          + "the proper permission to start a new listener on these configurations";

  private final McpIndex mcpIndex;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(McpIndex mcpIndex) {
    this.mcpIndex = mcpIndex;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    log.trace("Initializing shared Jetty server");
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = mcpIndex.configuration().getInt("http.port", 8000);
        log.trace("Resolving http.port: {}", port);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }

      String hostname;
      try {
        hostname = mcpIndex.configuration().getString("http.hostname", "127.0.0.1");
        if (Objects.isNull(hostname) || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
        log.trace("Resolving http.hostname: {}", hostname);
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      try {
        if (!hostname.equals("0.0.0.0")) {
          server = new Server();
          ServerConnector connector = new ServerConnector(server);
          connector.setHost(hostname);
          connector.setPort(port);
          server.addConnector(connector);
        } else {
          server = new Server(port);
        }

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        List<String> allowedHosts =
            mcpIndex.configuration().getList(String.class, "http.allowed-hosts", List.of());
        contextHandler.addFilter(
            new FilterHolder(new OriginValidationFilter(allowedHosts)),
            "/*",
            EnumSet.of(DispatcherType.REQUEST));
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException(
            "There was a problem while attempting to initialize jetty service. " + NETWORK_HINT,
            e);
      }
    }
  }

  /** Start Jetty if not already started. */
  public void start() {
    log.trace("Starting shared Jetty server");
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
        log.info("Starting shared Jetty server on port {}...", getPort());
        server.start();
        log.info("Jetty listening on {}", server.getURI());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "There was a problem while attempting to start jetty service. " + NETWORK_HINT,
                    ex));
      }
    }
  }

  public void stop() {
    log.trace("Stopping shared Jetty server");
    synchronized (lifecycleLock) {
      if (server != null) {
        try {
          if (server.isRunning() || server.isStarted() || server.isStarting()) {
            server.stop();
          }
        } catch (Exception e) {
          log.error("Error stopping jetty server; continuing shutdown of other services", e);
        } finally {
          server = null;
          contextHandler = null;
        }
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
        return server.getURI().getPort();
      }
      return mcpIndex.configuration().getInt("http.port", 8000);
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
