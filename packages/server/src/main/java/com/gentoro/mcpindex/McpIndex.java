package com.gentoro.mcpindex;

import com.gentoro.mcpindex.actuator.ActuatorService;
import com.gentoro.mcpindex.console.InteractiveConsole;
import com.gentoro.mcpindex.database.CatalogDatabase;
import com.gentoro.mcpindex.database.CatalogDatabaseFactory;
import com.gentoro.mcpindex.database.DatabaseSettings;
import com.gentoro.mcpindex.database.IndexState;
import com.gentoro.mcpindex.database.LiveCatalogFetcher;
import com.gentoro.mcpindex.exception.CatalogUnavailableException;
import com.gentoro.mcpindex.exception.ConfigException;
import com.gentoro.mcpindex.exception.ExecutionException;
import com.gentoro.mcpindex.exception.StateException;
import com.gentoro.mcpindex.http.EmbeddedJettyServer;
import com.gentoro.mcpindex.http.OkHttpFactory;
import com.gentoro.mcpindex.logging.LoggingService;
import com.gentoro.mcpindex.mcp.McpServer;
import com.gentoro.mcpindex.precomputed.PrecomputedDataLoader;
import com.gentoro.mcpindex.publish.BuildReport;
import com.gentoro.mcpindex.publish.PrecomputedDataBuilder;
import com.gentoro.mcpindex.search.EmbeddingProvider;
import com.gentoro.mcpindex.source.ServerSourceFactory;
import com.gentoro.mcpindex.tool.FindServerTool;
import com.gentoro.mcpindex.tool.ReadmeFetcher;
import com.gentoro.mcpindex.tool.ToolSettings;
import com.gentoro.mcpindex.utility.StdoutUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context. Owns configuration, the shared HTTP client, the catalog database and, in
 * server mode, the Jetty server with the MCP and actuator endpoints mounted on it.
 */
public class McpIndex {

  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(McpIndex.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private OkHttpClient httpClient;
  private CatalogDatabase catalogDatabase;
  private FindServerTool findServerTool;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public McpIndex(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  /** Progress and results go to stdout in every mode except {@code server}. */
  public boolean isConsoleOutputEnabled() {
    return !StartupParameters.MODE_SERVER.equalsIgnoreCase(startupParameters.mode());
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    String mode = startupParameters.mode();
    if (StartupParameters.MODE_HELP.equals(mode)) {
      System.out.println(StartupParameters.usage());
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyLevels(configuration());
    if (StartupParameters.MODE_INTERACTIVE.equals(mode)) {
      LoggingService.configureFileOnly(Path.of(configuration().getString("logging.dir", "logs")));
    }

    this.httpClient = OkHttpFactory.create(configuration());

    if (StartupParameters.MODE_BUILD_DATA.equals(mode)) {
      try {
        buildData();
      } finally {
        shutdown();
      }
      return;
    }

    this.catalogDatabase = CatalogDatabaseFactory.create(this);
    if (startupParameters.isFlagSet("clear-cache")) {
      log.info("Clearing catalog and embedding caches");
      catalogDatabase.clearCaches();
    }
    loadCatalog(startupParameters.isFlagSet("refresh"));

    ToolSettings toolSettings = ToolSettings.fromConfiguration(configuration());
    this.findServerTool =
        new FindServerTool(
            catalogDatabase,
            new ReadmeFetcher(httpClient, toolSettings.readmeMaxChars()),
            toolSettings);

    switch (mode) {
      case StartupParameters.MODE_INTERACTIVE:
        try {
          new InteractiveConsole(this).run(System.in);
        } finally {
          shutdown();
        }
        break;
      case StartupParameters.MODE_SERVER:
        startHttpServer();
        break;
      default:
        shutdown();
        throw new IllegalArgumentException("Invalid mode: " + mode);
    }
  }

  private void loadCatalog(boolean forceLive) {
    try {
      IndexState state =
          forceLive ? catalogDatabase.refresh(true) : catalogDatabase.initialize();
      StdoutUtility.printSuccessLine(
          this,
          "Catalog loaded: %d servers from %s, %s search"
              .formatted(
                  state.catalog().entryCount(),
                  state.origin(),
                  state.engine().mode().name().toLowerCase()));
    } catch (CatalogUnavailableException e) {
      // health reports DOWN and the tool answers with an error until a refresh succeeds
      log.error("Server catalog unavailable {}", e.summary());
      StdoutUtility.printError(this, "Server catalog unavailable", e);
    }
  }

  private void startHttpServer() {
    this.httpServer = new EmbeddedJettyServer(this);
    httpServer.prepare();
    try {
      new ActuatorService(this).register();
      this.mcpServer = new McpServer(this);
      mcpServer.register();
      // Start Jetty (non-blocking)
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new ExecutionException("Could not start http server", e);
    }
  }

  private void buildData() {
    Configuration cfg = configuration();
    Path output =
        Path.of(
            startupParameters
                .getOptionalParameter("output", String.class)
                .orElse(cfg.getString("publish.output-dir", "dist")));
    String previousBaseUrl =
        cfg.getBoolean("publish.incremental", true)
            ? cfg.getString("precomputed.base-url", PrecomputedDataLoader.DEFAULT_BASE_URL)
            : null;
    EmbeddingProvider embeddingProvider = CatalogDatabaseFactory.createEmbeddingProvider(cfg);
    if (embeddingProvider == null) {
      throw new ConfigException("build-data requires embeddings.enabled=true");
    }

    PrecomputedDataBuilder builder =
        new PrecomputedDataBuilder(
            new LiveCatalogFetcher(
                ServerSourceFactory.createEnabled(httpClient, cfg),
                DatabaseSettings.fromConfiguration(cfg).sourcesTimeout()),
            httpClient,
            previousBaseUrl,
            embeddingProvider,
            Clock.systemUTC());
    BuildReport report = builder.build(output, startupParameters.isFlagSet("force"));
    if (report.changed()) {
      StdoutUtility.printSuccessLine(
          this,
          "Data built successfully\n  Servers: %d\n  Embeddings: %s\n  Reused: %d\n  Hash: %s"
              .formatted(
                  report.serversCount(),
                  report.embeddingsShape(),
                  report.reusedEmbeddings(),
                  report.serversHash()));
    } else {
      StdoutUtility.printSuccessLine(this, "No changes detected, data is up to date");
    }
    writeStepOutput(report);
  }

  private void writeStepOutput(BuildReport report) {
    String target = System.getenv("GITHUB_OUTPUT");
    if (target == null || target.isBlank()) {
      return;
    }
    try {
      Files.writeString(
          Path.of(target),
          report.toStepOutput(),
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND);
    } catch (IOException e) {
      log.warn("Could not append build outputs to {}: {}", target, e.getMessage());
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
          shutdownHook = new Thread(this::shutdown, "mcp-index-shutdown-hook");
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
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
        if (httpClient != null) {
          httpClient.dispatcher().executorService().shutdown();
          httpClient.connectionPool().evictAll();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.debug("Error while closing {}: {}", closeable.getClass().getName(), e.getMessage());
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("McpIndex not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public OkHttpClient httpClient() {
    return httpClient;
  }

  public CatalogDatabase catalogDatabase() {
    return catalogDatabase;
  }

  public FindServerTool findServerTool() {
    return findServerTool;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
