package com.gentoro.mcpindex.database;

import com.gentoro.mcpindex.catalog.CatalogAggregator;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.exception.ExceptionUtil;
import com.gentoro.mcpindex.source.ServerSource;
import com.gentoro.mcpindex.source.SourceParseResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches all sources concurrently under one shared deadline and merges what came back. A source
 * that throws, times out or yields zero entries is recorded as a failure; the others still count.
 */
public class LiveCatalogFetcher {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(LiveCatalogFetcher.class);

  private static final int MAX_PARALLEL_FETCHES = 4;

  private final List<ServerSource> sources;
  private final Duration timeout;

  public LiveCatalogFetcher(List<ServerSource> sources, Duration timeout) {
    this.sources = List.copyOf(sources);
    this.timeout = timeout;
  }

  public List<ServerSource> sources() {
    return sources;
  }

  public LiveFetchResult fetch() {
    List<String> failures = new ArrayList<>();
    List<CatalogEntry> raw = new ArrayList<>();
    if (sources.isEmpty()) {
      failures.add("no sources configured");
      return new LiveFetchResult(List.of(), 0, failures);
    }
    ExecutorService executor =
        Executors.newFixedThreadPool(
            Math.min(sources.size(), MAX_PARALLEL_FETCHES), new SourceThreadFactory());
    try {
      List<Future<SourceParseResult>> futures = new ArrayList<>();
      for (ServerSource source : sources) {
        futures.add(executor.submit(() -> source.parse(source.fetch())));
      }
      long deadline = System.nanoTime() + timeout.toNanos();
      for (int i = 0; i < sources.size(); i++) {
        ServerSource source = sources.get(i);
        Future<SourceParseResult> future = futures.get(i);
        try {
          long remaining = Math.max(0, deadline - System.nanoTime());
          SourceParseResult result = future.get(remaining, TimeUnit.NANOSECONDS);
          if (result.parsedCount() == 0) {
            failures.add(source.id() + ": no entries");
            log.warn("Source {} produced no entries", source.name());
          } else {
            if (!result.skipped().isEmpty()) {
              log.debug("Skipped {} rows from {}", result.skipped().size(), source.name());
            }
            log.info("Loaded {} entries from {}", result.parsedCount(), source.name());
            raw.addAll(result.entries());
          }
        } catch (TimeoutException e) {
          future.cancel(true);
          failures.add(source.id() + ": timed out");
          log.warn("Source {} timed out after {}", source.name(), timeout);
        } catch (ExecutionException e) {
          failures.add(source.id() + ": " + ExceptionUtil.describe(e.getCause()));
          log.warn("Failed to load {}: {}", source.name(), ExceptionUtil.describe(e.getCause()));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          future.cancel(true);
          failures.add(source.id() + ": interrupted");
        }
      }
    } finally {
      executor.shutdownNow();
    }
    return new LiveFetchResult(CatalogAggregator.deduplicate(raw), raw.size(), failures);
  }

  private static final class SourceThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, "mcp-index-source-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
