package com.gentoro.mcpindex.testing;

import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.source.RowOutcome;
import com.gentoro.mcpindex.source.ServerSource;
import com.gentoro.mcpindex.source.SourceParseResult;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Source returning canned entries, failing, or stalling, without touching the network. */
public class FakeSource implements ServerSource {

  private final String id;
  private final List<CatalogEntry> entries;
  private final IOException failure;
  private final Duration delay;
  private final AtomicInteger fetches = new AtomicInteger();

  private FakeSource(String id, List<CatalogEntry> entries, IOException failure, Duration delay) {
    this.id = id;
    this.entries = entries;
    this.failure = failure;
    this.delay = delay;
  }

  public static FakeSource returning(String id, List<CatalogEntry> entries) {
    return new FakeSource(id, entries, null, Duration.ZERO);
  }

  public static FakeSource failing(String id) {
    return new FakeSource(id, List.of(), new IOException("HTTP 503"), Duration.ZERO);
  }

  public static FakeSource slow(String id, List<CatalogEntry> entries, Duration delay) {
    return new FakeSource(id, entries, null, delay);
  }

  /** {@code count} distinct entries labelled with this source id. */
  public static List<CatalogEntry> entries(String id, int count) {
    List<CatalogEntry> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      out.add(
          new CatalogEntry(
              id + "-server-" + i,
              "Server number " + i + " from " + id,
              "https://github.com/" + id + "/server-" + i,
              "",
              id));
    }
    return out;
  }

  public int fetches() {
    return fetches.get();
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String name() {
    return "Fake " + id;
  }

  @Override
  public String label() {
    return id;
  }

  @Override
  public String url() {
    return "https://example.org/" + id;
  }

  @Override
  public String fetch() throws IOException {
    fetches.incrementAndGet();
    if (!delay.isZero()) {
      try {
        Thread.sleep(delay.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("interrupted", e);
      }
    }
    if (failure != null) {
      throw failure;
    }
    return id;
  }

  @Override
  public SourceParseResult parse(String content) {
    List<RowOutcome> outcomes = new ArrayList<>();
    for (int i = 0; i < entries.size(); i++) {
      outcomes.add(RowOutcome.parsed(i + 1, entries.get(i)));
    }
    return new SourceParseResult(id, outcomes);
  }
}
