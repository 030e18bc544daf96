package com.gentoro.mcpindex.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.mcpindex.cache.CatalogCache;
import com.gentoro.mcpindex.cache.NpyCodec;
import com.gentoro.mcpindex.catalog.CatalogEntry;
import com.gentoro.mcpindex.catalog.ContentHasher;
import com.gentoro.mcpindex.catalog.EmbeddingMatrix;
import com.gentoro.mcpindex.database.LiveCatalogFetcher;
import com.gentoro.mcpindex.database.LiveFetchResult;
import com.gentoro.mcpindex.exception.CatalogUnavailableException;
import com.gentoro.mcpindex.exception.ExceptionUtil;
import com.gentoro.mcpindex.exception.SerializationException;
import com.gentoro.mcpindex.precomputed.DataInfo;
import com.gentoro.mcpindex.precomputed.PrecomputedDataLoader;
import com.gentoro.mcpindex.schema.SchemaVersion;
import com.gentoro.mcpindex.search.EmbeddingProvider;
import com.gentoro.mcpindex.source.ServerSource;
import com.gentoro.mcpindex.utility.FileUtility;
import com.gentoro.mcpindex.utility.JacksonUtility;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Builds the bundle that {@link PrecomputedDataLoader} consumes: {@code servers.json}, {@code
 * embeddings.npz} and {@code data_info.json}.
 *
 * <p>The previous release is downloaded first. If its {@code servers_hash} equals the hash of the
 * freshly fetched catalog, nothing is written. Otherwise embeddings of entries whose content hash
 * is unchanged are copied over and only new or edited entries go through the model.
 */
public class PrecomputedDataBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(PrecomputedDataBuilder.class);

  static final DateTimeFormatter BUILD_DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

  private final LiveCatalogFetcher fetcher;
  private final OkHttpClient httpClient;
  private final String previousBaseUrl;
  private final EmbeddingProvider embeddingProvider;
  private final Clock clock;

  /**
   * @param previousBaseUrl release to diff against; {@code null} builds from scratch
   */
  public PrecomputedDataBuilder(
      LiveCatalogFetcher fetcher,
      OkHttpClient httpClient,
      String previousBaseUrl,
      EmbeddingProvider embeddingProvider,
      Clock clock) {
    this.fetcher = fetcher;
    this.httpClient = httpClient;
    this.previousBaseUrl =
        previousBaseUrl == null || previousBaseUrl.isBlank()
            ? null
            : previousBaseUrl.replaceAll("/+$", "");
    this.embeddingProvider = embeddingProvider;
    this.clock = clock;
  }

  /**
   * Fetch, diff and write the bundle into {@code outputDir}.
   *
   * @param force write even when the catalog hash is unchanged
   * @throws CatalogUnavailableException when no source produced any entry
   */
  public BuildReport build(Path outputDir, boolean force) {
    Instant start = clock.instant();
    LiveFetchResult live = fetcher.fetch();
    List<CatalogEntry> entries = live.entries();
    if (entries.isEmpty()) {
      throw new CatalogUnavailableException(
          "No servers fetched from any source", Map.of("failures", live.failures()));
    }
    log.info(
        "Fetched {} unique servers from {} raw entries ({} source failures)",
        entries.size(),
        live.rawCount(),
        live.failures().size());

    String serversHash = ContentHasher.entriesHash(entries);
    log.info("Current servers hash: {}", serversHash);

    PreviousRelease previous = downloadPrevious();
    if (!force && serversHash.equals(previous.serversHash())) {
      log.info("No changes detected, published data is up to date");
      return new BuildReport(
          false,
          entries.size(),
          serversHash,
          null,
          0,
          Duration.between(start, clock.instant()));
    }

    IncrementalEmbeddings embeddings = embed(entries, previous);
    Instant builtAt = clock.instant();
    DataInfo info = dataInfo(entries, serversHash, embeddings.matrix(), builtAt);

    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    try {
      FileUtility.writeAtomically(
          outputDir.resolve(PrecomputedDataLoader.SERVERS_FILE), mapper.writeValueAsBytes(entries));
      FileUtility.writeAtomically(
          outputDir.resolve(PrecomputedDataLoader.EMBEDDINGS_FILE),
          NpyCodec.writeNpz(PrecomputedDataLoader.EMBEDDINGS_KEY, embeddings.matrix()));
      FileUtility.writeAtomically(
          outputDir.resolve(DataInfo.FILE_NAME), mapper.writeValueAsBytes(info));
    } catch (IOException e) {
      throw new SerializationException("Failed to serialize bundle files", e);
    }

    BuildReport report =
        new BuildReport(
            true,
            entries.size(),
            serversHash,
            info.getEmbeddingsShape(),
            embeddings.reused(),
            Duration.between(start, clock.instant()));
    log.info(
        "Bundle written to {}: {} servers, embeddings {}, {} reused",
        outputDir.toAbsolutePath(),
        report.serversCount(),
        report.embeddingsShape(),
        report.reusedEmbeddings());
    return report;
  }

  IncrementalEmbeddings embed(List<CatalogEntry> entries, PreviousRelease previous) {
    Map<String, Integer> previousIndex = new HashMap<>();
    EmbeddingMatrix previousMatrix = null;
    if (previous.hasReusableEmbeddings()) {
      if (previous.embeddings().dimension() == embeddingProvider.dimension()) {
        previousMatrix = previous.embeddings();
        for (int i = 0; i < previous.entries().size(); i++) {
          previousIndex.putIfAbsent(ContentHasher.entryHash(previous.entries().get(i)), i);
        }
      } else {
        log.info(
            "Previous embeddings have dimension {}, model produces {}; recomputing all",
            previous.embeddings().dimension(),
            embeddingProvider.dimension());
      }
    }

    float[][] rows = new float[entries.size()][];
    List<Integer> changed = new ArrayList<>();
    int reused = 0;
    for (int i = 0; i < entries.size(); i++) {
      Integer prev = previousIndex.get(ContentHasher.entryHash(entries.get(i)));
      if (prev != null && prev < previousMatrix.rowCount()) {
        rows[i] = previousMatrix.row(prev);
        reused++;
      } else {
        changed.add(i);
      }
    }
    log.info("Reusing {} embeddings, computing {}", reused, changed.size());

    if (!changed.isEmpty()) {
      List<String> texts = changed.stream().map(i -> entries.get(i).embeddingText()).toList();
      List<float[]> computed = embeddingProvider.embedAll(texts);
      for (int k = 0; k < changed.size(); k++) {
        rows[changed.get(k)] = computed.get(k);
      }
    }
    return new IncrementalEmbeddings(EmbeddingMatrix.of(rows), reused);
  }

  private DataInfo dataInfo(
      List<CatalogEntry> entries, String serversHash, EmbeddingMatrix matrix, Instant builtAt) {
    DataInfo info = new DataInfo();
    info.setServersCount(entries.size());
    info.setServersHash(serversHash);
    info.setEmbeddingsShape(List.of(matrix.rowCount(), matrix.dimension()));
    info.setModelName(embeddingProvider.modelName());
    info.setEmbeddingsVersion(ContentHasher.EMBEDDINGS_VERSION);
    info.setSchemaVersion(SchemaVersion.CURRENT.toString());
    info.setBuildTimestamp(builtAt.toEpochMilli() / 1000.0);
    info.setBuildDate(BUILD_DATE_FORMAT.format(builtAt));
    info.setSources(fetcher.sources().stream().map(ServerSource::name).toList());
    return info;
  }

  PreviousRelease downloadPrevious() {
    if (previousBaseUrl == null) {
      return PreviousRelease.none();
    }
    log.info("Downloading previous release from {}", previousBaseUrl);
    ObjectMapper mapper = JacksonUtility.getJsonMapper();

    List<CatalogEntry> entries = null;
    EmbeddingMatrix embeddings = null;
    DataInfo info = null;
    try {
      Optional<byte[]> servers = download(PrecomputedDataLoader.SERVERS_FILE);
      if (servers.isPresent()) {
        entries = new ArrayList<>();
        for (JsonNode node : mapper.readTree(servers.get())) {
          entries.add(CatalogCache.toEntry(node));
        }
        log.info("Previous release has {} servers", entries.size());
      }
    } catch (IOException | RuntimeException e) {
      log.info("Could not read previous servers: {}", ExceptionUtil.describe(e));
      entries = null;
    }
    try {
      Optional<byte[]> npz = download(PrecomputedDataLoader.EMBEDDINGS_FILE);
      if (npz.isPresent()) {
        embeddings =
            EmbeddingMatrix.of(
                NpyCodec.readNpz(
                    new ByteArrayInputStream(npz.get()), PrecomputedDataLoader.EMBEDDINGS_KEY));
        log.info(
            "Previous embeddings matrix: {}x{}", embeddings.rowCount(), embeddings.dimension());
      }
    } catch (IOException | RuntimeException e) {
      log.info("Could not read previous embeddings: {}", ExceptionUtil.describe(e));
    }
    try {
      Optional<byte[]> dataInfo = download(DataInfo.FILE_NAME);
      if (dataInfo.isPresent()) {
        info = mapper.readValue(dataInfo.get(), DataInfo.class);
      }
    } catch (IOException | RuntimeException e) {
      log.info("Could not read previous data info: {}", ExceptionUtil.describe(e));
    }
    return new PreviousRelease(entries, embeddings, info);
  }

  private Optional<byte[]> download(String fileName) throws IOException {
    Request request = new Request.Builder().url(previousBaseUrl + "/" + fileName).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        log.info("No previous {} (HTTP {})", fileName, response.code());
        return Optional.empty();
      }
      return Optional.of(body.bytes());
    }
  }

  record IncrementalEmbeddings(EmbeddingMatrix matrix, int reused) {}
}
