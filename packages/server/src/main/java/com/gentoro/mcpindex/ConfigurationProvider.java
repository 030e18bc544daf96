package com.gentoro.mcpindex;

import com.gentoro.mcpindex.exception.ConfigException;
import com.gentoro.mcpindex.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the YAML configuration of the index and exposes it as an Apache Commons Configuration.
 *
 * <p>Accepted locations are {@code classpath:some/path.yaml}, {@code file:} URIs and plain
 * filesystem paths, relative or absolute. Values may reference {@code ${env:NAME}}; unset variables
 * are looked up in a {@code .env.local} file next to the process.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader.getResource(resourceName) == null) {
      log.warn("Configuration resource {} not found on classpath; using defaults", resourceName);
      return addOns(new YAMLConfiguration());
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input = loader.getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new ConfigException("Resource not found: %s".formatted(resourceName));
      }
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(new String(input.readAllBytes(), StandardCharsets.UTF_8)));
      return addOns(config);
    } catch (IOException | ConfigurationException e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file does not exist: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file));
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath("application.yaml");
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.startsWith("file:")) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Malformed configuration URI: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(Configuration config) {
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  /** Environment lookup that falls back to KEY=VALUE pairs from a local dotenv file. */
  static final class FallbackEnvLookup implements Lookup {
    private static final List<Path> CANDIDATES =
        List.of(Paths.get(".env.local"), Paths.get("packages/server/.env.local"));

    private volatile Map<String, String> fallback;

    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }
      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            fallback =
                CANDIDATES.stream()
                    .filter(Files::isRegularFile)
                    .findFirst()
                    .map(FallbackEnvLookup::readKeyValueFile)
                    .orElseGet(
                        () -> {
                          log.debug("No .env.local found; using the process environment only");
                          return Collections.emptyMap();
                        });
          }
        }
      }
      return fallback.get(key);
    }

    static Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading environment fallbacks from {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty() && !line.startsWith("#"))
            .map(FallbackEnvLookup::parseLine)
            .filter(e -> !e.getKey().isEmpty())
            .collect(
                Collectors.toMap(
                    Map.Entry::getKey, Map.Entry::getValue, (a, b) -> b, ConcurrentHashMap::new));
      } catch (IOException e) {
        log.warn("Could not read {}: {}", path, e.getMessage());
        return Collections.emptyMap();
      }
    }

    static Map.Entry<String, String> parseLine(String line) {
      String body = line.startsWith("export ") ? line.substring("export ".length()) : line;
      int idx = body.indexOf('=');
      if (idx <= 0) {
        return Map.entry("", "");
      }
      String key = body.substring(0, idx).trim();
      String val = body.substring(idx + 1).trim();
      if (val.length() >= 2
          && ((val.startsWith("\"") && val.endsWith("\""))
              || (val.startsWith("'") && val.endsWith("'")))) {
        val = val.substring(1, val.length() - 1);
      }
      return Map.entry(key, val);
    }
  }
}
