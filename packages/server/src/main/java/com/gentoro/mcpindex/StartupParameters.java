package com.gentoro.mcpindex;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line arguments of the form {@code --name value}. A {@code --flag} followed by another
 * option or by nothing is recorded as {@code "true"}.
 */
public class StartupParameters {

  public static final String MODE_SERVER = "server";
  public static final String MODE_INTERACTIVE = "interactive";
  public static final String MODE_BUILD_DATA = "build-data";
  public static final String MODE_HELP = "help";

  private static final Set<String> MODES =
      Set.of(MODE_SERVER, MODE_INTERACTIVE, MODE_BUILD_DATA, MODE_HELP);

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", MODE_SERVER);
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = "true";
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }
    Object configFile = parameters.get("config-file");
    if (configFile == null || configFile.toString().isBlank() || "true".equals(configFile)) {
      throw new IllegalArgumentException("Missing config file location");
    }
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/mcp-index.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class)
        .orElse(ConfigurationProvider.DEFAULT_LOCATION);
  }

  /** True when {@code --name} was given without a value, or with {@code true}. */
  public boolean isFlagSet(String name) {
    return getOptionalParameter(name, String.class).map(Boolean::parseBoolean).orElse(false);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return String.join(
        System.lineSeparator(),
        "Usage: mcp-index [--mode server|interactive|build-data|help] [options]",
        "",
        "Options:",
        "  --config-file <location>  YAML configuration (default classpath:application.yaml)",
        "  --clear-cache             remove cached catalog and embeddings before loading",
        "  --refresh                 ignore precomputed data and caches, fetch sources live",
        "  --output <dir>            build-data output directory (default dist)",
        "  --force                   build-data: write files even when nothing changed");
  }
}
