package com.gentoro.mcpindex.schema;

import com.gentoro.mcpindex.exception.ConfigException;
import com.gentoro.mcpindex.exception.ValidationException;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Decides whether distributed data at some schema version can be consumed by this build.
 *
 * <p>Data is {@link Compatibility#COMPATIBLE} when its major version is one this build knows and
 * its minor version does not exceed the highest minor known for that major.
 */
public final class SchemaCompatibilityChecker {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(SchemaCompatibilityChecker.class);

  private final Map<Integer, Set<Integer>> knownVersions;

  public SchemaCompatibilityChecker(Map<Integer, ? extends Collection<Integer>> knownVersions) {
    Objects.requireNonNull(knownVersions, "knownVersions");
    if (knownVersions.isEmpty()) {
      throw new ConfigException("At least one known schema version is required");
    }
    Map<Integer, Set<Integer>> copy = new TreeMap<>();
    knownVersions.forEach(
        (major, minors) -> {
          if (minors == null || minors.isEmpty()) {
            throw new ConfigException("No minor versions listed for schema major " + major);
          }
          copy.put(major, Collections.unmodifiableSet(new TreeSet<>(minors)));
        });
    this.knownVersions = Collections.unmodifiableMap(copy);
  }

  /** Build a checker from textual versions such as {@code ["1.0", "1.1"]}. */
  public static SchemaCompatibilityChecker fromVersions(List<String> versions) {
    if (versions == null || versions.isEmpty()) {
      return new SchemaCompatibilityChecker(
          Map.of(SchemaVersion.CURRENT.major(), Set.of(SchemaVersion.CURRENT.minor())));
    }
    Map<Integer, Set<Integer>> known = new TreeMap<>();
    for (String v : versions) {
      SchemaVersion parsed;
      try {
        parsed = SchemaVersion.parse(v);
      } catch (ValidationException e) {
        throw new ConfigException("Invalid known schema version: " + v, e);
      }
      known.computeIfAbsent(parsed.major(), k -> new TreeSet<>()).add(parsed.minor());
    }
    return new SchemaCompatibilityChecker(known);
  }

  /** Pure decision function. */
  public static Compatibility compatibility(
      Map<Integer, ? extends Collection<Integer>> known, SchemaVersion data) {
    if (data == null || known == null) {
      return Compatibility.INCOMPATIBLE;
    }
    Collection<Integer> minors = known.get(data.major());
    if (minors == null || minors.isEmpty()) {
      return Compatibility.INCOMPATIBLE;
    }
    int maxMinor = minors.stream().mapToInt(Integer::intValue).max().getAsInt();
    return data.minor() <= maxMinor ? Compatibility.COMPATIBLE : Compatibility.INCOMPATIBLE;
  }

  public Compatibility check(SchemaVersion data) {
    return compatibility(knownVersions, data);
  }

  /** Unparseable version text is {@link Compatibility#INCOMPATIBLE}. */
  public Compatibility check(String dataVersion) {
    try {
      return check(SchemaVersion.parse(dataVersion));
    } catch (ValidationException e) {
      log.debug("Unparseable schema version '{}': {}", dataVersion, e.getMessage());
      return Compatibility.INCOMPATIBLE;
    }
  }

  public String describe(String dataVersion) {
    return check(dataVersion) == Compatibility.COMPATIBLE
        ? "Schema v%s compatible".formatted(dataVersion)
        : "Schema v%s incompatible (known: %s), using live sources"
            .formatted(dataVersion, knownVersionsText());
  }

  public Map<Integer, Set<Integer>> knownVersions() {
    return knownVersions;
  }

  private String knownVersionsText() {
    return knownVersions.entrySet().stream()
        .flatMap(e -> e.getValue().stream().map(minor -> e.getKey() + "." + minor))
        .collect(Collectors.joining(", "));
  }
}
