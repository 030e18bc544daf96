package com.gentoro.mcpindex.schema;

import com.gentoro.mcpindex.exception.ValidationException;

/**
 * Version tag of persisted or distributed catalog data.
 *
 * <p>Textual form is {@code major.minor} with an optional third component that is accepted and
 * ignored ({@code 1.2.7} reads as {@code 1.2}).
 */
public record SchemaVersion(int major, int minor) implements Comparable<SchemaVersion> {

  /** Layout written by this build. */
  public static final SchemaVersion CURRENT = new SchemaVersion(1, 0);

  public SchemaVersion {
    if (major < 0 || minor < 0) {
      throw new ValidationException("Schema version components must be non-negative");
    }
  }

  public static SchemaVersion parse(String text) {
    if (text == null || text.isBlank()) {
      throw new ValidationException("Schema version is empty");
    }
    String[] parts = text.trim().split("\\.", -1);
    if (parts.length < 2) {
      throw new ValidationException("Version must have major.minor format: " + text);
    }
    if (parts.length > 3) {
      throw new ValidationException("Version has too many parts: " + text);
    }
    try {
      int major = Integer.parseInt(parts[0]);
      int minor = Integer.parseInt(parts[1]);
      if (parts.length == 3) {
        Integer.parseInt(parts[2]);
      }
      return new SchemaVersion(major, minor);
    } catch (NumberFormatException e) {
      throw new ValidationException("Invalid schema version format: " + text, e);
    }
  }

  @Override
  public int compareTo(SchemaVersion other) {
    int c = Integer.compare(major, other.major);
    return c != 0 ? c : Integer.compare(minor, other.minor);
  }

  @Override
  public String toString() {
    return major + "." + minor;
  }
}
