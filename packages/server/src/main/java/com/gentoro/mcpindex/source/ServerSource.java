package com.gentoro.mcpindex.source;

import java.io.IOException;

/** One external listing of MCP servers. */
public interface ServerSource {

  /** Stable identifier, matching the provider id and the {@code catalog.sources.<id>} key. */
  String id();

  /** Human readable name used in logs. */
  String name();

  /** Provenance label stamped on every entry this source emits. */
  String label();

  /** Location of the raw listing. */
  String url();

  /**
   * Download the raw listing.
   *
   * @throws IOException on transport failure or a non-successful HTTP status
   */
  String fetch() throws IOException;

  /** Parse a listing. Never throws because of an individual malformed row. */
  SourceParseResult parse(String content);
}
