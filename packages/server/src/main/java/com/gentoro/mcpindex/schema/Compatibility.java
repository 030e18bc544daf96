package com.gentoro.mcpindex.schema;

/** Outcome of a schema check. */
public enum Compatibility {
  /** Data can be used as-is. */
  COMPATIBLE,
  /** Data must not be used; the caller falls back to live sources. */
  INCOMPATIBLE
}
