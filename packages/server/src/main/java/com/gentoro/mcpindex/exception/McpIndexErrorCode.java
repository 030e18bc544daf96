package com.gentoro.mcpindex.exception;

/**
 * Canonical error codes for MCP Index. Codes are stable and suitable for tool payloads and logs.
 * Prefer choosing the most specific code that reflects the failure origin and actionability.
 */
public enum McpIndexErrorCode {
  // Generic
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  UNAVAILABLE,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  EXECUTION_ERROR,
  EMBEDDING_ERROR,
  NETWORK_ERROR,
}
