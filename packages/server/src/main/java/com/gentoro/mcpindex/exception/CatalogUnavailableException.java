package com.gentoro.mcpindex.exception;

import java.util.Map;

/** Every catalog tier failed; no usable catalog could be assembled. */
public class CatalogUnavailableException extends McpIndexException {
  public CatalogUnavailableException(String message) {
    super(McpIndexErrorCode.UNAVAILABLE, message);
  }

  public CatalogUnavailableException(String message, Throwable cause) {
    super(McpIndexErrorCode.UNAVAILABLE, message, cause);
  }

  public CatalogUnavailableException(String message, Map<String, ?> context) {
    super(McpIndexErrorCode.UNAVAILABLE, message, context);
  }
}
