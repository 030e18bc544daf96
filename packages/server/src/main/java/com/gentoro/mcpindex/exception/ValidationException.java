package com.gentoro.mcpindex.exception;

import java.util.Map;

/** Input validation failure or illegal argument. */
public class ValidationException extends McpIndexException {
  public ValidationException(String message) {
    super(McpIndexErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(McpIndexErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(McpIndexErrorCode.INVALID_ARGUMENT, message, context);
  }
}
