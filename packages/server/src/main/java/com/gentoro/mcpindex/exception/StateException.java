package com.gentoro.mcpindex.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends McpIndexException {
  public StateException(String message) {
    super(McpIndexErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(McpIndexErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
