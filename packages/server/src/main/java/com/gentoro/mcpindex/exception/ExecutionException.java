package com.gentoro.mcpindex.exception;

/** Error while executing a command or runtime operation. */
public class ExecutionException extends McpIndexException {
  public ExecutionException(String message) {
    super(McpIndexErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(McpIndexErrorCode.EXECUTION_ERROR, message, cause);
  }
}
