package com.gentoro.mcpindex.exception;

/** I/O operation failed (filesystem, classpath, network streams). */
public class IoException extends McpIndexException {
  public IoException(String message) {
    super(McpIndexErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(McpIndexErrorCode.IO_ERROR, message, cause);
  }
}
