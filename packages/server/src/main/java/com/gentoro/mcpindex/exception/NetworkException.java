package com.gentoro.mcpindex.exception;

/** Network-level communication error (HTTP, sockets, timeouts). */
public class NetworkException extends McpIndexException {
  public NetworkException(String message) {
    super(McpIndexErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(McpIndexErrorCode.NETWORK_ERROR, message, cause);
  }
}
