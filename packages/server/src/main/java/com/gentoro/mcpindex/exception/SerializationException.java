package com.gentoro.mcpindex.exception;

/** JSON or binary (de)serialization failure. */
public class SerializationException extends McpIndexException {
  public SerializationException(String message) {
    super(McpIndexErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(McpIndexErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
