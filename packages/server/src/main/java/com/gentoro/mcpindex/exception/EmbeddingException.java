package com.gentoro.mcpindex.exception;

/** Embedding model could not be loaded or failed to encode text. */
public class EmbeddingException extends McpIndexException {
  public EmbeddingException(String message) {
    super(McpIndexErrorCode.EMBEDDING_ERROR, message);
  }

  public EmbeddingException(String message, Throwable cause) {
    super(McpIndexErrorCode.EMBEDDING_ERROR, message, cause);
  }
}
