package com.gentoro.mcpindex.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends McpIndexException {
  public ConfigException(String message) {
    super(McpIndexErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(McpIndexErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
