package com.gentoro.mcpindex.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the index's runtime exceptions. Each carries a {@link McpIndexErrorCode} chosen by the
 * subclass and a read-only snapshot of diagnostic values such as failing source ids or missing
 * bundle fields.
 */
public class McpIndexException extends RuntimeException {
  private final McpIndexErrorCode code;
  private final Map<String, Object> context;

  public McpIndexException(McpIndexErrorCode code, String message) {
    this(code, message, null, null);
  }

  public McpIndexException(McpIndexErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public McpIndexException(McpIndexErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  private McpIndexException(
      McpIndexErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public McpIndexErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  /** One-line form used in log lines: {@code [CODE] message {key=value}}. */
  public String summary() {
    StringBuilder sb = new StringBuilder().append('[').append(code).append("] ");
    sb.append(getMessage());
    if (!context.isEmpty()) {
      sb.append(' ').append(context);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + ": " + summary();
  }
}
