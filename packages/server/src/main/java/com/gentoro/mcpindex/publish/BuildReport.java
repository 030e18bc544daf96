package com.gentoro.mcpindex.publish;

import java.time.Duration;
import java.util.List;

/**
 * Summary of a {@code build-data} run.
 *
 * @param changed false when the catalog hash matched the previous release and nothing was written
 * @param embeddingsShape rows and dimension of the written matrix; empty when unchanged
 * @param reusedEmbeddings rows copied from the previous release instead of recomputed
 */
public record BuildReport(
    boolean changed,
    int serversCount,
    String serversHash,
    List<Integer> embeddingsShape,
    int reusedEmbeddings,
    Duration buildTime) {

  public BuildReport {
    embeddingsShape = embeddingsShape == null ? List.of() : List.copyOf(embeddingsShape);
  }

  /** {@code key=value} lines in the format CI step outputs expect. */
  public String toStepOutput() {
    StringBuilder out = new StringBuilder();
    out.append("changed=").append(changed).append('\n');
    if (changed) {
      out.append("servers_count=").append(serversCount).append('\n');
      out.append("servers_hash=").append(serversHash).append('\n');
    }
    return out.toString();
  }
}
