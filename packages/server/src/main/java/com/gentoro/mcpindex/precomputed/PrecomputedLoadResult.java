package com.gentoro.mcpindex.precomputed;

import java.util.Objects;

/** Outcome of {@link PrecomputedDataLoader#load()}: a bundle, or the reason there is none. */
public record PrecomputedLoadResult(PrecomputedBundle bundle, String reason) {

  public static PrecomputedLoadResult available(PrecomputedBundle bundle) {
    return new PrecomputedLoadResult(Objects.requireNonNull(bundle, "bundle"), null);
  }

  public static PrecomputedLoadResult unavailable(String reason) {
    return new PrecomputedLoadResult(null, reason);
  }

  public boolean isAvailable() {
    return bundle != null;
  }
}
