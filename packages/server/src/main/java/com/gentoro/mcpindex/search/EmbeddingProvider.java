package com.gentoro.mcpindex.search;

import java.util.List;

/**
 * Turns text into fixed-length vectors. Implementations throw {@link
 * com.gentoro.mcpindex.exception.EmbeddingException} when the model cannot be loaded or fails.
 */
public interface EmbeddingProvider {

  /** Identifier recorded in bundles and content hashes. */
  String modelName();

  /** Vector length, known without loading the model. */
  int dimension();

  float[] embed(String text);

  List<float[]> embedAll(List<String> texts);
}
