package com.gentoro.mcpindex.search;

import com.gentoro.mcpindex.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import java.util.ArrayList;
import java.util.List;

/**
 * In-process {@code all-MiniLM-L6-v2} sentence embeddings through langchain4j's bundled ONNX
 * model. The model is loaded on first use.
 */
public class MiniLmEmbeddingProvider implements EmbeddingProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(MiniLmEmbeddingProvider.class);

  public static final String MODEL_NAME = "all-MiniLM-L6-v2";
  public static final int DIMENSION = 384;

  private static final int BATCH_SIZE = 64;

  private volatile EmbeddingModel model;

  @Override
  public String modelName() {
    return MODEL_NAME;
  }

  @Override
  public int dimension() {
    return DIMENSION;
  }

  @Override
  public float[] embed(String text) {
    try {
      return model().embed(text).content().vector();
    } catch (EmbeddingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EmbeddingException("Failed to embed text", e);
    }
  }

  @Override
  public List<float[]> embedAll(List<String> texts) {
    List<float[]> out = new ArrayList<>(texts.size());
    try {
      EmbeddingModel m = model();
      for (int start = 0; start < texts.size(); start += BATCH_SIZE) {
        List<TextSegment> batch =
            texts.subList(start, Math.min(start + BATCH_SIZE, texts.size())).stream()
                .map(TextSegment::from)
                .toList();
        for (Embedding embedding : m.embedAll(batch).content()) {
          out.add(embedding.vector());
        }
        if (texts.size() > BATCH_SIZE) {
          log.debug("Embedded {}/{} texts", out.size(), texts.size());
        }
      }
      return out;
    } catch (EmbeddingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EmbeddingException("Failed to embed %d texts".formatted(texts.size()), e);
    }
  }

  private EmbeddingModel model() {
    EmbeddingModel m = model;
    if (m == null) {
      synchronized (this) {
        m = model;
        if (m == null) {
          log.info("Loading embedding model {}", MODEL_NAME);
          try {
            m = new AllMiniLmL6V2EmbeddingModel();
          } catch (RuntimeException | LinkageError e) {
            throw new EmbeddingException("Cannot load embedding model " + MODEL_NAME, e);
          }
          model = m;
        }
      }
    }
    return m;
  }
}
