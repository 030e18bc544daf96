package com.gentoro.mcpindex.catalog;

import com.gentoro.mcpindex.exception.ValidationException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One fixed-length vector per catalog entry, aligned by index with {@link Catalog#entries()}.
 *
 * <p>Rows are copied on construction and never handed out mutably.
 */
public final class EmbeddingMatrix {
  private final float[][] rows;
  private final int dimension;

  private EmbeddingMatrix(float[][] rows, int dimension) {
    this.rows = rows;
    this.dimension = dimension;
  }

  public static EmbeddingMatrix of(float[][] rows) {
    Objects.requireNonNull(rows, "rows");
    int dimension = rows.length == 0 ? 0 : rows[0].length;
    float[][] copy = new float[rows.length][];
    for (int i = 0; i < rows.length; i++) {
      if (rows[i] == null || rows[i].length != dimension) {
        throw new ValidationException(
            "Embedding row %d has length %d, expected %d"
                .formatted(i, rows[i] == null ? 0 : rows[i].length, dimension));
      }
      copy[i] = rows[i].clone();
    }
    return new EmbeddingMatrix(copy, dimension);
  }

  public static EmbeddingMatrix of(List<float[]> rows) {
    return of(rows.toArray(new float[0][]));
  }

  public int rowCount() {
    return rows.length;
  }

  public int dimension() {
    return dimension;
  }

  /** Copy of row {@code index}. */
  public float[] row(int index) {
    return rows[index].clone();
  }

  /** Cosine similarity between {@code query} and every row, in row order. */
  public double[] cosineSimilarities(float[] query) {
    if (query.length != dimension) {
      throw new ValidationException(
          "Query vector has dimension %d, matrix has %d".formatted(query.length, dimension));
    }
    double queryNorm = norm(query);
    double[] out = new double[rows.length];
    for (int i = 0; i < rows.length; i++) {
      float[] row = rows[i];
      double dot = 0;
      for (int d = 0; d < dimension; d++) {
        dot += (double) query[d] * row[d];
      }
      double rowNorm = norm(row);
      out[i] = queryNorm == 0 || rowNorm == 0 ? 0 : dot / (queryNorm * rowNorm);
    }
    return out;
  }

  /** Reject any catalog whose size differs from the number of rows. */
  public void requireAlignedWith(Catalog catalog) {
    if (catalog.entryCount() != rows.length) {
      throw new ValidationException(
          "Embedding matrix has %d rows but catalog has %d entries"
              .formatted(rows.length, catalog.entryCount()),
          Map.of("rows", rows.length, "entries", catalog.entryCount()));
    }
  }

  public boolean isAlignedWith(Catalog catalog) {
    return catalog.entryCount() == rows.length;
  }

  private static double norm(float[] v) {
    double sum = 0;
    for (float x : v) {
      sum += (double) x * x;
    }
    return Math.sqrt(sum);
  }
}
