package com.gentoro.mcpindex.cache;

import com.gentoro.mcpindex.catalog.EmbeddingMatrix;
import com.gentoro.mcpindex.exception.SerializationException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Reader and writer for NumPy {@code .npy} arrays and {@code .npz} archives, limited to what the
 * embedding matrices need: two-dimensional float32/float64 arrays in either byte order.
 *
 * <p>Written files are always little-endian float32, header format 1.0.
 */
public final class NpyCodec {

  private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
  private static final int HEADER_ALIGNMENT = 64;

  private static final Pattern DESCR =
      Pattern.compile("'descr'\\s*:\\s*'([^']*)'");
  private static final Pattern FORTRAN =
      Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
  private static final Pattern SHAPE =
      Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

  private NpyCodec() {}

  /** Decode a complete {@code .npy} file. */
  public static float[][] readNpy(byte[] data) {
    if (data.length < MAGIC.length + 4) {
      throw new SerializationException("Not an NPY file: too short");
    }
    for (int i = 0; i < MAGIC.length; i++) {
      if (data[i] != MAGIC[i]) {
        throw new SerializationException("Not an NPY file: bad magic");
      }
    }
    ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    int major = data[6] & 0xFF;
    int headerLength;
    int headerStart;
    switch (major) {
      case 1 -> {
        headerLength = buf.getShort(8) & 0xFFFF;
        headerStart = 10;
      }
      case 2, 3 -> {
        if (data.length < 12) {
          throw new SerializationException("Truncated NPY header");
        }
        headerLength = buf.getInt(8);
        headerStart = 12;
      }
      default -> throw new SerializationException("Unsupported NPY format version " + major);
    }
    if (headerLength < 0 || headerStart + headerLength > data.length) {
      throw new SerializationException("Truncated NPY header");
    }
    String header =
        new String(
            data,
            headerStart,
            headerLength,
            major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);

    String descr = group(DESCR, header, "descr");
    boolean fortranOrder = "True".equals(group(FORTRAN, header, "fortran_order"));
    int[] shape = parseShape(group(SHAPE, header, "shape"));

    ByteOrder order;
    switch (descr.charAt(0)) {
      case '<', '|', '=' -> order = ByteOrder.LITTLE_ENDIAN;
      case '>' -> order = ByteOrder.BIG_ENDIAN;
      default -> throw new SerializationException("Unsupported dtype " + descr);
    }
    String type = descr.substring(1);
    int width;
    if ("f4".equals(type)) {
      width = 4;
    } else if ("f8".equals(type)) {
      width = 8;
    } else {
      throw new SerializationException("Unsupported dtype " + descr + ", expected float32/64");
    }

    int rows = shape[0];
    int cols = shape[1];
    int offset = headerStart + headerLength;
    long needed = (long) rows * cols * width;
    if (data.length - offset < needed) {
      throw new SerializationException(
          "NPY payload has %d bytes, shape needs %d".formatted(data.length - offset, needed));
    }
    ByteBuffer payload = ByteBuffer.wrap(data, offset, (int) needed).slice().order(order);
    float[][] out = new float[rows][cols];
    for (int k = 0; k < rows * cols; k++) {
      float value = width == 4 ? payload.getFloat(k * 4) : (float) payload.getDouble(k * 8);
      if (fortranOrder) {
        out[k % rows][k / rows] = value;
      } else {
        out[k / cols][k % cols] = value;
      }
    }
    return out;
  }

  public static float[][] readNpy(InputStream in) throws IOException {
    return readNpy(in.readAllBytes());
  }

  /**
   * Read one array out of an {@code .npz} archive.
   *
   * @param key array name as given to {@code numpy.savez}, without the {@code .npy} suffix
   */
  public static float[][] readNpz(InputStream in, String key) throws IOException {
    String wanted = key + ".npy";
    try (ZipInputStream zip = new ZipInputStream(in)) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (wanted.equals(entry.getName())) {
          return readNpy(zip.readAllBytes());
        }
      }
    }
    throw new SerializationException("Archive has no array named '" + key + "'");
  }

  public static byte[] writeNpy(EmbeddingMatrix matrix) {
    int rows = matrix.rowCount();
    int cols = matrix.dimension();
    String dict =
        "{'descr': '<f4', 'fortran_order': False, 'shape': (%d, %d), }".formatted(rows, cols);
    // magic(6) + version(2) + length(2) + dict + padding + '\n' is a multiple of 64
    int unpadded = MAGIC.length + 4 + dict.length() + 1;
    int padding = (HEADER_ALIGNMENT - unpadded % HEADER_ALIGNMENT) % HEADER_ALIGNMENT;
    String header = dict + " ".repeat(padding) + "\n";

    ByteBuffer buf =
        ByteBuffer.allocate(MAGIC.length + 4 + header.length() + rows * cols * 4)
            .order(ByteOrder.LITTLE_ENDIAN);
    buf.put(MAGIC).put((byte) 1).put((byte) 0).putShort((short) header.length());
    buf.put(header.getBytes(StandardCharsets.ISO_8859_1));
    for (int r = 0; r < rows; r++) {
      for (float v : matrix.row(r)) {
        buf.putFloat(v);
      }
    }
    return buf.array();
  }

  public static void writeNpz(OutputStream out, String key, EmbeddingMatrix matrix)
      throws IOException {
    ZipOutputStream zip = new ZipOutputStream(out);
    zip.putNextEntry(new ZipEntry(key + ".npy"));
    zip.write(writeNpy(matrix));
    zip.closeEntry();
    zip.finish();
  }

  public static byte[] writeNpz(String key, EmbeddingMatrix matrix) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try {
      writeNpz(bytes, key, matrix);
    } catch (IOException e) {
      throw new SerializationException("Failed to encode npz archive", e);
    }
    return bytes.toByteArray();
  }

  private static String group(Pattern pattern, String header, String field) {
    Matcher m = pattern.matcher(header);
    if (!m.find()) {
      throw new SerializationException("NPY header lacks '" + field + "': " + header.trim());
    }
    return m.group(1);
  }

  private static int[] parseShape(String text) {
    String[] parts = text.split(",");
    int[] dims = new int[2];
    int count = 0;
    for (String part : parts) {
      String p = part.trim();
      if (p.isEmpty()) {
        continue;
      }
      if (count == 2) {
        throw new SerializationException("Expected a 2-d array, got shape (" + text + ")");
      }
      try {
        dims[count++] = Integer.parseInt(p.endsWith("L") ? p.substring(0, p.length() - 1) : p);
      } catch (NumberFormatException e) {
        throw new SerializationException("Bad NPY shape (" + text + ")", e);
      }
    }
    if (count != 2) {
      throw new SerializationException("Expected a 2-d array, got shape (" + text + ")");
    }
    return dims;
  }
}
