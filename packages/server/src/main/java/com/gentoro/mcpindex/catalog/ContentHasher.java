package com.gentoro.mcpindex.catalog;

import com.gentoro.mcpindex.exception.SerializationException;
import com.gentoro.mcpindex.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deterministic content hashes over catalog entries.
 *
 * <p>Only name, description, category and url take part; the source label is provenance, not
 * content, so a re-attributed entry keeps its embedding.
 */
public final class ContentHasher {

  /** Bump when the text fed to the embedding model changes shape. */
  public static final String EMBEDDINGS_VERSION = "v1";

  private static final int HASH_LENGTH = 16;

  private ContentHasher() {}

  /** Hash of a whole catalog for a given embedding model; names embedding cache files. */
  public static String catalogHash(List<CatalogEntry> entries, String modelName) {
    List<Map<String, String>> content = new ArrayList<>(entries.size());
    for (CatalogEntry entry : entries) {
      content.add(contentOf(entry));
    }
    content.sort(
        Comparator.comparing((Map<String, String> m) -> m.get("name"))
            .thenComparing(m -> m.get("url")));
    String input = EMBEDDINGS_VERSION + ":" + modelName + ":" + canonicalJson(content);
    return sha256(input).substring(0, HASH_LENGTH);
  }

  /** Hash of a single entry; used to reuse embeddings of unchanged entries between builds. */
  public static String entryHash(CatalogEntry entry) {
    return sha256(canonicalJson(contentOf(entry))).substring(0, HASH_LENGTH);
  }

  /** Order-insensitive hash over entry hashes; detects whether a rebuild changed anything. */
  public static String entriesHash(List<CatalogEntry> entries) {
    String combined =
        entries.stream().map(ContentHasher::entryHash).sorted().collect(Collectors.joining("|"));
    return sha256(combined).substring(0, HASH_LENGTH);
  }

  private static Map<String, String> contentOf(CatalogEntry entry) {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("name", entry.name());
    m.put("description", entry.description());
    m.put("category", entry.category());
    m.put("url", entry.url());
    return m;
  }

  private static String canonicalJson(Object value) {
    try {
      return JacksonUtility.getCanonicalMapper().writeValueAsString(value);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize catalog content for hashing", e);
    }
  }

  private static String sha256(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
      StringBuilder hexString = new StringBuilder();
      for (byte b : hash) {
        String hex = Integer.toHexString(0xff & b);
        if (hex.length() == 1) {
          hexString.append('0');
        }
        hexString.append(hex);
      }
      return hexString.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
