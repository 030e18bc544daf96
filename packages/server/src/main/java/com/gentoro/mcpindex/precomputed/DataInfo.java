package com.gentoro.mcpindex.precomputed;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.mcpindex.exception.ValidationException;
import com.gentoro.mcpindex.schema.SchemaVersion;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Metadata document ({@code data_info.json}) published alongside a data bundle. */
public class DataInfo {
  public static final String FILE_NAME = "data_info.json";

  @JsonProperty("servers_count")
  private Integer serversCount;

  @JsonProperty("servers_hash")
  private String serversHash;

  @JsonProperty("embeddings_shape")
  private List<Integer> embeddingsShape;

  @JsonProperty("model_name")
  private String modelName;

  @JsonProperty("embeddings_version")
  private String embeddingsVersion;

  @JsonProperty("schema_version")
  private String schemaVersion;

  @JsonProperty("build_timestamp")
  private Double buildTimestamp;

  @JsonProperty("build_date")
  private String buildDate;

  @JsonProperty("sources")
  private List<String> sources;

  public DataInfo() {}

  /**
   * Reject documents missing a required field or carrying a malformed schema version.
   *
   * @throws ValidationException naming the first problem found
   */
  public void validate() {
    List<String> missing = new ArrayList<>();
    if (serversCount == null) missing.add("servers_count");
    if (embeddingsShape == null) missing.add("embeddings_shape");
    if (modelName == null || modelName.isBlank()) missing.add("model_name");
    if (buildTimestamp == null) missing.add("build_timestamp");
    if (!missing.isEmpty()) {
      throw new ValidationException(
          "Missing required field(s): " + String.join(", ", missing), Map.of("missing", missing));
    }
    if (embeddingsShape.size() != 2) {
      throw new ValidationException(
          "embeddings_shape must have two dimensions: " + embeddingsShape);
    }
    if (schemaVersion != null && !schemaVersion.isBlank()) {
      SchemaVersion.parse(schemaVersion);
    }
  }

  /** Declared schema version; bundles predating versioning are {@code 1.0}. */
  @JsonIgnore
  public String effectiveSchemaVersion() {
    return schemaVersion == null || schemaVersion.isBlank()
        ? SchemaVersion.CURRENT.toString()
        : schemaVersion;
  }

  public Integer getServersCount() {
    return serversCount;
  }

  public void setServersCount(Integer serversCount) {
    this.serversCount = serversCount;
  }

  public String getServersHash() {
    return serversHash;
  }

  public void setServersHash(String serversHash) {
    this.serversHash = serversHash;
  }

  public List<Integer> getEmbeddingsShape() {
    return embeddingsShape;
  }

  public void setEmbeddingsShape(List<Integer> embeddingsShape) {
    this.embeddingsShape = embeddingsShape;
  }

  public String getModelName() {
    return modelName;
  }

  public void setModelName(String modelName) {
    this.modelName = modelName;
  }

  public String getEmbeddingsVersion() {
    return embeddingsVersion;
  }

  public void setEmbeddingsVersion(String embeddingsVersion) {
    this.embeddingsVersion = embeddingsVersion;
  }

  public String getSchemaVersion() {
    return schemaVersion;
  }

  public void setSchemaVersion(String schemaVersion) {
    this.schemaVersion = schemaVersion;
  }

  public Double getBuildTimestamp() {
    return buildTimestamp;
  }

  public void setBuildTimestamp(Double buildTimestamp) {
    this.buildTimestamp = buildTimestamp;
  }

  public String getBuildDate() {
    return buildDate;
  }

  public void setBuildDate(String buildDate) {
    this.buildDate = buildDate;
  }

  public List<String> getSources() {
    return sources;
  }

  public void setSources(List<String> sources) {
    this.sources = sources;
  }
}
