/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.medallion.lakehouse.etl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration shared by the layer stages.
 *
 * <p>Every setting has a default, so {@code LakehousePipelineConfig.builder().build()}
 * describes the standard brewery layout.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * layers:
 *   raw: bronze_layer/raw
 *   cleaned: bronze_layer/cleaned
 *   silver: silver_layer
 *   gold: golden_layer
 *
 * cleaning:
 *   nullSentinel: unknown
 *   lowercaseFieldNames: true
 *
 * partition:
 *   field: state
 *   filePrefix: breweries
 *   onSchemaViolation: abort
 *
 * aggregate:
 *   categoryField: brewery_type
 *   countColumn: brewery_count
 *   fileName: brewery_aggregated_by_type_and_location.parquet
 *   mode: per_file
 *   onSchemaViolation: abort
 *
 * compression: snappy
 * storageType: s3
 * storageConfig:
 *   bucket: lakehouse
 *   endpoint: http://localhost:9000
 * }</pre>
 */
public class LakehousePipelineConfig {

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final String rawPrefix;
  private final String cleanedPrefix;
  private final String silverPrefix;
  private final String goldPrefix;
  private final String rawExtension;
  private final String columnarExtension;
  private final String nullSentinel;
  private final boolean lowercaseFieldNames;
  private final String flattenSeparator;
  private final String partitionField;
  private final String partitionFilePrefix;
  private final SchemaViolationPolicy partitionSchemaPolicy;
  private final String categoryField;
  private final String countColumn;
  private final String goldFileName;
  private final AggregationMode aggregationMode;
  private final SchemaViolationPolicy aggregateSchemaPolicy;
  private final String compression;
  private final @Nullable Path scratchRoot;
  private final String storageType;
  private final Map<String, Object> storageConfig;

  private LakehousePipelineConfig(Builder builder) {
    this.rawPrefix = builder.rawPrefix;
    this.cleanedPrefix = builder.cleanedPrefix;
    this.silverPrefix = builder.silverPrefix;
    this.goldPrefix = builder.goldPrefix;
    this.rawExtension = builder.rawExtension;
    this.columnarExtension = builder.columnarExtension;
    this.nullSentinel = builder.nullSentinel;
    this.lowercaseFieldNames = builder.lowercaseFieldNames;
    this.flattenSeparator = builder.flattenSeparator;
    this.partitionField = builder.partitionField;
    this.partitionFilePrefix = builder.partitionFilePrefix;
    this.partitionSchemaPolicy = builder.partitionSchemaPolicy;
    this.categoryField = builder.categoryField;
    this.countColumn = builder.countColumn;
    this.goldFileName = builder.goldFileName;
    this.aggregationMode = builder.aggregationMode;
    this.aggregateSchemaPolicy = builder.aggregateSchemaPolicy;
    this.compression = builder.compression;
    this.scratchRoot = builder.scratchRoot;
    this.storageType = builder.storageType;
    this.storageConfig = builder.storageConfig != null
        ? Collections.unmodifiableMap(new LinkedHashMap<String, Object>(builder.storageConfig))
        : Collections.<String, Object>emptyMap();
  }

  /**
   * Returns the prefix of the raw landing layer.
   */
  public String getRawPrefix() {
    return rawPrefix;
  }

  /**
   * Returns the prefix of the cleaned layer.
   */
  public String getCleanedPrefix() {
    return cleanedPrefix;
  }

  /**
   * Returns the prefix of the partitioned columnar layer.
   */
  public String getSilverPrefix() {
    return silverPrefix;
  }

  /**
   * Returns the prefix of the aggregated layer.
   */
  public String getGoldPrefix() {
    return goldPrefix;
  }

  /**
   * Returns the extension of row-oriented JSON files, including the dot.
   */
  public String getRawExtension() {
    return rawExtension;
  }

  /**
   * Returns the extension of columnar files, including the dot.
   */
  public String getColumnarExtension() {
    return columnarExtension;
  }

  public String getNullSentinel() {
    return nullSentinel;
  }

  public boolean isLowercaseFieldNames() {
    return lowercaseFieldNames;
  }

  public String getFlattenSeparator() {
    return flattenSeparator;
  }

  public String getPartitionField() {
    return partitionField;
  }

  public String getPartitionFilePrefix() {
    return partitionFilePrefix;
  }

  public SchemaViolationPolicy getPartitionSchemaPolicy() {
    return partitionSchemaPolicy;
  }

  public String getCategoryField() {
    return categoryField;
  }

  public String getCountColumn() {
    return countColumn;
  }

  public String getGoldFileName() {
    return goldFileName;
  }

  public AggregationMode getAggregationMode() {
    return aggregationMode;
  }

  public SchemaViolationPolicy getAggregateSchemaPolicy() {
    return aggregateSchemaPolicy;
  }

  /**
   * Returns the Parquet compression codec name.
   */
  public String getCompression() {
    return compression;
  }

  /**
   * Returns the directory under which run-scoped scratch directories are
   * created, or null for {@code java.io.tmpdir}.
   */
  public @Nullable Path getScratchRoot() {
    return scratchRoot;
  }

  /**
   * Returns the object store type, "local" or "s3".
   */
  public String getStorageType() {
    return storageType;
  }

  /**
   * Returns the object store settings passed to the store factory.
   */
  public Map<String, Object> getStorageConfig() {
    return storageConfig;
  }

  /**
   * Creates a new builder for LakehousePipelineConfig.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the configuration with every setting at its default.
   */
  public static LakehousePipelineConfig defaults() {
    return builder().build();
  }

  /**
   * Loads a configuration from a YAML file.
   *
   * @param file YAML file
   * @return Parsed configuration
   * @throws IOException If the file cannot be read or parsed
   * @throws IllegalArgumentException If a setting is invalid
   */
  public static LakehousePipelineConfig load(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      Map<String, Object> map =
          YAML_MAPPER.readValue(in, new TypeReference<Map<String, Object>>() { });
      return fromMap(map != null ? map : Collections.<String, Object>emptyMap());
    }
  }

  /**
   * Creates a LakehousePipelineConfig from a YAML/JSON map. Missing settings
   * keep their defaults.
   */
  @SuppressWarnings("unchecked")
  public static LakehousePipelineConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }

    Object layersObj = map.get("layers");
    if (layersObj instanceof Map) {
      Map<String, Object> layers = (Map<String, Object>) layersObj;
      String raw = stringValue(layers, "raw");
      if (raw != null) {
        builder.rawPrefix(raw);
      }
      String cleaned = stringValue(layers, "cleaned");
      if (cleaned != null) {
        builder.cleanedPrefix(cleaned);
      }
      String silver = stringValue(layers, "silver");
      if (silver != null) {
        builder.silverPrefix(silver);
      }
      String gold = stringValue(layers, "gold");
      if (gold != null) {
        builder.goldPrefix(gold);
      }
    }

    String rawExtension = stringValue(map, "rawExtension");
    if (rawExtension != null) {
      builder.rawExtension(rawExtension);
    }
    String columnarExtension = stringValue(map, "columnarExtension");
    if (columnarExtension != null) {
      builder.columnarExtension(columnarExtension);
    }

    Object cleaningObj = map.get("cleaning");
    if (cleaningObj instanceof Map) {
      Map<String, Object> cleaning = (Map<String, Object>) cleaningObj;
      String sentinel = stringValue(cleaning, "nullSentinel");
      if (sentinel != null) {
        builder.nullSentinel(sentinel);
      }
      Object lowercaseObj = cleaning.get("lowercaseFieldNames");
      if (lowercaseObj instanceof Boolean) {
        builder.lowercaseFieldNames((Boolean) lowercaseObj);
      }
      String separator = stringValue(cleaning, "flattenSeparator");
      if (separator != null) {
        builder.flattenSeparator(separator);
      }
    }

    Object partitionObj = map.get("partition");
    if (partitionObj instanceof Map) {
      Map<String, Object> partition = (Map<String, Object>) partitionObj;
      String field = stringValue(partition, "field");
      if (field != null) {
        builder.partitionField(field);
      }
      String filePrefix = stringValue(partition, "filePrefix");
      if (filePrefix != null) {
        builder.partitionFilePrefix(filePrefix);
      }
      String policy = stringValue(partition, "onSchemaViolation");
      if (policy != null) {
        builder.partitionSchemaPolicy(SchemaViolationPolicy.fromString(policy));
      }
    }

    Object aggregateObj = map.get("aggregate");
    if (aggregateObj instanceof Map) {
      Map<String, Object> aggregate = (Map<String, Object>) aggregateObj;
      String categoryField = stringValue(aggregate, "categoryField");
      if (categoryField != null) {
        builder.categoryField(categoryField);
      }
      String countColumn = stringValue(aggregate, "countColumn");
      if (countColumn != null) {
        builder.countColumn(countColumn);
      }
      String fileName = stringValue(aggregate, "fileName");
      if (fileName != null) {
        builder.goldFileName(fileName);
      }
      String mode = stringValue(aggregate, "mode");
      if (mode != null) {
        builder.aggregationMode(AggregationMode.fromString(mode));
      }
      String policy = stringValue(aggregate, "onSchemaViolation");
      if (policy != null) {
        builder.aggregateSchemaPolicy(SchemaViolationPolicy.fromString(policy));
      }
    }

    String compression = stringValue(map, "compression");
    if (compression != null) {
      builder.compression(compression);
    }
    String scratchRoot = stringValue(map, "scratchRoot");
    if (scratchRoot != null) {
      builder.scratchRoot(Paths.get(scratchRoot));
    }
    String storageType = stringValue(map, "storageType");
    if (storageType != null) {
      builder.storageType(storageType);
    }
    Object storageConfigObj = map.get("storageConfig");
    if (storageConfigObj instanceof Map) {
      builder.storageConfig((Map<String, Object>) storageConfigObj);
    }

    return builder.build();
  }

  private static @Nullable String stringValue(Map<String, Object> map, String key) {
    Object value = map.get(key);
    return value != null ? value.toString() : null;
  }

  /**
   * Builder for LakehousePipelineConfig.
   */
  public static class Builder {
    private String rawPrefix = "bronze_layer/raw";
    private String cleanedPrefix = "bronze_layer/cleaned";
    private String silverPrefix = "silver_layer";
    private String goldPrefix = "golden_layer";
    private String rawExtension = ".json";
    private String columnarExtension = ".parquet";
    private String nullSentinel = "unknown";
    private boolean lowercaseFieldNames = true;
    private String flattenSeparator = ".";
    private String partitionField = "state";
    private String partitionFilePrefix = "breweries";
    private SchemaViolationPolicy partitionSchemaPolicy = SchemaViolationPolicy.ABORT;
    private String categoryField = "brewery_type";
    private String countColumn = "brewery_count";
    private String goldFileName = "brewery_aggregated_by_type_and_location.parquet";
    private AggregationMode aggregationMode = AggregationMode.PER_FILE;
    private SchemaViolationPolicy aggregateSchemaPolicy = SchemaViolationPolicy.ABORT;
    private String compression = "snappy";
    private @Nullable Path scratchRoot;
    private String storageType = "local";
    private Map<String, Object> storageConfig;

    public Builder rawPrefix(String rawPrefix) {
      this.rawPrefix = rawPrefix;
      return this;
    }

    public Builder cleanedPrefix(String cleanedPrefix) {
      this.cleanedPrefix = cleanedPrefix;
      return this;
    }

    public Builder silverPrefix(String silverPrefix) {
      this.silverPrefix = silverPrefix;
      return this;
    }

    public Builder goldPrefix(String goldPrefix) {
      this.goldPrefix = goldPrefix;
      return this;
    }

    public Builder rawExtension(String rawExtension) {
      this.rawExtension = rawExtension;
      return this;
    }

    public Builder columnarExtension(String columnarExtension) {
      this.columnarExtension = columnarExtension;
      return this;
    }

    public Builder nullSentinel(String nullSentinel) {
      this.nullSentinel = nullSentinel;
      return this;
    }

    public Builder lowercaseFieldNames(boolean lowercaseFieldNames) {
      this.lowercaseFieldNames = lowercaseFieldNames;
      return this;
    }

    public Builder flattenSeparator(String flattenSeparator) {
      this.flattenSeparator = flattenSeparator;
      return this;
    }

    public Builder partitionField(String partitionField) {
      this.partitionField = partitionField;
      return this;
    }

    public Builder partitionFilePrefix(String partitionFilePrefix) {
      this.partitionFilePrefix = partitionFilePrefix;
      return this;
    }

    public Builder partitionSchemaPolicy(SchemaViolationPolicy policy) {
      this.partitionSchemaPolicy = policy;
      return this;
    }

    public Builder categoryField(String categoryField) {
      this.categoryField = categoryField;
      return this;
    }

    public Builder countColumn(String countColumn) {
      this.countColumn = countColumn;
      return this;
    }

    public Builder goldFileName(String goldFileName) {
      this.goldFileName = goldFileName;
      return this;
    }

    public Builder aggregationMode(AggregationMode aggregationMode) {
      this.aggregationMode = aggregationMode;
      return this;
    }

    public Builder aggregateSchemaPolicy(SchemaViolationPolicy policy) {
      this.aggregateSchemaPolicy = policy;
      return this;
    }

    public Builder compression(String compression) {
      this.compression = compression;
      return this;
    }

    public Builder scratchRoot(@Nullable Path scratchRoot) {
      this.scratchRoot = scratchRoot;
      return this;
    }

    public Builder storageType(String storageType) {
      this.storageType = storageType;
      return this;
    }

    public Builder storageConfig(Map<String, Object> storageConfig) {
      this.storageConfig = storageConfig;
      return this;
    }

    public LakehousePipelineConfig build() {
      requireText(rawPrefix, "Raw layer prefix");
      requireText(cleanedPrefix, "Cleaned layer prefix");
      requireText(silverPrefix, "Silver layer prefix");
      requireText(goldPrefix, "Gold layer prefix");
      requireExtension(rawExtension, "Raw extension");
      requireExtension(columnarExtension, "Columnar extension");
      requireText(partitionField, "Partition field");
      requireText(partitionFilePrefix, "Partition file prefix");
      requireText(categoryField, "Category field");
      requireText(countColumn, "Count column");
      requireText(goldFileName, "Gold file name");
      requireText(compression, "Compression codec");
      requireText(storageType, "Storage type");
      if (nullSentinel == null) {
        throw new IllegalArgumentException("Null sentinel is required");
      }
      if (flattenSeparator == null || flattenSeparator.isEmpty()) {
        throw new IllegalArgumentException("Flatten separator is required");
      }
      if (partitionSchemaPolicy == null || aggregateSchemaPolicy == null) {
        throw new IllegalArgumentException("Schema violation policy is required");
      }
      if (aggregationMode == null) {
        throw new IllegalArgumentException("Aggregation mode is required");
      }
      if (cleanedPrefix.equals(rawPrefix)) {
        throw new IllegalArgumentException(
            "Cleaned layer prefix must differ from raw layer prefix: " + rawPrefix);
      }
      if (goldFileName.contains("/")) {
        throw new IllegalArgumentException("Gold file name must not contain '/': " + goldFileName);
      }
      return new LakehousePipelineConfig(this);
    }

    private static void requireText(String value, String what) {
      if (value == null || value.trim().isEmpty()) {
        throw new IllegalArgumentException(what + " is required");
      }
    }

    private static void requireExtension(String value, String what) {
      if (value == null || value.length() < 2 || value.charAt(0) != '.') {
        throw new IllegalArgumentException(what + " must start with '.': " + value);
      }
    }
  }
}
