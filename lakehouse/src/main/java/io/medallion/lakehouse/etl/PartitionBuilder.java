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

import io.medallion.lakehouse.format.json.JsonRecordCodec;
import io.medallion.lakehouse.format.parquet.ParquetRecordCodec;
import io.medallion.lakehouse.model.DataRecord;
import io.medallion.lakehouse.model.PartitionFile;
import io.medallion.lakehouse.model.PartitionKey;
import io.medallion.lakehouse.model.RecordBatch;
import io.medallion.lakehouse.storage.ObjectKeys;
import io.medallion.lakehouse.storage.ObjectStore;
import io.medallion.lakehouse.util.ScratchDirectory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups the cleaned records by their partition field and writes one Parquet
 * file per distinct value to the silver layer.
 *
 * <p>The file for key {@code k} is stored at
 * {@code <silverPrefix>/<segment>/<filePrefix>_<segment>.parquet}, where
 * {@code segment} is the URL-encoded key. A rerun overwrites the same files.
 *
 * <p>Every file carries the columns of all accepted inputs, in first-seen
 * order; a row lacking a column stores null there.
 *
 * <p>All inputs are read and validated before the first file is written, so
 * a schema violation under the {@link SchemaViolationPolicy#ABORT} policy
 * leaves the silver layer untouched. A write failure stops the stage; files
 * written before it stay in place.
 */
public class PartitionBuilder extends LayerStage<Map<PartitionKey, PartitionFile>> {
  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionBuilder.class);

  private final JsonRecordCodec jsonCodec;
  private final ParquetRecordCodec parquetCodec;

  public PartitionBuilder(ObjectStore store, LakehousePipelineConfig config) {
    super(store, config);
    this.jsonCodec = new JsonRecordCodec(config.getFlattenSeparator());
    this.parquetCodec = new ParquetRecordCodec(config.getCompression());
  }

  @Override public String getName() {
    return "partition";
  }

  @Override public Map<PartitionKey, PartitionFile> run() throws PipelineException {
    String cleanedPrefix = config.getCleanedPrefix();
    List<String> keys = listCandidates(cleanedPrefix, config.getRawExtension());
    return buildPartitions(keys);
  }

  /**
   * Builds the partition files from the given cleaned files.
   *
   * @param cleanedKeys Keys of cleaned files; keys without the JSON extension
   *     are ignored
   * @return Written files by partition key, in write order
   * @throws NoInputException If no key qualifies
   * @throws SchemaException If a file has a record without a partition value
   *     and the policy is ABORT
   * @throws StoreException If a file cannot be read or a partition cannot be
   *     written
   */
  public Map<PartitionKey, PartitionFile> buildPartitions(List<String> cleanedKeys)
      throws PipelineException {
    String partitionField = config.getPartitionField();
    List<String> candidates = new ArrayList<String>();
    for (String key : cleanedKeys) {
      if (ObjectKeys.hasExtension(key, config.getRawExtension())) {
        candidates.add(key);
      } else {
        LOGGER.debug("Skipping '{}': not a {} file", key, config.getRawExtension());
      }
    }
    if (candidates.isEmpty()) {
      throw new NoInputException(config.getCleanedPrefix(),
          "No " + config.getRawExtension() + " files to partition under '"
              + config.getCleanedPrefix() + "'");
    }

    Map<PartitionKey, List<DataRecord>> groups = new TreeMap<PartitionKey, List<DataRecord>>();
    Set<String> columns = new LinkedHashSet<String>();
    for (String key : candidates) {
      RecordBatch batch = readBatch(key);
      int violation = firstViolation(batch, partitionField);
      if (violation >= 0) {
        String message = "Record " + violation + " of '" + key
            + "' has no value for partition field '" + partitionField + "'";
        if (config.getPartitionSchemaPolicy() == SchemaViolationPolicy.SKIP) {
          LOGGER.warn("Skipping '{}': {}", key, message);
          continue;
        }
        throw new SchemaException(key, message);
      }
      columns.addAll(batch.getColumns());
      for (DataRecord row : batch.getRows()) {
        PartitionKey partitionKey = PartitionKey.of(row.get(partitionField));
        groups.computeIfAbsent(partitionKey, k -> new ArrayList<DataRecord>()).add(row);
      }
    }

    Map<PartitionKey, PartitionFile> written = new LinkedHashMap<PartitionKey, PartitionFile>();
    try (ScratchDirectory scratch = openScratch()) {
      for (Map.Entry<PartitionKey, List<DataRecord>> group : groups.entrySet()) {
        PartitionFile file =
            writePartition(scratch, group.getKey(), new ArrayList<String>(columns),
                group.getValue());
        written.put(group.getKey(), file);
      }
    }
    LOGGER.info("Wrote {} partition files under '{}'", written.size(), config.getSilverPrefix());
    return written;
  }

  /**
   * Returns the object key of the file holding a partition.
   */
  public String objectKeyFor(PartitionKey key) {
    String segment = key.pathSegment();
    String fileName = config.getPartitionFilePrefix() + "_" + segment
        + config.getColumnarExtension();
    return ObjectKeys.join(config.getSilverPrefix(), segment, fileName);
  }

  private PartitionFile writePartition(ScratchDirectory scratch, PartitionKey key,
      List<String> columns, List<DataRecord> rows) throws PipelineException {
    String objectKey = objectKeyFor(key);
    Path localFile = scratch.resolve(objectKey);

    try {
      parquetCodec.write(localFile, config.getPartitionFilePrefix(), columns, rows);
    } catch (IOException e) {
      throw new StoreException(localFile.toString(),
          "Failed to write partition '" + key + "' to " + localFile, e);
    }
    try {
      store.put(objectKey, localFile);
    } catch (IOException e) {
      throw new StoreException(objectKey,
          "Failed to upload partition '" + key + "' to '" + objectKey + "'", e);
    }
    LOGGER.debug("Wrote partition '{}' with {} rows to '{}'", key, rows.size(), objectKey);
    return new PartitionFile(key, objectKey, rows.size());
  }

  private RecordBatch readBatch(String key) throws PipelineException {
    try (InputStream in = store.get(key)) {
      return jsonCodec.decode(key, in);
    } catch (IOException e) {
      throw new StoreException(key, "Failed to read cleaned file '" + key + "'", e);
    }
  }

  private static int firstViolation(RecordBatch batch, String partitionField) {
    List<DataRecord> rows = batch.getRows();
    for (int i = 0; i < rows.size(); i++) {
      if (!rows.get(i).hasValue(partitionField)) {
        return i;
      }
    }
    return -1;
  }
}
