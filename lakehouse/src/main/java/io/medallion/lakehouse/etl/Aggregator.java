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

import io.medallion.lakehouse.format.parquet.ParquetRecordCodec;
import io.medallion.lakehouse.model.AggregateRow;
import io.medallion.lakehouse.model.DataRecord;
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
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts the silver rows per (category, partition key) pair and writes the
 * counts as one Parquet file to the gold layer.
 *
 * <p>In {@link AggregationMode#PER_FILE} mode each silver file is counted on
 * its own and the per-file rows are concatenated in listing order, so a pair
 * that occurs in two files yields two rows. {@link AggregationMode#SUMMED}
 * adds the counts up into one row per pair instead.
 *
 * <p>The gold file has three columns: the category field, the partition
 * field and the count column (a long).
 */
public class Aggregator extends LayerStage<List<AggregateRow>> {
  private static final Logger LOGGER = LoggerFactory.getLogger(Aggregator.class);

  private final ParquetRecordCodec codec;

  public Aggregator(ObjectStore store, LakehousePipelineConfig config) {
    super(store, config);
    this.codec = new ParquetRecordCodec(config.getCompression());
  }

  @Override public String getName() {
    return "aggregate";
  }

  @Override public List<AggregateRow> run() throws PipelineException {
    List<String> keys = listCandidates(config.getSilverPrefix(), config.getColumnarExtension());
    return aggregate(keys);
  }

  /**
   * Returns the object key of the gold file.
   */
  public String goldKey() {
    return ObjectKeys.join(config.getGoldPrefix(), config.getGoldFileName());
  }

  /**
   * Aggregates the given silver files and writes the gold file.
   *
   * @param silverKeys Keys of silver files; keys without the columnar
   *     extension are ignored
   * @return Aggregate rows, in the order they were written
   * @throws NoInputException If no key qualifies
   * @throws SchemaException If a file lacks the category or partition column
   *     and the policy is ABORT
   * @throws EmptyResultException If no row was counted
   * @throws StoreException If a file cannot be read or the gold file cannot
   *     be written
   */
  public List<AggregateRow> aggregate(List<String> silverKeys) throws PipelineException {
    List<String> candidates = new ArrayList<String>();
    for (String key : silverKeys) {
      if (ObjectKeys.hasExtension(key, config.getColumnarExtension())) {
        candidates.add(key);
      } else {
        LOGGER.debug("Ignoring '{}': not a {} file", key, config.getColumnarExtension());
      }
    }
    if (candidates.isEmpty()) {
      throw new NoInputException(config.getSilverPrefix(),
          "No " + config.getColumnarExtension() + " files to aggregate under '"
              + config.getSilverPrefix() + "'");
    }

    List<AggregateRow> result;
    try (ScratchDirectory scratch = openScratch()) {
      List<List<AggregateRow>> partials = new ArrayList<List<AggregateRow>>();
      for (String key : candidates) {
        RecordBatch batch = readBatch(key, scratch.getPath());
        if (!checkColumns(batch)) {
          continue;
        }
        List<AggregateRow> partial = countFile(batch);
        LOGGER.debug("Counted {} pairs in '{}'", partial.size(), key);
        partials.add(partial);
      }

      result = combine(partials);
      if (result.isEmpty()) {
        throw new EmptyResultException(config.getSilverPrefix(),
            "No aggregate rows produced from '" + config.getSilverPrefix() + "'");
      }
      writeGold(scratch, result);
    }
    LOGGER.info("Wrote {} aggregate rows to '{}'", result.size(), goldKey());
    return result;
  }

  /**
   * Counts the rows of one file per (category, key) pair, ordered by category
   * then key. Rows lacking either value are not counted.
   */
  List<AggregateRow> countFile(RecordBatch batch) {
    Map<List<String>, Long> counts = new TreeMap<List<String>, Long>(Aggregator::comparePairs);
    for (DataRecord row : batch.getRows()) {
      if (!row.hasValue(config.getCategoryField()) || !row.hasValue(config.getPartitionField())) {
        continue;
      }
      List<String> pair = Arrays.asList(
          row.get(config.getCategoryField()).render(),
          row.get(config.getPartitionField()).render());
      counts.merge(pair, 1L, Long::sum);
    }
    return toRows(counts);
  }

  private List<AggregateRow> combine(List<List<AggregateRow>> partials) {
    List<AggregateRow> rows = new ArrayList<AggregateRow>();
    switch (config.getAggregationMode()) {
      case SUMMED:
        Map<List<String>, Long> totals =
            new TreeMap<List<String>, Long>(Aggregator::comparePairs);
        for (List<AggregateRow> partial : partials) {
          for (AggregateRow row : partial) {
            totals.merge(Arrays.asList(row.getCategory(), row.getPartitionKey()),
                row.getCount(), Long::sum);
          }
        }
        rows.addAll(toRows(totals));
        break;
      case PER_FILE:
      default:
        for (List<AggregateRow> partial : partials) {
          rows.addAll(partial);
        }
        break;
    }
    return rows;
  }

  private boolean checkColumns(RecordBatch batch) throws PipelineException {
    List<String> missing = new ArrayList<String>();
    if (!batch.hasColumn(config.getCategoryField())) {
      missing.add(config.getCategoryField());
    }
    if (!batch.hasColumn(config.getPartitionField())) {
      missing.add(config.getPartitionField());
    }
    if (missing.isEmpty()) {
      return true;
    }
    String message = "Silver file '" + batch.getSourceKey() + "' lacks column(s) " + missing;
    if (config.getAggregateSchemaPolicy() == SchemaViolationPolicy.SKIP) {
      LOGGER.warn("Skipping '{}': {}", batch.getSourceKey(), message);
      return false;
    }
    throw new SchemaException(batch.getSourceKey(), message);
  }

  private void writeGold(ScratchDirectory scratch, List<AggregateRow> rows)
      throws PipelineException {
    String goldKey = goldKey();
    Path localFile = scratch.resolve(goldKey);
    List<String> columns = Arrays.asList(
        config.getCategoryField(), config.getPartitionField(), config.getCountColumn());

    List<DataRecord> records = new ArrayList<DataRecord>(rows.size());
    for (AggregateRow row : rows) {
      records.add(DataRecord.builder()
          .put(config.getCategoryField(), row.getCategory())
          .put(config.getPartitionField(), row.getPartitionKey())
          .put(config.getCountColumn(), row.getCount())
          .build());
    }

    try {
      codec.write(localFile, recordName(config.getGoldFileName()), columns, records);
    } catch (IOException e) {
      throw new StoreException(localFile.toString(),
          "Failed to write gold file " + localFile, e);
    }
    try {
      store.put(goldKey, localFile);
    } catch (IOException e) {
      throw new StoreException(goldKey, "Failed to upload gold file '" + goldKey + "'", e);
    }
  }

  private RecordBatch readBatch(String key, Path scratchDir) throws PipelineException {
    try (InputStream in = store.get(key)) {
      return codec.read(key, in, scratchDir);
    } catch (IOException e) {
      throw new StoreException(key, "Failed to read silver file '" + key + "'", e);
    }
  }

  private static List<AggregateRow> toRows(Map<List<String>, Long> counts) {
    List<AggregateRow> rows = new ArrayList<AggregateRow>(counts.size());
    for (Map.Entry<List<String>, Long> entry : counts.entrySet()) {
      rows.add(new AggregateRow(entry.getKey().get(0), entry.getKey().get(1), entry.getValue()));
    }
    return rows;
  }

  private static int comparePairs(List<String> a, List<String> b) {
    int c = a.get(0).compareTo(b.get(0));
    return c != 0 ? c : a.get(1).compareTo(b.get(1));
  }

  private static String recordName(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
