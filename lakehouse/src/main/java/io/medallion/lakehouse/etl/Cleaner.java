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
import io.medallion.lakehouse.model.DataRecord;
import io.medallion.lakehouse.model.FieldValue;
import io.medallion.lakehouse.model.RecordBatch;
import io.medallion.lakehouse.storage.ObjectKeys;
import io.medallion.lakehouse.storage.ObjectStore;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes raw records and writes them to the cleaned layer.
 *
 * <p>Cleaning a batch:
 * <ul>
 *   <li>replaces every whitespace character of a field name with {@code _}
 *   and, unless disabled, lowercases the name;</li>
 *   <li>lowercases text values and replaces each run of whitespace with a
 *   single {@code _}; numbers and booleans are kept;</li>
 *   <li>replaces null values, and fields that a record lacks but another
 *   record of the batch has, with the null sentinel.</li>
 * </ul>
 * Every cleaned record therefore has the same columns, in order of first
 * appearance. Cleaning a cleaned batch returns it unchanged.
 */
public class Cleaner extends LayerStage<List<String>> {
  private static final Logger LOGGER = LoggerFactory.getLogger(Cleaner.class);

  private static final Pattern WHITESPACE = Pattern.compile("\\s");
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  private final JsonRecordCodec codec;
  private final FieldValue sentinel;

  public Cleaner(ObjectStore store, LakehousePipelineConfig config) {
    super(store, config);
    this.codec = new JsonRecordCodec(config.getFlattenSeparator());
    this.sentinel = FieldValue.text(normalizeText(config.getNullSentinel()));
  }

  @Override public String getName() {
    return "clean";
  }

  /**
   * Cleans every raw file and writes one cleaned file per input, with the
   * same base name, under the cleaned prefix.
   *
   * @return Keys of the cleaned files, in listing order
   */
  @Override public List<String> run() throws PipelineException {
    String rawPrefix = config.getRawPrefix();
    List<String> rawKeys = listCandidates(rawPrefix, config.getRawExtension());
    if (rawKeys.isEmpty()) {
      throw new NoInputException(rawPrefix,
          "No " + config.getRawExtension() + " files found under '" + rawPrefix + "'");
    }

    List<String> cleanedKeys = new ArrayList<String>();
    for (String rawKey : rawKeys) {
      cleanedKeys.add(cleanFile(rawKey));
    }
    LOGGER.info("Cleaned {} files from '{}' into '{}'",
        cleanedKeys.size(), rawPrefix, config.getCleanedPrefix());
    return cleanedKeys;
  }

  /**
   * Cleans one raw file and stores the result under the cleaned prefix.
   *
   * @param rawKey Key of the raw file
   * @return Key of the cleaned file
   * @throws StoreException If the file cannot be read, decoded or written
   */
  public String cleanFile(String rawKey) throws PipelineException {
    RecordBatch batch;
    try (InputStream in = store.get(rawKey)) {
      batch = codec.decode(rawKey, in);
    } catch (IOException e) {
      throw new StoreException(rawKey, "Failed to read raw file '" + rawKey + "'", e);
    }

    List<DataRecord> cleaned = clean(batch.getRows());
    String cleanedKey =
        ObjectKeys.join(config.getCleanedPrefix(), ObjectKeys.baseName(rawKey));
    try {
      store.put(cleanedKey, codec.encode(cleaned));
    } catch (IOException e) {
      throw new StoreException(cleanedKey, "Failed to write cleaned file '" + cleanedKey + "'", e);
    }
    LOGGER.debug("Cleaned {} rows from '{}' into '{}'", cleaned.size(), rawKey, cleanedKey);
    return cleanedKey;
  }

  /**
   * Cleans a batch of records. Does not touch the store.
   *
   * @param rawBatch Raw records
   * @return Cleaned records, in input order
   */
  public List<DataRecord> clean(List<DataRecord> rawBatch) {
    List<Map<String, FieldValue>> renamed = new ArrayList<Map<String, FieldValue>>();
    Set<String> columns = new LinkedHashSet<String>();
    for (DataRecord record : rawBatch) {
      Map<String, FieldValue> fields = new LinkedHashMap<String, FieldValue>();
      for (Map.Entry<String, FieldValue> entry : record.fields().entrySet()) {
        String name = normalizeName(entry.getKey());
        fields.put(name, entry.getValue());
        columns.add(name);
      }
      renamed.add(fields);
    }

    List<DataRecord> cleaned = new ArrayList<DataRecord>(renamed.size());
    for (Map<String, FieldValue> fields : renamed) {
      DataRecord.Builder builder = DataRecord.builder();
      for (String column : columns) {
        builder.put(column, normalizeValue(fields.get(column)));
      }
      cleaned.add(builder.build());
    }
    return cleaned;
  }

  String normalizeName(String name) {
    String replaced = WHITESPACE.matcher(name).replaceAll("_");
    return config.isLowercaseFieldNames() ? replaced.toLowerCase(Locale.ROOT) : replaced;
  }

  private FieldValue normalizeValue(@Nullable FieldValue value) {
    if (value == null || value.isNull()) {
      return sentinel;
    }
    if (value.isText()) {
      return FieldValue.text(normalizeText(value.asText()));
    }
    return value;
  }

  static String normalizeText(String text) {
    return WHITESPACE_RUN.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("_");
  }
}
