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
import io.medallion.lakehouse.storage.ObjectKeys;
import io.medallion.lakehouse.storage.ObjectStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Stores an already fetched batch of source records, unchanged, in the raw
 * landing layer.
 */
public class RawLanding {
  private static final Logger LOGGER = LoggerFactory.getLogger(RawLanding.class);

  private final ObjectStore store;
  private final LakehousePipelineConfig config;
  private final JsonRecordCodec codec;

  public RawLanding(ObjectStore store, LakehousePipelineConfig config) {
    this.store = store;
    this.config = config;
    this.codec = new JsonRecordCodec(config.getFlattenSeparator());
  }

  /**
   * Writes records as one JSON array file under the raw prefix.
   *
   * @param records Source records, nested values allowed
   * @param fileName Base name of the file; must carry the raw extension
   * @return Key of the written file
   * @throws StoreException If the upload fails
   */
  public String land(List<Map<String, Object>> records, String fileName)
      throws PipelineException {
    if (fileName == null || fileName.isEmpty() || fileName.contains("/")) {
      throw new IllegalArgumentException("Invalid raw file name: " + fileName);
    }
    if (!ObjectKeys.hasExtension(fileName, config.getRawExtension())) {
      throw new IllegalArgumentException(
          "Raw file name must end with " + config.getRawExtension() + ": " + fileName);
    }

    String key = ObjectKeys.join(config.getRawPrefix(), fileName);
    try {
      store.put(key, codec.encodeMaps(records));
    } catch (IOException e) {
      throw new StoreException(key, "Failed to write raw file '" + key + "'", e);
    }
    LOGGER.info("Landed {} raw records at '{}'", records.size(), key);
    return key;
  }
}
