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
package io.medallion.lakehouse.format.json;

import io.medallion.lakehouse.model.DataRecord;
import io.medallion.lakehouse.model.RecordBatch;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the row-oriented JSON files of the raw and cleaned layers.
 *
 * <p>A file holds a JSON array of objects. A file holding a single top-level
 * object is read as a one-row batch. Nested objects are flattened on read.
 */
public class JsonRecordCodec {
  private final ObjectMapper mapper;
  private final JsonFlattener flattener;

  public JsonRecordCodec() {
    this(".");
  }

  public JsonRecordCodec(String flattenSeparator) {
    this.mapper = new ObjectMapper();
    this.flattener = new JsonFlattener(mapper, flattenSeparator, ",");
  }

  /**
   * Decodes one JSON file.
   *
   * @param sourceKey Key the content was read from, kept on the batch
   * @param input JSON content
   * @return Decoded batch
   * @throws IOException If the content is not JSON, or not an object or an
   *     array of objects
   */
  public RecordBatch decode(String sourceKey, InputStream input) throws IOException {
    Object root = mapper.readValue(input, Object.class);
    List<DataRecord> rows = new ArrayList<DataRecord>();

    if (root instanceof Map) {
      rows.add(toRecord(root));
    } else if (root instanceof List) {
      int index = 0;
      for (Object element : (List<?>) root) {
        if (!(element instanceof Map)) {
          throw new IOException("Element " + index + " of " + sourceKey
              + " is not a JSON object");
        }
        rows.add(toRecord(element));
        index++;
      }
    } else {
      throw new IOException("Expected a JSON array of objects in " + sourceKey);
    }
    return RecordBatch.of(sourceKey, rows);
  }

  /**
   * Encodes rows as a JSON array of objects, preserving field order.
   */
  public byte[] encode(List<DataRecord> rows) throws IOException {
    List<Map<String, Object>> maps = new ArrayList<Map<String, Object>>(rows.size());
    for (DataRecord row : rows) {
      maps.add(row.toJavaMap());
    }
    return mapper.writeValueAsBytes(maps);
  }

  /**
   * Encodes plain maps, as fetched from the source API, without flattening.
   */
  public byte[] encodeMaps(List<Map<String, Object>> rows) throws IOException {
    return mapper.writeValueAsBytes(rows);
  }

  private DataRecord toRecord(Object element) throws IOException {
    @SuppressWarnings("unchecked")
    Map<String, Object> object = (Map<String, Object>) element;
    return DataRecord.of(flattener.flatten(object));
  }
}
