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
package io.medallion.lakehouse.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decoded content of one stored file: its key, its columns and its rows.
 *
 * <p>Columns are the union of the field names of all rows in order of first
 * appearance, unless the file format carries its own schema (Parquet), in
 * which case they are the schema's fields even when every row is empty.
 */
public final class RecordBatch {

  private final String sourceKey;
  private final List<String> columns;
  private final List<DataRecord> rows;

  public RecordBatch(String sourceKey, List<String> columns, List<DataRecord> rows) {
    this.sourceKey = sourceKey;
    this.columns = Collections.unmodifiableList(new ArrayList<String>(columns));
    this.rows = Collections.unmodifiableList(new ArrayList<DataRecord>(rows));
  }

  /**
   * Creates a batch whose columns are derived from its rows.
   */
  public static RecordBatch of(String sourceKey, List<DataRecord> rows) {
    return new RecordBatch(sourceKey, columnsOf(rows), rows);
  }

  /**
   * Returns the union of field names of the given rows, in order of first appearance.
   */
  public static List<String> columnsOf(List<DataRecord> rows) {
    Set<String> names = new LinkedHashSet<String>();
    for (DataRecord row : rows) {
      names.addAll(row.fieldNames());
    }
    return new ArrayList<String>(names);
  }

  public String getSourceKey() {
    return sourceKey;
  }

  public List<String> getColumns() {
    return columns;
  }

  public List<DataRecord> getRows() {
    return rows;
  }

  public boolean hasColumn(String name) {
    return columns.contains(name);
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  @Override public String toString() {
    return "RecordBatch{source=" + sourceKey + ", columns=" + columns
        + ", rows=" + rows.size() + "}";
  }
}
