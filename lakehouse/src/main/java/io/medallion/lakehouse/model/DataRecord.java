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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered mapping from field name to {@link FieldValue}.
 *
 * <p>The same type carries raw records (any schema, nulls allowed) and
 * cleaned records (normalized names, no nulls). Stages validate the shape they
 * need at their boundary rather than relying on the type.
 */
public final class DataRecord {

  private final Map<String, FieldValue> fields;

  private DataRecord(Map<String, FieldValue> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  /**
   * Creates a record from plain Java values, preserving the map's iteration order.
   */
  public static DataRecord of(Map<String, ?> values) {
    Map<String, FieldValue> fields = new LinkedHashMap<String, FieldValue>();
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      fields.put(entry.getKey(), FieldValue.of(entry.getValue()));
    }
    return new DataRecord(fields);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the value of a field, or null if the record has no such field.
   * A field that is present with a null value returns {@link FieldValue#nullValue()}.
   */
  public @Nullable FieldValue get(String name) {
    return fields.get(name);
  }

  public boolean has(String name) {
    return fields.containsKey(name);
  }

  /** Returns true if the field is present and not null. */
  public boolean hasValue(String name) {
    FieldValue value = fields.get(name);
    return value != null && !value.isNull();
  }

  public Set<String> fieldNames() {
    return fields.keySet();
  }

  public Map<String, FieldValue> fields() {
    return fields;
  }

  public int size() {
    return fields.size();
  }

  /**
   * Returns the record as a map of plain Java values, suitable for JSON
   * serialization.
   */
  public Map<String, Object> toJavaMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    for (Map.Entry<String, FieldValue> entry : fields.entrySet()) {
      map.put(entry.getKey(), entry.getValue().toJava());
    }
    return map;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof DataRecord && fields.equals(((DataRecord) o).fields);
  }

  @Override public int hashCode() {
    return fields.hashCode();
  }

  @Override public String toString() {
    return fields.toString();
  }

  /**
   * Builder for DataRecord.
   */
  public static class Builder {
    private final Map<String, FieldValue> fields = new LinkedHashMap<String, FieldValue>();

    /** Adds a field; {@code value} may be a {@link FieldValue} or a plain Java value. */
    public Builder put(String name, @Nullable Object value) {
      fields.put(name, FieldValue.of(value));
      return this;
    }

    public DataRecord build() {
      return new DataRecord(new LinkedHashMap<String, FieldValue>(fields));
    }
  }
}
