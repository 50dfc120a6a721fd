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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Value of the partition field shared by all rows of one silver-layer file.
 *
 * <p>Keys order naturally by their text. The {@link #pathSegment() path segment}
 * is URL-encoded, so two distinct keys never map to the same storage location.
 */
public final class PartitionKey implements Comparable<PartitionKey> {

  private final String value;

  private PartitionKey(String value) {
    this.value = value;
  }

  public static PartitionKey of(String value) {
    return new PartitionKey(Objects.requireNonNull(value, "value"));
  }

  /**
   * Creates a key from a field value.
   *
   * @throws IllegalArgumentException if the value is null
   */
  public static PartitionKey of(FieldValue value) {
    String rendered = value.render();
    if (rendered == null) {
      throw new IllegalArgumentException("Partition value cannot be null");
    }
    return new PartitionKey(rendered);
  }

  public String getValue() {
    return value;
  }

  /**
   * Returns the key in a form that is safe to use as one segment of an object
   * key or a local file name.
   */
  public String pathSegment() {
    String encoded = URLEncoder.encode(value, StandardCharsets.UTF_8).replace("*", "%2A");
    // URLEncoder never emits these escapes ('.' stays literal, ' ' becomes '+'),
    // so the substitutions below cannot collide with another key.
    if (encoded.isEmpty()) {
      return "%20";
    }
    if (".".equals(encoded) || "..".equals(encoded)) {
      return encoded.replace(".", "%2E");
    }
    return encoded;
  }

  @Override public int compareTo(PartitionKey other) {
    return value.compareTo(other.value);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof PartitionKey && value.equals(((PartitionKey) o).value);
  }

  @Override public int hashCode() {
    return value.hashCode();
  }

  @Override public String toString() {
    return value;
  }
}
