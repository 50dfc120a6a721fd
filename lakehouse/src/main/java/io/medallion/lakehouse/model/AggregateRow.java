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

import java.util.Comparator;
import java.util.Objects;

/**
 * One gold-layer row: the number of rows sharing a category and a partition key.
 */
public final class AggregateRow {

  /** Orders rows by category, then partition key. */
  public static final Comparator<AggregateRow> DIMENSION_ORDER =
      Comparator.comparing(AggregateRow::getCategory)
          .thenComparing(AggregateRow::getPartitionKey);

  private final String category;
  private final String partitionKey;
  private final long count;

  public AggregateRow(String category, String partitionKey, long count) {
    if (count < 0) {
      throw new IllegalArgumentException("Count must be non-negative: " + count);
    }
    this.category = Objects.requireNonNull(category, "category");
    this.partitionKey = Objects.requireNonNull(partitionKey, "partitionKey");
    this.count = count;
  }

  public String getCategory() {
    return category;
  }

  public String getPartitionKey() {
    return partitionKey;
  }

  public long getCount() {
    return count;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AggregateRow)) {
      return false;
    }
    AggregateRow that = (AggregateRow) o;
    return count == that.count
        && category.equals(that.category)
        && partitionKey.equals(that.partitionKey);
  }

  @Override public int hashCode() {
    return Objects.hash(category, partitionKey, count);
  }

  @Override public String toString() {
    return "(" + category + ", " + partitionKey + ", " + count + ")";
  }
}
