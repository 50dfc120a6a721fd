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

import java.util.Objects;

/**
 * A silver-layer Parquet file holding every cleaned row of one partition key.
 */
public final class PartitionFile {

  private final PartitionKey key;
  private final String objectKey;
  private final long rowCount;

  public PartitionFile(PartitionKey key, String objectKey, long rowCount) {
    this.key = Objects.requireNonNull(key, "key");
    this.objectKey = Objects.requireNonNull(objectKey, "objectKey");
    this.rowCount = rowCount;
  }

  public PartitionKey getKey() {
    return key;
  }

  /** Returns the object-store key the file was uploaded to. */
  public String getObjectKey() {
    return objectKey;
  }

  public long getRowCount() {
    return rowCount;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PartitionFile)) {
      return false;
    }
    PartitionFile that = (PartitionFile) o;
    return rowCount == that.rowCount
        && key.equals(that.key)
        && objectKey.equals(that.objectKey);
  }

  @Override public int hashCode() {
    return Objects.hash(key, objectKey, rowCount);
  }

  @Override public String toString() {
    return "PartitionFile{key=" + key + ", objectKey=" + objectKey + ", rows=" + rowCount + "}";
  }
}
