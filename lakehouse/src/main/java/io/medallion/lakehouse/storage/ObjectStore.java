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
package io.medallion.lakehouse.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Key-addressed object storage consumed by the layer stages.
 *
 * <p>Keys are slash-separated strings without a leading slash, for example
 * {@code silver_layer/ca/breweries_ca.parquet}. Implementations exist for the
 * local filesystem and for S3-compatible services (AWS S3, MinIO).
 */
public interface ObjectStore {

  /**
   * Lists every object whose key starts with the given prefix, in ascending
   * key order. An empty list is a valid result.
   *
   * @param prefix Key prefix
   * @return Object entries under the prefix
   * @throws IOException If the listing fails
   */
  List<ObjectEntry> list(String prefix) throws IOException;

  /**
   * Opens an object's full content for reading.
   *
   * @param key Object key
   * @return Stream over the object content; the caller closes it
   * @throws IOException If the object cannot be read
   */
  InputStream get(String key) throws IOException;

  /**
   * Creates or overwrites an object.
   *
   * @param key Object key
   * @param content Object content
   * @throws IOException If the upload fails
   */
  void put(String key, byte[] content) throws IOException;

  /**
   * Uploads a local file, creating or overwriting the object.
   *
   * @param key Object key
   * @param localFile File to upload
   * @throws IOException If the file cannot be read or the upload fails
   */
  default void put(String key, Path localFile) throws IOException {
    put(key, Files.readAllBytes(localFile));
  }

  /**
   * Returns a short identifier of the store type, e.g. "local" or "s3".
   */
  String getStoreType();

  /**
   * Entry in an object listing.
   */
  class ObjectEntry {
    private final String key;
    private final long size;

    public ObjectEntry(String key, long size) {
      this.key = key;
      this.size = size;
    }

    public String getKey() {
      return key;
    }

    public long getSize() {
      return size;
    }

    @Override public String toString() {
      return key + " (" + size + " bytes)";
    }
  }
}
