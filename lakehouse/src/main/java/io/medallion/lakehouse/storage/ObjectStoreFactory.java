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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Creates {@link ObjectStore} instances from a store type and a settings map.
 *
 * <p>Supported types:
 * <ul>
 *   <li>{@code local} - {@link LocalFileObjectStore}; setting {@code directory}
 *   (default: the working directory)</li>
 *   <li>{@code s3} (alias {@code minio}) - {@link S3ObjectStore}; see
 *   {@link S3ObjectStore#create(Map)}</li>
 * </ul>
 */
public final class ObjectStoreFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreFactory.class);

  private ObjectStoreFactory() {
  }

  /**
   * Creates an object store.
   *
   * @param storageType Store type
   * @param storageConfig Store settings
   * @return Object store
   * @throws IllegalArgumentException If the type is unknown or a required
   *     setting is missing
   */
  public static ObjectStore createFromType(String storageType, Map<String, Object> storageConfig) {
    if (storageType == null) {
      throw new IllegalArgumentException("Storage type is required");
    }
    switch (storageType.toLowerCase(Locale.ROOT)) {
      case "local":
      case "file":
        Object directory = storageConfig.get("directory");
        String root = directory != null ? directory.toString() : ".";
        LOGGER.debug("Creating local object store rooted at {}", root);
        return new LocalFileObjectStore(Paths.get(root));
      case "s3":
      case "minio":
        return S3ObjectStore.create(storageConfig);
      default:
        throw new IllegalArgumentException("Unsupported storage type: " + storageType);
    }
  }
}
