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

import io.medallion.lakehouse.storage.ObjectKeys;
import io.medallion.lakehouse.storage.ObjectStore;
import io.medallion.lakehouse.util.ScratchDirectory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class of the stages that read one layer of the object store and write
 * the next.
 *
 * <p>{@link #run()} reports failures as {@link PipelineException}s;
 * {@link #execute()} runs the stage and reports the outcome as a
 * {@link StageResult} instead.
 *
 * @param <T> Type of the stage output
 */
public abstract class LayerStage<T> {
  private static final Logger LOGGER = LoggerFactory.getLogger(LayerStage.class);

  protected final ObjectStore store;
  protected final LakehousePipelineConfig config;

  protected LayerStage(ObjectStore store, LakehousePipelineConfig config) {
    this.store = store;
    this.config = config;
  }

  /**
   * Returns a short name of the stage for logs and results.
   */
  public abstract String getName();

  /**
   * Runs the stage against the whole source prefix.
   *
   * @return Stage output
   * @throws PipelineException If the stage fails
   */
  public abstract T run() throws PipelineException;

  /**
   * Runs the stage, capturing any failure in the returned result.
   */
  public StageResult<T> execute() {
    String name = getName();
    LOGGER.info("Starting stage: {}", name);
    long startTime = System.currentTimeMillis();
    try {
      T output = run();
      long elapsed = System.currentTimeMillis() - startTime;
      LOGGER.info("Stage '{}' complete in {}ms", name, elapsed);
      return StageResult.success(name, output, elapsed);
    } catch (PipelineException e) {
      long elapsed = System.currentTimeMillis() - startTime;
      LOGGER.error(String.format("Stage '%s' failed after %dms (%s at '%s'): %s",
          name, elapsed, e.getKind(), e.getContext(), e.getMessage()), e);
      return StageResult.failure(name, e, elapsed);
    }
  }

  /**
   * Lists the keys under a layer prefix that carry the given extension.
   *
   * @param prefix Layer prefix
   * @param extension Required extension
   * @return Matching keys in listing order
   * @throws NoInputException If nothing at all is stored under the prefix
   * @throws StoreException If the listing fails
   */
  protected List<String> listCandidates(String prefix, String extension)
      throws PipelineException {
    String listingPrefix = ObjectKeys.directoryPrefix(prefix);
    List<ObjectStore.ObjectEntry> entries;
    try {
      entries = store.list(listingPrefix);
    } catch (IOException e) {
      throw new StoreException(listingPrefix, "Failed to list '" + listingPrefix + "'", e);
    }
    if (entries.isEmpty()) {
      throw new NoInputException(listingPrefix, "No files found under '" + listingPrefix + "'");
    }

    List<String> keys = new ArrayList<String>();
    for (ObjectStore.ObjectEntry entry : entries) {
      if (ObjectKeys.hasExtension(entry.getKey(), extension)) {
        keys.add(entry.getKey());
      } else {
        LOGGER.debug("Skipping '{}': not a {} file", entry.getKey(), extension);
      }
    }
    return keys;
  }

  /**
   * Creates the run-scoped scratch directory of this stage.
   *
   * @throws StoreException If the directory cannot be created
   */
  protected ScratchDirectory openScratch() throws PipelineException {
    try {
      return ScratchDirectory.create(config.getScratchRoot(), getName());
    } catch (IOException e) {
      String root = config.getScratchRoot() != null
          ? config.getScratchRoot().toString()
          : System.getProperty("java.io.tmpdir");
      throw new StoreException(root, "Failed to create scratch directory under " + root, e);
    }
  }
}
