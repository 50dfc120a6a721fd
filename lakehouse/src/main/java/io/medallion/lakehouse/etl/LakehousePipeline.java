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

import io.medallion.lakehouse.storage.ObjectStore;
import io.medallion.lakehouse.storage.ObjectStoreFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the cleaning, partitioning and aggregation stages in order against one
 * object store.
 *
 * <p>Each stage reads only what the previous one wrote. The run stops at the
 * first failed stage; later stages are not invoked. There is no retry.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * LakehousePipelineConfig config = LakehousePipelineConfig.load(Paths.get("lakehouse.yaml"));
 * PipelineResult result = LakehousePipeline.fromConfig(config).execute();
 * if (!result.isSuccess()) {
 *   System.err.println("Failed: " + result.getFailedStage());
 * }
 * }</pre>
 */
public class LakehousePipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(LakehousePipeline.class);

  static final int STAGE_COUNT = 3;

  private final ObjectStore store;
  private final Cleaner cleaner;
  private final PartitionBuilder partitionBuilder;
  private final Aggregator aggregator;

  public LakehousePipeline(ObjectStore store, LakehousePipelineConfig config) {
    this.store = store;
    this.cleaner = new Cleaner(store, config);
    this.partitionBuilder = new PartitionBuilder(store, config);
    this.aggregator = new Aggregator(store, config);
  }

  /**
   * Creates a pipeline over the object store the configuration describes.
   */
  public static LakehousePipeline fromConfig(LakehousePipelineConfig config) {
    ObjectStore store =
        ObjectStoreFactory.createFromType(config.getStorageType(), config.getStorageConfig());
    return new LakehousePipeline(store, config);
  }

  public Cleaner getCleaner() {
    return cleaner;
  }

  public PartitionBuilder getPartitionBuilder() {
    return partitionBuilder;
  }

  public Aggregator getAggregator() {
    return aggregator;
  }

  /**
   * Runs the stages in order, stopping at the first failure.
   *
   * @return Results of the stages that ran
   */
  public PipelineResult execute() {
    LOGGER.info("Starting lakehouse pipeline on {} store", store.getStoreType());
    long startTime = System.currentTimeMillis();

    List<StageResult<?>> results = new ArrayList<StageResult<?>>();
    List<LayerStage<?>> stages = Arrays.<LayerStage<?>>asList(cleaner, partitionBuilder, aggregator);
    for (LayerStage<?> stage : stages) {
      StageResult<?> result = stage.execute();
      results.add(result);
      if (result.isFailure()) {
        LOGGER.warn("Stopping pipeline after failed stage '{}'", stage.getName());
        break;
      }
    }

    long elapsed = System.currentTimeMillis() - startTime;
    PipelineResult pipelineResult = new PipelineResult(results, elapsed);
    LOGGER.info("Lakehouse pipeline finished in {}ms: {}", elapsed,
        pipelineResult.isSuccess() ? "success" : "failed");
    return pipelineResult;
  }
}
