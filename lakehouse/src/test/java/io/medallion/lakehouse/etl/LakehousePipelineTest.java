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

import io.medallion.lakehouse.model.AggregateRow;
import io.medallion.lakehouse.storage.LocalFileObjectStore;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the whole pipeline over a local object store.
 */
@Tag("unit")
public class LakehousePipelineTest {

  @TempDir
  Path tempDir;

  private static Map<String, Object> brewery(String name, String type, String state,
      String city) {
    Map<String, Object> address = new LinkedHashMap<String, Object>();
    address.put("city", city);
    Map<String, Object> record = new LinkedHashMap<String, Object>();
    record.put("Name", name);
    record.put("brewery_type", type);
    record.put("State", state);
    record.put("address", address);
    return record;
  }

  private LakehousePipelineConfig config() {
    return LakehousePipelineConfig.builder().scratchRoot(tempDir.resolve("scratch")).build();
  }

  @Test void testEndToEnd() throws IOException {
    LocalFileObjectStore store = new LocalFileObjectStore(tempDir.resolve("store"));
    LakehousePipelineConfig config = config();
    RawLanding landing = new RawLanding(store, config);
    landing.land(Arrays.asList(
        brewery("Alpha", "micro", "Texas", "Austin"),
        brewery("Beta", "brewpub", "Texas", "Dallas")), "page_1.json");
    landing.land(Arrays.asList(
        brewery("Gamma", "micro", "New York", "Buffalo"),
        brewery("Delta", "micro", "Texas", null)), "page_2.json");

    PipelineResult result = new LakehousePipeline(store, config).execute();

    assertTrue(result.isSuccess(), String.valueOf(result));
    assertEquals(3, result.getStages().size());
    assertNull(result.getFailedStage());

    List<String> silverKeys = new ArrayList<String>();
    store.list("silver_layer/").forEach(e -> silverKeys.add(e.getKey()));
    assertEquals(Arrays.asList(
        "silver_layer/new_york/breweries_new_york.parquet",
        "silver_layer/texas/breweries_texas.parquet"), silverKeys);

    StageResult<?> aggregate = result.getStage("aggregate");
    assertNotNull(aggregate);
    assertEquals(Arrays.asList(
        new AggregateRow("micro", "new_york", 1),
        new AggregateRow("brewpub", "texas", 1),
        new AggregateRow("micro", "texas", 2)), aggregate.getOutput());
    assertEquals(1, store.list("golden_layer/").size());
  }

  @Test void testStopsAfterFirstFailure() {
    LocalFileObjectStore store = new LocalFileObjectStore(tempDir.resolve("store"));

    PipelineResult result = new LakehousePipeline(store, config()).execute();

    assertFalse(result.isSuccess());
    assertEquals(1, result.getStages().size());
    StageResult<?> failed = result.getFailedStage();
    assertNotNull(failed);
    assertEquals("clean", failed.getStageName());
    assertEquals(ErrorKind.NO_INPUT, failed.getKind());
    assertNull(result.getStage("partition"));
  }

  @Test void testSchemaFailureLeavesLaterLayersEmpty() throws IOException {
    LocalFileObjectStore store = new LocalFileObjectStore(tempDir.resolve("store"));
    LakehousePipelineConfig config = config();
    Map<String, Object> stateless = new HashMap<String, Object>();
    stateless.put("name", "Nowhere");
    stateless.put("brewery_type", "micro");
    new RawLanding(store, config).land(Collections.singletonList(stateless), "page_1.json");

    PipelineResult result = new LakehousePipeline(store, config).execute();

    assertFalse(result.isSuccess());
    assertEquals(2, result.getStages().size());
    StageResult<?> failed = result.getFailedStage();
    assertNotNull(failed);
    assertEquals("partition", failed.getStageName());
    assertEquals(ErrorKind.SCHEMA, failed.getKind());
    assertEquals("bronze_layer/cleaned/page_1.json", failed.getContext());
    assertTrue(store.list("silver_layer/").isEmpty());
    assertTrue(store.list("golden_layer/").isEmpty());
  }

  @Test void testFromConfigUsesLocalStore() throws IOException {
    Path root = tempDir.resolve("store");
    Map<String, Object> storageConfig = new HashMap<String, Object>();
    storageConfig.put("directory", root.toString());
    LakehousePipelineConfig config = LakehousePipelineConfig.builder()
        .scratchRoot(tempDir.resolve("scratch"))
        .storageType("local")
        .storageConfig(storageConfig)
        .build();
    new RawLanding(new LocalFileObjectStore(root), config).land(
        Collections.singletonList(brewery("Alpha", "micro", "Ohio", "Akron")), "page_1.json");

    PipelineResult result = LakehousePipeline.fromConfig(config).execute();

    assertTrue(result.isSuccess(), String.valueOf(result));
    assertEquals(1, new LocalFileObjectStore(root).list("golden_layer/").size());
  }

  @Test void testPagesWithDifferentFieldsStillAggregate() throws IOException {
    LocalFileObjectStore store = new LocalFileObjectStore(tempDir.resolve("store"));
    LakehousePipelineConfig config = config();
    Map<String, Object> typed = new LinkedHashMap<String, Object>();
    typed.put("brewery_type", "micro");
    typed.put("state", "CA");
    Map<String, Object> untyped = new LinkedHashMap<String, Object>();
    untyped.put("name", "x");
    untyped.put("state", "TX");
    RawLanding landing = new RawLanding(store, config);
    landing.land(Collections.singletonList(typed), "page_1.json");
    landing.land(Collections.singletonList(untyped), "page_2.json");

    PipelineResult result = new LakehousePipeline(store, config).execute();

    assertTrue(result.isSuccess(), String.valueOf(result));
    StageResult<?> aggregate = result.getStage("aggregate");
    assertNotNull(aggregate);
    assertEquals(Collections.singletonList(new AggregateRow("micro", "ca", 1)),
        aggregate.getOutput());
  }
}
