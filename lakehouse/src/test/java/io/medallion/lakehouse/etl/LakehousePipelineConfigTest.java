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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LakehousePipelineConfig}.
 */
@Tag("unit")
public class LakehousePipelineConfigTest {

  @Test void testDefaults() {
    LakehousePipelineConfig config = LakehousePipelineConfig.defaults();

    assertEquals("bronze_layer/raw", config.getRawPrefix());
    assertEquals("bronze_layer/cleaned", config.getCleanedPrefix());
    assertEquals("silver_layer", config.getSilverPrefix());
    assertEquals("golden_layer", config.getGoldPrefix());
    assertEquals(".json", config.getRawExtension());
    assertEquals(".parquet", config.getColumnarExtension());
    assertEquals("state", config.getPartitionField());
    assertEquals("brewery_type", config.getCategoryField());
    assertEquals("brewery_count", config.getCountColumn());
    assertEquals("breweries", config.getPartitionFilePrefix());
    assertEquals("brewery_aggregated_by_type_and_location.parquet", config.getGoldFileName());
    assertEquals("unknown", config.getNullSentinel());
    assertTrue(config.isLowercaseFieldNames());
    assertEquals(SchemaViolationPolicy.ABORT, config.getPartitionSchemaPolicy());
    assertEquals(SchemaViolationPolicy.ABORT, config.getAggregateSchemaPolicy());
    assertEquals(AggregationMode.PER_FILE, config.getAggregationMode());
    assertEquals("snappy", config.getCompression());
    assertEquals("local", config.getStorageType());
    assertNull(config.getScratchRoot());
  }

  @Test void testFromMapOverridesNestedSections() {
    Map<String, Object> partition = new HashMap<String, Object>();
    partition.put("field", "city");
    partition.put("onSchemaViolation", "skip");
    Map<String, Object> aggregate = new HashMap<String, Object>();
    aggregate.put("mode", "summed");
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("partition", partition);
    map.put("aggregate", aggregate);
    map.put("scratchRoot", "/var/tmp/lakehouse");

    LakehousePipelineConfig config = LakehousePipelineConfig.fromMap(map);

    assertEquals("city", config.getPartitionField());
    assertEquals(SchemaViolationPolicy.SKIP, config.getPartitionSchemaPolicy());
    assertEquals(AggregationMode.SUMMED, config.getAggregationMode());
    assertEquals(Paths.get("/var/tmp/lakehouse"), config.getScratchRoot());
    assertEquals("silver_layer", config.getSilverPrefix());
  }

  @Test void testLoadYaml() throws IOException, URISyntaxException {
    Path file = Paths.get(getClass().getResource("/lakehouse-test.yaml").toURI());

    LakehousePipelineConfig config = LakehousePipelineConfig.load(file);

    assertEquals("landing/raw", config.getRawPrefix());
    assertEquals("landing/cleaned", config.getCleanedPrefix());
    assertEquals("silver", config.getSilverPrefix());
    assertEquals("gold", config.getGoldPrefix());
    assertEquals("missing", config.getNullSentinel());
    assertFalse(config.isLowercaseFieldNames());
    assertEquals("country", config.getPartitionField());
    assertEquals("rows", config.getPartitionFilePrefix());
    assertEquals(SchemaViolationPolicy.SKIP, config.getPartitionSchemaPolicy());
    assertEquals("kind", config.getCategoryField());
    assertEquals("total", config.getCountColumn());
    assertEquals("summary.parquet", config.getGoldFileName());
    assertEquals(AggregationMode.SUMMED, config.getAggregationMode());
    assertEquals(SchemaViolationPolicy.ABORT, config.getAggregateSchemaPolicy());
    assertEquals("gzip", config.getCompression());
    assertEquals("/tmp/lakehouse", config.getStorageConfig().get("directory"));
  }

  @Test void testBuildRejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> LakehousePipelineConfig.builder().rawPrefix("").build());
    assertThrows(IllegalArgumentException.class,
        () -> LakehousePipelineConfig.builder().rawExtension("json").build());
    assertThrows(IllegalArgumentException.class,
        () -> LakehousePipelineConfig.builder().cleanedPrefix("bronze_layer/raw").build());
    assertThrows(IllegalArgumentException.class,
        () -> LakehousePipelineConfig.builder().goldFileName("a/b.parquet").build());
  }

  @Test void testPolicyAndModeParsing() {
    assertEquals(SchemaViolationPolicy.ABORT, SchemaViolationPolicy.fromString(null));
    assertEquals(SchemaViolationPolicy.SKIP, SchemaViolationPolicy.fromString("SKIP"));
    assertEquals(AggregationMode.PER_FILE, AggregationMode.fromString(""));
    assertEquals(AggregationMode.SUMMED, AggregationMode.fromString("Summed"));
    assertThrows(IllegalArgumentException.class, () -> AggregationMode.fromString("avg"));
    assertThrows(IllegalArgumentException.class,
        () -> SchemaViolationPolicy.fromString("ignore"));
  }
}
