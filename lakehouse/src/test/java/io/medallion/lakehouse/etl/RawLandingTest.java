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

import io.medallion.lakehouse.format.json.JsonRecordCodec;
import io.medallion.lakehouse.model.RecordBatch;
import io.medallion.lakehouse.storage.FailingObjectStore;
import io.medallion.lakehouse.storage.LocalFileObjectStore;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link RawLanding}.
 */
@Tag("unit")
public class RawLandingTest {

  @TempDir
  Path tempDir;

  private static List<Map<String, Object>> records() {
    Map<String, Object> record = new LinkedHashMap<String, Object>();
    record.put("Name", "X Brew");
    record.put("state", "CA");
    return Collections.singletonList(record);
  }

  @Test void testLandWritesUnchangedRecords() throws IOException {
    LocalFileObjectStore store = new LocalFileObjectStore(tempDir);
    RawLanding landing = new RawLanding(store, LakehousePipelineConfig.defaults());

    String key = landing.land(records(), "page_1.json");

    assertEquals("bronze_layer/raw/page_1.json", key);
    try (InputStream in = store.get(key)) {
      RecordBatch batch = new JsonRecordCodec().decode(key, in);
      assertEquals(1, batch.size());
      assertEquals("X Brew", batch.getRows().get(0).get("Name").asText());
    }
  }

  @Test void testInvalidFileNamesRejected() {
    RawLanding landing =
        new RawLanding(new LocalFileObjectStore(tempDir), LakehousePipelineConfig.defaults());

    assertThrows(IllegalArgumentException.class, () -> landing.land(records(), ""));
    assertThrows(IllegalArgumentException.class, () -> landing.land(records(), "a/b.json"));
    assertThrows(IllegalArgumentException.class, () -> landing.land(records(), "page_1.csv"));
  }

  @Test void testUploadFailureIsStoreError() {
    FailingObjectStore store =
        new FailingObjectStore(new LocalFileObjectStore(tempDir), key -> true);
    RawLanding landing = new RawLanding(store, LakehousePipelineConfig.defaults());

    StoreException e = assertThrows(StoreException.class,
        () -> landing.land(records(), "page_1.json"));

    assertEquals(ErrorKind.STORE_IO, e.getKind());
    assertEquals("bronze_layer/raw/page_1.json", e.getContext());
  }
}
