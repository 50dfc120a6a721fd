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
package io.medallion.lakehouse.format.parquet;

import io.medallion.lakehouse.model.DataRecord;
import io.medallion.lakehouse.model.RecordBatch;

import org.apache.avro.Schema;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ParquetRecordCodec}.
 */
@Tag("unit")
public class ParquetRecordCodecTest {

  @TempDir
  Path tempDir;

  private final ParquetRecordCodec codec = new ParquetRecordCodec();

  private static List<DataRecord> breweries() {
    return Arrays.asList(
        DataRecord.builder().put("name", "x_brew").put("state", "ca").put("rating", 4)
            .put("open", true).build(),
        DataRecord.builder().put("name", "y_brew").put("state", "ca").put("rating", 3.5)
            .put("open", false).build());
  }

  @Test void testInferSchemaTypes() {
    List<DataRecord> rows = breweries();
    Schema schema = codec.inferSchema("breweries", RecordBatch.columnsOf(rows), rows);

    assertEquals(Arrays.asList(Schema.Type.NULL, Schema.Type.STRING),
        types(schema, "name"));
    // long and double together widen to double
    assertEquals(Arrays.asList(Schema.Type.NULL, Schema.Type.DOUBLE),
        types(schema, "rating"));
    assertEquals(Arrays.asList(Schema.Type.NULL, Schema.Type.BOOLEAN),
        types(schema, "open"));
  }

  @Test void testInferSchemaMixedKindsAndAllNull() {
    List<DataRecord> rows = Arrays.asList(
        DataRecord.builder().put("zip", 78701).put("note", null).build(),
        DataRecord.builder().put("zip", "unknown").put("note", null).build());
    Schema schema = codec.inferSchema("mixed", RecordBatch.columnsOf(rows), rows);

    assertEquals(Arrays.asList(Schema.Type.NULL, Schema.Type.LONG, Schema.Type.STRING),
        types(schema, "zip"));
    assertEquals(Arrays.asList(Schema.Type.NULL, Schema.Type.STRING),
        types(schema, "note"));
  }

  @Test void testSanitizedNamesKeepOriginal() {
    List<DataRecord> rows = Collections.singletonList(DataRecord.builder()
        .put("address.city", "austin")
        .put("address_city", "dallas")
        .put("1st", "x")
        .build());
    Schema schema = codec.inferSchema("r", RecordBatch.columnsOf(rows), rows);

    assertEquals("address_city", schema.getFields().get(0).name());
    assertEquals("address.city",
        schema.getFields().get(0).getProp(ParquetRecordCodec.ORIGINAL_NAME_PROP));
    assertEquals("address_city_2", schema.getFields().get(1).name());
    assertEquals("_1st", schema.getFields().get(2).name());
  }

  @Test void testWriteThenReadReconstructsRows() throws IOException {
    List<DataRecord> rows = breweries();
    Path file = tempDir.resolve("silver/ca/breweries_ca.parquet");

    codec.write(file, "breweries", RecordBatch.columnsOf(rows), rows);
    RecordBatch batch = codec.read("silver/ca/breweries_ca.parquet", file);

    assertEquals(Arrays.asList("name", "state", "rating", "open"), batch.getColumns());
    assertEquals(new HashSet<DataRecord>(rows), new HashSet<DataRecord>(batch.getRows()));
  }

  @Test void testReadRestoresOriginalNamesAndOmitsNulls() throws IOException {
    List<DataRecord> rows = Arrays.asList(
        DataRecord.builder().put("address.city", "austin").put("phone", "555").build(),
        DataRecord.builder().put("address.city", "dallas").put("phone", null).build());
    Path file = tempDir.resolve("nested.parquet");

    codec.write(file, "nested", RecordBatch.columnsOf(rows), rows);
    RecordBatch batch = codec.read("nested.parquet", file);

    assertEquals(Arrays.asList("address.city", "phone"), batch.getColumns());
    DataRecord second = batch.getRows().get(1);
    assertEquals("dallas", second.get("address.city").asText());
    assertFalse(second.has("phone"));
  }

  @Test void testEmptyFileKeepsColumns() throws IOException {
    Path file = tempDir.resolve("empty.parquet");
    codec.write(file, "empty", Arrays.asList("brewery_type", "state"),
        Collections.<DataRecord>emptyList());

    RecordBatch batch = codec.read("empty.parquet", file);
    assertTrue(batch.isEmpty());
    assertTrue(batch.hasColumn("brewery_type"));
    assertTrue(batch.hasColumn("state"));
  }

  @Test void testReadFromStreamCleansUpTempCopy() throws IOException {
    List<DataRecord> rows = breweries();
    Path file = tempDir.resolve("source.parquet");
    codec.write(file, "breweries", RecordBatch.columnsOf(rows), rows);
    Path scratch = tempDir.resolve("scratch");

    RecordBatch batch;
    try (InputStream in = Files.newInputStream(file)) {
      batch = codec.read("source.parquet", in, scratch);
    }

    assertEquals(2, batch.size());
    try (java.util.stream.Stream<Path> files = Files.list(scratch)) {
      assertEquals(0, files.count());
    }
  }

  @Test void testOverwriteReplacesFile() throws IOException {
    Path file = tempDir.resolve("rerun.parquet");
    List<DataRecord> first = breweries();
    List<DataRecord> second = Collections.singletonList(first.get(0));

    codec.write(file, "breweries", RecordBatch.columnsOf(first), first);
    codec.write(file, "breweries", RecordBatch.columnsOf(second), second);

    assertEquals(1, codec.read("rerun.parquet", file).size());
  }

  @Test void testUnknownCompressionRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ParquetRecordCodec("zip-zap"));
  }

  private static List<Schema.Type> types(Schema schema, String field) {
    List<Schema.Type> types = new java.util.ArrayList<Schema.Type>();
    for (Schema branch : schema.getField(field).schema().getTypes()) {
      types.add(branch.getType());
    }
    return types;
  }
}
