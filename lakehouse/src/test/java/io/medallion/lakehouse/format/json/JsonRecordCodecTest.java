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
package io.medallion.lakehouse.format.json;

import io.medallion.lakehouse.model.DataRecord;
import io.medallion.lakehouse.model.RecordBatch;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link JsonRecordCodec}.
 */
@Tag("unit")
public class JsonRecordCodecTest {

  private final JsonRecordCodec codec = new JsonRecordCodec();

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test void testDecodeArrayOfObjects() throws IOException {
    RecordBatch batch = codec.decode("raw/a.json", json(
        "[{\"Name\":\"X Brew\",\"City\":null},{\"Name\":\"Y\",\"zip\":123}]"));

    assertEquals("raw/a.json", batch.getSourceKey());
    assertEquals(2, batch.size());
    assertEquals(Arrays.asList("Name", "City", "zip"), batch.getColumns());
    assertTrue(batch.getRows().get(0).get("City").isNull());
    assertEquals(123L, batch.getRows().get(1).get("zip").toJava());
  }

  @Test void testDecodeSingleObject() throws IOException {
    RecordBatch batch = codec.decode("raw/one.json", json("{\"id\":1}"));
    assertEquals(1, batch.size());
  }

  @Test void testDecodeFlattensNestedObjects() throws IOException {
    RecordBatch batch = codec.decode("raw/n.json",
        json("[{\"address\":{\"city\":\"austin\"}}]"));
    assertEquals(Collections.singletonList("address.city"), batch.getColumns());
  }

  @Test void testDecodeEmptyArray() throws IOException {
    RecordBatch batch = codec.decode("raw/empty.json", json("[]"));
    assertTrue(batch.isEmpty());
    assertTrue(batch.getColumns().isEmpty());
  }

  @Test void testDecodeRejectsNonObjects() {
    assertThrows(IOException.class, () -> codec.decode("raw/bad.json", json("[1, 2]")));
    assertThrows(IOException.class, () -> codec.decode("raw/bad.json", json("\"text\"")));
    assertThrows(IOException.class, () -> codec.decode("raw/bad.json", json("[{\"a\":")));
  }

  @Test void testEncodePreservesFieldOrderAndTypes() throws IOException {
    DataRecord row = DataRecord.builder()
        .put("name", "x_brew")
        .put("count", 2)
        .put("open", true)
        .build();

    String text = new String(codec.encode(Collections.singletonList(row)),
        StandardCharsets.UTF_8);

    assertEquals("[{\"name\":\"x_brew\",\"count\":2,\"open\":true}]", text);
  }
}
