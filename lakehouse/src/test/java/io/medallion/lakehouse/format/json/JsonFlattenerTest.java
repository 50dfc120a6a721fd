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

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link JsonFlattener}.
 */
@Tag("unit")
public class JsonFlattenerTest {

  private final JsonFlattener flattener = new JsonFlattener(new ObjectMapper());

  @Test void testNestedObjectsUseDottedNames() throws Exception {
    Map<String, Object> geo = new LinkedHashMap<String, Object>();
    geo.put("lat", 1.5);
    geo.put("lon", -2.5);
    Map<String, Object> address = new LinkedHashMap<String, Object>();
    address.put("city", "Austin");
    address.put("geo", geo);
    Map<String, Object> input = new LinkedHashMap<String, Object>();
    input.put("id", 1);
    input.put("address", address);

    Map<String, Object> output = flattener.flatten(input);

    assertEquals(Arrays.asList("id", "address.city", "address.geo.lat", "address.geo.lon"),
        Arrays.asList(output.keySet().toArray()));
    assertEquals("Austin", output.get("address.city"));
    assertEquals(-2.5, output.get("address.geo.lon"));
  }

  @Test void testScalarArraysAreJoined() throws Exception {
    Map<String, Object> input = new LinkedHashMap<String, Object>();
    input.put("tags", Arrays.asList("a", "b", 3));

    assertEquals("a,b,3", flattener.flatten(input).get("tags"));
  }

  @Test void testArraysOfObjectsKeptAsJson() throws Exception {
    Map<String, Object> item = new LinkedHashMap<String, Object>();
    item.put("k", "v");
    Map<String, Object> input = new LinkedHashMap<String, Object>();
    input.put("items", Collections.singletonList(item));

    assertEquals("[{\"k\":\"v\"}]", flattener.flatten(input).get("items"));
  }

  @Test void testNullsAreKept() throws Exception {
    Map<String, Object> input = new LinkedHashMap<String, Object>();
    input.put("phone", null);

    Map<String, Object> output = flattener.flatten(input);
    assertTrue(output.containsKey("phone"));
    assertNull(output.get("phone"));
  }

  @Test void testEmptyObjectContributesNoField() throws Exception {
    Map<String, Object> input = new LinkedHashMap<String, Object>();
    input.put("meta", new LinkedHashMap<String, Object>());
    input.put("id", 1);

    Map<String, Object> output = flattener.flatten(input);
    assertFalse(output.containsKey("meta"));
    assertEquals(1, output.size());
  }
}
