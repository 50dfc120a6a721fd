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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flattens nested JSON objects into a single level of scalar fields.
 *
 * <p>Nested object keys are joined with a separator ({@code address.city}).
 * Arrays of scalars become one delimited string; arrays that contain objects
 * are kept as their JSON text. Empty nested objects contribute no field.
 */
public class JsonFlattener {
  private final ObjectMapper mapper;
  private final String separator;
  private final String delimiter;

  public JsonFlattener(ObjectMapper mapper) {
    this(mapper, ".", ",");
  }

  public JsonFlattener(ObjectMapper mapper, String separator, String delimiter) {
    this.mapper = mapper;
    this.separator = separator;
    this.delimiter = delimiter;
  }

  /**
   * Flattens a nested map structure.
   *
   * @param input The map to flatten
   * @return A new map with flattened keys, in input order
   * @throws JsonProcessingException If an array of objects cannot be rendered
   */
  public Map<String, Object> flatten(Map<String, Object> input) throws JsonProcessingException {
    Map<String, Object> output = new LinkedHashMap<String, Object>();
    flattenObject("", input, output);
    return output;
  }

  private void flattenObject(String prefix, Map<String, Object> obj,
      Map<String, Object> output) throws JsonProcessingException {
    for (Map.Entry<String, Object> entry : obj.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + separator + entry.getKey();
      Object value = entry.getValue();

      if (value instanceof Map) {
        @SuppressWarnings("unchecked")
        Map<String, Object> mapValue = (Map<String, Object>) value;
        flattenObject(key, mapValue, output);
      } else if (value instanceof List) {
        output.put(key, flattenArray((List<?>) value));
      } else {
        output.put(key, value);
      }
    }
  }

  private String flattenArray(List<?> array) throws JsonProcessingException {
    if (array.stream().anyMatch(item -> item instanceof Map || item instanceof List)) {
      return mapper.writeValueAsString(array);
    }
    return array.stream()
        .map(v -> v == null ? "" : v.toString())
        .collect(Collectors.joining(delimiter));
  }
}
