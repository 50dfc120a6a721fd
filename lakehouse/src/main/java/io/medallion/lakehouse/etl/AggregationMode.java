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

import java.util.Locale;

/**
 * How the aggregation stage combines the counts of individual silver files.
 */
public enum AggregationMode {
  /**
   * One row per (category, key) pair per file, concatenated in listing
   * order. A pair present in two files yields two rows.
   */
  PER_FILE,
  /** Counts are summed across files into one row per pair. */
  SUMMED;

  /**
   * Parses a mode from a string value.
   *
   * @param value String representation (case-insensitive)
   * @return Mode, defaulting to PER_FILE if null or empty
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static AggregationMode fromString(String value) {
    if (value == null || value.isEmpty()) {
      return PER_FILE;
    }
    switch (value.toLowerCase(Locale.ROOT)) {
      case "per_file":
      case "perfile":
        return PER_FILE;
      case "summed":
      case "sum":
        return SUMMED;
      default:
        throw new IllegalArgumentException("Unknown aggregation mode: " + value);
    }
  }
}
