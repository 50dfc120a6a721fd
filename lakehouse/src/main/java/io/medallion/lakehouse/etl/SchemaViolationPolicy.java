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
 * What a stage does with an input file that lacks a required field.
 */
public enum SchemaViolationPolicy {
  /** Fail the whole stage before anything is written. */
  ABORT,
  /** Drop the offending file, log a warning and continue. */
  SKIP;

  /**
   * Parses a policy from a string value.
   *
   * @param value String representation (case-insensitive)
   * @return Policy, defaulting to ABORT if null or empty
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static SchemaViolationPolicy fromString(String value) {
    if (value == null || value.isEmpty()) {
      return ABORT;
    }
    switch (value.toLowerCase(Locale.ROOT)) {
      case "abort":
      case "fail":
        return ABORT;
      case "skip":
        return SKIP;
      default:
        throw new IllegalArgumentException("Unknown schema violation policy: " + value);
    }
  }
}
