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
package io.medallion.lakehouse.storage;

import java.util.Locale;

/**
 * Helpers for slash-separated object keys.
 */
public final class ObjectKeys {

  private ObjectKeys() {
  }

  /**
   * Joins key segments with single slashes, dropping empty segments and
   * redundant leading or trailing slashes.
   */
  public static String join(String... segments) {
    StringBuilder sb = new StringBuilder();
    for (String segment : segments) {
      String trimmed = trim(segment);
      if (trimmed.isEmpty()) {
        continue;
      }
      if (sb.length() > 0) {
        sb.append('/');
      }
      sb.append(trimmed);
    }
    return sb.toString();
  }

  /**
   * Returns the listing prefix for a layer root: the root with exactly one
   * trailing slash, so that {@code silver_layer} does not also match
   * {@code silver_layer_old/...}.
   */
  public static String directoryPrefix(String root) {
    String trimmed = trim(root);
    return trimmed.isEmpty() ? "" : trimmed + "/";
  }

  /**
   * Returns the last segment of a key.
   */
  public static String baseName(String key) {
    String trimmed = trim(key);
    int slash = trimmed.lastIndexOf('/');
    return slash < 0 ? trimmed : trimmed.substring(slash + 1);
  }

  /**
   * Returns true if the key ends with the given extension, ignoring case.
   */
  public static boolean hasExtension(String key, String extension) {
    return key.toLowerCase(Locale.ROOT).endsWith(extension.toLowerCase(Locale.ROOT));
  }

  private static String trim(String segment) {
    if (segment == null) {
      return "";
    }
    int start = 0;
    int end = segment.length();
    while (start < end && segment.charAt(start) == '/') {
      start++;
    }
    while (end > start && segment.charAt(end - 1) == '/') {
      end--;
    }
    return segment.substring(start, end);
  }
}
