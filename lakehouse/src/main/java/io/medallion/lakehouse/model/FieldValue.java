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
package io.medallion.lakehouse.model;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Scalar value of a record field.
 *
 * <p>Records in every layer are schema-on-read, so a field holds one of four
 * kinds of value:
 * <ul>
 *   <li>{@link Kind#TEXT} - a string</li>
 *   <li>{@link Kind#NUMBER} - a {@code Long} when integral, otherwise a {@code Double}</li>
 *   <li>{@link Kind#BOOLEAN} - a boolean</li>
 *   <li>{@link Kind#NULL} - an explicit null</li>
 * </ul>
 *
 * <p>Numbers compare by exact numeric value, so {@code 1} and {@code 1.0} are
 * equal while a long beyond 2<sup>53</sup> never equals its nearest double.
 * Equal values render to the same text: a double holding an integral value in
 * the long range renders without a fraction.
 */
public final class FieldValue {

  /**
   * Kind of a field value.
   */
  public enum Kind {
    TEXT, NUMBER, BOOLEAN, NULL
  }

  private static final FieldValue NULL_VALUE = new FieldValue(Kind.NULL, null);
  private static final FieldValue TRUE_VALUE = new FieldValue(Kind.BOOLEAN, Boolean.TRUE);
  private static final FieldValue FALSE_VALUE = new FieldValue(Kind.BOOLEAN, Boolean.FALSE);

  private final Kind kind;
  private final @Nullable Object value;

  private FieldValue(Kind kind, @Nullable Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static FieldValue text(String value) {
    return new FieldValue(Kind.TEXT, Objects.requireNonNull(value, "value"));
  }

  public static FieldValue number(Number value) {
    return new FieldValue(Kind.NUMBER, normalize(Objects.requireNonNull(value, "value")));
  }

  public static FieldValue bool(boolean value) {
    return value ? TRUE_VALUE : FALSE_VALUE;
  }

  public static FieldValue nullValue() {
    return NULL_VALUE;
  }

  /**
   * Converts a plain Java value, as produced by a JSON or Avro decoder, to a
   * field value. Values that are neither strings, numbers nor booleans are
   * kept as their string form.
   *
   * @param value Java value, may be null
   * @return Field value
   */
  public static FieldValue of(@Nullable Object value) {
    if (value == null) {
      return NULL_VALUE;
    }
    if (value instanceof FieldValue) {
      return (FieldValue) value;
    }
    if (value instanceof Boolean) {
      return bool((Boolean) value);
    }
    if (value instanceof Number) {
      return number((Number) value);
    }
    return text(value.toString());
  }

  private static Number normalize(Number number) {
    if (number instanceof Long) {
      return number;
    }
    if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
      return number.longValue();
    }
    if (number instanceof BigInteger) {
      BigInteger big = (BigInteger) number;
      return big.bitLength() < Long.SIZE ? (Number) big.longValue() : (Number) big.doubleValue();
    }
    if (number instanceof BigDecimal) {
      BigDecimal decimal = (BigDecimal) number;
      if (decimal.scale() <= 0 && decimal.precision() - decimal.scale() < 19) {
        return decimal.longValueExact();
      }
      return decimal.doubleValue();
    }
    return number.doubleValue();
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isText() {
    return kind == Kind.TEXT;
  }

  public boolean isNumber() {
    return kind == Kind.NUMBER;
  }

  public boolean isBoolean() {
    return kind == Kind.BOOLEAN;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  /** Returns true if this is a number held as a 64-bit integer. */
  public boolean isIntegral() {
    return value instanceof Long;
  }

  public String asText() {
    if (kind != Kind.TEXT) {
      throw new IllegalStateException("Not a text value: " + this);
    }
    return (String) value;
  }

  public Number asNumber() {
    if (kind != Kind.NUMBER) {
      throw new IllegalStateException("Not a numeric value: " + this);
    }
    return (Number) value;
  }

  public boolean asBoolean() {
    if (kind != Kind.BOOLEAN) {
      throw new IllegalStateException("Not a boolean value: " + this);
    }
    return (Boolean) value;
  }

  /**
   * Returns the plain Java value: a {@code String}, {@code Long},
   * {@code Double}, {@code Boolean} or null.
   */
  public @Nullable Object toJava() {
    return value;
  }

  /**
   * Returns the value rendered as text, or null for {@link Kind#NULL}.
   * Partition keys and aggregate dimensions are built from this form.
   */
  public @Nullable String render() {
    if (value instanceof Double) {
      double d = (Double) value;
      if (isLongValued(d)) {
        return Long.toString((long) d);
      }
    }
    return value == null ? null : value.toString();
  }

  private static boolean isLongValued(double d) {
    return d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63;
  }

  private static boolean numericEquals(Number a, Number b) {
    if (a instanceof Long && b instanceof Long) {
      return a.longValue() == b.longValue();
    }
    double da = a.doubleValue();
    double db = b.doubleValue();
    if (Double.isNaN(da) || Double.isInfinite(da) || Double.isNaN(db) || Double.isInfinite(db)) {
      return Double.compare(da, db) == 0;
    }
    return exact(a).compareTo(exact(b)) == 0;
  }

  private static BigDecimal exact(Number number) {
    return number instanceof Long
        ? BigDecimal.valueOf(number.longValue())
        : new BigDecimal(number.doubleValue());
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldValue)) {
      return false;
    }
    FieldValue that = (FieldValue) o;
    if (kind != that.kind) {
      return false;
    }
    if (kind == Kind.NUMBER) {
      return numericEquals((Number) value, (Number) that.value);
    }
    return Objects.equals(value, that.value);
  }

  @Override public int hashCode() {
    if (value instanceof Long) {
      return Long.hashCode((Long) value);
    }
    if (value instanceof Double) {
      double d = (Double) value;
      return isLongValued(d) ? Long.hashCode((long) d) : Double.hashCode(d);
    }
    return Objects.hash(kind, value);
  }

  @Override public String toString() {
    switch (kind) {
      case NULL:
        return "null";
      case TEXT:
        return "\"" + value + "\"";
      default:
        return String.valueOf(value);
    }
  }
}
