// This file is part of VizQE.
// Copyright (C) 2026  The VizQE Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.vizqe.data;

import java.util.UUID;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A single typed value of a storage or result row.
 */
public final class RowValue {

  private final ValueType type;

  /** Numeric payload for the integer and timestamp types. */
  private final long number;

  /** Payload for strings and UUIDs. */
  private final Object object;

  private RowValue(final ValueType type, final long number,
                   final Object object) {
    this.type = type;
    this.number = number;
    this.object = object;
  }

  public static RowValue ofString(final String value) {
    Preconditions.checkNotNull(value, "String value cannot be null.");
    return new RowValue(ValueType.STRING, 0, value);
  }

  public static RowValue ofLong(final long value) {
    return new RowValue(ValueType.INT64, value, null);
  }

  public static RowValue ofUnsigned(final long value) {
    return new RowValue(ValueType.UINT64, value, null);
  }

  public static RowValue ofTimestamp(final long micros) {
    return new RowValue(ValueType.TIMESTAMP, micros, null);
  }

  public static RowValue ofUuid(final UUID value) {
    Preconditions.checkNotNull(value, "UUID value cannot be null.");
    return new RowValue(ValueType.UUID, 0, value);
  }

  /** @return The type tag of this value. */
  public ValueType type() {
    return type;
  }

  /** @return Whether or not the value is one of the integer types. */
  public boolean isNumeric() {
    return type == ValueType.INT64 ||
           type == ValueType.UINT64 ||
           type == ValueType.TIMESTAMP;
  }

  /**
   * @return The numeric value.
   * @throws IllegalStateException if the value is not numeric.
   */
  public long longValue() {
    if (!isNumeric()) {
      throw new IllegalStateException("Value of type " + type 
          + " is not numeric.");
    }
    return number;
  }

  /**
   * @return The UUID value.
   * @throws IllegalStateException if the value is not a UUID.
   */
  public UUID uuidValue() {
    if (type != ValueType.UUID) {
      throw new IllegalStateException("Value of type " + type 
          + " is not a UUID.");
    }
    return (UUID) object;
  }

  /** @return The canonical string form. Unsigned values are rendered
   * unsigned. */
  public String asString() {
    switch (type) {
    case STRING:
      return (String) object;
    case UUID:
      return object.toString();
    case UINT64:
      return Long.toUnsignedString(number);
    default:
      return Long.toString(number);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final RowValue other = (RowValue) o;
    return type == other.type &&
           number == other.number &&
           Objects.equal(object, other.object);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, number, object);
  }

  @Override
  public String toString() {
    return type + ":" + asString();
  }
}
