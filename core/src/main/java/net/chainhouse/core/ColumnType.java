/*
 * This file is part of OpenTSDB.
 * Copyright (C) 2021  Yahoo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.chainhouse.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Physical column types. Values travel as {@link Long}, {@link Double} or
 * {@link String} once coerced.
 */
public enum ColumnType {

  /** Epoch milliseconds. */
  TIMESTAMP((byte) 1) {
    @Override
    public Object coerce(final Object value) {
      if (value instanceof Instant) {
        return ((Instant) value).toEpochMilli();
      }
      return toLong(this, value);
    }
  },

  LONG((byte) 2) {
    @Override
    public Object coerce(final Object value) {
      return toLong(this, value);
    }
  },

  DOUBLE((byte) 3) {
    @Override
    public Object coerce(final Object value) {
      if (value instanceof Number) {
        return ((Number) value).doubleValue();
      }
      throw mismatch(this, value);
    }
  },

  STRING((byte) 4) {
    @Override
    public Object coerce(final Object value) {
      if (value instanceof CharSequence) {
        return value.toString();
      }
      throw mismatch(this, value);
    }
  };

  private final byte id;

  ColumnType(final byte id) {
    this.id = id;
  }

  public byte getId() {
    return id;
  }

  /**
   * Converts a non-null value to this type's canonical boxed representation.
   *
   * @throws IllegalArgumentException if the value cannot be represented.
   */
  public abstract Object coerce(Object value);

  public boolean isNumeric() {
    return this != STRING;
  }

  public boolean isIntegral() {
    return this == TIMESTAMP || this == LONG;
  }

  /** Compares two already coerced, non-null values of this type. */
  public int compare(final Object a, final Object b) {
    switch (this) {
      case TIMESTAMP:
      case LONG:
        return Long.compare((Long) a, (Long) b);
      case DOUBLE:
        return Double.compare((Double) a, (Double) b);
      case STRING:
        return ((String) a).compareTo((String) b);
      default:
        throw new IllegalStateException("Unhandled column type " + this);
    }
  }

  public static ColumnType getById(final byte id) {
    for (ColumnType type : values()) {
      if (type.id == id) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown column type id: " + id);
  }

  private static Long toLong(final ColumnType type, final Object value) {
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    try {
      if (value instanceof BigInteger) {
        return ((BigInteger) value).longValueExact();
      }
      if (value instanceof BigDecimal) {
        return ((BigDecimal) value).longValueExact();
      }
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(value + " does not fit in a " + type, e);
    }
    throw mismatch(type, value);
  }

  private static IllegalArgumentException mismatch(final ColumnType type, final Object value) {
    return new IllegalArgumentException("Value " + value + " of "
        + (value == null ? "null" : value.getClass().getSimpleName()) + " is not a " + type);
  }
}
