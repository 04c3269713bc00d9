/*
 * Copyright (C) 2017-2019 Dremio Corporation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.rivulet.exec.record;

import com.google.common.base.Preconditions;

/**
 * Types of block columns and the Java class that carries their values.
 */
public enum ColumnType {
  BOOL(Boolean.class),
  INT(Long.class),
  UINT(Long.class),
  FLOAT(Double.class),
  STRING(String.class),
  TIME(Time.class);

  private final Class<?> valueClass;

  ColumnType(Class<?> valueClass) {
    this.valueClass = valueClass;
  }

  /**
   * Checks that a value may be stored in a column of this type. Integers are widened to long.
   *
   * @return the value to store, possibly null
   * @throws IllegalArgumentException if the value has the wrong class
   */
  public Object coerce(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Integer && valueClass == Long.class) {
      return Long.valueOf((Integer) value);
    }
    Preconditions.checkArgument(valueClass.isInstance(value),
        "value %s of class %s is not a %s", value, value.getClass().getSimpleName(), this);
    return value;
  }

  /**
   * Compares two non null values of this type by their natural order. UINT values compare
   * unsigned and booleans order false first.
   */
  @SuppressWarnings("unchecked")
  public int compare(Object left, Object right) {
    switch (this) {
      case UINT:
        return Long.compareUnsigned((Long) left, (Long) right);
      case BOOL:
        return Boolean.compare((Boolean) left, (Boolean) right);
      default:
        return ((Comparable<Object>) left).compareTo(right);
    }
  }
}
