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

import static java.nio.charset.StandardCharsets.UTF_8;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.TimeStampNanoVector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VarCharVector;

/**
 * Maps column types to Arrow vectors and moves single values in and out of them.
 */
final class ColumnVectors {

  private ColumnVectors() {
  }

  static ValueVector newVector(ColumnMeta column, BufferAllocator allocator) {
    final String name = column.getLabel();
    switch (column.getType()) {
      case BOOL:
        return new BitVector(name, allocator);
      case INT:
        return new BigIntVector(name, allocator);
      case UINT:
        return new UInt8Vector(name, allocator);
      case FLOAT:
        return new Float8Vector(name, allocator);
      case STRING:
        return new VarCharVector(name, allocator);
      case TIME:
        return new TimeStampNanoVector(name, allocator);
      default:
        throw new UnsupportedOperationException("no vector for column type " + column.getType());
    }
  }

  /**
   * Allocates a vector for the column with room for at least {@code capacity} values.
   */
  static ValueVector allocate(ColumnMeta column, BufferAllocator allocator, int capacity) {
    final ValueVector vector = newVector(column, allocator);
    try {
      vector.setInitialCapacity(Math.max(capacity, 1));
      vector.allocateNew();
      return vector;
    } catch (RuntimeException e) {
      vector.close();
      throw e;
    }
  }

  /**
   * Copies a vector into a new one, optionally reordering rows.
   *
   * @param order source row for each target row, or null to keep the order
   */
  static ValueVector copy(ColumnMeta column, ValueVector from, int rowCount, int[] order, BufferAllocator allocator) {
    final ValueVector to = allocate(column, allocator, rowCount);
    try {
      for (int i = 0; i < rowCount; i++) {
        to.copyFromSafe(order == null ? i : order[i], i, from);
      }
      to.setValueCount(rowCount);
      return to;
    } catch (RuntimeException e) {
      to.close();
      throw e;
    }
  }

  static void set(ValueVector vector, ColumnType type, int index, Object value) {
    if (value == null) {
      setNull(vector, index);
      return;
    }
    switch (type) {
      case BOOL:
        ((BitVector) vector).setSafe(index, (Boolean) value ? 1 : 0);
        break;
      case INT:
        ((BigIntVector) vector).setSafe(index, (Long) value);
        break;
      case UINT:
        ((UInt8Vector) vector).setSafe(index, (Long) value);
        break;
      case FLOAT:
        ((Float8Vector) vector).setSafe(index, (Double) value);
        break;
      case STRING:
        ((VarCharVector) vector).setSafe(index, ((String) value).getBytes(UTF_8));
        break;
      case TIME:
        ((TimeStampNanoVector) vector).setSafe(index, ((Time) value).getNanos());
        break;
      default:
        throw new UnsupportedOperationException("unsupported column type " + type);
    }
  }

  static Object get(ValueVector vector, ColumnType type, int index) {
    if (vector.isNull(index)) {
      return null;
    }
    switch (type) {
      case BOOL:
        return ((BitVector) vector).get(index) != 0;
      case INT:
        return ((BigIntVector) vector).get(index);
      case UINT:
        return ((UInt8Vector) vector).get(index);
      case FLOAT:
        return ((Float8Vector) vector).get(index);
      case STRING:
        return new String(((VarCharVector) vector).get(index), UTF_8);
      case TIME:
        return Time.ofNanos(((TimeStampNanoVector) vector).get(index));
      default:
        throw new UnsupportedOperationException("unsupported column type " + type);
    }
  }

  private static void setNull(ValueVector vector, int index) {
    if (vector instanceof BaseFixedWidthVector) {
      ((BaseFixedWidthVector) vector).setNull(index);
    } else if (vector instanceof BaseVariableWidthVector) {
      ((BaseVariableWidthVector) vector).setNull(index);
    } else {
      throw new UnsupportedOperationException("cannot set null in " + vector.getClass().getSimpleName());
    }
  }
}
