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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ValueVector;

/**
 * Block builder backing every column with an Arrow vector allocated from the given allocator.
 *
 * <p>Not thread safe.
 */
public class ArrowBlockBuilder implements BlockBuilder {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(ArrowBlockBuilder.class);

  private final PartitionKey key;
  private final BufferAllocator allocator;
  private final int initialCapacity;
  private final List<ColumnMeta> columns = new ArrayList<>();
  private final List<ValueVector> vectors = new ArrayList<>();
  private boolean closed;

  public ArrowBlockBuilder(PartitionKey key, BufferAllocator allocator, int initialCapacity) {
    this.key = Preconditions.checkNotNull(key);
    this.allocator = Preconditions.checkNotNull(allocator);
    this.initialCapacity = initialCapacity;
  }

  @Override
  public PartitionKey getKey() {
    return key;
  }

  @Override
  public List<ColumnMeta> getColumns() {
    return ImmutableList.copyOf(columns);
  }

  @Override
  public int getRowCount() {
    return vectors.isEmpty() ? 0 : vectors.get(0).getValueCount();
  }

  @Override
  public int addColumn(ColumnMeta column) {
    checkOpen();
    Preconditions.checkArgument(BlockUtil.columnIndex(column.getLabel(), columns) < 0,
        "block builder already has column with label %s", column.getLabel());
    final int rows = getRowCount();
    final ValueVector vector = ColumnVectors.allocate(column, allocator, Math.max(initialCapacity, rows));
    try {
      for (int i = 0; i < rows; i++) {
        ColumnVectors.set(vector, column.getType(), i, null);
      }
      vector.setValueCount(rows);
    } catch (RuntimeException e) {
      vector.close();
      throw e;
    }
    columns.add(column);
    vectors.add(vector);
    return columns.size() - 1;
  }

  @Override
  public void appendValue(int column, Object value) {
    checkOpen();
    final ColumnType type = columns.get(column).getType();
    final ValueVector vector = vectors.get(column);
    final int index = vector.getValueCount();
    ColumnVectors.set(vector, type, index, type.coerce(value));
    vector.setValueCount(index + 1);
  }

  @Override
  public Object getValue(int row, int column) {
    checkOpen();
    final ValueVector vector = vectors.get(column);
    Preconditions.checkElementIndex(row, vector.getValueCount());
    return ColumnVectors.get(vector, columns.get(column).getType(), row);
  }

  @Override
  public void sort(List<String> labels, boolean descending) {
    checkOpen();
    final int rows = checkRowCount();
    final List<Integer> sortColumns = new ArrayList<>();
    for (String label : labels) {
      int col = BlockUtil.columnIndex(label, columns);
      if (col >= 0) {
        sortColumns.add(col);
      }
    }
    if (sortColumns.isEmpty() || rows < 2) {
      return;
    }

    final ColumnType[] types = new ColumnType[sortColumns.size()];
    final Object[][] keys = new Object[sortColumns.size()][];
    for (int c = 0; c < sortColumns.size(); c++) {
      final int col = sortColumns.get(c);
      types[c] = columns.get(col).getType();
      keys[c] = new Object[rows];
      for (int row = 0; row < rows; row++) {
        keys[c][row] = getValue(row, col);
      }
    }

    final int[] order = new int[rows];
    for (int i = 0; i < rows; i++) {
      order[i] = i;
    }
    new BlockSorter(order, types, keys, descending).sort();

    final List<ValueVector> sorted = copyVectors(rows, order);
    for (ValueVector vector : vectors) {
      vector.close();
    }
    vectors.clear();
    vectors.addAll(sorted);
    logger.debug("Sorted {} rows of block {} by {}", rows, key, labels);
  }

  @Override
  public ArrowBlock build() {
    checkOpen();
    final int rows = checkRowCount();
    return new ArrowBlock(key, columns, copyVectors(rows, null), rows);
  }

  @Override
  public void clearData() {
    checkOpen();
    for (ValueVector vector : vectors) {
      vector.reset();
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (ValueVector vector : vectors) {
      vector.close();
    }
    vectors.clear();
  }

  private List<ValueVector> copyVectors(int rows, int[] order) {
    final List<ValueVector> copies = new ArrayList<>(vectors.size());
    try {
      for (int col = 0; col < vectors.size(); col++) {
        copies.add(ColumnVectors.copy(columns.get(col), vectors.get(col), rows, order, allocator));
      }
      return copies;
    } catch (RuntimeException e) {
      for (ValueVector copy : copies) {
        copy.close();
      }
      throw e;
    }
  }

  private int checkRowCount() {
    final int rows = getRowCount();
    for (int col = 1; col < vectors.size(); col++) {
      Preconditions.checkState(vectors.get(col).getValueCount() == rows,
          "column %s has %s rows, expected %s", columns.get(col).getLabel(), vectors.get(col).getValueCount(), rows);
    }
    return rows;
  }

  private void checkOpen() {
    Preconditions.checkState(!closed, "block builder for %s is closed", key);
  }
}
