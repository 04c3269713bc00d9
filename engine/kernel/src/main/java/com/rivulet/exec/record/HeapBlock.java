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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable block held on the Java heap. Used to build test input and to keep blocks past the
 * call that delivered them.
 */
public final class HeapBlock implements Block {
  private final PartitionKey key;
  private final ImmutableList<ColumnMeta> columns;
  private final List<List<Object>> data;
  private final int rowCount;

  private HeapBlock(PartitionKey key, ImmutableList<ColumnMeta> columns, List<List<Object>> data, int rowCount) {
    this.key = key;
    this.columns = columns;
    this.data = data;
    this.rowCount = rowCount;
  }

  public static Builder builder(PartitionKey key) {
    return new Builder(key);
  }

  /**
   * Copies any block, including its key, to the heap.
   */
  public static HeapBlock copyOf(Block block) {
    if (block instanceof HeapBlock) {
      return (HeapBlock) block;
    }
    final List<List<Object>> data = new ArrayList<>(block.getColumnCount());
    for (int col = 0; col < block.getColumnCount(); col++) {
      List<Object> values = new ArrayList<>(block.getRowCount());
      for (int row = 0; row < block.getRowCount(); row++) {
        values.add(block.getValue(row, col));
      }
      data.add(Collections.unmodifiableList(values));
    }
    return new HeapBlock(block.getKey(), ImmutableList.copyOf(block.getColumns()), data, block.getRowCount());
  }

  @Override
  public PartitionKey getKey() {
    return key;
  }

  @Override
  public List<ColumnMeta> getColumns() {
    return columns;
  }

  @Override
  public int getRowCount() {
    return rowCount;
  }

  @Override
  public Object getValue(int row, int column) {
    Preconditions.checkElementIndex(row, rowCount);
    return data.get(column).get(row);
  }

  /**
   * @return the values of the column with the given label
   * @throws IllegalArgumentException if the block has no such column
   */
  public List<Object> getColumnValues(String label) {
    int col = BlockUtil.columnIndex(label, columns);
    Preconditions.checkArgument(col >= 0, "block has no column %s", label);
    return data.get(col);
  }

  /**
   * @return the cells of one row in column order
   */
  public List<Object> getRow(int row) {
    List<Object> values = new ArrayList<>(columns.size());
    for (int col = 0; col < columns.size(); col++) {
      values.add(getValue(row, col));
    }
    return values;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("columns", columns)
        .add("rows", rowCount)
        .toString();
  }

  /**
   * Row by row builder for {@link HeapBlock}.
   */
  public static final class Builder {
    private final PartitionKey key;
    private final ImmutableList.Builder<ColumnMeta> columns = ImmutableList.builder();
    private final List<ColumnType> types = new ArrayList<>();
    private final List<List<Object>> data = new ArrayList<>();
    private int rowCount;

    private Builder(PartitionKey key) {
      this.key = Preconditions.checkNotNull(key);
    }

    public Builder column(String label, ColumnType type) {
      Preconditions.checkState(rowCount == 0, "columns must be declared before rows");
      Preconditions.checkArgument(BlockUtil.columnIndex(label, columns.build()) < 0, "duplicate column %s", label);
      columns.add(ColumnMeta.of(label, type));
      types.add(type);
      data.add(new ArrayList<>());
      return this;
    }

    public Builder row(Object... values) {
      Preconditions.checkArgument(values.length == types.size(),
          "row has %s values for %s columns", values.length, types.size());
      for (int i = 0; i < values.length; i++) {
        data.get(i).add(types.get(i).coerce(values[i]));
      }
      rowCount++;
      return this;
    }

    public HeapBlock build() {
      final List<List<Object>> frozen = new ArrayList<>(data.size());
      for (List<Object> column : data) {
        frozen.add(Collections.unmodifiableList(new ArrayList<>(column)));
      }
      return new HeapBlock(key, columns.build(), frozen, rowCount);
    }
  }
}
