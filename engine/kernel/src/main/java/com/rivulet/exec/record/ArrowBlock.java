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
import java.util.List;
import org.apache.arrow.vector.ValueVector;

/**
 * A block whose columns live in Arrow vectors. The block owns its vectors and releases them on
 * {@link #close()}.
 */
public final class ArrowBlock implements Block, AutoCloseable {
  private final PartitionKey key;
  private final ImmutableList<ColumnMeta> columns;
  private final ImmutableList<ValueVector> vectors;
  private final int rowCount;
  private boolean closed;

  ArrowBlock(PartitionKey key, List<ColumnMeta> columns, List<ValueVector> vectors, int rowCount) {
    Preconditions.checkArgument(columns.size() == vectors.size());
    this.key = key;
    this.columns = ImmutableList.copyOf(columns);
    this.vectors = ImmutableList.copyOf(vectors);
    this.rowCount = rowCount;
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
    Preconditions.checkState(!closed, "block %s is closed", key);
    Preconditions.checkElementIndex(row, rowCount);
    return ColumnVectors.get(vectors.get(column), columns.get(column).getType(), row);
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
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("key", key).add("rows", rowCount).toString();
  }
}
