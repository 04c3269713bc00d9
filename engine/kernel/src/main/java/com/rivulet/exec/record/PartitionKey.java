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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The group a block belongs to: ordered key columns and the value every row holds in them.
 *
 * <p>Two keys are the same group when their columns and values are equal in the same order.
 * Values may be null.
 */
public final class PartitionKey {

  private static final PartitionKey EMPTY = new PartitionKey(ImmutableList.of(), Collections.emptyList());

  private final ImmutableList<ColumnMeta> columns;
  private final List<Object> values;
  private final int hash;

  private PartitionKey(ImmutableList<ColumnMeta> columns, List<Object> values) {
    this.columns = columns;
    this.values = Collections.unmodifiableList(values);
    this.hash = Objects.hash(columns, values);
  }

  public static PartitionKey empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableList<ColumnMeta> getColumns() {
    return columns;
  }

  public List<Object> getValues() {
    return values;
  }

  public int size() {
    return columns.size();
  }

  public Object getValue(int i) {
    return values.get(i);
  }

  /**
   * @return the position of the column with the given label, or -1
   */
  public int indexOf(String label) {
    return BlockUtil.columnIndex(label, columns);
  }

  public boolean hasColumn(String label) {
    return indexOf(label) >= 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PartitionKey)) {
      return false;
    }
    PartitionKey that = (PartitionKey) o;
    return hash == that.hash && columns.equals(that.columns) && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(columns.get(i).getLabel()).append('=').append(values.get(i));
    }
    return sb.append('}').toString();
  }

  /**
   * Builder for {@link PartitionKey}. Column labels must be unique.
   */
  public static final class Builder {
    private final ImmutableList.Builder<ColumnMeta> columns = ImmutableList.builder();
    private final List<Object> values = new ArrayList<>();
    private final Set<String> labels = new HashSet<>();

    private Builder() {
    }

    public Builder add(ColumnMeta column, Object value) {
      Preconditions.checkArgument(labels.add(column.getLabel()), "duplicate key column %s", column.getLabel());
      columns.add(column);
      values.add(column.getType().coerce(value));
      return this;
    }

    public Builder add(String label, ColumnType type, Object value) {
      return add(ColumnMeta.of(label, type), value);
    }

    public PartitionKey build() {
      return new PartitionKey(columns.build(), new ArrayList<>(values));
    }
  }
}
