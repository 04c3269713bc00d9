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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import com.rivulet.exec.BaseTestWithAllocator;
import org.junit.Test;

public class TestBlockUtil extends BaseTestWithAllocator {

  private static final PartitionKey KEY = PartitionKey.builder().add("host", ColumnType.STRING, "a").build();

  @Test
  public void columnIndex() {
    ImmutableList<ColumnMeta> columns = ImmutableList.of(ColumnMeta.of("a", ColumnType.INT), ColumnMeta.of("b", ColumnType.FLOAT));
    assertThat(BlockUtil.columnIndex("b", columns)).isEqualTo(1);
    assertThat(BlockUtil.columnIndex("c", columns)).isEqualTo(-1);
    assertThat(BlockUtil.containsLabel(ImmutableList.of("a", "b"), "a")).isTrue();
    assertThat(BlockUtil.containsLabel(ImmutableList.of("a", "b"), "c")).isFalse();
  }

  @Test
  public void copyBlockIntoBuilder() {
    HeapBlock block = HeapBlock.builder(KEY)
        .column("host", ColumnType.STRING)
        .column("_value", ColumnType.FLOAT)
        .row("a", 1.5d)
        .row("a", null)
        .build();

    try (ArrowBlockBuilder builder = new ArrowBlockBuilder(KEY, allocator, 1)) {
      BlockUtil.addBlockColumns(block, builder);
      BlockUtil.appendBlock(block, builder, new ColumnIndexMap().resize(block.getColumnCount()));

      assertThat(builder.getColumns()).isEqualTo(block.getColumns());
      assertThat(builder.getRowCount()).isEqualTo(2);
      assertThat(builder.getValue(0, 1)).isEqualTo(1.5d);
      assertThat(builder.getValue(1, 1)).isNull();
    }
  }

  @Test
  public void columnIndexMapGrowsOnlyWhenNeeded() {
    ColumnIndexMap map = new ColumnIndexMap();
    map.resize(3);
    assertThat(map.size()).isEqualTo(3);
    assertThat(map.get(2)).isEqualTo(2);

    map.resize(2);
    assertThat(map.size()).isEqualTo(2);
    assertThat(map.capacity()).isEqualTo(3);
    assertThatThrownBy(() -> map.get(2)).isInstanceOf(IndexOutOfBoundsException.class);

    map.resize(5);
    assertThat(map.capacity()).isEqualTo(5);
    assertThat(map.get(4)).isEqualTo(4);
  }

  @Test
  public void heapCopyOfArrowBlock() {
    HeapBlock copy;
    try (ArrowBlockBuilder builder = new ArrowBlockBuilder(KEY, allocator, 1)) {
      int col = builder.addColumn(ColumnMeta.of("_time", ColumnType.TIME));
      builder.appendValue(col, Time.ofSeconds(1));
      try (ArrowBlock block = builder.build()) {
        copy = HeapBlock.copyOf(block);
      }
    }
    // still readable once the vectors are released
    assertThat(copy.getKey()).isEqualTo(KEY);
    assertThat(copy.getColumnValues("_time")).containsExactly(Time.ofSeconds(1));
  }
}
