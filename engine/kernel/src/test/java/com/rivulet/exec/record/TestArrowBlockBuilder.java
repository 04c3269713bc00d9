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
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class TestArrowBlockBuilder extends BaseTestWithAllocator {

  private static final PartitionKey KEY = PartitionKey.builder().add("host", ColumnType.STRING, "a").build();

  private ArrowBlockBuilder newBuilder() {
    return new ArrowBlockBuilder(KEY, allocator, 2);
  }

  private static List<Object> column(BlockBuilder builder, int col) {
    List<Object> values = new ArrayList<>();
    for (int row = 0; row < builder.getRowCount(); row++) {
      values.add(builder.getValue(row, col));
    }
    return values;
  }

  /** Builds a builder with an INT column "a" and a STRING column "b". */
  private ArrowBlockBuilder twoColumns(Object[][] rows) {
    ArrowBlockBuilder builder = newBuilder();
    int a = builder.addColumn(ColumnMeta.of("a", ColumnType.INT));
    int b = builder.addColumn(ColumnMeta.of("b", ColumnType.STRING));
    for (Object[] row : rows) {
      builder.appendValue(a, row[0]);
      builder.appendValue(b, row[1]);
    }
    return builder;
  }

  @Test
  public void appendAndBuild() {
    try (ArrowBlockBuilder builder = twoColumns(new Object[][] {{1, "x"}, {null, "y"}})) {
      try (ArrowBlock block = builder.build()) {
        assertThat(block.getKey()).isEqualTo(KEY);
        assertThat(block.getRowCount()).isEqualTo(2);
        assertThat(block.getValue(0, 0)).isEqualTo(1L);
        assertThat(block.getValue(1, 0)).isNull();
        assertThat(block.getValue(1, 1)).isEqualTo("y");
      }
      // the builder keeps its rows
      assertThat(builder.getRowCount()).isEqualTo(2);
    }
  }

  @Test
  public void growsPastInitialCapacity() {
    try (ArrowBlockBuilder builder = newBuilder()) {
      int s = builder.addColumn(ColumnMeta.of("s", ColumnType.STRING));
      for (int i = 0; i < 1000; i++) {
        builder.appendValue(s, "value-" + i);
      }
      assertThat(builder.getRowCount()).isEqualTo(1000);
      assertThat(builder.getValue(999, s)).isEqualTo("value-999");
    }
  }

  @Test
  public void everyColumnType() {
    try (ArrowBlockBuilder builder = newBuilder()) {
      Object[] values = {true, -3L, -1L, 2.5d, "s", Time.ofNanos(42)};
      ColumnType[] types = ColumnType.values();
      for (int i = 0; i < types.length; i++) {
        builder.addColumn(ColumnMeta.of("c" + i, types[i]));
      }
      for (int i = 0; i < types.length; i++) {
        builder.appendValue(i, values[i]);
      }
      for (int i = 0; i < types.length; i++) {
        builder.appendValue(i, null);
      }
      assertThat(builder.getRowCount()).isEqualTo(2);
      for (int i = 0; i < types.length; i++) {
        assertThat(column(builder, i)).containsExactly(values[i], null);
      }
    }
  }

  @Test
  public void stableAscendingSort() {
    try (ArrowBlockBuilder builder = twoColumns(new Object[][] {{3, "x"}, {1, "y"}, {1, "z"}})) {
      builder.sort(ImmutableList.of("a"), false);
      assertThat(column(builder, 0)).containsExactly(1L, 1L, 3L);
      assertThat(column(builder, 1)).containsExactly("y", "z", "x");
    }
  }

  @Test
  public void stableDescendingSort() {
    try (ArrowBlockBuilder builder = twoColumns(new Object[][] {{3, "x"}, {1, "y"}, {1, "z"}})) {
      builder.sort(ImmutableList.of("a"), true);
      assertThat(column(builder, 0)).containsExactly(3L, 1L, 1L);
      assertThat(column(builder, 1)).containsExactly("x", "y", "z");
    }
  }

  @Test
  public void multipleColumnsInOrder() {
    try (ArrowBlockBuilder builder = twoColumns(new Object[][] {{2, "a"}, {1, "b"}, {1, "a"}, {2, "b"}})) {
      builder.sort(ImmutableList.of("b", "a"), false);
      assertThat(column(builder, 0)).containsExactly(1L, 2L, 1L, 2L);
      assertThat(column(builder, 1)).containsExactly("a", "a", "b", "b");
    }
  }

  @Test
  public void nullsFirstAscendingLastDescending() {
    try (ArrowBlockBuilder builder = twoColumns(new Object[][] {{2, "x"}, {null, "y"}, {1, "z"}})) {
      builder.sort(ImmutableList.of("a"), false);
      assertThat(column(builder, 0)).containsExactly(null, 1L, 2L);
      builder.sort(ImmutableList.of("a"), true);
      assertThat(column(builder, 0)).containsExactly(2L, 1L, null);
    }
  }

  @Test
  public void unsignedOrder() {
    try (ArrowBlockBuilder builder = newBuilder()) {
      int u = builder.addColumn(ColumnMeta.of("u", ColumnType.UINT));
      builder.appendValue(u, -1L);
      builder.appendValue(u, 1L);
      builder.sort(ImmutableList.of("u"), false);
      assertThat(column(builder, u)).containsExactly(1L, -1L);
    }
  }

  @Test
  public void booleanAndTimeOrder() {
    try (ArrowBlockBuilder builder = newBuilder()) {
      int b = builder.addColumn(ColumnMeta.of("b", ColumnType.BOOL));
      int t = builder.addColumn(ColumnMeta.of("t", ColumnType.TIME));
      builder.appendValue(b, true);
      builder.appendValue(t, Time.ofSeconds(1));
      builder.appendValue(b, false);
      builder.appendValue(t, Time.ofSeconds(2));

      builder.sort(ImmutableList.of("b"), false);
      assertThat(column(builder, b)).containsExactly(false, true);
      builder.sort(ImmutableList.of("t"), false);
      assertThat(column(builder, t)).containsExactly(Time.ofSeconds(1), Time.ofSeconds(2));
    }
  }

  @Test
  public void missingSortColumnsAreIgnored() {
    try (ArrowBlockBuilder builder = twoColumns(new Object[][] {{3, "x"}, {1, "y"}})) {
      builder.sort(ImmutableList.of("missing"), false);
      assertThat(column(builder, 0)).containsExactly(3L, 1L);

      builder.sort(ImmutableList.of("missing", "a"), false);
      assertThat(column(builder, 0)).containsExactly(1L, 3L);
    }
  }

  @Test
  public void addColumnPadsWithNulls() {
    try (ArrowBlockBuilder builder = twoColumns(new Object[][] {{1, "x"}, {2, "y"}})) {
      int c = builder.addColumn(ColumnMeta.of("c", ColumnType.FLOAT));
      assertThat(column(builder, c)).containsExactly(null, null);
      assertThat(builder.getColumns()).extracting(ColumnMeta::getLabel).containsExactly("a", "b", "c");
    }
  }

  @Test
  public void clearDataKeepsColumns() {
    try (ArrowBlockBuilder builder = twoColumns(new Object[][] {{1, "x"}})) {
      builder.clearData();
      assertThat(builder.getRowCount()).isZero();
      assertThat(builder.getColumns()).hasSize(2);

      builder.appendValue(0, 5);
      builder.appendValue(1, "z");
      assertThat(column(builder, 1)).containsExactly("z");
    }
  }

  @Test
  public void rejectsInvalidUse() {
    try (ArrowBlockBuilder builder = twoColumns(new Object[][] {})) {
      assertThatThrownBy(() -> builder.addColumn(ColumnMeta.of("a", ColumnType.FLOAT)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("already has column with label a");
      assertThatThrownBy(() -> builder.appendValue(0, "not a number"))
          .isInstanceOf(IllegalArgumentException.class);

      builder.appendValue(0, 1);
      // column b is now shorter than column a
      assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }
  }

  @Test
  public void closedBuilder() {
    ArrowBlockBuilder builder = twoColumns(new Object[][] {{1, "x"}});
    builder.close();
    builder.close();
    assertThatThrownBy(() -> builder.appendValue(0, 1)).isInstanceOf(IllegalStateException.class);
  }
}
