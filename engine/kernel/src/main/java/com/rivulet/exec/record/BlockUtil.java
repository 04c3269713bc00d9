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

import java.util.List;

/**
 * Column and row helpers shared by transformations.
 */
public final class BlockUtil {

  private BlockUtil() {
  }

  /**
   * @return the index of the column with the given label, or -1
   */
  public static int columnIndex(String label, List<ColumnMeta> columns) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).getLabel().equals(label)) {
        return i;
      }
    }
    return -1;
  }

  public static boolean containsLabel(List<String> labels, String label) {
    return labels.contains(label);
  }

  /**
   * Adds every column of the block to the builder, in block order.
   */
  public static void addBlockColumns(Block block, BlockBuilder builder) {
    for (ColumnMeta column : block.getColumns()) {
      builder.addColumn(column);
    }
  }

  /**
   * Appends every row of the block. Builder column {@code j} receives block column
   * {@code columnMap.get(j)}.
   */
  public static void appendBlock(Block block, BlockBuilder builder, ColumnIndexMap columnMap) {
    final int rows = block.getRowCount();
    for (int j = 0; j < columnMap.size(); j++) {
      final int source = columnMap.get(j);
      for (int row = 0; row < rows; row++) {
        builder.appendValue(j, block.getValue(row, source));
      }
    }
  }
}
