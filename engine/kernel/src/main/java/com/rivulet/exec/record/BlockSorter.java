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

import org.apache.lucene.util.InPlaceMergeSorter;

/**
 * Stable in place sort of a row permutation. Nulls order first, and a descending sort reverses
 * the whole comparison.
 */
class BlockSorter extends InPlaceMergeSorter {
  private final int[] order;
  private final ColumnType[] types;
  private final Object[][] keys;
  private final boolean descending;

  /**
   * @param types type of each sort column
   * @param keys values of each sort column, indexed by row
   */
  BlockSorter(int[] order, ColumnType[] types, Object[][] keys, boolean descending) {
    this.order = order;
    this.types = types;
    this.keys = keys;
    this.descending = descending;
  }

  void sort() {
    sort(0, order.length);
  }

  @Override
  protected int compare(int i, int j) {
    final int left = order[i];
    final int right = order[j];
    for (int c = 0; c < types.length; c++) {
      int cmp = compareValues(types[c], keys[c][left], keys[c][right]);
      if (cmp != 0) {
        return descending ? -cmp : cmp;
      }
    }
    return 0;
  }

  @Override
  protected void swap(int i, int j) {
    int tmp = order[i];
    order[i] = order[j];
    order[j] = tmp;
  }

  private static int compareValues(ColumnType type, Object left, Object right) {
    if (left == null || right == null) {
      return left == right ? 0 : (left == null ? -1 : 1);
    }
    return type.compare(left, right);
  }
}
