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
 * Maps builder columns to input block columns. Owns an identity buffer that only grows, so that
 * processing many blocks of the same width allocates once.
 */
public final class ColumnIndexMap {
  private int[] buffer = new int[0];
  private int size;

  /**
   * Sets the view to the first {@code columns} entries, growing the buffer when it is too small.
   */
  public ColumnIndexMap resize(int columns) {
    Preconditions.checkArgument(columns >= 0);
    if (buffer.length < columns) {
      buffer = new int[columns];
      for (int i = 0; i < columns; i++) {
        buffer[i] = i;
      }
    }
    size = columns;
    return this;
  }

  public int get(int column) {
    Preconditions.checkElementIndex(column, size);
    return buffer[column];
  }

  public int size() {
    return size;
  }

  int capacity() {
    return buffer.length;
  }
}
