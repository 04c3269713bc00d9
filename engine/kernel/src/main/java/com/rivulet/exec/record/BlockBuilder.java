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
 * Accumulates the rows of one output block for a partition key.
 */
public interface BlockBuilder extends AutoCloseable {

  PartitionKey getKey();

  List<ColumnMeta> getColumns();

  int getRowCount();

  /**
   * Appends a column. Existing rows hold null in it.
   *
   * @return the index of the new column
   * @throws IllegalArgumentException if a column with the same label exists
   */
  int addColumn(ColumnMeta column);

  /**
   * Appends a value, possibly null, to the end of a column.
   *
   * @throws IllegalArgumentException if the value does not match the column type
   */
  void appendValue(int column, Object value);

  Object getValue(int row, int column);

  /**
   * Sorts the rows in place by the given columns, all ascending or all descending. Labels the
   * builder does not have are ignored. Rows that compare equal keep their relative order.
   */
  void sort(List<String> columns, boolean descending);

  /**
   * Builds a block from the current rows. The builder keeps its rows.
   */
  ArrowBlock build();

  /**
   * Drops all rows, keeping the columns.
   */
  void clearData();

  @Override
  void close();
}
