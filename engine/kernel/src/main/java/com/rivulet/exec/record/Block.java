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
 * A column oriented fragment of a table. All rows belong to the group named by the block's key,
 * and the key columns hold the key value in every row.
 *
 * <p>A block handed to a transformation is only valid for the duration of that call.
 */
public interface Block {

  PartitionKey getKey();

  List<ColumnMeta> getColumns();

  int getRowCount();

  /**
   * @return the value of a cell, null for a null cell
   */
  Object getValue(int row, int column);

  default int getColumnCount() {
    return getColumns().size();
  }
}
