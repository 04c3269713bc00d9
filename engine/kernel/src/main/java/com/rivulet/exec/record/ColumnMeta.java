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
import com.google.common.base.Strings;
import java.util.Objects;

/**
 * Label and type of a column.
 */
public final class ColumnMeta {
  private final String label;
  private final ColumnType type;

  public ColumnMeta(String label, ColumnType type) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(label), "column label must not be empty");
    this.label = label;
    this.type = Preconditions.checkNotNull(type, "column %s has no type", label);
  }

  public static ColumnMeta of(String label, ColumnType type) {
    return new ColumnMeta(label, type);
  }

  public String getLabel() {
    return label;
  }

  public ColumnType getType() {
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnMeta)) {
      return false;
    }
    ColumnMeta that = (ColumnMeta) o;
    return label.equals(that.label) && type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(label, type);
  }

  @Override
  public String toString() {
    return label + ":" + type;
  }
}
