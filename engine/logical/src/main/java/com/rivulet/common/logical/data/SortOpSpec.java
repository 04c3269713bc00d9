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
package com.rivulet.common.logical.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.rivulet.common.logical.Administration;
import com.rivulet.common.logical.ColumnLabels;
import com.rivulet.common.logical.FunctionSignature;
import com.rivulet.common.logical.OperationSpec;
import com.rivulet.common.logical.args.ArrayValue;
import com.rivulet.common.logical.args.Arguments;
import com.rivulet.common.logical.args.SemanticType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sorts the rows of every table by a list of columns.
 */
@JsonTypeName(SortOpSpec.KIND)
public final class SortOpSpec implements OperationSpec {

  public static final String KIND = "sort";

  public static final FunctionSignature SIGNATURE = FunctionSignature.defaultSignature()
      .param("cols", SemanticType.arrayOf(SemanticType.STRING))
      .param("desc", SemanticType.BOOL)
      .build();

  private static final ImmutableList<String> DEFAULT_COLUMNS = ImmutableList.of(ColumnLabels.DEFAULT_VALUE);

  private final ImmutableList<String> columns;
  private final boolean descending;

  @JsonCreator
  public SortOpSpec(@JsonProperty("cols") List<String> columns, @JsonProperty("desc") boolean descending) {
    this.columns = columns == null ? DEFAULT_COLUMNS : ImmutableList.copyOf(columns);
    this.descending = descending;
  }

  /**
   * Parses {@code sort(table, cols, desc)}. Sorts ascending by {@code _value} unless told
   * otherwise.
   */
  public static SortOpSpec create(Arguments args, Administration administration) {
    administration.addParentFromArgs(args);

    final List<String> columns;
    Optional<ArrayValue> cols = args.getArray("cols", SemanticType.STRING);
    if (cols.isPresent()) {
      columns = cols.get().toStringList();
    } else {
      columns = DEFAULT_COLUMNS;
    }

    boolean desc = args.getBoolean("desc").orElse(false);
    return new SortOpSpec(columns, desc);
  }

  @Override
  public String getKind() {
    return KIND;
  }

  @JsonProperty("cols")
  public ImmutableList<String> getColumns() {
    return columns;
  }

  @JsonProperty("desc")
  public boolean isDescending() {
    return descending;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SortOpSpec)) {
      return false;
    }
    SortOpSpec that = (SortOpSpec) o;
    return descending == that.descending && columns.equals(that.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns, descending);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("cols", columns).add("desc", descending).toString();
  }
}
