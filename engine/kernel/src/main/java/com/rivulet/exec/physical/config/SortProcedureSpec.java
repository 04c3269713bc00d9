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
package com.rivulet.exec.physical.config;

import com.google.common.base.MoreObjects;
import com.rivulet.common.logical.data.SortOpSpec;
import com.rivulet.exec.planner.PlanAdministration;
import com.rivulet.exec.planner.ProcedureSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Physical configuration of the sort operator: the columns to sort by and the direction.
 */
public class SortProcedureSpec implements ProcedureSpec {

  private final List<String> columns;
  private final boolean descending;

  public SortProcedureSpec(List<String> columns, boolean descending) {
    this.columns = new ArrayList<>(columns);
    this.descending = descending;
  }

  public static SortProcedureSpec create(SortOpSpec spec, PlanAdministration administration) {
    return new SortProcedureSpec(spec.getColumns(), spec.isDescending());
  }

  @Override
  public String getKind() {
    return SortOpSpec.KIND;
  }

  /**
   * @return the sort columns, owned by this spec
   */
  public List<String> getColumns() {
    return columns;
  }

  public boolean isDescending() {
    return descending;
  }

  @Override
  public SortProcedureSpec copy() {
    return new SortProcedureSpec(columns, descending);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SortProcedureSpec)) {
      return false;
    }
    SortProcedureSpec that = (SortProcedureSpec) o;
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
