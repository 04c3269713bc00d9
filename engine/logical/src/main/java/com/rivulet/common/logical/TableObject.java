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
package com.rivulet.common.logical;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The value a function call evaluates to: a reference to the operation that produces a stream of
 * tables, together with the table objects it consumes. Passing a table object as an argument of
 * another call makes that call a child of this operation.
 */
public final class TableObject {
  private final OperationId id;
  private final OperationSpec spec;
  private final ImmutableList<TableObject> parents;

  public TableObject(OperationId id, OperationSpec spec, List<TableObject> parents) {
    this.id = Preconditions.checkNotNull(id);
    this.spec = Preconditions.checkNotNull(spec);
    this.parents = ImmutableList.copyOf(parents);
  }

  public OperationId getId() {
    return id;
  }

  public String getKind() {
    return spec.getKind();
  }

  public OperationSpec getSpec() {
    return spec;
  }

  public ImmutableList<TableObject> getParents() {
    return parents;
  }

  public Operation toOperation() {
    return new Operation(id, spec);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("id", id).add("kind", getKind()).toString();
  }
}
