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
package com.rivulet.exec.planner;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.rivulet.common.logical.OperationId;
import java.util.List;

/**
 * A node of a physical plan.
 */
public final class Procedure {
  private final OperationId id;
  private final ProcedureSpec spec;
  private final ImmutableList<OperationId> parents;
  private final ImmutableList<OperationId> children;

  public Procedure(OperationId id, ProcedureSpec spec, List<OperationId> parents, List<OperationId> children) {
    this.id = Preconditions.checkNotNull(id);
    this.spec = Preconditions.checkNotNull(spec);
    this.parents = ImmutableList.copyOf(parents);
    this.children = ImmutableList.copyOf(children);
  }

  public OperationId getId() {
    return id;
  }

  public String getKind() {
    return spec.getKind();
  }

  public ProcedureSpec getSpec() {
    return spec;
  }

  public ImmutableList<OperationId> getParents() {
    return parents;
  }

  public ImmutableList<OperationId> getChildren() {
    return children;
  }

  /**
   * @return a procedure with the same links and a deep copy of the spec
   */
  public Procedure copy() {
    return new Procedure(id, spec.copy(), parents, children);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("kind", getKind())
        .add("parents", parents)
        .add("children", children)
        .toString();
  }
}
