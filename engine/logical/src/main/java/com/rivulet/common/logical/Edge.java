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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * Directed edge of the logical plan. Data flows from parent to child.
 */
public final class Edge {
  private final OperationId parent;
  private final OperationId child;

  @JsonCreator
  public Edge(@JsonProperty("parent") OperationId parent, @JsonProperty("child") OperationId child) {
    this.parent = Preconditions.checkNotNull(parent);
    this.child = Preconditions.checkNotNull(child);
  }

  public OperationId getParent() {
    return parent;
  }

  public OperationId getChild() {
    return child;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Edge)) {
      return false;
    }
    Edge edge = (Edge) o;
    return parent.equals(edge.parent) && child.equals(edge.child);
  }

  @Override
  public int hashCode() {
    return Objects.hash(parent, child);
  }

  @Override
  public String toString() {
    return parent + " -> " + child;
  }
}
