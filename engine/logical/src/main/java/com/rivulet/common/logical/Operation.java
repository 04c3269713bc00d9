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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * A node of the logical plan: an identified {@link OperationSpec}.
 */
public final class Operation {
  private final OperationId id;
  private final OperationSpec spec;

  @JsonCreator
  public Operation(@JsonProperty("id") OperationId id, @JsonProperty("spec") OperationSpec spec) {
    this.id = Preconditions.checkNotNull(id, "operation id is required");
    this.spec = Preconditions.checkNotNull(spec, "operation %s has no spec", id);
  }

  public OperationId getId() {
    return id;
  }

  public OperationSpec getSpec() {
    return spec;
  }

  @JsonIgnore
  public String getKind() {
    return spec.getKind();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Operation)) {
      return false;
    }
    Operation that = (Operation) o;
    return id.equals(that.id) && spec.equals(that.spec);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, spec);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("id", id).add("spec", spec).toString();
  }
}
