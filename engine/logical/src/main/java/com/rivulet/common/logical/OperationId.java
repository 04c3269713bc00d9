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
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Identifier of an operation within one query.
 */
public final class OperationId implements Comparable<OperationId> {
  private final String name;

  private OperationId(String name) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "operation id must not be empty");
    this.name = name;
  }

  @JsonCreator
  public static OperationId of(String name) {
    return new OperationId(name);
  }

  /**
   * Builds the conventional id of the n-th call of a function, e.g. {@code sort2}.
   */
  public static OperationId of(String kind, int n) {
    return new OperationId(kind + n);
  }

  @JsonValue
  public String getName() {
    return name;
  }

  @Override
  public int compareTo(OperationId o) {
    return name.compareTo(o.name);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof OperationId && name.equals(((OperationId) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
