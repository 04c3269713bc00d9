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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.rivulet.common.exceptions.UserException;
import com.rivulet.common.logical.OperationId;
import com.rivulet.exec.record.Time;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A physical plan: procedures in topological order.
 */
public final class PlanSpec {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PlanSpec.class);

  private final ImmutableMap<OperationId, Procedure> procedures;
  private final Time now;

  PlanSpec(List<Procedure> procedures, Time now) {
    final Map<OperationId, Procedure> byId = new LinkedHashMap<>();
    for (Procedure procedure : procedures) {
      byId.put(procedure.getId(), procedure);
    }
    this.procedures = ImmutableMap.copyOf(byId);
    this.now = now;
  }

  /**
   * @return every procedure, parents before children
   */
  public ImmutableList<Procedure> getProcedures() {
    return procedures.values().asList();
  }

  public Procedure getProcedure(OperationId id) {
    final Procedure procedure = procedures.get(id);
    if (procedure == null) {
      throw UserException.planError()
          .message("plan has no procedure %s", id)
          .build(logger);
    }
    return procedure;
  }

  /**
   * @return the procedures without parents
   */
  public ImmutableList<Procedure> getRoots() {
    ImmutableList.Builder<Procedure> roots = ImmutableList.builder();
    for (Procedure procedure : procedures.values()) {
      if (procedure.getParents().isEmpty()) {
        roots.add(procedure);
      }
    }
    return roots.build();
  }

  /**
   * @return the procedures without children, whose output is the query result
   */
  public ImmutableList<Procedure> getResults() {
    ImmutableList.Builder<Procedure> results = ImmutableList.builder();
    for (Procedure procedure : procedures.values()) {
      if (procedure.getChildren().isEmpty()) {
        results.add(procedure);
      }
    }
    return results.build();
  }

  public Time getNow() {
    return now;
  }

  /**
   * @return a plan whose procedure specs can be changed without affecting this one
   */
  public PlanSpec copy() {
    ImmutableList.Builder<Procedure> copies = ImmutableList.builder();
    for (Procedure procedure : procedures.values()) {
      copies.add(procedure.copy());
    }
    return new PlanSpec(copies.build(), now);
  }
}
