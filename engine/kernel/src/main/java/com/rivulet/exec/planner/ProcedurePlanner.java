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

import com.google.common.base.Preconditions;
import com.rivulet.common.exceptions.UserException;
import com.rivulet.common.logical.Operation;
import com.rivulet.common.logical.QuerySpec;
import com.rivulet.exec.record.Time;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a logical query into a physical plan, one procedure per operation.
 */
public class ProcedurePlanner {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(ProcedurePlanner.class);

  private final ProcedureRegistry registry;

  public ProcedurePlanner(ProcedureRegistry registry) {
    this.registry = Preconditions.checkNotNull(registry);
  }

  /**
   * @throws UserException of type PLAN if the query is invalid or an operation cannot be planned
   */
  public PlanSpec plan(QuerySpec query, Time now) {
    query.validate();

    final PlanAdministration administration = new PlanAdministration() {
      @Override
      public Time getNow() {
        return now;
      }
    };

    final List<Procedure> procedures = new ArrayList<>();
    for (Operation operation : query.topologicalOrder()) {
      final ProcedureSpec spec;
      try {
        spec = registry.createProcedureSpec(operation.getKind(), operation.getSpec(), administration);
      } catch (UserException e) {
        throw UserException.planError(e)
            .addContext("operation", operation.getId().getName())
            .build(logger);
      }
      procedures.add(new Procedure(operation.getId(), spec,
          query.getParents(operation.getId()), query.getChildren(operation.getId())));
    }
    logger.debug("Planned {} procedures", procedures.size());
    return new PlanSpec(procedures, now);
  }
}
