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
import com.google.common.collect.ImmutableList;
import com.rivulet.common.exceptions.UserException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The logical plan of a query: its operations and the edges between them.
 */
public final class QuerySpec {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(QuerySpec.class);

  private final ImmutableList<Operation> operations;
  private final ImmutableList<Edge> edges;

  @JsonCreator
  public QuerySpec(@JsonProperty("operations") List<Operation> operations,
                   @JsonProperty("edges") List<Edge> edges) {
    this.operations = operations == null ? ImmutableList.of() : ImmutableList.copyOf(operations);
    this.edges = edges == null ? ImmutableList.of() : ImmutableList.copyOf(edges);
  }

  /**
   * Builds the plan that produces the given results by walking their parents. Operations appear
   * parents first.
   */
  public static QuerySpec fromTables(TableObject... results) {
    final Map<OperationId, Operation> operations = new LinkedHashMap<>();
    final List<Edge> edges = new ArrayList<>();
    final Set<OperationId> visited = new HashSet<>();
    for (TableObject result : results) {
      visit(result, visited, operations, edges);
    }
    return new QuerySpec(new ArrayList<>(operations.values()), edges);
  }

  private static void visit(TableObject table, Set<OperationId> visited,
                            Map<OperationId, Operation> operations, List<Edge> edges) {
    if (!visited.add(table.getId())) {
      return;
    }
    for (TableObject parent : table.getParents()) {
      visit(parent, visited, operations, edges);
      edges.add(new Edge(parent.getId(), table.getId()));
    }
    operations.put(table.getId(), table.toOperation());
  }

  public ImmutableList<Operation> getOperations() {
    return operations;
  }

  public ImmutableList<Edge> getEdges() {
    return edges;
  }

  public Operation getOperation(OperationId id) {
    for (Operation operation : operations) {
      if (operation.getId().equals(id)) {
        return operation;
      }
    }
    throw UserException.planError()
        .message("unknown operation %s", id)
        .build(logger);
  }

  public ImmutableList<OperationId> getParents(OperationId id) {
    ImmutableList.Builder<OperationId> parents = ImmutableList.builder();
    for (Edge edge : edges) {
      if (edge.getChild().equals(id)) {
        parents.add(edge.getParent());
      }
    }
    return parents.build();
  }

  public ImmutableList<OperationId> getChildren(OperationId id) {
    ImmutableList.Builder<OperationId> children = ImmutableList.builder();
    for (Edge edge : edges) {
      if (edge.getParent().equals(id)) {
        children.add(edge.getChild());
      }
    }
    return children.build();
  }

  /**
   * Checks that the plan is a well formed graph: at least one operation, unique ids, edges that
   * only reference known operations and no cycles.
   *
   * @throws UserException of type PLAN describing the first problem found
   */
  public void validate() {
    if (operations.isEmpty()) {
      throw UserException.planError().message("query has no operations").build(logger);
    }
    Set<OperationId> ids = new HashSet<>();
    for (Operation operation : operations) {
      if (!ids.add(operation.getId())) {
        throw UserException.planError()
            .message("found duplicate operation ID %s", operation.getId())
            .build(logger);
      }
    }
    for (Edge edge : edges) {
      if (!ids.contains(edge.getParent()) || !ids.contains(edge.getChild())) {
        throw UserException.planError()
            .message("edge %s references an unknown operation", edge)
            .build(logger);
      }
    }
    topologicalOrder();
  }

  /**
   * @return the operations ordered so that every parent precedes its children
   * @throws UserException of type PLAN if the edges contain a cycle
   */
  public ImmutableList<Operation> topologicalOrder() {
    final Map<OperationId, Integer> pending = new HashMap<>();
    for (Operation operation : operations) {
      pending.put(operation.getId(), 0);
    }
    for (Edge edge : edges) {
      pending.merge(edge.getChild(), 1, Integer::sum);
    }

    final Deque<OperationId> ready = new ArrayDeque<>();
    for (Operation operation : operations) {
      if (pending.get(operation.getId()) == 0) {
        ready.add(operation.getId());
      }
    }

    final ImmutableList.Builder<Operation> ordered = ImmutableList.builder();
    int count = 0;
    while (!ready.isEmpty()) {
      OperationId id = ready.poll();
      ordered.add(getOperation(id));
      count++;
      for (OperationId child : getChildren(id)) {
        if (pending.merge(child, -1, Integer::sum) == 0) {
          ready.add(child);
        }
      }
    }

    if (count != operations.size()) {
      throw UserException.planError().message("found cycle in query").build(logger);
    }
    return ordered.build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QuerySpec)) {
      return false;
    }
    QuerySpec that = (QuerySpec) o;
    return operations.equals(that.operations) && edges.equals(that.edges);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operations, edges);
  }
}
