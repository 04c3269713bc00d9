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

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.rivulet.common.exceptions.ErrorType;
import com.rivulet.common.logical.args.Arguments;
import com.rivulet.common.logical.data.SortOpSpec;
import com.rivulet.test.UserExceptionAssert;
import org.junit.Test;

public class TestQuerySpec extends FunctionRegistryTestBase {

  private static TableObject sort(String id, TableObject parent) {
    return REGISTRY.call(OperationId.of(id), SortOpSpec.KIND, Arguments.builder().table(parent).build());
  }

  @Test
  public void fromTablesOrdersParentsFirst() {
    TableObject from = source("source0");
    TableObject sorted = sort("sort1", from);

    QuerySpec query = QuerySpec.fromTables(sorted);
    query.validate();

    assertThat(query.getOperations()).extracting(Operation::getId)
        .containsExactly(OperationId.of("source0"), OperationId.of("sort1"));
    assertThat(query.getEdges()).containsExactly(new Edge(OperationId.of("source0"), OperationId.of("sort1")));
    assertThat(query.getParents(OperationId.of("sort1"))).containsExactly(OperationId.of("source0"));
  }

  @Test
  public void sharedParentVisitedOnce() {
    TableObject from = source("source0");
    QuerySpec query = QuerySpec.fromTables(sort("sort1", from), sort("sort2", from));

    assertThat(query.getOperations()).hasSize(3);
    assertThat(query.getChildren(OperationId.of("source0")))
        .containsExactly(OperationId.of("sort1"), OperationId.of("sort2"));
  }

  @Test
  public void emptyQuery() {
    UserExceptionAssert.assertThatThrownBy(() -> new QuerySpec(null, null).validate())
        .hasErrorType(ErrorType.PLAN);
  }

  @Test
  public void duplicateIds() {
    Operation op = new Operation(OperationId.of("a"), new SourceOpSpec("x"));
    UserExceptionAssert.assertThatThrownBy(() -> new QuerySpec(ImmutableList.of(op, op), null).validate())
        .hasErrorType(ErrorType.PLAN)
        .hasMessageContaining("duplicate operation ID a");
  }

  @Test
  public void unknownEdgeEndpoint() {
    Operation op = new Operation(OperationId.of("a"), new SourceOpSpec("x"));
    QuerySpec query = new QuerySpec(ImmutableList.of(op), ImmutableList.of(new Edge(OperationId.of("a"), OperationId.of("b"))));
    UserExceptionAssert.assertThatThrownBy(query::validate)
        .hasErrorType(ErrorType.PLAN)
        .hasMessageContaining("unknown operation");
  }

  @Test
  public void cycle() {
    Operation a = new Operation(OperationId.of("a"), new SortOpSpec(null, false));
    Operation b = new Operation(OperationId.of("b"), new SortOpSpec(null, false));
    QuerySpec query = new QuerySpec(ImmutableList.of(a, b), ImmutableList.of(
        new Edge(a.getId(), b.getId()), new Edge(b.getId(), a.getId())));
    UserExceptionAssert.assertThatThrownBy(query::topologicalOrder)
        .hasErrorType(ErrorType.PLAN)
        .hasMessageContaining("cycle");
  }

  @Test
  public void jsonRoundTrip() throws Exception {
    ObjectMapper mapper = REGISTRY.newObjectMapper();
    QuerySpec query = QuerySpec.fromTables(sort("sort1", source("source0")));

    String json = mapper.writeValueAsString(query);
    QuerySpec read = mapper.readValue(json, QuerySpec.class);

    assertThat(read).isEqualTo(query);
    assertThat(read.getOperation(OperationId.of("sort1")).getKind()).isEqualTo(SortOpSpec.KIND);
  }
}
