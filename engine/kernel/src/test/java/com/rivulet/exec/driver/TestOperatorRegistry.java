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
package com.rivulet.exec.driver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.rivulet.common.config.RivuletConfig;
import com.rivulet.common.exceptions.ErrorType;
import com.rivulet.common.exceptions.ExecutionSetupException;
import com.rivulet.common.logical.OperationId;
import com.rivulet.common.logical.QuerySpec;
import com.rivulet.common.logical.TableObject;
import com.rivulet.common.logical.args.ArrayValue;
import com.rivulet.common.logical.args.Arguments;
import com.rivulet.common.logical.data.SortOpSpec;
import com.rivulet.exec.ValuesOperatorModule;
import com.rivulet.exec.ValuesOperatorModule.ValuesProcedureSpec;
import com.rivulet.exec.context.ExecutionContext;
import com.rivulet.exec.op.sort.SortOperatorModule;
import com.rivulet.exec.physical.config.SortProcedureSpec;
import com.rivulet.exec.planner.PlanSpec;
import com.rivulet.exec.planner.Procedure;
import com.rivulet.exec.record.ColumnType;
import com.rivulet.exec.record.HeapBlock;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;
import com.rivulet.exec.stream.AccumulationMode;
import com.rivulet.exec.stream.BlockCollector;
import com.rivulet.exec.stream.CreatedTransformation;
import com.rivulet.exec.stream.DatasetId;
import com.rivulet.test.UserExceptionAssert;
import org.junit.Test;

public class TestOperatorRegistry {

  @Test
  public void sortIsDiscovered() {
    OperatorRegistry registry = OperatorRegistry.fromClasspath();

    assertThat(registry.getFunctions().getFunctionKinds()).contains(SortOpSpec.KIND);
    assertThat(registry.getFunctions().getOperationSpecType(SortOpSpec.KIND)).isEqualTo(SortOpSpec.class);
    assertThat(registry.getProcedures().getKinds()).contains(SortOpSpec.KIND);
    assertThat(registry.getTransformations().getKinds()).contains(SortOpSpec.KIND);
  }

  @Test
  public void laterRegistrationWins() {
    SortProcedureSpec replacement = new SortProcedureSpec(ImmutableList.of("replaced"), true);
    OperatorRegistry registry = OperatorRegistry.builder()
        .install(new SortOperatorModule())
        .registerProcedure(SortOpSpec.KIND, SortOpSpec.class, (spec, administration) -> replacement)
        .build();

    assertThat(registry.getProcedures().createProcedureSpec(new SortOpSpec(null, false), () -> Time.ofSeconds(0)))
        .isSameAs(replacement);
  }

  @Test
  public void wrongProcedureSpecType() {
    OperatorRegistry registry = OperatorRegistry.builder()
        .install(new ValuesOperatorModule())
        .registerTransformation(ValuesOperatorModule.KIND, SortProcedureSpec.class,
            (id, mode, spec, administration) -> {
              throw new AssertionError("must not be called");
            })
        .build();

    assertThatThrownBy(() -> registry.getTransformations().createTransformation(DatasetId.of("values0"),
        AccumulationMode.DISCARDING, new ValuesProcedureSpec(), null))
        .isInstanceOf(ExecutionSetupException.class)
        .hasMessage("invalid spec type " + ValuesProcedureSpec.class.getName() + " for transformation values");
  }

  @Test
  public void noTransformationForKind() {
    OperatorRegistry registry = OperatorRegistry.fromModules(ImmutableList.of(new ValuesOperatorModule()));

    UserExceptionAssert.assertThatThrownBy(() -> registry.getTransformations().createTransformation(
        DatasetId.of("values0"), AccumulationMode.DISCARDING, new ValuesProcedureSpec(), null))
        .hasErrorType(ErrorType.PLAN)
        .hasMessage("no transformation registered for kind values");
  }

  @Test
  public void queryToSortedBlocks() throws Exception {
    OperatorRegistry registry = OperatorRegistry.builder()
        .install(new ValuesOperatorModule())
        .install(new SortOperatorModule())
        .build();

    TableObject from = registry.getFunctions().call(OperationId.of("values0"), ValuesOperatorModule.KIND,
        Arguments.empty());
    TableObject sorted = registry.getFunctions().call(OperationId.of("sort1"), SortOpSpec.KIND,
        Arguments.builder()
            .table(from)
            .put("cols", ArrayValue.ofStrings("host", "v"))
            .build());

    // queries travel as JSON
    ObjectMapper mapper = registry.newObjectMapper();
    QuerySpec query = mapper.readValue(mapper.writeValueAsString(QuerySpec.fromTables(sorted)), QuerySpec.class);
    PlanSpec plan = registry.newPlanner().plan(query, Time.ofSeconds(60));
    Procedure sort = plan.getProcedure(OperationId.of("sort1"));

    BlockCollector collector = new BlockCollector();
    try (ExecutionContext context = new ExecutionContext(RivuletConfig.create())) {
      CreatedTransformation created = registry.getTransformations().createTransformation(
          DatasetId.of(sort.getId().getName()), AccumulationMode.DISCARDING, sort.getSpec(), context);
      created.getDataset().addTransformation(collector);

      DatasetId parent = DatasetId.of("values0");
      PartitionKey key = PartitionKey.builder().add("_measurement", ColumnType.STRING, "cpu").build();
      created.getTransformation().process(parent, HeapBlock.builder(key)
          .column("host", ColumnType.STRING)
          .column("v", ColumnType.FLOAT)
          .row("b", 1.0)
          .row("a", 2.0)
          .row("a", 1.5)
          .build());
      created.getTransformation().finish(parent, null);
    }

    assertThat(collector.isFinished()).isTrue();
    assertThat(collector.getError()).isNull();
    assertThat(collector.getBlocks()).hasSize(1);
    HeapBlock out = collector.getBlocks().get(0);
    assertThat(out.getColumnValues("host")).containsExactly("a", "a", "b");
    assertThat(out.getColumnValues("v")).containsExactly(1.5, 2.0, 1.0);
  }
}
