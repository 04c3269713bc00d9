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
package com.rivulet.exec.op.sort;

import com.rivulet.common.logical.data.SortOpSpec;
import com.rivulet.exec.driver.OperatorModule;
import com.rivulet.exec.driver.OperatorRegistry;
import com.rivulet.exec.physical.config.SortProcedureSpec;

/**
 * Registers {@code sort}.
 */
public class SortOperatorModule implements OperatorModule {

  @Override
  public void register(OperatorRegistry.Builder builder) {
    builder.registerFunction(SortOpSpec.KIND, SortOpSpec::create, SortOpSpec.SIGNATURE)
        .registerOperationSpec(SortOpSpec.KIND, SortOpSpec.class)
        .registerProcedure(SortOpSpec.KIND, SortOpSpec.class, SortProcedureSpec::create)
        .registerTransformation(SortOpSpec.KIND, SortProcedureSpec.class, SortTransformation::create);
  }
}
