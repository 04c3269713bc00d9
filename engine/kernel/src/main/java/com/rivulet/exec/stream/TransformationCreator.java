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
package com.rivulet.exec.stream;

import com.rivulet.common.exceptions.ExecutionSetupException;
import com.rivulet.exec.context.ExecutionAdministration;
import com.rivulet.exec.planner.ProcedureSpec;

/**
 * Builds the runtime node of one procedure kind.
 *
 * @param <T> the procedure spec type the creator accepts
 */
public interface TransformationCreator<T extends ProcedureSpec> {

  CreatedTransformation create(DatasetId id, AccumulationMode mode, T spec, ExecutionAdministration administration)
      throws ExecutionSetupException;
}
