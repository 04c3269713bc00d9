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

import com.google.common.collect.ImmutableList;
import com.rivulet.common.exceptions.UserException;
import com.rivulet.common.logical.args.Arguments;
import java.util.ArrayList;
import java.util.List;

/**
 * Context handed to an {@link ArgumentParser} while one function call is turned into an
 * operation. Collects the upstream operations the call consumes.
 */
public class Administration {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(Administration.class);

  /** Name of the pipe argument, the table a call consumes. */
  public static final String TABLE_PARAM = "table";

  private final OperationId id;
  private final List<TableObject> parents = new ArrayList<>();

  public Administration(OperationId id) {
    this.id = id;
  }

  public OperationId getId() {
    return id;
  }

  /**
   * Attaches the table passed as the pipe argument as a parent of the operation.
   *
   * @throws UserException if the argument is missing or is not a table
   */
  public void addParentFromArgs(Arguments args) {
    Object parent = args.getRequired(TABLE_PARAM);
    if (!(parent instanceof TableObject)) {
      throw UserException.functionError()
          .message("argument is not a table object: got %s", parent.getClass().getSimpleName())
          .addContext("argument", TABLE_PARAM)
          .build(logger);
    }
    addParent((TableObject) parent);
  }

  public void addParent(TableObject parent) {
    parents.add(parent);
  }

  public ImmutableList<TableObject> getParents() {
    return ImmutableList.copyOf(parents);
  }
}
