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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.rivulet.common.exceptions.UserException;
import com.rivulet.common.logical.args.Arguments;
import com.rivulet.common.logical.args.SemanticType;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declared parameters of a function: their names and types, and which parameter receives the
 * piped table.
 */
public final class FunctionSignature {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(FunctionSignature.class);

  private final ImmutableMap<String, SemanticType> params;
  private final String pipeArgument;

  private FunctionSignature(Map<String, SemanticType> params, String pipeArgument) {
    this.params = ImmutableMap.copyOf(params);
    this.pipeArgument = pipeArgument;
  }

  /**
   * Starts a signature for a function that consumes a table through the {@code table} pipe
   * argument.
   */
  public static Builder defaultSignature() {
    return new Builder().param(Administration.TABLE_PARAM, SemanticType.TABLE).pipe(Administration.TABLE_PARAM);
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableMap<String, SemanticType> getParams() {
    return params;
  }

  public String getPipeArgument() {
    return pipeArgument;
  }

  /**
   * Checks that every argument of a call is declared with a matching type.
   *
   * @throws UserException of type FUNCTION on the first offending argument
   */
  public void check(String kind, Arguments args) {
    for (String name : args.keys()) {
      SemanticType declared = params.get(name);
      if (declared == null) {
        throw UserException.functionError()
            .message("function %s has no parameter \"%s\"", kind, name)
            .build(logger);
      }
      // peek without marking the argument as used
      SemanticType actual = SemanticType.of(args.peek(name));
      if (!declared.equals(actual)) {
        throw UserException.functionError()
            .message("keyword argument \"%s\" has wrong type: expected %s, got %s", name, declared, actual)
            .addContext("function", kind)
            .build(logger);
      }
    }
  }

  @Override
  public String toString() {
    return params.toString();
  }

  /**
   * Builder for {@link FunctionSignature}.
   */
  public static final class Builder {
    private final Map<String, SemanticType> params = new LinkedHashMap<>();
    private String pipeArgument;

    private Builder() {
    }

    public Builder param(String name, SemanticType type) {
      Preconditions.checkArgument(params.put(name, type) == null, "parameter %s declared twice", name);
      return this;
    }

    public Builder pipe(String name) {
      Preconditions.checkArgument(params.containsKey(name), "pipe argument %s is not a parameter", name);
      this.pipeArgument = name;
      return this;
    }

    public FunctionSignature build() {
      return new FunctionSignature(params, pipeArgument);
    }
  }
}
