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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.rivulet.common.exceptions.UserException;
import com.rivulet.common.logical.args.Arguments;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Functions callable from a query and the operation-spec types they produce, keyed by kind.
 *
 * <p>Built once at startup through a {@link Builder} and immutable afterwards.
 */
public final class FunctionRegistry {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(FunctionRegistry.class);

  private final ImmutableMap<String, FunctionDefinition> functions;
  private final ImmutableMap<String, Class<? extends OperationSpec>> specTypes;

  private FunctionRegistry(Map<String, FunctionDefinition> functions,
                           Map<String, Class<? extends OperationSpec>> specTypes) {
    this.functions = ImmutableMap.copyOf(functions);
    this.specTypes = ImmutableMap.copyOf(specTypes);
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableSet<String> getFunctionKinds() {
    return functions.keySet();
  }

  public FunctionSignature getSignature(String kind) {
    return lookup(kind).signature;
  }

  public Class<? extends OperationSpec> getOperationSpecType(String kind) {
    Class<? extends OperationSpec> type = specTypes.get(kind);
    if (type == null) {
      throw UserException.planError()
          .message("no operation spec registered for kind %s", kind)
          .build(logger);
    }
    return type;
  }

  /**
   * Evaluates one function call.
   *
   * @param id id of the resulting operation
   * @param kind function to call
   * @param args keyword arguments; every argument must be consumed by the function
   * @return the table object describing the new operation
   * @throws UserException of type FUNCTION for argument errors
   */
  public TableObject call(OperationId id, String kind, Arguments args) {
    final FunctionDefinition function = lookup(kind);
    function.signature.check(kind, args);

    final Administration administration = new Administration(id);
    final OperationSpec spec;
    try {
      spec = function.parser.create(args, administration);
    } catch (UserException e) {
      throw UserException.functionError(e)
          .addContext("function", kind)
          .build(logger);
    }

    List<String> unused = args.listUnused();
    if (!unused.isEmpty()) {
      throw UserException.functionError()
          .message("unused arguments %s", unused)
          .addContext("function", kind)
          .build(logger);
    }
    Preconditions.checkState(kind.equals(spec.getKind()),
        "function %s produced an operation of kind %s", kind, spec.getKind());
    return new TableObject(id, spec, administration.getParents());
  }

  /**
   * Creates an object mapper that reads and writes every registered operation-spec type.
   */
  public ObjectMapper newObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    for (Map.Entry<String, Class<? extends OperationSpec>> entry : specTypes.entrySet()) {
      mapper.registerSubtypes(new NamedType(entry.getValue(), entry.getKey()));
    }
    return mapper;
  }

  private FunctionDefinition lookup(String kind) {
    FunctionDefinition function = functions.get(kind);
    if (function == null) {
      throw UserException.functionError()
          .message("unknown function %s", kind)
          .build(logger);
    }
    return function;
  }

  private static final class FunctionDefinition {
    private final ArgumentParser parser;
    private final FunctionSignature signature;

    private FunctionDefinition(ArgumentParser parser, FunctionSignature signature) {
      this.parser = parser;
      this.signature = signature;
    }
  }

  /**
   * Collects registrations. A later registration for a kind replaces the earlier one.
   */
  public static final class Builder {
    private final Map<String, FunctionDefinition> functions = new HashMap<>();
    private final Map<String, Class<? extends OperationSpec>> specTypes = new HashMap<>();

    private Builder() {
    }

    public Builder registerFunction(String kind, ArgumentParser parser, FunctionSignature signature) {
      Preconditions.checkNotNull(kind);
      Preconditions.checkNotNull(parser, "no argument parser for %s", kind);
      Preconditions.checkNotNull(signature, "no signature for %s", kind);
      if (functions.put(kind, new FunctionDefinition(parser, signature)) != null) {
        logger.warn("Function {} registered more than once, keeping the last registration", kind);
      }
      return this;
    }

    public Builder registerOperationSpec(String kind, Class<? extends OperationSpec> type) {
      Preconditions.checkNotNull(kind);
      Preconditions.checkNotNull(type, "no operation spec type for %s", kind);
      Class<? extends OperationSpec> old = specTypes.put(kind, type);
      if (old != null && !old.equals(type)) {
        logger.warn("Operation spec {} registered more than once, replacing {} with {}",
            kind, old.getName(), type.getName());
      }
      return this;
    }

    public FunctionRegistry build() {
      return new FunctionRegistry(functions, specTypes);
    }
  }
}
