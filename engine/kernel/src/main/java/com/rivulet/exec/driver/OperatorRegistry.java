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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.rivulet.common.logical.ArgumentParser;
import com.rivulet.common.logical.FunctionRegistry;
import com.rivulet.common.logical.FunctionSignature;
import com.rivulet.common.logical.OperationSpec;
import com.rivulet.exec.planner.ProcedureCreator;
import com.rivulet.exec.planner.ProcedurePlanner;
import com.rivulet.exec.planner.ProcedureRegistry;
import com.rivulet.exec.planner.ProcedureSpec;
import com.rivulet.exec.stream.TransformationCreator;
import com.rivulet.exec.stream.TransformationRegistry;
import java.util.ServiceLoader;

/**
 * Everything known about the available operators: functions, operation spec types, procedure
 * creators and transformation creators, all keyed by kind.
 *
 * <p>Built once at startup and immutable afterwards. A later registration for a kind replaces
 * the earlier one.
 */
public final class OperatorRegistry {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(OperatorRegistry.class);

  private final FunctionRegistry functions;
  private final ProcedureRegistry procedures;
  private final TransformationRegistry transformations;

  private OperatorRegistry(Builder builder) {
    this.functions = builder.functions.build();
    this.procedures = builder.procedures.build();
    this.transformations = builder.transformations.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a registry from the given modules, in order.
   */
  public static OperatorRegistry fromModules(Iterable<? extends OperatorModule> modules) {
    final Builder builder = builder();
    for (OperatorModule module : modules) {
      builder.install(module);
    }
    return builder.build();
  }

  /**
   * Builds a registry from the modules listed in
   * {@code META-INF/services/com.rivulet.exec.driver.OperatorModule} on the classpath.
   */
  public static OperatorRegistry fromClasspath() {
    return fromModules(ServiceLoader.load(OperatorModule.class));
  }

  public FunctionRegistry getFunctions() {
    return functions;
  }

  public ProcedureRegistry getProcedures() {
    return procedures;
  }

  public TransformationRegistry getTransformations() {
    return transformations;
  }

  public ProcedurePlanner newPlanner() {
    return new ProcedurePlanner(procedures);
  }

  /**
   * @return a mapper that reads and writes query specs made of the registered operations
   */
  public ObjectMapper newObjectMapper() {
    return functions.newObjectMapper();
  }

  /**
   * Collects the registrations of every operator.
   */
  public static final class Builder {
    private final FunctionRegistry.Builder functions = FunctionRegistry.builder();
    private final ProcedureRegistry.Builder procedures = ProcedureRegistry.builder();
    private final TransformationRegistry.Builder transformations = TransformationRegistry.builder();

    private Builder() {
    }

    public Builder install(OperatorModule module) {
      Preconditions.checkNotNull(module);
      logger.debug("Installing operator module {}", module.getClass().getName());
      module.register(this);
      return this;
    }

    public Builder registerFunction(String kind, ArgumentParser parser, FunctionSignature signature) {
      functions.registerFunction(kind, parser, signature);
      return this;
    }

    public Builder registerOperationSpec(String kind, Class<? extends OperationSpec> type) {
      functions.registerOperationSpec(kind, type);
      return this;
    }

    public <T extends OperationSpec> Builder registerProcedure(String kind, Class<T> operationSpecType,
                                                             ProcedureCreator<T> creator) {
      procedures.register(kind, operationSpecType, creator);
      return this;
    }

    public <T extends ProcedureSpec> Builder registerTransformation(String kind, Class<T> procedureSpecType,
                                                                  TransformationCreator<T> creator) {
      transformations.register(kind, procedureSpecType, creator);
      return this;
    }

    public OperatorRegistry build() {
      return new OperatorRegistry(this);
    }
  }
}
