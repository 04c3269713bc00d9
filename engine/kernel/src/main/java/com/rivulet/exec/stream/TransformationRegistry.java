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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.rivulet.common.exceptions.ExecutionSetupException;
import com.rivulet.common.exceptions.UserException;
import com.rivulet.exec.context.ExecutionAdministration;
import com.rivulet.exec.planner.ProcedureSpec;
import java.util.HashMap;
import java.util.Map;

/**
 * Transformation creators keyed by kind, each bound to the procedure spec class it accepts.
 */
public final class TransformationRegistry {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(TransformationRegistry.class);

  private final ImmutableMap<String, Registration<?>> registrations;

  private TransformationRegistry(Map<String, Registration<?>> registrations) {
    this.registrations = ImmutableMap.copyOf(registrations);
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableSet<String> getKinds() {
    return registrations.keySet();
  }

  /**
   * Creates the transformation for a procedure spec.
   *
   * @throws UserException of type PLAN if no creator is registered for the spec's kind
   * @throws ExecutionSetupException if the spec is not of the type the creator accepts, or the
   *     creator fails
   */
  public CreatedTransformation createTransformation(DatasetId id, AccumulationMode mode, ProcedureSpec spec,
                                                    ExecutionAdministration administration)
      throws ExecutionSetupException {
    final Registration<?> registration = registrations.get(spec.getKind());
    if (registration == null) {
      throw UserException.planError()
          .message("no transformation registered for kind %s", spec.getKind())
          .build(logger);
    }
    if (!registration.specType.isInstance(spec)) {
      throw new ExecutionSetupException(String.format("invalid spec type %s for transformation %s",
          spec.getClass().getName(), spec.getKind()));
    }
    return registration.create(id, mode, spec, administration);
  }

  private static final class Registration<T extends ProcedureSpec> {
    private final Class<T> specType;
    private final TransformationCreator<T> creator;

    private Registration(Class<T> specType, TransformationCreator<T> creator) {
      this.specType = specType;
      this.creator = creator;
    }

    private CreatedTransformation create(DatasetId id, AccumulationMode mode, ProcedureSpec spec,
        ExecutionAdministration administration) throws ExecutionSetupException {
      return creator.create(id, mode, specType.cast(spec), administration);
    }
  }

  /**
   * Collects registrations. A later registration for a kind replaces the earlier one.
   */
  public static final class Builder {
    private final Map<String, Registration<?>> registrations = new HashMap<>();

    private Builder() {
    }

    public <T extends ProcedureSpec> Builder register(String kind, Class<T> specType, TransformationCreator<T> creator) {
      Preconditions.checkNotNull(kind);
      Preconditions.checkNotNull(specType, "no procedure spec type for %s", kind);
      Preconditions.checkNotNull(creator, "no transformation creator for %s", kind);
      if (registrations.put(kind, new Registration<>(specType, creator)) != null) {
        logger.warn("Transformation {} registered more than once, keeping the last registration", kind);
      }
      return this;
    }

    public TransformationRegistry build() {
      return new TransformationRegistry(registrations);
    }
  }
}
