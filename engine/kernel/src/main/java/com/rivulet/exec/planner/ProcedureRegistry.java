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
package com.rivulet.exec.planner;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.rivulet.common.exceptions.UserException;
import com.rivulet.common.logical.OperationSpec;
import java.util.HashMap;
import java.util.Map;

/**
 * Procedure creators keyed by kind, each bound to the operation spec class it accepts.
 */
public final class ProcedureRegistry {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(ProcedureRegistry.class);

  private final ImmutableMap<String, Registration<?>> registrations;

  private ProcedureRegistry(Map<String, Registration<?>> registrations) {
    this.registrations = ImmutableMap.copyOf(registrations);
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableSet<String> getKinds() {
    return registrations.keySet();
  }

  /**
   * Derives the procedure spec of an operation spec, dispatching on the spec's kind.
   *
   * @throws UserException of type PLAN if the kind is unknown or the spec is not of the type
   *     registered for it
   */
  public ProcedureSpec createProcedureSpec(OperationSpec spec, PlanAdministration administration) {
    return createProcedureSpec(spec.getKind(), spec, administration);
  }

  public ProcedureSpec createProcedureSpec(String kind, OperationSpec spec, PlanAdministration administration) {
    final Registration<?> registration = registrations.get(kind);
    if (registration == null) {
      throw UserException.planError()
          .message("no procedure registered for kind %s", kind)
          .build(logger);
    }
    if (!registration.specType.isInstance(spec)) {
      throw UserException.planError()
          .message("invalid spec type %s", spec == null ? "null" : spec.getClass().getName())
          .addContext("kind", kind)
          .build(logger);
    }
    return registration.create(spec, administration);
  }

  private static final class Registration<T extends OperationSpec> {
    private final Class<T> specType;
    private final ProcedureCreator<T> creator;

    private Registration(Class<T> specType, ProcedureCreator<T> creator) {
      this.specType = specType;
      this.creator = creator;
    }

    private ProcedureSpec create(OperationSpec spec, PlanAdministration administration) {
      return creator.create(specType.cast(spec), administration);
    }
  }

  /**
   * Collects registrations. A later registration for a kind replaces the earlier one.
   */
  public static final class Builder {
    private final Map<String, Registration<?>> registrations = new HashMap<>();

    private Builder() {
    }

    public <T extends OperationSpec> Builder register(String kind, Class<T> specType, ProcedureCreator<T> creator) {
      Preconditions.checkNotNull(kind);
      Preconditions.checkNotNull(specType, "no operation spec type for %s", kind);
      Preconditions.checkNotNull(creator, "no procedure creator for %s", kind);
      if (registrations.put(kind, new Registration<>(specType, creator)) != null) {
        logger.warn("Procedure {} registered more than once, keeping the last registration", kind);
      }
      return this;
    }

    public ProcedureRegistry build() {
      return new ProcedureRegistry(registrations);
    }
  }
}
