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
package com.rivulet.common.logical.args;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.rivulet.common.exceptions.UserException;
import com.rivulet.common.logical.Administration;
import com.rivulet.common.logical.TableObject;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword arguments of a function call.
 *
 * <p>Every read marks the argument as used so that the caller can reject arguments nobody
 * consumed. Not thread safe: one instance belongs to one call.
 */
public final class Arguments {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Arguments.class);

  private final ImmutableMap<String, Object> values;
  private final Set<String> used = new HashSet<>();

  private Arguments(Map<String, Object> values) {
    this.values = ImmutableMap.copyOf(values);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static Arguments empty() {
    return new Arguments(ImmutableMap.of());
  }

  public Set<String> keys() {
    return values.keySet();
  }

  /**
   * Looks up an argument without checking its type.
   */
  public Optional<Object> get(String name) {
    used.add(name);
    return Optional.ofNullable(values.get(name));
  }

  /**
   * Looks up an argument without marking it as used.
   */
  public Object peek(String name) {
    return values.get(name);
  }

  public Object getRequired(String name) {
    return get(name).orElseThrow(() -> UserException.functionError()
        .message("missing required keyword argument \"%s\"", name)
        .build(logger));
  }

  public Optional<String> getString(String name) {
    return get(name, SemanticType.STRING).map(String.class::cast);
  }

  public Optional<Boolean> getBoolean(String name) {
    return get(name, SemanticType.BOOL).map(Boolean.class::cast);
  }

  public Optional<Long> getInt(String name) {
    return get(name, SemanticType.INT).map(v -> ((Number) v).longValue());
  }

  public Optional<Double> getFloat(String name) {
    return get(name, SemanticType.FLOAT).map(Double.class::cast);
  }

  public Optional<ArrayValue> getArray(String name, SemanticType elementType) {
    return get(name, SemanticType.arrayOf(elementType)).map(ArrayValue.class::cast);
  }

  private Optional<Object> get(String name, SemanticType expected) {
    Optional<Object> value = get(name);
    if (value.isPresent()) {
      SemanticType actual = SemanticType.of(value.get());
      if (!expected.equals(actual)) {
        throw UserException.functionError()
            .message("keyword argument \"%s\" has wrong type: expected %s, got %s", name, expected, actual)
            .build(logger);
      }
    }
    return value;
  }

  /**
   * @return the names of the arguments that were never read, in declaration order
   */
  public ImmutableList<String> listUnused() {
    ImmutableList.Builder<String> unused = ImmutableList.builder();
    for (String key : values.keySet()) {
      if (!used.contains(key)) {
        unused.add(key);
      }
    }
    return unused.build();
  }

  @Override
  public String toString() {
    return values.toString();
  }

  /**
   * Builder for {@link Arguments}.
   */
  public static final class Builder {
    private static final Set<Class<?>> SUPPORTED = ImmutableSet.of(
        Boolean.class, Long.class, Double.class, String.class, ArrayValue.class, TableObject.class);

    private final Map<String, Object> values = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder put(String name, Object value) {
      Preconditions.checkNotNull(name);
      Preconditions.checkNotNull(value, "argument %s has no value", name);
      Object normalized = value instanceof Integer ? Long.valueOf((Integer) value) : value;
      Preconditions.checkArgument(SUPPORTED.contains(normalized.getClass()),
          "unsupported value type %s for argument %s", normalized.getClass().getName(), name);
      Preconditions.checkArgument(values.put(name, normalized) == null, "duplicate argument %s", name);
      return this;
    }

    /**
     * Sets the pipe argument, the table the call consumes.
     */
    public Builder table(TableObject parent) {
      return put(Administration.TABLE_PARAM, parent);
    }

    public Arguments build() {
      return new Arguments(values);
    }
  }
}
