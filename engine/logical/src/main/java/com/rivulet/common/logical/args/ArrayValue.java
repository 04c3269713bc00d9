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
import com.rivulet.common.exceptions.UserException;
import java.util.Arrays;
import java.util.List;

/**
 * An array argument. All elements share one element type.
 */
public final class ArrayValue {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(ArrayValue.class);

  private final SemanticType elementType;
  private final ImmutableList<Object> elements;

  private ArrayValue(SemanticType elementType, List<?> elements) {
    this.elementType = Preconditions.checkNotNull(elementType);
    for (Object element : elements) {
      Preconditions.checkArgument(elementType.equals(SemanticType.of(element)),
          "array element %s is not of type %s", element, elementType);
    }
    this.elements = ImmutableList.copyOf(elements);
  }

  public static ArrayValue of(SemanticType elementType, Object... elements) {
    return new ArrayValue(elementType, Arrays.asList(elements));
  }

  public static ArrayValue of(SemanticType elementType, List<?> elements) {
    return new ArrayValue(elementType, elements);
  }

  public static ArrayValue ofStrings(String... elements) {
    return of(SemanticType.STRING, (Object[]) elements);
  }

  public SemanticType getElementType() {
    return elementType;
  }

  public int size() {
    return elements.size();
  }

  public Object get(int i) {
    return elements.get(i);
  }

  /**
   * Converts an array of strings to a list.
   *
   * @throws UserException if the elements are not strings
   */
  public List<String> toStringList() {
    if (!SemanticType.STRING.equals(elementType)) {
      throw UserException.functionError()
          .message("cannot convert array of %s to an array of string", elementType)
          .build(logger);
    }
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (Object element : elements) {
      builder.add((String) element);
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ArrayValue)) {
      return false;
    }
    ArrayValue that = (ArrayValue) o;
    return elementType.equals(that.elementType) && elements.equals(that.elements);
  }

  @Override
  public int hashCode() {
    return 31 * elementType.hashCode() + elements.hashCode();
  }

  @Override
  public String toString() {
    return elements.toString();
  }
}
