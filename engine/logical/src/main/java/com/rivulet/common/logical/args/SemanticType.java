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
import com.rivulet.common.logical.TableObject;
import java.util.Locale;
import java.util.Objects;

/**
 * Type of a function argument as declared by a {@link com.rivulet.common.logical.FunctionSignature}.
 */
public final class SemanticType {

  /**
   * The kind of value described by a type.
   */
  public enum Nature {
    BOOL, INT, FLOAT, STRING, TABLE, ARRAY
  }

  public static final SemanticType BOOL = new SemanticType(Nature.BOOL, null);
  public static final SemanticType INT = new SemanticType(Nature.INT, null);
  public static final SemanticType FLOAT = new SemanticType(Nature.FLOAT, null);
  public static final SemanticType STRING = new SemanticType(Nature.STRING, null);
  public static final SemanticType TABLE = new SemanticType(Nature.TABLE, null);

  private final Nature nature;
  private final SemanticType elementType;

  private SemanticType(Nature nature, SemanticType elementType) {
    this.nature = nature;
    this.elementType = elementType;
  }

  public static SemanticType arrayOf(SemanticType elementType) {
    Preconditions.checkNotNull(elementType, "array element type is required");
    return new SemanticType(Nature.ARRAY, elementType);
  }

  /**
   * Infers the type of an argument value.
   *
   * @throws IllegalArgumentException if the value is not a supported argument value
   */
  public static SemanticType of(Object value) {
    if (value instanceof Boolean) {
      return BOOL;
    } else if (value instanceof Long || value instanceof Integer) {
      return INT;
    } else if (value instanceof Double) {
      return FLOAT;
    } else if (value instanceof String) {
      return STRING;
    } else if (value instanceof TableObject) {
      return TABLE;
    } else if (value instanceof ArrayValue) {
      return arrayOf(((ArrayValue) value).getElementType());
    }
    throw new IllegalArgumentException(String.format("unsupported argument value %s of type %s",
        value, value == null ? "null" : value.getClass().getName()));
  }

  /**
   * @return the element type of an array type, null for any other type
   */
  public SemanticType getElementType() {
    return elementType;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SemanticType)) {
      return false;
    }
    SemanticType that = (SemanticType) o;
    return nature == that.nature && Objects.equals(elementType, that.elementType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(nature, elementType);
  }

  @Override
  public String toString() {
    if (nature == Nature.ARRAY) {
      return "array<" + elementType + ">";
    }
    return nature.name().toLowerCase(Locale.ROOT);
  }
}
