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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rivulet.common.exceptions.ErrorType;
import com.rivulet.test.UserExceptionAssert;
import org.junit.Test;

public class TestArguments {

  @Test
  public void typedGetters() {
    Arguments args = Arguments.builder()
        .put("s", "text")
        .put("b", true)
        .put("i", 3)
        .put("f", 1.5d)
        .put("a", ArrayValue.ofStrings("x", "y"))
        .build();

    assertThat(args.getString("s")).contains("text");
    assertThat(args.getBoolean("b")).contains(true);
    assertThat(args.getInt("i")).contains(3L);
    assertThat(args.getFloat("f")).contains(1.5d);
    assertThat(args.getArray("a", SemanticType.STRING).get().toStringList()).containsExactly("x", "y");
    assertThat(args.listUnused()).isEmpty();
  }

  @Test
  public void missingOptionalIsEmpty() {
    Arguments args = Arguments.empty();
    assertThat(args.getString("missing")).isEmpty();
    assertThat(args.getArray("missing", SemanticType.INT)).isEmpty();
  }

  @Test
  public void missingRequired() {
    UserExceptionAssert.assertThatThrownBy(() -> Arguments.empty().getRequired("table"))
        .hasErrorType(ErrorType.FUNCTION)
        .hasMessageContaining("missing required keyword argument \"table\"");
  }

  @Test
  public void wrongType() {
    Arguments args = Arguments.builder().put("desc", "yes").build();
    UserExceptionAssert.assertThatThrownBy(() -> args.getBoolean("desc"))
        .hasErrorType(ErrorType.FUNCTION)
        .hasMessageContaining("expected bool, got string");
  }

  @Test
  public void wrongArrayElementType() {
    Arguments args = Arguments.builder().put("cols", ArrayValue.of(SemanticType.INT, 1L, 2L)).build();
    UserExceptionAssert.assertThatThrownBy(() -> args.getArray("cols", SemanticType.STRING))
        .hasErrorType(ErrorType.FUNCTION)
        .hasMessageContaining("expected array<string>, got array<int>");
  }

  @Test
  public void unusedInDeclarationOrder() {
    Arguments args = Arguments.builder().put("b", 1).put("a", 2).put("c", 3).build();
    args.getInt("a");
    // peek does not count as a use
    args.peek("c");
    assertThat(args.listUnused()).containsExactly("b", "c");
  }

  @Test
  public void rejectsDuplicateAndUnsupported() {
    assertThatThrownBy(() -> Arguments.builder().put("a", 1).put("a", 2))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Arguments.builder().put("a", new Object()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
