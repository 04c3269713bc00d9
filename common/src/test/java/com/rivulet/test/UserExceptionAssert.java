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
package com.rivulet.test;

import com.google.common.base.Objects;
import com.rivulet.common.exceptions.ErrorType;
import com.rivulet.common.exceptions.UserException;
import java.util.stream.Stream;
import org.assertj.core.api.AbstractThrowableAssert;
import org.assertj.core.api.Assertions;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;

/**
 * A custom AssertJ assertion class for matching the error type / error message / context of a
 * {@link UserException}
 */
public class UserExceptionAssert extends AbstractThrowableAssert<UserExceptionAssert, UserException> {

  public UserExceptionAssert(UserException e) {
    super(e, UserExceptionAssert.class);
  }

  public static UserExceptionAssert assertThat(UserException actual) {
    return new UserExceptionAssert(actual);
  }

  public static UserExceptionAssert assertThatThrownBy(ThrowingCallable shouldRaiseUserException) {
    UserException e = Assertions.catchThrowableOfType(shouldRaiseUserException, UserException.class);
    if (e == null) {
      Assertions.fail("Expecting code to raise a UserException.");
    }
    return new UserExceptionAssert(e);
  }

  public UserExceptionAssert hasContext(String expectedContext) {
    isNotNull();
    if (actual.getContextStrings().stream().noneMatch(c -> c.contains(expectedContext))) {
      failWithMessage("Expected context '%s' to be contained in '%s'", expectedContext,
          actual.getContextStrings());
    }
    return this;
  }

  public UserExceptionAssert hasContexts(String... expectedContexts) {
    isNotNull();
    Stream.of(expectedContexts).forEach(this::hasContext);
    return this;
  }

  public UserExceptionAssert hasErrorType(ErrorType expectedType) {
    isNotNull();
    if (!Objects.equal(actual.getErrorType(), expectedType)) {
      failWithMessage("Expected error type to be '%s' but was '%s'", expectedType,
          actual.getErrorType());
    }
    return this;
  }
}
