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
package com.rivulet.common.exceptions;

import java.util.List;
import org.apache.arrow.memory.OutOfMemoryException;
import org.slf4j.Logger;

/**
 * Base class for all user exceptions. The goal is to separate out common error conditions where
 * we can give users useful feedback.
 *
 * <p>Throwing a user exception guarantees its message reaches the user, along with any context
 * added to the exception at the various levels it travels through.
 *
 * <p>A specific class of user exceptions are system exceptions. They represent errors that do not
 * carry a user facing message apart from the root cause of the failure.
 *
 * @see ErrorType
 */
public class UserException extends RuntimeException {
  private static final long serialVersionUID = 8422817455379387512L;

  public static final String MEMORY_ERROR_MSG =
      "Query was cancelled because it exceeded the memory limits set by the administrator.";

  /**
   * Creates a new FUNCTION exception builder. Used for argument errors while an operation is
   * constructed from a function call.
   *
   * @return user exception builder
   */
  public static Builder functionError() {
    return functionError(null);
  }

  /**
   * Wraps the passed exception inside a function error.
   * <p>The cause message will be used unless {@link Builder#message(String, Object...)} is called.
   * <p>If the wrapped exception is, or wraps, a user exception it will be returned by
   * {@link Builder#build(Logger)} instead of creating a new exception.
   *
   * @param cause exception we want the user exception to wrap
   * @return user exception builder
   */
  public static Builder functionError(final Throwable cause) {
    return builder(ErrorType.FUNCTION, cause);
  }

  /**
   * Creates a new PLAN exception builder.
   *
   * @return user exception builder
   */
  public static Builder planError() {
    return planError(null);
  }

  public static Builder planError(final Throwable cause) {
    return builder(ErrorType.PLAN, cause);
  }

  /**
   * Creates a new EXECUTION exception builder. Used when a running operator detects that its
   * input breaks a contract it relies on.
   *
   * @return user exception builder
   */
  public static Builder executionError() {
    return executionError(null);
  }

  public static Builder executionError(final Throwable cause) {
    return builder(ErrorType.EXECUTION, cause);
  }

  /**
   * Creates an OUT_OF_MEMORY error with a prebuilt message
   *
   * @param cause exception that will be wrapped inside a memory error
   * @return user exception builder
   */
  public static Builder memoryError(final Throwable cause) {
    final Builder b = builder(ErrorType.OUT_OF_MEMORY, cause).message(MEMORY_ERROR_MSG);
    if (cause != null) {
      b.addContext(cause.getMessage());
    }
    return b;
  }

  public static Builder memoryError() {
    return memoryError(null);
  }

  /**
   * Wraps the passed exception inside a system error.
   *
   * @param cause exception we want the user exception to wrap
   * @return user exception builder
   */
  public static Builder systemError(final Throwable cause) {
    return builder(ErrorType.SYSTEM, cause);
  }

  private static Builder builder(final ErrorType type, final Throwable cause) {
    return new Builder(type, cause);
  }

  /**
   * Builder class for UserException. You can wrap an existing exception, in this case it will
   * first check if this exception is, or wraps, a UserException. If it does then the builder will
   * use the user exception as it is (it will ignore the message passed to the constructor) and will
   * add any additional context information to the exception's context
   */
  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final UserExceptionContext context;

    private String message;

    private boolean fixedMessage; // if true, calls to message() are a no op

    private Builder(final ErrorType errorType, final Throwable cause) {
      uex = ErrorHelper.findWrappedCause(cause, UserException.class);
      if (uex != null) {
        this.errorType = null;
        this.context = uex.context;
        this.cause = cause;
      } else {
        OutOfMemoryException oom = ErrorHelper.findWrappedCause(cause, OutOfMemoryException.class);
        if (oom != null) {
          this.errorType = ErrorType.OUT_OF_MEMORY;
          this.message = MEMORY_ERROR_MSG;
          this.cause = oom;
          fixedMessage = true;
        } else {
          this.cause = cause;
          this.errorType = errorType;
          this.message = cause != null ? cause.getMessage() : null;
        }
        this.context = new UserExceptionContext();
      }
    }

    /**
     * sets or replaces the error message.
     * <p>This will be ignored if this builder is wrapping a user exception
     *
     * @see String#format(String, Object...)
     *
     * @param format format string
     * @param args Arguments referenced by the format specifiers in the format string
     * @return this builder
     */
    public Builder message(final String format, final Object... args) {
      // we can't replace the message of a user exception
      if (uex == null && !fixedMessage && format != null) {
        this.message = (args == null || args.length == 0) ? format : String.format(format, args);
      }
      return this;
    }

    /**
     * add a string line to the bottom of the context
     * @param value string line
     * @return this builder
     */
    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(final String name, final String value) {
      context.add(name, value);
      return this;
    }

    public Builder addContext(final String name, final long value) {
      context.add(name, value);
      return this;
    }

    /**
     * builds a user exception or returns the wrapped one. If the error is a system error, the
     * error message is logged to the given {@link Logger}.
     *
     * @param logger the logger to write to
     * @return user exception
     */
    public UserException build(final Logger logger) {
      if (uex != null) {
        return uex;
      }

      boolean isSystemError = errorType == ErrorType.SYSTEM;

      // make sure system errors use the root error message and display the root cause class name
      if (isSystemError) {
        message = ErrorHelper.getRootMessage(cause);
      } else if (message == null || message.length() == 0) {
        if (cause != null) {
          // a cause with a null message (NPE ?) and no custom message
          message = cause.getClass().getSimpleName();
        } else {
          message = "";
        }
      }

      final UserException newException = new UserException(this);

      switch (errorType) {
        case SYSTEM:
        case OUT_OF_MEMORY:
          logger.error(newException.getMessage(), newException);
          break;
        default:
          logger.info("User Error Occurred [" + newException.getErrorId() + "]", newException);
      }

      return newException;
    }
  }

  private final ErrorType errorType;

  private final UserExceptionContext context;

  private UserException(final Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  /**
   *
   * @return the error message that was passed to the builder
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  /**
   * generates the message that will be displayed to the client. The message also contains the
   * stack trace.
   *
   * @return verbose error message
   */
  public String getVerboseMessage() {
    return getVerboseMessage(true);
  }

  public String getVerboseMessage(boolean includeErrorId) {
    return generateMessage(includeErrorId) + "\n\n" + ErrorHelper.buildCausesMessage(getCause());
  }

  public List<String> getContextStrings() {
    return context.getContextAsStrings();
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  /**
   * Generates a user error message that has the following structure:
   * ERROR TYPE: ERROR_MESSAGE
   * CONTEXT
   * [ERROR_ID]
   *
   * @return generated user error message
   */
  private String generateMessage(boolean includeErrorId) {
    return errorType + " ERROR: " + super.getMessage() + "\n\n"
        + context.generateContextMessage(includeErrorId);
  }
}
