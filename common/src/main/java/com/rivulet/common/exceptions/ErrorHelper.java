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

/**
 * Utility class that handles error message generation.
 */
public final class ErrorHelper {

  private ErrorHelper() {
  }

  /**
   * Constructs the root error message in the form [root exception class name]: [root exception message]
   *
   * @param cause exception we want the root message for
   * @return root error message or empty string if none found
   */
  static String getRootMessage(final Throwable cause) {
    String message = "";

    Throwable ex = cause;
    while (ex != null) {
      message = ex.getClass().getSimpleName();
      if (ex.getMessage() != null) {
        message += ": " + ex.getMessage();
      }

      if (ex.getCause() != null && ex.getCause() != ex) {
        ex = ex.getCause();
      } else {
        break;
      }
    }

    return message;
  }

  static String buildCausesMessage(final Throwable t) {
    StringBuilder sb = new StringBuilder();
    Throwable ex = t;
    boolean cause = false;
    while (ex != null) {
      sb.append("  ");
      if (cause) {
        sb.append("Caused By ");
      }
      sb.append('(').append(ex.getClass().getCanonicalName()).append(") ");
      sb.append(ex.getMessage()).append('\n');

      for (StackTraceElement st : ex.getStackTrace()) {
        sb.append("    ")
            .append(st.getClassName())
            .append('.')
            .append(st.getMethodName())
            .append("():")
            .append(st.getLineNumber())
            .append('\n');
      }
      cause = true;

      if (ex.getCause() != null && ex.getCause() != ex) {
        ex = ex.getCause();
      } else {
        ex = null;
      }
    }

    return sb.toString();
  }

  /**
   * searches for an exception of type T wrapped inside the exception
   * @param ex exception
   * @return null if exception is null or no exception of the requested type was found
   */
  @SuppressWarnings("unchecked")
  public static <T extends Throwable> T findWrappedCause(Throwable ex, Class<T> causeClass) {
    if (ex == null) {
      return null;
    }

    Throwable cause = ex;
    while (!causeClass.isInstance(cause)) {
      if (cause.getCause() != null && cause.getCause() != cause) {
        cause = cause.getCause();
      } else {
        return null;
      }
    }

    return (T) cause;
  }
}
