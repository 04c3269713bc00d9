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

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Holds context information about a {@link UserException}. Context lines are collected while
 * the exception travels up through the engine.
 */
class UserExceptionContext {

  private final String errorId;
  private final List<String> contextList;

  UserExceptionContext() {
    errorId = UUID.randomUUID().toString();
    contextList = new ArrayList<>();
  }

  /**
   * adds a context line to the bottom of the context list
   * @param context context line
   */
  void add(String context) {
    contextList.add(context);
  }

  void add(String name, String value) {
    add(String.format("%s %s", name, value));
  }

  void add(String name, long value) {
    add(String.format("%s %d", name, value));
  }

  String getErrorId() {
    return errorId;
  }

  List<String> getContextAsStrings() {
    return contextList;
  }

  /**
   * generate a context message
   * @return string containing all context information concatenated
   */
  String generateContextMessage(boolean includeErrorId) {
    StringBuilder sb = new StringBuilder();
    for (String context : contextList) {
      sb.append(context).append('\n');
    }
    if (includeErrorId) {
      sb.append("[ErrorId: ").append(errorId).append(']');
    }
    return sb.toString();
  }
}
