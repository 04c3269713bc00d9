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
package com.rivulet.common.logical;

/**
 * Column labels with a meaning shared by every operator.
 */
public final class ColumnLabels {

  /** Column holding the value of unkeyed scalar results. */
  public static final String DEFAULT_VALUE = "_value";
  public static final String DEFAULT_TIME = "_time";
  public static final String DEFAULT_START = "_start";
  public static final String DEFAULT_STOP = "_stop";

  private ColumnLabels() {
  }
}
