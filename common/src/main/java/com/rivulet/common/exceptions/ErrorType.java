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
 * Categories of {@link UserException}. The category decides how the error is logged and which
 * layer of the engine reported it.
 */
public enum ErrorType {
  /** Malformed, missing or mistyped arguments of a function call. */
  FUNCTION,
  /** An inconsistent plan, usually a registration mismatch inside the engine. */
  PLAN,
  /** A data or contract violation detected while a query executes. */
  EXECUTION,
  /** The query exceeded its memory limit. */
  OUT_OF_MEMORY,
  /** Anything else. Reported with the root cause message. */
  SYSTEM
}
