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
package com.rivulet.exec.stream;

/**
 * What a dataset does with cached rows after emitting them.
 */
public enum AccumulationMode {
  /** Drop emitted rows. */
  DISCARDING,
  /** Keep emitted rows; later emissions include them again. */
  ACCUMULATING,
  /** Keep emitted rows and retract the previous emission before emitting again. */
  ACCUMULATING_RETRACTING
}
