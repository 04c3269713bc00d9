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
package com.rivulet.exec.stream.trigger;

/**
 * Decides when the data cached for one partition key is emitted. One instance per key; stateful.
 */
public interface Trigger {

  /**
   * @return true if the cached data should be emitted now
   */
  boolean triggers(TriggerContext context);

  /**
   * @return true once the key will never be emitted again and its data can be dropped
   */
  boolean finished();

  void reset();
}
