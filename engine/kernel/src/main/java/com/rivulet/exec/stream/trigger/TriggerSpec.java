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
 * Immutable description of a trigger. Creates a fresh {@link Trigger} for every cached key.
 */
public interface TriggerSpec {

  /** Fires once the watermark passes the end of the key's window. */
  TriggerSpec DEFAULT = new AfterWatermarkTriggerSpec(0);

  Trigger newTrigger();
}
