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

import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;
import com.rivulet.exec.stream.trigger.TriggerSpec;

/**
 * Output endpoint of a transformation. Emits the blocks of its cache to the downstream
 * transformations and forwards lifecycle signals to them.
 */
public interface Dataset {

  DatasetId getId();

  void addTransformation(Transformation transformation);

  void setTriggerSpec(TriggerSpec spec);

  void retractBlock(PartitionKey key);

  void updateWatermark(Time watermark);

  void updateProcessingTime(Time time);

  /**
   * @param error the failure to propagate, or null on success
   */
  void finish(Throwable error);
}
