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

import com.rivulet.exec.record.Block;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;

/**
 * A push based stream processor. The caller delivers one call at a time; each call completes
 * before the next one starts. Errors are thrown to the caller.
 */
public interface Transformation {

  /**
   * Processes one block. The block is only valid for the duration of the call.
   */
  void process(DatasetId id, Block block);

  void retractBlock(DatasetId id, PartitionKey key);

  void updateWatermark(DatasetId id, Time watermark);

  void updateProcessingTime(DatasetId id, Time time);

  /**
   * Signals that the parent will send nothing else.
   *
   * @param error the reason the parent failed, or null on success
   */
  void finish(DatasetId id, Throwable error);
}
