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

import com.google.common.base.MoreObjects;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;

/**
 * What a trigger sees when it is evaluated for one cached key.
 */
public final class TriggerContext {
  private final PartitionKey key;
  private final int rowCount;
  private final Time watermark;
  private final Time processingTime;

  public TriggerContext(PartitionKey key, int rowCount, Time watermark, Time processingTime) {
    this.key = key;
    this.rowCount = rowCount;
    this.watermark = watermark;
    this.processingTime = processingTime;
  }

  public PartitionKey getKey() {
    return key;
  }

  public int getRowCount() {
    return rowCount;
  }

  public Time getWatermark() {
    return watermark;
  }

  public Time getProcessingTime() {
    return processingTime;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("rows", rowCount)
        .add("watermark", watermark)
        .add("processingTime", processingTime)
        .toString();
  }
}
