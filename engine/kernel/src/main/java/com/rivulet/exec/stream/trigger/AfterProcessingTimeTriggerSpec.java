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

import com.google.common.base.Preconditions;
import com.rivulet.exec.record.Time;

/**
 * Fires once processing time has advanced by the given duration since the trigger was first
 * evaluated.
 */
public final class AfterProcessingTimeTriggerSpec implements TriggerSpec {
  private final long durationNanos;

  public AfterProcessingTimeTriggerSpec(long durationNanos) {
    Preconditions.checkArgument(durationNanos >= 0, "duration must not be negative");
    this.durationNanos = durationNanos;
  }

  @Override
  public Trigger newTrigger() {
    return new Trigger() {
      private Time triggerTime;

      @Override
      public boolean triggers(TriggerContext context) {
        if (triggerTime == null) {
          triggerTime = context.getProcessingTime().plusNanos(durationNanos);
        }
        return context.getProcessingTime().compareTo(triggerTime) >= 0;
      }

      @Override
      public boolean finished() {
        return false;
      }

      @Override
      public void reset() {
        triggerTime = null;
      }
    };
  }

  @Override
  public String toString() {
    return "afterProcessingTime(" + durationNanos + "ns)";
  }
}
