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
import com.rivulet.common.logical.ColumnLabels;
import com.rivulet.exec.record.ColumnType;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;

/**
 * Fires when the watermark reaches the {@code _stop} value of the key. Keys without a time typed
 * {@code _stop} column never fire. The trigger finishes once the watermark is past
 * {@code _stop + allowedLateness}.
 */
public final class AfterWatermarkTriggerSpec implements TriggerSpec {
  private final long allowedLatenessNanos;

  public AfterWatermarkTriggerSpec(long allowedLatenessNanos) {
    Preconditions.checkArgument(allowedLatenessNanos >= 0, "allowed lateness must not be negative");
    this.allowedLatenessNanos = allowedLatenessNanos;
  }

  public long getAllowedLatenessNanos() {
    return allowedLatenessNanos;
  }

  @Override
  public Trigger newTrigger() {
    return new AfterWatermarkTrigger(allowedLatenessNanos);
  }

  @Override
  public String toString() {
    return "afterWatermark(" + allowedLatenessNanos + "ns)";
  }

  private static final class AfterWatermarkTrigger implements Trigger {
    private final long allowedLatenessNanos;
    private boolean finished;

    private AfterWatermarkTrigger(long allowedLatenessNanos) {
      this.allowedLatenessNanos = allowedLatenessNanos;
    }

    @Override
    public boolean triggers(TriggerContext context) {
      final PartitionKey key = context.getKey();
      final int stopIndex = key.indexOf(ColumnLabels.DEFAULT_STOP);
      if (stopIndex < 0 || key.getColumns().get(stopIndex).getType() != ColumnType.TIME) {
        return false;
      }
      final Time stop = (Time) key.getValue(stopIndex);
      if (stop == null) {
        return false;
      }
      if (context.getWatermark().compareTo(stop.plusNanos(allowedLatenessNanos)) >= 0) {
        finished = true;
      }
      return context.getWatermark().compareTo(stop) >= 0;
    }

    @Override
    public boolean finished() {
      return finished;
    }

    @Override
    public void reset() {
      finished = false;
    }
  }
}
