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

/**
 * Fires whenever the key has cached at least the given number of rows.
 */
public final class AfterAtLeastCountTriggerSpec implements TriggerSpec {
  private final long count;

  public AfterAtLeastCountTriggerSpec(long count) {
    Preconditions.checkArgument(count > 0, "count must be positive");
    this.count = count;
  }

  @Override
  public Trigger newTrigger() {
    return new Trigger() {
      @Override
      public boolean triggers(TriggerContext context) {
        return context.getRowCount() >= count;
      }

      @Override
      public boolean finished() {
        return false;
      }

      @Override
      public void reset() {
      }
    };
  }

  @Override
  public String toString() {
    return "afterAtLeastCount(" + count + ")";
  }
}
