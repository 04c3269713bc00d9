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
 * Repeats a trigger forever: whenever the inner trigger finishes it is reset instead.
 */
public final class RepeatedTriggerSpec implements TriggerSpec {
  private final TriggerSpec inner;

  public RepeatedTriggerSpec(TriggerSpec inner) {
    this.inner = Preconditions.checkNotNull(inner);
  }

  @Override
  public Trigger newTrigger() {
    final Trigger trigger = inner.newTrigger();
    return new Trigger() {
      @Override
      public boolean triggers(TriggerContext context) {
        return trigger.triggers(context);
      }

      @Override
      public boolean finished() {
        if (trigger.finished()) {
          trigger.reset();
        }
        return false;
      }

      @Override
      public void reset() {
        trigger.reset();
      }
    };
  }

  @Override
  public String toString() {
    return "repeated(" + inner + ")";
  }
}
