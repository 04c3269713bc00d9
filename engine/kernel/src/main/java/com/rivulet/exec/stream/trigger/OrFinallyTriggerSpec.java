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
 * Fires when the main trigger fires. Fires one last time and finishes when the finally trigger
 * fires.
 */
public final class OrFinallyTriggerSpec implements TriggerSpec {
  private final TriggerSpec main;
  private final TriggerSpec last;

  public OrFinallyTriggerSpec(TriggerSpec main, TriggerSpec last) {
    this.main = Preconditions.checkNotNull(main);
    this.last = Preconditions.checkNotNull(last);
  }

  @Override
  public Trigger newTrigger() {
    final Trigger mainTrigger = main.newTrigger();
    final Trigger lastTrigger = last.newTrigger();
    return new Trigger() {
      private boolean finished;

      @Override
      public boolean triggers(TriggerContext context) {
        if (lastTrigger.triggers(context)) {
          finished = true;
          return true;
        }
        return mainTrigger.triggers(context);
      }

      @Override
      public boolean finished() {
        return finished;
      }

      @Override
      public void reset() {
        finished = false;
        mainTrigger.reset();
        lastTrigger.reset();
      }
    };
  }

  @Override
  public String toString() {
    return "orFinally(" + main + ", " + last + ")";
  }
}
