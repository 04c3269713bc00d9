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
package com.rivulet.exec;

import com.rivulet.common.config.RivuletConfig;
import com.rivulet.exec.context.ExecutionAdministration;
import com.rivulet.test.AllocatorRule;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.AutoCloseables;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;

public abstract class BaseTestWithAllocator {

  protected BufferAllocator allocator;

  @Rule public final AllocatorRule allocatorRule = AllocatorRule.defaultAllocator();

  @Before
  public void setupAllocator() {
    this.allocator = allocatorRule.newAllocator(this.getClass().getSimpleName(), 0, Long.MAX_VALUE);
  }

  @After
  public void closeAllocator() throws Exception {
    AutoCloseables.close(allocator);
  }

  protected ExecutionAdministration administration() {
    final RivuletConfig config = RivuletConfig.create();
    return new ExecutionAdministration() {
      @Override
      public BufferAllocator getAllocator() {
        return allocator;
      }

      @Override
      public RivuletConfig getConfig() {
        return config;
      }
    };
  }
}
