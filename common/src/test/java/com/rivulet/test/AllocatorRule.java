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
package com.rivulet.test;

import com.google.common.base.Preconditions;
import com.rivulet.common.config.RivuletConfig;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.rules.ExternalResource;

/**
 * Allocator rule to automatically create a root allocator around each test. Closing the root
 * fails the test when memory is still held by one of its children.
 */
public final class AllocatorRule extends ExternalResource {

  private final RivuletConfig config;
  private BufferAllocator rootAllocator;

  private AllocatorRule(RivuletConfig config) {
    this.config = config;
  }

  /**
   * Creates a root allocator rule using the default configuration
   */
  public static AllocatorRule defaultAllocator() {
    return new AllocatorRule(RivuletConfig.create());
  }

  /**
   * Creates a root allocator rule with the provided memory limit
   */
  public static AllocatorRule withLimit(long limit) {
    return new AllocatorRule(RivuletConfig.create().withValue(RivuletConfig.MEMORY_MAX_BYTES, limit));
  }

  public BufferAllocator newAllocator(String name, int initReservation, long maxAllocation) {
    Preconditions.checkState(rootAllocator != null, "Trying to allocate buffer before test is started");
    return rootAllocator.newChildAllocator(name, initReservation, maxAllocation);
  }

  @Override
  protected void before() throws Throwable {
    rootAllocator = new RootAllocator(config.getBytes(RivuletConfig.MEMORY_MAX_BYTES));
    super.before();
  }

  @Override
  protected void after() {
    super.after();
    if (rootAllocator != null) {
      rootAllocator.close();
    }
  }
}
