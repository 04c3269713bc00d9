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
package com.rivulet.exec.context;

import com.google.common.base.Preconditions;
import com.rivulet.common.config.RivuletConfig;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.util.AutoCloseables;

/**
 * Owns the memory of one query execution: a root allocator limited by
 * {@code rivulet.exec.memory.max} and the child allocator handed to transformations.
 *
 * <p>Closing the context fails if memory is still held, which points at a leaked block or
 * builder.
 */
public class ExecutionContext implements ExecutionAdministration, AutoCloseable {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(ExecutionContext.class);

  private final RivuletConfig config;
  private final BufferAllocator rootAllocator;
  private final BufferAllocator allocator;

  public ExecutionContext(RivuletConfig config) {
    this.config = Preconditions.checkNotNull(config);
    final long limit = config.getBytes(RivuletConfig.MEMORY_MAX_BYTES);
    this.rootAllocator = new RootAllocator(limit);
    this.allocator = rootAllocator.newChildAllocator("execution", 0, limit);
    logger.debug("Created execution context with a memory limit of {} bytes", limit);
  }

  @Override
  public BufferAllocator getAllocator() {
    return allocator;
  }

  @Override
  public RivuletConfig getConfig() {
    return config;
  }

  @Override
  public void close() throws Exception {
    AutoCloseables.close(allocator, rootAllocator);
  }
}
