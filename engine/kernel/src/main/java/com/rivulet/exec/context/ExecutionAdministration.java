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

import com.rivulet.common.config.RivuletConfig;
import org.apache.arrow.memory.BufferAllocator;

/**
 * Resources handed to a transformation while it is created.
 */
public interface ExecutionAdministration {

  /**
   * @return the allocator transformation state is charged to
   */
  BufferAllocator getAllocator();

  RivuletConfig getConfig();
}
