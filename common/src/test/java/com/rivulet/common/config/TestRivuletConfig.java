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
package com.rivulet.common.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rivulet.test.TemporarySystemProperties;
import org.junit.Rule;
import org.junit.Test;

/**
 * Test Rivulet Config.
 */
public class TestRivuletConfig {

  @Rule
  public final TemporarySystemProperties properties = new TemporarySystemProperties();

  @Test
  public void initialize() {
    properties.clear(RivuletConfig.MEMORY_MAX_BYTES);
    RivuletConfig config = RivuletConfig.create();

    assertThat(config.getBytes(RivuletConfig.MEMORY_MAX_BYTES)).isEqualTo(1024L * 1024 * 1024);
    assertThat(config.getInt(RivuletConfig.BUILDER_INITIAL_CAPACITY)).isEqualTo(64);
    assertThat(config.getLong(RivuletConfig.TRANSPORT_DRAIN_TIMEOUT_MS)).isEqualTo(30000L);
  }

  @Test
  public void fileOverride() {
    properties.clear(RivuletConfig.MEMORY_MAX_BYTES);
    RivuletConfig config = RivuletConfig.create(getClass().getResource("/test-rivulet.conf"));

    assertThat(config.getBytes(RivuletConfig.MEMORY_MAX_BYTES)).isEqualTo(16L * 1024 * 1024);
    // untouched values fall back to the reference
    assertThat(config.getInt(RivuletConfig.BUILDER_INITIAL_CAPACITY)).isEqualTo(64);
  }

  /**
   * Make sure that system properties win over a user config even if that user config sets the
   * value.
   */
  @Test
  public void systemOverFile() {
    properties.set(RivuletConfig.BUILDER_INITIAL_CAPACITY, "8");
    RivuletConfig config = RivuletConfig.create(getClass().getResource("/test-rivulet.conf"));

    assertThat(config.getInt(RivuletConfig.BUILDER_INITIAL_CAPACITY)).isEqualTo(8);
  }

  @Test
  public void badProperty() {
    assertThatThrownBy(() -> RivuletConfig.create(getClass().getResource("/test-rivulet-bad.conf")))
        .isInstanceOf(RuntimeException.class)
        .hasMessageContaining("mistyped-property");
  }

  @Test
  public void appOverride() {
    RivuletConfig config = RivuletConfig.create()
        .withValue(RivuletConfig.BUILDER_INITIAL_CAPACITY, 4);

    assertThat(config.getInt(RivuletConfig.BUILDER_INITIAL_CAPACITY)).isEqualTo(4);
  }
}
