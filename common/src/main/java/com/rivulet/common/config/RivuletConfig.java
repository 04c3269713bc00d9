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

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueFactory;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;

/**
 * Engine configuration, merged with and validated against {@code rivulet-reference.conf}.
 *
 * <p>Layering, highest priority first: system properties named like a reference path, the user
 * configuration ({@code rivulet.conf} on the classpath or an explicit URL), the reference.
 */
public final class RivuletConfig {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(RivuletConfig.class);

  private static final String REFERENCE_CONFIG = "rivulet-reference.conf";
  private static final String DEFAULT_USER_CONFIG = "rivulet.conf";

  public static final String MEMORY_MAX_BYTES = "rivulet.exec.memory.max";
  public static final String BUILDER_INITIAL_CAPACITY = "rivulet.exec.builder.initial_capacity";
  public static final String TRANSPORT_DRAIN_TIMEOUT_MS = "rivulet.exec.transport.drain_timeout_ms";

  private final Config unresolved;
  private final Config reference;
  private final Config config;

  /**
   * We keep the unresolved layers so that withValue can be applied before resolution.
   */
  private RivuletConfig(Config unresolved, Config reference) {
    this.unresolved = unresolved;
    this.reference = reference;
    this.config = unresolved.withFallback(reference).resolve();
    check();
  }

  private void check() {
    final Config ref = reference.resolve();

    // make sure types are right
    config.checkValid(ref);

    // make sure we don't have any extra paths. these are typically typos.
    List<String> invalidPaths = new ArrayList<>();
    for (Entry<String, ConfigValue> entry : config.entrySet()) {
      if (!ref.hasPath(entry.getKey())) {
        invalidPaths.add(entry.getKey());
      }
    }

    if (!invalidPaths.isEmpty()) {
      StringBuilder sb = new StringBuilder();
      sb.append("Failure reading configuration file. The following properties were invalid:\n");
      for (String s : invalidPaths) {
        sb.append('\t').append(s).append('\n');
      }
      throw new RuntimeException(sb.toString());
    }
  }

  public static RivuletConfig create() {
    return create(null);
  }

  public static RivuletConfig create(final URL userConfigPath) {
    final ClassLoader classLoader = RivuletConfig.class.getClassLoader();
    Preconditions.checkNotNull(classLoader.getResource(REFERENCE_CONFIG),
        "Unable to find the reference configuration.");
    final Config reference = ConfigFactory.parseResources(classLoader, REFERENCE_CONFIG);

    final Config userConfig;
    if (userConfigPath == null) {
      userConfig = classLoader.getResource(DEFAULT_USER_CONFIG) == null
          ? ConfigFactory.empty()
          : ConfigFactory.parseResources(classLoader, DEFAULT_USER_CONFIG);
    } else {
      userConfig = ConfigFactory.parseURL(userConfigPath, ConfigParseOptions.defaults().setAllowMissing(false));
    }

    return new RivuletConfig(applySystemProperties(userConfig, reference), reference);
  }

  private static Config applySystemProperties(Config config, Config reference) {
    for (Entry<String, ConfigValue> entry : reference.entrySet()) {
      String property = System.getProperty(entry.getKey());
      if (property != null && !property.isEmpty()) {
        config = config.withValue(entry.getKey(), ConfigValueFactory.fromAnyRef(property));
        logger.info("Applying provided system property to config: -D{}={}", entry.getKey(), property);
      }
    }
    return config;
  }

  public RivuletConfig withValue(String path, Object value) {
    return new RivuletConfig(unresolved.withValue(path, ConfigValueFactory.fromAnyRef(value)), reference);
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public String getString(String path) {
    return config.getString(path);
  }

  public boolean getBoolean(String path) {
    return config.getBoolean(path);
  }

  public int getInt(String path) {
    return config.getInt(path);
  }

  public long getLong(String path) {
    return config.getLong(path);
  }

  /**
   * Reads a size in bytes. Accepts plain numbers as well as HOCON size strings such as {@code 512M}.
   */
  public long getBytes(String path) {
    return config.getBytes(path);
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
