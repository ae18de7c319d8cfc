/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.prism.common.config;

import java.io.IOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.apache.prism.common.exceptions.UserException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import com.typesafe.config.ConfigValueFactory;

/**
 * Immutable engine configuration backed by a Typesafe {@link Config}.
 */
public class PrismConfig {
  private static final Logger logger = LoggerFactory.getLogger(PrismConfig.class);

  private final Config config;

  @VisibleForTesting
  public PrismConfig(Config config) {
    this.config = config;
    logger.trace("Given Config object is:\n{}", config.root().render(ConfigRenderOptions.concise()));
  }

  /**
   * Creates a configuration using the default override file name.
   * <p>
   * Configuration values are retrieved as follows, in order of precedence:
   * <ul>
   * <li>Overriding properties passed by the caller, if any.</li>
   * <li>JVM system properties.</li>
   * <li>A single copy of "{@code prism-override.conf}".</li>
   * <li>All copies of "{@code prism-module.conf}". Loading order is indeterminate.</li>
   * <li>A single copy of "{@code prism-default.conf}".</li>
   * </ul>
   *
   * @return the new PrismConfig object
   */
  public static PrismConfig create() {
    return create(null, null);
  }

  public static PrismConfig create(String overrideFileResourcePathname) {
    return create(overrideFileResourcePathname, null);
  }

  /**
   * <b><u>Do not use this method outside of test code.</u></b>
   */
  @VisibleForTesting
  public static PrismConfig create(Properties testConfigurations) {
    return create(null, testConfigurations);
  }

  /**
   * Creates a configuration from an already assembled {@link Config}.
   */
  public static PrismConfig create(Config config) {
    return new PrismConfig(config.resolve());
  }

  private static PrismConfig create(String overrideFileResourcePathname, Properties overriderProps) {
    StringBuilder logString = new StringBuilder();
    Stopwatch watch = Stopwatch.createStarted();
    overrideFileResourcePathname = overrideFileResourcePathname == null
        ? CommonConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME
        : overrideFileResourcePathname;

    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader == null) {
      classLoader = PrismConfig.class.getClassLoader();
    }

    // 1. Load defaults configuration file.
    Config fallback = ConfigFactory.empty();
    URL defaultUrl = classLoader.getResource(CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);
    if (defaultUrl != null) {
      logString.append("Base Configuration:\n\t- ").append(defaultUrl).append("\n");
      fallback = ConfigFactory.parseURL(defaultUrl);
    }

    // 2. Load per-module configuration files.
    logString.append("\nIntermediate Configuration files, in order of precedence:\n");
    for (URL url : getModuleConfigUrls(classLoader)) {
      logString.append("\t- ").append(url).append("\n");
      fallback = ConfigFactory.parseURL(url).withFallback(fallback);
    }
    logString.append("\n");

    // 3. Load any specified overrides configuration file along with any
    //    overrides from JVM system properties.
    URL overrideFileUrl = classLoader.getResource(overrideFileResourcePathname);
    if (overrideFileUrl != null) {
      logString.append("Override File: ").append(overrideFileUrl).append("\n");
      fallback = ConfigFactory.parseURL(overrideFileUrl).withFallback(fallback);
    }
    Config effectiveConfig = ConfigFactory.systemProperties().withFallback(fallback);

    // 4. Apply any overriding properties.
    if (overriderProps != null) {
      logString.append("Overridden Properties:\n");
      for (Entry<Object, Object> entry : overriderProps.entrySet()) {
        logString.append("\t-").append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
      }
      logString.append("\n");
      effectiveConfig = ConfigFactory.parseProperties(overriderProps).withFallback(effectiveConfig);
    }

    logger.debug("Configuration file(s) identified in {}ms.\n{}",
        watch.elapsed(TimeUnit.MILLISECONDS),
        logString);
    return new PrismConfig(effectiveConfig.resolve());
  }

  private static List<URL> getModuleConfigUrls(ClassLoader classLoader) {
    List<URL> urls = new ArrayList<>();
    try {
      Enumeration<URL> resources = classLoader.getResources(CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME);
      while (resources.hasMoreElements()) {
        urls.add(resources.nextElement());
      }
    } catch (IOException e) {
      throw UserException.dataReadError(e)
          .message("Failure while scanning the class path for %s files.", CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME)
          .build(logger);
    }
    return urls;
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
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

  public String getString(String path) {
    return config.getString(path);
  }

  /**
   * Returns the boolean value at the given path or the default when the path is absent.
   */
  public boolean getBoolean(String path, boolean defaultValue) {
    return config.hasPath(path) ? config.getBoolean(path) : defaultValue;
  }

  public int getInt(String path, int defaultValue) {
    return config.hasPath(path) ? config.getInt(path) : defaultValue;
  }

  /**
   * Returns a copy of this configuration with the given value set at the path.
   */
  public PrismConfig withValue(String path, Object value) {
    try {
      return new PrismConfig(config.withValue(path, ConfigValueFactory.fromAnyRef(value)));
    } catch (ConfigException e) {
      throw UserException.validationError(e)
          .message("Invalid configuration value for %s: %s", path, value)
          .build(logger);
    }
  }

  public Config getConfig() {
    return config;
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
