// This file is part of VizQE.
// Copyright (C) 2026  The VizQE Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.vizqe.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Query engine settings backed by a Java properties file.
 * <p>
 * Every key the engine reads has a default in {@link #DEFAULTS}, so a
 * config built without a file is complete. Values from a file or from
 * {@link #overrideConfig(String, String)} win over the defaults.
 * <p>
 * The numeric getters throw a {@link NumberFormatException} when the value
 * is missing or malformed, {@link #getString(String)} returns null for
 * unknown keys.
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** The module name the engine logs under. */
  public static final String MODULE_ID_KEY = "vizqe.query.module_id";

  /** Whether to hide the engine's own log messages from log queries. */
  public static final String FILTER_OWN_LOGS_KEY = "vizqe.query.filter_own_logs";

  /** Default batch fan out for a query. */
  public static final String MAX_BATCHES_KEY = "vizqe.query.max_batches";

  /** Size of the batch worker pool. */
  public static final String WORKER_THREADS_KEY = "vizqe.query.worker_threads";

  /** How far back data is assumed to reach when storage doesn't know. */
  public static final String START_TIME_LOOKBACK_KEY = 
      "vizqe.query.start_time_lookback";

  /** Row time bits of the standard tables. */
  public static final String ROW_TIME_BITS_KEY = "vizqe.schema.row_time_bits";

  /** Values used for keys missing from the file. */
  public static final Map<String, String> DEFAULTS = 
      ImmutableMap.<String, String>builder()
        .put(MODULE_ID_KEY, "QueryEngine")
        .put(FILTER_OWN_LOGS_KEY, "true")
        .put(MAX_BATCHES_KEY, "8")
        .put(WORKER_THREADS_KEY, "4")
        .put(START_TIME_LOOKBACK_KEY, "30d")
        .put(ROW_TIME_BITS_KEY, "23")
        .build();

  /** Where {@link #Config(boolean)} looks for a file, in order. */
  static final List<String> UNIX_LOCATIONS = ImmutableList.of(
      "vizqe.conf",
      "/etc/vizqe.conf",
      "/etc/vizqe/vizqe.conf",
      "/opt/vizqe/vizqe.conf");

  static final List<String> WINDOWS_LOCATIONS = ImmutableList.of(
      "vizqe.conf",
      "C:\\Program Files\\vizqe\\vizqe.conf",
      "C:\\Program Files (x86)\\vizqe\\vizqe.conf");

  protected final Properties properties = new Properties();

  /** The file the properties came from, null if none. */
  private String config_location;

  /**
   * Ctor that optionally searches the default locations for a file.
   * @param auto_load_config Whether to search for a file. The first one
   * found is loaded; if there is none only the defaults apply.
   * @throws IOException if a file was found but could not be read.
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      search(System.getProperty("os.name", "").toUpperCase()
          .contains("WINDOWS") ? WINDOWS_LOCATIONS : UNIX_LOCATIONS);
    }
    applyDefaults();
  }

  /**
   * Ctor loading the given file.
   * @param file Path to a properties file.
   * @throws FileNotFoundException if the file does not exist.
   * @throws IOException if the file could not be read.
   */
  public Config(final String file) throws FileNotFoundException, IOException {
    load(file);
    applyDefaults();
  }

  /**
   * Sets a value, e.g. from the command line. Call before handing the config
   * to the engine; the engine reads its settings once at startup.
   * @param property The key.
   * @param value The value.
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * @param property The key.
   * @return The value or null if the key is not set.
   */
  public final String getString(final String property) {
    return properties.getProperty(property);
  }

  /**
   * @param property The key.
   * @return The value parsed as an integer.
   * @throws NumberFormatException if the value is missing or not an integer.
   */
  public final int getInt(final String property) {
    return Integer.parseInt(properties.getProperty(property));
  }

  /**
   * "1", "true" and "yes" in any case are true, anything else is false.
   * @param property The key.
   * @return The value parsed as a flag.
   * @throws NullPointerException if the key is not set.
   */
  public final boolean getBoolean(final String property) {
    final String value = properties.getProperty(property);
    if (value == null) {
      throw new NullPointerException("No such property: " + property);
    }
    final String flag = value.trim().toUpperCase();
    return flag.equals("1") || flag.equals("TRUE") || flag.equals("YES");
  }

  /**
   * @param property The key of a duration such as "30d".
   * @return The duration in milliseconds.
   * @throws IllegalArgumentException if the value is missing or malformed.
   * @see DateTime#parseDuration(String)
   */
  public final long getDuration(final String property) {
    return DateTime.parseDuration(properties.getProperty(property));
  }

  /**
   * @param property The key.
   * @return True if the key is set to a non-empty value.
   */
  public final boolean hasProperty(final String property) {
    return !Strings.isNullOrEmpty(properties.getProperty(property));
  }

  /** @return The file the properties were loaded from, null if none. */
  public final String configLocation() {
    return config_location;
  }

  /** @return Every setting, one per line and sorted by key. */
  public final String dumpConfiguration() {
    final StringBuilder buf = new StringBuilder("VizQE Configuration:\n")
        .append("File [")
        .append(config_location)
        .append("]\n");
    for (final String key : new TreeSet<String>(
        properties.stringPropertyNames())) {
      buf.append("Key [")
         .append(key)
         .append("]  Value [")
         .append(properties.getProperty(key))
         .append("]\n");
    }
    return buf.toString();
  }

  private void applyDefaults() {
    for (final Map.Entry<String, String> entry : DEFAULTS.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /**
   * Loads the first readable file of the list.
   * @param locations Candidate paths.
   * @throws IOException if a file exists but could not be read.
   */
  private void search(final List<String> locations) throws IOException {
    for (final String location : locations) {
      try {
        load(location);
        return;
      } catch (FileNotFoundException e) {
        LOG.debug("No config file at " + location);
      }
    }
    LOG.info("No configuration file found, using defaults");
  }

  private void load(final String file) throws FileNotFoundException, 
      IOException {
    final Properties loaded = new Properties();
    try (final InputStream stream = new FileInputStream(file)) {
      loaded.load(stream);
    }
    properties.clear();
    properties.putAll(loaded);
    config_location = file;
    LOG.info("Loaded configuration file: " + file);
  }
}
