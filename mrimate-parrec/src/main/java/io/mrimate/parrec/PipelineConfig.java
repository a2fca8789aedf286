package io.mrimate.parrec;

/*
 * Copyright (c) mrimate
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.mrimate.parrec.errors.ParRecException;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Settings for one pipeline run.
///
/// A config file is a flat YAML (or JSON) map using the component names as keys, for example:
/// ```yaml
/// threads: 4
/// checkRecSize: true
/// exportTempPrefix: .mrimate-
/// ```
/// Keys that are left out take their defaults. Unknown keys are an error.
/// @param threads
///     the number of image assembly threads, 1 for none
/// @param checkRecSize
///     whether the REC size is checked against the header before reading
/// @param exportTempPrefix
///     the file name prefix of the temporary file an export is written to
public record PipelineConfig(int threads, boolean checkRecSize, String exportTempPrefix) {

  public static final int DEFAULT_THREADS = 1;
  public static final String DEFAULT_TEMP_PREFIX = ".mrimate-";

  private final static LoadSettings loadSettings = LoadSettings.builder().build();
  private final static Load yaml = new Load(loadSettings);
  private static final Set<String> KEYS = Set.of("threads", "checkRecSize", "exportTempPrefix");

  public PipelineConfig {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be positive, got " + threads);
    }
    if (exportTempPrefix == null || exportTempPrefix.isBlank()) {
      throw new IllegalArgumentException("exportTempPrefix must not be blank");
    }
  }

  /// @return the default settings
  public static PipelineConfig defaults() {
    return new PipelineConfig(DEFAULT_THREADS, true, DEFAULT_TEMP_PREFIX);
  }

  /// @param threads an assembly thread count
  /// @return a copy with that thread count
  public PipelineConfig withThreads(int threads) {
    return new PipelineConfig(threads, checkRecSize, exportTempPrefix);
  }

  /// Load settings from a {@code .yaml}, {@code .yml} or {@code .json} file
  /// @param path
  ///     the config file
  /// @return the settings, defaults for missing keys
  /// @throws ParRecException
  ///     if the file cannot be read or holds invalid settings
  public static PipelineConfig load(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    Object data;
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      if (name.endsWith(".yaml") || name.endsWith(".yml")) {
        data = yaml.loadFromReader(reader);
      } else if (name.endsWith(".json")) {
        Gson gson = new GsonBuilder().create();
        data = gson.fromJson(reader, Map.class);
      } else {
        throw new ParRecException("unsupported config file type: " + path);
      }
    } catch (IOException e) {
      throw new ParRecException("unable to read config file " + path, e);
    }
    if (data == null) {
      return defaults();
    }
    if (!(data instanceof Map)) {
      throw new ParRecException("config file " + path + " must hold a map of settings");
    }
    try {
      return fromMap((Map<?, ?>) data);
    } catch (IllegalArgumentException e) {
      throw new ParRecException("invalid config file " + path + ": " + e.getMessage(), e);
    }
  }

  /// @param map settings by key
  /// @return the settings, defaults for missing keys
  /// @throws IllegalArgumentException for unknown keys or values of the wrong type
  public static PipelineConfig fromMap(Map<?, ?> map) {
    for (Object key : map.keySet()) {
      if (!KEYS.contains(String.valueOf(key))) {
        throw new IllegalArgumentException("unknown setting '" + key + "', expected one of "
                                           + KEYS);
      }
    }
    PipelineConfig d = defaults();
    Object threads = map.get("threads");
    Object check = map.get("checkRecSize");
    Object prefix = map.get("exportTempPrefix");
    return new PipelineConfig(
        threads == null ? d.threads() : asInt("threads", threads),
        check == null ? d.checkRecSize() : asBoolean("checkRecSize", check),
        prefix == null ? d.exportTempPrefix() : String.valueOf(prefix)
    );
  }

  private static int asInt(String key, Object value) {
    if (value instanceof Number) {
      double d = ((Number) value).doubleValue();
      if (d == Math.rint(d)) {
        return (int) d;
      }
    }
    try {
      return Integer.parseInt(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
    }
  }

  private static boolean asBoolean(String key, Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    String text = String.valueOf(value).trim();
    if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
      return Boolean.parseBoolean(text);
    }
    throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
  }
}
