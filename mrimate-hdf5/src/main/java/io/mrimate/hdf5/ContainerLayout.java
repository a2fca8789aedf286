package io.mrimate.hdf5;

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

import io.mrimate.parrec.image.Axis;

import java.util.Locale;

/// Names used in an exported container.
///
/// ```
/// /                         scan parameters as attributes, format_version, warnings
/// /header                   unrecognized header entries, index
/// /<image type>             axes, unit
/// /<image type>/data        float64 [row, column, slice, echo, dynamic, cardiac_phase]
/// /<image type>/<axis>_positions
/// /<image type>/records/<column>
/// ```
public final class ContainerLayout {

  /// Version of this layout, written to every container
  public static final String FORMAT_VERSION = "1.0";

  public static final String FORMAT_VERSION_ATTR = "format_version";
  public static final String WARNINGS_ATTR = "warnings";
  public static final String HEADER_GROUP = "header";
  public static final String HEADER_INDEX_ATTR = "index";
  public static final String DATA = "data";
  public static final String AXES_ATTR = "axes";
  public static final String UNIT_ATTR = "unit";
  public static final String RECORDS_GROUP = "records";
  public static final String UNIT_SUFFIX = "_unit";
  private static final String POSITIONS_SUFFIX = "_positions";

  private ContainerLayout() {
  }

  /// @param axis one of slice, echo, dynamic or cardiac phase
  /// @return the name of the dataset holding that axis' raw index values
  public static String positionsName(Axis axis) {
    return axis.label() + POSITIONS_SUFFIX;
  }

  /// @param name a Java identifier in camel case
  /// @return the same name in snake case
  public static String snakeCase(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 8);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isUpperCase(c)) {
        if (i > 0) {
          sb.append('_');
        }
        sb.append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /// @param key a header key such as {@code Max. number of gradient orients}
  /// @return an attribute name made of lower case letters, digits and underscores
  public static String attributeName(String key) {
    String name = key.toLowerCase(Locale.ROOT)
        .replaceAll("[^a-z0-9]+", "_")
        .replaceAll("^_+|_+$", "");
    return name.isEmpty() ? "entry" : name;
  }
}
