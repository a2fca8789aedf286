package io.mrimate.parrec.header;

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

import io.mrimate.parrec.errors.UnsupportedVersionException;

/// The PAR header versions whose image information rows can be read.
///
/// Each later version appends columns to the rows of the previous one, so the leading 41 columns
/// have the same meaning in all of them.
public enum HeaderVersion {
  /// Research image export tool V4
  V4("4", 41),
  /// V4.1 adds diffusion b-value number, gradient orientation number, contrast type,
  /// anisotropy type and the diffusion direction
  V4_1("4.1", 48),
  /// V4.2 adds the ASL label type
  V4_2("4.2", 49);

  private final String label;
  private final int columnCount;

  HeaderVersion(String label, int columnCount) {
    this.label = label;
    this.columnCount = columnCount;
  }

  /// @return the version number as it is written after the leading {@code V}
  public String label() {
    return label;
  }

  /// @return the number of whitespace-separated columns in each image information row
  public int columnCount() {
    return columnCount;
  }

  /// @return true if rows carry the diffusion key columns
  public boolean hasDiffusionColumns() {
    return this != V4;
  }

  /// @return true if rows carry the ASL label type column
  public boolean hasLabelTypeColumn() {
    return this == V4_2;
  }

  /// Resolve a declared version
  /// @param declared
  ///     the version as written in the header, with or without the leading {@code V}
  /// @return the matching version
  /// @throws UnsupportedVersionException
  ///     if the version is missing or unknown
  public static HeaderVersion fromDeclared(String declared) {
    if (declared == null || declared.isBlank()) {
      throw new UnsupportedVersionException(null);
    }
    String normalized = declared.trim();
    if (normalized.startsWith("V") || normalized.startsWith("v")) {
      normalized = normalized.substring(1);
    }
    for (HeaderVersion version : values()) {
      if (version.label.equals(normalized)) {
        return version;
      }
    }
    throw new UnsupportedVersionException(declared.trim());
  }

  @Override
  public String toString() {
    return "V" + label;
  }
}
