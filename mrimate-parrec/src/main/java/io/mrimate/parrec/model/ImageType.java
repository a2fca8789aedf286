package io.mrimate.parrec.model;

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

import java.util.Optional;

/// The kind of stored image, from the {@code image_type_mr} column.
public enum ImageType {
  MAGNITUDE(0, "magnitude"),
  REAL(1, "real"),
  IMAGINARY(2, "imaginary"),
  PHASE(3, "phase");

  private final int code;
  private final String label;

  ImageType(int code, String label) {
    this.code = code;
    this.label = label;
  }

  /// @return the scanner's numeric code for this type
  public int code() {
    return code;
  }

  /// @return the lower case name used for container groups
  public String label() {
    return label;
  }

  /// @param code an {@code image_type_mr} value
  /// @return the matching type, empty for codes this reader does not reconstruct
  public static Optional<ImageType> fromCode(long code) {
    for (ImageType type : values()) {
      if (type.code == code) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /// @param label a group label such as {@code phase}
  /// @return the matching type
  /// @throws IllegalArgumentException for an unknown label
  public static ImageType fromLabel(String label) {
    for (ImageType type : values()) {
      if (type.label.equalsIgnoreCase(label)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown image type label: " + label);
  }
}
