package io.mrimate.parrec.image;

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

/// The unit an {@link ImageArray}'s values are expressed in.
public enum UnitTag {
  COUNTS("counts"),
  RADIANS("radians"),
  CM_PER_S("cm_per_s"),
  DIMENSIONLESS("dimensionless");

  private final String label;

  UnitTag(String label) {
    this.label = label;
  }

  /// @return the tag written to containers
  public String label() {
    return label;
  }

  /// @param label a tag as written to containers
  /// @return the matching unit tag
  /// @throws IllegalArgumentException for an unknown tag
  public static UnitTag fromLabel(String label) {
    for (UnitTag tag : values()) {
      if (tag.label.equals(label)) {
        return tag;
      }
    }
    throw new IllegalArgumentException("unknown unit tag: " + label);
  }
}
