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

/// The physical axes of an {@link ImageArray}, in the fixed dimension order of every array.
public enum Axis {
  ROW("row"),
  COLUMN("column"),
  SLICE("slice"),
  ECHO("echo"),
  DYNAMIC("dynamic"),
  CARDIAC_PHASE("cardiac_phase");

  private final String label;

  Axis(String label) {
    this.label = label;
  }

  /// @return the axis name written to containers
  public String label() {
    return label;
  }

  /// @param label an axis name as written to containers
  /// @return the matching axis
  /// @throws IllegalArgumentException for an unknown name
  public static Axis fromLabel(String label) {
    for (Axis axis : values()) {
      if (axis.label.equals(label)) {
        return axis;
      }
    }
    throw new IllegalArgumentException("unknown axis label: " + label);
  }
}
