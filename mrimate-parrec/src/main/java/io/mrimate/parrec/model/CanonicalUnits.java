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

/// The canonical units every normalized parameter is held in. Header values are converted to
/// these at the parameter model boundary.
public final class CanonicalUnits {
  public static final PhysicalUnit TIME = PhysicalUnit.SECOND;
  public static final PhysicalUnit LENGTH = PhysicalUnit.MILLIMETRE;
  public static final PhysicalUnit VELOCITY = PhysicalUnit.CENTIMETRE_PER_SECOND;
  public static final PhysicalUnit ANGLE = PhysicalUnit.DEGREE;
  public static final PhysicalUnit FIELD_STRENGTH = PhysicalUnit.TESLA;

  private CanonicalUnits() {
  }

  /// @param unit any unit
  /// @return the canonical unit of the same dimension
  public static PhysicalUnit canonicalFor(PhysicalUnit unit) {
    switch (unit.dimension()) {
      case TIME:
        return TIME;
      case LENGTH:
        return LENGTH;
      case VELOCITY:
        return VELOCITY;
      case ANGLE:
        return ANGLE;
      case FIELD_STRENGTH:
        return FIELD_STRENGTH;
      default:
        return unit;
    }
  }

  /// @param quantity any quantity
  /// @return the quantity in its dimension's canonical unit
  public static Quantity normalize(Quantity quantity) {
    return quantity.to(canonicalFor(quantity.unit()));
  }
}
