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

import java.util.Objects;

/// A value tagged with the unit it is measured in.
/// @param value
///     the magnitude
/// @param unit
///     the unit of the magnitude
public record Quantity(double value, PhysicalUnit unit) {

  public Quantity {
    Objects.requireNonNull(unit, "unit cannot be null");
  }

  /// @param value the magnitude
  /// @param unit the unit
  /// @return a new quantity
  public static Quantity of(double value, PhysicalUnit unit) {
    return new Quantity(value, unit);
  }

  /// @param target a unit of the same dimension
  /// @return this quantity expressed in the target unit
  /// @throws IllegalArgumentException if the dimensions differ
  public Quantity to(PhysicalUnit target) {
    return new Quantity(unit.convert(value, target), target);
  }

  /// @param target a unit of the same dimension
  /// @return the magnitude of this quantity in the target unit
  public double in(PhysicalUnit target) {
    return unit.convert(value, target);
  }

  @Override
  public String toString() {
    return value + " " + unit.symbol();
  }
}
