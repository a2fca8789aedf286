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

/// Units carried by normalized parameter values. Each unit belongs to one physical dimension and
/// converts to the others of that dimension through a factor to the dimension's base unit.
public enum PhysicalUnit {
  SECOND(Dimension.TIME, "s", 1.0),
  MILLISECOND(Dimension.TIME, "ms", 1.0e-3),
  MILLIMETRE(Dimension.LENGTH, "mm", 1.0),
  CENTIMETRE(Dimension.LENGTH, "cm", 10.0),
  CENTIMETRE_PER_SECOND(Dimension.VELOCITY, "cm/s", 1.0),
  DEGREE(Dimension.ANGLE, "deg", 1.0),
  RADIAN(Dimension.ANGLE, "rad", 180.0 / Math.PI),
  TESLA(Dimension.FIELD_STRENGTH, "T", 1.0),
  PIXEL(Dimension.PIXELS, "px", 1.0);

  /// Physical dimensions, each with one base unit.
  public enum Dimension {
    TIME,
    LENGTH,
    VELOCITY,
    ANGLE,
    FIELD_STRENGTH,
    PIXELS
  }

  private final Dimension dimension;
  private final String symbol;
  private final double toBase;

  PhysicalUnit(Dimension dimension, String symbol, double toBase) {
    this.dimension = dimension;
    this.symbol = symbol;
    this.toBase = toBase;
  }

  public Dimension dimension() {
    return dimension;
  }

  public String symbol() {
    return symbol;
  }

  /// Convert a value in this unit to another unit of the same dimension
  /// @param value
  ///     the value in this unit
  /// @param target
  ///     the unit to convert to
  /// @return the converted value
  /// @throws IllegalArgumentException
  ///     if the target unit measures a different dimension
  public double convert(double value, PhysicalUnit target) {
    if (target.dimension != this.dimension) {
      throw new IllegalArgumentException(
          "cannot convert " + symbol + " (" + dimension + ") to " + target.symbol + " ("
          + target.dimension + ")");
    }
    if (target == this) {
      return value;
    }
    return value * toBase / target.toBase;
  }
}
