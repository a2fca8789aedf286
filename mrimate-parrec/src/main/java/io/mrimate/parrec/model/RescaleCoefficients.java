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

/// Per-record calibration from stored sample values to physical values.
/// @param intercept
///     rescale intercept
/// @param slope
///     rescale slope
/// @param scaleSlope
///     scale slope, NaN when the header carries none
public record RescaleCoefficients(double intercept, double slope, double scaleSlope) {

  /// @return the scale slope to divide by, 1 when it is zero or absent
  public double effectiveScaleSlope() {
    if (Double.isNaN(scaleSlope) || scaleSlope == 0.0d) {
      return 1.0d;
    }
    return scaleSlope;
  }

  /// @param stored a stored sample value
  /// @return {@code (stored * slope + intercept) / scaleSlope}
  public double apply(double stored) {
    return (stored * slope + intercept) / effectiveScaleSlope();
  }
}
