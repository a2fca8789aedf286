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

import io.mrimate.parrec.model.CanonicalUnits;
import io.mrimate.parrec.model.ImageType;
import io.mrimate.parrec.model.ParameterRecord;
import io.mrimate.parrec.model.Quantity;
import io.mrimate.parrec.model.RescaleCoefficients;
import io.mrimate.parrec.model.ScanParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/// Converts stored sample values into physical values, using each slab's own record.
///
/// {@code physical = (stored * slope + intercept) / scaleSlope}, where a scale slope of zero or
/// none at all counts as 1. Phase images are then in radians, and when the scan declares a
/// velocity encoding they are further scaled by {@code venc / pi} into cm/s. Unfilled samples
/// stay {@link ImageArray#SENTINEL}.
public class RescaleEngine {
  private static final Logger logger = LogManager.getLogger(RescaleEngine.class);

  private final Optional<Quantity> venc;

  /// @param scan the scan the arrays belong to
  public RescaleEngine(ScanParameters scan) {
    this.venc = scan.venc();
  }

  /// Rescale one array in place. The array is read-only afterwards.
  /// @param array
  ///     an assembled array holding stored sample values
  /// @return the same array
  /// @throws IllegalStateException
  ///     if the array was already rescaled
  public ImageArray rescale(ImageArray array) {
    ImageType type = array.type();
    UnitTag unit = unitFor(type);
    if (unit == UnitTag.CM_PER_S) {
      double factor = venc.orElseThrow().in(CanonicalUnits.VELOCITY) / Math.PI;
      array.rescale(r -> calibration(r).andThen(v -> v * factor), unit);
    } else {
      array.rescale(RescaleEngine::calibration, unit);
    }
    logger.debug("rescaled {} to {}", type.label(), unit.label());
    return array;
  }

  /// @param arrays assembled arrays
  /// @return the same arrays, rescaled
  public Map<ImageType, ImageArray> rescaleAll(Map<ImageType, ImageArray> arrays) {
    arrays.values().forEach(this::rescale);
    return arrays;
  }

  /// @param type an image type
  /// @return the unit its rescaled values are in
  public UnitTag unitFor(ImageType type) {
    switch (type) {
      case MAGNITUDE:
        return UnitTag.COUNTS;
      case PHASE:
        return venc.isPresent() ? UnitTag.CM_PER_S : UnitTag.RADIANS;
      default:
        return UnitTag.DIMENSIONLESS;
    }
  }

  private static DoubleUnaryOperator calibration(ParameterRecord record) {
    RescaleCoefficients c = record.rescale();
    return c::apply;
  }
}
