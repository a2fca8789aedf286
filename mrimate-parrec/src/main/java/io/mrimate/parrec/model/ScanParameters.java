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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/// Scan-level parameters from the general information section of a PAR header.
///
/// Times are in seconds, lengths in millimetres, angles in degrees and velocities in cm/s.
/// Entries the reader does not recognize are kept verbatim in {@link #extras()}.
public record ScanParameters(
    String patientName,
    String examinationName,
    String protocolName,
    String examinationDateTime,
    String seriesType,
    int acquisitionNumber,
    int reconstructionNumber,
    Quantity scanDuration,
    int maxCardiacPhases,
    int maxEchoes,
    int maxSlices,
    int maxDynamics,
    int maxMixes,
    String patientPosition,
    String preparationDirection,
    String technique,
    int[] scanResolution,
    String scanMode,
    Quantity repetitionTime,
    Quantity[] fov,
    double waterFatShift,
    Quantity[] angulationMidslice,
    Quantity[] offCentreMidslice,
    int flowCompensation,
    int presaturation,
    Quantity[] phaseEncodingVelocity,
    int mtc,
    int spir,
    int epiFactor,
    int dynamicScan,
    int diffusion,
    Quantity diffusionEchoTime,
    int maxDiffusionValues,
    int maxGradientOrients,
    int numberOfLabelTypes,
    List<Quantity> echoTimes,
    Optional<Quantity> fieldStrength,
    Map<String, String> extras
)
{

  public ScanParameters {
    scanResolution = scanResolution.clone();
    fov = fov.clone();
    angulationMidslice = angulationMidslice.clone();
    offCentreMidslice = offCentreMidslice.clone();
    phaseEncodingVelocity = phaseEncodingVelocity.clone();
    echoTimes = List.copyOf(echoTimes);
    extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras));
  }

  @Override
  public int[] scanResolution() {
    return scanResolution.clone();
  }

  @Override
  public Quantity[] fov() {
    return fov.clone();
  }

  @Override
  public Quantity[] angulationMidslice() {
    return angulationMidslice.clone();
  }

  @Override
  public Quantity[] offCentreMidslice() {
    return offCentreMidslice.clone();
  }

  @Override
  public Quantity[] phaseEncodingVelocity() {
    return phaseEncodingVelocity.clone();
  }

  /// The velocity encoding of a flow scan: the largest magnitude among the phase encoding
  /// velocity components.
  /// @return the venc, empty when no component is non-zero
  public Optional<Quantity> venc() {
    return Arrays.stream(phaseEncodingVelocity)
        .map(q -> q.in(CanonicalUnits.VELOCITY))
        .map(Math::abs)
        .filter(v -> v > 0.0d)
        .max(Double::compare)
        .map(v -> Quantity.of(v, CanonicalUnits.VELOCITY));
  }

  /// @return true if the scan mode or series type marks a 3D acquisition
  public boolean isThreeDimensional() {
    return scanMode.toUpperCase(Locale.ROOT).contains("3D")
        || seriesType.toUpperCase(Locale.ROOT).contains("3D");
  }
}
