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

/// Acquisition settings recorded per image which play no part in image assembly.
/// @param scanningSequence
///     scanning sequence code
/// @param scanPercentage
///     scan percentage
/// @param windowCenter
///     display window center
/// @param windowWidth
///     display window width
/// @param flipAngle
///     flip angle
/// @param averages
///     number of averages
/// @param diffusionBFactor
///     diffusion b factor, s/mm2
/// @param diffusionValueNumber
///     diffusion b value number, 0 for headers before V4.1
/// @param gradientOrientationNumber
///     gradient orientation number, 0 for headers before V4.1
/// @param labelType
///     ASL label type, 0 for headers before V4.2
public record AcquisitionSettings(
    int scanningSequence,
    int scanPercentage,
    int windowCenter,
    int windowWidth,
    Quantity flipAngle,
    int averages,
    double diffusionBFactor,
    int diffusionValueNumber,
    int gradientOrientationNumber,
    int labelType
)
{
}
