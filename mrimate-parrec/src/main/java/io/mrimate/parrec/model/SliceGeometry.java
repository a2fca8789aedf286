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

/// Position and extent of a stored image in patient space. Lengths are millimetres, angles
/// degrees.
/// @param pixelSpacing
///     in-plane spacing, x then y
/// @param angulation
///     angulation about the ap, fh and rl axes
/// @param offcentre
///     offcentre along the ap, fh and rl axes
/// @param sliceThickness
///     slice thickness
/// @param sliceGap
///     gap between slices
/// @param sliceOrientation
///     1 transversal, 2 sagittal, 3 coronal
public record SliceGeometry(
    Quantity[] pixelSpacing,
    Quantity[] angulation,
    Quantity[] offcentre,
    Quantity sliceThickness,
    Quantity sliceGap,
    int sliceOrientation
)
{
}
