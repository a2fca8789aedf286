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

/// The array extents of one image type: the common in-plane resolution and the number of distinct
/// slice, echo, dynamic and cardiac phase values among the records having that resolution.
public record AxisExtents(Resolution resolution, int slices, int echoes, int dynamics,
    int cardiacPhases)
{

  /// @return the array shape in {@code [row, column, slice, echo, dynamic, cardiac_phase]} order
  public int[] shape() {
    return new int[]{
        resolution.rows(), resolution.columns(), slices, echoes, dynamics, cardiacPhases
    };
  }

  /// @return the number of slabs, one per slice, echo, dynamic and cardiac phase combination
  public int slabCount() {
    return slices * echoes * dynamics * cardiacPhases;
  }
}
