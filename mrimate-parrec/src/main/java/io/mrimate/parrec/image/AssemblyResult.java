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

import io.mrimate.parrec.errors.ReconstructionWarning;
import io.mrimate.parrec.model.ImageType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// The output of {@link ImageAssembler}: one filled array per reconstructible image type and the
/// warnings raised while assembling them.
/// @param images
///     the filled arrays, in image type order
/// @param warnings
///     geometry, dropped-type and grid warnings, in image type order
public record AssemblyResult(Map<ImageType, ImageArray> images,
    List<ReconstructionWarning> warnings)
{
  public AssemblyResult {
    EnumMap<ImageType, ImageArray> copy = new EnumMap<>(ImageType.class);
    copy.putAll(images);
    images = Collections.unmodifiableMap(copy);
    warnings = List.copyOf(warnings);
  }

  /// @param type an image type
  /// @return its array, if the type was reconstructed
  public Optional<ImageArray> image(ImageType type) {
    return Optional.ofNullable(images.get(type));
  }
}
