package io.mrimate.hdf5;

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

import io.mrimate.parrec.image.ImageArray;
import io.mrimate.parrec.model.ImageType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// The content of an exported container as read back by {@link ContainerReader}.
/// @param formatVersion
///     the layout version the container was written with
/// @param attributes
///     the root attributes other than the format version and warnings
/// @param header
///     unrecognized header entries by their original key
/// @param warnings
///     the warnings recorded at export
/// @param images
///     one read-only array per image type
/// @param records
///     per-record column arrays by image type
public record ExportedContainer(
    String formatVersion,
    Map<String, Object> attributes,
    Map<String, String> header,
    List<String> warnings,
    Map<ImageType, ImageArray> images,
    Map<ImageType, Map<String, Object>> records
)
{
  public ExportedContainer {
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    header = Collections.unmodifiableMap(new LinkedHashMap<>(header));
    warnings = List.copyOf(warnings);
    EnumMap<ImageType, ImageArray> imageCopy = new EnumMap<>(ImageType.class);
    imageCopy.putAll(images);
    images = Collections.unmodifiableMap(imageCopy);
    EnumMap<ImageType, Map<String, Object>> recordCopy = new EnumMap<>(ImageType.class);
    recordCopy.putAll(records);
    records = Collections.unmodifiableMap(recordCopy);
  }

  /// @param type an image type
  /// @return its array, if the container holds one
  public Optional<ImageArray> image(ImageType type) {
    return Optional.ofNullable(images.get(type));
  }

  /// @param name a root attribute name
  /// @return its value, if present
  public Optional<Object> attribute(String name) {
    return Optional.ofNullable(attributes.get(name));
  }
}
