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

/// One validated image information row.
///
/// Times are in seconds, lengths in millimetres. The byte offset and length locate the image's
/// samples in the REC buffer.
/// @param recordIndex
///     zero-based position of the row among the header's well-formed rows
/// @param lineNumber
///     1-based line number in the header
/// @param key
///     the image's acquisition coordinates
/// @param recIndex
///     the image's position in the REC file, in images
/// @param bitsPerSample
///     stored sample width
/// @param resolution
///     the image's declared resolution
/// @param rescale
///     calibration coefficients
/// @param geometry
///     slice geometry
/// @param echoTime
///     echo time
/// @param dynamicBeginTime
///     start time of the dynamic scan
/// @param triggerTime
///     cardiac trigger time
/// @param settings
///     remaining acquisition settings
/// @param byteOffset
///     offset of the first sample in the REC buffer
/// @param byteLength
///     number of bytes the image occupies
public record ParameterRecord(
    int recordIndex,
    int lineNumber,
    ImageKey key,
    int recIndex,
    int bitsPerSample,
    Resolution resolution,
    RescaleCoefficients rescale,
    SliceGeometry geometry,
    Quantity echoTime,
    Quantity dynamicBeginTime,
    Quantity triggerTime,
    AcquisitionSettings settings,
    long byteOffset,
    long byteLength
)
{

  /// @return the image type of this record
  public ImageType type() {
    return key.type();
  }

  /// @return the number of bytes one sample occupies
  public int bytesPerSample() {
    return bitsPerSample / Byte.SIZE;
  }
}
