package io.mrimate.parrec.errors;

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

/// A record whose declared resolution differs from the common resolution of its image type.
/// The record is skipped during assembly.
public class InconsistentGeometryException extends ParRecException {

  private final String imageType;
  private final int recordIndex;

  public InconsistentGeometryException(
      String imageType,
      int recordIndex,
      int expectedRows,
      int expectedColumns,
      int rows,
      int columns
  )
  {
    super(String.format(
        "record %d (%s): resolution %dx%d does not match common resolution %dx%d",
        recordIndex,
        imageType,
        rows,
        columns,
        expectedRows,
        expectedColumns
    ));
    this.imageType = imageType;
    this.recordIndex = recordIndex;
  }

  /// For a record of an image type whose records share no common resolution.
  public InconsistentGeometryException(String imageType, int recordIndex, int rows, int columns) {
    super(String.format(
        "record %d (%s): resolution %dx%d, but the image type has no common resolution",
        recordIndex,
        imageType,
        rows,
        columns
    ));
    this.imageType = imageType;
    this.recordIndex = recordIndex;
  }

  public String getImageType() {
    return imageType;
  }

  public int getRecordIndex() {
    return recordIndex;
  }
}
