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

/// Categories of recoverable problems reported alongside a successful reconstruction.
public enum WarningKind {
  /// a header data row with the wrong column count was skipped
  MALFORMED_RECORD,
  /// a record or scan parameter failed validation
  INVALID_PARAMETER,
  /// a record's resolution differed from its image type's common resolution
  INCONSISTENT_GEOMETRY,
  /// no valid records remained for an image type, so it was not reconstructed
  DROPPED_IMAGE_TYPE,
  /// the records of an image type did not cover every cell of its index grid
  IRREGULAR_GRID
}
