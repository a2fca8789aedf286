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

import java.util.Optional;

/// A recoverable problem encountered during reconstruction.
/// @param kind
///     the category of the problem
/// @param message
///     a human-readable description
/// @param cause
///     the recoverable exception behind the warning, if there was one
public record ReconstructionWarning(WarningKind kind, String message, Optional<ParRecException> cause) {

  /// @param e a skipped header row
  /// @return a warning for it
  public static ReconstructionWarning of(MalformedRecordException e) {
    return new ReconstructionWarning(WarningKind.MALFORMED_RECORD, e.getMessage(), Optional.of(e));
  }

  /// @param e an excluded record or defaulted scan parameter
  /// @return a warning for it
  public static ReconstructionWarning of(InvalidParameterException e) {
    return new ReconstructionWarning(WarningKind.INVALID_PARAMETER, e.getMessage(), Optional.of(e));
  }

  /// @param e a record skipped for its geometry
  /// @return a warning for it
  public static ReconstructionWarning of(InconsistentGeometryException e) {
    return new ReconstructionWarning(
        WarningKind.INCONSISTENT_GEOMETRY,
        e.getMessage(),
        Optional.of(e)
    );
  }

  /// @param kind the category
  /// @param message the description
  /// @return a warning without an underlying exception
  public static ReconstructionWarning of(WarningKind kind, String message) {
    return new ReconstructionWarning(kind, message, Optional.empty());
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
