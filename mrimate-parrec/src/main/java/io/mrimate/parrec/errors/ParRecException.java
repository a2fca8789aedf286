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

/// Base type for every failure raised while reading, reconstructing or exporting a PAR/REC scan.
///
/// Subtypes are split into recoverable ones, which the pipeline collects as
/// {@link ReconstructionWarning}s, and fatal ones, which abort the run for a file.
public class ParRecException extends RuntimeException {

  /// @param message the error message
  public ParRecException(String message) {
    super(message);
  }

  /// @param message the error message
  /// @param cause the underlying cause
  public ParRecException(String message, Throwable cause) {
    super(message, cause);
  }
}
