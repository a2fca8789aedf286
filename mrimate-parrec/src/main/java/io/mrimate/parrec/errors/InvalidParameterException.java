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

/// A parameter value outside its physically meaningful range, or one that cannot be coerced to
/// the type the field requires.
///
/// For per-record fields the record is excluded from reconstruction. For scan-level fields the
/// record index is {@link #SCAN_LEVEL} and a default value is used instead.
public class InvalidParameterException extends ParRecException {

  /// Record index used for scan-level (general information) parameters.
  public static final int SCAN_LEVEL = -1;

  private final String field;
  private final int recordIndex;

  public InvalidParameterException(String field, int recordIndex, String detail) {
    super(recordIndex == SCAN_LEVEL
        ? String.format("scan parameter '%s': %s", field, detail)
        : String.format("record %d, field '%s': %s", recordIndex, field, detail));
    this.field = field;
    this.recordIndex = recordIndex;
  }

  /// @return the name of the offending field
  public String getField() {
    return field;
  }

  /// @return the zero-based index of the offending row in header order, or {@link #SCAN_LEVEL}
  public int getRecordIndex() {
    return recordIndex;
  }
}
