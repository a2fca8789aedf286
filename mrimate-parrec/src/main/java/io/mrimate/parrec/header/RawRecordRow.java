package io.mrimate.parrec.header;

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

import java.util.List;

/// One image information row, tokenized but not interpreted.
/// @param lineNumber
///     the 1-based line number in the header
/// @param columns
///     the row's tokens in column order
/// @param rawText
///     the row as it appeared in the header
public record RawRecordRow(int lineNumber, List<RawValue> columns, String rawText) {

  public RawRecordRow {
    columns = List.copyOf(columns);
  }

  /// @param index a zero-based column index
  /// @return the token in that column
  public RawValue column(int index) {
    return columns.get(index);
  }

  /// @return the number of columns in this row
  public int size() {
    return columns.size();
  }
}
