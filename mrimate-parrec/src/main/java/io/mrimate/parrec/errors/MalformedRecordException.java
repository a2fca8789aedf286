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

/// A data row of the image information section whose column count does not match the schema of
/// the declared header version. The row is skipped.
public class MalformedRecordException extends ParRecException {

  private final int lineNumber;
  private final String rawText;
  private final int expectedColumns;
  private final int actualColumns;

  public MalformedRecordException(
      int lineNumber,
      String rawText,
      int expectedColumns,
      int actualColumns
  )
  {
    super(String.format(
        "line %d: expected %d columns but found %d: '%s'",
        lineNumber,
        expectedColumns,
        actualColumns,
        rawText.trim()
    ));
    this.lineNumber = lineNumber;
    this.rawText = rawText;
    this.expectedColumns = expectedColumns;
    this.actualColumns = actualColumns;
  }

  /// @return the 1-based line number of the row in the header file
  public int getLineNumber() {
    return lineNumber;
  }

  /// @return the row exactly as it appeared in the header
  public String getRawText() {
    return rawText;
  }

  public int getExpectedColumns() {
    return expectedColumns;
  }

  public int getActualColumns() {
    return actualColumns;
  }
}
