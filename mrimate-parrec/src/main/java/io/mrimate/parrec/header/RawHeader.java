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

import io.mrimate.parrec.errors.MalformedRecordException;

import java.util.List;
import java.util.Optional;

/// The untyped result of parsing a PAR header.
///
/// General information entries and image rows are kept in file order. Rows whose column count did
/// not match the version's schema are listed separately. They are never validated into records,
/// but their tokens are kept so the REC layout can still account for the images they describe.
public final class RawHeader {

  private final HeaderVersion version;
  private final List<GeneralEntry> entries;
  private final List<RawRecordRow> rows;
  private final List<MalformedRecordException> malformedRows;
  private final List<RawRecordRow> skippedRows;

  public RawHeader(
      HeaderVersion version,
      List<GeneralEntry> entries,
      List<RawRecordRow> rows,
      List<MalformedRecordException> malformedRows,
      List<RawRecordRow> skippedRows
  )
  {
    this.version = version;
    this.entries = List.copyOf(entries);
    this.rows = List.copyOf(rows);
    this.malformedRows = List.copyOf(malformedRows);
    this.skippedRows = List.copyOf(skippedRows);
  }

  public HeaderVersion version() {
    return version;
  }

  /// @return every general information entry, including keys this reader does not know
  public List<GeneralEntry> entries() {
    return entries;
  }

  /// @return the well-formed image information rows
  public List<RawRecordRow> rows() {
    return rows;
  }

  /// @return the rows skipped for a column count mismatch
  public List<MalformedRecordException> malformedRows() {
    return malformedRows;
  }

  /// @return the tokens of the rows skipped for a column count mismatch, in file order
  public List<RawRecordRow> skippedRows() {
    return skippedRows;
  }

  /// Find the first entry whose normalized key starts with the given prefix
  /// @param normalizedPrefix
  ///     a lower case key prefix with single spaces, see {@link GeneralEntry#normalizeKey(String)}
  /// @return the entry, if present
  public Optional<GeneralEntry> entry(String normalizedPrefix) {
    return entries.stream().filter(e -> e.normalizedKey().startsWith(normalizedPrefix)).findFirst();
  }
}
