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
import java.util.Locale;
import java.util.stream.Collectors;

/// A general information line of the form {@code .    key : value}.
/// @param key
///     the key with surrounding whitespace removed, otherwise verbatim
/// @param values
///     the whitespace-separated tokens of the value, possibly empty
/// @param lineNumber
///     the 1-based line number in the header
public record GeneralEntry(String key, List<RawValue> values, int lineNumber) {

  public GeneralEntry {
    values = List.copyOf(values);
  }

  /// @return the value tokens joined by single spaces
  public String text() {
    return values.stream().map(RawValue::text).collect(Collectors.joining(" "));
  }

  /// @return the key in lower case with runs of whitespace collapsed, for matching
  public String normalizedKey() {
    return normalizeKey(key);
  }

  /// @param key a general information key
  /// @return the key in lower case with runs of whitespace collapsed
  public static String normalizeKey(String key) {
    return key.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
