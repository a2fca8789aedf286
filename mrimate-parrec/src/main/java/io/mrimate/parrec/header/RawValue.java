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

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/// One whitespace-delimited token from a PAR header, typed as loosely as the header itself.
///
/// A token is classified once as an integer, a floating point number or a string. Coercion to the
/// type a field needs happens later, in the parameter model.
public final class RawValue {

  /// How the token text was classified
  public enum Kind {
    INTEGER,
    FLOAT,
    STRING
  }

  private final String text;
  private final Kind kind;

  private RawValue(String text, Kind kind) {
    this.text = text;
    this.kind = kind;
  }

  /// Classify a token
  /// @param token
  ///     the token text, without surrounding whitespace
  /// @return the classified token
  public static RawValue of(String token) {
    Objects.requireNonNull(token, "token cannot be null");
    if (isInteger(token)) {
      return new RawValue(token, Kind.INTEGER);
    }
    if (isFloat(token)) {
      return new RawValue(token, Kind.FLOAT);
    }
    return new RawValue(token, Kind.STRING);
  }

  private static boolean isInteger(String token) {
    try {
      Long.parseLong(token);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean isFloat(String token) {
    if (token.isEmpty() || !(Character.isDigit(token.charAt(token.length() - 1))
                             || token.charAt(token.length() - 1) == '.'))
    {
      // rejects NaN, Infinity and java's type suffixes such as 1f or 2d
      return false;
    }
    try {
      Double.parseDouble(token);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  /// @return the token exactly as it appeared
  public String text() {
    return text;
  }

  /// @return the classification of the token
  public Kind kind() {
    return kind;
  }

  /// @return true for integer and floating point tokens
  public boolean isNumeric() {
    return kind != Kind.STRING;
  }

  /// @return the integer value, empty if the token is not an integer
  public OptionalLong asLong() {
    return kind == Kind.INTEGER ? OptionalLong.of(Long.parseLong(text)) : OptionalLong.empty();
  }

  /// @return the numeric value of an integer or floating point token, empty for strings
  public OptionalDouble asDouble() {
    return isNumeric() ? OptionalDouble.of(Double.parseDouble(text)) : OptionalDouble.empty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawValue)) {
      return false;
    }
    RawValue other = (RawValue) o;
    return text.equals(other.text) && kind == other.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, kind);
  }

  @Override
  public String toString() {
    return text;
  }
}
