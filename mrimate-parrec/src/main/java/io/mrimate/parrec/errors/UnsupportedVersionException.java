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

/// The header declares no format version, or one whose data row schema is not known.
public class UnsupportedVersionException extends ParRecException {

  private final String declaredVersion;

  public UnsupportedVersionException(String declaredVersion) {
    super(declaredVersion == null
        ? "header does not declare a format version"
        : "unsupported header format version: " + declaredVersion);
    this.declaredVersion = declaredVersion;
  }

  /// @return the version string as declared, or null if none was found
  public String getDeclaredVersion() {
    return declaredVersion;
  }
}
