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

import java.nio.file.Path;

/// A fatal error that terminated reconstruction of one PAR/REC pair. The message names the file,
/// the cause is the original fatal exception.
public class ReconstructionFailedException extends ParRecException {

  private final Path file;

  public ReconstructionFailedException(Path file, ParRecException cause) {
    super("unable to reconstruct " + file + ": " + cause.getMessage(), cause);
    this.file = file;
  }

  public Path getFile() {
    return file;
  }
}
