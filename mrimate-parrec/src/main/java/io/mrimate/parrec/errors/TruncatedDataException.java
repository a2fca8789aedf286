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

/// The REC buffer holds fewer bytes than the header's records declare. Reconstruction of the scan
/// is not possible.
public class TruncatedDataException extends ParRecException {

  private final Path file;
  private final long requiredBytes;
  private final long availableBytes;

  public TruncatedDataException(Path file, long requiredBytes, long availableBytes) {
    super(String.format(
        "%s holds %,d bytes but the header declares %,d bytes of image data",
        file,
        availableBytes,
        requiredBytes
    ));
    this.file = file;
    this.requiredBytes = requiredBytes;
    this.availableBytes = availableBytes;
  }

  public Path getFile() {
    return file;
  }

  public long getRequiredBytes() {
    return requiredBytes;
  }

  public long getAvailableBytes() {
    return availableBytes;
  }
}
