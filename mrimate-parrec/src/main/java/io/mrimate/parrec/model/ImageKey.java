package io.mrimate.parrec.model;

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

/// The acquisition coordinates identifying one stored image. Unique within a scan.
/// @param slice
///     the scanner's slice number
/// @param echo
///     the scanner's echo number
/// @param dynamic
///     the scanner's dynamic scan number
/// @param cardiacPhase
///     the scanner's cardiac phase number
/// @param type
///     the image type
public record ImageKey(int slice, int echo, int dynamic, int cardiacPhase, ImageType type) {
}
