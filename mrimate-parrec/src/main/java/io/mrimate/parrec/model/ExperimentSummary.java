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

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/// A short human-readable description of a scan, grouped into experiment details and scan
/// information.
public final class ExperimentSummary {

  private static final DateTimeFormatter PAR_DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy.MM.dd / HH:mm:ss", Locale.ROOT);
  private static final DateTimeFormatter DISPLAY_DATE =
      DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

  private ExperimentSummary() {
  }

  /// @param scan the scan to describe
  /// @return a multi-line description
  public static String describe(ScanParameters scan) {
    int[] resolution = scan.scanResolution();
    StringBuilder sb = new StringBuilder();
    sb.append("Experiment Details:\n");
    sb.append("- Type: ").append(scan.seriesType()).append('\n');
    sb.append("- Date: ").append(displayDate(scan.examinationDateTime())).append("\n\n");

    sb.append("Scan Information:\n");
    sb.append("- Technique: ").append(scan.technique()).append('\n');
    sb.append("- Dimension: ").append(scan.isThreeDimensional() ? "3D" : "2D").append('\n');
    sb.append("- Resolution: ");
    if (resolution.length >= 2) {
      sb.append(resolution[0]).append('x').append(resolution[1]).append(" pixels\n");
    } else {
      sb.append("unknown\n");
    }
    sb.append("- Slices: ").append(scan.maxSlices()).append('\n');
    sb.append("- Dynamics: ")
        .append(scan.maxDynamics() > 1 ? String.valueOf(scan.maxDynamics()) : "None")
        .append('\n');
    sb.append("- Flow Encoding: ").append(scan.venc().map(v -> "Yes (venc " + v + ")").orElse("No"))
        .append('\n');
    sb.append("- Diffusion Encoding: ").append(scan.diffusion() != 0 ? "Yes" : "No").append('\n');
    return sb.toString();
  }

  /// @param examinationDateTime the header's {@code yyyy.MM.dd / HH:mm:ss} value
  /// @return the date spelled out, or the value unchanged if it does not parse
  static String displayDate(String examinationDateTime) {
    try {
      return LocalDateTime.parse(examinationDateTime.trim(), PAR_DATE_TIME).format(DISPLAY_DATE);
    } catch (DateTimeParseException e) {
      return examinationDateTime;
    }
  }
}
