package io.mrimate.hdf5;

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

import io.mrimate.parrec.model.ParameterRecord;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;
import java.util.function.ToLongFunction;

/// The per-record columns written under an image type's {@code records} group, one 1-D dataset
/// per column with one entry per record in record index order.
final class RecordTable {

  private static final Map<String, ToIntFunction<ParameterRecord>> INT_COLUMNS =
      new LinkedHashMap<>();
  private static final Map<String, ToDoubleFunction<ParameterRecord>> DOUBLE_COLUMNS =
      new LinkedHashMap<>();
  private static final Map<String, ToLongFunction<ParameterRecord>> LONG_COLUMNS =
      new LinkedHashMap<>();

  static {
    INT_COLUMNS.put("record_index", ParameterRecord::recordIndex);
    INT_COLUMNS.put("slice_number", r -> r.key().slice());
    INT_COLUMNS.put("echo_number", r -> r.key().echo());
    INT_COLUMNS.put("dynamic_scan_number", r -> r.key().dynamic());
    INT_COLUMNS.put("cardiac_phase_number", r -> r.key().cardiacPhase());
    INT_COLUMNS.put("image_type", r -> r.type().code());
    INT_COLUMNS.put("rec_index", ParameterRecord::recIndex);
    INT_COLUMNS.put("bits_per_sample", ParameterRecord::bitsPerSample);
    INT_COLUMNS.put("scan_percentage", r -> r.settings().scanPercentage());
    INT_COLUMNS.put("window_center", r -> r.settings().windowCenter());
    INT_COLUMNS.put("window_width", r -> r.settings().windowWidth());
    INT_COLUMNS.put("slice_orientation", r -> r.geometry().sliceOrientation());
    INT_COLUMNS.put("averages", r -> r.settings().averages());

    DOUBLE_COLUMNS.put("rescale_intercept", r -> r.rescale().intercept());
    DOUBLE_COLUMNS.put("rescale_slope", r -> r.rescale().slope());
    DOUBLE_COLUMNS.put("scale_slope", r -> r.rescale().scaleSlope());
    DOUBLE_COLUMNS.put("echo_time", r -> r.echoTime().value());
    DOUBLE_COLUMNS.put("dynamic_begin_time", r -> r.dynamicBeginTime().value());
    DOUBLE_COLUMNS.put("trigger_time", r -> r.triggerTime().value());
    DOUBLE_COLUMNS.put("slice_thickness", r -> r.geometry().sliceThickness().value());
    DOUBLE_COLUMNS.put("slice_gap", r -> r.geometry().sliceGap().value());
    DOUBLE_COLUMNS.put("flip_angle", r -> r.settings().flipAngle().value());
    DOUBLE_COLUMNS.put("diffusion_b_factor", r -> r.settings().diffusionBFactor());

    LONG_COLUMNS.put("byte_offset", ParameterRecord::byteOffset);
  }

  private RecordTable() {
  }

  /// @param records the records of one image type
  /// @return column arrays by dataset name
  static Map<String, Object> columns(List<ParameterRecord> records) {
    List<ParameterRecord> ordered =
        records.stream().sorted(Comparator.comparingInt(ParameterRecord::recordIndex)).toList();
    Map<String, Object> columns = new LinkedHashMap<>();
    INT_COLUMNS.forEach((name, f) -> columns.put(name, ordered.stream().mapToInt(f).toArray()));
    DOUBLE_COLUMNS.forEach(
        (name, f) -> columns.put(name, ordered.stream().mapToDouble(f).toArray()));
    LONG_COLUMNS.forEach((name, f) -> columns.put(name, ordered.stream().mapToLong(f).toArray()));
    return columns;
  }
}
