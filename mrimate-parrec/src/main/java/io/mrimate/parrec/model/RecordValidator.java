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

import io.mrimate.parrec.errors.InvalidParameterException;
import io.mrimate.parrec.header.HeaderVersion;
import io.mrimate.parrec.header.RawRecordRow;
import io.mrimate.parrec.header.RawValue;

import java.util.OptionalDouble;
import java.util.OptionalLong;

/// Coerces image information rows into {@link ParameterRecord}s, checking each field against its
/// physically meaningful range.
final class RecordValidator {

  private final HeaderVersion version;

  RecordValidator(HeaderVersion version) {
    this.version = version;
  }

  /// @param row a well-formed row
  /// @param recordIndex the row's position among well-formed rows
  /// @param byteOffset the row's offset in the REC buffer
  /// @return the validated record
  /// @throws InvalidParameterException for the first field that fails validation
  ParameterRecord validate(RawRecordRow row, int recordIndex, long byteOffset) {
    int slice = intColumn(row, RecordColumn.SLICE, "slice number", recordIndex, 0);
    int echo = intColumn(row, RecordColumn.ECHO, "echo number", recordIndex, 0);
    int dynamic = intColumn(row, RecordColumn.DYNAMIC, "dynamic scan number", recordIndex, 0);
    int phase = intColumn(row, RecordColumn.CARDIAC_PHASE, "cardiac phase number", recordIndex, 0);
    int typeCode = intColumn(row, RecordColumn.IMAGE_TYPE, "image type", recordIndex, 0);
    ImageType type = ImageType.fromCode(typeCode).orElseThrow(
        () -> new InvalidParameterException("image type", recordIndex,
            "unsupported image type code " + typeCode));
    int recIndex = intColumn(row, RecordColumn.REC_INDEX, "index in REC file", recordIndex, 0);
    int bits = intColumn(row, RecordColumn.PIXEL_SIZE, "image pixel size", recordIndex, 1);
    if (bits != 8 && bits != 16 && bits != 32) {
      throw new InvalidParameterException("image pixel size", recordIndex,
          "sample width must be 8, 16 or 32 bits but was " + bits);
    }
    int columns = intColumn(row, RecordColumn.RESOLUTION_X, "recon resolution x", recordIndex, 1);
    int rows = intColumn(row, RecordColumn.RESOLUTION_Y, "recon resolution y", recordIndex, 1);

    RescaleCoefficients rescale = new RescaleCoefficients(
        doubleColumn(row, RecordColumn.RESCALE_INTERCEPT, "rescale intercept", recordIndex),
        doubleColumn(row, RecordColumn.RESCALE_SLOPE, "rescale slope", recordIndex),
        row.column(RecordColumn.SCALE_SLOPE).asDouble().orElse(Double.NaN)
    );

    SliceGeometry geometry = new SliceGeometry(
        quantities(row, RecordColumn.PIXEL_SPACING, 2, "pixel spacing", recordIndex,
            PhysicalUnit.MILLIMETRE),
        quantities(row, RecordColumn.ANGULATION, 3, "image angulation", recordIndex,
            PhysicalUnit.DEGREE),
        quantities(row, RecordColumn.OFFCENTRE, 3, "image offcentre", recordIndex,
            PhysicalUnit.MILLIMETRE),
        quantity(row, RecordColumn.SLICE_THICKNESS, "slice thickness", recordIndex,
            PhysicalUnit.MILLIMETRE),
        quantity(row, RecordColumn.SLICE_GAP, "slice gap", recordIndex, PhysicalUnit.MILLIMETRE),
        intColumn(row, RecordColumn.SLICE_ORIENTATION, "slice orientation", recordIndex, 0)
    );

    AcquisitionSettings settings = new AcquisitionSettings(
        intColumn(row, RecordColumn.SCANNING_SEQUENCE, "scanning sequence", recordIndex, 0),
        intColumn(row, RecordColumn.SCAN_PERCENTAGE, "scan percentage", recordIndex, 0),
        (int) Math.round(doubleColumn(row, RecordColumn.WINDOW_CENTER, "window center",
            recordIndex)),
        (int) Math.round(doubleColumn(row, RecordColumn.WINDOW_WIDTH, "window width",
            recordIndex)),
        quantity(row, RecordColumn.FLIP_ANGLE, "image flip angle", recordIndex,
            PhysicalUnit.DEGREE),
        intColumn(row, RecordColumn.AVERAGES, "number of averages", recordIndex, 0),
        doubleColumn(row, RecordColumn.DIFFUSION_B_FACTOR, "diffusion b factor", recordIndex),
        version.hasDiffusionColumns()
            ? intColumn(row, RecordColumn.DIFFUSION_VALUE_NUMBER, "diffusion b value number",
            recordIndex, 0) : 0,
        version.hasDiffusionColumns()
            ? intColumn(row, RecordColumn.GRADIENT_ORIENTATION_NUMBER,
            "gradient orientation number", recordIndex, 0) : 0,
        version.hasLabelTypeColumn()
            ? intColumn(row, RecordColumn.LABEL_TYPE, "label type", recordIndex, 0) : 0
    );

    Resolution resolution = new Resolution(rows, columns);
    return new ParameterRecord(
        recordIndex,
        row.lineNumber(),
        new ImageKey(slice, echo, dynamic, phase, type),
        recIndex,
        bits,
        resolution,
        rescale,
        geometry,
        quantity(row, RecordColumn.ECHO_TIME, "echo time", recordIndex, PhysicalUnit.MILLISECOND),
        quantity(row, RecordColumn.DYNAMIC_BEGIN_TIME, "dynamic scan begin time", recordIndex,
            PhysicalUnit.SECOND),
        quantity(row, RecordColumn.TRIGGER_TIME, "trigger time", recordIndex,
            PhysicalUnit.MILLISECOND),
        settings,
        byteOffset,
        (long) resolution.sampleCount() * (bits / Byte.SIZE)
    );
  }

  /// The number of REC bytes a row declares, read leniently so that rows which fail validation
  /// still account for their share of the buffer. Rows whose geometry cannot be read at all
  /// declare none.
  /// @param row an image row, possibly one skipped for its column count
  /// @return the declared byte length
  static long declaredBytes(RawRecordRow row) {
    if (row.size() <= RecordColumn.RESOLUTION_Y) {
      return 0L;
    }
    long x = row.column(RecordColumn.RESOLUTION_X).asLong().orElse(0L);
    long y = row.column(RecordColumn.RESOLUTION_Y).asLong().orElse(0L);
    long bits = row.column(RecordColumn.PIXEL_SIZE).asLong().orElse(0L);
    if (x <= 0 || y <= 0 || bits <= 0 || bits % Byte.SIZE != 0) {
      return 0L;
    }
    return x * y * (bits / Byte.SIZE);
  }

  /// @param row an image row, possibly one skipped for its column count
  /// @return the row's REC index, or empty if it cannot be read
  static OptionalLong declaredRecIndex(RawRecordRow row) {
    if (row.size() <= RecordColumn.REC_INDEX) {
      return OptionalLong.empty();
    }
    OptionalLong index = row.column(RecordColumn.REC_INDEX).asLong();
    if (index.isPresent() && index.getAsLong() < 0) {
      return OptionalLong.empty();
    }
    return index;
  }

  private static int intColumn(RawRecordRow row, int column, String field, int recordIndex,
      int min)
  {
    RawValue token = row.column(column);
    OptionalLong value = token.asLong();
    if (value.isEmpty()) {
      OptionalDouble d = token.asDouble();
      if (d.isPresent() && d.getAsDouble() == Math.rint(d.getAsDouble())) {
        value = OptionalLong.of((long) d.getAsDouble());
      } else {
        throw new InvalidParameterException(field, recordIndex,
            "expected an integer but found '" + token.text() + "'");
      }
    }
    long v = value.getAsLong();
    if (v < min) {
      throw new InvalidParameterException(field, recordIndex,
          "must be >= " + min + " but was " + v);
    }
    if (v > Integer.MAX_VALUE) {
      throw new InvalidParameterException(field, recordIndex, "value " + v + " is out of range");
    }
    return (int) v;
  }

  private static double doubleColumn(RawRecordRow row, int column, String field,
      int recordIndex)
  {
    RawValue token = row.column(column);
    return token.asDouble().orElseThrow(() -> new InvalidParameterException(field, recordIndex,
        "expected a number but found '" + token.text() + "'"));
  }

  private static Quantity quantity(RawRecordRow row, int column, String field, int recordIndex,
      PhysicalUnit unit)
  {
    return CanonicalUnits.normalize(
        Quantity.of(doubleColumn(row, column, field, recordIndex), unit));
  }

  private static Quantity[] quantities(RawRecordRow row, int column, int count, String field,
      int recordIndex, PhysicalUnit unit)
  {
    Quantity[] values = new Quantity[count];
    for (int i = 0; i < count; i++) {
      values[i] = quantity(row, column + i, field, recordIndex, unit);
    }
    return values;
  }
}
