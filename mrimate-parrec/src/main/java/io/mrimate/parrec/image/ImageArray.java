package io.mrimate.parrec.image;

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

import io.mrimate.parrec.model.ImageType;
import io.mrimate.parrec.model.ParameterRecord;
import io.mrimate.parrec.model.Resolution;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

/// A six-dimensional image of one {@link ImageType}, with dimensions ordered
/// {@code [row, column, slice, echo, dynamic, cardiac_phase]}.
///
/// Values are stored flat in row-major order over that shape. Each 2D slab (one slice, echo,
/// dynamic and cardiac phase combination) is filled from one record. Slabs no record covers keep
/// the {@link #SENTINEL} value.
///
/// The lifecycle is one-way: an array is allocated, filled, rescaled once and from then on is
/// read-only.
public final class ImageArray {

  /// Value of every sample no record has filled.
  public static final double SENTINEL = Double.NaN;

  private static final List<Axis> AXES = List.of(Axis.values());

  private final ImageType type;
  private final int[] shape;
  private final double[] data;
  private final AxisIndex[] indices;
  private final Map<SlabPosition, ParameterRecord> sources = new LinkedHashMap<>();
  private UnitTag unit;
  private boolean rescaled;

  private ImageArray(ImageType type, int[] shape, double[] data, AxisIndex[] indices,
      UnitTag unit, boolean rescaled)
  {
    this.type = type;
    this.shape = shape;
    this.data = data;
    this.indices = indices;
    this.unit = unit;
    this.rescaled = rescaled;
  }

  /// Allocate a sentinel-filled array
  /// @param type
  ///     the image type held
  /// @param resolution
  ///     the in-plane resolution
  /// @param slices
  ///     the slice axis mapping
  /// @param echoes
  ///     the echo axis mapping
  /// @param dynamics
  ///     the dynamic axis mapping
  /// @param cardiacPhases
  ///     the cardiac phase axis mapping
  /// @return an empty array holding stored sample values
  public static ImageArray allocate(
      ImageType type,
      Resolution resolution,
      AxisIndex slices,
      AxisIndex echoes,
      AxisIndex dynamics,
      AxisIndex cardiacPhases
  )
  {
    int[] shape = {
        resolution.rows(),
        resolution.columns(),
        slices.size(),
        echoes.size(),
        dynamics.size(),
        cardiacPhases.size()
    };
    double[] data = new double[Math.toIntExact(elementCount(shape))];
    Arrays.fill(data, SENTINEL);
    return new ImageArray(type, shape, data,
        new AxisIndex[]{slices, echoes, dynamics, cardiacPhases}, null, false);
  }

  /// Rebuild a finished array from previously exported content. The result is read-only.
  /// @param type
  ///     the image type held
  /// @param shape
  ///     the six extents
  /// @param data
  ///     the values, row-major over the shape
  /// @param unit
  ///     the unit of the values
  /// @param slices
  ///     the slice axis mapping
  /// @param echoes
  ///     the echo axis mapping
  /// @param dynamics
  ///     the dynamic axis mapping
  /// @param cardiacPhases
  ///     the cardiac phase axis mapping
  /// @return the restored array
  public static ImageArray restore(
      ImageType type,
      int[] shape,
      double[] data,
      UnitTag unit,
      AxisIndex slices,
      AxisIndex echoes,
      AxisIndex dynamics,
      AxisIndex cardiacPhases
  )
  {
    if (shape.length != AXES.size()) {
      throw new IllegalArgumentException(
          "expected " + AXES.size() + " dimensions but got " + shape.length);
    }
    if (elementCount(shape) != data.length) {
      throw new IllegalArgumentException(
          "shape " + Arrays.toString(shape) + " does not match " + data.length + " values");
    }
    AxisIndex[] indices = {slices, echoes, dynamics, cardiacPhases};
    for (int i = 0; i < indices.length; i++) {
      if (indices[i].size() != shape[i + 2]) {
        throw new IllegalArgumentException(
            AXES.get(i + 2).label() + " positions do not match extent " + shape[i + 2]);
      }
    }
    return new ImageArray(type, shape.clone(), data.clone(), indices, unit, true);
  }

  private static long elementCount(int[] shape) {
    long count = 1L;
    for (int extent : shape) {
      count *= extent;
    }
    return count;
  }

  /// Copy one record's samples into a slab
  /// @param position
  ///     the slab to fill
  /// @param source
  ///     the record the samples come from
  /// @param samples
  ///     rows * columns stored values, row-major
  /// @throws IllegalStateException
  ///     if the array has been rescaled or the slab is already filled
  public void fillSlab(SlabPosition position, ParameterRecord source, double[] samples) {
    if (rescaled) {
      throw new IllegalStateException("cannot fill a " + type.label() + " array after rescaling");
    }
    int rows = shape[0];
    int columns = shape[1];
    if (samples.length != rows * columns) {
      throw new IllegalArgumentException(
          "slab needs " + rows * columns + " samples but got " + samples.length);
    }
    if (sources.containsKey(position)) {
      throw new IllegalStateException("slab " + position + " is already filled");
    }
    sources.put(position, source);
    int slabOffset = slabOffset(position);
    int stride = slabStride();
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < columns; c++) {
        data[(r * columns + c) * stride + slabOffset] = samples[r * columns + c];
      }
    }
  }

  /// Apply each filled slab's conversion, then mark the array rescaled and read-only.
  /// @param perRecord
  ///     the conversion for the record a slab came from
  /// @param resultUnit
  ///     the unit of the converted values
  /// @throws IllegalStateException
  ///     if the array was already rescaled
  void rescale(Function<ParameterRecord, DoubleUnaryOperator> perRecord, UnitTag resultUnit) {
    if (rescaled) {
      throw new IllegalStateException(type.label() + " array has already been rescaled");
    }
    int stride = slabStride();
    int planeSize = shape[0] * shape[1];
    for (Map.Entry<SlabPosition, ParameterRecord> e : sources.entrySet()) {
      DoubleUnaryOperator op = perRecord.apply(e.getValue());
      int slabOffset = slabOffset(e.getKey());
      for (int i = 0; i < planeSize; i++) {
        int idx = i * stride + slabOffset;
        data[idx] = op.applyAsDouble(data[idx]);
      }
    }
    this.unit = resultUnit;
    this.rescaled = true;
  }

  private int slabStride() {
    return shape[2] * shape[3] * shape[4] * shape[5];
  }

  private int slabOffset(SlabPosition p) {
    return ((p.slice() * shape[3] + p.echo()) * shape[4] + p.dynamic()) * shape[5]
           + p.cardiacPhase();
  }

  /// @param index six zero-based indices in axis order
  /// @return the value at that position
  public double get(int... index) {
    if (index.length != shape.length) {
      throw new IllegalArgumentException("expected " + shape.length + " indices");
    }
    int flat = 0;
    for (int i = 0; i < shape.length; i++) {
      if (index[i] < 0 || index[i] >= shape[i]) {
        throw new IndexOutOfBoundsException(
            AXES.get(i).label() + " index " + index[i] + " out of bounds for " + shape[i]);
      }
      flat = flat * shape[i] + index[i];
    }
    return data[flat];
  }

  /// @param position a slab position
  /// @return a copy of the slab's values, row-major
  public double[] slab(SlabPosition position) {
    int rows = shape[0];
    int columns = shape[1];
    double[] values = new double[rows * columns];
    int slabOffset = slabOffset(position);
    int stride = slabStride();
    for (int i = 0; i < values.length; i++) {
      values[i] = data[i * stride + slabOffset];
    }
    return values;
  }

  /// @return a copy of all values, row-major over {@link #shape()}
  public double[] data() {
    return data.clone();
  }

  public ImageType type() {
    return type;
  }

  /// @return the six extents in axis order
  public int[] shape() {
    return shape.clone();
  }

  /// @return the axes in dimension order
  public List<Axis> axes() {
    return AXES;
  }

  /// @return the unit of the values, empty while they are still stored samples
  public Optional<UnitTag> unit() {
    return Optional.ofNullable(unit);
  }

  /// @return true once the values are physical rather than stored samples
  public boolean isRescaled() {
    return rescaled;
  }

  /// @param axis one of slice, echo, dynamic or cardiac phase
  /// @return the raw-to-position mapping along that axis
  public AxisIndex index(Axis axis) {
    if (axis == Axis.ROW || axis == Axis.COLUMN) {
      throw new IllegalArgumentException(axis + " has no raw index mapping");
    }
    return indices[axis.ordinal() - 2];
  }

  /// @return the record behind each filled slab, in fill order. Empty for restored arrays.
  public Map<SlabPosition, ParameterRecord> sources() {
    return Collections.unmodifiableMap(sources);
  }

  /// @return the number of slabs in the array
  public int slabCount() {
    return slabStride();
  }

  /// @return the number of slabs no record has filled
  public int missingSlabCount() {
    return slabCount() - sources.size();
  }

  @Override
  public String toString() {
    return "ImageArray{" + type.label() + " " + Arrays.toString(shape) + " "
           + (rescaled ? unit.label() : "stored") + "}";
  }
}
