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

import java.lang.reflect.Array;
import java.util.Arrays;

/// Conversions between flat row-major {@code double[]} storage and the nested Java arrays the
/// HDF5 library reads and writes.
public final class NdArrays {

  private NdArrays() {
  }

  /// @param flat
  ///     values in row-major order
  /// @param shape
  ///     the extents, at least one
  /// @return a nested {@code double} array of the given shape
  public static Object reshape(double[] flat, int[] shape) {
    long count = 1L;
    for (int extent : shape) {
      count *= extent;
    }
    if (shape.length == 0 || count != flat.length) {
      throw new IllegalArgumentException(
          "cannot reshape " + flat.length + " values to " + Arrays.toString(shape));
    }
    Object nested = Array.newInstance(double.class, shape);
    fill(nested, flat, shape, 0, 0);
    return nested;
  }

  private static int fill(Object target, double[] flat, int[] shape, int dim, int offset) {
    if (dim == shape.length - 1) {
      System.arraycopy(flat, offset, target, 0, shape[dim]);
      return offset + shape[dim];
    }
    for (int i = 0; i < shape[dim]; i++) {
      offset = fill(Array.get(target, i), flat, shape, dim + 1, offset);
    }
    return offset;
  }

  /// @param nested
  ///     a rectangular nested {@code double} array, or a {@code double[]}
  /// @return its values in row-major order
  public static double[] flatten(Object nested) {
    int[] shape = shapeOf(nested);
    long count = 1L;
    for (int extent : shape) {
      count *= extent;
    }
    double[] flat = new double[Math.toIntExact(count)];
    collect(nested, flat, 0);
    return flat;
  }

  private static int collect(Object source, double[] flat, int offset) {
    if (source instanceof double[]) {
      double[] row = (double[]) source;
      System.arraycopy(row, 0, flat, offset, row.length);
      return offset + row.length;
    }
    int length = Array.getLength(source);
    for (int i = 0; i < length; i++) {
      offset = collect(Array.get(source, i), flat, offset);
    }
    return offset;
  }

  /// @param nested a nested array
  /// @return its extents, taken from the first element along each dimension
  public static int[] shapeOf(Object nested) {
    if (nested == null || !nested.getClass().isArray()) {
      throw new IllegalArgumentException("not an array: " + nested);
    }
    int rank = 0;
    for (Class<?> c = nested.getClass(); c.isArray(); c = c.getComponentType()) {
      rank++;
    }
    int[] shape = new int[rank];
    Object current = nested;
    for (int d = 0; d < rank; d++) {
      shape[d] = Array.getLength(current);
      if (d < rank - 1) {
        if (shape[d] == 0) {
          break;
        }
        current = Array.get(current, 0);
      }
    }
    return shape;
  }
}
