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

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

/// An ordered mapping from the scanner's index values along one axis to zero-based, contiguous
/// array positions.
///
/// Raw values need not start at zero or be contiguous. Positions follow the ascending order of
/// the raw values, so acquisition order is kept along dynamic and cardiac phase axes.
public final class AxisIndex {

  private final int[] rawValues;
  private final Map<Integer, Integer> positions;

  private AxisIndex(int[] sortedDistinct) {
    this.rawValues = sortedDistinct;
    this.positions = new HashMap<>();
    for (int i = 0; i < sortedDistinct.length; i++) {
      positions.put(sortedDistinct[i], i);
    }
  }

  /// @param rawValues raw index values, in any order and possibly repeated
  /// @return the mapping over the distinct values
  public static AxisIndex of(Collection<Integer> rawValues) {
    return new AxisIndex(new TreeSet<>(rawValues).stream().mapToInt(Integer::intValue).toArray());
  }

  /// @param rawValues raw index values, in any order and possibly repeated
  /// @return the mapping over the distinct values
  public static AxisIndex of(int... rawValues) {
    return new AxisIndex(Arrays.stream(rawValues).sorted().distinct().toArray());
  }

  /// @param raw a raw index value
  /// @return its zero-based position
  /// @throws IllegalArgumentException if the value is not part of this mapping
  public int positionOf(int raw) {
    Integer position = positions.get(raw);
    if (position == null) {
      throw new IllegalArgumentException("raw index " + raw + " is not in " + this);
    }
    return position;
  }

  /// @param position a zero-based position
  /// @return the raw index value stored there
  public int rawValueAt(int position) {
    return rawValues[position];
  }

  /// @return the number of distinct raw values
  public int size() {
    return rawValues.length;
  }

  /// @return the raw values in position order
  public int[] rawValues() {
    return rawValues.clone();
  }

  @Override
  public String toString() {
    return "AxisIndex" + Arrays.toString(rawValues);
  }
}
