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

import io.mrimate.parrec.model.Quantity;
import io.mrimate.parrec.model.ScanParameters;

import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Maps {@link ScanParameters} to container root attributes.
///
/// Each record component becomes one attribute named in snake case. A quantity is written as its
/// value with a companion {@code <name>_unit} attribute. Empty strings, empty arrays and absent
/// optionals are left out. The unrecognized header entries are not part of this map, they go to
/// their own group.
public final class ScanAttributes {

  private static final String EXTRAS = "extras";

  private ScanAttributes() {
  }

  /// @param scan
  ///     the scan parameters
  /// @return attribute values by name, in record component order, followed by {@code venc}
  public static Map<String, Object> of(ScanParameters scan) {
    Map<String, Object> attrs = new LinkedHashMap<>();
    try {
      for (RecordComponent comp : ScanParameters.class.getRecordComponents()) {
        if (comp.getName().equals(EXTRAS)) {
          continue;
        }
        Method accessor = comp.getAccessor();
        Object value = accessor.invoke(scan);
        put(attrs, ContainerLayout.snakeCase(comp.getName()), value);
      }
    } catch (ReflectiveOperationException e) {
      throw new ExportException("unable to read scan parameters", e);
    }
    scan.venc().ifPresent(v -> put(attrs, "venc", v));
    return attrs;
  }

  private static void put(Map<String, Object> attrs, String name, Object value) {
    if (value instanceof Optional<?> optional) {
      optional.ifPresent(v -> put(attrs, name, v));
    } else if (value instanceof Quantity q) {
      attrs.put(name, q.value());
      attrs.put(name + ContainerLayout.UNIT_SUFFIX, q.unit().symbol());
    } else if (value instanceof Quantity[] qs) {
      putQuantities(attrs, name, List.of(qs));
    } else if (value instanceof List<?> list) {
      if (!list.isEmpty() && list.stream().allMatch(Quantity.class::isInstance)) {
        putQuantities(attrs, name, list.stream().map(Quantity.class::cast).toList());
      } else if (!list.isEmpty()) {
        attrs.put(name, list.stream().map(String::valueOf).toArray(String[]::new));
      }
    } else if (value instanceof String s) {
      if (!s.isEmpty()) {
        attrs.put(name, s);
      }
    } else if (value instanceof int[] ints) {
      if (ints.length > 0) {
        attrs.put(name, ints);
      }
    } else if (value instanceof Enum<?> e) {
      attrs.put(name, e.name());
    } else if (value != null) {
      attrs.put(name, value);
    }
  }

  private static void putQuantities(Map<String, Object> attrs, String name, List<Quantity> qs) {
    if (qs.isEmpty()) {
      return;
    }
    double[] values = new double[qs.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = qs.get(i).in(qs.get(0).unit());
    }
    attrs.put(name, values);
    attrs.put(name + ContainerLayout.UNIT_SUFFIX, qs.get(0).unit().symbol());
  }
}
