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
import io.mrimate.parrec.errors.ReconstructionWarning;
import io.mrimate.parrec.header.GeneralEntry;
import io.mrimate.parrec.header.RawHeader;
import io.mrimate.parrec.header.RawValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/// Builds {@link ScanParameters} from the general information entries of a header.
///
/// Missing or uncoercible entries never abort the scan. They fall back to a default and are
/// reported as an {@link InvalidParameterException} warning naming the key.
final class ScanParametersReader {

  private final RawHeader header;
  private final List<ReconstructionWarning> warnings;

  ScanParametersReader(RawHeader header, List<ReconstructionWarning> warnings) {
    this.header = header;
    this.warnings = warnings;
  }

  ScanParameters read(List<Quantity> echoTimes) {
    return new ScanParameters(
        text(ParKey.PATIENT_NAME),
        text(ParKey.EXAMINATION_NAME),
        text(ParKey.PROTOCOL_NAME),
        text(ParKey.EXAMINATION_DATE_TIME),
        text(ParKey.SERIES_TYPE),
        integer(ParKey.ACQUISITION_NR),
        integer(ParKey.RECONSTRUCTION_NR),
        quantity(ParKey.SCAN_DURATION, PhysicalUnit.SECOND),
        integer(ParKey.MAX_CARDIAC_PHASES),
        integer(ParKey.MAX_ECHOES),
        integer(ParKey.MAX_SLICES),
        integer(ParKey.MAX_DYNAMICS),
        integer(ParKey.MAX_MIXES),
        text(ParKey.PATIENT_POSITION),
        text(ParKey.PREPARATION_DIRECTION),
        text(ParKey.TECHNIQUE),
        integers(ParKey.SCAN_RESOLUTION, 2),
        text(ParKey.SCAN_MODE),
        quantity(ParKey.REPETITION_TIME, PhysicalUnit.MILLISECOND),
        quantities(ParKey.FOV, 3, PhysicalUnit.MILLIMETRE),
        number(ParKey.WATER_FAT_SHIFT),
        quantities(ParKey.ANGULATION_MIDSLICE, 3, PhysicalUnit.DEGREE),
        quantities(ParKey.OFF_CENTRE_MIDSLICE, 3, PhysicalUnit.MILLIMETRE),
        integer(ParKey.FLOW_COMPENSATION),
        integer(ParKey.PRESATURATION),
        quantities(ParKey.PHASE_ENCODING_VELOCITY, 3, PhysicalUnit.CENTIMETRE_PER_SECOND),
        integer(ParKey.MTC),
        integer(ParKey.SPIR),
        integer(ParKey.EPI_FACTOR),
        integer(ParKey.DYNAMIC_SCAN),
        integer(ParKey.DIFFUSION),
        quantity(ParKey.DIFFUSION_ECHO_TIME, PhysicalUnit.MILLISECOND),
        integer(ParKey.MAX_DIFFUSION_VALUES),
        integer(ParKey.MAX_GRADIENT_ORIENTS),
        integer(ParKey.NUMBER_OF_LABEL_TYPES),
        echoTimes,
        find(ParKey.FIELD_STRENGTH).flatMap(e -> firstNumber(e.values()))
            .map(v -> Quantity.of(v, PhysicalUnit.TESLA)),
        extras()
    );
  }

  private Map<String, String> extras() {
    Map<String, String> extras = new LinkedHashMap<>();
    for (GeneralEntry entry : header.entries()) {
      if (!ParKey.isKnown(entry.normalizedKey())) {
        extras.putIfAbsent(entry.key(), entry.text());
      }
    }
    return extras;
  }

  private Optional<GeneralEntry> find(ParKey key) {
    Optional<GeneralEntry> entry = header.entry(key.prefix());
    if (entry.isEmpty() && key.required()) {
      invalid(key, "missing from header, using default");
    }
    return entry;
  }

  private String text(ParKey key) {
    return find(key).map(GeneralEntry::text).orElse("");
  }

  private int integer(ParKey key) {
    Optional<GeneralEntry> entry = find(key);
    if (entry.isEmpty()) {
      return 0;
    }
    Optional<Double> value = firstNumber(entry.get().values());
    if (value.isEmpty() || value.get() != Math.rint(value.get())) {
      invalid(key, "expected an integer but found '" + entry.get().text() + "'");
      return 0;
    }
    return value.get().intValue();
  }

  private double number(ParKey key) {
    Optional<GeneralEntry> entry = find(key);
    if (entry.isEmpty()) {
      return 0.0d;
    }
    Optional<Double> value = firstNumber(entry.get().values());
    if (value.isEmpty()) {
      invalid(key, "expected a number but found '" + entry.get().text() + "'");
      return 0.0d;
    }
    return value.get();
  }

  private Quantity quantity(ParKey key, PhysicalUnit unit) {
    Optional<GeneralEntry> entry = find(key);
    double value = 0.0d;
    if (entry.isPresent()) {
      Optional<Double> parsed = firstNumber(entry.get().values());
      if (parsed.isPresent()) {
        value = parsed.get();
      } else {
        invalid(key, "expected a number but found '" + entry.get().text() + "'");
      }
    }
    return CanonicalUnits.normalize(Quantity.of(value, unit));
  }

  private Quantity[] quantities(ParKey key, int count, PhysicalUnit unit) {
    double[] values = numbers(key, count);
    Quantity[] quantities = new Quantity[count];
    for (int i = 0; i < count; i++) {
      quantities[i] = CanonicalUnits.normalize(Quantity.of(values[i], unit));
    }
    return quantities;
  }

  private int[] integers(ParKey key, int count) {
    double[] values = numbers(key, count);
    int[] ints = new int[count];
    for (int i = 0; i < count; i++) {
      ints[i] = (int) values[i];
    }
    return ints;
  }

  private double[] numbers(ParKey key, int count) {
    double[] values = new double[count];
    Optional<GeneralEntry> entry = find(key);
    if (entry.isEmpty()) {
      return values;
    }
    List<RawValue> tokens = entry.get().values();
    int found = 0;
    for (RawValue token : tokens) {
      OptionalDouble d = token.asDouble();
      if (d.isPresent() && found < count) {
        values[found++] = d.getAsDouble();
      }
    }
    if (found < count) {
      invalid(key, "expected " + count + " numbers but found '" + entry.get().text() + "'");
    }
    return values;
  }

  private static Optional<Double> firstNumber(List<RawValue> tokens) {
    for (RawValue token : tokens) {
      OptionalDouble d = token.asDouble();
      if (d.isPresent()) {
        return Optional.of(d.getAsDouble());
      }
    }
    return Optional.empty();
  }

  private void invalid(ParKey key, String detail) {
    warnings.add(ReconstructionWarning.of(
        new InvalidParameterException(key.prefix(), InvalidParameterException.SCAN_LEVEL, detail)));
  }
}
