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

/// General information keys of the PAR header that map onto {@link ScanParameters} fields.
///
/// Keys are matched by the prefix of their normalized form, so unit annotations and option hints
/// such as {@code <0=no 1=yes> ?} do not need to be spelled exactly.
public enum ParKey {
  PATIENT_NAME("patient name", true),
  EXAMINATION_NAME("examination name", true),
  PROTOCOL_NAME("protocol name", true),
  EXAMINATION_DATE_TIME("examination date/time", true),
  SERIES_TYPE("series type", true),
  ACQUISITION_NR("acquisition nr", true),
  RECONSTRUCTION_NR("reconstruction nr", true),
  SCAN_DURATION("scan duration", true),
  MAX_CARDIAC_PHASES("max. number of cardiac phases", true),
  MAX_ECHOES("max. number of echoes", true),
  MAX_SLICES("max. number of slices/locations", true),
  MAX_DYNAMICS("max. number of dynamics", true),
  MAX_MIXES("max. number of mixes", true),
  PATIENT_POSITION("patient position", true),
  PREPARATION_DIRECTION("preparation direction", true),
  TECHNIQUE("technique", true),
  SCAN_RESOLUTION("scan resolution", true),
  SCAN_MODE("scan mode", true),
  REPETITION_TIME("repetition time", true),
  FOV("fov", true),
  WATER_FAT_SHIFT("water fat shift", true),
  ANGULATION_MIDSLICE("angulation midslice", true),
  OFF_CENTRE_MIDSLICE("off centre midslice", true),
  FLOW_COMPENSATION("flow compensation", true),
  PRESATURATION("presaturation", true),
  PHASE_ENCODING_VELOCITY("phase encoding velocity", true),
  MTC("mtc", true),
  SPIR("spir", true),
  EPI_FACTOR("epi factor", true),
  DYNAMIC_SCAN("dynamic scan", true),
  DIFFUSION("diffusion <", true),
  DIFFUSION_ECHO_TIME("diffusion echo time", true),
  MAX_DIFFUSION_VALUES("max. number of diffusion values", false),
  MAX_GRADIENT_ORIENTS("max. number of gradient orients", false),
  NUMBER_OF_LABEL_TYPES("number of label types", false),
  FIELD_STRENGTH("field strength", false);

  private final String prefix;
  private final boolean required;

  ParKey(String prefix, boolean required) {
    this.prefix = prefix;
    this.required = required;
  }

  /// @return the normalized key prefix this entry is matched by
  public String prefix() {
    return prefix;
  }

  /// @return true if a missing entry should be reported
  public boolean required() {
    return required;
  }

  /// @param normalizedKey a normalized general information key
  /// @return true if the key belongs to this entry
  public boolean matches(String normalizedKey) {
    return normalizedKey.startsWith(prefix);
  }

  /// @param normalizedKey a normalized general information key
  /// @return true if any known entry matches the key
  public static boolean isKnown(String normalizedKey) {
    for (ParKey key : values()) {
      if (key.matches(normalizedKey)) {
        return true;
      }
    }
    return false;
  }
}
