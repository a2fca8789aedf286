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

/// Zero-based column positions in an image information row. Columns up to
/// {@link #INVERSION_DELAY} are shared by all supported versions.
final class RecordColumn {
  static final int SLICE = 0;
  static final int ECHO = 1;
  static final int DYNAMIC = 2;
  static final int CARDIAC_PHASE = 3;
  static final int IMAGE_TYPE = 4;
  static final int SCANNING_SEQUENCE = 5;
  static final int REC_INDEX = 6;
  static final int PIXEL_SIZE = 7;
  static final int SCAN_PERCENTAGE = 8;
  static final int RESOLUTION_X = 9;
  static final int RESOLUTION_Y = 10;
  static final int RESCALE_INTERCEPT = 11;
  static final int RESCALE_SLOPE = 12;
  static final int SCALE_SLOPE = 13;
  static final int WINDOW_CENTER = 14;
  static final int WINDOW_WIDTH = 15;
  static final int ANGULATION = 16;
  static final int OFFCENTRE = 19;
  static final int SLICE_THICKNESS = 22;
  static final int SLICE_GAP = 23;
  static final int SLICE_ORIENTATION = 25;
  static final int PIXEL_SPACING = 28;
  static final int ECHO_TIME = 30;
  static final int DYNAMIC_BEGIN_TIME = 31;
  static final int TRIGGER_TIME = 32;
  static final int DIFFUSION_B_FACTOR = 33;
  static final int AVERAGES = 34;
  static final int FLIP_ANGLE = 35;
  static final int INVERSION_DELAY = 40;
  static final int DIFFUSION_VALUE_NUMBER = 41;
  static final int GRADIENT_ORIENTATION_NUMBER = 42;
  static final int LABEL_TYPE = 48;

  private RecordColumn() {
  }
}
