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
import io.mrimate.parrec.errors.ParRecException;
import io.mrimate.parrec.errors.ReconstructionWarning;
import io.mrimate.parrec.header.HeaderVersion;
import io.mrimate.parrec.header.RawHeader;
import io.mrimate.parrec.header.RawRecordRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.ToIntFunction;

/// The validated parameters of one scan: its {@link ScanParameters} and the ordered list of
/// accepted {@link ParameterRecord}s.
///
/// A model is built once from a {@link RawHeader} and never changes afterwards. Records that fail
/// validation are left out and reported through {@link #warnings()}. Derived values such as the
/// extents of each image type are computed during construction.
public final class ParameterModel {
  private static final Logger logger = LogManager.getLogger(ParameterModel.class);

  private final HeaderVersion version;
  private final ScanParameters scan;
  private final List<ParameterRecord> records;
  private final List<ReconstructionWarning> warnings;
  private final Map<ImageType, List<ParameterRecord>> recordsByType;
  private final Map<ImageType, AxisExtents> extentsByType;
  private final int uniqueSliceCount;
  private final long requiredRecBytes;

  private ParameterModel(
      HeaderVersion version,
      ScanParameters scan,
      List<ParameterRecord> records,
      List<ReconstructionWarning> warnings,
      long requiredRecBytes
  )
  {
    this.version = version;
    this.scan = scan;
    this.records = List.copyOf(records);
    this.warnings = List.copyOf(warnings);
    this.requiredRecBytes = requiredRecBytes;

    Map<ImageType, List<ParameterRecord>> byType = new EnumMap<>(ImageType.class);
    for (ParameterRecord record : this.records) {
      byType.computeIfAbsent(record.type(), t -> new ArrayList<>()).add(record);
    }
    Map<ImageType, List<ParameterRecord>> frozen = new EnumMap<>(ImageType.class);
    Map<ImageType, AxisExtents> extents = new EnumMap<>(ImageType.class);
    byType.forEach((type, list) -> {
      frozen.put(type, List.copyOf(list));
      commonResolution(list).ifPresent(common -> extents.put(type, computeExtents(list, common)));
    });
    this.recordsByType = Collections.unmodifiableMap(frozen);
    this.extentsByType = Collections.unmodifiableMap(extents);
    this.uniqueSliceCount = distinct(this.records, r -> r.key().slice());
  }

  /// Validate and normalize a raw header
  /// @param header
  ///     the parser output
  /// @return the validated model, with warnings for every skipped row or defaulted parameter
  public static ParameterModel fromHeader(RawHeader header) {
    List<ReconstructionWarning> warnings = new ArrayList<>();
    header.malformedRows().forEach(e -> warnings.add(ReconstructionWarning.of(e)));

    List<RawRecordRow> rows = header.rows();
    long[] offsets = new long[rows.size()];
    long required = layOut(rows, header.skippedRows(), offsets);

    RecordValidator validator = new RecordValidator(header.version());
    List<ParameterRecord> accepted = new ArrayList<>();
    Map<ImageKey, ParameterRecord> seen = new HashMap<>();
    for (int i = 0; i < rows.size(); i++) {
      try {
        ParameterRecord record = validator.validate(rows.get(i), i, offsets[i]);
        ParameterRecord previous = seen.putIfAbsent(record.key(), record);
        if (previous != null) {
          throw new InvalidParameterException("image key", i,
              "duplicates the slice/echo/dynamic/phase/type of record " + previous.recordIndex());
        }
        accepted.add(record);
      } catch (InvalidParameterException e) {
        logger.warn("excluding record: {}", e.getMessage());
        warnings.add(ReconstructionWarning.of(e));
      }
    }

    List<Quantity> echoTimes = new ArrayList<>();
    new TreeSet<>(accepted.stream().map(r -> r.echoTime().in(CanonicalUnits.TIME)).toList())
        .forEach(t -> echoTimes.add(Quantity.of(t, CanonicalUnits.TIME)));

    ScanParameters scan = new ScanParametersReader(header, warnings).read(echoTimes);
    logger.debug("accepted {} of {} image rows", accepted.size(), rows.size());
    return new ParameterModel(header.version(), scan, accepted, warnings, required);
  }

  /// One image stored in the REC buffer. {@code row} is the index into the well-formed rows, or
  /// -1 for an image described only by a skipped row.
  private record Slab(int row, long recIndex, long bytes) {
  }

  /// Fill in the byte offset of every well-formed row and return the total declared size.
  ///
  /// Offsets follow the REC index order of all rows whose REC index can be read. Rows that later
  /// fail validation still shift the images stored after them, and so do rows skipped for their
  /// column count when their REC index and geometry can be read leniently and their REC index is
  /// not already taken by a well-formed row. Every REC index below the highest well-formed one
  /// must be accounted for, otherwise the images after the gap cannot be located.
  /// @throws ParRecException
  ///     if a REC index before a well-formed row is missing or its size cannot be read
  private static long layOut(List<RawRecordRow> rows, List<RawRecordRow> skipped, long[] offsets) {
    List<Slab> slabs = new ArrayList<>();
    Set<Long> claimed = new HashSet<>();
    long highest = -1L;
    for (int i = 0; i < rows.size(); i++) {
      OptionalLong recIndex = RecordValidator.declaredRecIndex(rows.get(i));
      if (recIndex.isPresent()) {
        long index = recIndex.getAsLong();
        slabs.add(new Slab(i, index, RecordValidator.declaredBytes(rows.get(i))));
        claimed.add(index);
        highest = Math.max(highest, index);
      }
    }

    Map<Long, RawRecordRow> unsized = new TreeMap<>();
    for (RawRecordRow row : skipped) {
      OptionalLong recIndex = RecordValidator.declaredRecIndex(row);
      if (recIndex.isEmpty() || claimed.contains(recIndex.getAsLong())) {
        continue;
      }
      long bytes = RecordValidator.declaredBytes(row);
      if (bytes > 0) {
        slabs.add(new Slab(-1, recIndex.getAsLong(), bytes));
        claimed.add(recIndex.getAsLong());
      } else {
        unsized.putIfAbsent(recIndex.getAsLong(), row);
      }
    }

    slabs.sort(Comparator.comparingLong(Slab::recIndex)
        .thenComparingInt(s -> s.row() < 0 ? Integer.MAX_VALUE : s.row()));
    long expected = 0L;
    for (Slab slab : slabs) {
      if (slab.recIndex() > highest) {
        break;
      }
      if (slab.recIndex() > expected) {
        throw new ParRecException(gapMessage(expected, unsized));
      }
      expected = Math.max(expected, slab.recIndex() + 1);
    }

    long position = 0L;
    for (Slab slab : slabs) {
      if (slab.row() >= 0) {
        offsets[slab.row()] = position;
      } else {
        logger.debug("REC index {} belongs to a skipped row, reserving {} bytes", slab.recIndex(),
            slab.bytes());
      }
      position += slab.bytes();
    }
    return position;
  }

  private static String gapMessage(long recIndex, Map<Long, RawRecordRow> unsized) {
    RawRecordRow row = unsized.get(recIndex);
    if (row != null) {
      return "REC index " + recIndex + " on skipped line " + row.lineNumber()
             + " has no readable size, the images stored after it cannot be located";
    }
    return "no image row declares REC index " + recIndex
           + ", the images stored after it cannot be located";
  }

  private static AxisExtents computeExtents(List<ParameterRecord> records, Resolution common) {
    List<ParameterRecord> matching =
        records.stream().filter(r -> r.resolution().equals(common)).toList();
    return new AxisExtents(
        common,
        distinct(matching, r -> r.key().slice()),
        distinct(matching, r -> r.key().echo()),
        distinct(matching, r -> r.key().dynamic()),
        distinct(matching, r -> r.key().cardiacPhase())
    );
  }

  /// The resolution shared by more records than any other. When two or more resolutions tie for
  /// the highest count there is no common resolution.
  private static Optional<Resolution> commonResolution(List<ParameterRecord> records) {
    Map<Resolution, Integer> counts = new LinkedHashMap<>();
    records.forEach(r -> counts.merge(r.resolution(), 1, Integer::sum));
    Resolution best = null;
    int bestCount = 0;
    boolean tied = false;
    for (Map.Entry<Resolution, Integer> e : counts.entrySet()) {
      if (e.getValue() > bestCount) {
        best = e.getKey();
        bestCount = e.getValue();
        tied = false;
      } else if (e.getValue() == bestCount) {
        tied = true;
      }
    }
    return tied ? Optional.empty() : Optional.ofNullable(best);
  }

  private static int distinct(List<ParameterRecord> records, ToIntFunction<ParameterRecord> f) {
    return (int) records.stream().mapToInt(f).distinct().count();
  }

  /// @return the header format version
  public HeaderVersion version() {
    return version;
  }

  /// @return the scan-level parameters
  public ScanParameters scan() {
    return scan;
  }

  /// @return the accepted records in header order
  public List<ParameterRecord> records() {
    return records;
  }

  /// @return the malformed-row and invalid-parameter warnings raised while building this model
  public List<ReconstructionWarning> warnings() {
    return warnings;
  }

  /// @return the image types having at least one accepted record, in type code order
  public Set<ImageType> imageTypes() {
    return recordsByType.keySet();
  }

  /// @param type an image type
  /// @return the accepted records of that type in header order, empty if there are none
  public List<ParameterRecord> recordsOf(ImageType type) {
    return recordsByType.getOrDefault(type, List.of());
  }

  /// @param type an image type
  /// @return the extents of that type's array, empty if the type has no records or its records
  ///     share no common resolution
  public Optional<AxisExtents> extentsOf(ImageType type) {
    return Optional.ofNullable(extentsByType.get(type));
  }

  /// @return the number of distinct slice numbers across all accepted records
  public int uniqueSliceCount() {
    return uniqueSliceCount;
  }

  /// @return the total number of bytes the header's image rows declare for the REC buffer
  public long requiredRecBytes() {
    return requiredRecBytes;
  }

  /// @param recordIndex a record index
  /// @return the accepted record with that index, if any
  public Optional<ParameterRecord> record(int recordIndex) {
    return records.stream().filter(r -> r.recordIndex() == recordIndex).findFirst();
  }

  @Override
  public String toString() {
    return "ParameterModel{version=" + version + ", records=" + records.size() + ", types="
           + imageTypes() + ", warnings=" + warnings.size() + "}";
  }
}
