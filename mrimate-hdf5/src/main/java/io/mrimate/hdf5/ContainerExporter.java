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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.WritableGroup;
import io.mrimate.parrec.Reconstruction;
import io.mrimate.parrec.errors.ReconstructionWarning;
import io.mrimate.parrec.image.Axis;
import io.mrimate.parrec.image.ImageArray;
import io.mrimate.parrec.model.ImageType;
import io.mrimate.parrec.model.ParameterRecord;
import io.mrimate.parrec.model.ScanParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Writes a reconstruction to an HDF5 container, laid out as described by
/// {@link ContainerLayout}.
///
/// The container is first written to a temporary file beside the target, then moved onto the
/// target. A failed export removes the temporary file and leaves any existing target untouched.
public class ContainerExporter {
  private static final Logger logger = LogManager.getLogger(ContainerExporter.class);
  private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

  private final String tempPrefix;

  /// @param tempPrefix the file name prefix of temporary files
  public ContainerExporter(String tempPrefix) {
    this.tempPrefix = tempPrefix;
  }

  public ContainerExporter() {
    this(".mrimate-");
  }

  /// Export a reconstruction
  /// @param reconstruction
  ///     rescaled images and the parameters they came from
  /// @param target
  ///     the container to write
  /// @return the target
  /// @throws ExportException
  ///     if the container cannot be written
  public Path export(Reconstruction reconstruction, Path target) {
    return export(
        reconstruction.model().scan(),
        reconstruction.images(),
        reconstruction.warnings(),
        target
    );
  }

  /// Export rescaled images
  /// @param scan
  ///     the scan parameters, written as root attributes
  /// @param images
  ///     rescaled arrays by image type
  /// @param warnings
  ///     the warnings to record in the container
  /// @param target
  ///     the container to write
  /// @return the target
  /// @throws ExportException
  ///     if an array has not been rescaled or the container cannot be written
  public Path export(
      ScanParameters scan,
      Map<ImageType, ImageArray> images,
      List<ReconstructionWarning> warnings,
      Path target
  )
  {
    images.values().forEach(image -> {
      if (!image.isRescaled()) {
        throw new ExportException(image.type().label() + " images have not been rescaled");
      }
    });

    Path absolute = target.toAbsolutePath();
    Path temp = createTemp(absolute);
    try {
      try (WritableHdfFile hdf = HdfFile.write(temp)) {
        writeRoot(hdf, scan, warnings);
        for (ImageArray image : images.values()) {
          writeImage(hdf.putGroup(image.type().label()), image);
        }
      }
      relink(temp, absolute);
      logger.info("exported {} image type(s) to {}", images.size(), absolute);
      return target;
    } catch (RuntimeException | IOException e) {
      ExportException failure =
          new ExportException("unable to export " + absolute + ": " + e.getMessage(), e);
      try {
        Files.deleteIfExists(temp);
      } catch (IOException cleanup) {
        logger.warn("unable to remove temporary file {}: {}", temp, cleanup.getMessage());
        failure.addSuppressed(cleanup);
      }
      throw failure;
    }
  }

  private Path createTemp(Path target) {
    Path dir = target.getParent();
    try {
      if (dir != null) {
        Files.createDirectories(dir);
      }
      return Files.createTempFile(dir, tempPrefix, ".h5.tmp");
    } catch (IOException e) {
      throw new ExportException("unable to create a temporary file for " + target, e);
    }
  }

  private static void relink(Path from, Path to) throws IOException {
    try {
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      logger.debug("atomic move not supported for {}, moving in place", to);
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void writeRoot(WritableHdfFile hdf, ScanParameters scan,
      List<ReconstructionWarning> warnings)
  {
    hdf.putAttribute(ContainerLayout.FORMAT_VERSION_ATTR, ContainerLayout.FORMAT_VERSION);
    ScanAttributes.of(scan).forEach(hdf::putAttribute);
    if (!warnings.isEmpty()) {
      hdf.putAttribute(
          ContainerLayout.WARNINGS_ATTR,
          warnings.stream().map(ReconstructionWarning::toString).toArray(String[]::new)
      );
    }
    if (!scan.extras().isEmpty()) {
      writeHeader(hdf.putGroup(ContainerLayout.HEADER_GROUP), scan.extras());
    }
  }

  /// Header keys are not valid attribute names as they stand, so each is written under a
  /// sanitized name and the {@code index} attribute maps those names back to the keys as JSON.
  private void writeHeader(WritableGroup group, Map<String, String> extras) {
    Map<String, String> index = new LinkedHashMap<>();
    extras.forEach((key, value) -> {
      String base = ContainerLayout.attributeName(key);
      String name = base;
      for (int n = 2; index.containsKey(name) || name.equals(ContainerLayout.HEADER_INDEX_ATTR);
           n++) {
        name = base + "_" + n;
      }
      index.put(name, key);
      if (!value.isEmpty()) {
        group.putAttribute(name, value);
      }
    });
    group.putAttribute(ContainerLayout.HEADER_INDEX_ATTR, gson.toJson(index));
  }

  private void writeImage(WritableGroup group, ImageArray image) {
    group.putAttribute(
        ContainerLayout.AXES_ATTR,
        image.axes().stream().map(Axis::label).toArray(String[]::new)
    );
    group.putAttribute(ContainerLayout.UNIT_ATTR, image.unit().orElseThrow().label());
    group.putDataset(ContainerLayout.DATA, NdArrays.reshape(image.data(), image.shape()));
    for (Axis axis : List.of(Axis.SLICE, Axis.ECHO, Axis.DYNAMIC, Axis.CARDIAC_PHASE)) {
      group.putDataset(ContainerLayout.positionsName(axis), image.index(axis).rawValues());
    }
    List<ParameterRecord> records = new ArrayList<>(image.sources().values());
    if (!records.isEmpty()) {
      WritableGroup recordGroup = group.putGroup(ContainerLayout.RECORDS_GROUP);
      RecordTable.columns(records).forEach(recordGroup::putDataset);
    }
    logger.debug("wrote {} {}", image.type().label(), image);
  }
}
