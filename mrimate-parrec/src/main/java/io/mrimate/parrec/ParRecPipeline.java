package io.mrimate.parrec;

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

import io.mrimate.parrec.errors.ParRecException;
import io.mrimate.parrec.errors.ReconstructionFailedException;
import io.mrimate.parrec.errors.ReconstructionWarning;
import io.mrimate.parrec.header.HeaderParser;
import io.mrimate.parrec.header.RawHeader;
import io.mrimate.parrec.image.AssemblyResult;
import io.mrimate.parrec.image.ImageAssembler;
import io.mrimate.parrec.image.RescaleEngine;
import io.mrimate.parrec.model.ParameterModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Runs the reconstruction stages for one PAR/REC pair: header parsing, validation, image
/// assembly and rescaling.
///
/// Recoverable problems are gathered into {@link Reconstruction#warnings()}. A fatal problem ends
/// the run with a {@link ReconstructionFailedException} naming the file, with the original
/// exception as its cause.
public class ParRecPipeline {
  private static final Logger logger = LogManager.getLogger(ParRecPipeline.class);

  private final PipelineConfig config;

  public ParRecPipeline(PipelineConfig config) {
    this.config = config;
  }

  public ParRecPipeline() {
    this(PipelineConfig.defaults());
  }

  /// @return the settings this pipeline runs with
  public PipelineConfig config() {
    return config;
  }

  /// Reconstruct a PAR file and the REC file beside it
  /// @param parFile
  ///     the header
  /// @return the reconstructed images
  /// @throws ReconstructionFailedException
  ///     if the scan cannot be reconstructed
  public Reconstruction run(Path parFile) {
    return run(parFile, recPathFor(parFile));
  }

  /// Reconstruct a PAR/REC pair
  /// @param parFile
  ///     the header
  /// @param recFile
  ///     the binary image data
  /// @return the reconstructed images
  /// @throws ReconstructionFailedException
  ///     if the scan cannot be reconstructed
  public Reconstruction run(Path parFile, Path recFile) {
    try {
      return reconstruct(parFile, recFile);
    } catch (ReconstructionFailedException e) {
      throw e;
    } catch (ParRecException e) {
      logger.error("unable to reconstruct {}: {}", parFile, e.getMessage());
      throw new ReconstructionFailedException(parFile, e);
    }
  }

  /// Read and validate only the header of a PAR file
  /// @param parFile
  ///     the header
  /// @return the validated parameters
  /// @throws ReconstructionFailedException
  ///     if the header cannot be read
  public ParameterModel readModel(Path parFile) {
    try {
      return ParameterModel.fromHeader(new HeaderParser().parse(parFile));
    } catch (ParRecException e) {
      throw new ReconstructionFailedException(parFile, e);
    }
  }

  private Reconstruction reconstruct(Path parFile, Path recFile) {
    logger.info("reconstructing {} with {}", parFile, recFile);
    RawHeader header = new HeaderParser().parse(parFile);
    ParameterModel model = ParameterModel.fromHeader(header);
    logger.debug("{}", model);
    if (model.records().isEmpty()) {
      throw new ParRecException("no reconstructible records in " + header.rows().size()
                                + " image rows");
    }
    if (!Files.isRegularFile(recFile)) {
      throw new ParRecException("REC file " + recFile + " does not exist");
    }

    AssemblyResult assembled =
        new ImageAssembler(config.threads(), config.checkRecSize()).assemble(model, recFile);
    if (assembled.images().isEmpty()) {
      throw new ParRecException("no reconstructible records: every image type was dropped");
    }
    new RescaleEngine(model.scan()).rescaleAll(assembled.images());

    List<ReconstructionWarning> warnings = new ArrayList<>(model.warnings());
    warnings.addAll(assembled.warnings());
    logger.info("reconstructed {} image type(s) from {} with {} warning(s)",
        assembled.images().size(), parFile.getFileName(), warnings.size());
    return new Reconstruction(parFile, model, assembled.images(), warnings);
  }

  /// The REC file beside a PAR file: {@code .par} becomes {@code .rec} and {@code .PAR} becomes
  /// {@code .REC}. A mixed-case extension maps to lower case.
  /// @param parFile
  ///     the header
  /// @return the sibling REC file
  public static Path recPathFor(Path parFile) {
    String name = parFile.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String base = dot < 0 ? name : name.substring(0, dot);
    String ext = dot < 0 ? "" : name.substring(dot + 1);
    String recExt = ext.equals("PAR") ? "REC" : "rec";
    return parFile.resolveSibling(base + "." + recExt);
  }
}
