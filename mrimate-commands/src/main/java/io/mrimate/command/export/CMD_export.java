package io.mrimate.command.export;

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

import io.mrimate.command.common.ParallelExecutionOption;
import io.mrimate.command.common.VerbosityOption;
import io.mrimate.hdf5.ContainerExporter;
import io.mrimate.hdf5.ExportException;
import io.mrimate.parrec.ParRecPipeline;
import io.mrimate.parrec.PipelineConfig;
import io.mrimate.parrec.Reconstruction;
import io.mrimate.parrec.errors.ParRecException;
import io.mrimate.parrec.errors.ReconstructionWarning;
import io.mrimate.parrec.image.ImageArray;
import io.mrimate.parrec.image.UnitTag;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.Callable;

/// Reconstruct a PAR/REC pair and export it to an HDF5 container
@CommandLine.Command(name = "export",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    description = "reconstruct a PAR/REC scan and write it to an HDF5 container",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: no errors",
        "1: invalid configuration",
        "2: the scan could not be reconstructed",
        "3: the container could not be written"
    })
public class CMD_export implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(CMD_export.class);

  /// exit code for a configuration file that cannot be used
  public static final int EXIT_CONFIG = 1;
  /// exit code for a scan that cannot be reconstructed
  public static final int EXIT_SCAN = 2;
  /// exit code for a container that cannot be written
  public static final int EXIT_EXPORT = 3;

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(description = "The PAR header of the scan")
  private Path parFile;

  @CommandLine.Option(names = {"-o", "--output"},
      description = "The container to write (default: the PAR file name with a .h5 extension)")
  private Path output;

  @CommandLine.Option(names = {"--rec"},
      description = "The REC file (default: beside the PAR file)")
  private Path recFile;

  @CommandLine.Option(names = {"--config"},
      description = "A YAML or JSON pipeline configuration file")
  private Path configFile;

  @CommandLine.Mixin
  private ParallelExecutionOption parallel = new ParallelExecutionOption();

  @CommandLine.Mixin
  private VerbosityOption verbosity = new VerbosityOption();

  @Override
  public Integer call() {
    verbosity.validate(spec);
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();

    PipelineConfig config;
    try {
      config = configFile == null ? PipelineConfig.defaults() : PipelineConfig.load(configFile);
      config = parallel.getRequestedThreads().map(config::withThreads).orElse(config);
    } catch (ParRecException | IllegalArgumentException e) {
      logger.debug("invalid configuration", e);
      err.println("ERROR: " + e.getMessage());
      return EXIT_CONFIG;
    }

    Path rec = recFile != null ? recFile : ParRecPipeline.recPathFor(parFile);
    Path target = output != null ? output : defaultOutput(parFile);
    Reconstruction reconstruction;
    try {
      reconstruction = new ParRecPipeline(config).run(parFile, rec);
    } catch (ParRecException e) {
      logger.debug("reconstruction failed", e);
      err.println("ERROR: " + e.getMessage());
      return EXIT_SCAN;
    }

    if (verbosity.showNormalOutput()) {
      for (ReconstructionWarning warning : reconstruction.warnings()) {
        err.println("WARNING: " + warning);
      }
    }

    try {
      new ContainerExporter(config.exportTempPrefix()).export(reconstruction, target);
    } catch (ExportException e) {
      logger.debug("export failed", e);
      err.println("ERROR: " + e.getMessage());
      return EXIT_EXPORT;
    }

    if (verbosity.showNormalOutput()) {
      out.printf("wrote %s%n", target);
      if (verbosity.showVerbose()) {
        for (ImageArray image : reconstruction.images().values()) {
          out.printf("  %s %s %s%n", image.type().label(), Arrays.toString(image.shape()),
              image.unit().map(UnitTag::label).orElse("stored"));
        }
      }
    }
    out.flush();
    err.flush();
    return 0;
  }

  /// @param parFile a PAR file
  /// @return the same name with an {@code .h5} extension, beside it
  static Path defaultOutput(Path parFile) {
    String name = parFile.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return parFile.resolveSibling((dot < 0 ? name : name.substring(0, dot)) + ".h5");
  }
}
