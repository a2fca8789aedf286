package io.mrimate.command.describe;

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
import io.mrimate.command.common.VerbosityOption;
import io.mrimate.hdf5.ScanAttributes;
import io.mrimate.parrec.ParRecPipeline;
import io.mrimate.parrec.errors.ParRecException;
import io.mrimate.parrec.errors.ReconstructionWarning;
import io.mrimate.parrec.model.ExperimentSummary;
import io.mrimate.parrec.model.ImageType;
import io.mrimate.parrec.model.ParameterModel;
import io.mrimate.parrec.model.ParameterRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/// Describe the scan a PAR header belongs to, without reading its REC file
@CommandLine.Command(name = "describe",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    description = "print the experiment and scan details of a PAR header",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: no errors",
        "2: the header could not be read"
    })
public class CMD_describe implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(CMD_describe.class);
  private static final Gson gson = new GsonBuilder()
      .setPrettyPrinting()
      .serializeSpecialFloatingPointValues()
      .disableHtmlEscaping()
      .create();

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(description = "The PAR header to describe")
  private Path parFile;

  @CommandLine.Option(names = {"--json"},
      description = "Print the scan parameters as JSON instead of a summary")
  private boolean json;

  @CommandLine.Mixin
  private VerbosityOption verbosity = new VerbosityOption();

  @Override
  public Integer call() {
    verbosity.validate(spec);
    PrintWriter out = spec.commandLine().getOut();
    ParameterModel model;
    try {
      model = new ParRecPipeline().readModel(parFile);
    } catch (ParRecException e) {
      logger.debug("unable to describe {}", parFile, e);
      spec.commandLine().getErr().println("ERROR: " + e.getMessage());
      return 2;
    }

    if (json) {
      out.println(gson.toJson(toJson(model)));
    } else if (verbosity.showNormalOutput()) {
      out.print(ExperimentSummary.describe(model.scan()));
      out.printf("%nImages:%n");
      out.printf("  Header version: V%s%n", model.version().label());
      for (ImageType type : model.imageTypes()) {
        out.printf("  %s: %d records%s%n", type.label(), model.recordsOf(type).size(),
            model.extentsOf(type).map(e -> " " + Arrays.toString(e.shape()))
                .orElse(" (no common resolution)"));
      }
      if (verbosity.showVerbose()) {
        for (ParameterRecord record : model.records()) {
          out.printf("  record %d: %s %dbit offset %d%n", record.recordIndex(), record.key(),
              record.bitsPerSample(), record.byteOffset());
        }
      }
      if (!model.warnings().isEmpty()) {
        out.printf("%nWarnings: %d%n", model.warnings().size());
        if (verbosity.showVerbose()) {
          for (ReconstructionWarning warning : model.warnings()) {
            out.printf("  %s%n", warning);
          }
        }
      }
    }
    out.flush();
    return 0;
  }

  private static Map<String, Object> toJson(ParameterModel model) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("header_version", "V" + model.version().label());
    doc.put("scan", ScanAttributes.of(model.scan()));
    doc.put("header", model.scan().extras());
    Map<String, Integer> recordCounts = new LinkedHashMap<>();
    model.imageTypes().forEach(t -> recordCounts.put(t.label(), model.recordsOf(t).size()));
    doc.put("records", recordCounts);
    doc.put("warnings", model.warnings().stream().map(ReconstructionWarning::toString).toList());
    return doc;
  }
}
