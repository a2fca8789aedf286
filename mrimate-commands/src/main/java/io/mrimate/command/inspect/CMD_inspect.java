package io.mrimate.command.inspect;

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

import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import io.mrimate.hdf5.ContainerReader;
import io.mrimate.hdf5.ExportException;
import io.mrimate.hdf5.ExportedContainer;
import io.mrimate.parrec.image.Axis;
import io.mrimate.parrec.image.ImageArray;
import io.mrimate.parrec.image.UnitTag;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.lang.reflect.Array;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/// Show the content of an exported container
@CommandLine.Command(name = "inspect",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    description = "list the images, axes, units and scan attributes of an HDF5 container",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: no errors",
        "3: the container could not be read"
    })
public class CMD_inspect implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(CMD_inspect.class);

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(description = "The HDF5 container to inspect")
  private Path file;

  @CommandLine.Option(names = {"--tree"},
      description = "Walk every group and dataset instead of summarizing the images")
  private boolean tree;

  @Override
  public Integer call() {
    PrintWriter out = spec.commandLine().getOut();
    try {
      if (tree) {
        StringBuilder sb = new StringBuilder();
        try (HdfFile hdf = new HdfFile(file)) {
          walkHdf(hdf, sb, 0);
        }
        out.print(sb);
      } else {
        summarize(new ContainerReader().read(file), out);
      }
    } catch (ExportException | HdfException e) {
      logger.debug("unable to inspect {}", file, e);
      spec.commandLine().getErr().println("ERROR: " + e.getMessage());
      return 3;
    }
    out.flush();
    return 0;
  }

  private void summarize(ExportedContainer container, PrintWriter out) {
    out.printf("%s (format %s)%n", file, container.formatVersion());
    for (ImageArray image : container.images().values()) {
      out.printf("%s:%n", image.type().label());
      out.printf("  shape: %s%n", Arrays.toString(image.shape()));
      out.printf("  axes: %s%n",
          image.axes().stream().map(Axis::label).collect(Collectors.joining(", ")));
      out.printf("  unit: %s%n", image.unit().map(UnitTag::label).orElse("stored"));
      for (Axis axis : new Axis[]{Axis.SLICE, Axis.ECHO, Axis.DYNAMIC, Axis.CARDIAC_PHASE}) {
        out.printf("  %s positions: %s%n", axis.label(),
            Arrays.toString(image.index(axis).rawValues()));
      }
      Map<String, Object> records = container.records().get(image.type());
      if (records != null && !records.isEmpty()) {
        Object first = records.values().iterator().next();
        out.printf("  records: %d%n", Array.getLength(first));
      }
    }
    out.printf("attributes:%n");
    container.attributes().forEach((name, value) ->
        out.printf("  %s = %s%n", name, format(value)));
    if (!container.header().isEmpty()) {
      out.printf("header:%n");
      container.header().forEach((key, value) -> out.printf("  %s = %s%n", key, value));
    }
    if (!container.warnings().isEmpty()) {
      out.printf("warnings:%n");
      container.warnings().forEach(w -> out.printf("  %s%n", w));
    }
  }

  private void walkHdf(Node node, StringBuilder sb, int level) {
    sb.append(" ".repeat(level)).append(node.getName()).append(" (")
        .append(node.getClass().getSimpleName()).append(")\n");
    for (Map.Entry<String, Attribute> e : node.getAttributes().entrySet()) {
      sb.append(" ".repeat(level + 1)).append("@").append(e.getKey()).append(" = ")
          .append(format(e.getValue().getData())).append("\n");
    }
    if (node instanceof Dataset dataset) {
      sb.append(" ".repeat(level + 1)).append("dimensions: ")
          .append(Arrays.toString(dataset.getDimensions())).append(", type: ")
          .append(dataset.getJavaType().getSimpleName()).append("\n");
    } else if (node instanceof Group group) {
      for (Node childNode : group.getChildren().values()) {
        walkHdf(childNode, sb, level + 1);
      }
    }
  }

  /// Render an attribute value, which may be a scalar or a primitive or object array
  static String format(Object value) {
    if (value == null || !value.getClass().isArray()) {
      return String.valueOf(value);
    }
    StringJoiner joiner = new StringJoiner(", ", "[", "]");
    for (int i = 0; i < Array.getLength(value); i++) {
      joiner.add(format(Array.get(value, i)));
    }
    return joiner.toString();
  }
}
