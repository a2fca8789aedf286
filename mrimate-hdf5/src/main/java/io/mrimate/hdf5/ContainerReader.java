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
import com.google.gson.reflect.TypeToken;
import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import io.mrimate.parrec.image.Axis;
import io.mrimate.parrec.image.AxisIndex;
import io.mrimate.parrec.image.ImageArray;
import io.mrimate.parrec.image.UnitTag;
import io.mrimate.parrec.model.ImageType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads a container written by {@link ContainerExporter}, rebuilding each image type's array
/// with its shape, axes, unit and values.
public class ContainerReader {
  private static final Logger logger = LogManager.getLogger(ContainerReader.class);
  private static final Type INDEX_TYPE = new TypeToken<Map<String, String>>() {
  }.getType();

  /// @param path
  ///     an exported container
  /// @return its content
  /// @throws ExportException
  ///     if the file is missing or not a valid container
  public ExportedContainer read(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ExportException("no such container: " + path);
    }
    try (HdfFile hdf = new HdfFile(path)) {
      Map<String, Object> attributes = new LinkedHashMap<>();
      hdf.getAttributes().forEach((name, attr) -> attributes.put(name, attr.getData()));
      Object version = attributes.remove(ContainerLayout.FORMAT_VERSION_ATTR);
      if (version == null) {
        throw new ExportException(path + " has no " + ContainerLayout.FORMAT_VERSION_ATTR
                                  + " attribute");
      }
      Object warnings = attributes.remove(ContainerLayout.WARNINGS_ATTR);

      Map<String, String> header = new LinkedHashMap<>();
      Map<ImageType, ImageArray> images = new EnumMap<>(ImageType.class);
      Map<ImageType, Map<String, Object>> records = new EnumMap<>(ImageType.class);
      for (Node child : hdf.getChildren().values()) {
        if (!(child instanceof Group group)) {
          logger.debug("ignoring root dataset {}", child.getName());
        } else if (group.getName().equals(ContainerLayout.HEADER_GROUP)) {
          header.putAll(readHeader(group));
        } else {
          ImageType type = ImageType.fromLabel(group.getName());
          images.put(type, readImage(type, group));
          Node recordNode = group.getChild(ContainerLayout.RECORDS_GROUP);
          if (recordNode instanceof Group recordGroup) {
            records.put(type, readColumns(recordGroup));
          }
        }
      }
      logger.debug("read {} image type(s) from {}", images.size(), path);
      return new ExportedContainer(
          String.valueOf(version),
          attributes,
          header,
          warnings == null ? List.of() : Arrays.asList((String[]) warnings),
          images,
          records
      );
    } catch (HdfException | IllegalArgumentException | ClassCastException e) {
      throw new ExportException("unable to read container " + path + ": " + e.getMessage(), e);
    }
  }

  private static Map<String, String> readHeader(Group group) {
    Map<String, Attribute> attrs = group.getAttributes();
    Attribute indexAttr = attrs.get(ContainerLayout.HEADER_INDEX_ATTR);
    if (indexAttr == null) {
      throw new ExportException("header group has no " + ContainerLayout.HEADER_INDEX_ATTR);
    }
    Map<String, String> index = new Gson().fromJson(indexAttr.getData().toString(), INDEX_TYPE);
    Map<String, String> header = new LinkedHashMap<>();
    index.forEach((name, key) -> {
      Attribute attr = attrs.get(name);
      header.put(key, attr == null ? "" : attr.getData().toString());
    });
    return header;
  }

  private static ImageArray readImage(ImageType type, Group group) {
    String[] axes = (String[]) requireAttribute(group, ContainerLayout.AXES_ATTR).getData();
    List<String> expected = new ArrayList<>();
    for (Axis axis : Axis.values()) {
      expected.add(axis.label());
    }
    if (!Arrays.asList(axes).equals(expected)) {
      throw new ExportException(
          group.getPath() + " has axes " + Arrays.toString(axes) + ", expected " + expected);
    }
    UnitTag unit = UnitTag.fromLabel(
        requireAttribute(group, ContainerLayout.UNIT_ATTR).getData().toString());

    Dataset data = requireDataset(group, ContainerLayout.DATA);
    int[] shape = data.getDimensions();
    double[] values = (double[]) data.getDataFlat();
    return ImageArray.restore(
        type,
        shape,
        values,
        unit,
        positions(group, Axis.SLICE),
        positions(group, Axis.ECHO),
        positions(group, Axis.DYNAMIC),
        positions(group, Axis.CARDIAC_PHASE)
    );
  }

  private static AxisIndex positions(Group group, Axis axis) {
    Dataset ds = requireDataset(group, ContainerLayout.positionsName(axis));
    return AxisIndex.of((int[]) ds.getData());
  }

  private static Map<String, Object> readColumns(Group group) {
    Map<String, Object> columns = new LinkedHashMap<>();
    group.getChildren().forEach((name, node) -> {
      if (node instanceof Dataset ds) {
        columns.put(name, ds.getData());
      }
    });
    return columns;
  }

  private static Attribute requireAttribute(Group group, String name) {
    Attribute attr = group.getAttribute(name);
    if (attr == null) {
      throw new ExportException(group.getPath() + " has no " + name + " attribute");
    }
    return attr;
  }

  private static Dataset requireDataset(Group group, String name) {
    Node node = group.getChild(name);
    if (!(node instanceof Dataset ds)) {
      throw new ExportException(group.getPath() + " has no " + name + " dataset");
    }
    return ds;
  }
}
