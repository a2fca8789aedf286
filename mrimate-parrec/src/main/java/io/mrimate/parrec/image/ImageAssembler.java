package io.mrimate.parrec.image;

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

import io.mrimate.parrec.errors.InconsistentGeometryException;
import io.mrimate.parrec.errors.ParRecException;
import io.mrimate.parrec.errors.ReconstructionWarning;
import io.mrimate.parrec.errors.TruncatedDataException;
import io.mrimate.parrec.errors.WarningKind;
import io.mrimate.parrec.model.AxisExtents;
import io.mrimate.parrec.model.ImageKey;
import io.mrimate.parrec.model.ImageType;
import io.mrimate.parrec.model.ParameterModel;
import io.mrimate.parrec.model.ParameterRecord;
import io.mrimate.parrec.model.Resolution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/// Reads a REC buffer into one {@link ImageArray} per image type.
///
/// Each image type is assembled by an independent task which owns its array. With more than one
/// thread the tasks run on a fixed pool and are collected as they complete; with one thread they
/// run inline on the caller's thread. Either way the result is the same.
///
/// Per type, records whose resolution differs from the common one are skipped with an
/// {@link InconsistentGeometryException} warning. A type left without records is dropped. Slabs
/// that no record covers keep {@link ImageArray#SENTINEL} and are reported once per type as an
/// irregular grid.
public class ImageAssembler {
  private static final Logger logger = LogManager.getLogger(ImageAssembler.class);

  private final int threads;
  private final boolean checkSize;

  /// @param threads
  ///     the number of assembly threads, 1 to assemble on the calling thread
  /// @param checkSize
  ///     whether the REC size is compared against the header before any read
  public ImageAssembler(int threads, boolean checkSize) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be positive, got " + threads);
    }
    this.threads = threads;
    this.checkSize = checkSize;
  }

  public ImageAssembler(int threads) {
    this(threads, true);
  }

  /// Assemble every image type of the model
  /// @param model
  ///     the validated parameters
  /// @param recFile
  ///     the REC buffer
  /// @return the filled arrays and any warnings
  /// @throws TruncatedDataException
  ///     if the REC buffer holds fewer bytes than the header declares
  /// @throws ParRecException
  ///     if the REC buffer cannot be read
  public AssemblyResult assemble(ParameterModel model, Path recFile) {
    try (RecReader reader = new RecReader(recFile)) {
      long available = reader.size();
      if (checkSize && available < model.requiredRecBytes()) {
        throw new TruncatedDataException(recFile, model.requiredRecBytes(), available);
      }
      List<TypeAssembly> tasks = new ArrayList<>();
      for (ImageType type : model.imageTypes()) {
        tasks.add(new TypeAssembly(type, model.recordsOf(type), model.extentsOf(type), reader::read));
      }
      logger.debug("assembling {} image types from {} on {} thread(s)",
          tasks.size(), recFile, Math.min(threads, Math.max(tasks.size(), 1)));
      Map<ImageType, TypeResult> results =
          (threads == 1 || tasks.size() < 2) ? runInline(tasks) : runPooled(tasks);
      return collect(results);
    } catch (UncheckedIOException e) {
      throw new ParRecException("unable to read REC file " + recFile + ": "
                                + e.getCause().getMessage(), e);
    }
  }

  private Map<ImageType, TypeResult> runInline(List<TypeAssembly> tasks) {
    Map<ImageType, TypeResult> results = new EnumMap<>(ImageType.class);
    for (TypeAssembly task : tasks) {
      TypeResult result = task.call();
      results.put(result.type(), result);
    }
    return results;
  }

  private Map<ImageType, TypeResult> runPooled(List<TypeAssembly> tasks) {
    ExecutorService pool = Executors.newFixedThreadPool(
        Math.min(threads, tasks.size()),
        new ThreadFactory() {
          private final AtomicInteger counter = new AtomicInteger(0);

          @Override
          public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "assembler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
          }
        }
    );
    try {
      CompletionService<TypeResult> completion = new ExecutorCompletionService<>(pool);
      tasks.forEach(completion::submit);
      Map<ImageType, TypeResult> results = new EnumMap<>(ImageType.class);
      for (int i = 0; i < tasks.size(); i++) {
        TypeResult result = completion.take().get();
        logger.trace("finished {} assembly", result.type().label());
        results.put(result.type(), result);
      }
      return results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ParRecException("interrupted while assembling images", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new ParRecException("image assembly failed: " + cause.getMessage(), cause);
    } finally {
      pool.shutdownNow();
    }
  }

  private static AssemblyResult collect(Map<ImageType, TypeResult> results) {
    Map<ImageType, ImageArray> images = new EnumMap<>(ImageType.class);
    List<ReconstructionWarning> warnings = new ArrayList<>();
    results.forEach((type, result) -> {
      result.image().ifPresent(image -> images.put(type, image));
      warnings.addAll(result.warnings());
    });
    warnings.forEach(w -> logger.warn("{}", w));
    return new AssemblyResult(images, warnings);
  }

  private record TypeResult(ImageType type, Optional<ImageArray> image,
      List<ReconstructionWarning> warnings)
  {
  }

  /// Assembly of one image type. Owns its array until it is returned.
  private static final class TypeAssembly implements Callable<TypeResult> {
    private final ImageType type;
    private final List<ParameterRecord> records;
    private final Optional<AxisExtents> extents;
    private final Function<ParameterRecord, double[]> samples;

    private TypeAssembly(
        ImageType type,
        List<ParameterRecord> records,
        Optional<AxisExtents> extents,
        Function<ParameterRecord, double[]> samples
    )
    {
      this.type = type;
      this.records = records;
      this.extents = extents;
      this.samples = samples;
    }

    @Override
    public TypeResult call() {
      List<ReconstructionWarning> warnings = new ArrayList<>();
      List<ParameterRecord> usable = new ArrayList<>();
      Resolution common = extents.map(AxisExtents::resolution).orElse(null);
      for (ParameterRecord record : records) {
        Resolution res = record.resolution();
        if (common != null && common.equals(res)) {
          usable.add(record);
        } else if (common != null) {
          warnings.add(ReconstructionWarning.of(new InconsistentGeometryException(
              type.label(), record.recordIndex(), common.rows(), common.columns(), res.rows(),
              res.columns())));
        } else {
          warnings.add(ReconstructionWarning.of(new InconsistentGeometryException(
              type.label(), record.recordIndex(), res.rows(), res.columns())));
        }
      }
      if (usable.isEmpty()) {
        warnings.add(ReconstructionWarning.of(WarningKind.DROPPED_IMAGE_TYPE,
            "dropped " + type.label() + " images: no records share a common resolution"));
        return new TypeResult(type, Optional.empty(), warnings);
      }

      AxisIndex slices = AxisIndex.of(usable.stream().map(r -> r.key().slice()).toList());
      AxisIndex echoes = AxisIndex.of(usable.stream().map(r -> r.key().echo()).toList());
      AxisIndex dynamics = AxisIndex.of(usable.stream().map(r -> r.key().dynamic()).toList());
      AxisIndex phases = AxisIndex.of(usable.stream().map(r -> r.key().cardiacPhase()).toList());
      ImageArray array = ImageArray.allocate(type, common, slices, echoes, dynamics, phases);

      for (ParameterRecord record : usable) {
        ImageKey key = record.key();
        SlabPosition position = new SlabPosition(
            slices.positionOf(key.slice()),
            echoes.positionOf(key.echo()),
            dynamics.positionOf(key.dynamic()),
            phases.positionOf(key.cardiacPhase())
        );
        array.fillSlab(position, record, samples.apply(record));
      }

      int missing = array.missingSlabCount();
      if (missing > 0) {
        warnings.add(ReconstructionWarning.of(WarningKind.IRREGULAR_GRID,
            type.label() + " grid is missing " + missing + " of " + array.slabCount()
            + " slabs; they are left unfilled"));
      }
      return new TypeResult(type, Optional.of(array), warnings);
    }
  }
}
