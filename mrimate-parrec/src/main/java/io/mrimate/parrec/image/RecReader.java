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

import io.mrimate.parrec.errors.ParRecException;
import io.mrimate.parrec.errors.TruncatedDataException;
import io.mrimate.parrec.model.ParameterRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// Positional reader over a REC buffer. Each call reads exactly one record's samples, so memory
/// use is bounded by the largest image. Positional reads do not move the channel position and
/// may be issued from several threads at once.
public class RecReader implements AutoCloseable {

  private final Path path;
  private final FileChannel channel;

  /// @param path the REC file
  /// @throws UncheckedIOException if the file cannot be opened
  public RecReader(Path path) {
    this.path = path;
    try {
      this.channel = FileChannel.open(path, StandardOpenOption.READ);
    } catch (IOException e) {
      throw new UncheckedIOException("unable to open REC file " + path, e);
    }
  }

  /// @return the REC file being read
  public Path path() {
    return path;
  }

  /// @return the size of the REC file in bytes
  public long size() {
    try {
      return channel.size();
    } catch (IOException e) {
      throw new UncheckedIOException("unable to size REC file " + path, e);
    }
  }

  /// Read and decode one record's stored samples
  /// @param record
  ///     the record to read
  /// @return rows * columns stored values in REC order, which is row-major
  /// @throws TruncatedDataException
  ///     if the file ends before the record does
  public double[] read(ParameterRecord record) {
    int length = Math.toIntExact(record.byteLength());
    ByteBuffer buffer = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
    long position = record.byteOffset();
    try {
      while (buffer.hasRemaining()) {
        int read = channel.read(buffer, position);
        if (read < 0) {
          throw new TruncatedDataException(path, record.byteOffset() + length, position);
        }
        position += read;
      }
    } catch (IOException e) {
      throw new UncheckedIOException("error reading record " + record.recordIndex() + " from "
                                     + path, e);
    }
    buffer.flip();
    return decode(buffer, record.bitsPerSample());
  }

  /// Decode little-endian samples: 8 and 16 bit unsigned integers, 32 bit IEEE floats.
  /// @param buffer
  ///     a buffer positioned at the first sample
  /// @param bitsPerSample
  ///     the sample width
  /// @return the decoded values
  static double[] decode(ByteBuffer buffer, int bitsPerSample) {
    if (bitsPerSample != 8 && bitsPerSample != 16 && bitsPerSample != 32) {
      throw new ParRecException("unsupported sample width: " + bitsPerSample + " bits");
    }
    ByteBuffer le = buffer.order(ByteOrder.LITTLE_ENDIAN);
    int count = le.remaining() / (bitsPerSample / Byte.SIZE);
    double[] values = new double[count];
    switch (bitsPerSample) {
      case 8:
        for (int i = 0; i < count; i++) {
          values[i] = Byte.toUnsignedInt(le.get());
        }
        break;
      case 16:
        for (int i = 0; i < count; i++) {
          values[i] = Short.toUnsignedInt(le.getShort());
        }
        break;
      default:
        for (int i = 0; i < count; i++) {
          values[i] = le.getFloat();
        }
        break;
    }
    return values;
  }

  @Override
  public void close() {
    try {
      channel.close();
    } catch (IOException e) {
      throw new UncheckedIOException("error closing REC file " + path, e);
    }
  }
}
