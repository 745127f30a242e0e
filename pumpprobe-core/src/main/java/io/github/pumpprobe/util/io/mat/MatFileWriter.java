/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.pumpprobe.util.io.mat;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;

/**
 * Writes single precision arrays as Level 5 MAT-files (one variable per file, little endian).
 * <p>
 * MATLAB stores arrays in column-major order; the caller passes the values through an
 * {@link ElementSource} addressed by (row, col, page) and this writer takes care of the order.
 */
public final class MatFileWriter {

  private static final int MI_INT8 = 1;
  private static final int MI_INT32 = 5;
  private static final int MI_UINT32 = 6;
  private static final int MI_SINGLE = 7;
  private static final int MI_MATRIX = 14;
  private static final int MX_SINGLE_CLASS = 7;
  private static final int HEADER_TEXT_LENGTH = 116;

  private MatFileWriter() {
  }

  @FunctionalInterface
  public interface ElementSource {

    float get(int row, int col, int page);
  }

  /**
   * @param dims (rows, cols, pages), pages may be 1 for a 2D matrix
   */
  public static void writeSingle(@NotNull Path file, @NotNull String variableName, int rows,
      int cols, int pages, @NotNull ElementSource source) throws IOException {
    final int[] dims = pages == 1 ? new int[]{rows, cols} : new int[]{rows, cols, pages};
    final long elements = (long) rows * cols * pages;
    final byte[] nameBytes = variableName.getBytes(StandardCharsets.US_ASCII);

    final long flagsBytes = 8 + 8;
    final long dimsBytes = 8 + padded(4L * dims.length);
    final long nameElementBytes = 8 + padded(nameBytes.length);
    final long dataBytes = 8 + padded(4L * elements);
    final long matrixBytes = flagsBytes + dimsBytes + nameElementBytes + dataBytes;
    if (matrixBytes > 0xFFFFFFFFL) {
      throw new IOException("Array too large for a MAT v5 file: " + elements + " elements");
    }

    try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file), 1 << 16)) {
      out.write(header());

      final ByteBuffer meta = ByteBuffer.allocate((int) (8 + flagsBytes + dimsBytes
          + nameElementBytes + 8)).order(ByteOrder.LITTLE_ENDIAN);
      meta.putInt(MI_MATRIX).putInt((int) matrixBytes);
      // array flags
      meta.putInt(MI_UINT32).putInt(8).putInt(MX_SINGLE_CLASS).putInt(0);
      // dimensions
      meta.putInt(MI_INT32).putInt(4 * dims.length);
      for (int dim : dims) {
        meta.putInt(dim);
      }
      pad(meta, 4L * dims.length);
      // name
      meta.putInt(MI_INT8).putInt(nameBytes.length).put(nameBytes);
      pad(meta, nameBytes.length);
      // real part tag
      meta.putInt(MI_SINGLE).putInt((int) (4L * elements));
      out.write(meta.array());

      final ByteBuffer column = ByteBuffer.allocate(4 * rows).order(ByteOrder.LITTLE_ENDIAN);
      for (int page = 0; page < pages; page++) {
        for (int col = 0; col < cols; col++) {
          column.clear();
          for (int row = 0; row < rows; row++) {
            column.putFloat(source.get(row, col, page));
          }
          out.write(column.array(), 0, column.position());
        }
      }
      final int tail = (int) (padded(4L * elements) - 4L * elements);
      out.write(new byte[tail]);
    }
  }

  private static byte[] header() {
    final String text = String.format(Locale.US, "MATLAB 5.0 MAT-file, Platform: JAVA, Created on: %s",
        LocalDateTime.now().format(DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy",
            Locale.US)));
    final ByteBuffer header = ByteBuffer.allocate(128).order(ByteOrder.LITTLE_ENDIAN);
    final byte[] textBytes = text.getBytes(StandardCharsets.US_ASCII);
    for (int i = 0; i < HEADER_TEXT_LENGTH; i++) {
      header.put(i < textBytes.length ? textBytes[i] : (byte) ' ');
    }
    header.putLong(0L); // subsystem data offset
    header.putShort((short) 0x0100);
    header.put((byte) 'I').put((byte) 'M');
    return header.array();
  }

  private static long padded(long bytes) {
    return (bytes + 7) / 8 * 8;
  }

  private static void pad(ByteBuffer buffer, long written) {
    for (long i = written; i < padded(written); i++) {
      buffer.put((byte) 0);
    }
  }
}
