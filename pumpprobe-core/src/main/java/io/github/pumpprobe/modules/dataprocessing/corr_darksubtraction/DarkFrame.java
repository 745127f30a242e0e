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

package io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction;

import io.github.pumpprobe.util.io.npy.NpyArray;
import io.github.pumpprobe.util.io.npy.NpyFormat;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Per-pixel detector background, row-major.
 */
public record DarkFrame(int height, int width, float @NotNull [] values) {

  public DarkFrame {
    if (values.length != height * width) {
      throw new IllegalArgumentException(
          "Dark frame has " + values.length + " values, expected " + height + "x" + width);
    }
  }

  public static @NotNull DarkFrame zeros(int height, int width) {
    return new DarkFrame(height, width, new float[height * width]);
  }

  /**
   * Reads a .npy dark reference. A [H,W] array is used as is, a [N,H,W] stack of dark shots is
   * averaged over its first axis.
   *
   * @throws MissingDarkFrameException if the file does not exist
   */
  public static @NotNull DarkFrame load(@NotNull Path file) throws IOException {
    final NpyArray array;
    try {
      array = NpyFormat.read(file);
    } catch (NoSuchFileException e) {
      throw new MissingDarkFrameException(file, e);
    }
    final int[] shape = array.getShape();
    final double[] data = array.toDoubleArray();
    if (shape.length == 2) {
      final float[] values = new float[data.length];
      for (int i = 0; i < data.length; i++) {
        values[i] = (float) data[i];
      }
      return new DarkFrame(shape[0], shape[1], values);
    }
    if (shape.length == 3 && shape[0] > 0) {
      final int pixels = shape[1] * shape[2];
      final double[] acc = new double[pixels];
      for (int n = 0; n < shape[0]; n++) {
        for (int p = 0; p < pixels; p++) {
          acc[p] += data[n * pixels + p];
        }
      }
      final float[] values = new float[pixels];
      for (int p = 0; p < pixels; p++) {
        values[p] = (float) (acc[p] / shape[0]);
      }
      return new DarkFrame(shape[1], shape[2], values);
    }
    throw new IOException(
        "Dark frame " + file + " must be 2D or a non-empty 3D stack, got shape " + Arrays.toString(
            shape));
  }
}
