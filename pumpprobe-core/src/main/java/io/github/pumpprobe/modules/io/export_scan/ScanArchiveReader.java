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

package io.github.pumpprobe.modules.io.export_scan;

import io.github.pumpprobe.datamodel.ImageStack;
import io.github.pumpprobe.datamodel.ScanSeries;
import io.github.pumpprobe.util.io.npy.NpyArray;
import io.github.pumpprobe.util.io.npy.NpzArchive;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;

/**
 * Reads an archive written by {@link NpzScanSeriesWriter} back into a {@link ScanSeries}.
 * Negative pixels are set to zero, NaN frames of missing pump states are kept. The pipeline name
 * is taken from the file name.
 */
public class ScanArchiveReader {

  public @NotNull ScanSeries read(@NotNull Path file) throws IOException {
    final Map<String, NpyArray> arrays = NpzArchive.read(file);
    final double[] delays = require(arrays, file, ScanArchiveKeys.DELAY).toDoubleArray();
    final int steps = delays.length;
    final ImageStack pon = readImages(require(arrays, file, ScanArchiveKeys.PON), file, steps);
    final ImageStack poff = readImages(require(arrays, file, ScanArchiveKeys.POFF), file, steps);
    if (pon.getHeight() != poff.getHeight() || pon.getWidth() != poff.getWidth()) {
      throw new ScanArchiveFormatException(file, "pon and poff frame sizes differ");
    }
    final int[] indices = new int[steps];
    Arrays.setAll(indices, i -> i);
    final String name = file.getFileName().toString().replaceFirst("\\.npz$", "");
    return new ScanSeries(name, delays, indices, pon, poff,
        optionalVector(arrays, file, ScanArchiveKeys.PON_QBPM, steps),
        optionalVector(arrays, file, ScanArchiveKeys.POFF_QBPM, steps), List.of());
  }

  private static ImageStack readImages(NpyArray array, Path file, int steps)
      throws ScanArchiveFormatException {
    final int[] shape = array.getShape();
    if (shape.length != 3 || shape[0] != steps) {
      throw new ScanArchiveFormatException(file,
          "expected images of shape [" + steps + ",H,W] but got " + Arrays.toString(shape));
    }
    if (shape[1] == 0 || shape[2] == 0) {
      throw new ScanArchiveFormatException(file, "empty frames " + Arrays.toString(shape));
    }
    final float[] block = array.toFloatArray();
    for (int i = 0; i < block.length; i++) {
      if (block[i] < 0f) {
        block[i] = 0f;
      }
    }
    return ImageStack.fromBlock(block, shape[0], shape[1], shape[2]);
  }

  private static double[] optionalVector(Map<String, NpyArray> arrays, Path file, String key,
      int steps) throws ScanArchiveFormatException {
    final NpyArray array = arrays.get(key);
    if (array == null) {
      final double[] nan = new double[steps];
      Arrays.fill(nan, Double.NaN);
      return nan;
    }
    if (array.getNumberOfElements() != steps) {
      throw new ScanArchiveFormatException(file,
          key + " has " + array.getNumberOfElements() + " values, expected " + steps);
    }
    return array.toDoubleArray();
  }

  private static NpyArray require(Map<String, NpyArray> arrays, Path file, String key)
      throws ScanArchiveFormatException {
    final NpyArray array = arrays.get(key);
    if (array == null) {
      throw new ScanArchiveFormatException(file, "missing required entry '" + key + "'");
    }
    return array;
  }
}
