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
import io.github.pumpprobe.datamodel.PumpState;
import io.github.pumpprobe.datamodel.ScanSeries;
import io.github.pumpprobe.util.io.mat.MatFileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Writes one MAT file per pump state, {@code <base>_<pipeline>_pon.mat} and
 * {@code <base>_<pipeline>_poff.mat}, each holding the variable {@code data} with axes
 * (row, column, step).
 */
public class MatScanSeriesWriter implements ScanSeriesWriter {

  public static final String VARIABLE_NAME = "data";

  @Override
  public @NotNull List<Path> write(@NotNull ScanSeries series, @NotNull Path directory,
      @NotNull String baseName) throws IOException {
    Files.createDirectories(directory);
    final List<Path> files = new ArrayList<>(2);
    for (PumpState state : PumpState.values()) {
      final Path file = directory.resolve(
          ScanSeriesWriter.fileStem(series, baseName) + "_" + state.getKey() + ".mat");
      final ImageStack images = series.getImages(state);
      MatFileWriter.writeSingle(file, VARIABLE_NAME, images.getHeight(), images.getWidth(),
          images.size(), (row, col, step) -> images.getValue(step, row, col));
      files.add(file);
    }
    return files;
  }
}
