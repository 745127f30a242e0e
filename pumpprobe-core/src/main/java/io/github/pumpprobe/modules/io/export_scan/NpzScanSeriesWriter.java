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
import io.github.pumpprobe.util.io.npy.NpyArray;
import io.github.pumpprobe.util.io.npy.NpzArchive;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;

/**
 * Writes {@code <base>_<pipeline>.npz} with delay [S], pon and poff [S,H,W] and the mean beam
 * intensities pon_qbpm and poff_qbpm [S].
 */
public class NpzScanSeriesWriter implements ScanSeriesWriter {

  @Override
  public @NotNull List<Path> write(@NotNull ScanSeries series, @NotNull Path directory,
      @NotNull String baseName) throws IOException {
    Files.createDirectories(directory);
    final Path file = directory.resolve(ScanSeriesWriter.fileStem(series, baseName) + ".npz");
    final Map<String, NpyArray> arrays = new LinkedHashMap<>();
    arrays.put(ScanArchiveKeys.DELAY, NpyArray.ofDoubles(series.getDelays()));
    arrays.put(ScanArchiveKeys.PON, toArray(series.getPon()));
    arrays.put(ScanArchiveKeys.POFF, toArray(series.getPoff()));
    arrays.put(ScanArchiveKeys.PON_QBPM, NpyArray.ofDoubles(series.getBeamIntensity(PumpState.ON)));
    arrays.put(ScanArchiveKeys.POFF_QBPM,
        NpyArray.ofDoubles(series.getBeamIntensity(PumpState.OFF)));
    NpzArchive.write(file, arrays);
    return List.of(file);
  }

  private static NpyArray toArray(ImageStack stack) {
    return NpyArray.ofFloats(stack.toBlock(), stack.size(), stack.getHeight(), stack.getWidth());
  }
}
