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

import io.github.pumpprobe.datamodel.MomentSeries;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import org.jetbrains.annotations.NotNull;

/**
 * Writes a moment series as CSV, one row per delay. The first column is {@code delay}.
 */
public class MomentSeriesCsvWriter {

  public void write(@NotNull MomentSeries series, @NotNull Path file) throws IOException {
    final Map<String, double[]> columns = series.getColumns();
    final double[] delays = series.getDelays();
    final StringBuilder csv = new StringBuilder("delay");
    for (String name : columns.keySet()) {
      csv.append(',').append(name);
    }
    csv.append('\n');
    for (int i = 0; i < delays.length; i++) {
      csv.append(format(delays[i]));
      for (Entry<String, double[]> column : columns.entrySet()) {
        csv.append(',').append(format(column.getValue()[i]));
      }
      csv.append('\n');
    }
    final Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(file, csv.toString());
  }

  private static String format(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    return String.format(Locale.US, "%.9g", value);
  }
}
