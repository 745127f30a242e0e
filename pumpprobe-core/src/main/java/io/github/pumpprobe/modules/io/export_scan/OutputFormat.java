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

import java.util.List;
import org.jetbrains.annotations.NotNull;

public enum OutputFormat {
  NPZ("npz"), MAT("mat"), NPZ_AND_MAT("npz + mat");

  private final String label;

  OutputFormat(String label) {
    this.label = label;
  }

  public @NotNull List<ScanSeriesWriter> createWriters() {
    return switch (this) {
      case NPZ -> List.of(new NpzScanSeriesWriter());
      case MAT -> List.of(new MatScanSeriesWriter());
      case NPZ_AND_MAT -> List.of(new NpzScanSeriesWriter(), new MatScanSeriesWriter());
    };
  }

  @Override
  public String toString() {
    return label;
  }
}
