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

package io.github.pumpprobe.util;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.jetbrains.annotations.NotNull;

public final class MathUtils {

  private MathUtils() {
  }

  /**
   * @return the median, NaN for an empty array
   */
  public static double median(double @NotNull [] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    return new Median().evaluate(values);
  }

  /**
   * Median absolute deviation from the median, without consistency scaling.
   */
  public static double medianAbsoluteDeviation(double @NotNull [] values) {
    final double median = median(values);
    final double[] deviations = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      deviations[i] = Math.abs(values[i] - median);
    }
    return median(deviations);
  }

  public static double mean(double @NotNull [] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    double sum = 0d;
    for (double v : values) {
      sum += v;
    }
    return sum / values.length;
  }

  public static int countTrue(boolean @NotNull [] mask) {
    int count = 0;
    for (boolean b : mask) {
      if (b) {
        count++;
      }
    }
    return count;
  }
}
