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

package io.github.pumpprobe.modules.dataprocessing.filter_linearconfidence;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Least squares line with a band of {@code k} propagated standard errors:
 * {@code fit(x) +- k * sqrt((slopeErr * x)^2 + interceptErr^2)}.
 */
public record ConfidenceBand(double slope, double intercept, double slopeStdErr,
                             double interceptStdErr, double k) {

  /**
   * @return the band, or null if fewer than three points or the standard errors are undefined
   */
  public static @Nullable ConfidenceBand fit(double @NotNull [] x, double @NotNull [] y,
      double k) {
    if (x.length != y.length) {
      throw new IllegalArgumentException("x and y differ in length");
    }
    if (x.length < 3) {
      return null;
    }
    final SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < x.length; i++) {
      regression.addData(x[i], y[i]);
    }
    final ConfidenceBand band = new ConfidenceBand(regression.getSlope(),
        regression.getIntercept(), regression.getSlopeStdErr(),
        regression.getInterceptStdErr(), k);
    return band.isDefined() ? band : null;
  }

  public boolean isDefined() {
    return Double.isFinite(slope) && Double.isFinite(intercept) && Double.isFinite(slopeStdErr)
        && Double.isFinite(interceptStdErr);
  }

  public double fitted(double x) {
    return slope * x + intercept;
  }

  public double halfWidth(double x) {
    final double s = slopeStdErr * x;
    return k * Math.sqrt(s * s + interceptStdErr * interceptStdErr);
  }

  public double lower(double x) {
    return fitted(x) - halfWidth(x);
  }

  public double upper(double x) {
    return fitted(x) + halfWidth(x);
  }

  public boolean contains(double x, double y) {
    return y >= lower(x) && y <= upper(x);
  }
}
