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

package io.github.pumpprobe.modules.dataanalysis.roi_moments;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.GaussianCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.jetbrains.annotations.NotNull;

/**
 * Fits {@code a * exp(-(x - mu)^2 / (2 sigma^2))} to the column sums and row sums of an ROI
 * frame. A profile that does not converge yields NaN parameters.
 */
public class GaussianProfileFit {

  private static final Logger logger = Logger.getLogger(GaussianProfileFit.class.getName());

  private final int maxIterations;

  public GaussianProfileFit(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  /**
   * @param roiFrame row-major ROI pixels
   */
  public @NotNull FrameFit fit(float @NotNull [] roiFrame, int height, int width) {
    final double[] xProfile = new double[width];
    final double[] yProfile = new double[height];
    for (int row = 0; row < height; row++) {
      for (int col = 0; col < width; col++) {
        final float v = roiFrame[row * width + col];
        xProfile[col] += v;
        yProfile[row] += v;
      }
    }
    final Profile x = fitProfile(xProfile);
    final Profile y = fitProfile(yProfile);
    return new FrameFit(Math.sqrt(x.amplitude() * y.amplitude()), x.center(), y.center(),
        x.sigma(), y.sigma());
  }

  @NotNull Profile fitProfile(double @NotNull [] profile) {
    final WeightedObservedPoints points = new WeightedObservedPoints();
    for (int i = 0; i < profile.length; i++) {
      if (!Double.isFinite(profile[i])) {
        return Profile.FAILED;
      }
      points.add(i, profile[i]);
    }
    try {
      final double[] p = GaussianCurveFitter.create().withMaxIterations(maxIterations)
          .fit(points.toList());
      if (!Double.isFinite(p[0]) || !Double.isFinite(p[1]) || !Double.isFinite(p[2])) {
        return Profile.FAILED;
      }
      return new Profile(p[0], p[1], Math.abs(p[2]));
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      logger.log(Level.FINE, "Gaussian fit failed: " + e.getMessage(), e);
      return Profile.FAILED;
    }
  }

  record Profile(double amplitude, double center, double sigma) {

    static final Profile FAILED = new Profile(Double.NaN, Double.NaN, Double.NaN);
  }

  /**
   * @param amplitude geometric mean of the x and y profile amplitudes
   * @param centerX   fitted center in ROI column coordinates
   * @param centerY   fitted center in ROI row coordinates
   */
  public record FrameFit(double amplitude, double centerX, double centerY, double sigmaX,
                         double sigmaY) {

  }
}
