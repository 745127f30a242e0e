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

package io.github.pumpprobe.modules.dataprocessing.filter_ransac;

import io.github.pumpprobe.util.MathUtils;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Robust straight line fit y = slope * x + intercept by random sample consensus.
 * <p>
 * Each trial fits a least squares line through a random subset of {@code minSamples} points and
 * counts the points whose absolute residual is at most the threshold. The trial with most inliers
 * wins, ties go to the higher R² on the inliers. The number of trials shrinks once the inlier
 * fraction is large enough to reach the stop probability.
 */
public class RansacLineFit {

  private final int minSamples;
  private final int maxTrials;
  private final double stopProbability;
  private final @Nullable Double residualThreshold;
  private final long seed;

  /**
   * @param residualThreshold null to use the median absolute deviation of y
   */
  public RansacLineFit(int minSamples, int maxTrials, double stopProbability,
      @Nullable Double residualThreshold, long seed) {
    if (minSamples < 2) {
      throw new IllegalArgumentException("A line needs at least 2 samples, got " + minSamples);
    }
    this.minSamples = minSamples;
    this.maxTrials = maxTrials;
    this.stopProbability = stopProbability;
    this.residualThreshold = residualThreshold;
    this.seed = seed;
  }

  /**
   * @return the best consensus, or null if no trial produced a non-degenerate line
   */
  public @Nullable Result fit(double @NotNull [] x, double @NotNull [] y) {
    if (x.length != y.length) {
      throw new IllegalArgumentException("x and y differ in length");
    }
    final int n = x.length;
    if (n < minSamples) {
      return null;
    }
    final double threshold =
        residualThreshold != null ? residualThreshold : MathUtils.medianAbsoluteDeviation(y);
    final RandomDataGenerator random = new RandomDataGenerator(new Well19937c(seed));

    Result best = null;
    long trialLimit = maxTrials;
    for (int trial = 0; trial < trialLimit; trial++) {
      final int[] subset = random.nextPermutation(n, minSamples);
      final SimpleRegression regression = new SimpleRegression();
      for (int i : subset) {
        regression.addData(x[i], y[i]);
      }
      final double slope = regression.getSlope();
      final double intercept = regression.getIntercept();
      if (!Double.isFinite(slope) || !Double.isFinite(intercept)) {
        continue;
      }

      final boolean[] inliers = new boolean[n];
      int count = 0;
      for (int i = 0; i < n; i++) {
        if (Math.abs(y[i] - (slope * x[i] + intercept)) <= threshold) {
          inliers[i] = true;
          count++;
        }
      }
      if (best != null && count < best.inlierCount()) {
        continue;
      }
      final double score = rSquared(x, y, inliers, slope, intercept);
      if (best != null && count == best.inlierCount() && !(score > best.score())) {
        continue;
      }
      best = new Result(slope, intercept, threshold, inliers, count, score);
      if (count == n) {
        break;
      }
      trialLimit = Math.min(maxTrials, requiredTrials(count, n));
    }
    return best;
  }

  /**
   * Trials needed to draw one all-inlier subset with the stop probability.
   */
  long requiredTrials(int inliers, int n) {
    final double inlierRatio = (double) inliers / n;
    final double nom = 1d - stopProbability;
    final double denom = 1d - Math.pow(inlierRatio, minSamples);
    if (nom == 0d || denom == 1d) {
      return Long.MAX_VALUE;
    }
    if (denom == 0d) {
      return 1;
    }
    return (long) Math.abs(Math.ceil(Math.log(nom) / Math.log(denom)));
  }

  private static double rSquared(double[] x, double[] y, boolean[] mask, double slope,
      double intercept) {
    double sum = 0d;
    int count = 0;
    for (int i = 0; i < y.length; i++) {
      if (mask[i]) {
        sum += y[i];
        count++;
      }
    }
    final double mean = sum / count;
    double ssRes = 0d;
    double ssTot = 0d;
    for (int i = 0; i < y.length; i++) {
      if (mask[i]) {
        final double r = y[i] - (slope * x[i] + intercept);
        ssRes += r * r;
        ssTot += (y[i] - mean) * (y[i] - mean);
      }
    }
    if (ssTot == 0d) {
      return ssRes == 0d ? 1d : 0d;
    }
    return 1d - ssRes / ssTot;
  }

  public record Result(double slope, double intercept, double threshold, boolean[] inlierMask,
                       int inlierCount, double score) {

    @Override
    public String toString() {
      return "Result{slope=" + slope + ", intercept=" + intercept + ", threshold=" + threshold
          + ", inliers=" + inlierCount + "/" + inlierMask.length + ", score=" + score + "}";
    }
  }
}
