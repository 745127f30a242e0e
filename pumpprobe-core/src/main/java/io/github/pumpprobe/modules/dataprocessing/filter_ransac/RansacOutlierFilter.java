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

import io.github.pumpprobe.datamodel.RoiRectangle;
import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.modules.dataprocessing.corrections.ShotStackCorrection;
import io.github.pumpprobe.modules.dataprocessing.filter_ransac.RansacLineFit.Result;
import io.github.pumpprobe.parameters.ParameterSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps the shots whose summed intensity follows a robust line over the beam monitor reading.
 * Shot counts up to the minimum sample size pass unchanged, as does a stack where no consensus
 * line was found.
 */
public class RansacOutlierFilter implements ShotStackCorrection {

  private static final Logger logger = Logger.getLogger(RansacOutlierFilter.class.getName());

  private final RansacLineFit lineFit;
  private final int minSamples;
  private final @Nullable RoiRectangle roi;

  public RansacOutlierFilter() {
    this(new RansacOutlierFilterParameters());
  }

  public RansacOutlierFilter(@NotNull ParameterSet parameters) {
    this(parameters.getValue(RansacOutlierFilterParameters.MIN_SAMPLES),
        parameters.getValue(RansacOutlierFilterParameters.MAX_TRIALS),
        parameters.getValue(RansacOutlierFilterParameters.STOP_PROBABILITY),
        parameters.getEmbeddedParameterValueIfSelectedOrElse(
            RansacOutlierFilterParameters.RESIDUAL_THRESHOLD, null),
        parameters.getValue(RansacOutlierFilterParameters.RANDOM_SEED),
        parameters.getEmbeddedParameterValueIfSelectedOrElse(RansacOutlierFilterParameters.ROI,
            null));
  }

  public RansacOutlierFilter(int minSamples, int maxTrials, double stopProbability,
      @Nullable Double residualThreshold, long seed, @Nullable RoiRectangle roi) {
    this.lineFit = new RansacLineFit(minSamples, maxTrials, stopProbability, residualThreshold,
        seed);
    this.minSamples = minSamples;
    this.roi = roi;
  }

  @Override
  public @NotNull String getName() {
    return "ransac_outlier_filter";
  }

  @Override
  public @NotNull ShotStack apply(@NotNull ShotStack shots) {
    if (shots.size() <= minSamples) {
      return shots;
    }
    final double[] intensities = shots.images().getTotalIntensities(roi);
    final Result result = lineFit.fit(shots.beamIntensity(), intensities);
    if (result == null) {
      logger.log(Level.WARNING,
          "No RANSAC consensus found for " + shots.size() + " shots, keeping all");
      return shots;
    }
    logger.fine(() -> "RANSAC kept " + result.inlierCount() + " of " + shots.size() + " shots");
    return shots.select(result.inlierMask());
  }
}
