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

import io.github.pumpprobe.datamodel.RoiRectangle;
import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.modules.dataprocessing.corrections.ShotStackCorrection;
import io.github.pumpprobe.parameters.ParameterSet;
import io.github.pumpprobe.util.MathUtils;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps shots whose summed intensity lies inside the {@link ConfidenceBand} of a least squares
 * line over the beam monitor reading. Stacks too small for a band pass unchanged.
 */
public class LinearConfidenceBandFilter implements ShotStackCorrection {

  private static final Logger logger = Logger.getLogger(
      LinearConfidenceBandFilter.class.getName());

  private final double sigma;
  private final @Nullable RoiRectangle roi;

  public LinearConfidenceBandFilter(@NotNull ParameterSet parameters) {
    this(parameters.getValue(LinearConfidenceBandFilterParameters.SIGMA),
        parameters.getEmbeddedParameterValueIfSelectedOrElse(
            LinearConfidenceBandFilterParameters.ROI, null));
  }

  public LinearConfidenceBandFilter(double sigma, @Nullable RoiRectangle roi) {
    this.sigma = sigma;
    this.roi = roi;
  }

  @Override
  public @NotNull String getName() {
    return "linear_confidence_band_filter";
  }

  @Override
  public @NotNull ShotStack apply(@NotNull ShotStack shots) {
    final double[] x = shots.beamIntensity();
    final double[] y = shots.images().getTotalIntensities(roi);
    final ConfidenceBand band = ConfidenceBand.fit(x, y, sigma);
    if (band == null) {
      logger.fine(() -> "No confidence band for " + shots.size() + " shots, keeping all");
      return shots;
    }
    final boolean[] inside = new boolean[x.length];
    for (int i = 0; i < x.length; i++) {
      inside[i] = band.contains(x[i], y[i]);
    }
    final int kept = MathUtils.countTrue(inside);
    logger.fine(() -> "Confidence band kept " + kept + " of " + shots.size() + " shots");
    return kept == x.length ? shots : shots.select(inside);
  }
}
