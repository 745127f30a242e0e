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

import io.github.pumpprobe.parameters.Parameter;
import io.github.pumpprobe.parameters.impl.SimpleParameterSet;
import io.github.pumpprobe.parameters.parametertypes.DoubleParameter;
import io.github.pumpprobe.parameters.parametertypes.IntegerParameter;
import io.github.pumpprobe.parameters.parametertypes.OptionalParameter;
import io.github.pumpprobe.parameters.parametertypes.RoiRectangleParameter;
import java.text.DecimalFormat;

public class RansacOutlierFilterParameters extends SimpleParameterSet {

  public static final IntegerParameter MIN_SAMPLES = new IntegerParameter("Minimum samples",
      "Number of shots drawn for each candidate line.", 2, 2, null);

  public static final IntegerParameter MAX_TRIALS = new IntegerParameter("Maximum trials",
      "Upper limit of random subsets that are tried.", 100, 1, null);

  public static final DoubleParameter STOP_PROBABILITY = new DoubleParameter("Stop probability",
      """
      Confidence that at least one outlier-free subset was drawn. The search ends early once the
      best consensus reaches it.
      """, new DecimalFormat("0.###"), 0.99, 0d, 1d);

  public static final OptionalParameter<DoubleParameter> RESIDUAL_THRESHOLD = new OptionalParameter<>(
      new DoubleParameter("Residual threshold",
          """
          Largest absolute residual of an inlier. If not set, the median absolute deviation of
          the shot intensities is used.
          """, new DecimalFormat("0.###E0"), 1d, 0d, null));

  public static final IntegerParameter RANDOM_SEED = new IntegerParameter("Random seed",
      "Seed of the subset sampler, fixed for reproducible results.", 0);

  public static final OptionalParameter<RoiRectangleParameter> ROI = new OptionalParameter<>(
      new RoiRectangleParameter("Intensity ROI",
          "Sum shot intensities inside this region (x1,y1,x2,y2) instead of the full frame."));

  public RansacOutlierFilterParameters() {
    super(new Parameter[]{MIN_SAMPLES, MAX_TRIALS, STOP_PROBABILITY, RESIDUAL_THRESHOLD,
        RANDOM_SEED, ROI});
  }
}
