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

import io.github.pumpprobe.parameters.Parameter;
import io.github.pumpprobe.parameters.experiment.ExperimentParameters;
import io.github.pumpprobe.parameters.impl.SimpleParameterSet;
import io.github.pumpprobe.parameters.parametertypes.ComboParameter;
import io.github.pumpprobe.parameters.parametertypes.IntegerParameter;
import io.github.pumpprobe.parameters.parametertypes.ParameterSetParameter;
import io.github.pumpprobe.parameters.parametertypes.RoiRectangleParameter;
import io.github.pumpprobe.parameters.parametertypes.filenames.FileNameParameter;
import io.github.pumpprobe.parameters.parametertypes.filenames.FileSelectionType;

public class RoiMomentParameters extends SimpleParameterSet {

  public static final FileNameParameter SCAN_ARCHIVE = new FileNameParameter("Scan archive",
      "Aggregated scan (.npz) with delay, pon and poff.", FileSelectionType.OPEN);

  public static final RoiRectangleParameter ROI = new RoiRectangleParameter("ROI",
      "Region of interest x1,y1,x2,y2 in pixels, end exclusive.");

  public static final ComboParameter<CentroidMethod> CENTROID_METHOD = new ComboParameter<>(
      "Centroid method", """
      Center of mass uses the intensity weighted pixel coordinates. Gaussian fit uses the fitted
      centers of the row and column sums and adds the fitted amplitude series.
      """, CentroidMethod.values(), CentroidMethod.CENTER_OF_MASS);

  public static final IntegerParameter GAUSS_MAX_ITERATIONS = new IntegerParameter(
      "Gaussian fit iterations", "Maximum iterations of one profile fit.",
      RoiMomentExtractor.DEFAULT_GAUSS_MAX_ITERATIONS, 10, null);

  public static final ParameterSetParameter<ExperimentParameters> EXPERIMENT = new ParameterSetParameter<>(
      "Experiment", "Detector geometry and beam energy for the momentum transfer conversion.",
      new ExperimentParameters());

  public static final FileNameParameter OUTPUT_FILE = new FileNameParameter("Output file",
      "CSV file for the moment series.", FileSelectionType.SAVE);

  public RoiMomentParameters() {
    super(new Parameter[]{SCAN_ARCHIVE, ROI, CENTROID_METHOD, GAUSS_MAX_ITERATIONS, EXPERIMENT,
        OUTPUT_FILE});
  }
}
