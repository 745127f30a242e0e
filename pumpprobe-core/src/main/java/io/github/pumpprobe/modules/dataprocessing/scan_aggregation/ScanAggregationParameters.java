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

package io.github.pumpprobe.modules.dataprocessing.scan_aggregation;

import io.github.pumpprobe.modules.dataanalysis.roi_moments.CentroidMethod;
import io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction.DarkSubtractionParameters;
import io.github.pumpprobe.modules.dataprocessing.corrections.CorrectionPipelines;
import io.github.pumpprobe.modules.dataprocessing.filter_linearconfidence.LinearConfidenceBandFilterParameters;
import io.github.pumpprobe.modules.dataprocessing.filter_ransac.RansacOutlierFilterParameters;
import io.github.pumpprobe.modules.io.export_scan.OutputFormat;
import io.github.pumpprobe.parameters.Parameter;
import io.github.pumpprobe.parameters.experiment.ExperimentParameters;
import io.github.pumpprobe.parameters.impl.SimpleParameterSet;
import io.github.pumpprobe.parameters.parametertypes.ComboParameter;
import io.github.pumpprobe.parameters.parametertypes.IntegerParameter;
import io.github.pumpprobe.parameters.parametertypes.OptionalParameter;
import io.github.pumpprobe.parameters.parametertypes.ParameterSetParameter;
import io.github.pumpprobe.parameters.parametertypes.RoiRectangleParameter;
import io.github.pumpprobe.parameters.parametertypes.StringParameter;
import io.github.pumpprobe.parameters.parametertypes.filenames.FileNameParameter;
import io.github.pumpprobe.parameters.parametertypes.filenames.FileSelectionType;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;

public class ScanAggregationParameters extends SimpleParameterSet {

  public static final FileNameParameter SCAN_DIRECTORY = new FileNameParameter("Scan directory",
      "Directory with one shot file per scan step.", FileSelectionType.DIRECTORY);

  public static final StringParameter FILE_EXTENSION = new StringParameter("File extension",
      "Extension of the shot files, without dot.", "npz");

  public static final StringParameter PIPELINES = new StringParameter("Pipelines",
      "Comma separated correction pipelines, one output per pipeline. Available: "
          + String.join(", ", CorrectionPipelines.getNames()), CorrectionPipelines.STANDARD);

  public static final IntegerParameter THREADS = new IntegerParameter("Worker threads",
      "Number of shot files processed in parallel.", 1, 1, null);

  public static final ParameterSetParameter<ExperimentParameters> EXPERIMENT = new ParameterSetParameter<>(
      "Experiment", "Hutch, detector, pump rate and geometry.", new ExperimentParameters());

  public static final ParameterSetParameter<DarkSubtractionParameters> DARK_SUBTRACTION = new ParameterSetParameter<>(
      "Dark subtraction", "Dark reference of the detector.", new DarkSubtractionParameters());

  public static final ParameterSetParameter<RansacOutlierFilterParameters> RANSAC = new ParameterSetParameter<>(
      "RANSAC filter", "Robust line fit of shot intensity over beam intensity.",
      new RansacOutlierFilterParameters());

  public static final ParameterSetParameter<LinearConfidenceBandFilterParameters> CONFIDENCE_BAND = new ParameterSetParameter<>(
      "Confidence band filter", "Least squares band of shot intensity over beam intensity.",
      new LinearConfidenceBandFilterParameters());

  public static final FileNameParameter OUTPUT_DIRECTORY = new FileNameParameter(
      "Output directory", "Directory for the scan archives.", FileSelectionType.SAVE);

  public static final StringParameter OUTPUT_BASE_NAME = new StringParameter("Output base name",
      "File name prefix of all outputs, e.g. run0012_scan0001.", "scan");

  public static final ComboParameter<OutputFormat> OUTPUT_FORMAT = new ComboParameter<>(
      "Output format", "Encoding of the aggregated scans.", OutputFormat.values(),
      OutputFormat.NPZ);

  public static final OptionalParameter<RoiRectangleParameter> MOMENT_ROI = new OptionalParameter<>(
      new RoiRectangleParameter("ROI moments",
          "If set, ROI intensity and centroid series (x1,y1,x2,y2) are written as CSV per pipeline."));

  public static final ComboParameter<CentroidMethod> CENTROID_METHOD = new ComboParameter<>(
      "Centroid method", "Centroid estimator for the ROI moments.", CentroidMethod.values(),
      CentroidMethod.CENTER_OF_MASS);

  public ScanAggregationParameters() {
    super(new Parameter[]{SCAN_DIRECTORY, FILE_EXTENSION, PIPELINES, THREADS, EXPERIMENT,
        DARK_SUBTRACTION, RANSAC, CONFIDENCE_BAND, OUTPUT_DIRECTORY, OUTPUT_BASE_NAME,
        OUTPUT_FORMAT, MOMENT_ROI, CENTROID_METHOD});
  }

  @Override
  public boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean valid = super.checkParameterValues(errorMessages);
    final String pipelines = getValue(PIPELINES);
    if (pipelines != null) {
      try {
        CorrectionPipelines.parseNames(pipelines);
      } catch (IllegalArgumentException e) {
        errorMessages.add(e.getMessage());
        valid = false;
      }
    }
    return valid;
  }
}
