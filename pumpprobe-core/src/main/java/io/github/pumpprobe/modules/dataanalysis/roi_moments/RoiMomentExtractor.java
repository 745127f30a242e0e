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

import io.github.pumpprobe.datamodel.ImageStack;
import io.github.pumpprobe.datamodel.MomentSeries;
import io.github.pumpprobe.datamodel.PumpState;
import io.github.pumpprobe.datamodel.RoiMoments;
import io.github.pumpprobe.datamodel.RoiRectangle;
import io.github.pumpprobe.datamodel.ScanSeries;
import io.github.pumpprobe.modules.dataprocessing.scan_aggregation.EmptyScanException;
import io.github.pumpprobe.parameters.ParameterSet;
import io.github.pumpprobe.parameters.experiment.ExperimentParameters;
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Computes per-step ROI intensity (mean pixel value) and centroid for both pump states of a scan
 * series. The centroid is the intensity weighted mean of the ROI-local pixel coordinates, or the
 * centers of Gaussian fits to the row and column sums. A frame whose ROI sums to zero has a NaN
 * centroid.
 */
public class RoiMomentExtractor {

  private static final Logger logger = Logger.getLogger(RoiMomentExtractor.class.getName());

  public static final int DEFAULT_GAUSS_MAX_ITERATIONS = 1000;

  private final RoiRectangle roi;
  private final double deltaQPerPixel;
  private final CentroidMethod method;
  private final GaussianProfileFit gaussianFit;

  public RoiMomentExtractor(@NotNull RoiRectangle roi, @NotNull ParameterSet experiment,
      @NotNull CentroidMethod method, int gaussMaxIterations) {
    this(roi, ExperimentParameters.deltaQPerPixel(experiment), method, gaussMaxIterations);
  }

  public RoiMomentExtractor(@NotNull RoiRectangle roi, double deltaQPerPixel,
      @NotNull CentroidMethod method, int gaussMaxIterations) {
    this.roi = roi;
    this.deltaQPerPixel = deltaQPerPixel;
    this.method = method;
    this.gaussianFit = new GaussianProfileFit(gaussMaxIterations);
  }

  public RoiMomentExtractor(@NotNull RoiRectangle roi, double deltaQPerPixel) {
    this(roi, deltaQPerPixel, CentroidMethod.CENTER_OF_MASS, DEFAULT_GAUSS_MAX_ITERATIONS);
  }

  /**
   * @throws EmptyScanException       if the series has no step to normalize against
   * @throws IllegalArgumentException if the ROI does not fit into the frames
   */
  public @NotNull MomentSeries extract(@NotNull ScanSeries series) {
    if (series.isEmpty()) {
      throw new EmptyScanException("Cannot extract ROI moments from an empty scan series");
    }
    final ImageStack pon = series.getPon();
    if (!roi.fitsInto(pon.getHeight(), pon.getWidth())) {
      throw new IllegalArgumentException(
          "ROI " + roi.format() + " does not fit into frames of " + pon.getHeight() + "x"
              + pon.getWidth());
    }
    final Map<PumpState, RoiMoments> moments = new EnumMap<>(PumpState.class);
    final Map<PumpState, double[]> amplitudes = new EnumMap<>(PumpState.class);
    for (PumpState state : PumpState.values()) {
      final ImageStack images = series.getImages(state);
      if (method == CentroidMethod.GAUSSIAN_FIT) {
        final double[] amplitude = new double[images.size()];
        moments.put(state, gaussianMoments(images, amplitude));
        amplitudes.put(state, amplitude);
      } else {
        moments.put(state, centerOfMass(images));
      }
      warnIfAnchorUndefined(series, state, moments.get(state));
    }
    logger.fine(() -> "Extracted ROI " + roi.format() + " moments of " + series.size()
        + " steps with " + method);
    return new MomentSeries(series.getDelays(), moments, amplitudes, deltaQPerPixel);
  }

  /**
   * The first step normalizes the whole series. Without a usable first value every normalized
   * value of that pump state is undefined.
   */
  private void warnIfAnchorUndefined(ScanSeries series, PumpState state, RoiMoments raw) {
    final double intensity = raw.intensity()[0];
    final double x = raw.centroidX()[0];
    final double y = raw.centroidY()[0];
    if (Double.isFinite(intensity) && intensity != 0d && Double.isFinite(x)
        && Double.isFinite(y)) {
      return;
    }
    logger.warning(() -> String.format(
        "%s: %s of the first step (delay %s) has ROI intensity %s and centroid (%s, %s), the "
            + "normalized %s series is undefined", series.getPipelineName(), state.getKey(),
        series.getDelays()[0], intensity, x, y, state.getKey()));
  }

  public @NotNull RoiMoments centerOfMass(@NotNull ImageStack images) {
    final int h = roi.height();
    final int w = roi.width();
    final int n = images.size();
    final double[] intensity = new double[n];
    final double[] comX = new double[n];
    final double[] comY = new double[n];
    for (int i = 0; i < n; i++) {
      final float[] frame = roi.slice(images.getFrame(i), images.getHeight(), images.getWidth());
      double sum = 0d;
      double sumX = 0d;
      double sumY = 0d;
      for (int row = 0; row < h; row++) {
        for (int col = 0; col < w; col++) {
          final double v = frame[row * w + col];
          sum += v;
          sumX += v * col;
          sumY += v * row;
        }
      }
      intensity[i] = sum / frame.length;
      comX[i] = sum == 0d ? Double.NaN : sumX / sum;
      comY[i] = sum == 0d ? Double.NaN : sumY / sum;
    }
    return new RoiMoments(intensity, comX, comY);
  }

  private RoiMoments gaussianMoments(ImageStack images, double[] amplitudeOut) {
    final int h = roi.height();
    final int w = roi.width();
    final int n = images.size();
    final double[] intensity = new double[n];
    final double[] centerX = new double[n];
    final double[] centerY = new double[n];
    for (int i = 0; i < n; i++) {
      final float[] frame = roi.slice(images.getFrame(i), images.getHeight(), images.getWidth());
      double sum = 0d;
      for (float v : frame) {
        sum += v;
      }
      intensity[i] = sum / frame.length;
      final GaussianProfileFit.FrameFit fit = gaussianFit.fit(frame, h, w);
      amplitudeOut[i] = fit.amplitude();
      centerX[i] = fit.centerX();
      centerY[i] = fit.centerY();
    }
    return new RoiMoments(intensity, centerX, centerY);
  }
}
