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

package io.github.pumpprobe.datamodel;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * The result of one correction pipeline over a scan directory: one pump-on and one pump-off mean
 * frame per kept scan step, in file index order. A step that kept only one pump state carries a NaN
 * frame for the other so that delay, pon and poff stay aligned.
 */
public final class ScanSeries {

  private final String pipelineName;
  private final double[] delays;
  private final int[] fileIndices;
  private final ImageStack pon;
  private final ImageStack poff;
  private final double[] ponBeamIntensity;
  private final double[] poffBeamIntensity;
  private final List<DroppedScanStep> droppedSteps;

  public ScanSeries(@NotNull String pipelineName, double @NotNull [] delays,
      int @NotNull [] fileIndices, @NotNull ImageStack pon, @NotNull ImageStack poff,
      double @NotNull [] ponBeamIntensity, double @NotNull [] poffBeamIntensity,
      @NotNull List<DroppedScanStep> droppedSteps) {
    final int s = delays.length;
    if (fileIndices.length != s || pon.size() != s || poff.size() != s
        || ponBeamIntensity.length != s || poffBeamIntensity.length != s) {
      throw new IllegalArgumentException("Scan series arrays are not aligned to " + s + " steps");
    }
    if (pon.getHeight() != poff.getHeight() || pon.getWidth() != poff.getWidth()) {
      throw new IllegalArgumentException("pon and poff frame sizes differ");
    }
    this.pipelineName = pipelineName;
    this.delays = delays;
    this.fileIndices = fileIndices;
    this.pon = pon;
    this.poff = poff;
    this.ponBeamIntensity = ponBeamIntensity;
    this.poffBeamIntensity = poffBeamIntensity;
    this.droppedSteps = List.copyOf(droppedSteps);
  }

  /**
   * Stacks reduced steps. All steps must have the same frame size.
   */
  public static @NotNull ScanSeries stack(@NotNull String pipelineName,
      @NotNull List<ScanStep> steps, @NotNull List<DroppedScanStep> droppedSteps) {
    if (steps.isEmpty()) {
      throw new IllegalArgumentException("Cannot stack an empty list of scan steps");
    }
    final int height = steps.get(0).height();
    final int width = steps.get(0).width();
    final int s = steps.size();
    final double[] delays = new double[s];
    final int[] indices = new int[s];
    final float[][] pon = new float[s][];
    final float[][] poff = new float[s][];
    final double[] ponBeam = new double[s];
    final double[] poffBeam = new double[s];
    for (int i = 0; i < s; i++) {
      final ScanStep step = steps.get(i);
      delays[i] = step.delay();
      indices[i] = step.fileIndex();
      pon[i] = step.pon() != null ? step.pon() : nanFrame(height * width);
      poff[i] = step.poff() != null ? step.poff() : nanFrame(height * width);
      ponBeam[i] = step.ponBeamIntensity();
      poffBeam[i] = step.poffBeamIntensity();
    }
    return new ScanSeries(pipelineName, delays, indices, new ImageStack(height, width, pon),
        new ImageStack(height, width, poff), ponBeam, poffBeam, droppedSteps);
  }

  private static float[] nanFrame(int pixels) {
    final float[] frame = new float[pixels];
    Arrays.fill(frame, Float.NaN);
    return frame;
  }

  public @NotNull String getPipelineName() {
    return pipelineName;
  }

  public int size() {
    return delays.length;
  }

  public boolean isEmpty() {
    return delays.length == 0;
  }

  public double @NotNull [] getDelays() {
    return delays.clone();
  }

  public int @NotNull [] getFileIndices() {
    return fileIndices.clone();
  }

  public @NotNull ImageStack getPon() {
    return pon;
  }

  public @NotNull ImageStack getPoff() {
    return poff;
  }

  public @NotNull ImageStack getImages(@NotNull PumpState state) {
    return state == PumpState.ON ? pon : poff;
  }

  public double @NotNull [] getBeamIntensity(@NotNull PumpState state) {
    return (state == PumpState.ON ? ponBeamIntensity : poffBeamIntensity).clone();
  }

  /**
   * @return files that did not yield a scan step, in file index order
   */
  public @NotNull List<DroppedScanStep> getDroppedSteps() {
    return droppedSteps;
  }

  /**
   * Delays of the dropped steps that could still be read. Steps that failed to load have no known
   * delay and are only reported through {@link #getDroppedSteps()}.
   */
  public double @NotNull [] getDroppedDelays() {
    return droppedSteps.stream().mapToDouble(DroppedScanStep::delay).filter(d -> !Double.isNaN(d))
        .toArray();
  }

  public @NotNull List<Path> getDroppedFiles() {
    final List<Path> files = new ArrayList<>(droppedSteps.size());
    for (DroppedScanStep step : droppedSteps) {
      files.add(step.source());
    }
    return files;
  }

  /**
   * Pump-on minus pump-off per step, floored at zero.
   */
  public @NotNull ImageStack getPonMinusPoff() {
    final float[][] diff = new float[size()][];
    for (int i = 0; i < size(); i++) {
      final float[] a = pon.getFrame(i);
      final float[] b = poff.getFrame(i);
      final float[] d = new float[a.length];
      for (int p = 0; p < a.length; p++) {
        d[p] = Math.max(a[p] - b[p], 0f);
      }
      diff[i] = d;
    }
    return new ImageStack(pon.getHeight(), pon.getWidth(), diff);
  }

  public float @NotNull [] getSummedImage(@NotNull PumpState state) {
    return getImages(state).sumFrame();
  }

  @Override
  public String toString() {
    return "ScanSeries{" + pipelineName + ", steps=" + size() + ", frame=" + pon.getHeight() + "x"
        + pon.getWidth() + ", dropped=" + droppedSteps.size() + "}";
  }
}
