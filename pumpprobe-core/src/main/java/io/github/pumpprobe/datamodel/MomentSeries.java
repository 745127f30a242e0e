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

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Delay indexed ROI intensity and centroid series for pump-on and pump-off. Intensities are
 * divided by their value at the first delay, centroids are offset by their first value and scaled
 * to momentum transfer.
 */
public final class MomentSeries {

  public static final String INTENSITY = "intensity";
  public static final String COM_X = "com_x";
  public static final String COM_Y = "com_y";
  public static final String GAUSS_INTENSITY = "gauss_intensity";

  private final double[] delays;
  private final EnumMap<PumpState, RoiMoments> raw;
  private final EnumMap<PumpState, double[]> gaussAmplitudes;
  private final double deltaQPerPixel;

  /**
   * @param gaussAmplitudes fitted Gaussian amplitudes per state, empty if no fit was done
   */
  public MomentSeries(double @NotNull [] delays, @NotNull Map<PumpState, RoiMoments> raw,
      @NotNull Map<PumpState, double[]> gaussAmplitudes, double deltaQPerPixel) {
    if (delays.length == 0) {
      throw new IllegalArgumentException("A moment series needs at least one delay");
    }
    for (RoiMoments m : raw.values()) {
      if (m.size() != delays.length) {
        throw new IllegalArgumentException("Moments are not aligned to the delays");
      }
    }
    this.delays = delays.clone();
    this.raw = new EnumMap<>(PumpState.class);
    this.raw.putAll(raw);
    this.gaussAmplitudes = new EnumMap<>(PumpState.class);
    this.gaussAmplitudes.putAll(gaussAmplitudes);
    this.deltaQPerPixel = deltaQPerPixel;
  }

  public static @NotNull String columnName(@NotNull PumpState state, @NotNull String quantity) {
    return state.getKey() + "_" + quantity;
  }

  public int size() {
    return delays.length;
  }

  public double @NotNull [] getDelays() {
    return delays.clone();
  }

  public double getDeltaQPerPixel() {
    return deltaQPerPixel;
  }

  public @Nullable RoiMoments getRawMoments(@NotNull PumpState state) {
    return raw.get(state);
  }

  /**
   * Intensity divided by its value at the first delay.
   */
  public double @NotNull [] getNormalizedIntensity(@NotNull PumpState state) {
    return ratioToFirst(requireMoments(state).intensity());
  }

  /**
   * Centroid displacement from the first delay in pixels.
   */
  public double @NotNull [] getCentroidDisplacement(@NotNull PumpState state, boolean xAxis) {
    final RoiMoments m = requireMoments(state);
    return offsetFromFirst(xAxis ? m.centroidX() : m.centroidY());
  }

  /**
   * Centroid displacement from the first delay in momentum transfer units (1/Angstrom).
   */
  public double @NotNull [] getCentroidShiftQ(@NotNull PumpState state, boolean xAxis) {
    final double[] shift = getCentroidDisplacement(state, xAxis);
    for (int i = 0; i < shift.length; i++) {
      shift[i] *= deltaQPerPixel;
    }
    return shift;
  }

  /**
   * The output table: pon_intensity, poff_intensity, pon_com_x, pon_com_y, poff_com_x, poff_com_y
   * and, if fitted, the Gaussian amplitude ratios.
   */
  public @NotNull Map<String, double[]> getColumns() {
    final Map<String, double[]> columns = new LinkedHashMap<>();
    for (PumpState state : PumpState.values()) {
      if (raw.containsKey(state)) {
        columns.put(columnName(state, INTENSITY), getNormalizedIntensity(state));
      }
    }
    for (PumpState state : PumpState.values()) {
      if (raw.containsKey(state)) {
        columns.put(columnName(state, COM_X), getCentroidShiftQ(state, true));
        columns.put(columnName(state, COM_Y), getCentroidShiftQ(state, false));
      }
    }
    for (PumpState state : PumpState.values()) {
      final double[] amplitudes = gaussAmplitudes.get(state);
      if (amplitudes != null) {
        columns.put(columnName(state, GAUSS_INTENSITY), ratioToFirst(amplitudes));
      }
    }
    return Collections.unmodifiableMap(columns);
  }

  private RoiMoments requireMoments(PumpState state) {
    final RoiMoments m = raw.get(state);
    if (m == null) {
      throw new IllegalArgumentException("No moments for " + state);
    }
    return m;
  }

  private static double[] ratioToFirst(double[] values) {
    final double anchor = values[0];
    final double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = values[i] / anchor;
    }
    return result;
  }

  private static double[] offsetFromFirst(double[] values) {
    final double anchor = values[0];
    final double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = values[i] - anchor;
    }
    return result;
  }
}
