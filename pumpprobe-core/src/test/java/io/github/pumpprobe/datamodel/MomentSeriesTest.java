/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.datamodel;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MomentSeriesTest {

  private static final double DQ = 0.01;

  private static MomentSeries series(Map<PumpState, double[]> gauss) {
    final RoiMoments on = new RoiMoments(new double[]{4d, 2d, 6d}, new double[]{1d, 1.5d, 3d},
        new double[]{2d, 2d, 1d});
    final RoiMoments off = new RoiMoments(new double[]{5d, 5d, 5d}, new double[]{1d, 1d, 1d},
        new double[]{1d, 1d, 1d});
    return new MomentSeries(new double[]{-1d, 0d, 1d}, Map.of(PumpState.ON, on, PumpState.OFF,
        off), gauss, DQ);
  }

  @Test
  void testFirstDelayIsTheAnchor() {
    final MomentSeries series = series(Map.of());
    Assertions.assertArrayEquals(new double[]{1d, 0.5d, 1.5d},
        series.getNormalizedIntensity(PumpState.ON), 1e-12);
    Assertions.assertArrayEquals(new double[]{0d, 0.5d, 2d},
        series.getCentroidDisplacement(PumpState.ON, true), 1e-12);
    Assertions.assertArrayEquals(new double[]{0d, 0.005d, 0.02d},
        series.getCentroidShiftQ(PumpState.ON, true), 1e-12);
    Assertions.assertArrayEquals(new double[]{0d, 0d, -0.01d},
        series.getCentroidShiftQ(PumpState.ON, false), 1e-12);
  }

  @Test
  void testColumnOrder() {
    final MomentSeries series = series(Map.of(PumpState.ON, new double[]{2d, 4d, 1d}));
    final Map<String, double[]> columns = series.getColumns();
    Assertions.assertEquals(
        List.of("pon_intensity", "poff_intensity", "pon_com_x", "pon_com_y", "poff_com_x",
            "poff_com_y", "pon_gauss_intensity"), List.copyOf(columns.keySet()));
    Assertions.assertArrayEquals(new double[]{1d, 2d, 0.5d}, columns.get("pon_gauss_intensity"),
        1e-12);
  }

  @Test
  void testZeroAnchorGivesNonFiniteRatios() {
    final RoiMoments on = new RoiMoments(new double[]{0d, 3d}, new double[2], new double[2]);
    final MomentSeries series = new MomentSeries(new double[]{0d, 1d}, Map.of(PumpState.ON, on),
        Map.of(), DQ);
    final double[] normalized = series.getNormalizedIntensity(PumpState.ON);
    Assertions.assertTrue(Double.isNaN(normalized[0]));
    Assertions.assertTrue(Double.isInfinite(normalized[1]));
  }

  @Test
  void testRejectsMisalignedMoments() {
    final RoiMoments on = new RoiMoments(new double[1], new double[1], new double[1]);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new MomentSeries(new double[]{0d, 1d}, Map.of(PumpState.ON, on), Map.of(), DQ));
  }
}
