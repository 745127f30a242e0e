/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.modules.dataprocessing.filter_linearconfidence;

import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.testutils.TestShots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LinearConfidenceBandFilterTest {

  private static final int SPIKE = 14;

  /**
   * y = 5x + 3 with alternating +-1 noise for x = 1..30 and one shot 200 above the line.
   */
  private static double[][] noisyLine() {
    final double[] x = new double[30];
    final double[] y = new double[30];
    for (int i = 0; i < 30; i++) {
      x[i] = i + 1;
      y[i] = 5d * x[i] + 3d + (i % 2 == 0 ? 1d : -1d);
    }
    y[SPIKE] += 200d;
    return new double[][]{x, y};
  }

  @Test
  void testBandFit() {
    final double[][] data = noisyLine();
    final ConfidenceBand band = ConfidenceBand.fit(data[0], data[1], 1d);
    Assertions.assertNotNull(band);
    Assertions.assertEquals(4.949, band.slope(), 1e-3);
    Assertions.assertEquals(10.46, band.intercept(), 1e-2);
    Assertions.assertEquals(0.788, band.slopeStdErr(), 1e-3);
    Assertions.assertEquals(13.99, band.interceptStdErr(), 1e-2);
    Assertions.assertEquals(band.fitted(2d) - band.halfWidth(2d), band.lower(2d), 1e-12);
  }

  @Test
  void testFilterDropsSpike() {
    final double[][] data = noisyLine();
    final ShotStack filtered = new LinearConfidenceBandFilter(1d, null).apply(
        TestShots.pixels(data[0], data[1]));

    Assertions.assertEquals(29, filtered.size());
    for (double x : filtered.beamIntensity()) {
      Assertions.assertNotEquals(SPIKE + 1d, x);
    }
  }

  @Test
  void testWideBandKeepsEverything() {
    final double[][] data = noisyLine();
    final ShotStack shots = TestShots.pixels(data[0], data[1]);
    Assertions.assertSame(shots, new LinearConfidenceBandFilter(100d, null).apply(shots));
  }

  @Test
  void testTooFewShotsPassThrough() {
    final ShotStack shots = TestShots.pixels(new double[]{1d, 2d}, new double[]{5d, 50d});
    Assertions.assertSame(shots, new LinearConfidenceBandFilter(1d, null).apply(shots));
  }

  @Test
  void testConstantBeamHasNoBand() {
    Assertions.assertNull(
        ConfidenceBand.fit(new double[]{1d, 1d, 1d}, new double[]{1d, 2d, 3d}, 1d));
  }
}
