/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.modules.dataprocessing.filter_ransac;

import io.github.pumpprobe.datamodel.RoiRectangle;
import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.modules.dataprocessing.filter_ransac.RansacLineFit.Result;
import io.github.pumpprobe.testutils.TestShots;
import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RansacOutlierFilterTest {

  private static final int[] OUTLIERS = {4, 9, 14};

  /**
   * y = 5x + 3 for x = 1..20 plus three shots far above the line.
   */
  private static double[][] lineWithOutliers() {
    final double[] x = new double[23];
    final double[] y = new double[23];
    for (int i = 0; i < 20; i++) {
      x[i] = i + 1;
      y[i] = 5d * x[i] + 3d;
    }
    for (int j = 0; j < OUTLIERS.length; j++) {
      x[20 + j] = x[OUTLIERS[j]];
      y[20 + j] = y[OUTLIERS[j]] + 500d;
    }
    return new double[][]{x, y};
  }

  @Test
  void testLineFitFindsConsensus() {
    final double[][] data = lineWithOutliers();
    final Result result = new RansacLineFit(2, 100, 0.99, null, 0L).fit(data[0], data[1]);

    Assertions.assertNotNull(result);
    Assertions.assertEquals(20, result.inlierCount());
    Assertions.assertEquals(5d, result.slope(), 1e-9);
    Assertions.assertEquals(3d, result.intercept(), 1e-9);
    Assertions.assertFalse(result.inlierMask()[21]);
  }

  @Test
  void testFilterDropsOutlierShots() {
    final double[][] data = lineWithOutliers();
    final ShotStack filtered = new RansacOutlierFilter().apply(TestShots.pixels(data[0], data[1]));

    Assertions.assertEquals(20, filtered.size());
    for (int i = 0; i < filtered.size(); i++) {
      final double x = filtered.beamIntensity()[i];
      Assertions.assertEquals(5d * x + 3d, filtered.images().getFrame(i)[0], 1e-4);
    }
  }

  @Test
  void testSameSeedSameResult() {
    final double[][] data = lineWithOutliers();
    final Result a = new RansacLineFit(2, 100, 0.99, null, 7L).fit(data[0], data[1]);
    final Result b = new RansacLineFit(2, 100, 0.99, null, 7L).fit(data[0], data[1]);
    Assertions.assertArrayEquals(a.inlierMask(), b.inlierMask());
    Assertions.assertEquals(a.slope(), b.slope());
  }

  @Test
  void testFixedResidualThreshold() {
    final double[][] data = lineWithOutliers();
    final Result tight = new RansacLineFit(2, 100, 0.99, 0.5, 0L).fit(data[0], data[1]);
    Assertions.assertEquals(0.5, tight.threshold());
    Assertions.assertEquals(20, tight.inlierCount());

    // any line through two shots covers all of them
    final Result loose = new RansacLineFit(2, 100, 0.99, 1e6, 0L).fit(data[0], data[1]);
    Assertions.assertEquals(23, loose.inlierCount());
  }

  @Test
  void testSmallStackPassesThrough() {
    final ShotStack shots = TestShots.pixels(new double[]{1d, 2d}, new double[]{1d, 100d});
    Assertions.assertSame(shots, new RansacOutlierFilter().apply(shots));
  }

  @Test
  void testRoiRestrictsIntensity() {
    final double[][] data = lineWithOutliers();
    final float[][] frames = new float[23][];
    for (int i = 0; i < 23; i++) {
      // left pixel follows the line, right pixel is noise
      frames[i] = new float[]{(float) data[1][i], (i % 2 == 0 ? 1e4f : 0f)};
    }
    final ShotStack shots = TestShots.frames(1, 2, data[0], frames);
    final ShotStack filtered = new RansacOutlierFilter(2, 100, 0.99, null, 0L,
        new RoiRectangle(0, 0, 1, 1)).apply(shots);
    Assertions.assertEquals(20, filtered.size());
  }

  @Test
  void testRequiredTrials() {
    final RansacLineFit fit = new RansacLineFit(2, 100, 0.99, null, 0L);
    Assertions.assertEquals(1, fit.requiredTrials(20, 20));
    // log(0.01) / log(1 - 0.5^2)
    Assertions.assertEquals(17, fit.requiredTrials(10, 20));
    Assertions.assertEquals(Long.MAX_VALUE, fit.requiredTrials(0, 20));
  }

  @Test
  void testRejectsSingleSample() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new RansacLineFit(1, 100, 0.99, null, 0L));
  }

  @Test
  void testOutlierIndicesAreExcluded() {
    final double[][] data = lineWithOutliers();
    final Result result = new RansacLineFit(2, 100, 0.99, null, 3L).fit(data[0], data[1]);
    final boolean[] expected = new boolean[23];
    Arrays.fill(expected, 0, 20, true);
    Assertions.assertArrayEquals(expected, result.inlierMask());
  }
}
