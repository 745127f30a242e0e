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

package io.github.pumpprobe.modules.dataprocessing.corr_qbpmnormalization;

import io.github.pumpprobe.datamodel.ImageStack;
import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.modules.dataprocessing.corrections.ShotStackCorrection;
import io.github.pumpprobe.util.MathUtils;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Scales image i by {@code mean(q) / q[i]}, where q is the beam monitor reading. Shots with a
 * non-positive or non-finite reading are dropped first; the mean is taken over the kept shots.
 * Beam intensities are passed on unchanged.
 */
public class QbpmNormalization implements ShotStackCorrection {

  private static final Logger logger = Logger.getLogger(QbpmNormalization.class.getName());

  @Override
  public @NotNull String getName() {
    return "qbpm_normalization";
  }

  @Override
  public @NotNull ShotStack apply(@NotNull ShotStack shots) {
    final double[] q = shots.beamIntensity();
    final boolean[] valid = new boolean[q.length];
    for (int i = 0; i < q.length; i++) {
      valid[i] = Double.isFinite(q[i]) && q[i] > 0d;
    }
    final int validCount = MathUtils.countTrue(valid);
    final ShotStack kept = validCount == q.length ? shots : shots.select(valid);
    if (validCount < q.length) {
      logger.fine(() -> "Dropped " + (q.length - validCount) + " shots without beam intensity");
    }
    if (kept.isEmpty()) {
      return kept;
    }

    final double meanQ = kept.meanBeamIntensity();
    final ImageStack images = kept.images();
    final float[][] scaled = new float[images.size()][];
    for (int i = 0; i < images.size(); i++) {
      final double factor = meanQ / kept.beamIntensity()[i];
      final float[] frame = images.getFrame(i);
      final float[] out = new float[frame.length];
      for (int p = 0; p < frame.length; p++) {
        out[p] = (float) (frame[p] * factor);
      }
      scaled[i] = out;
    }
    return kept.withImages(new ImageStack(images.getHeight(), images.getWidth(), scaled));
  }
}
