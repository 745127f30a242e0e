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

import org.jetbrains.annotations.NotNull;

/**
 * Images of N shots together with the beam intensity (QBPM sum) of each shot. This is what every
 * correction stage consumes and produces.
 */
public record ShotStack(@NotNull ImageStack images, double @NotNull [] beamIntensity) {

  public ShotStack {
    if (images.size() != beamIntensity.length) {
      throw new IllegalArgumentException(
          "Got " + images.size() + " images but " + beamIntensity.length + " beam intensities");
    }
  }

  public int size() {
    return beamIntensity.length;
  }

  public boolean isEmpty() {
    return beamIntensity.length == 0;
  }

  public @NotNull ShotStack select(boolean @NotNull [] mask) {
    final ImageStack selected = images.select(mask);
    final double[] beam = new double[selected.size()];
    int j = 0;
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        beam[j++] = beamIntensity[i];
      }
    }
    return new ShotStack(selected, beam);
  }

  public @NotNull ShotStack withImages(@NotNull ImageStack newImages) {
    return new ShotStack(newImages, beamIntensity);
  }

  public double meanBeamIntensity() {
    if (beamIntensity.length == 0) {
      return Double.NaN;
    }
    double sum = 0d;
    for (double v : beamIntensity) {
      sum += v;
    }
    return sum / beamIntensity.length;
  }
}
