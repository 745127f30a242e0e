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

package io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction;

import io.github.pumpprobe.datamodel.ImageStack;
import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.modules.dataprocessing.corrections.ShotStackCorrection;
import org.jetbrains.annotations.NotNull;

/**
 * Subtracts the dark frame from every image and sets negative results to zero.
 */
public class DarkSubtraction implements ShotStackCorrection {

  private final DarkFrame dark;

  public DarkSubtraction(@NotNull DarkFrame dark) {
    this.dark = dark;
  }

  @Override
  public @NotNull String getName() {
    return "dark_subtraction";
  }

  @Override
  public @NotNull ShotStack apply(@NotNull ShotStack shots) {
    final ImageStack images = shots.images();
    if (images.getHeight() != dark.height() || images.getWidth() != dark.width()) {
      throw new IllegalArgumentException(
          "Dark frame is " + dark.height() + "x" + dark.width() + " but images are "
              + images.getHeight() + "x" + images.getWidth());
    }
    final float[] darkValues = dark.values();
    final float[][] corrected = new float[images.size()][];
    for (int i = 0; i < images.size(); i++) {
      final float[] frame = images.getFrame(i);
      final float[] out = new float[frame.length];
      for (int p = 0; p < frame.length; p++) {
        out[p] = Math.max(0f, frame[p] - darkValues[p]);
      }
      corrected[i] = out;
    }
    return shots.withImages(new ImageStack(images.getHeight(), images.getWidth(), corrected));
  }
}
