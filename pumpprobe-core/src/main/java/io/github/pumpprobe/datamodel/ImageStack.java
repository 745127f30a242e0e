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

import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * N detector frames of equal size. Each frame is a row-major float array of height * width. The
 * frame arrays are shared, not copied; code that changes pixel values creates new arrays.
 */
public final class ImageStack {

  private final int height;
  private final int width;
  private final float[][] frames;

  public ImageStack(int height, int width, float[][] frames) {
    if (height <= 0 || width <= 0) {
      throw new IllegalArgumentException("Invalid frame size " + height + "x" + width);
    }
    final int pixels = height * width;
    for (int i = 0; i < frames.length; i++) {
      if (frames[i] == null || frames[i].length != pixels) {
        throw new IllegalArgumentException(
            "Frame " + i + " does not have " + height + "x" + width + " pixels");
      }
    }
    this.height = height;
    this.width = width;
    this.frames = frames;
  }

  public ImageStack(int height, int width, @NotNull List<float[]> frames) {
    this(height, width, frames.toArray(new float[0][]));
  }

  /**
   * Splits a C-ordered [n, height, width] block into frames.
   */
  public static @NotNull ImageStack fromBlock(float @NotNull [] block, int n, int height,
      int width) {
    final int pixels = height * width;
    if ((long) n * pixels != block.length) {
      throw new IllegalArgumentException(
          "Block of " + block.length + " values does not match " + n + "x" + height + "x" + width);
    }
    final float[][] frames = new float[n][];
    for (int i = 0; i < n; i++) {
      frames[i] = Arrays.copyOfRange(block, i * pixels, (i + 1) * pixels);
    }
    return new ImageStack(height, width, frames);
  }

  public int size() {
    return frames.length;
  }

  public boolean isEmpty() {
    return frames.length == 0;
  }

  public int getHeight() {
    return height;
  }

  public int getWidth() {
    return width;
  }

  public int getPixelCount() {
    return height * width;
  }

  /**
   * @return the backing row-major array of frame i, must not be modified
   */
  public float @NotNull [] getFrame(int i) {
    return frames[i];
  }

  public float getValue(int frame, int row, int col) {
    return frames[frame][row * width + col];
  }

  /**
   * @param roi restricts the sum to the region, null sums the full frame
   * @return per frame pixel sums
   */
  public double @NotNull [] getTotalIntensities(@Nullable RoiRectangle roi) {
    final double[] totals = new double[frames.length];
    for (int i = 0; i < frames.length; i++) {
      totals[i] = roi == null ? sum(frames[i]) : sum(roi.slice(frames[i], height, width));
    }
    return totals;
  }

  public double @NotNull [] getTotalIntensities() {
    return getTotalIntensities(null);
  }

  private static double sum(float[] values) {
    double sum = 0d;
    for (float v : values) {
      sum += v;
    }
    return sum;
  }

  public @NotNull ImageStack select(boolean @NotNull [] mask) {
    if (mask.length != frames.length) {
      throw new IllegalArgumentException(
          "Mask length " + mask.length + " does not match " + frames.length + " frames");
    }
    int count = 0;
    for (boolean b : mask) {
      if (b) {
        count++;
      }
    }
    final float[][] selected = new float[count][];
    int j = 0;
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        selected[j++] = frames[i];
      }
    }
    return new ImageStack(height, width, selected);
  }

  /**
   * Pixel-wise mean over all frames, accumulated in double precision.
   */
  public float @NotNull [] meanFrame() {
    if (frames.length == 0) {
      throw new IllegalStateException("Cannot average an empty image stack");
    }
    final double[] acc = new double[getPixelCount()];
    for (float[] frame : frames) {
      for (int p = 0; p < acc.length; p++) {
        acc[p] += frame[p];
      }
    }
    final float[] mean = new float[acc.length];
    for (int p = 0; p < acc.length; p++) {
      mean[p] = (float) (acc[p] / frames.length);
    }
    return mean;
  }

  /**
   * Pixel-wise sum over all frames.
   */
  public float @NotNull [] sumFrame() {
    final double[] acc = new double[getPixelCount()];
    for (float[] frame : frames) {
      for (int p = 0; p < acc.length; p++) {
        acc[p] += frame[p];
      }
    }
    final float[] sum = new float[acc.length];
    for (int p = 0; p < acc.length; p++) {
      sum[p] = (float) acc[p];
    }
    return sum;
  }

  /**
   * @return smallest pixel value of the stack, NaN when empty
   */
  public float min() {
    float min = Float.NaN;
    for (float[] frame : frames) {
      for (float v : frame) {
        if (Float.isNaN(min) || v < min) {
          min = v;
        }
      }
    }
    return min;
  }

  /**
   * All frames concatenated in C order [n, height, width].
   */
  public float @NotNull [] toBlock() {
    final int pixels = getPixelCount();
    final float[] block = new float[frames.length * pixels];
    for (int i = 0; i < frames.length; i++) {
      System.arraycopy(frames[i], 0, block, i * pixels, pixels);
    }
    return block;
  }

  @Override
  public String toString() {
    return "ImageStack{" + frames.length + "x" + height + "x" + width + "}";
  }
}
