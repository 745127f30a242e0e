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

import com.google.common.collect.Range;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Axis aligned region of interest in detector pixel coordinates. x is the column, y the row. The
 * upper coordinates are exclusive, so the region covers columns [x1, x2) and rows [y1, y2).
 */
public record RoiRectangle(int x1, int y1, int x2, int y2) {

  public RoiRectangle {
    if (x1 < 0 || y1 < 0) {
      throw new IllegalArgumentException(
          "ROI origin must not be negative: (" + x1 + ", " + y1 + ")");
    }
    if (x1 >= x2 || y1 >= y2) {
      throw new IllegalArgumentException(
          "ROI requires x1 < x2 and y1 < y2 but was " + x1 + "," + y1 + "," + x2 + "," + y2);
    }
  }

  /**
   * @param text four integers "x1,y1,x2,y2", separated by commas or whitespace
   */
  public static @NotNull RoiRectangle parse(@NotNull String text) {
    final int[] values = Arrays.stream(text.trim().split("[,\\s]+")).filter(s -> !s.isEmpty())
        .mapToInt(Integer::parseInt).toArray();
    if (values.length != 4) {
      throw new IllegalArgumentException("ROI needs four coordinates x1,y1,x2,y2: " + text);
    }
    return new RoiRectangle(values[0], values[1], values[2], values[3]);
  }

  public int width() {
    return x2 - x1;
  }

  public int height() {
    return y2 - y1;
  }

  public @NotNull Range<Integer> columnRange() {
    return Range.closedOpen(x1, x2);
  }

  public @NotNull Range<Integer> rowRange() {
    return Range.closedOpen(y1, y2);
  }

  public boolean fitsInto(int frameHeight, int frameWidth) {
    return Range.closedOpen(0, frameWidth).encloses(columnRange())
        && Range.closedOpen(0, frameHeight).encloses(rowRange());
  }

  /**
   * Copies the ROI out of a row-major frame.
   *
   * @return row-major array of size height() * width()
   */
  public float @NotNull [] slice(float @NotNull [] frame, int frameHeight, int frameWidth) {
    if (!fitsInto(frameHeight, frameWidth)) {
      throw new IllegalArgumentException(
          "ROI " + format() + " exceeds frame of " + frameHeight + "x" + frameWidth);
    }
    final int w = width();
    final float[] roi = new float[height() * w];
    for (int row = y1; row < y2; row++) {
      System.arraycopy(frame, row * frameWidth + x1, roi, (row - y1) * w, w);
    }
    return roi;
  }

  public @NotNull String format() {
    return x1 + "," + y1 + "," + x2 + "," + y2;
  }
}
