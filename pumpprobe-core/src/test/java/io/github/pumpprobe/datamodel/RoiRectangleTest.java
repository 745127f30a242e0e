/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.datamodel;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RoiRectangleTest {

  @Test
  void testParseCommaAndWhitespace() {
    Assertions.assertEquals(new RoiRectangle(1, 2, 5, 7), RoiRectangle.parse("1,2,5,7"));
    Assertions.assertEquals(new RoiRectangle(1, 2, 5, 7), RoiRectangle.parse(" 1, 2  5,7 "));
    Assertions.assertEquals("1,2,5,7", RoiRectangle.parse("1 2 5 7").format());
  }

  @Test
  void testParseRejectsWrongCount() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> RoiRectangle.parse("1,2,3"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> RoiRectangle.parse("a,b,c,d"));
  }

  @Test
  void testInvalidCorners() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new RoiRectangle(3, 0, 3, 4));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new RoiRectangle(0, 5, 2, 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new RoiRectangle(-1, 0, 2, 2));
  }

  @Test
  void testSliceUsesExclusiveUpperBounds() {
    // 3 rows x 4 columns, value = row * 10 + col
    final float[] frame = new float[12];
    for (int row = 0; row < 3; row++) {
      for (int col = 0; col < 4; col++) {
        frame[row * 4 + col] = row * 10 + col;
      }
    }
    final RoiRectangle roi = new RoiRectangle(1, 1, 3, 3);
    Assertions.assertEquals(2, roi.width());
    Assertions.assertEquals(2, roi.height());
    Assertions.assertArrayEquals(new float[]{11f, 12f, 21f, 22f}, roi.slice(frame, 3, 4));
    Assertions.assertTrue(roi.columnRange().contains(2));
    Assertions.assertFalse(roi.columnRange().contains(3));
  }

  @Test
  void testFitsInto() {
    final RoiRectangle roi = new RoiRectangle(0, 0, 4, 3);
    Assertions.assertTrue(roi.fitsInto(3, 4));
    Assertions.assertFalse(roi.fitsInto(2, 4));
    Assertions.assertFalse(roi.fitsInto(3, 3));
    Assertions.assertFalse(new RoiRectangle(1, 0, 2, 1).fitsInto(1, 0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> roi.slice(new float[8], 2, 4));
  }
}
