/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction;

import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.testutils.TestShots;
import io.github.pumpprobe.util.io.npy.NpyArray;
import io.github.pumpprobe.util.io.npy.NpyFormat;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DarkSubtractionTest {

  @TempDir
  Path tempDir;

  @Test
  void testSubtractAndFloor() {
    final DarkFrame dark = new DarkFrame(1, 2, new float[]{1f, 5f});
    final ShotStack shots = TestShots.frames(1, 2, new double[]{1d, 2d}, new float[]{3f, 2f},
        new float[]{1f, 9f});
    final ShotStack corrected = new DarkSubtraction(dark).apply(shots);

    Assertions.assertArrayEquals(new float[]{2f, 0f}, corrected.images().getFrame(0));
    Assertions.assertArrayEquals(new float[]{0f, 4f}, corrected.images().getFrame(1));
    Assertions.assertArrayEquals(new double[]{1d, 2d}, corrected.beamIntensity());
    // input untouched
    Assertions.assertArrayEquals(new float[]{3f, 2f}, shots.images().getFrame(0));
  }

  @Test
  void testZeroDarkFrameKeepsShots() {
    final ShotStack shots = TestShots.frames(2, 2, new double[]{4d, 0.5d},
        new float[]{0f, 1.5f, 7f, 1000f}, new float[]{3f, 0f, 0.25f, 12f});
    final ShotStack corrected = new DarkSubtraction(DarkFrame.zeros(2, 2)).apply(shots);

    Assertions.assertEquals(shots.size(), corrected.size());
    for (int i = 0; i < shots.size(); i++) {
      Assertions.assertArrayEquals(shots.images().getFrame(i), corrected.images().getFrame(i));
    }
    Assertions.assertArrayEquals(shots.beamIntensity(), corrected.beamIntensity());
  }

  @Test
  void testShapeMismatch() {
    final ShotStack shots = TestShots.frames(1, 2, new double[]{1d}, new float[]{3f, 2f});
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new DarkSubtraction(DarkFrame.zeros(2, 2)).apply(shots));
  }

  @Test
  void testLoadTwoDimensional() throws IOException {
    final Path file = tempDir.resolve("dark.npy");
    NpyFormat.write(NpyArray.ofDoubles(new double[]{1d, 2d, 3d, 4d, 5d, 6d}, 2, 3), file);
    final DarkFrame dark = DarkFrame.load(file);
    Assertions.assertEquals(2, dark.height());
    Assertions.assertEquals(3, dark.width());
    Assertions.assertArrayEquals(new float[]{1f, 2f, 3f, 4f, 5f, 6f}, dark.values());
  }

  @Test
  void testLoadAveragesStack() throws IOException {
    final Path file = tempDir.resolve("dark_stack.npy");
    NpyFormat.write(NpyArray.ofFloats(new float[]{1f, 2f, 3f, 6f}, 2, 1, 2), file);
    final DarkFrame dark = DarkFrame.load(file);
    Assertions.assertEquals(1, dark.height());
    Assertions.assertArrayEquals(new float[]{2f, 4f}, dark.values());
  }

  @Test
  void testLoadMissingFile() {
    Assertions.assertThrows(MissingDarkFrameException.class,
        () -> DarkFrame.load(tempDir.resolve("absent.npy")));
  }

  @Test
  void testLoadRejectsVector() throws IOException {
    final Path file = tempDir.resolve("vector.npy");
    NpyFormat.write(NpyArray.ofDoubles(new double[]{1d, 2d}), file);
    Assertions.assertThrows(IOException.class, () -> DarkFrame.load(file));
  }
}
