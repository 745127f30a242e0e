/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.util.io.npy;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NpzArchiveTest {

  @TempDir
  Path tempDir;

  @Test
  void testNestedKeysKeepOrderAndValues() throws IOException {
    final Map<String, NpyArray> arrays = new LinkedHashMap<>();
    arrays.put("metadata/index", NpyArray.ofLongs(new long[]{10L, 11L, 1L << 40}, 3));
    arrays.put("detector/eh1/jf/image/block0_values",
        NpyArray.ofFloats(new float[]{0f, 1f, 2f, 3f, 4f, 5f, 6f, 7f}, 2, 2, 2));
    arrays.put("delay", NpyArray.ofDoubles(new double[]{-1.5, Double.NaN}));

    final Path file = tempDir.resolve("shots.npz");
    NpzArchive.write(file, arrays);
    final Map<String, NpyArray> read = NpzArchive.read(file);

    Assertions.assertEquals(List.copyOf(arrays.keySet()), List.copyOf(read.keySet()));
    Assertions.assertArrayEquals(new long[]{10L, 11L, 1L << 40},
        read.get("metadata/index").toLongArray());
    Assertions.assertArrayEquals(new int[]{2, 2, 2},
        read.get("detector/eh1/jf/image/block0_values").getShape());
    Assertions.assertEquals(7f, read.get("detector/eh1/jf/image/block0_values").toFloatArray()[7]);
    Assertions.assertTrue(Double.isNaN(read.get("delay").toDoubleArray()[1]));
  }

  @Test
  void testMissingFile() {
    Assertions.assertThrows(NoSuchFileException.class,
        () -> NpzArchive.read(tempDir.resolve("absent.npz")));
  }

  @Test
  void testReadOnlyMap() throws IOException {
    final Path file = tempDir.resolve("one.npz");
    NpzArchive.write(file, Map.of("a", NpyArray.ofDoubles(new double[]{1d})));
    final Map<String, NpyArray> read = NpzArchive.read(file);
    Assertions.assertThrows(UnsupportedOperationException.class, () -> read.remove("a"));
  }
}
