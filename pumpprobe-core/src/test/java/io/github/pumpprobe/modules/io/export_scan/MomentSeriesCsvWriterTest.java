/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.modules.io.export_scan;

import io.github.pumpprobe.datamodel.MomentSeries;
import io.github.pumpprobe.datamodel.PumpState;
import io.github.pumpprobe.datamodel.RoiMoments;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MomentSeriesCsvWriterTest {

  @TempDir
  Path tempDir;

  @Test
  void testHeaderAndRows() throws IOException {
    final RoiMoments on = new RoiMoments(new double[]{2d, 3d}, new double[]{1d, 2d},
        new double[]{1d, Double.NaN});
    final RoiMoments off = new RoiMoments(new double[]{4d, 4d}, new double[]{0d, 0d},
        new double[]{0d, 0d});
    final MomentSeries series = new MomentSeries(new double[]{-1d, 1.5d},
        Map.of(PumpState.ON, on, PumpState.OFF, off), Map.of(), 1d);
    final Path file = tempDir.resolve("nested").resolve("moments.csv");

    new MomentSeriesCsvWriter().write(series, file);
    final List<String> lines = Files.readAllLines(file);

    Assertions.assertEquals(3, lines.size());
    Assertions.assertEquals(
        "delay,pon_intensity,poff_intensity,pon_com_x,pon_com_y,poff_com_x,poff_com_y",
        lines.get(0));
    final String[] second = lines.get(2).split(",");
    Assertions.assertEquals(1.5, Double.parseDouble(second[0]));
    Assertions.assertEquals(1.5, Double.parseDouble(second[1]), 1e-9);
    Assertions.assertEquals(1d, Double.parseDouble(second[3]), 1e-9);
    Assertions.assertEquals("NaN", second[4]);
  }
}
