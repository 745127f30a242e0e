/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.modules.dataanalysis.roi_moments;

import io.github.pumpprobe.datamodel.MomentSeries;
import io.github.pumpprobe.datamodel.PumpState;
import io.github.pumpprobe.datamodel.RoiRectangle;
import io.github.pumpprobe.datamodel.ScanSeries;
import io.github.pumpprobe.datamodel.ScanStep;
import io.github.pumpprobe.modules.io.export_scan.NpzScanSeriesWriter;
import io.github.pumpprobe.parameters.experiment.ExperimentParameters;
import io.github.pumpprobe.taskcontrol.Task;
import io.github.pumpprobe.taskcontrol.TaskStatus;
import io.github.pumpprobe.util.ExitCode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RoiMomentAnalysisModuleTest {

  @TempDir
  Path tempDir;

  private Path writeArchive() throws IOException {
    final List<ScanStep> steps = new ArrayList<>();
    for (int s = 0; s < 3; s++) {
      final float[] frame = new float[4 * 4];
      frame[s + 4] = 10f; // row 1, moving right
      steps.add(new ScanStep(s, Path.of("run_" + s + ".npz"), s * 0.1, 4, 4, frame, frame, 1d,
          1d));
    }
    final ScanSeries series = ScanSeries.stack("standard", steps, List.of());
    return new NpzScanSeriesWriter().write(series, tempDir, "run0002").get(0);
  }

  private RoiMomentParameters parameters(Path archive, Path output) {
    final RoiMomentParameters params = new RoiMomentParameters();
    params.setParameter(RoiMomentParameters.SCAN_ARCHIVE, archive.toFile());
    params.setParameter(RoiMomentParameters.OUTPUT_FILE, output.toFile());
    params.setParameter(RoiMomentParameters.ROI, new RoiRectangle(0, 0, 4, 4));
    return params;
  }

  @Test
  void testRunModuleCreatesTaskAndReturnsOK() throws IOException {
    final Collection<Task> tasks = new ArrayList<>();
    final ExitCode code = new RoiMomentAnalysisModule().runModule(
        parameters(writeArchive(), tempDir.resolve("roi.csv")), tasks, Instant.now());
    Assertions.assertEquals(ExitCode.OK, code);
    Assertions.assertInstanceOf(RoiMomentAnalysisTask.class, tasks.iterator().next());
  }

  @Test
  void testRunModuleRequiresRoi() throws IOException {
    final RoiMomentParameters params = parameters(writeArchive(), tempDir.resolve("roi.csv"));
    params.setParameter(RoiMomentParameters.ROI, null);
    final Collection<Task> tasks = new ArrayList<>();
    Assertions.assertEquals(ExitCode.ERROR,
        new RoiMomentAnalysisModule().runModule(params, tasks, Instant.now()));
    Assertions.assertTrue(tasks.isEmpty());
  }

  @Test
  void testTaskWritesCsv() throws IOException {
    final Path output = tempDir.resolve("moments").resolve("roi.csv");
    final RoiMomentAnalysisTask task = new RoiMomentAnalysisTask(
        parameters(writeArchive(), output), Instant.now());
    task.run();

    Assertions.assertEquals(TaskStatus.FINISHED, task.getStatus(), task.getErrorMessage());
    Assertions.assertEquals(4, Files.readAllLines(output).size());
    final MomentSeries result = task.getResult();
    Assertions.assertNotNull(result);
    final double dq = ExperimentParameters.deltaQPerPixel(new ExperimentParameters());
    Assertions.assertEquals(2d * dq, result.getCentroidShiftQ(PumpState.ON, true)[2], 1e-12);
  }

  @Test
  void testTaskFailsOnMissingArchive() {
    final RoiMomentAnalysisTask task = new RoiMomentAnalysisTask(
        parameters(tempDir.resolve("absent.npz"), tempDir.resolve("roi.csv")), Instant.now());
    task.run();
    Assertions.assertEquals(TaskStatus.ERROR, task.getStatus());
    Assertions.assertFalse(Files.exists(tempDir.resolve("roi.csv")));
  }
}
