/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.modules.dataprocessing.scan_aggregation;

import io.github.pumpprobe.datamodel.DroppedScanStep;
import io.github.pumpprobe.datamodel.DroppedScanStep.Reason;
import io.github.pumpprobe.datamodel.PumpState;
import io.github.pumpprobe.datamodel.ScanSeries;
import io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction.DarkFrame;
import io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction.DarkSubtraction;
import io.github.pumpprobe.modules.dataprocessing.corr_qbpmnormalization.QbpmNormalization;
import io.github.pumpprobe.modules.dataprocessing.corrections.CorrectionPipeline;
import io.github.pumpprobe.modules.dataprocessing.corrections.CorrectionPipelines;
import io.github.pumpprobe.modules.io.import_shotfile.ShotArchiveLoader;
import io.github.pumpprobe.modules.io.import_shotfile.ShotFileLoader;
import io.github.pumpprobe.parameters.experiment.Detector;
import io.github.pumpprobe.parameters.experiment.Hutch;
import io.github.pumpprobe.parameters.experiment.PumpRate;
import io.github.pumpprobe.parameters.experiment.XrayMode;
import io.github.pumpprobe.testutils.ShotArchiveFixture;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScanAggregatorTest {

  private static final int SIZE = 2;

  @TempDir
  Path tempDir;

  private final ShotArchiveLoader loader = new ShotArchiveLoader(Hutch.EH1, Detector.JUNGFRAU2,
      XrayMode.HX, PumpRate.HZ_15);
  private CorrectionPipelines catalogue;

  @BeforeEach
  void setUp() {
    final float[] dark = new float[SIZE * SIZE];
    Arrays.fill(dark, 1f);
    catalogue = new CorrectionPipelines(new DarkFrame(SIZE, SIZE, dark));
  }

  /**
   * Four pump-on and four pump-off shots with beam intensity q = 1..4 and pixel value 1 + 10 q.
   * After dark subtraction and beam normalization every pixel is 25.
   *
   * @param beamScale 0 writes shots without beam intensity
   */
  private Path writeStep(String name, double delay, double beamScale, int size)
      throws IOException {
    final ShotArchiveFixture fixture = new ShotArchiveFixture(size, size).delay(delay);
    long ts = 1000;
    for (boolean pumped : new boolean[]{true, false}) {
      for (int q = 1; q <= 4; q++) {
        fixture.shot(ts++, 1f + 10f * q, q * beamScale, pumped);
      }
    }
    return fixture.write(tempDir.resolve(name));
  }

  private Path writeStep(String name, double delay) throws IOException {
    return writeStep(name, delay, 1d, SIZE);
  }

  private List<CorrectionPipeline> pipelines(String... names) throws IOException {
    return catalogue.createAll(List.of(names));
  }

  @Test
  void testStandardPipelineEndToEnd() throws IOException {
    writeStep("run_001.npz", 5d);
    writeStep("run_002.npz", -1d);
    writeStep("run_010.npz", 2d);

    final Map<String, ScanSeries> result = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.STANDARD, CorrectionPipelines.NO_PROCESSING)).aggregate(
        tempDir, "npz");
    Assertions.assertEquals(List.of("standard", "no_processing"), List.copyOf(result.keySet()));

    final ScanSeries standard = result.get(CorrectionPipelines.STANDARD);
    Assertions.assertEquals(3, standard.size());
    // acquisition order, not delay order
    Assertions.assertArrayEquals(new double[]{5d, -1d, 2d}, standard.getDelays());
    Assertions.assertArrayEquals(new int[]{1, 2, 10}, standard.getFileIndices());
    for (int s = 0; s < 3; s++) {
      for (float v : standard.getPon().getFrame(s)) {
        Assertions.assertEquals(25f, v, 1e-4);
      }
      for (float v : standard.getPoff().getFrame(s)) {
        Assertions.assertEquals(25f, v, 1e-4);
      }
    }
    Assertions.assertEquals(2.5, standard.getBeamIntensity(PumpState.ON)[0], 1e-6);
    Assertions.assertTrue(standard.getDroppedSteps().isEmpty());

    // mean of 11, 21, 31, 41
    Assertions.assertEquals(26f,
        result.get(CorrectionPipelines.NO_PROCESSING).getPon().getFrame(0)[0], 1e-4);
  }

  @Test
  void testDarkAndBeamNormalizationOverTenByTenFrames() throws IOException {
    final int size = 10;
    writeStep("scan_0.npz", 0d, 1d, size);
    writeStep("scan_1.npz", 1d, 1d, size);
    writeStep("scan_2.npz", 2d, 1d, size);
    final float[] dark = new float[size * size];
    Arrays.fill(dark, 1f);
    final CorrectionPipeline darkAndBeam = new CorrectionPipeline("dark_and_beam",
        List.of(new DarkSubtraction(new DarkFrame(size, size, dark)), new QbpmNormalization()));

    final ScanSeries series = new ScanAggregator(loader, List.of(darkAndBeam)).aggregate(tempDir,
        "npz").get("dark_and_beam");
    Assertions.assertArrayEquals(new double[]{0d, 1d, 2d}, series.getDelays());
    for (PumpState state : PumpState.values()) {
      Assertions.assertEquals(3, series.getImages(state).size());
      Assertions.assertEquals(size, series.getImages(state).getHeight());
      Assertions.assertEquals(size, series.getImages(state).getWidth());
      for (float v : series.getImages(state).toBlock()) {
        Assertions.assertEquals(25f, v, 1e-4);
      }
    }
  }

  @Test
  void testEmptyPipelineKeepsOtherPipelines() throws IOException {
    writeStep("run_001.npz", 1d, 0d, SIZE);
    writeStep("run_002.npz", 2d, 0d, SIZE);

    final Map<String, ScanSeries> result = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.STANDARD, CorrectionPipelines.NO_PROCESSING)).aggregate(
        tempDir, "npz");
    Assertions.assertEquals(List.of(CorrectionPipelines.NO_PROCESSING),
        List.copyOf(result.keySet()));
    Assertions.assertArrayEquals(new double[]{1d, 2d},
        result.get(CorrectionPipelines.NO_PROCESSING).getDelays());
  }

  @Test
  void testLoaderRuntimeFailureIsSkipped() throws IOException {
    writeStep("run_001.npz", 1d);
    final Path broken = writeStep("run_002.npz", 2d);
    writeStep("run_003.npz", 3d);
    final ShotFileLoader failing = file -> {
      if (file.getFileName().equals(broken.getFileName())) {
        throw new IllegalStateException("corrupt image block");
      }
      return loader.load(file);
    };

    for (int threads : new int[]{1, 3}) {
      final ScanSeries series = new ScanAggregator(failing,
          pipelines(CorrectionPipelines.NO_PROCESSING), threads).aggregate(tempDir, "npz")
          .get(CorrectionPipelines.NO_PROCESSING);
      Assertions.assertArrayEquals(new double[]{1d, 3d}, series.getDelays());
      final DroppedScanStep dropped = series.getDroppedSteps().get(0);
      Assertions.assertEquals(Reason.LOAD_FAILED, dropped.reason());
      Assertions.assertEquals(broken.getFileName(), dropped.source().getFileName());
    }
  }

  @Test
  void testFileWithEmptyFramesIsSkipped() throws IOException {
    writeStep("run_001.npz", 1d);
    new ShotArchiveFixture(1, 0).delay(2d).shot(1000, new float[0], 1d, true)
        .write(tempDir.resolve("run_002.npz"));

    final ScanSeries series = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.NO_PROCESSING)).aggregate(tempDir, "npz")
        .get(CorrectionPipelines.NO_PROCESSING);
    Assertions.assertEquals(1, series.size());
    Assertions.assertEquals(Reason.LOAD_FAILED, series.getDroppedSteps().get(0).reason());
  }

  @Test
  void testStepWithoutSurvivingShotsIsDropped() throws IOException {
    writeStep("run_000.npz", 0d);
    final Path empty = writeStep("run_001.npz", 1d, 0d, SIZE);
    writeStep("run_002.npz", 2d);

    final Map<String, ScanSeries> result = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.STANDARD, CorrectionPipelines.NO_PROCESSING)).aggregate(
        tempDir, "npz");

    final ScanSeries standard = result.get(CorrectionPipelines.STANDARD);
    Assertions.assertEquals(2, standard.size());
    Assertions.assertArrayEquals(new double[]{0d, 2d}, standard.getDelays());
    Assertions.assertArrayEquals(new double[]{1d}, standard.getDroppedDelays());
    final DroppedScanStep dropped = standard.getDroppedSteps().get(0);
    Assertions.assertEquals(Reason.NO_SURVIVING_SHOTS, dropped.reason());
    Assertions.assertEquals(empty, dropped.source());

    // the same file still contributes to pipelines that do not need the beam monitor
    Assertions.assertEquals(3, result.get(CorrectionPipelines.NO_PROCESSING).size());
  }

  @Test
  void testUnreadableFileIsSkipped() throws IOException {
    writeStep("run_001.npz", 1d);
    Files.writeString(tempDir.resolve("run_002.npz"), "not an archive");
    writeStep("run_003.npz", 3d);

    final ScanSeries series = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.STANDARD)).aggregate(tempDir, "npz")
        .get(CorrectionPipelines.STANDARD);
    Assertions.assertArrayEquals(new double[]{1d, 3d}, series.getDelays());
    Assertions.assertEquals(Reason.LOAD_FAILED, series.getDroppedSteps().get(0).reason());
    Assertions.assertEquals(0, series.getDroppedDelays().length);
  }

  @Test
  void testDifferentFrameSizeIsSkipped() throws IOException {
    writeStep("run_001.npz", 1d);
    writeStep("run_002.npz", 2d, 1d, 3);

    final Map<String, ScanSeries> result = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.STANDARD, CorrectionPipelines.NO_PROCESSING)).aggregate(
        tempDir, "npz");
    for (ScanSeries series : result.values()) {
      Assertions.assertEquals(1, series.size(), series.getPipelineName());
      Assertions.assertEquals(Reason.SHAPE_MISMATCH, series.getDroppedSteps().get(0).reason());
    }
  }

  @Test
  void testNothingToSave() throws IOException {
    writeStep("run_001.npz", 1d, 0d, SIZE);
    writeStep("run_002.npz", 2d, 0d, SIZE);
    final ScanAggregator aggregator = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.STANDARD));
    final EmptyScanException e = Assertions.assertThrows(EmptyScanException.class,
        () -> aggregator.aggregate(tempDir, "npz"));
    Assertions.assertTrue(e.getMessage().startsWith("Nothing to save"));
  }

  @Test
  void testEmptyDirectory() throws IOException {
    final ScanAggregator aggregator = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.NO_PROCESSING));
    Assertions.assertThrows(EmptyScanException.class, () -> aggregator.aggregate(tempDir, "npz"));
  }

  @Test
  void testParallelMatchesSequential() throws IOException {
    for (int i = 0; i < 6; i++) {
      writeStep("run_" + i + ".npz", 10d - i, i == 3 ? 0d : 1d, SIZE);
    }
    final ScanSeries sequential = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.STANDARD), 1).aggregate(tempDir, "npz")
        .get(CorrectionPipelines.STANDARD);
    final ScanAggregator parallelAggregator = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.STANDARD), 4);
    final ScanSeries parallel = parallelAggregator.aggregate(tempDir, "npz")
        .get(CorrectionPipelines.STANDARD);

    Assertions.assertArrayEquals(sequential.getDelays(), parallel.getDelays());
    Assertions.assertArrayEquals(sequential.getPon().toBlock(), parallel.getPon().toBlock());
    Assertions.assertArrayEquals(sequential.getDroppedDelays(), parallel.getDroppedDelays());
    Assertions.assertEquals(1d, parallelAggregator.getFinishedPercentage());
  }

  @Test
  void testCanceledBeforeStart() throws IOException {
    writeStep("run_001.npz", 1d);
    final ScanAggregator aggregator = new ScanAggregator(loader,
        pipelines(CorrectionPipelines.STANDARD));
    aggregator.cancel();
    Assertions.assertThrows(CancellationException.class,
        () -> aggregator.aggregate(tempDir, "npz"));
  }

  @Test
  void testPipelineNamesMustBeUnique() throws IOException {
    final List<CorrectionPipeline> twice = pipelines(CorrectionPipelines.STANDARD,
        CorrectionPipelines.NO_PROCESSING);
    final List<CorrectionPipeline> duplicated = List.of(twice.get(0), twice.get(0));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new ScanAggregator(loader, duplicated));
  }
}
