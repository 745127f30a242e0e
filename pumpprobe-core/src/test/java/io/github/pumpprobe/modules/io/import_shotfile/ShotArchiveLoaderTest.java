/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.modules.io.import_shotfile;

import io.github.pumpprobe.datamodel.PumpState;
import io.github.pumpprobe.datamodel.ShotBundle;
import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.parameters.experiment.Detector;
import io.github.pumpprobe.parameters.experiment.ExperimentParameters;
import io.github.pumpprobe.parameters.experiment.Hutch;
import io.github.pumpprobe.parameters.experiment.PumpRate;
import io.github.pumpprobe.parameters.experiment.XrayMode;
import io.github.pumpprobe.testutils.ShotArchiveFixture;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ShotArchiveLoaderTest {

  @TempDir
  Path tempDir;

  private final ShotArchiveLoader loader = new ShotArchiveLoader(Hutch.EH1, Detector.JUNGFRAU2,
      XrayMode.HX, PumpRate.HZ_15);

  @Test
  void testInnerJoinOnTimestamps() throws IOException {
    final Path file = new ShotArchiveFixture(2, 2).delay(3d)
        .shot(100, 1f, 1d, true)
        .shot(101, 2f, 2d, false)
        .shot(102, 3f, 3d, true)
        .image(103, ShotArchiveFixture.uniform(2, 2, 9f)) // no qbpm, no metadata
        .qbpm(104, 5d).metadata(104, true) // no image
        .image(105, ShotArchiveFixture.uniform(2, 2, 7f)).qbpm(105, 7d) // no metadata
        .write(tempDir.resolve("run_0001.npz"));

    final ShotBundle bundle = loader.load(file);
    Assertions.assertEquals(3, bundle.getTotalShots());
    Assertions.assertEquals(2, bundle.getShotCount(PumpState.ON));
    Assertions.assertEquals(1, bundle.getShotCount(PumpState.OFF));
    Assertions.assertEquals(3d, bundle.delay());

    final ShotStack on = bundle.getPartition(PumpState.ON).orElseThrow().shots();
    Assertions.assertEquals(1f, on.images().getFrame(0)[0]);
    Assertions.assertEquals(3f, on.images().getFrame(1)[3]);
    Assertions.assertArrayEquals(new double[]{1d, 3d}, on.beamIntensity(), 1e-6);
  }

  @Test
  void testMetadataOrderIsKept() throws IOException {
    final Path file = new ShotArchiveFixture(1, 1)
        .image(1, new float[]{10f}).image(2, new float[]{20f})
        .qbpm(2, 2d).qbpm(1, 1d)
        .metadata(2, false).metadata(1, false)
        .write(tempDir.resolve("order.npz"));

    final ShotStack off = loader.load(file).getPartition(PumpState.OFF).orElseThrow().shots();
    Assertions.assertEquals(20f, off.images().getFrame(0)[0]);
    Assertions.assertEquals(10f, off.images().getFrame(1)[0]);
    Assertions.assertArrayEquals(new double[]{2d, 1d}, off.beamIntensity(), 1e-6);
  }

  @Test
  void testNegativePixelsAreFloored() throws IOException {
    final Path file = new ShotArchiveFixture(1, 3)
        .shot(1, new float[]{-4f, 0f, 2.5f}, 1d, true)
        .write(tempDir.resolve("neg.npz"));
    final ShotStack on = loader.load(file).getPartition(PumpState.ON).orElseThrow().shots();
    Assertions.assertArrayEquals(new float[]{0f, 0f, 2.5f}, on.images().getFrame(0));
  }

  @Test
  void testOnlyNonEmptyPartitions() throws IOException {
    final Path file = new ShotArchiveFixture(1, 1).shot(1, 1f, 1d, true).shot(2, 1f, 1d, true)
        .write(tempDir.resolve("only_on.npz"));
    final ShotBundle bundle = loader.load(file);
    Assertions.assertEquals(1, bundle.partitions().size());
    Assertions.assertTrue(bundle.getPartition(PumpState.OFF).isEmpty());
  }

  @Test
  void testZeroRateMarksAllShotsPumpOff() throws IOException {
    final Path file = new ShotArchiveFixture(1, 1).pumpRate(PumpRate.ZERO)
        .shot(1, 1f, 1d, true).shot(2, 1f, 1d, true)
        .write(tempDir.resolve("dark_run.npz"));
    final ExperimentParameters experiment = new ExperimentParameters();
    experiment.setParameter(ExperimentParameters.PUMP_RATE, PumpRate.ZERO);

    final ShotBundle bundle = new ShotArchiveLoader(experiment).load(file);
    Assertions.assertEquals(0, bundle.getShotCount(PumpState.ON));
    Assertions.assertEquals(2, bundle.getShotCount(PumpState.OFF));
  }

  @Test
  void testMissingPumpColumn() throws IOException {
    final Path file = new ShotArchiveFixture(1, 1).withoutPumpColumn().shot(1, 1f, 1d, true)
        .write(tempDir.resolve("no_rate.npz"));
    final MissingShotDataException e = Assertions.assertThrows(MissingShotDataException.class,
        () -> loader.load(file));
    Assertions.assertEquals("metadata/timestamp_info.RATE_HX_15HZ", e.getKey());
  }

  @Test
  void testMissingDetectorGroup() throws IOException {
    final Path file = new ShotArchiveFixture(1, 1).withoutDetector().shot(1, 1f, 1d, true)
        .write(tempDir.resolve("no_detector.npz"));
    final MissingShotDataException e = Assertions.assertThrows(MissingShotDataException.class,
        () -> loader.load(file));
    Assertions.assertEquals("detector", e.getKey());
  }

  @Test
  void testWrongDetector() throws IOException {
    final Path file = new ShotArchiveFixture(1, 1).shot(1, 1f, 1d, true)
        .write(tempDir.resolve("jf2.npz"));
    final ShotArchiveLoader other = new ShotArchiveLoader(Hutch.EH1, Detector.JUNGFRAU1,
        XrayMode.HX, PumpRate.HZ_15);
    Assertions.assertThrows(MissingShotDataException.class, () -> other.load(file));
  }

  @Test
  void testMissingFile() {
    Assertions.assertThrows(NoSuchFileException.class,
        () -> loader.load(tempDir.resolve("absent.npz")));
  }

  @Test
  void testDelayFallsBackToDelayValue() throws IOException {
    final Path file = new ShotArchiveFixture(1, 1).delayColumn("delay_value").delay(0.1)
        .shot(1, 1f, 1d, true).write(tempDir.resolve("delay_value.npz"));
    Assertions.assertEquals((double) 0.1f, loader.load(file).delay());
  }

  @Test
  void testMissingDelayIsNaN() throws IOException {
    final Path file = new ShotArchiveFixture(1, 1).delayColumn(null).shot(1, 1f, 1d, true)
        .write(tempDir.resolve("no_delay.npz"));
    Assertions.assertTrue(Double.isNaN(loader.load(file).delay()));
  }

  @Test
  void testNoJoinedShots() throws IOException {
    final Path file = new ShotArchiveFixture(1, 1).image(1, new float[]{1f}).qbpm(2, 1d)
        .metadata(3, true).write(tempDir.resolve("disjoint.npz"));
    final ShotBundle bundle = loader.load(file);
    Assertions.assertEquals(0, bundle.getTotalShots());
    Assertions.assertTrue(bundle.partitions().isEmpty());
  }

  @Test
  void testEmptyFramesAreRejected() throws IOException {
    final Path file = new ShotArchiveFixture(1, 0).shot(1, new float[0], 1d, true)
        .write(tempDir.resolve("empty_frames.npz"));
    final IOException e = Assertions.assertThrows(IOException.class, () -> loader.load(file));
    Assertions.assertTrue(e.getMessage().startsWith("Empty frames of size 1x0"));
  }
}
