/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.testutils;

import io.github.pumpprobe.modules.io.import_shotfile.ShotArchiveLayout;
import io.github.pumpprobe.parameters.experiment.Detector;
import io.github.pumpprobe.parameters.experiment.ExperimentParameters;
import io.github.pumpprobe.parameters.experiment.Hutch;
import io.github.pumpprobe.parameters.experiment.PumpRate;
import io.github.pumpprobe.parameters.experiment.XrayMode;
import io.github.pumpprobe.util.io.npy.NpyArray;
import io.github.pumpprobe.util.io.npy.NpzArchive;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds synthetic shot archives. Images, beam monitor readings and metadata rows are registered
 * separately so tests can create partially overlapping timestamps.
 */
public class ShotArchiveFixture {

  public static final int SAMPLES_PER_WAVEFORM = 2;

  private final int height;
  private final int width;
  private Hutch hutch = Hutch.EH1;
  private Detector detector = Detector.JUNGFRAU2;
  private XrayMode xray = XrayMode.HX;
  private PumpRate pumpRate = PumpRate.HZ_15;
  private String delayColumn = "th_value";
  private double delay = 0d;
  private boolean includeDetector = true;
  private boolean includePumpColumn = true;

  private final List<Long> imageTimestamps = new ArrayList<>();
  private final List<float[]> images = new ArrayList<>();
  private final List<Long> qbpmTimestamps = new ArrayList<>();
  private final List<Double> qbpm = new ArrayList<>();
  private final List<Long> metadataTimestamps = new ArrayList<>();
  private final List<Boolean> pumped = new ArrayList<>();

  public ShotArchiveFixture(int height, int width) {
    this.height = height;
    this.width = width;
  }

  public static float[] uniform(int height, int width, float value) {
    final float[] frame = new float[height * width];
    Arrays.fill(frame, value);
    return frame;
  }

  public ShotArchiveFixture delay(double delay) {
    this.delay = delay;
    return this;
  }

  /**
   * @param column metadata column for the delay, null writes no delay column
   */
  public ShotArchiveFixture delayColumn(String column) {
    this.delayColumn = column;
    return this;
  }

  public ShotArchiveFixture pumpRate(PumpRate rate) {
    this.pumpRate = rate;
    return this;
  }

  public ShotArchiveFixture withoutDetector() {
    this.includeDetector = false;
    return this;
  }

  public ShotArchiveFixture withoutPumpColumn() {
    this.includePumpColumn = false;
    return this;
  }

  /**
   * Adds a shot present in all three sources.
   */
  public ShotArchiveFixture shot(long timestamp, float[] image, double beamIntensity,
      boolean pumpOn) {
    image(timestamp, image);
    qbpm(timestamp, beamIntensity);
    metadata(timestamp, pumpOn);
    return this;
  }

  public ShotArchiveFixture shot(long timestamp, float value, double beamIntensity,
      boolean pumpOn) {
    return shot(timestamp, uniform(height, width, value), beamIntensity, pumpOn);
  }

  public ShotArchiveFixture image(long timestamp, float[] image) {
    imageTimestamps.add(timestamp);
    images.add(image);
    return this;
  }

  public ShotArchiveFixture qbpm(long timestamp, double beamIntensity) {
    qbpmTimestamps.add(timestamp);
    qbpm.add(beamIntensity);
    return this;
  }

  public ShotArchiveFixture metadata(long timestamp, boolean pumpOn) {
    metadataTimestamps.add(timestamp);
    pumped.add(pumpOn);
    return this;
  }

  public Path write(Path file) throws IOException {
    final Map<String, NpyArray> arrays = new LinkedHashMap<>();
    final int m = metadataTimestamps.size();
    arrays.put(ShotArchiveLayout.METADATA_INDEX, NpyArray.ofLongs(toLongs(metadataTimestamps), m));
    if (delayColumn != null) {
      final double[] delays = new double[m];
      Arrays.fill(delays, delay);
      arrays.put(ShotArchiveLayout.metadataColumn(delayColumn), NpyArray.ofDoubles(delays));
    }
    if (includePumpColumn && pumpRate.isPumped()) {
      final boolean[] flags = new boolean[m];
      for (int i = 0; i < m; i++) {
        flags[i] = pumped.get(i);
      }
      arrays.put(ShotArchiveLayout.metadataColumn(
          ExperimentParameters.pumpRateColumn(xray, pumpRate)), NpyArray.ofBooleans(flags, m));
    }

    if (includeDetector) {
      final int n = images.size();
      final float[] block = new float[n * height * width];
      for (int i = 0; i < n; i++) {
        System.arraycopy(images.get(i), 0, block, i * height * width, height * width);
      }
      arrays.put(ShotArchiveLayout.imageValues(hutch, detector),
          NpyArray.ofFloats(block, n, height, width));
      arrays.put(ShotArchiveLayout.imageTimestamps(hutch, detector),
          NpyArray.ofLongs(toLongs(imageTimestamps), n));
    }

    final int k = qbpm.size();
    for (int ch = 1; ch <= ShotArchiveLayout.QBPM_CHANNELS; ch++) {
      final float[] waveforms = new float[k * SAMPLES_PER_WAVEFORM];
      for (int i = 0; i < k; i++) {
        for (int s = 0; s < SAMPLES_PER_WAVEFORM; s++) {
          waveforms[i * SAMPLES_PER_WAVEFORM + s] = (float) (qbpm.get(i)
              / (ShotArchiveLayout.QBPM_CHANNELS * SAMPLES_PER_WAVEFORM));
        }
      }
      arrays.put(ShotArchiveLayout.qbpmWaveform(hutch, ch),
          NpyArray.ofFloats(waveforms, k, SAMPLES_PER_WAVEFORM));
    }
    arrays.put(ShotArchiveLayout.qbpmTimestamps(hutch), NpyArray.ofLongs(toLongs(qbpmTimestamps),
        k));
    NpzArchive.write(file, arrays);
    return file;
  }

  private static long[] toLongs(List<Long> values) {
    return values.stream().mapToLong(Long::longValue).toArray();
  }
}
