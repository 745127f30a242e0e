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

package io.github.pumpprobe.modules.io.import_shotfile;

import io.github.pumpprobe.datamodel.ImageStack;
import io.github.pumpprobe.datamodel.Partition;
import io.github.pumpprobe.datamodel.PumpState;
import io.github.pumpprobe.datamodel.ShotBundle;
import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.parameters.ParameterSet;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Loads shot archives laid out as described in {@link ShotArchiveLayout}.
 * <p>
 * Images, beam monitor sums and metadata rows are inner-joined on their timestamp; a shot missing
 * from any of the three is dropped. The result keeps the metadata row order. Negative pixel values
 * are set to zero.
 */
public class ShotArchiveLoader implements ShotFileLoader {

  private static final Logger logger = Logger.getLogger(ShotArchiveLoader.class.getName());

  private final Hutch hutch;
  private final Detector detector;
  private final XrayMode xray;
  private final PumpRate pumpRate;

  public ShotArchiveLoader(@NotNull ParameterSet experimentParameters) {
    this(experimentParameters.getValue(ExperimentParameters.HUTCH),
        experimentParameters.getValue(ExperimentParameters.DETECTOR),
        experimentParameters.getValue(ExperimentParameters.XRAY),
        experimentParameters.getValue(ExperimentParameters.PUMP_RATE));
  }

  public ShotArchiveLoader(@NotNull Hutch hutch, @NotNull Detector detector,
      @NotNull XrayMode xray, @NotNull PumpRate pumpRate) {
    this.hutch = hutch;
    this.detector = detector;
    this.xray = xray;
    this.pumpRate = pumpRate;
  }

  @Override
  public @NotNull ShotBundle load(@NotNull Path file) throws IOException {
    final Map<String, NpyArray> archive = NpzArchive.read(file);
    if (archive.keySet().stream()
        .noneMatch(k -> k.startsWith(ShotArchiveLayout.DETECTOR_GROUP + "/"))) {
      throw new MissingShotDataException(file, ShotArchiveLayout.DETECTOR_GROUP);
    }

    final NpyArray imageBlock = require(archive, file,
        ShotArchiveLayout.imageValues(hutch, detector));
    if (imageBlock.getNumberOfDimensions() != 3) {
      throw new IOException("Image block of " + file + " must have 3 dimensions but has shape "
          + Arrays.toString(imageBlock.getShape()));
    }
    final long[] imageTs = require(archive, file,
        ShotArchiveLayout.imageTimestamps(hutch, detector)).toLongArray();
    final int n = imageBlock.getDimension(0);
    if (imageTs.length != n) {
      throw new IOException(
          "Image timestamps (" + imageTs.length + ") do not match image count (" + n + ") in "
              + file);
    }

    final long[] qbpmTs = require(archive, file, ShotArchiveLayout.qbpmTimestamps(hutch))
        .toLongArray();
    final double[] qbpm = sumWaveforms(archive, file, qbpmTs.length);

    final long[] metadataTs = require(archive, file, ShotArchiveLayout.METADATA_INDEX)
        .toLongArray();
    final boolean[] pumpFlags = readPumpFlags(archive, file, metadataTs.length);
    final double delay = readDelay(archive, file);

    final Map<Long, Integer> imageRows = indexOf(imageTs);
    final Map<Long, Integer> qbpmRows = indexOf(qbpmTs);

    final int height = imageBlock.getDimension(1);
    final int width = imageBlock.getDimension(2);
    if (height < 1 || width < 1) {
      throw new IOException("Empty frames of size " + height + "x" + width + " in " + file);
    }
    final float[] block = imageBlock.toFloatArray();
    final int pixels = height * width;

    final List<float[]> ponFrames = new ArrayList<>();
    final List<float[]> poffFrames = new ArrayList<>();
    final List<Double> ponBeam = new ArrayList<>();
    final List<Double> poffBeam = new ArrayList<>();
    for (int m = 0; m < metadataTs.length; m++) {
      final Integer imageRow = imageRows.get(metadataTs[m]);
      final Integer qbpmRow = qbpmRows.get(metadataTs[m]);
      if (imageRow == null || qbpmRow == null) {
        continue;
      }
      final float[] frame = new float[pixels];
      final int offset = imageRow * pixels;
      for (int p = 0; p < pixels; p++) {
        final float v = block[offset + p];
        frame[p] = v < 0f ? 0f : v;
      }
      if (pumpFlags[m]) {
        ponFrames.add(frame);
        ponBeam.add(qbpm[qbpmRow]);
      } else {
        poffFrames.add(frame);
        poffBeam.add(qbpm[qbpmRow]);
      }
    }

    final List<Partition> partitions = new ArrayList<>(2);
    if (!ponFrames.isEmpty()) {
      partitions.add(new Partition(PumpState.ON,
          new ShotStack(new ImageStack(height, width, ponFrames), toArray(ponBeam))));
    }
    if (!poffFrames.isEmpty()) {
      partitions.add(new Partition(PumpState.OFF,
          new ShotStack(new ImageStack(height, width, poffFrames), toArray(poffBeam))));
    }
    logger.fine(() -> String.format("Loaded %s: %d images, %d qbpm, %d metadata rows, %d pon, "
            + "%d poff, delay %s", file.getFileName(), n, qbpmTs.length, metadataTs.length,
        ponFrames.size(), poffFrames.size(), delay));
    return new ShotBundle(file, delay, partitions);
  }

  /**
   * Sums the four QBPM channels over all samples, one value per waveform.
   */
  private double[] sumWaveforms(Map<String, NpyArray> archive, Path file, int count)
      throws IOException {
    final double[] sums = new double[count];
    for (int ch = 1; ch <= ShotArchiveLayout.QBPM_CHANNELS; ch++) {
      final NpyArray waveform = require(archive, file, ShotArchiveLayout.qbpmWaveform(hutch, ch));
      if (waveform.getNumberOfDimensions() == 0 || waveform.getDimension(0) != count) {
        throw new IOException(
            "QBPM channel " + ch + " of " + file + " does not have " + count + " waveforms");
      }
      final double[] values = waveform.toDoubleArray();
      final int samples = count == 0 ? 0 : values.length / count;
      for (int i = 0; i < count; i++) {
        for (int s = 0; s < samples; s++) {
          sums[i] += values[i * samples + s];
        }
      }
    }
    return sums;
  }

  private boolean[] readPumpFlags(Map<String, NpyArray> archive, Path file, int rows)
      throws IOException {
    if (!pumpRate.isPumped()) {
      return new boolean[rows];
    }
    final String column = ExperimentParameters.pumpRateColumn(xray, pumpRate);
    final NpyArray values = require(archive, file, ShotArchiveLayout.metadataColumn(column));
    if (values.getNumberOfElements() != rows) {
      throw new IOException("Column " + column + " of " + file + " has "
          + values.getNumberOfElements() + " rows, expected " + rows);
    }
    final boolean[] flags = new boolean[rows];
    for (int i = 0; i < rows; i++) {
      flags[i] = values.getDouble(i) != 0d;
    }
    return flags;
  }

  /**
   * @return the first value of the preferred delay column, NaN if none exists
   */
  private double readDelay(Map<String, NpyArray> archive, Path file) {
    for (String column : ShotArchiveLayout.DELAY_COLUMNS) {
      final NpyArray values = archive.get(ShotArchiveLayout.metadataColumn(column));
      if (values != null && values.getNumberOfElements() > 0) {
        // stored as float32 upstream
        return (float) values.getDouble(0);
      }
    }
    logger.log(Level.WARNING,
        "Neither th_value nor delay_value found in metadata of " + file + ", delay is NaN");
    return Double.NaN;
  }

  private static NpyArray require(Map<String, NpyArray> archive, Path file, String key)
      throws MissingShotDataException {
    final NpyArray array = archive.get(key);
    if (array == null) {
      throw new MissingShotDataException(file, key);
    }
    return array;
  }

  /**
   * Maps each timestamp to its first row.
   */
  private static Map<Long, Integer> indexOf(long[] timestamps) {
    final Map<Long, Integer> rows = new HashMap<>(timestamps.length * 2);
    for (int i = 0; i < timestamps.length; i++) {
      rows.putIfAbsent(timestamps[i], i);
    }
    return rows;
  }

  private static double[] toArray(List<Double> values) {
    return values.stream().mapToDouble(Double::doubleValue).toArray();
  }
}
