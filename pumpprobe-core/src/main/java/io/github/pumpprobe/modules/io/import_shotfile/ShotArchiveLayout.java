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

import io.github.pumpprobe.parameters.experiment.Detector;
import io.github.pumpprobe.parameters.experiment.Hutch;
import org.jetbrains.annotations.NotNull;

/**
 * Entry names inside a shot archive. The names follow the group hierarchy of the beamline's
 * shot files:
 * <pre>
 * metadata/index                                      int64 [M]   timestamps
 * metadata/&lt;column&gt;                                   [M]         e.g. th_value, delay_value
 * detector/&lt;hutch&gt;/&lt;detector&gt;/image/block0_values     [N,H,W]
 * detector/&lt;hutch&gt;/&lt;detector&gt;/image/block0_items      int64 [N]   timestamps
 * qbpm/&lt;hutch&gt;/qbpm1/waveforms.ch&lt;1..4&gt;/block0_values  [K,samples]
 * qbpm/&lt;hutch&gt;/qbpm1/waveforms.ch1/axis1                int64 [K]   timestamps
 * </pre>
 */
public final class ShotArchiveLayout {

  public static final String METADATA_GROUP = "metadata";
  public static final String DETECTOR_GROUP = "detector";
  public static final String QBPM_GROUP = "qbpm";
  public static final String METADATA_INDEX = METADATA_GROUP + "/index";
  public static final int QBPM_CHANNELS = 4;

  /**
   * Delay columns in order of preference.
   */
  public static final String[] DELAY_COLUMNS = {"th_value", "delay_value"};

  private ShotArchiveLayout() {
  }

  public static @NotNull String metadataColumn(@NotNull String column) {
    return METADATA_GROUP + "/" + column;
  }

  public static @NotNull String imageValues(@NotNull Hutch hutch, @NotNull Detector detector) {
    return imageGroup(hutch, detector) + "/block0_values";
  }

  public static @NotNull String imageTimestamps(@NotNull Hutch hutch,
      @NotNull Detector detector) {
    return imageGroup(hutch, detector) + "/block0_items";
  }

  /**
   * @param channel 1 based
   */
  public static @NotNull String qbpmWaveform(@NotNull Hutch hutch, int channel) {
    return qbpmGroup(hutch) + "/waveforms.ch" + channel + "/block0_values";
  }

  public static @NotNull String qbpmTimestamps(@NotNull Hutch hutch) {
    return qbpmGroup(hutch) + "/waveforms.ch1/axis1";
  }

  private static String imageGroup(Hutch hutch, Detector detector) {
    return DETECTOR_GROUP + "/" + hutch.getKey() + "/" + detector.getKey() + "/image";
  }

  private static String qbpmGroup(Hutch hutch) {
    return QBPM_GROUP + "/" + hutch.getKey() + "/qbpm1";
  }
}
