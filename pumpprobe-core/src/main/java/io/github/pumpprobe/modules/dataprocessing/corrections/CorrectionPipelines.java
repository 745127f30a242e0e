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

package io.github.pumpprobe.modules.dataprocessing.corrections;

import io.github.pumpprobe.modules.dataprocessing.corr_brightnessequalization.BrightnessEqualization;
import io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction.DarkFrame;
import io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction.DarkSubtraction;
import io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction.MissingDarkFrameException;
import io.github.pumpprobe.modules.dataprocessing.corr_positivityshift.PositivityShift;
import io.github.pumpprobe.modules.dataprocessing.corr_qbpmnormalization.QbpmNormalization;
import io.github.pumpprobe.modules.dataprocessing.filter_linearconfidence.LinearConfidenceBandFilter;
import io.github.pumpprobe.modules.dataprocessing.filter_linearconfidence.LinearConfidenceBandFilterParameters;
import io.github.pumpprobe.modules.dataprocessing.filter_ransac.RansacOutlierFilter;
import io.github.pumpprobe.modules.dataprocessing.filter_ransac.RansacOutlierFilterParameters;
import io.github.pumpprobe.parameters.ParameterSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Catalogue of the named pipelines. The dark frame is read on first use by a pipeline that
 * subtracts it, so pipelines without dark subtraction work without a dark file.
 */
public class CorrectionPipelines {

  public static final String NO_PROCESSING = "no_processing";
  public static final String STANDARD = "standard";
  public static final String NORMALIZE_IMAGES_BY_QBPM = "normalize_images_by_qbpm";
  public static final String EQUALIZE_INTENSITIES = "equalize_intensities";
  public static final String NO_NORMALIZE = "no_normalize";
  public static final String CONFIDENCE_BAND = "confidence_band";
  public static final String SHIFT_TO_POSITIVE = "shift_to_positive";

  private static final List<String> NAMES = List.of(NO_PROCESSING, STANDARD,
      NORMALIZE_IMAGES_BY_QBPM, EQUALIZE_INTENSITIES, NO_NORMALIZE, CONFIDENCE_BAND,
      SHIFT_TO_POSITIVE);

  private static final Logger logger = Logger.getLogger(CorrectionPipelines.class.getName());

  private final @Nullable Path darkFile;
  private final ParameterSet ransacParameters;
  private final ParameterSet confidenceBandParameters;
  private @Nullable DarkFrame darkFrame;

  public CorrectionPipelines(@Nullable Path darkFile, @NotNull ParameterSet ransacParameters,
      @NotNull ParameterSet confidenceBandParameters) {
    this.darkFile = darkFile;
    this.ransacParameters = ransacParameters;
    this.confidenceBandParameters = confidenceBandParameters;
  }

  /**
   * Uses an already loaded dark frame.
   */
  public CorrectionPipelines(@NotNull DarkFrame darkFrame) {
    this(null, new RansacOutlierFilterParameters(), new LinearConfidenceBandFilterParameters());
    this.darkFrame = darkFrame;
  }

  public static @NotNull List<String> getNames() {
    return NAMES;
  }

  /**
   * Parses a comma separated list of pipeline names.
   *
   * @throws IllegalArgumentException for unknown names or an empty list
   */
  public static @NotNull List<String> parseNames(@NotNull String commaSeparated) {
    final List<String> names = Arrays.stream(commaSeparated.split(",")).map(String::trim)
        .filter(s -> !s.isEmpty()).distinct().toList();
    if (names.isEmpty()) {
      throw new IllegalArgumentException("No pipeline selected");
    }
    for (String name : names) {
      if (!NAMES.contains(name)) {
        throw new IllegalArgumentException("Unknown pipeline '" + name + "', choose from " + NAMES);
      }
    }
    return names;
  }

  /**
   * @throws MissingDarkFrameException if the pipeline subtracts the dark frame and none exists
   * @throws IOException               if the dark frame cannot be read
   */
  public @NotNull CorrectionPipeline create(@NotNull String name) throws IOException {
    final List<ShotStackCorrection> stages = new ArrayList<>(3);
    switch (name) {
      case NO_PROCESSING -> {
      }
      case STANDARD, NORMALIZE_IMAGES_BY_QBPM -> {
        stages.add(darkSubtraction());
        stages.add(new RansacOutlierFilter(ransacParameters));
        stages.add(new QbpmNormalization());
      }
      case EQUALIZE_INTENSITIES -> {
        stages.add(darkSubtraction());
        stages.add(new RansacOutlierFilter(ransacParameters));
        stages.add(new BrightnessEqualization());
      }
      case NO_NORMALIZE -> {
        stages.add(darkSubtraction());
        stages.add(new RansacOutlierFilter(ransacParameters));
      }
      case CONFIDENCE_BAND -> {
        stages.add(darkSubtraction());
        stages.add(new LinearConfidenceBandFilter(confidenceBandParameters));
        stages.add(new QbpmNormalization());
      }
      case SHIFT_TO_POSITIVE -> {
        stages.add(new PositivityShift());
        stages.add(new RansacOutlierFilter(ransacParameters));
        stages.add(new QbpmNormalization());
      }
      default -> throw new IllegalArgumentException(
          "Unknown pipeline '" + name + "', choose from " + NAMES);
    }
    return new CorrectionPipeline(name, stages);
  }

  public @NotNull List<CorrectionPipeline> createAll(@NotNull List<String> names)
      throws IOException {
    final List<CorrectionPipeline> pipelines = new ArrayList<>(names.size());
    for (String name : names) {
      pipelines.add(create(name));
    }
    return pipelines;
  }

  private synchronized DarkSubtraction darkSubtraction() throws IOException {
    if (darkFrame == null) {
      if (darkFile == null) {
        throw new MissingDarkFrameException(null, null);
      }
      darkFrame = DarkFrame.load(darkFile);
      logger.info(() -> "Loaded dark frame " + darkFile + " (" + darkFrame.height() + "x"
          + darkFrame.width() + ")");
    }
    return new DarkSubtraction(darkFrame);
  }
}
