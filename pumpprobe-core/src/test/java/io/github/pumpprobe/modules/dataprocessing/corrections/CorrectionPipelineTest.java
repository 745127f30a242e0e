/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.modules.dataprocessing.corrections;

import io.github.pumpprobe.datamodel.ImageStack;
import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction.DarkFrame;
import io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction.MissingDarkFrameException;
import io.github.pumpprobe.modules.dataprocessing.filter_linearconfidence.LinearConfidenceBandFilterParameters;
import io.github.pumpprobe.modules.dataprocessing.filter_ransac.RansacOutlierFilterParameters;
import io.github.pumpprobe.testutils.TestShots;
import java.io.IOException;
import java.util.List;
import java.util.function.DoubleUnaryOperator;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CorrectionPipelineTest {

  private static ShotStackCorrection pixelwise(String name, DoubleUnaryOperator op) {
    return new ShotStackCorrection() {
      @Override
      public @NotNull String getName() {
        return name;
      }

      @Override
      public @NotNull ShotStack apply(@NotNull ShotStack shots) {
        final ImageStack images = shots.images();
        final float[][] out = new float[images.size()][];
        for (int i = 0; i < images.size(); i++) {
          final float[] frame = images.getFrame(i);
          out[i] = new float[frame.length];
          for (int p = 0; p < frame.length; p++) {
            out[i][p] = (float) op.applyAsDouble(frame[p]);
          }
        }
        return shots.withImages(new ImageStack(images.getHeight(), images.getWidth(), out));
      }
    };
  }

  private static List<String> stageNames(CorrectionPipeline pipeline) {
    return pipeline.getStages().stream().map(ShotStackCorrection::getName).toList();
  }

  @Test
  void testStagesRunInListOrder() {
    final CorrectionPipeline pipeline = new CorrectionPipeline("test",
        List.of(pixelwise("plus_one", v -> v + 1), pixelwise("times_two", v -> v * 2)));
    final ShotStack result = pipeline.apply(
        TestShots.pixels(new double[]{1d, 1d}, new double[]{3d, -1d}));
    Assertions.assertEquals(8f, result.images().getFrame(0)[0]);
    Assertions.assertEquals(0f, result.images().getFrame(1)[0]);
  }

  @Test
  void testEmptyPipelineReturnsInput() {
    final ShotStack shots = TestShots.pixels(new double[]{1d}, new double[]{3d});
    Assertions.assertSame(shots, new CorrectionPipeline("none", List.of()).apply(shots));
  }

  @Test
  void testStopsOnEmptyStack() {
    final ShotStackCorrection dropAll = new ShotStackCorrection() {
      @Override
      public @NotNull String getName() {
        return "drop_all";
      }

      @Override
      public @NotNull ShotStack apply(@NotNull ShotStack shots) {
        return shots.select(new boolean[shots.size()]);
      }
    };
    final ShotStackCorrection failing = pixelwise("unreachable", v -> {
      throw new AssertionError("stage after an empty stack must not run");
    });
    final ShotStack result = new CorrectionPipeline("drop", List.of(dropAll, failing)).apply(
        TestShots.pixels(new double[]{1d, 2d}, new double[]{3d, 4d}));
    Assertions.assertTrue(result.isEmpty());
  }

  @Test
  void testCatalogue() throws IOException {
    final CorrectionPipelines pipelines = new CorrectionPipelines(DarkFrame.zeros(1, 1));
    Assertions.assertEquals(List.of(),
        stageNames(pipelines.create(CorrectionPipelines.NO_PROCESSING)));
    Assertions.assertEquals(
        List.of("dark_subtraction", "ransac_outlier_filter", "qbpm_normalization"),
        stageNames(pipelines.create(CorrectionPipelines.STANDARD)));
    Assertions.assertEquals(
        List.of("dark_subtraction", "ransac_outlier_filter", "brightness_equalization"),
        stageNames(pipelines.create(CorrectionPipelines.EQUALIZE_INTENSITIES)));
    Assertions.assertEquals(List.of("dark_subtraction", "ransac_outlier_filter"),
        stageNames(pipelines.create(CorrectionPipelines.NO_NORMALIZE)));
    Assertions.assertEquals(
        List.of("dark_subtraction", "linear_confidence_band_filter", "qbpm_normalization"),
        stageNames(pipelines.create(CorrectionPipelines.CONFIDENCE_BAND)));
    Assertions.assertEquals(
        List.of("positivity_shift", "ransac_outlier_filter", "qbpm_normalization"),
        stageNames(pipelines.create(CorrectionPipelines.SHIFT_TO_POSITIVE)));
    Assertions.assertEquals(CorrectionPipelines.getNames().size(),
        pipelines.createAll(CorrectionPipelines.getNames()).size());
  }

  @Test
  void testMissingDarkFrameOnlyForDarkPipelines() throws IOException {
    final CorrectionPipelines pipelines = new CorrectionPipelines(null,
        new RansacOutlierFilterParameters(), new LinearConfidenceBandFilterParameters());
    Assertions.assertTrue(pipelines.create(CorrectionPipelines.NO_PROCESSING).getStages()
        .isEmpty());
    Assertions.assertEquals(3, pipelines.create(CorrectionPipelines.SHIFT_TO_POSITIVE)
        .getStages().size());
    Assertions.assertThrows(MissingDarkFrameException.class,
        () -> pipelines.create(CorrectionPipelines.STANDARD));
  }

  @Test
  void testParseNames() {
    Assertions.assertEquals(List.of("standard", "confidence_band"),
        CorrectionPipelines.parseNames(" standard, confidence_band ,standard"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> CorrectionPipelines.parseNames("standard,fancy"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> CorrectionPipelines.parseNames(" , "));
  }
}
