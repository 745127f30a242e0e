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

package io.github.pumpprobe.modules.dataanalysis.roi_moments;

import io.github.pumpprobe.datamodel.MomentSeries;
import io.github.pumpprobe.datamodel.RoiRectangle;
import io.github.pumpprobe.datamodel.ScanSeries;
import io.github.pumpprobe.modules.dataprocessing.scan_aggregation.EmptyScanException;
import io.github.pumpprobe.modules.io.export_scan.MomentSeriesCsvWriter;
import io.github.pumpprobe.modules.io.export_scan.ScanArchiveReader;
import io.github.pumpprobe.parameters.ParameterSet;
import io.github.pumpprobe.taskcontrol.AbstractTask;
import io.github.pumpprobe.taskcontrol.TaskStatus;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Reads a saved scan archive, extracts the ROI moment series and writes it as CSV.
 */
public class RoiMomentAnalysisTask extends AbstractTask {

  private static final Logger logger = Logger.getLogger(RoiMomentAnalysisTask.class.getName());

  private final Path archive;
  private final Path outputFile;
  private final RoiRectangle roi;
  private final RoiMomentExtractor extractor;
  private @Nullable MomentSeries result;
  private volatile double progress;

  public RoiMomentAnalysisTask(@NotNull ParameterSet parameters, @NotNull Instant moduleCallDate) {
    super(moduleCallDate);
    final File archiveFile = parameters.getValue(RoiMomentParameters.SCAN_ARCHIVE);
    final File output = parameters.getValue(RoiMomentParameters.OUTPUT_FILE);
    this.archive = archiveFile.toPath();
    this.outputFile = output.toPath();
    this.roi = parameters.getValue(RoiMomentParameters.ROI);
    this.extractor = new RoiMomentExtractor(roi,
        parameters.getValue(RoiMomentParameters.EXPERIMENT),
        parameters.getValue(RoiMomentParameters.CENTROID_METHOD),
        parameters.getValue(RoiMomentParameters.GAUSS_MAX_ITERATIONS));
  }

  @Override
  public @NotNull String getTaskDescription() {
    return "ROI " + roi.format() + " moments of " + archive.getFileName();
  }

  @Override
  public double getFinishedPercentage() {
    return progress;
  }

  @Override
  protected void process() {
    setStatus(TaskStatus.PROCESSING);
    try {
      final ScanSeries series = new ScanArchiveReader().read(archive);
      progress = 0.3;
      if (isCanceled()) {
        return;
      }
      final MomentSeries moments = extractor.extract(series);
      progress = 0.8;
      new MomentSeriesCsvWriter().write(moments, outputFile);
      result = moments;
      logger.info(() -> "Saved ROI moments of " + series.size() + " steps to " + outputFile);
      progress = 1d;
      setStatus(TaskStatus.FINISHED);
    } catch (IOException e) {
      error("Cannot analyse " + archive + ": " + e.getMessage(), e);
    } catch (EmptyScanException | IllegalArgumentException e) {
      error(String.valueOf(e.getMessage()), e);
    }
  }

  public @Nullable MomentSeries getResult() {
    return result;
  }
}
