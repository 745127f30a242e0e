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

package io.github.pumpprobe.modules.dataprocessing.scan_aggregation;

import io.github.pumpprobe.datamodel.MomentSeries;
import io.github.pumpprobe.datamodel.RoiRectangle;
import io.github.pumpprobe.datamodel.ScanSeries;
import io.github.pumpprobe.modules.dataanalysis.roi_moments.CentroidMethod;
import io.github.pumpprobe.modules.dataanalysis.roi_moments.RoiMomentExtractor;
import io.github.pumpprobe.modules.dataprocessing.corrections.CorrectionPipeline;
import io.github.pumpprobe.modules.dataprocessing.corrections.CorrectionPipelines;
import io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction.DarkSubtractionParameters;
import io.github.pumpprobe.modules.io.export_scan.MomentSeriesCsvWriter;
import io.github.pumpprobe.modules.io.export_scan.OutputFormat;
import io.github.pumpprobe.modules.io.export_scan.RunParametersWriter;
import io.github.pumpprobe.modules.io.export_scan.ScanSeriesWriter;
import io.github.pumpprobe.modules.io.import_shotfile.ShotArchiveLoader;
import io.github.pumpprobe.parameters.ParameterSet;
import io.github.pumpprobe.taskcontrol.AbstractTask;
import io.github.pumpprobe.taskcontrol.TaskStatus;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;

/**
 * Aggregates one scan directory with all selected pipelines and writes the results.
 */
public class ScanAggregationTask extends AbstractTask {

  private static final Logger logger = Logger.getLogger(ScanAggregationTask.class.getName());

  private final ParameterSet parameters;
  private final Path scanDirectory;
  private final String extension;
  private final Path outputDirectory;
  private final String baseName;
  private final OutputFormat outputFormat;
  private final @Nullable RoiRectangle momentRoi;
  private final CentroidMethod centroidMethod;
  private volatile @Nullable ScanAggregator aggregator;
  private @Nullable Map<String, ScanSeries> results;

  public ScanAggregationTask(@NotNull ParameterSet parameters, @NotNull Instant moduleCallDate) {
    super(moduleCallDate);
    this.parameters = parameters.cloneParameterSet();
    this.scanDirectory = parameters.getValue(ScanAggregationParameters.SCAN_DIRECTORY).toPath();
    this.extension = parameters.getValue(ScanAggregationParameters.FILE_EXTENSION);
    this.outputDirectory = parameters.getValue(ScanAggregationParameters.OUTPUT_DIRECTORY)
        .toPath();
    this.baseName = parameters.getValue(ScanAggregationParameters.OUTPUT_BASE_NAME);
    this.outputFormat = parameters.getValue(ScanAggregationParameters.OUTPUT_FORMAT);
    this.momentRoi = parameters.getEmbeddedParameterValueIfSelectedOrElse(
        ScanAggregationParameters.MOMENT_ROI, null);
    this.centroidMethod = parameters.getValue(ScanAggregationParameters.CENTROID_METHOD);
  }

  @Override
  public @NotNull String getTaskDescription() {
    return "Aggregating scan " + scanDirectory;
  }

  @Override
  public double getFinishedPercentage() {
    final ScanAggregator current = aggregator;
    return current == null ? 0d : current.getFinishedPercentage();
  }

  @Override
  protected void process() {
    setStatus(TaskStatus.PROCESSING);
    final JSONObject runJson = RunParametersWriter.toJson(parameters,
        ScanAggregationModule.class.getSimpleName(), getModuleCallDate());
    logger.info(() -> "Scan aggregation parameters:\n" + runJson.toString(2));
    try {
      final ParameterSet experiment = parameters.getValue(ScanAggregationParameters.EXPERIMENT);
      final File darkFile = parameters.getValue(ScanAggregationParameters.DARK_SUBTRACTION)
          .getValue(DarkSubtractionParameters.DARK_FILE);
      final CorrectionPipelines catalogue = new CorrectionPipelines(
          darkFile == null ? null : darkFile.toPath(),
          parameters.getValue(ScanAggregationParameters.RANSAC),
          parameters.getValue(ScanAggregationParameters.CONFIDENCE_BAND));
      final List<CorrectionPipeline> pipelines = catalogue.createAll(
          CorrectionPipelines.parseNames(parameters.getValue(ScanAggregationParameters.PIPELINES)));

      final ScanAggregator scanAggregator = new ScanAggregator(new ShotArchiveLoader(experiment),
          pipelines, parameters.getValue(ScanAggregationParameters.THREADS));
      aggregator = scanAggregator;
      if (isCanceled()) {
        return;
      }
      final Map<String, ScanSeries> aggregated = scanAggregator.aggregate(scanDirectory,
          extension);

      final List<ScanSeriesWriter> writers = outputFormat.createWriters();
      for (ScanSeries series : aggregated.values()) {
        for (ScanSeriesWriter writer : writers) {
          for (Path file : writer.write(series, outputDirectory, baseName)) {
            logger.info(() -> "Saved " + series + " to " + file);
          }
        }
        if (momentRoi != null) {
          final MomentSeries moments = new RoiMomentExtractor(momentRoi, experiment,
              centroidMethod, RoiMomentExtractor.DEFAULT_GAUSS_MAX_ITERATIONS).extract(series);
          final Path csv = outputDirectory.resolve(
              ScanSeriesWriter.fileStem(series, baseName) + "_roi.csv");
          new MomentSeriesCsvWriter().write(moments, csv);
          logger.info(() -> "Saved ROI moments to " + csv);
        }
      }
      new RunParametersWriter().write(runJson, outputDirectory, baseName);
      results = aggregated;
      setStatus(TaskStatus.FINISHED);
    } catch (CancellationException e) {
      setStatus(TaskStatus.CANCELED);
    } catch (IOException e) {
      error("Scan aggregation of " + scanDirectory + " failed: " + e.getMessage(), e);
    } catch (EmptyScanException | IllegalArgumentException e) {
      error(String.valueOf(e.getMessage()), e);
    }
  }

  @Override
  public void cancel() {
    super.cancel();
    final ScanAggregator current = aggregator;
    if (current != null) {
      current.cancel();
    }
  }

  /**
   * @return the aggregated series per pipeline once finished, otherwise null
   */
  public @Nullable Map<String, ScanSeries> getResults() {
    return results;
  }
}
