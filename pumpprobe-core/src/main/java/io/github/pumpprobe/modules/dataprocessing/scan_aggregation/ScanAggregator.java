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

import io.github.pumpprobe.datamodel.DroppedScanStep;
import io.github.pumpprobe.datamodel.DroppedScanStep.Reason;
import io.github.pumpprobe.datamodel.Partition;
import io.github.pumpprobe.datamodel.PumpState;
import io.github.pumpprobe.datamodel.ScanSeries;
import io.github.pumpprobe.datamodel.ScanStep;
import io.github.pumpprobe.datamodel.ShotBundle;
import io.github.pumpprobe.datamodel.ShotStack;
import io.github.pumpprobe.modules.dataprocessing.corrections.CorrectionPipeline;
import io.github.pumpprobe.modules.io.import_shotfile.ShotFileLoader;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Runs every shot file of a scan through the loader and each correction pipeline and stacks the
 * mean frames per pipeline.
 * <p>
 * A file that yields no usable mean frame is skipped with a warning and reported in
 * {@link ScanSeries#getDroppedSteps()}. Files are processed on a worker pool if more than one
 * thread is configured; results are always stacked in file index order.
 */
public class ScanAggregator {

  private static final Logger logger = Logger.getLogger(ScanAggregator.class.getName());

  private final ShotFileLoader loader;
  private final List<CorrectionPipeline> pipelines;
  private final int threads;
  private final AtomicInteger processedFiles = new AtomicInteger();
  private volatile int totalFiles;
  private volatile boolean canceled;

  public ScanAggregator(@NotNull ShotFileLoader loader, @NotNull List<CorrectionPipeline> pipelines,
      int threads) {
    if (pipelines.isEmpty()) {
      throw new IllegalArgumentException("At least one pipeline is required");
    }
    if (pipelines.stream().map(CorrectionPipeline::getName).distinct().count()
        != pipelines.size()) {
      throw new IllegalArgumentException("Pipeline names must be unique");
    }
    this.loader = loader;
    this.pipelines = List.copyOf(pipelines);
    this.threads = Math.max(1, threads);
  }

  public ScanAggregator(@NotNull ShotFileLoader loader,
      @NotNull List<CorrectionPipeline> pipelines) {
    this(loader, pipelines, 1);
  }

  /**
   * Aggregates all files with the extension in the directory.
   *
   * @see ScanFiles#list(Path, String)
   */
  public @NotNull Map<String, ScanSeries> aggregate(@NotNull Path directory,
      @NotNull String extension) throws IOException {
    final List<IndexedShotFile> files = ScanFiles.list(directory, extension);
    logger.info(() -> "Found " + files.size() + " shot files in " + directory);
    return aggregate(files);
  }

  /**
   * @param files in acquisition order
   * @return one series per pipeline that kept at least one scan step, keyed by pipeline name in
   * pipeline order
   * @throws EmptyScanException    if no pipeline kept a scan step
   * @throws CancellationException if {@link #cancel()} was called
   */
  public @NotNull Map<String, ScanSeries> aggregate(@NotNull List<IndexedShotFile> files)
      throws IOException {
    totalFiles = files.size();
    processedFiles.set(0);
    final List<FileResult> results = threads == 1 || files.size() < 2 ? processSequentially(files)
        : processInParallel(files);
    if (canceled) {
      throw new CancellationException("Scan aggregation canceled");
    }

    final Map<String, ScanSeries> series = new LinkedHashMap<>();
    for (CorrectionPipeline pipeline : pipelines) {
      final ScanSeries stacked = stack(pipeline.getName(), results);
      if (stacked != null) {
        series.put(pipeline.getName(), stacked);
      }
    }
    if (series.isEmpty()) {
      throw new EmptyScanException(
          "Nothing to save: no scan step survived any pipeline (" + results.size() + " files)");
    }
    return series;
  }

  private List<FileResult> processSequentially(List<IndexedShotFile> files) {
    final List<FileResult> results = new ArrayList<>(files.size());
    for (IndexedShotFile file : files) {
      if (canceled) {
        break;
      }
      results.add(process(file));
    }
    return results;
  }

  private List<FileResult> processInParallel(List<IndexedShotFile> files) throws IOException {
    final ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, files.size()));
    try {
      final List<Future<FileResult>> futures = new ArrayList<>(files.size());
      for (IndexedShotFile file : files) {
        futures.add(executor.submit(() -> canceled ? null : process(file)));
      }
      final List<FileResult> results = new ArrayList<>(files.size());
      for (Future<FileResult> future : futures) {
        final FileResult result = future.get();
        if (result != null) {
          results.add(result);
        }
      }
      return results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while aggregating scan");
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException re) {
        throw re;
      }
      throw new IllegalStateException("Scan worker failed", e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Loads one file and reduces it with every pipeline.
   */
  private FileResult process(IndexedShotFile indexed) {
    final Path file = indexed.file();
    try {
      final ShotBundle bundle;
      try {
        bundle = loader.load(file);
      } catch (IOException | RuntimeException e) {
        logger.log(Level.WARNING, "Skipping " + file + ": " + e.getMessage(), e);
        final Map<String, StepOutcome> outcomes = new LinkedHashMap<>();
        for (CorrectionPipeline pipeline : pipelines) {
          outcomes.put(pipeline.getName(), StepOutcome.skipped(
              new DroppedScanStep(indexed.index(), file, Double.NaN, Reason.LOAD_FAILED,
                  String.valueOf(e.getMessage()))));
        }
        return new FileResult(indexed, outcomes);
      }

      final Map<String, StepOutcome> outcomes = new LinkedHashMap<>();
      for (CorrectionPipeline pipeline : pipelines) {
        outcomes.put(pipeline.getName(), reduce(indexed, bundle, pipeline));
      }
      return new FileResult(indexed, outcomes);
    } finally {
      processedFiles.incrementAndGet();
    }
  }

  private StepOutcome reduce(IndexedShotFile indexed, ShotBundle bundle,
      CorrectionPipeline pipeline) {
    float[] pon = null;
    float[] poff = null;
    double ponBeam = Double.NaN;
    double poffBeam = Double.NaN;
    int height = 0;
    int width = 0;
    try {
      for (Partition partition : bundle.partitions()) {
        final ShotStack corrected = pipeline.apply(partition.shots());
        if (corrected.isEmpty()) {
          continue;
        }
        height = corrected.images().getHeight();
        width = corrected.images().getWidth();
        if (partition.state() == PumpState.ON) {
          pon = corrected.images().meanFrame();
          ponBeam = corrected.meanBeamIntensity();
        } else {
          poff = corrected.images().meanFrame();
          poffBeam = corrected.meanBeamIntensity();
        }
      }
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING,
          "Skipping " + bundle.source() + " in pipeline " + pipeline.getName() + ": "
              + e.getMessage());
      return StepOutcome.skipped(new DroppedScanStep(indexed.index(), bundle.source(),
          bundle.delay(), Reason.SHAPE_MISMATCH, String.valueOf(e.getMessage())));
    }
    if (pon == null && poff == null) {
      logger.log(Level.WARNING,
          "No shots of " + bundle.source() + " survived pipeline " + pipeline.getName()
              + ", delay " + bundle.delay() + " is missing from the scan");
      return StepOutcome.skipped(new DroppedScanStep(indexed.index(), bundle.source(),
          bundle.delay(), Reason.NO_SURVIVING_SHOTS, "no surviving shots"));
    }
    final double ponMean = ponBeam;
    final double poffMean = poffBeam;
    logger.fine(() -> String.format("%s %s: pon %s, poff %s", pipeline.getName(),
        bundle.source().getFileName(), ponMean, poffMean));
    return new StepOutcome(
        new ScanStep(indexed.index(), bundle.source(), bundle.delay(), height, width, pon, poff,
            ponBeam, poffBeam), null);
  }

  /**
   * @return null if the pipeline kept no scan step
   */
  private @Nullable ScanSeries stack(String pipelineName, List<FileResult> results) {
    final List<ScanStep> steps = new ArrayList<>();
    final List<DroppedScanStep> dropped = new ArrayList<>();
    for (FileResult result : results) {
      final StepOutcome outcome = result.outcomes().get(pipelineName);
      if (outcome.dropped() != null) {
        dropped.add(outcome.dropped());
        continue;
      }
      final ScanStep step = outcome.step();
      if (!steps.isEmpty() && (step.height() != steps.get(0).height()
          || step.width() != steps.get(0).width())) {
        final String message =
            "frame size " + step.height() + "x" + step.width() + " differs from "
                + steps.get(0).height() + "x" + steps.get(0).width();
        logger.log(Level.WARNING, "Skipping " + step.source() + ": " + message);
        dropped.add(new DroppedScanStep(step.fileIndex(), step.source(), step.delay(),
            Reason.SHAPE_MISMATCH, message));
        continue;
      }
      steps.add(step);
    }
    if (steps.isEmpty()) {
      logger.warning(() -> "No scan step survived pipeline " + pipelineName + " ("
          + dropped.size() + " files dropped), nothing is saved for it");
      return null;
    }
    if (!dropped.isEmpty()) {
      logger.warning(() -> pipelineName + ": " + dropped.size() + " of " + results.size()
          + " files dropped, scan has " + steps.size() + " steps");
    }
    return ScanSeries.stack(pipelineName, steps, dropped);
  }

  public void cancel() {
    canceled = true;
  }

  public boolean isCanceled() {
    return canceled;
  }

  public double getFinishedPercentage() {
    final int total = totalFiles;
    return total == 0 ? 0d : (double) processedFiles.get() / total;
  }

  /**
   * Outcome per pipeline name.
   */
  private record FileResult(@NotNull IndexedShotFile file,
                            @NotNull Map<String, StepOutcome> outcomes) {

  }

  /**
   * Exactly one of step and dropped is set.
   */
  private record StepOutcome(@Nullable ScanStep step, @Nullable DroppedScanStep dropped) {

    static StepOutcome skipped(@NotNull DroppedScanStep dropped) {
      return new StepOutcome(null, dropped);
    }
  }
}
