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

import io.github.pumpprobe.datamodel.ShotStack;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;

/**
 * A named list of corrections applied strictly in list order: the first correction sees the raw
 * shots, the last one produces the result. An empty list returns the input unchanged.
 */
public final class CorrectionPipeline {

  private static final Logger logger = Logger.getLogger(CorrectionPipeline.class.getName());

  private final String name;
  private final List<ShotStackCorrection> stages;

  public CorrectionPipeline(@NotNull String name, @NotNull List<ShotStackCorrection> stages) {
    this.name = name;
    this.stages = List.copyOf(stages);
  }

  public @NotNull String getName() {
    return name;
  }

  public @NotNull List<ShotStackCorrection> getStages() {
    return stages;
  }

  public @NotNull ShotStack apply(@NotNull ShotStack shots) {
    ShotStack current = shots;
    for (ShotStackCorrection stage : stages) {
      if (current.isEmpty()) {
        break;
      }
      final int before = current.size();
      current = stage.apply(current);
      final int after = current.size();
      logger.fine(() -> name + "/" + stage.getName() + ": " + before + " -> " + after);
    }
    return current;
  }

  @Override
  public String toString() {
    return name + stages.stream().map(ShotStackCorrection::getName)
        .collect(Collectors.joining(", ", "[", "]"));
  }
}
