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

import io.github.pumpprobe.modules.ModuleCategory;
import io.github.pumpprobe.modules.PumpProbeProcessingModule;
import io.github.pumpprobe.parameters.ParameterSet;
import io.github.pumpprobe.taskcontrol.Task;
import io.github.pumpprobe.util.ExitCode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

public class RoiMomentAnalysisModule implements PumpProbeProcessingModule {

  private static final Logger logger = Logger.getLogger(RoiMomentAnalysisModule.class.getName());

  private static final String MODULE_NAME = "ROI moment analysis";
  private static final String DESCRIPTION = "Extracts ROI intensity and centroid series over delay from an aggregated scan.";

  @Override
  public @NotNull String getName() {
    return MODULE_NAME;
  }

  @Override
  public @NotNull String getDescription() {
    return DESCRIPTION;
  }

  @Override
  public @NotNull Class<? extends ParameterSet> getParameterSetClass() {
    return RoiMomentParameters.class;
  }

  @Override
  public @NotNull ExitCode runModule(@NotNull ParameterSet parameters,
      @NotNull Collection<Task> tasks, @NotNull Instant moduleCallDate) {
    final List<String> errors = new ArrayList<>();
    if (!parameters.checkParameterValues(errors)) {
      logger.warning(() -> MODULE_NAME + ": invalid parameters " + errors);
      return ExitCode.ERROR;
    }
    tasks.add(new RoiMomentAnalysisTask(parameters, moduleCallDate));
    return ExitCode.OK;
  }

  @Override
  public @NotNull ModuleCategory getModuleCategory() {
    return ModuleCategory.DATAANALYSIS;
  }
}
