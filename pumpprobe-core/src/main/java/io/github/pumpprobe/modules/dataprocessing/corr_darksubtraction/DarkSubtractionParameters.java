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

package io.github.pumpprobe.modules.dataprocessing.corr_darksubtraction;

import io.github.pumpprobe.parameters.Parameter;
import io.github.pumpprobe.parameters.impl.SimpleParameterSet;
import io.github.pumpprobe.parameters.parametertypes.filenames.FileNameParameter;
import io.github.pumpprobe.parameters.parametertypes.filenames.FileSelectionType;

public class DarkSubtractionParameters extends SimpleParameterSet {

  public static final FileNameParameter DARK_FILE = new FileNameParameter("Dark frame file",
      """
      .npy file with the detector background, either one [H,W] frame or a [N,H,W] stack of
      dark shots that is averaged. Only needed by pipelines that subtract the dark frame.
      """, FileSelectionType.OPEN, true);

  public DarkSubtractionParameters() {
    super(new Parameter[]{DARK_FILE});
  }
}
