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

package io.github.pumpprobe.datamodel;

import java.nio.file.Path;
import org.jetbrains.annotations.NotNull;

/**
 * A shot file that did not become a scan step.
 *
 * @param delay the step's delay if the file could be read, otherwise NaN
 */
public record DroppedScanStep(int fileIndex, @NotNull Path source, double delay,
                              @NotNull Reason reason, @NotNull String message) {

  public enum Reason {
    /**
     * The file was missing, lacked a required group or could not be decoded.
     */
    LOAD_FAILED,
    /**
     * No shot survived the corrections in either pump state.
     */
    NO_SURVIVING_SHOTS,
    /**
     * Frame size differs from the first scan step.
     */
    SHAPE_MISMATCH
  }
}
