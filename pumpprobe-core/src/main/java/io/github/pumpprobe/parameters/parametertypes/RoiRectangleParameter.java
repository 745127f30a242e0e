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

package io.github.pumpprobe.parameters.parametertypes;

import io.github.pumpprobe.datamodel.RoiRectangle;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Region of interest given as {@code x1,y1,x2,y2} in pixels, end exclusive.
 */
public class RoiRectangleParameter extends AbstractParameter<RoiRectangle> {

  public RoiRectangleParameter(@NotNull String name, @NotNull String description) {
    this(name, description, null);
  }

  public RoiRectangleParameter(@NotNull String name, @NotNull String description,
      @Nullable RoiRectangle defaultValue) {
    super(name, description, defaultValue);
  }

  @Override
  public void loadValueFromString(@NotNull String value) {
    setValue(RoiRectangle.parse(value));
  }

  @Override
  public @Nullable Object getValueForExport() {
    return value == null ? null : value.format();
  }

  @Override
  public @NotNull RoiRectangleParameter cloneParameter() {
    return new RoiRectangleParameter(getName(), getDescription(), value);
  }
}
