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

import java.text.NumberFormat;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class DoubleParameter extends AbstractParameter<Double> {

  private final NumberFormat format;
  private final @Nullable Double minimum;
  private final @Nullable Double maximum;

  public DoubleParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, @Nullable Double defaultValue) {
    this(name, description, format, defaultValue, null, null);
  }

  public DoubleParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, @Nullable Double defaultValue, @Nullable Double minimum,
      @Nullable Double maximum) {
    super(name, description, defaultValue);
    this.format = format;
    this.minimum = minimum;
    this.maximum = maximum;
  }

  public @NotNull NumberFormat getFormat() {
    return format;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (!super.checkValue(errorMessages)) {
      return false;
    }
    if (!Double.isFinite(value)) {
      errorMessages.add(getName() + " must be a finite number");
      return false;
    }
    if (minimum != null && value < minimum) {
      errorMessages.add(getName() + " lies below the minimum " + format.format(minimum));
      return false;
    }
    if (maximum != null && value > maximum) {
      errorMessages.add(getName() + " lies above the maximum " + format.format(maximum));
      return false;
    }
    return true;
  }

  @Override
  public void loadValueFromString(@NotNull String value) {
    try {
      setValue(Double.parseDouble(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(getName() + ": not a number: " + value, e);
    }
  }

  @Override
  public @Nullable Object getValueForExport() {
    // JSON has no NaN or infinity
    return value == null || Double.isFinite(value) ? value : value.toString();
  }

  @Override
  public @NotNull DoubleParameter cloneParameter() {
    return new DoubleParameter(getName(), getDescription(), format, value, minimum, maximum);
  }
}
