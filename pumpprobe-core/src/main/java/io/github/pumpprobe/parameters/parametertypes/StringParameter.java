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

import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class StringParameter extends AbstractParameter<String> {

  private final boolean valueRequired;

  public StringParameter(@NotNull String name, @NotNull String description,
      @Nullable String defaultValue) {
    this(name, description, defaultValue, true);
  }

  public StringParameter(@NotNull String name, @NotNull String description,
      @Nullable String defaultValue, boolean valueRequired) {
    super(name, description, defaultValue);
    this.valueRequired = valueRequired;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (valueRequired && (value == null || value.isBlank())) {
      errorMessages.add(getName() + " is empty");
      return false;
    }
    return true;
  }

  @Override
  public void loadValueFromString(@NotNull String value) {
    setValue(value);
  }

  @Override
  public @NotNull StringParameter cloneParameter() {
    return new StringParameter(getName(), getDescription(), value, valueRequired);
  }
}
