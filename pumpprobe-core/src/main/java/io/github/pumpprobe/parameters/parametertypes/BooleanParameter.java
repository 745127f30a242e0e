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

import org.jetbrains.annotations.NotNull;

public class BooleanParameter extends AbstractParameter<Boolean> {

  public BooleanParameter(@NotNull String name, @NotNull String description,
      boolean defaultValue) {
    super(name, description, defaultValue);
  }

  @Override
  public void loadValueFromString(@NotNull String value) {
    if ("true".equalsIgnoreCase(value)) {
      setValue(true);
    } else if ("false".equalsIgnoreCase(value)) {
      setValue(false);
    } else {
      throw new IllegalArgumentException(getName() + ": expected true or false, got " + value);
    }
  }

  @Override
  public @NotNull BooleanParameter cloneParameter() {
    return new BooleanParameter(getName(), getDescription(), Boolean.TRUE.equals(value));
  }
}
