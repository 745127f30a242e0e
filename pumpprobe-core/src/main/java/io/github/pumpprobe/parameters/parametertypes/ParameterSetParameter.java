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

import io.github.pumpprobe.parameters.ParameterSet;
import io.github.pumpprobe.parameters.UserParameter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Embeds a complete parameter set, e.g. the settings of one processing stage inside the scan
 * settings. Nested values are addressed as {@code <this name>.<nested name>} in properties.
 */
public class ParameterSetParameter<S extends ParameterSet> implements UserParameter<S> {

  private final String name;
  private final String description;
  private @NotNull S value;

  public ParameterSetParameter(@NotNull String name, @NotNull String description,
      @NotNull S value) {
    this.name = name;
    this.description = description;
    this.value = value;
  }

  @Override
  public @NotNull String getName() {
    return name;
  }

  @Override
  public @NotNull String getDescription() {
    return description;
  }

  @Override
  public @NotNull S getValue() {
    return value;
  }

  @Override
  public void setValue(S newValue) {
    if (newValue == null) {
      throw new IllegalArgumentException(name + " cannot be unset");
    }
    this.value = newValue;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    final List<String> nested = new ArrayList<>();
    final boolean valid = value.checkParameterValues(nested);
    for (String message : nested) {
      errorMessages.add(name + ": " + message);
    }
    return valid;
  }

  @Override
  public void loadValueFromString(@NotNull String value) {
    throw new IllegalArgumentException(
        name + " is a parameter group, set its members as " + name + ".<parameter>");
  }

  @Override
  public @NotNull Object getValueForExport() {
    return value.toJson();
  }

  @Override
  @SuppressWarnings("unchecked")
  public @NotNull ParameterSetParameter<S> cloneParameter() {
    return new ParameterSetParameter<>(name, description, (S) value.cloneParameterSet());
  }
}
