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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Selection of one value out of a fixed list of choices.
 */
public class ComboParameter<E> extends AbstractParameter<E> {

  private final List<E> choices;

  public ComboParameter(@NotNull String name, @NotNull String description, E @NotNull [] choices,
      @NotNull E defaultValue) {
    this(name, description, List.of(choices), defaultValue);
  }

  public ComboParameter(@NotNull String name, @NotNull String description,
      @NotNull List<E> choices, @NotNull E defaultValue) {
    super(name, description, defaultValue);
    this.choices = List.copyOf(choices);
  }

  public @NotNull List<E> getChoices() {
    return choices;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (!super.checkValue(errorMessages)) {
      return false;
    }
    if (!choices.contains(value)) {
      errorMessages.add(getName() + ": " + value + " is not one of " + choices);
      return false;
    }
    return true;
  }

  /**
   * Accepts the display string or, for enum choices, the constant name (case-insensitive).
   */
  @Override
  public void loadValueFromString(@NotNull String value) {
    for (E choice : choices) {
      if (choice.toString().equalsIgnoreCase(value) || (choice instanceof Enum<?> e
          && e.name().equalsIgnoreCase(value))) {
        setValue(choice);
        return;
      }
    }
    throw new IllegalArgumentException(
        getName() + ": " + value + " is not one of " + Arrays.toString(choices.toArray()));
  }

  @Override
  public Object getValueForExport() {
    return value == null ? null : value.toString();
  }

  @Override
  public @NotNull ComboParameter<E> cloneParameter() {
    return new ComboParameter<>(getName(), getDescription(), choices, value);
  }
}
