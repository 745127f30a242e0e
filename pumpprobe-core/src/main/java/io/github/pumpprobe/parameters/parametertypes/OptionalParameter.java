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

import io.github.pumpprobe.parameters.UserParameter;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Wraps a parameter that only takes effect when selected. The value is the selection flag.
 */
public class OptionalParameter<P extends UserParameter<?>> implements UserParameter<Boolean> {

  private final P embeddedParameter;
  private @Nullable Boolean value;

  public OptionalParameter(@NotNull P embeddedParameter) {
    this(embeddedParameter, false);
  }

  public OptionalParameter(@NotNull P embeddedParameter, boolean defaultSelected) {
    this.embeddedParameter = embeddedParameter;
    this.value = defaultSelected;
  }

  public @NotNull P getEmbeddedParameter() {
    return embeddedParameter;
  }

  @Override
  public @NotNull String getName() {
    return embeddedParameter.getName();
  }

  @Override
  public @NotNull String getDescription() {
    return embeddedParameter.getDescription();
  }

  @Override
  public @Nullable Boolean getValue() {
    return value;
  }

  @Override
  public void setValue(@Nullable Boolean newValue) {
    this.value = newValue;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (!Boolean.TRUE.equals(value)) {
      return true;
    }
    return embeddedParameter.checkValue(errorMessages);
  }

  /**
   * "false" or an empty string deselects, "true" selects and keeps the embedded value, anything
   * else is loaded into the embedded parameter and selects it.
   */
  @Override
  public void loadValueFromString(@NotNull String value) {
    if (value.isEmpty() || "false".equalsIgnoreCase(value)) {
      setValue(false);
    } else if ("true".equalsIgnoreCase(value)) {
      setValue(true);
    } else {
      embeddedParameter.loadValueFromString(value);
      setValue(true);
    }
  }

  @Override
  public @Nullable Object getValueForExport() {
    return Boolean.TRUE.equals(value) ? embeddedParameter.getValueForExport() : Boolean.FALSE;
  }

  @Override
  @SuppressWarnings("unchecked")
  public @NotNull OptionalParameter<P> cloneParameter() {
    final P embeddedClone = (P) embeddedParameter.cloneParameter();
    return new OptionalParameter<>(embeddedClone, Boolean.TRUE.equals(value));
  }
}
