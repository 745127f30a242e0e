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

package io.github.pumpprobe.parameters;

import io.github.pumpprobe.parameters.parametertypes.OptionalParameter;
import java.util.Collection;
import java.util.Properties;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;

public interface ParameterSet {

  Parameter<?> @NotNull [] getParameters();

  /**
   * @param parameter the static template of a parameter of this set
   * @return this set's own instance of the parameter
   * @throws IllegalArgumentException if the set has no parameter of that name
   */
  @NotNull <P extends Parameter<?>> P getParameter(@NotNull P parameter);

  default <T> T getValue(@NotNull Parameter<T> parameter) {
    return getParameter(parameter).getValue();
  }

  default <T> void setParameter(@NotNull Parameter<T> parameter, @Nullable T value) {
    getParameter(parameter).setValue(value);
  }

  /**
   * @return the embedded value if the optional parameter is selected, otherwise the default
   */
  default <T, P extends UserParameter<T>> T getEmbeddedParameterValueIfSelectedOrElse(
      @NotNull OptionalParameter<P> parameter, T defaultValue) {
    final OptionalParameter<P> own = getParameter(parameter);
    if (Boolean.TRUE.equals(own.getValue())) {
      return own.getEmbeddedParameter().getValue();
    }
    return defaultValue;
  }

  /**
   * Checks all parameters and collects every error.
   *
   * @return true if all values are valid
   */
  boolean checkParameterValues(@NotNull Collection<String> errorMessages);

  @NotNull ParameterSet cloneParameterSet();

  /**
   * Overrides values from properties keyed by {@code prefix + parameter name}. Keys that are
   * absent leave the current value untouched.
   *
   * @throws IllegalArgumentException if a present value cannot be parsed
   */
  void loadValuesFromProperties(@NotNull Properties properties, @NotNull String prefix);

  @NotNull JSONObject toJson();
}
