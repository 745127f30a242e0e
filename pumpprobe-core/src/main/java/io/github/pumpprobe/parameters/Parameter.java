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

import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named, typed configuration value. Parameter instances declared as static fields of a
 * parameter set class are templates; every set works on its own clones.
 *
 * @param <T> value type
 */
public interface Parameter<T> {

  @NotNull String getName();

  @Nullable T getValue();

  void setValue(@Nullable T newValue);

  /**
   * @param errorMessages receives one message per problem found
   * @return true if the current value is valid
   */
  boolean checkValue(@NotNull Collection<String> errorMessages);

  /**
   * Parses and sets a value from its string form.
   *
   * @throws IllegalArgumentException if the string cannot be parsed
   */
  void loadValueFromString(@NotNull String value);

  /**
   * @return the value in a form {@link #loadValueFromString(String)} accepts, null if unset
   */
  @Nullable Object getValueForExport();

  @NotNull Parameter<T> cloneParameter();
}
