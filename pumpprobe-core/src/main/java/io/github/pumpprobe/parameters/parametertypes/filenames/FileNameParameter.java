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

package io.github.pumpprobe.parameters.parametertypes.filenames;

import io.github.pumpprobe.parameters.parametertypes.AbstractParameter;
import java.io.File;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class FileNameParameter extends AbstractParameter<File> {

  private final FileSelectionType type;
  private final boolean allowEmptyString;

  public FileNameParameter(@NotNull String name, @NotNull String description,
      @NotNull FileSelectionType type) {
    this(name, description, type, false);
  }

  /**
   * @param allowEmptyString true if the parameter may stay unset
   */
  public FileNameParameter(@NotNull String name, @NotNull String description,
      @NotNull FileSelectionType type, boolean allowEmptyString) {
    this(name, description, type, allowEmptyString, null);
  }

  private FileNameParameter(String name, String description, FileSelectionType type,
      boolean allowEmptyString, @Nullable File value) {
    super(name, description, value);
    this.type = type;
    this.allowEmptyString = allowEmptyString;
  }

  public @NotNull FileSelectionType getType() {
    return type;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (value == null || value.getPath().isEmpty()) {
      if (allowEmptyString) {
        return true;
      }
      errorMessages.add(getName() + " is not set");
      return false;
    }
    switch (type) {
      case OPEN -> {
        if (!value.isFile()) {
          errorMessages.add(getName() + ": file " + value + " does not exist");
          return false;
        }
      }
      case DIRECTORY -> {
        if (!value.isDirectory()) {
          errorMessages.add(getName() + ": directory " + value + " does not exist");
          return false;
        }
      }
      case SAVE -> {
      }
    }
    return true;
  }

  @Override
  public void loadValueFromString(@NotNull String value) {
    setValue(value.isEmpty() ? null : new File(value));
  }

  @Override
  public @Nullable Object getValueForExport() {
    return value == null ? null : value.getPath();
  }

  @Override
  public @NotNull FileNameParameter cloneParameter() {
    return new FileNameParameter(getName(), getDescription(), type, allowEmptyString, value);
  }
}
