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

package io.github.pumpprobe.modules.io.export_scan;

import io.github.pumpprobe.parameters.ParameterSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.jetbrains.annotations.NotNull;
import org.json.JSONObject;

/**
 * Writes the parameters of a run as {@code <base>_parameters.json} next to its results.
 */
public class RunParametersWriter {

  public static @NotNull JSONObject toJson(@NotNull ParameterSet parameters,
      @NotNull String moduleName, @NotNull Instant moduleCallDate) {
    final JSONObject json = new JSONObject();
    json.put("module", moduleName);
    json.put("date", moduleCallDate.toString());
    json.put("parameters", parameters.toJson());
    return json;
  }

  public @NotNull Path write(@NotNull JSONObject runJson, @NotNull Path directory,
      @NotNull String baseName) throws IOException {
    Files.createDirectories(directory);
    final Path file = directory.resolve(baseName + "_parameters.json");
    Files.writeString(file, runJson.toString(2));
    return file;
  }
}
