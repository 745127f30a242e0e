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

package io.github.pumpprobe.util.io.npy;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;
import org.jetbrains.annotations.NotNull;

/**
 * A .npz container: a zip archive of named .npy entries, as written by {@code numpy.savez}. Entry
 * names may contain '/' which is used to mirror a group hierarchy.
 */
public final class NpzArchive {

  private static final String NPY_SUFFIX = ".npy";

  private NpzArchive() {
  }

  /**
   * @return all arrays in archive order, keyed by entry name without the .npy suffix
   */
  public static @NotNull Map<String, NpyArray> read(@NotNull Path file) throws IOException {
    if (!Files.isRegularFile(file)) {
      throw new NoSuchFileException(file.toString());
    }
    final Map<String, NpyArray> arrays = new LinkedHashMap<>();
    try (ZipFile zip = new ZipFile(file.toFile())) {
      final Enumeration<? extends ZipEntry> entries = zip.entries();
      while (entries.hasMoreElements()) {
        final ZipEntry entry = entries.nextElement();
        if (entry.isDirectory() || !entry.getName().endsWith(NPY_SUFFIX)) {
          continue;
        }
        final String key = entry.getName()
            .substring(0, entry.getName().length() - NPY_SUFFIX.length());
        try (InputStream in = zip.getInputStream(entry)) {
          arrays.put(key, NpyFormat.read(in));
        } catch (IOException e) {
          throw new IOException("Cannot read entry '" + key + "' of " + file + ": " + e.getMessage(),
              e);
        }
      }
    }
    return Collections.unmodifiableMap(arrays);
  }

  public static void write(@NotNull Path file, @NotNull Map<String, NpyArray> arrays)
      throws IOException {
    try (OutputStream fileOut = new BufferedOutputStream(Files.newOutputStream(file));
        ZipOutputStream zip = new ZipOutputStream(fileOut)) {
      for (Entry<String, NpyArray> entry : arrays.entrySet()) {
        zip.putNextEntry(new ZipEntry(entry.getKey() + NPY_SUFFIX));
        NpyFormat.write(entry.getValue(), zip);
        zip.closeEntry();
      }
    }
  }
}
