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

package io.github.pumpprobe.modules.dataprocessing.scan_aggregation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jetbrains.annotations.NotNull;

/**
 * Lists the shot files of a scan directory in acquisition order.
 * <p>
 * The order comes from the last run of digits in the file name ({@code p0012.npz} is step 12),
 * not from sorting names or delays. Delay alignment of the whole scan depends on this naming
 * scheme: a file without digits is skipped, and files with equal numbers are ordered by name.
 */
public final class ScanFiles {

  private static final Logger logger = Logger.getLogger(ScanFiles.class.getName());
  private static final Pattern DIGITS = Pattern.compile("(\\d+)");

  private ScanFiles() {
  }

  /**
   * @param extension file extension without dot, matched case-insensitively
   * @throws NoSuchFileException if the directory does not exist
   */
  public static @NotNull List<IndexedShotFile> list(@NotNull Path directory,
      @NotNull String extension) throws IOException {
    if (!Files.isDirectory(directory)) {
      throw new NoSuchFileException(directory.toString());
    }
    final String suffix = "." + extension.toLowerCase();
    final List<IndexedShotFile> files = new ArrayList<>();
    try (Stream<Path> entries = Files.list(directory)) {
      for (Path file : (Iterable<Path>) entries::iterator) {
        final String name = file.getFileName().toString();
        if (!Files.isRegularFile(file) || !name.toLowerCase().endsWith(suffix)) {
          continue;
        }
        final OptionalInt index = parseIndex(name.substring(0, name.length() - suffix.length()));
        if (index.isEmpty()) {
          logger.log(Level.WARNING, "Skipping " + file + ": no acquisition index in file name");
          continue;
        }
        files.add(new IndexedShotFile(index.getAsInt(), file));
      }
    }
    files.sort(Comparator.comparingInt(IndexedShotFile::index)
        .thenComparing(f -> f.file().getFileName().toString()));
    return files;
  }

  /**
   * @return the value of the last digit run, empty if there is none or it overflows an int
   */
  public static @NotNull OptionalInt parseIndex(@NotNull String stem) {
    final Matcher matcher = DIGITS.matcher(stem);
    String last = null;
    while (matcher.find()) {
      last = matcher.group(1);
    }
    if (last == null) {
      return OptionalInt.empty();
    }
    try {
      return OptionalInt.of(Integer.parseInt(last));
    } catch (NumberFormatException e) {
      logger.log(Level.FINE, "Index " + last + " out of range", e);
      return OptionalInt.empty();
    }
  }
}
