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

package io.github.pumpprobe.datamodel;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;

/**
 * All joined shots of one shot file, split by pump state. Only non-empty partitions are present.
 *
 * @param delay scan step value, NaN if the file carries no delay field
 */
public record ShotBundle(@NotNull Path source, double delay, @NotNull List<Partition> partitions) {

  public ShotBundle {
    partitions = List.copyOf(partitions);
    if (partitions.stream().map(Partition::state).distinct().count() != partitions.size()) {
      throw new IllegalArgumentException("Duplicate pump state in bundle of " + source);
    }
  }

  public @NotNull Optional<Partition> getPartition(@NotNull PumpState state) {
    return partitions.stream().filter(p -> p.state() == state).findFirst();
  }

  public int getTotalShots() {
    return partitions.stream().mapToInt(Partition::size).sum();
  }

  public int getShotCount(@NotNull PumpState state) {
    return getPartition(state).map(Partition::size).orElse(0);
  }
}
