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

import org.jetbrains.annotations.NotNull;

/**
 * Element types of the NumPy .npy format that can be read and written. The byte order is kept
 * separately in {@link NpyArray}.
 */
public enum NpyDataType {

  BOOL('b', 1), INT8('i', 1), UINT8('u', 1), INT16('i', 2), UINT16('u', 2), INT32('i', 4),
  UINT32('u', 4), INT64('i', 8), FLOAT32('f', 4), FLOAT64('f', 8);

  private final char kind;
  private final int size;

  NpyDataType(char kind, int size) {
    this.kind = kind;
    this.size = size;
  }

  public int getSize() {
    return size;
  }

  public char getKind() {
    return kind;
  }

  /**
   * @param kindAndSize the descr without byte order character, e.g. "f4"
   */
  public static @NotNull NpyDataType fromDescr(@NotNull String kindAndSize) {
    if (kindAndSize.length() < 2) {
      throw new IllegalArgumentException("Invalid npy type descr: " + kindAndSize);
    }
    final char kind = kindAndSize.charAt(0);
    final int size;
    try {
      size = Integer.parseInt(kindAndSize.substring(1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid npy type descr: " + kindAndSize, e);
    }
    for (NpyDataType type : values()) {
      if (type.kind == kind && type.size == size) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unsupported npy type descr: " + kindAndSize);
  }

  /**
   * @return descr with byte order, "|" for single byte types
   */
  public @NotNull String toDescr(boolean littleEndian) {
    final char order = size == 1 ? '|' : (littleEndian ? '<' : '>');
    return "" + order + kind + size;
  }
}
