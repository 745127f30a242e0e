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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * An n-dimensional array in C (row-major) order as stored in a .npy entry. The raw bytes are kept
 * and converted on access, so large float images are not widened until requested.
 */
public final class NpyArray {

  private final NpyDataType dataType;
  private final ByteOrder byteOrder;
  private final int[] shape;
  private final byte[] data;

  public NpyArray(@NotNull NpyDataType dataType, @NotNull ByteOrder byteOrder, int @NotNull [] shape,
      byte @NotNull [] data) {
    this.dataType = dataType;
    this.byteOrder = byteOrder;
    this.shape = shape.clone();
    final long expected = elementCount(shape) * dataType.getSize();
    if (expected != data.length) {
      throw new IllegalArgumentException(
          "Data length " + data.length + " does not match shape " + Arrays.toString(shape) + " of "
              + dataType);
    }
    this.data = data;
  }

  public static @NotNull NpyArray ofFloats(float @NotNull [] values, int... shape) {
    final ByteBuffer buffer = allocate(values.length, NpyDataType.FLOAT32);
    buffer.asFloatBuffer().put(values);
    return new NpyArray(NpyDataType.FLOAT32, ByteOrder.LITTLE_ENDIAN, shape, buffer.array());
  }

  public static @NotNull NpyArray ofDoubles(double @NotNull [] values, int... shape) {
    final ByteBuffer buffer = allocate(values.length, NpyDataType.FLOAT64);
    buffer.asDoubleBuffer().put(values);
    return new NpyArray(NpyDataType.FLOAT64, ByteOrder.LITTLE_ENDIAN, shape, buffer.array());
  }

  public static @NotNull NpyArray ofLongs(long @NotNull [] values, int... shape) {
    final ByteBuffer buffer = allocate(values.length, NpyDataType.INT64);
    buffer.asLongBuffer().put(values);
    return new NpyArray(NpyDataType.INT64, ByteOrder.LITTLE_ENDIAN, shape, buffer.array());
  }

  public static @NotNull NpyArray ofBooleans(boolean @NotNull [] values, int... shape) {
    final byte[] bytes = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      bytes[i] = (byte) (values[i] ? 1 : 0);
    }
    return new NpyArray(NpyDataType.BOOL, ByteOrder.LITTLE_ENDIAN, shape, bytes);
  }

  /**
   * 1D double array, the common shape for per-step and per-shot values.
   */
  public static @NotNull NpyArray ofDoubles(double @NotNull [] values) {
    return ofDoubles(values, values.length);
  }

  private static ByteBuffer allocate(int elements, NpyDataType type) {
    return ByteBuffer.allocate(Math.multiplyExact(elements, type.getSize()))
        .order(ByteOrder.LITTLE_ENDIAN);
  }

  static long elementCount(int[] shape) {
    long count = 1;
    for (int dim : shape) {
      if (dim < 0) {
        throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
      }
      count *= dim;
    }
    return count;
  }

  public @NotNull NpyDataType getDataType() {
    return dataType;
  }

  public @NotNull ByteOrder getByteOrder() {
    return byteOrder;
  }

  public int[] getShape() {
    return shape.clone();
  }

  public int getDimension(int axis) {
    return shape[axis];
  }

  public int getNumberOfDimensions() {
    return shape.length;
  }

  public int getNumberOfElements() {
    return Math.toIntExact(elementCount(shape));
  }

  byte[] getRawData() {
    return data;
  }

  private ByteBuffer buffer() {
    return ByteBuffer.wrap(data).order(byteOrder);
  }

  /**
   * Reads one element as double, whatever the stored type.
   */
  public double getDouble(int flatIndex) {
    final ByteBuffer buffer = buffer();
    final int offset = flatIndex * dataType.getSize();
    return switch (dataType) {
      case BOOL, INT8 -> buffer.get(offset);
      case UINT8 -> buffer.get(offset) & 0xFF;
      case INT16 -> buffer.getShort(offset);
      case UINT16 -> buffer.getShort(offset) & 0xFFFF;
      case INT32 -> buffer.getInt(offset);
      case UINT32 -> buffer.getInt(offset) & 0xFFFFFFFFL;
      case INT64 -> buffer.getLong(offset);
      case FLOAT32 -> buffer.getFloat(offset);
      case FLOAT64 -> buffer.getDouble(offset);
    };
  }

  public long getLong(int flatIndex) {
    if (dataType == NpyDataType.INT64) {
      return buffer().getLong(flatIndex * dataType.getSize());
    }
    return (long) getDouble(flatIndex);
  }

  public double @NotNull [] toDoubleArray() {
    final int n = getNumberOfElements();
    final double[] values = new double[n];
    if (dataType == NpyDataType.FLOAT64) {
      buffer().asDoubleBuffer().get(values);
      return values;
    }
    for (int i = 0; i < n; i++) {
      values[i] = getDouble(i);
    }
    return values;
  }

  public float @NotNull [] toFloatArray() {
    final int n = getNumberOfElements();
    final float[] values = new float[n];
    if (dataType == NpyDataType.FLOAT32) {
      buffer().asFloatBuffer().get(values);
      return values;
    }
    for (int i = 0; i < n; i++) {
      values[i] = (float) getDouble(i);
    }
    return values;
  }

  public long @NotNull [] toLongArray() {
    final int n = getNumberOfElements();
    final long[] values = new long[n];
    for (int i = 0; i < n; i++) {
      values[i] = getLong(i);
    }
    return values;
  }

  public boolean @NotNull [] toBooleanArray() {
    final int n = getNumberOfElements();
    final boolean[] values = new boolean[n];
    for (int i = 0; i < n; i++) {
      values[i] = getDouble(i) != 0d;
    }
    return values;
  }

  @Override
  public String toString() {
    return "NpyArray{" + dataType + ", shape=" + Arrays.toString(shape) + "}";
  }
}
